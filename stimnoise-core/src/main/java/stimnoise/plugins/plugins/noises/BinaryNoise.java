/* 
 * Copyright (C) 2024 STIMNOISE authors
 *
 * This File is part of STIMNOISE
 *
 * STIMNOISE is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * STIMNOISE is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with STIMNOISE.  If not, see <http://www.gnu.org/licenses/>.
 */
package stimnoise.plugins.plugins.noises;

import org.apache.commons.math3.random.RandomGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import stimnoise.configuration.parameters.Parameter;
import stimnoise.image.ImageDouble;
import stimnoise.noise.ContrastAdaptation;
import stimnoise.noise.NoiseKind;
import stimnoise.plugins.NoiseGenerator;
import stimnoise.processing.spectral.SamplingGrid;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 *
 * Independent two-valued samples (-0.5 or 0.5) per pixel. Bypasses the spectral path so any shape is accepted, the sampling rate must still be isotropic
 */
public class BinaryNoise implements NoiseGenerator {
    public final static Logger logger = LoggerFactory.getLogger(BinaryNoise.class);

    @Override
    public NoiseKind getKind() {
        return NoiseKind.BINARY;
    }

    @Override
    public Parameter[] getParameters() {
        return new Parameter[0];
    }

    @Override
    public ImageDouble generate(SamplingGrid grid, RandomGenerator random) {
        grid.checkIsotropic();
        ImageDouble res = new ImageDouble("binary noise", grid.getSpatialProperties());
        double[] pix = res.getPixelArray();
        for (int i = 0; i<pix.length; ++i) pix[i] = random.nextBoolean() ? 0.5 : -0.5;
        logger.debug("binary noise: grid: {}", grid);
        return res;
    }

    @Override
    public Map<String, Object> getEffectiveParameters(SamplingGrid grid) {
        return new LinkedHashMap<>();
    }

    @Override
    public ContrastAdaptation getDefaultAdaptation() {
        return ContrastAdaptation.intensityRange(0, 1);
    }

    @Override
    public String getHintText() {
        return "Binary noise: each pixel is drawn independently among two values";
    }
}
