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

import stimnoise.configuration.parameters.Parameter;
import stimnoise.image.ImageDouble;
import stimnoise.noise.NoiseKind;
import stimnoise.plugins.SpectralNoise;
import stimnoise.processing.spectral.SamplingGrid;

/**
 *
 * @author STIMNOISE authors
 */
public class WhiteNoise extends SpectralNoise {

    public WhiteNoise() {}

    public WhiteNoise(boolean pseudoNoise) {
        setPseudoNoise(pseudoNoise);
    }

    @Override
    public NoiseKind getKind() {
        return NoiseKind.WHITE;
    }

    @Override
    protected ImageDouble getFilter(SamplingGrid grid) {
        return null;
    }

    @Override
    protected Parameter[] getFilterParameters() {
        return new Parameter[0];
    }

    @Override
    public String getHintText() {
        return "White noise: flat power spectrum, zero mean";
    }
}
