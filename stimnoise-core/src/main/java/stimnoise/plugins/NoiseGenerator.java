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
package stimnoise.plugins;

import org.apache.commons.math3.random.RandomGenerator;
import stimnoise.image.ImageDouble;
import stimnoise.noise.ContrastAdaptation;
import stimnoise.noise.NoiseKind;
import stimnoise.processing.spectral.SamplingGrid;

import java.util.Map;

/**
 *
 * Generates one kind of noise on a resolved sampling grid. The raw raster returned by {@link #generate(SamplingGrid, RandomGenerator)} is not adapted yet.
 */
public interface NoiseGenerator extends Plugin, Hint {
    NoiseKind getKind();

    /**
     * Checks parameters and grid, in this order, then synthesizes the noise.
     * @param grid resolved sampling grid
     * @param random generator, the only source of randomness
     * @return realized noise, calibrated with the grid
     * @throws stimnoise.utils.ConfigurationException if a parameter is missing or invalid, or if the grid is not supported. Raised before any allocation
     */
    ImageDouble generate(SamplingGrid grid, RandomGenerator random);

    /**
     * @return parameters used for {@param grid}, including derived ones, in declaration order
     */
    Map<String, Object> getEffectiveParameters(SamplingGrid grid);

    ContrastAdaptation getDefaultAdaptation();
}
