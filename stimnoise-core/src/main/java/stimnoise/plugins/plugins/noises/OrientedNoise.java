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

import stimnoise.configuration.parameters.BoundedNumberParameter;
import stimnoise.configuration.parameters.Parameter;
import stimnoise.image.ImageDouble;
import stimnoise.noise.ContrastAdaptation;
import stimnoise.noise.NoiseKind;
import stimnoise.plugins.SpectralNoise;
import stimnoise.processing.spectral.FrequencyFilters;
import stimnoise.processing.spectral.SamplingGrid;

/**
 *
 * White noise filtered by an oriented Gaussian: energy is concentrated along one orientation of the frequency plane
 */
public class OrientedNoise extends SpectralNoise {
    public final static double DEFAULT_RMS_CONTRAST = 0.2;
    BoundedNumberParameter orientation = new BoundedNumberParameter("orientation", 2, null).setHint("Orientation of the Gaussian in the frequency plane, in degrees");
    BoundedNumberParameter sigma = new BoundedNumberParameter("sigma", 3, null).setStrictlyPositive().setHint("Spread of the oriented Gaussian, in cycles per unit length");
    Parameter[] parameters = new Parameter[]{orientation, sigma};

    public OrientedNoise() {}

    public OrientedNoise(double sigma, double orientation) {
        this.sigma.setValue(sigma);
        this.orientation.setValue(orientation);
    }

    public OrientedNoise setSigma(double sigma) {
        this.sigma.setValue(sigma);
        return this;
    }

    public OrientedNoise setOrientation(double orientation) {
        this.orientation.setValue(orientation);
        return this;
    }

    @Override
    public NoiseKind getKind() {
        return NoiseKind.ORIENTED;
    }

    @Override
    protected ImageDouble getFilter(SamplingGrid grid) {
        return FrequencyFilters.oriented(grid, sigma.getDoubleValue(), orientation.getDoubleValue());
    }

    @Override
    protected Parameter[] getFilterParameters() {
        return parameters;
    }

    @Override
    public ContrastAdaptation getDefaultAdaptation() {
        return ContrastAdaptation.rmsContrast(DEFAULT_RMS_CONTRAST, null);
    }

    @Override
    public String getHintText() {
        return "Oriented noise: white noise filtered by an oriented Gaussian";
    }
}
