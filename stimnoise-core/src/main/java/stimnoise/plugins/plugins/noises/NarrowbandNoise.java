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
import stimnoise.noise.NoiseKind;
import stimnoise.plugins.SpectralNoise;
import stimnoise.processing.spectral.FrequencyFilters;
import stimnoise.processing.spectral.SamplingGrid;

import java.util.Map;

/**
 *
 * Band-pass filtered white noise: Gaussian ring around a center frequency, with a width given in octaves
 */
public class NarrowbandNoise extends SpectralNoise {
    BoundedNumberParameter centerFrequency = new BoundedNumberParameter("center_frequency", 3, null).setStrictlyPositive().setHint("Center of the pass band, in cycles per unit length (e.g. cpd). Must not exceed the Nyquist frequency sampling_rate/2");
    BoundedNumberParameter bandwidth = new BoundedNumberParameter("bandwidth", 3, null).setStrictlyPositive().setHint("Width of the pass band in octaves (full width at half maximum). 1 is a one-octave band");
    Parameter[] parameters = new Parameter[]{centerFrequency, bandwidth};

    public NarrowbandNoise() {}

    public NarrowbandNoise(double centerFrequency, double bandwidth) {
        this.centerFrequency.setValue(centerFrequency);
        this.bandwidth.setValue(bandwidth);
    }

    public NarrowbandNoise setCenterFrequency(double centerFrequency) {
        this.centerFrequency.setValue(centerFrequency);
        return this;
    }

    public NarrowbandNoise setBandwidth(double bandwidth) {
        this.bandwidth.setValue(bandwidth);
        return this;
    }

    @Override
    public NoiseKind getKind() {
        return NoiseKind.NARROWBAND;
    }

    public double getSigma() {
        return FrequencyFilters.octaveBandwidthToSigma(centerFrequency.getDoubleValue(), bandwidth.getDoubleValue());
    }

    @Override
    protected ImageDouble getFilter(SamplingGrid grid) {
        return FrequencyFilters.bandpass(grid, centerFrequency.getDoubleValue(), getSigma());
    }

    @Override
    protected Parameter[] getFilterParameters() {
        return parameters;
    }

    @Override
    public Map<String, Object> getEffectiveParameters(SamplingGrid grid) {
        Map<String, Object> res = super.getEffectiveParameters(grid);
        res.put("sigma", getSigma());
        return res;
    }

    @Override
    public String getHintText() {
        return "Narrowband noise: white noise filtered by a Gaussian ring centered on center_frequency";
    }
}
