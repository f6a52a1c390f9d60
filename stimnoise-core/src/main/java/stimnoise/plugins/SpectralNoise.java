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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import stimnoise.configuration.parameters.BooleanParameter;
import stimnoise.configuration.parameters.BoundedNumberParameter;
import stimnoise.configuration.parameters.Parameter;
import stimnoise.image.ImageComplex;
import stimnoise.image.ImageDouble;
import stimnoise.noise.ContrastAdaptation;
import stimnoise.processing.spectral.FourierTransform;
import stimnoise.processing.spectral.FrequencyFilters;
import stimnoise.processing.spectral.HermitianSpectrum;
import stimnoise.processing.spectral.SamplingGrid;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Noise built in the frequency domain: conjugate-symmetric white spectrum, optional filter, inverse transform.
 * Requires an isotropic sampling rate and an even-numbered shape.
 */
public abstract class SpectralNoise implements NoiseGenerator {
    public final static Logger logger = LoggerFactory.getLogger(SpectralNoise.class);
    protected BooleanParameter pseudoNoise = new BooleanParameter("pseudo_noise", false).setHint("If true, every frequency bin has the same magnitude and only the phase is random (ideal power spectrum). Otherwise the spectrum is the transform of uniform random samples");
    protected BoundedNumberParameter amplitude = new BoundedNumberParameter("amplitude", 3, HermitianSpectrum.DEFAULT_AMPLITUDE).setStrictlyPositive().setHint("Amplitude of each pair of opposite frequencies in pseudo-noise mode; each bin has magnitude amplitude/2");

    /**
     * @return filter applied to the white spectrum, or null for white noise
     */
    protected abstract ImageDouble getFilter(SamplingGrid grid);

    /**
     * @return parameters of the filter, listed before the synthesis parameters
     */
    protected abstract Parameter[] getFilterParameters();

    public SpectralNoise setPseudoNoise(boolean pseudoNoise) {
        this.pseudoNoise.setSelected(pseudoNoise);
        return this;
    }

    public SpectralNoise setAmplitude(double amplitude) {
        this.amplitude.setValue(amplitude);
        return this;
    }

    public boolean isPseudoNoise() {
        return pseudoNoise.getSelected();
    }

    @Override
    public Parameter[] getParameters() {
        Parameter[] filterParameters = getFilterParameters();
        Parameter[] res = new Parameter[filterParameters.length+2];
        System.arraycopy(filterParameters, 0, res, 0, filterParameters.length);
        res[filterParameters.length] = pseudoNoise;
        res[filterParameters.length+1] = amplitude;
        return res;
    }

    /**
     * Spectrum before filtering
     */
    public ImageComplex getWhiteSpectrum(SamplingGrid grid, RandomGenerator random) {
        if (pseudoNoise.getSelected()) return HermitianSpectrum.pseudoWhite(grid, amplitude.getDoubleValue(), random);
        else return HermitianSpectrum.free(grid, random);
    }

    @Override
    public ImageDouble generate(SamplingGrid grid, RandomGenerator random) {
        checkParameters();
        grid.checkSpectralPath();
        ImageDouble filter = getFilter(grid);
        ImageComplex spectrum = getWhiteSpectrum(grid, random);
        if (filter!=null) spectrum = FrequencyFilters.apply(spectrum, filter);
        logger.debug("{} noise: grid: {}, pseudo noise: {}, filter: {}", getKind(), grid, pseudoNoise.getSelected(), filter==null ? "none" : filter.getName());
        return FourierTransform.realize(spectrum, grid).setName(getKind().getTag()+" noise");
    }

    @Override
    public Map<String, Object> getEffectiveParameters(SamplingGrid grid) {
        Map<String, Object> res = new LinkedHashMap<>();
        for (Parameter p : getFilterParameters()) res.put(p.getName(), p.toJSONEntry());
        res.put(pseudoNoise.getName(), pseudoNoise.getSelected());
        if (pseudoNoise.getSelected()) res.put(amplitude.getName(), amplitude.getValue());
        return res;
    }

    @Override
    public ContrastAdaptation getDefaultAdaptation() {
        return ContrastAdaptation.intensityRange(0, 1);
    }
}
