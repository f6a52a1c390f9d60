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
package stimnoise.noise;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import stimnoise.configuration.parameters.Parameter;
import stimnoise.image.ImageComplex;
import stimnoise.image.ImageDouble;
import stimnoise.plugins.NoiseGenerator;
import stimnoise.plugins.plugins.noises.BinaryNoise;
import stimnoise.plugins.plugins.noises.NarrowbandNoise;
import stimnoise.plugins.plugins.noises.OneOverFNoise;
import stimnoise.plugins.plugins.noises.OrientedNoise;
import stimnoise.plugins.plugins.noises.WhiteNoise;
import stimnoise.processing.spectral.FourierTransform;
import stimnoise.processing.spectral.FrequencyFilters;
import stimnoise.processing.spectral.SamplingGrid;
import stimnoise.utils.ConfigurationException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Noise presets. Every preset has an overload taking the random generator; overloads without it share a default generator, used by one call at a time.
 * A null adaptation selects the default adaptation of the preset.
 */
public class Noises {
    public final static Logger logger = LoggerFactory.getLogger(Noises.class);
    private final static RandomGenerator DEFAULT_RANDOM = new Well19937c();

    /**
     * Checks, synthesizes and adapts
     * @param adaptation target statistics, null for the default of {@param generator}
     */
    public static NoiseImage generate(NoiseGenerator generator, SamplingGrid grid, ContrastAdaptation adaptation, RandomGenerator random) {
        if (random==null) throw new IllegalArgumentException("random generator is required");
        ContrastAdaptation a = adaptation==null ? generator.getDefaultAdaptation() : adaptation;
        ImageDouble raw = generator.generate(grid, random);
        ImageDouble adapted = a.apply(raw);
        NoiseImage res = new NoiseImage(adapted, grid, generator.getKind(), generator.getEffectiveParameters(grid), a);
        logger.debug("generated: {}", res);
        return res;
    }

    public static NoiseImage generate(NoiseGenerator generator, SamplingGrid grid, ContrastAdaptation adaptation) {
        synchronized (DEFAULT_RANDOM) {
            return generate(generator, grid, adaptation, DEFAULT_RANDOM);
        }
    }

    /**
     * Dispatch on a kind tag
     * @param kind tag, see {@link NoiseKind#fromTag(String)}
     * @param parameters JSON values keyed by parameter name
     * @throws stimnoise.utils.UnsupportedModeException if {@param kind} is unknown
     */
    public static NoiseImage generate(String kind, SamplingGrid grid, Map<String, ?> parameters, ContrastAdaptation adaptation, RandomGenerator random) {
        NoiseGenerator generator = NoiseKind.fromTag(kind).createGenerator();
        configure(generator, parameters);
        return generate(generator, grid, adaptation, random);
    }

    /**
     * Sets parameters of {@param generator} from JSON values
     * @throws ConfigurationException if a key is not a parameter of {@param generator} or a value has the wrong type
     */
    public static <G extends NoiseGenerator> G configure(G generator, Map<String, ?> parameters) {
        if (parameters==null) return generator;
        for (Map.Entry<String, ?> e : parameters.entrySet()) {
            Parameter p = generator.getParameter(e.getKey());
            if (p==null) {
                String available = generator.getParameters().length==0 ? "no parameters" : "parameters are:\n"+generator.getParameterSummary();
                throw new ConfigurationException("Unknown parameter: "+e.getKey()+" for "+generator.getKind().getTag()+" noise, "+available);
            }
            p.initFromJSONEntry(e.getValue());
        }
        return generator;
    }

    public static NoiseImage white(SamplingGrid grid, boolean pseudoNoise, ContrastAdaptation adaptation, RandomGenerator random) {
        return generate(new WhiteNoise(pseudoNoise), grid, adaptation, random);
    }

    public static NoiseImage white(SamplingGrid grid, boolean pseudoNoise, ContrastAdaptation adaptation) {
        return generate(new WhiteNoise(pseudoNoise), grid, adaptation);
    }

    /**
     * @param centerFrequency center of the pass band, in cycles per unit length. Must not exceed sampling_rate/2
     * @param bandwidth in octaves
     */
    public static NoiseImage narrowband(SamplingGrid grid, double centerFrequency, double bandwidth, boolean pseudoNoise, ContrastAdaptation adaptation, RandomGenerator random) {
        return generate(new NarrowbandNoise(centerFrequency, bandwidth).setPseudoNoise(pseudoNoise), grid, adaptation, random);
    }

    public static NoiseImage narrowband(SamplingGrid grid, double centerFrequency, double bandwidth, boolean pseudoNoise, ContrastAdaptation adaptation) {
        return generate(new NarrowbandNoise(centerFrequency, bandwidth).setPseudoNoise(pseudoNoise), grid, adaptation);
    }

    public static NoiseImage oneOverF(SamplingGrid grid, double exponent, boolean pseudoNoise, ContrastAdaptation adaptation, RandomGenerator random) {
        return generate(new OneOverFNoise(exponent).setPseudoNoise(pseudoNoise), grid, adaptation, random);
    }

    public static NoiseImage oneOverF(SamplingGrid grid, double exponent, boolean pseudoNoise, ContrastAdaptation adaptation) {
        return generate(new OneOverFNoise(exponent).setPseudoNoise(pseudoNoise), grid, adaptation);
    }

    public static NoiseImage pink(SamplingGrid grid, boolean pseudoNoise, ContrastAdaptation adaptation, RandomGenerator random) {
        return generate(OneOverFNoise.pink().setPseudoNoise(pseudoNoise), grid, adaptation, random);
    }

    public static NoiseImage pink(SamplingGrid grid, boolean pseudoNoise, ContrastAdaptation adaptation) {
        return generate(OneOverFNoise.pink().setPseudoNoise(pseudoNoise), grid, adaptation);
    }

    public static NoiseImage brown(SamplingGrid grid, boolean pseudoNoise, ContrastAdaptation adaptation, RandomGenerator random) {
        return generate(OneOverFNoise.brown().setPseudoNoise(pseudoNoise), grid, adaptation, random);
    }

    public static NoiseImage brown(SamplingGrid grid, boolean pseudoNoise, ContrastAdaptation adaptation) {
        return generate(OneOverFNoise.brown().setPseudoNoise(pseudoNoise), grid, adaptation);
    }

    /**
     * @param sigma spread of the oriented Gaussian, in cycles per unit length
     * @param orientation in degrees
     */
    public static NoiseImage oriented(SamplingGrid grid, double sigma, double orientation, boolean pseudoNoise, ContrastAdaptation adaptation, RandomGenerator random) {
        return generate(new OrientedNoise(sigma, orientation).setPseudoNoise(pseudoNoise), grid, adaptation, random);
    }

    public static NoiseImage oriented(SamplingGrid grid, double sigma, double orientation, boolean pseudoNoise, ContrastAdaptation adaptation) {
        return generate(new OrientedNoise(sigma, orientation).setPseudoNoise(pseudoNoise), grid, adaptation);
    }

    public static NoiseImage binary(SamplingGrid grid, ContrastAdaptation adaptation, RandomGenerator random) {
        return generate(new BinaryNoise(), grid, adaptation, random);
    }

    public static NoiseImage binary(SamplingGrid grid, ContrastAdaptation adaptation) {
        return generate(new BinaryNoise(), grid, adaptation);
    }

    /**
     * Filters an existing noise with an oriented Gaussian, then sets its RMS contrast to {@link OrientedNoise#DEFAULT_RMS_CONTRAST}, keeping its mean
     * @param noise source noise, not modified
     * @param sigma spread of the oriented Gaussian, in cycles per unit length
     * @param orientation in degrees
     * @return new noise of same kind, with the orientation recorded in its parameters
     */
    public static NoiseImage orient(NoiseImage noise, double sigma, double orientation) {
        SamplingGrid grid = noise.getGrid();
        ImageDouble filter = FrequencyFilters.oriented(grid, sigma, orientation);
        ImageComplex spectrum = FrequencyFilters.apply(FourierTransform.forward(noise.getImage(), grid), filter);
        ImageDouble oriented = FourierTransform.realize(spectrum, grid).setName("oriented "+noise.getKind().getTag()+" noise");
        ContrastAdaptation adaptation = ContrastAdaptation.rmsContrast(OrientedNoise.DEFAULT_RMS_CONTRAST, null);
        Map<String, Object> parameters = new LinkedHashMap<>(noise.getParameters());
        Map<String, Object> orientParameters = new LinkedHashMap<>();
        orientParameters.put("sigma", sigma);
        orientParameters.put("orientation", orientation);
        parameters.put("orient", orientParameters);
        logger.debug("orient {}: sigma: {}, orientation: {}", noise, sigma, orientation);
        return new NoiseImage(adaptation.apply(oriented), grid, noise.getKind(), parameters, adaptation);
    }
}
