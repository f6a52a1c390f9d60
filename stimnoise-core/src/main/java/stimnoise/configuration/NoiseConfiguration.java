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
package stimnoise.configuration;

import org.apache.commons.math3.random.Well19937c;
import org.json.simple.JSONObject;
import org.json.simple.parser.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import stimnoise.noise.ContrastAdaptation;
import stimnoise.noise.NoiseImage;
import stimnoise.noise.NoiseKind;
import stimnoise.noise.Noises;
import stimnoise.plugins.NoiseGenerator;
import stimnoise.processing.spectral.SamplingGrid;
import stimnoise.utils.ConfigurationException;
import stimnoise.utils.JSONSerializable;
import stimnoise.utils.JSONUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * JSON description of one noise request:
 * <pre>
 * {"kind": "narrowband", "shape": [64, 64], "sampling_rate": 60,
 *  "parameters": {"center_frequency": 5, "bandwidth": 1},
 *  "intensity_range": [0, 1], "seed": 123}
 * </pre>
 * {@code sampling_rate} can also be a pair {@code [rate_y, rate_x]}; the adaptation is one of {@code intensity_range},
 * {@code rms_contrast}, {@code normalized_rms_contrast} or {@code michelson_contrast}, optionally with {@code mean_luminance}.
 * Without adaptation the default of the kind applies; without seed the shared default generator is used.
 */
public class NoiseConfiguration implements JSONSerializable {
    public final static Logger logger = LoggerFactory.getLogger(NoiseConfiguration.class);
    private final static Set<String> KEYS = new HashSet<>(Arrays.asList("kind", "shape", "sampling_rate", "parameters", "intensity_range", "rms_contrast", "normalized_rms_contrast", "michelson_contrast", "mean_luminance", "seed"));
    NoiseKind kind;
    SamplingGrid grid;
    Map<String, Object> parameters = new LinkedHashMap<>();
    ContrastAdaptation adaptation;
    Long seed;

    public NoiseConfiguration() {}

    public NoiseConfiguration(NoiseKind kind, SamplingGrid grid) {
        this.kind = kind;
        this.grid = grid;
    }

    public static NoiseConfiguration parse(String json) {
        try {
            NoiseConfiguration res = new NoiseConfiguration();
            res.initFromJSONEntry(JSONUtils.parse(json));
            return res;
        } catch (ParseException e) {
            throw new ConfigurationException("Malformed noise configuration: "+e, e);
        }
    }

    public static NoiseConfiguration read(Path path) throws IOException {
        logger.debug("reading noise configuration: {}", path);
        return parse(new String(Files.readAllBytes(path), StandardCharsets.UTF_8));
    }

    public NoiseKind getKind() {
        return kind;
    }

    public SamplingGrid getGrid() {
        return grid;
    }

    public Map<String, Object> getParameters() {
        return parameters;
    }

    public NoiseConfiguration setParameter(String name, Object jsonValue) {
        parameters.put(name, jsonValue);
        return this;
    }

    /**
     * @return requested adaptation, null if the default adaptation of the kind applies
     */
    public ContrastAdaptation getAdaptation() {
        return adaptation;
    }

    public NoiseConfiguration setAdaptation(ContrastAdaptation adaptation) {
        this.adaptation = adaptation;
        return this;
    }

    public Long getSeed() {
        return seed;
    }

    public NoiseConfiguration setSeed(Long seed) {
        this.seed = seed;
        return this;
    }

    /**
     * @return new generator of the configured kind with the configured parameters
     */
    public NoiseGenerator createGenerator() {
        if (kind==null) throw new ConfigurationException("kind is required");
        return Noises.configure(kind.createGenerator(), parameters);
    }

    /**
     * Each call uses a new generator seeded with {@link #getSeed()}, so a seeded configuration always yields the same image
     */
    public NoiseImage generate() {
        if (grid==null) throw new ConfigurationException("shape and sampling_rate are required");
        NoiseGenerator generator = createGenerator();
        if (seed==null) return Noises.generate(generator, grid, adaptation);
        else return Noises.generate(generator, grid, adaptation, new Well19937c(seed));
    }

    @Override
    public JSONObject toJSONEntry() {
        JSONObject res = new JSONObject();
        if (kind!=null) res.put("kind", kind.getTag());
        if (grid!=null) res.putAll((JSONObject)grid.toJSONEntry());
        res.put("parameters", JSONUtils.toJSONObject(parameters));
        if (adaptation!=null) res.putAll(adaptation.toJSONEntry());
        if (seed!=null) res.put("seed", seed);
        return res;
    }

    @Override
    public void initFromJSONEntry(Object jsonEntry) {
        if (!(jsonEntry instanceof JSONObject)) throw new ConfigurationException("noise configuration should be a JSON object");
        JSONObject json = (JSONObject)jsonEntry;
        for (Object key : json.keySet()) {
            if (!KEYS.contains(key)) logger.warn("ignored key in noise configuration: {}", key);
        }
        Object k = json.get("kind");
        if (!(k instanceof String)) throw new ConfigurationException("kind is required and should be a string (found: "+k+")");
        kind = NoiseKind.fromTag((String)k);
        grid = SamplingGrid.fromJSONEntry(json);
        parameters = new LinkedHashMap<>();
        Object params = json.get("parameters");
        if (params instanceof Map) {
            for (Object e : ((Map)params).entrySet()) {
                Map.Entry entry = (Map.Entry)e;
                parameters.put(entry.getKey().toString(), entry.getValue());
            }
        } else if (params!=null) throw new ConfigurationException("parameters should be a JSON object (found: "+params+")");
        ContrastAdaptation a = ContrastAdaptation.fromJSONEntry(json);
        adaptation = a.getMode()==ContrastAdaptation.Mode.NONE ? null : a;
        Object s = json.get("seed");
        if (s==null) seed = null;
        else seed = JSONUtils.toLong(s, "seed");
        createGenerator(); // unknown parameters and wrong value types fail here
    }

    @Override
    public String toString() {
        return toJSONEntry().toJSONString();
    }
}
