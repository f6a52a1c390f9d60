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

import org.json.simple.parser.ParseException;
import org.junit.Test;
import stimnoise.noise.ContrastAdaptation;
import stimnoise.noise.NoiseImage;
import stimnoise.noise.NoiseKind;
import stimnoise.processing.spectral.SamplingGrid;
import stimnoise.utils.ConfigurationException;
import stimnoise.utils.UnsupportedModeException;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.Assert.*;

public class NoiseConfigurationTest {
    final static String NARROWBAND = "{\"kind\": \"narrowband\", \"shape\": [64, 64], \"sampling_rate\": 60, " +
            "\"parameters\": {\"center_frequency\": 5, \"bandwidth\": 1, \"pseudo_noise\": true}, " +
            "\"rms_contrast\": 0.2, \"mean_luminance\": 0.5, \"seed\": 123}";

    @Test
    public void testParse() {
        NoiseConfiguration conf = NoiseConfiguration.parse(NARROWBAND);
        assertEquals(NoiseKind.NARROWBAND, conf.getKind());
        assertEquals(SamplingGrid.of(64, 64, 60), conf.getGrid());
        assertEquals(ContrastAdaptation.rmsContrast(0.2, 0.5), conf.getAdaptation());
        assertEquals(Long.valueOf(123), conf.getSeed());
        assertEquals(5L, conf.getParameters().get("center_frequency"));
    }

    @Test
    public void testGenerate() {
        NoiseConfiguration conf = NoiseConfiguration.parse(NARROWBAND);
        NoiseImage a = conf.generate();
        NoiseImage b = conf.generate();
        assertArrayEquals("seeded configuration", a.getImage().getPixelArray(), b.getImage().getPixelArray(), 0);
        assertEquals(0.2, a.getRmsContrast(), 1e-12);
        assertEquals(0.5, a.getMean(), 1e-12);
        assertEquals(Boolean.TRUE, a.getParameters().get("pseudo_noise"));
    }

    @Test
    public void testRoundTrip() {
        NoiseConfiguration conf = NoiseConfiguration.parse(NARROWBAND);
        NoiseConfiguration conf2 = NoiseConfiguration.parse(conf.toString());
        assertEquals(conf.getKind(), conf2.getKind());
        assertEquals(conf.getGrid(), conf2.getGrid());
        assertEquals(conf.getAdaptation(), conf2.getAdaptation());
        assertEquals(conf.getSeed(), conf2.getSeed());
        assertArrayEquals(conf.generate().getImage().getPixelArray(), conf2.generate().getImage().getPixelArray(), 0);
    }

    @Test
    public void testDefaultAdaptation() {
        NoiseConfiguration conf = NoiseConfiguration.parse("{\"kind\": \"brown\", \"shape\": 32, \"sampling_rate\": [32, 32], \"seed\": 1}");
        assertNull(conf.getAdaptation());
        NoiseImage noise = conf.generate();
        assertEquals(0, noise.getMin(), 1e-12);
        assertEquals(1, noise.getMax(), 1e-12);
    }

    @Test
    public void testRead() throws Exception {
        Path file = Files.createTempFile("noise", ".json");
        try {
            Files.write(file, NARROWBAND.getBytes(StandardCharsets.UTF_8));
            assertEquals(NoiseKind.NARROWBAND, NoiseConfiguration.read(file).getKind());
        } finally {
            Files.deleteIfExists(file);
        }
    }

    @Test
    public void testErrors() {
        try {
            NoiseConfiguration.parse("{\"kind\": \"white\", ");
            fail("malformed");
        } catch (ConfigurationException e) {
            assertTrue(e.getCause() instanceof ParseException);
        }
        try {
            NoiseConfiguration.parse("{\"kind\": \"blue\", \"shape\": 32, \"sampling_rate\": 32}");
            fail("unknown kind");
        } catch (UnsupportedModeException e) {
            assertEquals("blue", e.getMode());
        }
        try {
            NoiseConfiguration.parse("{\"kind\": \"white\", \"shape\": 32, \"sampling_rate\": 32, \"intensity_range\": [0, 1], \"rms_contrast\": 0.2}");
            fail("two adaptations");
        } catch (ConfigurationException e) {
            assertTrue(e.getMessage().contains("rms_contrast"));
        }
        try {
            NoiseConfiguration.parse("{\"kind\": \"white\", \"shape\": 32, \"sampling_rate\": 32, \"parameters\": {\"pseudo_noise\": 3}}");
            fail("wrong parameter type");
        } catch (ConfigurationException e) {
            assertTrue(e.getMessage().contains("pseudo_noise"));
        }
        try {
            NoiseConfiguration.parse("{\"kind\": \"white\", \"shape\": [31, 32], \"sampling_rate\": 32}").generate();
            fail("odd shape");
        } catch (ConfigurationException e) {
            assertTrue(e.getMessage().contains("even-numbered"));
        }
    }

    private static void assertRejected(String json, String name) {
        try {
            NoiseConfiguration.parse(json);
            fail("should be rejected: "+json);
        } catch (ConfigurationException e) {
            assertTrue(e.getMessage(), e.getMessage().startsWith(name));
        }
    }

    @Test
    public void testNonNumericValues() {
        assertRejected("{\"kind\": \"white\", \"shape\": [\"a\", \"b\"], \"sampling_rate\": 32}", "shape should contain integers");
        assertRejected("{\"kind\": \"white\", \"shape\": [32.9, 32], \"sampling_rate\": 32}", "shape should contain integers");
        assertRejected("{\"kind\": \"white\", \"shape\": 32.5, \"sampling_rate\": 32}", "shape should contain integers");
        assertRejected("{\"kind\": \"white\", \"shape\": 32, \"sampling_rate\": [\"32\", 32]}", "sampling_rate should contain numbers");
        assertRejected("{\"kind\": \"white\", \"shape\": 32, \"sampling_rate\": 32, \"intensity_range\": [\"0\", 1]}", "intensity_range should contain numbers");
        assertRejected("{\"kind\": \"white\", \"shape\": 32, \"sampling_rate\": 32, \"seed\": 1.7}", "seed should be an integer");
        assertRejected("{\"kind\": \"white\", \"shape\": 32, \"sampling_rate\": 32, \"seed\": \"1\"}", "seed should be an integer");
        // whole decimals are integers
        NoiseConfiguration conf = NoiseConfiguration.parse("{\"kind\": \"white\", \"shape\": [32.0, 16], \"sampling_rate\": 32, \"seed\": 7.0}");
        assertEquals(SamplingGrid.of(32, 16, 32), conf.getGrid());
        assertEquals(Long.valueOf(7), conf.getSeed());
    }
}
