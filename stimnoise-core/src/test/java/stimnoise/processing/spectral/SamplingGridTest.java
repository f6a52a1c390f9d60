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
package stimnoise.processing.spectral;

import org.json.simple.JSONObject;
import org.junit.Test;
import stimnoise.utils.ConfigurationException;
import stimnoise.utils.JSONUtils;

import static org.junit.Assert.*;

public class SamplingGridTest {

    @Test
    public void testFrequencyAxes() {
        // same as numpy fftshift(fftfreq(n, 1/rate))
        assertArrayEquals(new double[]{-2, -1, 0, 1}, SamplingGrid.frequencyAxis(4, 4), 1e-15);
        assertArrayEquals(new double[]{-2, -1, 0, 1, 2}, SamplingGrid.frequencyAxis(5, 5), 1e-15);
        SamplingGrid grid = new SamplingGrid(64, 32, 60, 60);
        double[] fy = grid.getFrequencyAxisY();
        double[] fx = grid.getFrequencyAxisX();
        assertEquals(64, fy.length);
        assertEquals(32, fx.length);
        assertEquals(0, fy[32], 0);
        assertEquals(0, fx[16], 0);
        assertEquals(-30, fy[0], 1e-12);
        assertEquals(60./64, grid.getFrequencyResolutionY(), 1e-15);
        assertEquals(60./32, grid.getFrequencyResolutionX(), 1e-15);
        assertEquals(30, grid.getNyquistFrequency(), 0);
        assertArrayEquals(new double[]{64./60, 32./60}, grid.getVisualSize(), 1e-15);
    }

    @Test
    public void testRadialFrequency() {
        SamplingGrid grid = SamplingGrid.of(8, 8, 8);
        assertEquals(0, grid.getRadialFrequency().getPixel(4, 4), 0);
        assertEquals(5, grid.getRadialFrequency().getPixel(1, 0), 1e-12);
    }

    @Test
    public void testChecks() {
        SamplingGrid grid = new SamplingGrid(32, 32, 30, 60);
        assertFalse(grid.isIsotropic());
        try {
            grid.getRate();
            fail("anisotropic rate");
        } catch (ConfigurationException e) {
            assertTrue(e.getMessage().contains("sampling_rate"));
        }
        assertFalse(SamplingGrid.of(31, 32, 1).isEven());
        SamplingGrid.of(30, 32, 1).checkSpectralPath();
    }

    @Test(expected = ConfigurationException.class)
    public void testNonPositiveShape() {
        SamplingGrid.of(0, 32, 1);
    }

    @Test(expected = ConfigurationException.class)
    public void testNonPositiveRate() {
        SamplingGrid.of(32, 32, -1);
    }

    @Test
    public void testJSON() throws Exception {
        SamplingGrid grid = new SamplingGrid(16, 32, 30, 60);
        JSONObject json = JSONUtils.parse(((JSONObject)grid.toJSONEntry()).toJSONString());
        assertEquals(grid, SamplingGrid.fromJSONEntry(json));
        SamplingGrid square = SamplingGrid.fromJSONEntry(JSONUtils.parse("{\"shape\": 20, \"sampling_rate\": 10}"));
        assertEquals(SamplingGrid.of(20, 20, 10), square);
    }

    @Test(expected = ConfigurationException.class)
    public void testJSONMissingRate() throws Exception {
        SamplingGrid.fromJSONEntry(JSONUtils.parse("{\"shape\": [20, 20]}"));
    }
}
