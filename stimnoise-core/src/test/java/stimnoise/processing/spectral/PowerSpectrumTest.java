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

import org.apache.commons.math3.random.Well19937c;
import org.junit.Test;
import stimnoise.image.ImageDouble;

import static org.junit.Assert.*;

public class PowerSpectrumTest {

    @Test
    public void testGrating() {
        // vertical bars, 4 cycles per unit length along x
        SamplingGrid grid = SamplingGrid.of(32, 32, 32);
        ImageDouble grating = new ImageDouble("grating", grid.getSpatialProperties());
        for (int y = 0; y<32; ++y) for (int x = 0; x<32; ++x) grating.setPixel(x, y, Math.cos(2 * Math.PI * 4 * x / 32.));
        PowerSpectrum ps = new PowerSpectrum(grating, grid);
        assertEquals(512. * 512, ps.getPower(4, 0), 1e-6);
        assertEquals(512. * 512, ps.getPower(-4, 0), 1e-6);
        assertEquals(0, ps.getPower(0, 4), 1e-6);
        assertEquals(4, ps.getPeakRadialFrequency(0), 0);
        double[][] profile = ps.getRadialAverage();
        assertEquals(0, profile[0][0], 0);
        assertEquals(1, profile[0][1], 0);
    }

    @Test
    public void testLogLogSlope() {
        SamplingGrid grid = SamplingGrid.of(32, 32, 32);
        ImageDouble filter = FrequencyFilters.powerLaw(grid, 1);
        ImageDouble pink = FourierTransform.realize(FrequencyFilters.apply(HermitianSpectrum.pseudoWhite(grid, 2, new Well19937c(1)), filter), grid);
        PowerSpectrum ps = new PowerSpectrum(pink, grid);
        assertEquals(-2, ps.getLogLogSlope(1, 16), 1e-6);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testShapeMismatch() {
        new PowerSpectrum(new ImageDouble("small", 8, 8), SamplingGrid.of(16, 16, 16));
    }

    @Test
    public void testFrequencyOutsideGrid() {
        SamplingGrid grid = SamplingGrid.of(32, 32, 32);
        PowerSpectrum ps = new PowerSpectrum(FourierTransform.realize(HermitianSpectrum.pseudoWhite(grid, 2, new Well19937c(3)), grid), grid);
        assertEquals(1, ps.getPower(-16, -16), 1e-9);
        try {
            ps.getPower(16, 0);
            fail("16 cpd is not sampled on a 32 pixel axis");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().startsWith("Frequency (16.0, 0.0)"));
        }
        try {
            ps.getPower(0, -40);
            fail("below the lowest sampled frequency");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("outside the sampled frequencies"));
        }
    }
}
