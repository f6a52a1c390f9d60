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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import stimnoise.image.ImageComplex;
import stimnoise.image.ImageDouble;
import stimnoise.processing.ImageOperations;
import stimnoise.utils.ConfigurationException;

import java.util.Arrays;

import static org.junit.Assert.*;

public class HermitianSpectrumTest {
    public final static Logger logger = LoggerFactory.getLogger(HermitianSpectrumTest.class);

    @Test
    public void testPseudoWhiteSymmetry() {
        for (int[] shape : new int[][]{{32, 32}, {16, 24}, {2, 2}, {4, 8}}) {
            SamplingGrid grid = SamplingGrid.of(shape[0], shape[1], 30);
            ImageComplex spectrum = HermitianSpectrum.pseudoWhite(grid, 2, new Well19937c(1));
            assertEquals("symmetry error "+grid, 0, HermitianSpectrum.getSymmetryError(spectrum), 0);
            assertTrue(HermitianSpectrum.isHermitian(spectrum, 0));
        }
    }

    @Test
    public void testPseudoWhiteFixedPoints() {
        SamplingGrid grid = SamplingGrid.of(16, 20, 10);
        double amplitude = 3;
        ImageComplex spectrum = HermitianSpectrum.pseudoWhite(grid, amplitude, new Well19937c(5));
        assertEquals("DC real", 0, spectrum.getReal(10, 8), 0);
        assertEquals("DC imaginary", 0, spectrum.getImaginary(10, 8), 0);
        for (int[] xy : new int[][]{{0, 0}, {10, 0}, {0, 8}}) {
            assertEquals("fixed point real", -amplitude/2, spectrum.getReal(xy[0], xy[1]), 0);
            assertEquals("fixed point imaginary", 0, spectrum.getImaginary(xy[0], xy[1]), 0);
            assertTrue(HermitianSpectrum.isSelfConjugate(xy[0], xy[1], 20, 16));
        }
    }

    @Test
    public void testFlatAmplitude() {
        SamplingGrid grid = SamplingGrid.of(32, 32, 32);
        ImageComplex spectrum = HermitianSpectrum.pseudoWhite(grid, 2, new Well19937c(123));
        for (int y = 0; y<32; ++y) {
            for (int x = 0; x<32; ++x) {
                if (x==16 && y==16) continue;
                assertEquals("modulus at "+x+";"+y, 1, spectrum.getModulus(x, y), 1e-12);
            }
        }
    }

    @Test
    public void testRealness() {
        SamplingGrid grid = SamplingGrid.of(32, 48, 32);
        ImageComplex pseudo = HermitianSpectrum.pseudoWhite(grid, 2, new Well19937c(7));
        assertEquals("pseudo mode imaginary part", 0, FourierTransform.inverse(pseudo).getMaxAbsImaginary(), 1e-12);
        ImageComplex free = HermitianSpectrum.free(grid, new Well19937c(7));
        assertEquals("free mode imaginary part", 0, FourierTransform.inverse(free).getMaxAbsImaginary(), 1e-12);
        ImageComplex filtered = FrequencyFilters.apply(pseudo, FrequencyFilters.bandpass(grid, 4, 1));
        assertEquals("filtered imaginary part", 0, FourierTransform.inverse(filtered).getMaxAbsImaginary(), 1e-12);
    }

    @Test
    public void testZeroMean() {
        SamplingGrid grid = SamplingGrid.of(32, 32, 32);
        ImageDouble pseudo = FourierTransform.realize(HermitianSpectrum.pseudoWhite(grid, 2, new Well19937c(11)), grid);
        assertEquals(0, ImageOperations.getMeanAndSigma(pseudo)[0], 1e-14);
        ImageComplex free = HermitianSpectrum.free(grid, new Well19937c(11));
        assertEquals(0, free.getModulus(16, 16), 0);
        assertEquals(0, HermitianSpectrum.getSymmetryError(free), 0);
        assertEquals(0, ImageOperations.getMeanAndSigma(FourierTransform.realize(free, grid))[0], 1e-14);
    }

    @Test
    public void testDeterminism() {
        SamplingGrid grid = SamplingGrid.of(16, 16, 16);
        ImageDouble a = FourierTransform.realize(HermitianSpectrum.pseudoWhite(grid, 2, new Well19937c(42)), grid);
        ImageDouble b = FourierTransform.realize(HermitianSpectrum.pseudoWhite(grid, 2, new Well19937c(42)), grid);
        ImageDouble c = FourierTransform.realize(HermitianSpectrum.pseudoWhite(grid, 2, new Well19937c(43)), grid);
        assertArrayEquals(a.getPixelArray(), b.getPixelArray(), 0);
        assertFalse(Arrays.equals(a.getPixelArray(), c.getPixelArray()));
        ImageDouble fa = FourierTransform.realize(HermitianSpectrum.free(grid, new Well19937c(42)), grid);
        ImageDouble fb = FourierTransform.realize(HermitianSpectrum.free(grid, new Well19937c(42)), grid);
        assertArrayEquals(fa.getPixelArray(), fb.getPixelArray(), 0);
    }

    @Test
    public void testMirror() {
        assertEquals(0, HermitianSpectrum.mirror(0, 8));
        assertEquals(4, HermitianSpectrum.mirror(4, 8));
        assertEquals(7, HermitianSpectrum.mirror(1, 8));
        assertEquals(2, HermitianSpectrum.mirror(6, 8));
        // odd size: DC at 2, no Nyquist bin
        assertEquals(2, HermitianSpectrum.mirror(2, 5));
        assertEquals(4, HermitianSpectrum.mirror(0, 5));
        assertEquals(3, HermitianSpectrum.mirror(1, 5));
    }

    @Test
    public void testOddShape() {
        SamplingGrid grid = SamplingGrid.of(31, 32, 32);
        try {
            HermitianSpectrum.pseudoWhite(grid, 2, new Well19937c(1));
            fail("odd shape should be rejected");
        } catch (ConfigurationException e) {
            logger.debug("expected: {}", e.getMessage());
            assertTrue(e.getMessage().contains("even-numbered"));
        }
        try {
            HermitianSpectrum.free(grid, new Well19937c(1));
            fail("odd shape should be rejected");
        } catch (ConfigurationException e) {
            assertTrue(e.getMessage().contains("height=31"));
        }
    }

    @Test(expected = ConfigurationException.class)
    public void testAnisotropicRate() {
        HermitianSpectrum.pseudoWhite(new SamplingGrid(32, 32, 30, 60), 2, new Well19937c(1));
    }

    @Test(expected = ConfigurationException.class)
    public void testNegativeAmplitude() {
        HermitianSpectrum.pseudoWhite(SamplingGrid.of(8, 8, 8), -1, new Well19937c(1));
    }

    @Test
    public void testEnforceSymmetry() {
        ImageComplex spectrum = new ImageComplex("s", 5, 4);
        Well19937c random = new Well19937c(3);
        for (int y = 0; y<4; ++y) for (int x = 0; x<5; ++x) spectrum.set(x, y, random.nextDouble(), random.nextDouble());
        assertFalse(HermitianSpectrum.isHermitian(spectrum, 1e-3));
        HermitianSpectrum.enforceSymmetry(spectrum);
        assertEquals(0, HermitianSpectrum.getSymmetryError(spectrum), 0);
    }
}
