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
package stimnoise.processing;

import org.apache.commons.math3.random.Well19937c;
import org.junit.Test;
import stimnoise.image.ImageDouble;
import stimnoise.utils.ConfigurationException;
import stimnoise.utils.NumericDegeneracyException;

import static org.junit.Assert.*;

public class ImageOperationsTest {

    private static ImageDouble random(int seed) {
        Well19937c random = new Well19937c(seed);
        ImageDouble res = new ImageDouble("random", 16, 12);
        for (int i = 0; i<res.sizeXY(); ++i) res.setPixel(i, random.nextGaussian() * 3 + 1);
        return res;
    }

    private static ImageDouble constant(double value) {
        ImageDouble res = new ImageDouble("constant", 8, 8);
        for (int i = 0; i<res.sizeXY(); ++i) res.setPixel(i, value);
        return res;
    }

    @Test
    public void testIntensityRange() {
        ImageDouble image = random(1);
        double[] before = image.getPixelArray().clone();
        ImageDouble res = ImageOperations.adaptIntensityRange(image, -0.5, 2);
        assertArrayEquals("input not modified", before, image.getPixelArray(), 0);
        assertArrayEquals(new double[]{-0.5, 2}, res.getMinAndMax(), 1e-12);
        ImageDouble twice = ImageOperations.adaptIntensityRange(res, -0.5, 2);
        assertArrayEquals("idempotent", res.getPixelArray(), twice.getPixelArray(), 1e-12);
    }

    @Test
    public void testRmsContrast() {
        ImageDouble image = random(2);
        ImageDouble res = ImageOperations.adaptRmsContrast(image, 0.2, 0.5);
        double[] meanSigma = ImageOperations.getMeanAndSigma(res);
        assertEquals(0.5, meanSigma[0], 1e-12);
        assertEquals(0.2, meanSigma[1], 1e-12);
        ImageDouble twice = ImageOperations.adaptRmsContrast(res, 0.2, 0.5);
        assertArrayEquals("idempotent", res.getPixelArray(), twice.getPixelArray(), 1e-12);
        // null mean luminance keeps the mean
        double mean = ImageOperations.getMeanAndSigma(image)[0];
        assertEquals(mean, ImageOperations.getMeanAndSigma(ImageOperations.adaptRmsContrast(image, 0.1, null))[0], 1e-12);
    }

    @Test
    public void testNormalizedRmsContrast() {
        ImageDouble res = ImageOperations.adaptNormalizedRmsContrast(random(3), 0.2, 0.5);
        double[] meanSigma = ImageOperations.getMeanAndSigma(res);
        assertEquals(0.5, meanSigma[0], 1e-12);
        assertEquals(0.1, meanSigma[1], 1e-12);
    }

    @Test
    public void testNormalizedRmsContrastNegativeMean() {
        ImageDouble image = random(3);
        ImageDouble res = ImageOperations.adaptNormalizedRmsContrast(image, 0.2, -0.5);
        double[] meanSigma = ImageOperations.getMeanAndSigma(res);
        assertEquals(-0.5, meanSigma[0], 1e-12);
        assertEquals(0.1, meanSigma[1], 1e-12);
        // negative scale: brightest input pixel becomes the darkest
        double[] in = image.getPixelArray();
        int brightest = 0;
        for (int i = 1; i<in.length; ++i) if (in[i]>in[brightest]) brightest = i;
        assertEquals(res.getMinAndMax()[0], res.getPixel(brightest), 1e-12);
    }

    @Test
    public void testMichelsonContrast() {
        ImageDouble res = ImageOperations.adaptMichelsonContrast(random(4), 0.5, 0.5);
        assertArrayEquals(new double[]{0.25, 0.75}, res.getMinAndMax(), 1e-12);
        assertEquals(0.5, ImageOperations.getMichelsonContrast(res), 1e-12);
    }

    @Test
    public void testZeroVariance() {
        ImageDouble image = constant(0.3);
        try {
            ImageOperations.adaptRmsContrast(image, 0.2, null);
            fail("RMS contrast of a constant image");
        } catch (NumericDegeneracyException e) {
            assertTrue(e instanceof ArithmeticException);
        }
        try {
            ImageOperations.adaptIntensityRange(image, 0, 1);
            fail("intensity range of a constant image");
        } catch (NumericDegeneracyException e) {}
        try {
            ImageOperations.adaptNormalizedRmsContrast(image, 0.2, 0.5);
            fail("normalized RMS contrast of a constant image");
        } catch (NumericDegeneracyException e) {}
        try {
            ImageOperations.adaptMichelsonContrast(image, 0.2, 0.5);
            fail("Michelson contrast of a constant image");
        } catch (NumericDegeneracyException e) {}
    }

    @Test(expected = ConfigurationException.class)
    public void testUnorderedRange() {
        ImageOperations.adaptIntensityRange(random(5), 1, 0);
    }

    @Test
    public void testAddImage() {
        ImageDouble a = constant(1);
        ImageDouble b = constant(2);
        ImageDouble sum = ImageOperations.addImage(a, b, null, 0.5);
        assertArrayEquals(new double[]{2, 2}, sum.getMinAndMax(), 0);
    }
}
