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

import org.apache.commons.math3.random.RandomGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import stimnoise.image.ImageComplex;
import stimnoise.image.ImageDouble;
import stimnoise.utils.ConfigurationException;

/**
 * Synthesis of conjugate-symmetric spectra, i.e. spectra whose inverse transform is real valued.
 * <p>
 * Spectra are in centered layout: bin {@code (x, y)} holds frequency index {@code (x - w/2, y - h/2)}, its conjugate mirror is {@code ((w - x) % w, (h - y) % h)}.
 * For even sizes the self-conjugate bins are {@code x in {0, w/2}} x {@code y in {0, h/2}}, DC being {@code (w/2, h/2)}.
 * </p>
 * The random generator is always supplied by the caller: identical generator state gives a bit-identical spectrum.
 */
public class HermitianSpectrum {
    public final static Logger logger = LoggerFactory.getLogger(HermitianSpectrum.class);
    public final static double DEFAULT_AMPLITUDE = 2.0;

    /**
     * Exact-magnitude ("pseudo") white spectrum: every bin has modulus {@code amplitude/2}, only the phase is random. DC is 0.
     * Adapted from T. Peromaa's construction: two random quadrants, two mirrored quadrants, and self-symmetrized seam rows/columns.
     * @param grid sampling grid, even sized
     * @param amplitude amplitude A of each positive/negative frequency pair (each bin gets A/2)
     * @param random generator
     * @return centered spectrum
     */
    public static ImageComplex pseudoWhite(SamplingGrid grid, double amplitude, RandomGenerator random) {
        grid.checkSpectralPath();
        if (!(amplitude>0) || Double.isInfinite(amplitude)) throw new ConfigurationException("amplitude should be positive and finite (amplitude="+amplitude+")");
        final int h = grid.getHeight();
        final int w = grid.getWidth();
        final int hh = h/2;
        final int hw = w/2;
        final double a2 = amplitude / 2;
        ImageComplex spectrum = new ImageComplex("pseudo white spectrum", grid.getFrequencyProperties());
        // quadrants 1 & 2 (rows above the center row)
        for (int y = 1; y<hh; ++y) for (int x = 1; x<hw; ++x) setRandomBin(spectrum, x, y, a2, random);
        for (int y = 1; y<hh; ++y) for (int x = hw+1; x<w; ++x) setRandomBin(spectrum, x, y, a2, random);
        // quadrants 3 & 4: conjugate mirror
        for (int y = 1; y<hh; ++y) {
            for (int x = 1; x<w; ++x) {
                if (x==hw) continue;
                setConjugate(spectrum, x, y, w - x, h - y);
            }
        }
        // seams: rows 0 & h/2 then columns w/2 & 0, each symmetric within itself
        for (int y : new int[]{0, hh}) {
            for (int x = 0; x<w; ++x) setRandomBin(spectrum, x, y, a2, random);
            for (int x = hw+1; x<w; ++x) setConjugate(spectrum, w - x, y, x, y);
        }
        for (int x : new int[]{hw, 0}) {
            for (int y = 0; y<h; ++y) setRandomBin(spectrum, x, y, a2, random);
            for (int y = hh+1; y<h; ++y) setConjugate(spectrum, x, h - y, x, y);
        }
        // self-conjugate bins
        spectrum.set(0, 0, -a2, 0);
        spectrum.set(hw, 0, -a2, 0);
        spectrum.set(0, hh, -a2, 0);
        spectrum.set(hw, hh, 0, 0);
        logger.debug("pseudo white spectrum: {} amplitude: {}", grid, amplitude);
        return spectrum;
    }

    /**
     * Free mode: spectrum of independent samples drawn uniformly in [-1, 1); the modulus of each bin is random.
     * DC is set to 0 and the conjugate symmetry is enforced exactly.
     * @param grid sampling grid, even sized
     * @param random generator
     * @return centered spectrum
     */
    public static ImageComplex free(SamplingGrid grid, RandomGenerator random) {
        grid.checkSpectralPath();
        ImageDouble samples = new ImageDouble("white samples", grid.getSpatialProperties());
        double[] pix = samples.getPixelArray();
        for (int i = 0; i<pix.length; ++i) pix[i] = random.nextDouble() * 2 - 1;
        ImageComplex spectrum = FourierTransform.forward(samples, grid).setName("free white spectrum");
        spectrum.set(grid.getWidth()/2, grid.getHeight()/2, 0, 0);
        enforceSymmetry(spectrum);
        logger.debug("free white spectrum: {}", grid);
        return spectrum;
    }

    private static void setRandomBin(ImageComplex spectrum, int x, int y, double halfAmplitude, RandomGenerator random) {
        double re = random.nextDouble() * 2 * halfAmplitude - halfAmplitude;
        double im = Math.sqrt(Math.max(0, halfAmplitude * halfAmplitude - re * re));
        if (random.nextBoolean()) im = -im;
        spectrum.set(x, y, re, im);
    }

    /**
     * sets bin {@code (xDest, yDest)} to the conjugate of {@code (xSource, ySource)}
     */
    private static void setConjugate(ImageComplex spectrum, int xSource, int ySource, int xDest, int yDest) {
        spectrum.set(xDest, yDest, spectrum.getReal(xSource, ySource), -spectrum.getImaginary(xSource, ySource));
    }

    /**
     * @return index of frequency {@code -f} along an axis of {@param size} bins in centered layout, where index {@param index} holds {@code f}
     */
    public static int mirror(int index, int size) {
        return (2 * (size / 2) - index) % size;
    }

    public static boolean isSelfConjugate(int x, int y, int sizeX, int sizeY) {
        return mirror(x, sizeX) == x && mirror(y, sizeY) == y;
    }

    /**
     * Overwrites the second bin of each mirror pair (in row-major order) with the conjugate of the first one and drops the imaginary part of self-conjugate bins.
     * @param spectrum centered spectrum, modified in place
     */
    public static void enforceSymmetry(ImageComplex spectrum) {
        int w = spectrum.sizeX();
        int h = spectrum.sizeY();
        for (int y = 0; y<h; ++y) {
            int my = mirror(y, h);
            for (int x = 0; x<w; ++x) {
                int mx = mirror(x, w);
                int idx = x + y * w;
                int midx = mx + my * w;
                if (idx < midx) setConjugate(spectrum, x, y, mx, my);
                else if (idx == midx) spectrum.set(x, y, spectrum.getReal(x, y), 0);
            }
        }
    }

    /**
     * @return maximal deviation {@code |S[-u,-v] - conj(S[u,v])|} over all bins
     */
    public static double getSymmetryError(ImageComplex spectrum) {
        int w = spectrum.sizeX();
        int h = spectrum.sizeY();
        double max = 0;
        for (int y = 0; y<h; ++y) {
            int my = mirror(y, h);
            for (int x = 0; x<w; ++x) {
                int mx = mirror(x, w);
                double dRe = spectrum.getReal(mx, my) - spectrum.getReal(x, y);
                double dIm = spectrum.getImaginary(mx, my) + spectrum.getImaginary(x, y);
                double d = Math.hypot(dRe, dIm);
                if (d>max) max = d;
            }
        }
        return max;
    }

    public static boolean isHermitian(ImageComplex spectrum, double tolerance) {
        return getSymmetryError(spectrum) <= tolerance;
    }
}
