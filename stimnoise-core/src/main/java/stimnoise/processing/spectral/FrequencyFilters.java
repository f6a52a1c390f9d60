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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import stimnoise.image.ImageComplex;
import stimnoise.image.ImageDouble;
import stimnoise.utils.ConfigurationException;

/**
 * Real, non-negative frequency-domain kernels built on the centered frequency axes of a {@link SamplingGrid}, applied to a spectrum by elementwise multiplication.
 */
public class FrequencyFilters {
    public final static Logger logger = LoggerFactory.getLogger(FrequencyFilters.class);
    private final static double FWHM_FACTOR = Math.sqrt(2 * Math.log(2));

    /**
     * Standard deviation of a Gaussian band whose full width at half maximum spans {@param bandwidth} octaves around {@param centerFrequency}
     * (upper bound = lower bound * 2^bandwidth). For a one-octave band this is {@code centerFrequency / (3 * sqrt(2 ln 2))}.
     * @param centerFrequency center frequency, e.g. in cpd
     * @param bandwidth bandwidth in octaves
     * @return sigma, in the unit of {@param centerFrequency}
     */
    public static double octaveBandwidthToSigma(double centerFrequency, double bandwidth) {
        ConfigurationException.check(centerFrequency>0 && Double.isFinite(centerFrequency), "center_frequency should be positive (center_frequency=%s)", centerFrequency);
        ConfigurationException.check(bandwidth>0 && Double.isFinite(bandwidth), "bandwidth should be positive (bandwidth=%s)", bandwidth);
        double ratio = Math.pow(2, bandwidth);
        return centerFrequency * (ratio - 1) / ((ratio + 1) * FWHM_FACTOR);
    }

    /**
     * Gaussian ring {@code exp(-(fc - r)^2 / (2 sigma^2))} over radial frequency {@code r}, normalized to a maximum of 1
     * @param grid sampling grid
     * @param centerFrequency ring center, must not exceed the Nyquist frequency
     * @param sigma ring half-width
     * @return kernel in centered layout
     */
    public static ImageDouble bandpass(SamplingGrid grid, double centerFrequency, double sigma) {
        double nyquist = grid.getNyquistFrequency();
        ConfigurationException.check(centerFrequency>0, "center_frequency should be positive (center_frequency=%s)", centerFrequency);
        ConfigurationException.check(centerFrequency<=nyquist, "center_frequency (%s) should not exceed Nyquist limit %s (sampling_rate/2)", centerFrequency, nyquist);
        ConfigurationException.check(sigma>0 && Double.isFinite(sigma), "sigma should be positive (sigma=%s)", sigma);
        if (centerFrequency + sigma > nyquist) logger.warn("band-pass ring at {} (sigma: {}) extends above the Nyquist frequency {}", centerFrequency, sigma, nyquist);
        ImageDouble res = grid.getRadialFrequency().setName("bandpass");
        double[] pix = res.getPixelArray();
        double twoSigma2 = 2 * sigma * sigma;
        double max = 0;
        for (int i = 0; i<pix.length; ++i) {
            double d = centerFrequency - pix[i];
            pix[i] = Math.exp(-d * d / twoSigma2);
            if (pix[i]>max) max = pix[i];
        }
        if (max>0) for (int i = 0; i<pix.length; ++i) pix[i] /= max;
        return res;
    }

    /**
     * Radial power law {@code 1 / r^exponent}. The DC bin, where {@code r^exponent} is 0, gets weight 1.
     * @param grid sampling grid
     * @param exponent positive exponent: 1 is pink noise, 2 is brown noise
     * @return kernel in centered layout
     */
    public static ImageDouble powerLaw(SamplingGrid grid, double exponent) {
        ConfigurationException.check(exponent>0 && Double.isFinite(exponent), "exponent should be positive (exponent=%s)", exponent);
        ImageDouble res = grid.getRadialFrequency().setName("power law");
        double[] pix = res.getPixelArray();
        for (int i = 0; i<pix.length; ++i) {
            double f = Math.pow(pix[i], exponent);
            pix[i] = f == 0 ? 1 : 1 / f;
        }
        return res;
    }

    /**
     * Coefficients of a 2D Gaussian rotated by {@param orientation}
     * @param orientation angle in degrees
     * @param sigma spread
     * @return {a, b, c} with {@code a = cos^2(t) / (2 sigma^2)}, {@code b = -sin(2t) / (4 sigma^2)}, {@code c = sin^2(t) / (2 sigma^2)}
     */
    public static double[] orientedCoefficients(double orientation, double sigma) {
        ConfigurationException.check(sigma>0 && Double.isFinite(sigma), "sigma should be positive (sigma=%s)", sigma);
        double theta = Math.toRadians(orientation);
        double sigma2 = sigma * sigma;
        double cos = Math.cos(theta);
        double sin = Math.sin(theta);
        return new double[]{
                cos * cos / (2 * sigma2),
                -Math.sin(2 * theta) / (4 * sigma2),
                sin * sin / (2 * sigma2)
        };
    }

    /**
     * Oriented Gaussian {@code exp(-(a fx^2 + 2 b fx fy + c fy^2))}, see {@link #orientedCoefficients(double, double)}
     * @param grid sampling grid
     * @param sigma spread, in frequency units
     * @param orientation angle in degrees
     * @return kernel in centered layout
     */
    public static ImageDouble oriented(SamplingGrid grid, double sigma, double orientation) {
        double[] abc = orientedCoefficients(orientation, sigma);
        double[] fy = grid.getFrequencyAxisY();
        double[] fx = grid.getFrequencyAxisX();
        ImageDouble res = new ImageDouble("oriented", grid.getFrequencyProperties());
        for (int y = 0; y<fy.length; ++y) {
            for (int x = 0; x<fx.length; ++x) {
                res.setPixel(x, y, Math.exp(-(abc[0] * fx[x] * fx[x] + 2 * abc[1] * fx[x] * fy[y] + abc[2] * fy[y] * fy[y])));
            }
        }
        return res;
    }

    /**
     * @param spectrum centered spectrum (not modified)
     * @param filter real kernel of same shape
     * @return new spectrum {@code spectrum * filter}
     */
    public static ImageComplex apply(ImageComplex spectrum, ImageDouble filter) {
        if (!spectrum.sameDimensions(filter)) throw new IllegalArgumentException("Filter "+filter+" and spectrum "+spectrum+" should have same dimensions");
        ImageComplex res = spectrum.duplicate(spectrum.getName()+" x "+filter.getName());
        for (int y = 0; y<res.sizeY(); ++y) {
            for (int x = 0; x<res.sizeX(); ++x) res.multiply(x, y, filter.getPixel(x, y));
        }
        return res;
    }
}
