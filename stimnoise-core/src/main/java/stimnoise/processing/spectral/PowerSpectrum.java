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

import org.apache.commons.math3.stat.regression.SimpleRegression;
import stimnoise.image.ImageComplex;
import stimnoise.image.ImageDouble;
import stimnoise.utils.ArrayUtil;

/**
 * Power spectrum of a realized raster, with radial averaging and power-law fit. Used to check spectral properties of generated noise.
 */
public class PowerSpectrum {
    final SamplingGrid grid;
    final ImageDouble power;
    final ImageDouble radialFrequency;

    public PowerSpectrum(ImageDouble image, SamplingGrid grid) {
        if (!grid.sameShape(image)) throw new IllegalArgumentException("image "+image+" does not match grid "+grid);
        this.grid = grid;
        ImageComplex spectrum = FourierTransform.forward(image, grid);
        this.power = new ImageDouble("power spectrum of "+image.getName(), spectrum);
        double[] pix = power.getPixelArray();
        for (int y = 0; y<spectrum.sizeY(); ++y) {
            for (int x = 0; x<spectrum.sizeX(); ++x) {
                double m = spectrum.getModulus(x, y);
                pix[x + y * spectrum.sizeX()] = m * m;
            }
        }
        this.radialFrequency = grid.getRadialFrequency();
    }

    /**
     * @return squared modulus of each bin, centered layout
     */
    public ImageDouble getPower() {
        return power.duplicate();
    }

    /**
     * @return power of the bin nearest to frequency {@code (fx, fy)}
     * @throws IllegalArgumentException if the nearest bin is outside the grid
     */
    public double getPower(double fx, double fy) {
        long x = Math.round(fx / grid.getFrequencyResolutionX()) + grid.getWidth() / 2;
        long y = Math.round(fy / grid.getFrequencyResolutionY()) + grid.getHeight() / 2;
        if (x<0 || x>=grid.getWidth() || y<0 || y>=grid.getHeight()) throw new IllegalArgumentException("Frequency ("+fx+", "+fy+") is outside the sampled frequencies of "+grid);
        return power.getPixel((int)x, (int)y);
    }

    /**
     * Average power in rings of width {@code binWidth}: ring {@code k} gathers bins with {@code round(r / binWidth) == k}
     * @param binWidth ring width, in frequency units. Use the frequency resolution of the grid for one ring per bin
     * @return {frequencies, average power} with {@code frequencies[k] = k * binWidth}. Empty rings have NaN power
     */
    public double[][] getRadialAverage(double binWidth) {
        double[] r = radialFrequency.getPixelArray();
        double[] p = power.getPixelArray();
        int maxBin = (int)Math.round(r[ArrayUtil.max(r)] / binWidth);
        double[] sum = new double[maxBin+1];
        int[] count = new int[maxBin+1];
        for (int i = 0; i<r.length; ++i) {
            int k = (int)Math.round(r[i] / binWidth);
            sum[k] += p[i];
            count[k]++;
        }
        double[] freq = new double[maxBin+1];
        for (int k = 0; k<=maxBin; ++k) {
            freq[k] = k * binWidth;
            sum[k] = count[k]==0 ? Double.NaN : sum[k] / count[k];
        }
        return new double[][]{freq, sum};
    }

    public double[][] getRadialAverage() {
        return getRadialAverage(Math.max(grid.getFrequencyResolutionX(), grid.getFrequencyResolutionY()));
    }

    /**
     * @param minFrequency lower bound, excluded rings below
     * @return frequency of the ring with highest average power, considering rings at or above {@param minFrequency}
     */
    public double getPeakRadialFrequency(double minFrequency) {
        double[][] profile = getRadialAverage();
        int best = -1;
        for (int k = 0; k<profile[0].length; ++k) {
            if (profile[0][k]<minFrequency || Double.isNaN(profile[1][k])) continue;
            if (best<0 || profile[1][k]>profile[1][best]) best = k;
        }
        return best<0 ? Double.NaN : profile[0][best];
    }

    /**
     * Least-squares slope of {@code log(power)} against {@code log(r)} over all bins with {@code minFrequency <= r <= maxFrequency} and non-zero power
     * @return slope, e.g. -2 for pink noise and -4 for brown noise
     */
    public double getLogLogSlope(double minFrequency, double maxFrequency) {
        SimpleRegression regression = new SimpleRegression();
        double[] r = radialFrequency.getPixelArray();
        double[] p = power.getPixelArray();
        for (int i = 0; i<r.length; ++i) {
            if (r[i]<minFrequency || r[i]>maxFrequency || r[i]==0 || p[i]<=0) continue;
            regression.addData(Math.log(r[i]), Math.log(p[i]));
        }
        if (regression.getN()<2) throw new IllegalArgumentException("Not enough frequency bins in ["+minFrequency+"; "+maxFrequency+"] to fit a slope");
        return regression.getSlope();
    }
}
