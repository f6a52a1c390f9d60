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

import org.jtransforms.fft.DoubleFFT_2D;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import stimnoise.image.ImageComplex;
import stimnoise.image.ImageDouble;

/**
 * 2D discrete Fourier transforms between spatial rasters and centered spectra (DC at {@code (sizeX/2, sizeY/2)}).
 * Forward transform is unscaled, inverse transform is scaled by {@code 1/(sizeX*sizeY)}.
 */
public class FourierTransform {
    public final static Logger logger = LoggerFactory.getLogger(FourierTransform.class);

    /**
     * @param image real spatial raster
     * @return centered spectrum of {@param image}, calibrated in frequency units if {@param grid} is not null
     */
    public static ImageComplex forward(ImageDouble image, SamplingGrid grid) {
        ImageComplex data = ImageComplex.fromReal(image);
        double[][] a = data.getPixelArray();
        new DoubleFFT_2D(image.sizeY(), image.sizeX()).complexForward(a);
        ImageComplex res = new ImageComplex("FFT of "+image.getName(), shift(a, false));
        if (grid!=null) res.setCalibration(grid.getFrequencyResolutionX(), grid.getFrequencyResolutionY());
        return res;
    }

    /**
     * @param spectrum centered spectrum (not modified)
     * @return complex spatial raster
     */
    public static ImageComplex inverse(ImageComplex spectrum) {
        double[][] a = shift(spectrum.getPixelArray(), true);
        new DoubleFFT_2D(spectrum.sizeY(), spectrum.sizeX()).complexInverse(a, true);
        return new ImageComplex("Inverse FFT of "+spectrum.getName(), a);
    }

    /**
     * Inverse transform keeping only the real component. For a conjugate-symmetric spectrum the discarded imaginary part is rounding noise.
     * @param spectrum centered spectrum (not modified)
     * @param grid sampling grid used to calibrate the output, can be null
     * @return real spatial raster
     */
    public static ImageDouble realize(ImageComplex spectrum, SamplingGrid grid) {
        ImageComplex spatial = inverse(spectrum);
        if (logger.isDebugEnabled()) logger.debug("realize {}: max discarded imaginary part: {}", spectrum, spatial.getMaxAbsImaginary());
        ImageDouble res = spatial.getRealPart().setName("noise");
        if (grid!=null) res.setCalibration(1/grid.getRateX(), 1/grid.getRateY());
        return res;
    }

    /**
     * Circular shift of interleaved complex rows by half the size along each axis. {@code inverse=false} is numpy's fftshift, {@code inverse=true} is ifftshift. They only differ for odd sizes
     * @return new array
     */
    public static double[][] shift(double[][] data, boolean inverse) {
        int sizeY = data.length;
        if (sizeY==0) return new double[0][];
        int sizeX = data[0].length / 2;
        int shiftY = inverse ? sizeY - sizeY / 2 : sizeY / 2;
        int shiftX = inverse ? sizeX - sizeX / 2 : sizeX / 2;
        double[][] res = new double[sizeY][2*sizeX];
        for (int y = 0; y<sizeY; ++y) {
            double[] source = data[y];
            double[] dest = res[(y + shiftY) % sizeY];
            for (int x = 0; x<sizeX; ++x) {
                int xd = 2 * ((x + shiftX) % sizeX);
                dest[xd] = source[2*x];
                dest[xd+1] = source[2*x+1];
            }
        }
        return res;
    }
}
