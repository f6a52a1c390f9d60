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
package stimnoise.image.wrappers;

import ij.ImagePlus;
import ij.measure.Calibration;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;
import stimnoise.image.ImageDouble;

/**
 *
 * Conversion between rasters and ImageJ's ImagePlus. ImageJ has no 64-bit type, so pixels are converted to 32-bit float (no link between pixel arrays)
 */
public class IJImageWrapper {
    public static String UNIT = "deg";

    public static ImageDouble wrap(ImagePlus img) {
        if (img.getStackSize()>1) throw new IllegalArgumentException("Only single-plane images are supported (stack size: "+img.getStackSize()+")");
        ImageProcessor ip = img.getProcessor();
        int sizeX = ip.getWidth();
        int sizeY = ip.getHeight();
        double[] pixels = new double[sizeX * sizeY];
        for (int y = 0; y<sizeY; ++y) {
            for (int x = 0; x<sizeX; ++x) pixels[x + y * sizeX] = ip.getPixelValue(x, y);
        }
        ImageDouble res = new ImageDouble(img.getTitle(), sizeX, pixels);
        Calibration cal = img.getCalibration();
        if (cal!=null && cal.scaled()) res.setCalibration(cal.pixelWidth, cal.pixelHeight);
        return res;
    }

    /**
     * Generate ImageJ's ImagePlus object from {@param image}
     * @param image input image
     * @return 32-bit ImagePlus calibrated with the scales of {@param image}
     */
    public static ImagePlus getImagePlus(ImageDouble image) {
        float[] pixels = new float[image.sizeXY()];
        double[] source = image.getPixelArray();
        for (int i = 0; i<pixels.length; ++i) pixels[i] = (float)source[i];
        FloatProcessor fp = new FloatProcessor(image.sizeX(), image.sizeY(), pixels);
        fp.resetMinAndMax();
        ImagePlus ip = new ImagePlus(image.getName(), fp);
        Calibration cal = new Calibration();
        if (image.getScaleX()!=1 || image.getScaleY()!=1) {
            cal.pixelWidth=image.getScaleX();
            cal.pixelHeight=image.getScaleY();
            cal.setUnit(UNIT);
        }
        ip.setCalibration(cal);
        return ip;
    }
}
