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
package stimnoise.image;

import stimnoise.utils.ArrayUtil;

/**
 * Real valued raster with double precision. Used for realized noise and frequency-domain filter kernels.
 */
public class ImageDouble extends Image<ImageDouble> {

    final private double[] pixels;

    /**
     * Builds a new blank image with same properties as {@param properties}
     * @param name name of the new image
     * @param properties properties of the new image
     */
    public ImageDouble(String name, ImageProperties properties) {
        super(name, properties);
        this.pixels=new double[sizeXY];
    }
    public ImageDouble(String name, int sizeX, int sizeY) {
        super(name, sizeX, sizeY);
        this.pixels=new double[sizeXY];
    }

    public ImageDouble(String name, int sizeX, double[] pixels) {
        super(name, sizeX, sizeX>0?pixels.length/sizeX:0);
        if (sizeX>0 && pixels.length%sizeX!=0) throw new IllegalArgumentException("Pixel array length ("+pixels.length+") is not a multiple of sizeX ("+sizeX+")");
        this.pixels=pixels;
    }

    public double getPixel(int x, int y) {
        return pixels[x+y*sizeX];
    }

    public double getPixel(int xy) {
        return pixels[xy];
    }

    public void setPixel(int x, int y, double value) {
        pixels[x+y*sizeX]=value;
    }

    public void setPixel(int xy, double value) {
        pixels[xy]=value;
    }

    public double[] getMinAndMax() {
        return ArrayUtil.minAndMax(pixels);
    }

    @Override
    public ImageDouble duplicate(String name) {
        double[] newPixels = new double[sizeXY];
        System.arraycopy(pixels, 0, newPixels, 0, sizeXY);
        return new ImageDouble(name, sizeX, newPixels).setCalibration(this);
    }

    /**
     * @return backing pixel array (row-major), not a copy
     */
    public double[] getPixelArray() {
        return pixels;
    }
}
