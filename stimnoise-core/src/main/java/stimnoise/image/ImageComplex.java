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

/**
 * Complex valued raster. Storage is one interleaved row per line ({@code row[2*x]} real, {@code row[2*x+1]} imaginary),
 * which is the layout JTransforms' complex 2D transforms work on in place.
 */
public class ImageComplex extends Image<ImageComplex> {

    final private double[][] data;

    public ImageComplex(String name, ImageProperties properties) {
        super(name, properties);
        this.data = new double[sizeY][2*sizeX];
    }

    public ImageComplex(String name, int sizeX, int sizeY) {
        super(name, sizeX, sizeY);
        this.data = new double[sizeY][2*sizeX];
    }

    /**
     * @param data interleaved rows {@code [sizeY][2*sizeX]}, not copied
     */
    public ImageComplex(String name, double[][] data) {
        super(name, data.length>0 ? data[0].length/2 : 0, data.length);
        for (double[] row : data) if (row.length!=2*sizeX) throw new IllegalArgumentException("All rows should have length 2*sizeX");
        this.data = data;
    }

    public static ImageComplex fromReal(ImageDouble real) {
        ImageComplex res = new ImageComplex(real.getName(), real);
        double[] pix = real.getPixelArray();
        for (int y = 0; y<res.sizeY; ++y) {
            double[] row = res.data[y];
            int off = y * res.sizeX;
            for (int x = 0; x<res.sizeX; ++x) row[2*x] = pix[off+x];
        }
        return res;
    }

    public double getReal(int x, int y) {
        return data[y][2*x];
    }

    public double getImaginary(int x, int y) {
        return data[y][2*x+1];
    }

    public double getModulus(int x, int y) {
        return Math.hypot(data[y][2*x], data[y][2*x+1]);
    }

    public void set(int x, int y, double real, double imaginary) {
        data[y][2*x] = real;
        data[y][2*x+1] = imaginary;
    }

    public void multiply(int x, int y, double factor) {
        data[y][2*x] *= factor;
        data[y][2*x+1] *= factor;
    }

    public ImageDouble getRealPart() {
        ImageDouble res = new ImageDouble(name+"_re", this);
        double[] pix = res.getPixelArray();
        for (int y = 0; y<sizeY; ++y) {
            int off = y * sizeX;
            for (int x = 0; x<sizeX; ++x) pix[off+x] = data[y][2*x];
        }
        return res;
    }

    public double getMaxAbsImaginary() {
        double max = 0;
        for (double[] row : data) {
            for (int x = 1; x<row.length; x+=2) {
                double a = Math.abs(row[x]);
                if (a>max) max = a;
            }
        }
        return max;
    }

    @Override
    public ImageComplex duplicate(String name) {
        double[][] newData = new double[sizeY][];
        for (int y = 0; y<sizeY; ++y) newData[y] = data[y].clone();
        return new ImageComplex(name, newData).setCalibration(this);
    }

    /**
     * @return backing array, not a copy
     */
    public double[][] getPixelArray() {
        return data;
    }
}
