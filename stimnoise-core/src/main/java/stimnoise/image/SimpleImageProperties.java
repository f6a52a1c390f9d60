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
 *
 * Holder for the geometry of a raster. Scales are in unit length per sample (i.e. inverse of the sampling rate)
 */
public class SimpleImageProperties<T extends SimpleImageProperties<T>> implements ImageProperties<T> {
    protected double scaleX, scaleY;
    protected int sizeX, sizeY, sizeXY;
    protected String name;
    public SimpleImageProperties(ImageProperties properties) {
        this(properties.getName(), properties.sizeX(), properties.sizeY(), properties.getScaleX(), properties.getScaleY());
    }
    public SimpleImageProperties(String name, int sizeX, int sizeY, double scaleX, double scaleY) {
        if (sizeX<0 || sizeY<0) throw new IllegalArgumentException("Image size should be positive (sizeX="+sizeX+", sizeY="+sizeY+")");
        this.name = name==null ? "" : name;
        this.sizeX = sizeX;
        this.sizeY = sizeY;
        this.sizeXY = sizeX * sizeY;
        this.scaleX = scaleX;
        this.scaleY = scaleY;
    }
    public SimpleImageProperties(int sizeX, int sizeY) {
        this("", sizeX, sizeY, 1, 1);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public int sizeX() {
        return sizeX;
    }

    @Override
    public int sizeY() {
        return sizeY;
    }

    @Override
    public int sizeXY() {
        return sizeXY;
    }

    @Override
    public double getScaleX() {
        return scaleX;
    }

    @Override
    public double getScaleY() {
        return scaleY;
    }

    @Override
    public T setCalibration(ImageProperties properties) {
        this.scaleX = properties.getScaleX();
        this.scaleY = properties.getScaleY();
        return (T)this;
    }

    @Override
    public T setCalibration(double scaleX, double scaleY) {
        this.scaleX = scaleX;
        this.scaleY = scaleY;
        return (T)this;
    }

    @Override
    public boolean sameDimensions(ImageProperties image) {
        return sizeX == image.sizeX() && sizeY == image.sizeY();
    }

    @Override
    public String toString() {
        return name+" ["+sizeX+"x"+sizeY+"]";
    }
}
