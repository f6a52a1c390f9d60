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
 * 2D raster geometry: size in samples and physical length of one sample along each axis
 */
public interface ImageProperties<T extends ImageProperties<T>> {
    public String getName();
    public int sizeX();
    public int sizeY();
    public int sizeXY();
    public double getScaleX();
    public double getScaleY();
    public T setCalibration(ImageProperties properties);
    public T setCalibration(double scaleX, double scaleY);
    public boolean sameDimensions(ImageProperties image);
}
