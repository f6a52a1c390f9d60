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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 *
 * Named 2D raster. Pixels are stored row-major: index {@code xy = x + y * sizeX}
 */
public abstract class Image<I extends Image<I>> extends SimpleImageProperties<I> {
    public final static Logger logger = LoggerFactory.getLogger(Image.class);

    protected Image(String name, int sizeX, int sizeY) {
        super(name, sizeX, sizeY, 1, 1);
    }

    protected Image(String name, ImageProperties properties) {
        super(properties);
        this.name = name;
    }

    public I setName(String name) {
        this.name=name;
        return (I)this;
    }

    public abstract I duplicate(String name);
    public I duplicate() {
        return duplicate(name);
    }
}
