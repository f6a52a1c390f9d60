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
package stimnoise.configuration.parameters;

import stimnoise.utils.JSONSerializable;

import java.util.function.Predicate;

/**
 *
 * Named, typed and validated value of a generator. The JSON entry of a parameter is its value only, the name is the key of the enclosing document.
 */
public interface Parameter<P extends Parameter<P>> extends JSONSerializable {
    String getName();
    String getHintText();
    P setHint(String hint);
    boolean isValid();
    P addValidationFunction(Predicate<P> validationFunction);
    /**
     * @return this parameter
     * @throws stimnoise.utils.ConfigurationException naming the parameter if {@link #isValid()} is false
     */
    P checkValid();
    P duplicate();
}
