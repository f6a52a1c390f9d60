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
package stimnoise.plugins;

import stimnoise.configuration.parameters.Parameter;
import stimnoise.utils.ConfigurationException;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 *
 * Configurable processing unit
 */
public interface Plugin {
    Parameter[] getParameters();

    /**
     * @return parameter named {@param name} or null if there is none
     */
    default Parameter getParameter(String name) {
        return Arrays.stream(getParameters()).filter(p -> p.getName().equals(name)).findFirst().orElse(null);
    }

    /**
     * @return one line per parameter: name and hint
     */
    default String getParameterSummary() {
        return Arrays.stream(getParameters()).map(p -> p.getHintText()==null ? p.getName() : p.getName()+": "+p.getHintText()).collect(Collectors.joining("\n"));
    }

    /**
     * @throws ConfigurationException naming the first invalid parameter
     */
    default void checkParameters() {
        for (Parameter p : getParameters()) p.checkValid();
    }
}
