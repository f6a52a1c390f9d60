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

import stimnoise.utils.ConfigurationException;

/**
 *
 * @author STIMNOISE authors
 */
public class BooleanParameter extends ParameterImpl<BooleanParameter> {
    boolean selected;

    public BooleanParameter(String name) {
        this(name, false);
    }

    public BooleanParameter(String name, boolean defaultValue) {
        super(name);
        this.selected = defaultValue;
    }

    public boolean getSelected() {
        return selected;
    }

    public BooleanParameter setSelected(boolean selected){
        this.selected = selected;
        return this;
    }

    public Boolean getValue() {
        return getSelected();
    }

    @Override public BooleanParameter duplicate() {
        return transferProperties(new BooleanParameter(name, selected));
    }

    @Override
    public Object toJSONEntry() {
        return selected;
    }

    @Override
    public void initFromJSONEntry(Object json) {
        if (json instanceof Boolean) selected = (Boolean)json;
        else if ("true".equals(json) || "false".equals(json)) selected = "true".equals(json);
        else throw new ConfigurationException(name+" should be a boolean (found: "+json+")");
    }

    @Override
    public String toString() {
        return name+": "+selected;
    }
}
