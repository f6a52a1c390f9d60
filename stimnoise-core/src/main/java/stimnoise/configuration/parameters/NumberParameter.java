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

import java.text.DecimalFormat;
import java.text.NumberFormat;
import java.util.Locale;

/**
 *
 * Numeric parameter. A parameter without default value is required: it is invalid until set.
 */
public class NumberParameter<P extends NumberParameter<P>> extends ParameterImpl<P> {
    Number value;
    int decimalPlaces;

    public NumberParameter(String name, int decimalPlaces) {
        super(name);
        this.decimalPlaces=decimalPlaces;
    }

    public NumberParameter(String name, int decimalPlaces, Number defaultValue) {
        this(name, decimalPlaces);
        this.value=defaultValue;
    }

    public Number getValue() {
        return value;
    }

    public double getDoubleValue() {return checkValid().value.doubleValue();}

    public P setValue(Number value) {
        this.value=value;
        return (P)this;
    }

    @Override
    public boolean isValid() {
        if (value==null || Double.isNaN(value.doubleValue())) return false;
        return super.isValid();
    }

    @Override
    protected String getInvalidityMessage() {
        if (value==null) return name+" is required";
        return super.getInvalidityMessage();
    }

    @Override
    public String toString() {
        return name+": "+ (value==null? "":trimDecimalPlaces(value, decimalPlaces));
    }

    @Override public P duplicate() {
        NumberParameter res = new NumberParameter(name, decimalPlaces, value);
        return (P)transferProperties(res);
    }

    @Override
    public Object toJSONEntry() {
        return value;
    }

    @Override
    public void initFromJSONEntry(Object jsonEntry) {
        if (jsonEntry instanceof Number) this.value=(Number)jsonEntry;
        else throw new ConfigurationException(name+" should be a number (found: "+jsonEntry+")");
    }

    public static String trimDecimalPlaces(Number n, int digits) {
        DecimalFormat df = (DecimalFormat)NumberFormat.getInstance(Locale.US);
        df.setMaximumFractionDigits(digits);
        return df.format(n);
    }
}
