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

/**
 *
 * Numeric parameter with optional bounds. Bounds are inclusive unless set exclusive; out-of-bounds values are kept and reported by {@link #checkValid()}
 */
public class BoundedNumberParameter extends NumberParameter<BoundedNumberParameter> {
    Number lowerBound, upperBound;
    boolean lowerBoundExclusive, upperBoundExclusive;

    public BoundedNumberParameter(String name, int decimalPlaces, Number defaultValue) {
        this(name, decimalPlaces, defaultValue, null, null);
    }

    public BoundedNumberParameter(String name, int decimalPlaces, Number defaultValue, Number lowerBound, Number upperBound) {
        super(name, decimalPlaces, defaultValue);
        this.lowerBound=lowerBound;
        this.upperBound=upperBound;
    }

    public Number getLowerBound() {
        return lowerBound;
    }

    public Number getUpperBound() {
        return upperBound;
    }

    public BoundedNumberParameter setLowerBound(Number lowerBound, boolean exclusive) {
        this.lowerBound = lowerBound;
        this.lowerBoundExclusive = exclusive;
        return this;
    }

    public BoundedNumberParameter setUpperBound(Number upperBound, boolean exclusive) {
        this.upperBound = upperBound;
        this.upperBoundExclusive = exclusive;
        return this;
    }

    /**
     * lower bound 0, exclusive
     */
    public BoundedNumberParameter setStrictlyPositive() {
        return setLowerBound(0, true);
    }

    @Override
    public boolean isValid() {
        if (!super.isValid()) return false;
        double v = value.doubleValue();
        if (Double.isInfinite(v)) return false;
        if (lowerBound!=null && (lowerBoundExclusive ? v<=lowerBound.doubleValue() : v<lowerBound.doubleValue())) return false;
        if (upperBound!=null && (upperBoundExclusive ? v>=upperBound.doubleValue() : v>upperBound.doubleValue())) return false;
        return true;
    }

    @Override
    protected String getInvalidityMessage() {
        if (value==null) return super.getInvalidityMessage();
        return name+" should be in "+(lowerBound==null||lowerBoundExclusive?"]":"[")+(lowerBound==null?"-inf":lowerBound)+"; "+(upperBound==null?"+inf":upperBound)+(upperBound==null||upperBoundExclusive?"[":"]")+" ("+name+"="+value+")";
    }

    @Override public BoundedNumberParameter duplicate() {
        BoundedNumberParameter res = new BoundedNumberParameter(name, decimalPlaces, value, lowerBound, upperBound);
        res.lowerBoundExclusive = lowerBoundExclusive;
        res.upperBoundExclusive = upperBoundExclusive;
        return transferProperties(res);
    }
}
