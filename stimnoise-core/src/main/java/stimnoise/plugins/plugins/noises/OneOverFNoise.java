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
package stimnoise.plugins.plugins.noises;

import stimnoise.configuration.parameters.BoundedNumberParameter;
import stimnoise.configuration.parameters.Parameter;
import stimnoise.image.ImageDouble;
import stimnoise.noise.NoiseKind;
import stimnoise.plugins.SpectralNoise;
import stimnoise.processing.spectral.FrequencyFilters;
import stimnoise.processing.spectral.SamplingGrid;

import java.util.Map;

/**
 *
 * Power-law noise: white spectrum filtered by {@code 1 / f^exponent}. Pink and brown noise have a fixed exponent, that cannot be modified
 */
public class OneOverFNoise extends SpectralNoise {
    public final static double PINK_EXPONENT = 1.0;
    public final static double BROWN_EXPONENT = 2.0;
    final NoiseKind kind;
    BoundedNumberParameter exponent = new BoundedNumberParameter("exponent", 3, null).setStrictlyPositive().setHint("Exponent of the radial power law applied to amplitudes: 1 is pink noise, 2 is brown noise");
    Parameter[] parameters = new Parameter[]{exponent};

    public OneOverFNoise() {
        this.kind = NoiseKind.ONE_OVER_F;
    }

    public OneOverFNoise(double exponent) {
        this();
        this.exponent.setValue(exponent);
    }

    private OneOverFNoise(NoiseKind kind, double exponent) {
        this.kind = kind;
        this.exponent.setValue(exponent);
        this.exponent.addValidationFunction(e -> e.getValue()!=null && e.getValue().doubleValue()==exponent);
        this.parameters = new Parameter[0];
    }

    public static OneOverFNoise pink() {
        return new OneOverFNoise(NoiseKind.PINK, PINK_EXPONENT);
    }

    public static OneOverFNoise brown() {
        return new OneOverFNoise(NoiseKind.BROWN, BROWN_EXPONENT);
    }

    public OneOverFNoise setExponent(double exponent) {
        if (kind!=NoiseKind.ONE_OVER_F) throw new UnsupportedOperationException("exponent of "+kind.getTag()+" noise is fixed");
        this.exponent.setValue(exponent);
        return this;
    }

    public double getExponent() {
        return exponent.getDoubleValue();
    }

    @Override
    public NoiseKind getKind() {
        return kind;
    }

    @Override
    public void checkParameters() {
        super.checkParameters();
        exponent.checkValid();
    }

    @Override
    protected ImageDouble getFilter(SamplingGrid grid) {
        return FrequencyFilters.powerLaw(grid, exponent.getDoubleValue());
    }

    @Override
    protected Parameter[] getFilterParameters() {
        return parameters;
    }

    @Override
    public Map<String, Object> getEffectiveParameters(SamplingGrid grid) {
        Map<String, Object> res = super.getEffectiveParameters(grid);
        if (kind!=NoiseKind.ONE_OVER_F) res.put(exponent.getName(), exponent.getValue());
        return res;
    }

    @Override
    public String getHintText() {
        switch (kind) {
            case PINK:
                return "Pink noise: 1/f amplitude spectrum";
            case BROWN:
                return "Brown noise: 1/f^2 amplitude spectrum";
            default:
                return "1/f^exponent noise";
        }
    }
}
