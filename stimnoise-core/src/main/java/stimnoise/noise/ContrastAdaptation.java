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
package stimnoise.noise;

import org.json.simple.JSONObject;
import stimnoise.image.ImageDouble;
import stimnoise.processing.ImageOperations;
import stimnoise.utils.ConfigurationException;
import stimnoise.utils.JSONSerializable;
import stimnoise.utils.JSONUtils;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Target statistics of a realized noise. Targets are checked when the adaptation is created, so that an invalid request fails before any synthesis.
 */
public class ContrastAdaptation implements JSONSerializable {
    public enum Mode {
        NONE(null),
        INTENSITY_RANGE("intensity_range"),
        RMS_CONTRAST("rms_contrast"),
        NORMALIZED_RMS_CONTRAST("normalized_rms_contrast"),
        MICHELSON_CONTRAST("michelson_contrast");
        public final String key;
        Mode(String key) {
            this.key = key;
        }
    }
    public final static String MEAN_LUMINANCE = "mean_luminance";

    private Mode mode;
    private double min, max, contrast;
    private Double meanLuminance;

    private ContrastAdaptation() {}

    private ContrastAdaptation(Mode mode, double min, double max, double contrast, Double meanLuminance) {
        this.mode = mode;
        this.min = min;
        this.max = max;
        this.contrast = contrast;
        this.meanLuminance = meanLuminance;
        check();
    }

    private void check() {
        switch (mode) {
            case INTENSITY_RANGE:
                ConfigurationException.check(Double.isFinite(min) && Double.isFinite(max), "intensity_range should be finite (min=%s, max=%s)", min, max);
                ConfigurationException.check(min<=max, "intensity_range should be ordered (min=%s, max=%s)", min, max);
                break;
            case NONE:
                break;
            default:
                ConfigurationException.check(contrast>=0 && Double.isFinite(contrast), "%s should be positive and finite (%s=%s)", mode.key, mode.key, contrast);
                ConfigurationException.check(meanLuminance==null || Double.isFinite(meanLuminance), "mean_luminance should be finite (mean_luminance=%s)", meanLuminance);
        }
    }

    public static ContrastAdaptation none() {
        return new ContrastAdaptation(Mode.NONE, Double.NaN, Double.NaN, Double.NaN, null);
    }

    public static ContrastAdaptation intensityRange(double min, double max) {
        return new ContrastAdaptation(Mode.INTENSITY_RANGE, min, max, Double.NaN, null);
    }

    /**
     * @param meanLuminance target mean, null keeps the mean of the realized noise
     */
    public static ContrastAdaptation rmsContrast(double rmsContrast, Double meanLuminance) {
        return new ContrastAdaptation(Mode.RMS_CONTRAST, Double.NaN, Double.NaN, rmsContrast, meanLuminance);
    }

    public static ContrastAdaptation normalizedRmsContrast(double rmsContrast, Double meanLuminance) {
        return new ContrastAdaptation(Mode.NORMALIZED_RMS_CONTRAST, Double.NaN, Double.NaN, rmsContrast, meanLuminance);
    }

    public static ContrastAdaptation michelsonContrast(double michelsonContrast, Double meanLuminance) {
        return new ContrastAdaptation(Mode.MICHELSON_CONTRAST, Double.NaN, Double.NaN, michelsonContrast, meanLuminance);
    }

    public Mode getMode() {
        return mode;
    }

    public double[] getIntensityRange() {
        return new double[]{min, max};
    }

    public double getContrast() {
        return contrast;
    }

    public Double getMeanLuminance() {
        return meanLuminance;
    }

    /**
     * @return new adapted image, {@param image} is not modified
     * @throws stimnoise.utils.NumericDegeneracyException if {@param image} is constant and the mode divides by its spread
     */
    public ImageDouble apply(ImageDouble image) {
        switch (mode) {
            case INTENSITY_RANGE:
                return ImageOperations.adaptIntensityRange(image, min, max);
            case RMS_CONTRAST:
                return ImageOperations.adaptRmsContrast(image, contrast, meanLuminance);
            case NORMALIZED_RMS_CONTRAST:
                return ImageOperations.adaptNormalizedRmsContrast(image, contrast, meanLuminance);
            case MICHELSON_CONTRAST:
                return ImageOperations.adaptMichelsonContrast(image, contrast, meanLuminance);
            case NONE:
            default:
                return image.duplicate();
        }
    }

    @Override
    public JSONObject toJSONEntry() {
        JSONObject res = new JSONObject();
        switch (mode) {
            case NONE:
                break;
            case INTENSITY_RANGE:
                res.put(mode.key, JSONUtils.toJSONArray(new double[]{min, max}));
                break;
            default:
                res.put(mode.key, contrast);
                if (meanLuminance!=null) res.put(MEAN_LUMINANCE, meanLuminance);
        }
        return res;
    }

    /**
     * Reads the adaptation keys of {@param jsonEntry}, other keys are ignored. An entry without adaptation key is {@link Mode#NONE}
     */
    @Override
    public void initFromJSONEntry(Object jsonEntry) {
        if (!(jsonEntry instanceof Map)) throw new ConfigurationException("adaptation should be a JSON object");
        Map json = (Map)jsonEntry;
        mode = Mode.NONE;
        min = Double.NaN;
        max = Double.NaN;
        contrast = Double.NaN;
        meanLuminance = null;
        for (Mode m : Mode.values()) {
            if (m.key==null || !json.containsKey(m.key)) continue;
            if (mode!=Mode.NONE) throw new ConfigurationException("only one of intensity_range, rms_contrast, normalized_rms_contrast and michelson_contrast can be set (found "+mode.key+" and "+m.key+")");
            mode = m;
            Object value = json.get(m.key);
            if (m==Mode.INTENSITY_RANGE) {
                if (!(value instanceof List) || ((List)value).size()!=2) throw new ConfigurationException("intensity_range should be a pair of numbers (found: "+value+")");
                double[] range = JSONUtils.fromDoubleArray((List)value, m.key);
                min = range[0];
                max = range[1];
            } else {
                if (!(value instanceof Number)) throw new ConfigurationException(m.key+" should be a number (found: "+value+")");
                contrast = ((Number)value).doubleValue();
            }
        }
        Object mean = json.get(MEAN_LUMINANCE);
        if (mean!=null) {
            if (mode==Mode.NONE || mode==Mode.INTENSITY_RANGE) throw new ConfigurationException("mean_luminance requires a contrast adaptation (rms_contrast, normalized_rms_contrast or michelson_contrast)");
            if (!(mean instanceof Number)) throw new ConfigurationException("mean_luminance should be a number (found: "+mean+")");
            meanLuminance = ((Number)mean).doubleValue();
        }
        check();
    }

    public static ContrastAdaptation fromJSONEntry(Object jsonEntry) {
        ContrastAdaptation res = new ContrastAdaptation();
        res.initFromJSONEntry(jsonEntry);
        return res;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ContrastAdaptation)) return false;
        ContrastAdaptation that = (ContrastAdaptation) o;
        return mode == that.mode && Double.compare(that.min, min) == 0 && Double.compare(that.max, max) == 0 && Double.compare(that.contrast, contrast) == 0 && Objects.equals(meanLuminance, that.meanLuminance);
    }

    @Override
    public int hashCode() {
        return Objects.hash(mode, min, max, contrast, meanLuminance);
    }

    @Override
    public String toString() {
        switch (mode) {
            case NONE:
                return "no adaptation";
            case INTENSITY_RANGE:
                return "intensity_range=["+min+"; "+max+"]";
            default:
                return mode.key+"="+contrast+(meanLuminance==null ? "" : ", mean_luminance="+meanLuminance);
        }
    }
}
