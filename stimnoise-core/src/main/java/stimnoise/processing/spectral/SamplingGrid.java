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
package stimnoise.processing.spectral;

import stimnoise.image.ImageDouble;
import stimnoise.image.ImageProperties;
import stimnoise.image.SimpleImageProperties;
import stimnoise.utils.ConfigurationException;
import stimnoise.utils.JSONSerializable;
import stimnoise.utils.JSONUtils;
import org.json.simple.JSONObject;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Resolved raster geometry: shape in samples and sampling rate (samples per unit length, e.g. pixels per degree) along each axis.
 * Immutable once built. Frequency axes are in cycles per unit length (e.g. cpd), in centered order: index {@code i} maps to frequency {@code (i - n/2) * rate / n}.
 */
public class SamplingGrid implements JSONSerializable {
    private int height, width;
    private double rateY, rateX;

    public SamplingGrid(int height, int width, double rateY, double rateX) {
        this.height = height;
        this.width = width;
        this.rateY = rateY;
        this.rateX = rateX;
        check();
    }

    public static SamplingGrid of(int height, int width, double rate) {
        return new SamplingGrid(height, width, rate, rate);
    }

    public static SamplingGrid fromJSONEntry(Object jsonEntry) {
        SamplingGrid res = new SamplingGrid();
        res.initFromJSONEntry(jsonEntry);
        return res;
    }

    private SamplingGrid() {}

    private void check() {
        ConfigurationException.check(height>0 && width>0, "shape should be positive (height=%d, width=%d)", height, width);
        ConfigurationException.check(rateY>0 && rateX>0 && Double.isFinite(rateY) && Double.isFinite(rateX), "sampling_rate should be positive and finite (rate_y=%s, rate_x=%s)", rateY, rateX);
    }

    public int getHeight() {
        return height;
    }

    public int getWidth() {
        return width;
    }

    public double getRateY() {
        return rateY;
    }

    public double getRateX() {
        return rateX;
    }

    /**
     * @return the common sampling rate
     * @throws ConfigurationException if the rate differs between axes
     */
    public double getRate() {
        checkIsotropic();
        return rateY;
    }

    public boolean isIsotropic() {
        return rateY == rateX;
    }

    public boolean isEven() {
        return height % 2 == 0 && width % 2 == 0;
    }

    public void checkIsotropic() {
        if (!isIsotropic()) throw new ConfigurationException("sampling_rate should be equal in x and y direction (rate_y="+rateY+", rate_x="+rateX+")");
    }

    /**
     * Preconditions of every spectral-path synthesis. Checked before any array allocation.
     * @throws ConfigurationException if the sampling rate is anisotropic or the shape is not even-numbered
     */
    public void checkSpectralPath() {
        checkIsotropic();
        if (!isEven()) throw new ConfigurationException("shape needs to be even-numbered (height="+height+", width="+width+")");
    }

    /**
     * @return physical size along each axis {height / rateY, width / rateX}
     */
    public double[] getVisualSize() {
        return new double[]{height / rateY, width / rateX};
    }

    public double getFrequencyResolutionY() {
        return rateY / height;
    }

    public double getFrequencyResolutionX() {
        return rateX / width;
    }

    public double getNyquistFrequency() {
        return Math.min(rateY, rateX) / 2;
    }

    public static double[] frequencyAxis(int n, double rate) {
        double[] res = new double[n];
        int half = n / 2;
        for (int i = 0; i<n; ++i) res[i] = (i - half) * rate / n;
        return res;
    }

    public double[] getFrequencyAxisY() {
        return frequencyAxis(height, rateY);
    }

    public double[] getFrequencyAxisX() {
        return frequencyAxis(width, rateX);
    }

    /**
     * @return radial frequency {@code sqrt(fx^2+fy^2)} of every bin, centered layout
     */
    public ImageDouble getRadialFrequency() {
        double[] fy = getFrequencyAxisY();
        double[] fx = getFrequencyAxisX();
        ImageDouble res = new ImageDouble("radial frequency", getFrequencyProperties());
        for (int y = 0; y<height; ++y) {
            for (int x = 0; x<width; ++x) res.setPixel(x, y, Math.sqrt(fx[x]*fx[x] + fy[y]*fy[y]));
        }
        return res;
    }

    /**
     * @return properties of a frequency-domain raster: same shape, scale = frequency resolution
     */
    public ImageProperties getFrequencyProperties() {
        return new SimpleImageProperties("", width, height, getFrequencyResolutionX(), getFrequencyResolutionY());
    }

    /**
     * @return properties of a spatial raster: same shape, scale = 1 / rate
     */
    public ImageProperties getSpatialProperties() {
        return new SimpleImageProperties("", width, height, 1/rateX, 1/rateY);
    }

    public boolean sameShape(ImageProperties image) {
        return image.sizeX() == width && image.sizeY() == height;
    }

    @Override
    public Object toJSONEntry() {
        JSONObject res = new JSONObject();
        res.put("shape", JSONUtils.toJSONArray(new int[]{height, width}));
        if (isIsotropic()) res.put("sampling_rate", rateY);
        else res.put("sampling_rate", JSONUtils.toJSONArray(new double[]{rateY, rateX}));
        return res;
    }

    @Override
    public void initFromJSONEntry(Object jsonEntry) {
        if (!(jsonEntry instanceof JSONObject)) throw new ConfigurationException("sampling grid should be a JSON object");
        JSONObject json = (JSONObject)jsonEntry;
        Object shape = json.get("shape");
        if (shape instanceof Number) {
            height = JSONUtils.fromIntArray(Collections.singletonList(shape), "shape")[0];
            width = height;
        } else if (shape instanceof List && ((List)shape).size()==2) {
            int[] s = JSONUtils.fromIntArray((List)shape, "shape");
            height = s[0];
            width = s[1];
        } else throw new ConfigurationException("shape is missing or is not a number or a pair of numbers");
        Object rate = json.get("sampling_rate");
        if (rate instanceof Number) {
            rateY = ((Number)rate).doubleValue();
            rateX = rateY;
        } else if (rate instanceof List && ((List)rate).size()==2) {
            double[] r = JSONUtils.fromDoubleArray((List)rate, "sampling_rate");
            rateY = r[0];
            rateX = r[1];
        } else throw new ConfigurationException("sampling_rate is missing or is not a number or a pair of numbers");
        check();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SamplingGrid)) return false;
        SamplingGrid that = (SamplingGrid) o;
        return height == that.height && width == that.width && Double.compare(that.rateY, rateY) == 0 && Double.compare(that.rateX, rateX) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(height, width, rateY, rateX);
    }

    @Override
    public String toString() {
        return "SamplingGrid{shape=("+height+", "+width+"), rate=("+rateY+", "+rateX+")}";
    }
}
