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

import ij.ImagePlus;
import org.json.simple.JSONObject;
import stimnoise.image.ImageDouble;
import stimnoise.image.wrappers.IJImageWrapper;
import stimnoise.processing.ImageOperations;
import stimnoise.processing.spectral.SamplingGrid;
import stimnoise.utils.JSONUtils;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Realized noise with the metadata needed to reproduce and describe it: grid, kind, effective parameters, requested adaptation and achieved statistics.
 * Immutable: pixels are copied in and out.
 */
public class NoiseImage {
    final ImageDouble image;
    final SamplingGrid grid;
    final NoiseKind kind;
    final Map<String, Object> parameters;
    final ContrastAdaptation adaptation;
    final double[] minAndMax;
    final double[] meanSigma;

    public NoiseImage(ImageDouble image, SamplingGrid grid, NoiseKind kind, Map<String, Object> parameters, ContrastAdaptation adaptation) {
        if (!grid.sameShape(image)) throw new IllegalArgumentException("image "+image+" does not match grid "+grid);
        this.image = image.duplicate();
        this.grid = grid;
        this.kind = kind;
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        this.adaptation = adaptation;
        this.minAndMax = this.image.getMinAndMax();
        this.meanSigma = ImageOperations.getMeanAndSigma(this.image);
    }

    /**
     * @return copy of the pixels
     */
    public ImageDouble getImage() {
        return image.duplicate();
    }

    public double getPixel(int x, int y) {
        return image.getPixel(x, y);
    }

    public int getHeight() {
        return image.sizeY();
    }

    public int getWidth() {
        return image.sizeX();
    }

    public SamplingGrid getGrid() {
        return grid;
    }

    public NoiseKind getKind() {
        return kind;
    }

    /**
     * @return effective parameters, including derived ones such as {@code sigma} of narrowband noise
     */
    public Map<String, Object> getParameters() {
        return parameters;
    }

    public ContrastAdaptation getAdaptation() {
        return adaptation;
    }

    public double getMin() {
        return minAndMax[0];
    }

    public double getMax() {
        return minAndMax[1];
    }

    /**
     * @return achieved {min, max}
     */
    public double[] getIntensityRange() {
        return new double[]{minAndMax[0], minAndMax[1]};
    }

    public double getMean() {
        return meanSigma[0];
    }

    /**
     * @return achieved RMS contrast: population standard deviation of intensities
     */
    public double getRmsContrast() {
        return meanSigma[1];
    }

    /**
     * @return 32-bit ImageJ copy, calibrated in unit length per pixel
     */
    public ImagePlus getImagePlus() {
        return IJImageWrapper.getImagePlus(image);
    }

    public JSONObject getMetadata() {
        JSONObject res = new JSONObject();
        res.put("kind", kind.getTag());
        res.put("description", kind.getHintText());
        res.putAll((JSONObject)grid.toJSONEntry());
        res.put("parameters", JSONUtils.toJSONObject(parameters));
        if (adaptation!=null) res.put("adaptation", adaptation.toJSONEntry());
        JSONObject achieved = new JSONObject();
        achieved.put("intensity_range", JSONUtils.toJSONArray(getIntensityRange()));
        achieved.put("mean", getMean());
        achieved.put("rms_contrast", getRmsContrast());
        res.put("achieved", achieved);
        return res;
    }

    @Override
    public String toString() {
        return kind.getTag()+" noise "+grid+" "+parameters+" range: ["+getMin()+"; "+getMax()+"] rms contrast: "+getRmsContrast();
    }
}
