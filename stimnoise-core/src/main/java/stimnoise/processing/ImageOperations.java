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
package stimnoise.processing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import stimnoise.image.ImageDouble;
import stimnoise.utils.ArrayUtil;
import stimnoise.utils.ConfigurationException;
import stimnoise.utils.NumericDegeneracyException;

/**
 *
 * Intensity statistics and contrast adaptation. Adaptations never modify their input.
 */
public class ImageOperations {
    public final static Logger logger = LoggerFactory.getLogger(ImageOperations.class);

    /**
     * @return {mean, sigma} where sigma is the population standard deviation
     */
    public static double[] getMeanAndSigma(ImageDouble image) {
        double[] pix = image.getPixelArray();
        return ArrayUtil.meanSigma(pix, 0, pix.length, null);
    }

    public static double[] getMinAndMax(ImageDouble image) {
        return image.getMinAndMax();
    }

    /**
     * @return {@code output = source * multiplicativeCoefficient + additiveCoefficient}
     */
    public static ImageDouble affineOperation(ImageDouble source, ImageDouble output, double multiplicativeCoefficient, double additiveCoefficient) {
        if (output==null) output = new ImageDouble(source.getName(), source);
        else if (!output.sameDimensions(source)) throw new IllegalArgumentException("source and output should have same dimensions");
        double[] s = source.getPixelArray();
        double[] o = output.getPixelArray();
        for (int i = 0; i<s.length; ++i) o[i] = s[i] * multiplicativeCoefficient + additiveCoefficient;
        return output;
    }

    /**
     * Elementwise weighted sum, e.g. to lay a noise mask over a stimulus
     */
    public static ImageDouble addImage(ImageDouble source1, ImageDouble source2, ImageDouble output, double coeff) {
        if (!source1.sameDimensions(source2)) throw new IllegalArgumentException("sources should have same dimensions");
        if (output==null) output = new ImageDouble(source1.getName()+" + "+source2.getName(), source1);
        double[] s1 = source1.getPixelArray();
        double[] s2 = source2.getPixelArray();
        double[] o = output.getPixelArray();
        for (int i = 0; i<s1.length; ++i) o[i] = s1[i] + coeff * s2[i];
        return output;
    }

    private static double[] checkNotConstant(ImageDouble image, String mode) {
        double[] minAndMax = image.getMinAndMax();
        if (!(minAndMax[1] > minAndMax[0])) throw new NumericDegeneracyException(mode+" adaptation requires an image with non-zero variance (all pixels equal to "+minAndMax[0]+")");
        return minAndMax;
    }

    /**
     * Affine rescale so that {@code min -> intensityMin} and {@code max -> intensityMax}
     * @throws NumericDegeneracyException if all pixels are equal
     */
    public static ImageDouble adaptIntensityRange(ImageDouble image, double intensityMin, double intensityMax) {
        ConfigurationException.check(intensityMin<=intensityMax, "intensity_range should be ordered (min=%s, max=%s)", intensityMin, intensityMax);
        double[] minAndMax = checkNotConstant(image, "intensity range");
        double range = minAndMax[1] - minAndMax[0];
        double[] s = image.getPixelArray();
        ImageDouble res = new ImageDouble(image.getName(), image);
        double[] o = res.getPixelArray();
        for (int i = 0; i<s.length; ++i) o[i] = (s[i] - minAndMax[0]) / range * (intensityMax - intensityMin) + intensityMin;
        return res;
    }

    /**
     * Sets the standard deviation to {@param rmsContrast}: {@code (image - mean) / std * rmsContrast + meanLuminance}
     * @param meanLuminance target mean, if null the mean of {@param image} is kept
     * @throws NumericDegeneracyException if all pixels are equal
     */
    public static ImageDouble adaptRmsContrast(ImageDouble image, double rmsContrast, Double meanLuminance) {
        ConfigurationException.check(rmsContrast>=0 && Double.isFinite(rmsContrast), "rms_contrast should be positive (rms_contrast=%s)", rmsContrast);
        checkNotConstant(image, "RMS contrast");
        double[] meanSigma = getMeanAndSigma(image);
        double mean = meanLuminance==null ? meanSigma[0] : meanLuminance;
        logger.debug("adapt rms contrast: mean {} -> {}, std {} -> {}", meanSigma[0], mean, meanSigma[1], rmsContrast);
        return affineOperation(image, null, rmsContrast / meanSigma[1], mean - meanSigma[0] * rmsContrast / meanSigma[1]);
    }

    /**
     * RMS contrast normalized by mean luminance: {@code (image - mean) / std * rmsContrast * meanLuminance + meanLuminance}.
     * The scale is signed, so a negative {@param meanLuminance} inverts the image; the standard deviation becomes {@code rmsContrast * |meanLuminance|}
     * @param meanLuminance target mean, if null the mean of {@param image} is kept
     * @throws NumericDegeneracyException if all pixels are equal
     */
    public static ImageDouble adaptNormalizedRmsContrast(ImageDouble image, double rmsContrast, Double meanLuminance) {
        ConfigurationException.check(rmsContrast>=0 && Double.isFinite(rmsContrast), "normalized_rms_contrast should be positive (normalized_rms_contrast=%s)", rmsContrast);
        checkNotConstant(image, "normalized RMS contrast");
        double[] meanSigma = getMeanAndSigma(image);
        double mean = meanLuminance==null ? meanSigma[0] : meanLuminance;
        double scale = rmsContrast * mean / meanSigma[1];
        return affineOperation(image, null, scale, mean - meanSigma[0] * scale);
    }

    /**
     * Michelson contrast {@code (max - min) / (max + min)} around {@param meanLuminance}: the image is rescaled to
     * {@code [mean * (1 - michelsonContrast), mean * (1 + michelsonContrast)]}
     * @param meanLuminance center of the range, if null the mean of {@param image} is used
     * @throws NumericDegeneracyException if all pixels are equal
     */
    public static ImageDouble adaptMichelsonContrast(ImageDouble image, double michelsonContrast, Double meanLuminance) {
        ConfigurationException.check(michelsonContrast>=0 && Double.isFinite(michelsonContrast), "michelson_contrast should be positive (michelson_contrast=%s)", michelsonContrast);
        checkNotConstant(image, "Michelson contrast");
        double mean = meanLuminance==null ? getMeanAndSigma(image)[0] : meanLuminance;
        return adaptIntensityRange(image, mean - michelsonContrast * mean, mean + michelsonContrast * mean);
    }

    public static double getMichelsonContrast(ImageDouble image) {
        double[] minAndMax = image.getMinAndMax();
        return (minAndMax[1] - minAndMax[0]) / (minAndMax[1] + minAndMax[0]);
    }
}
