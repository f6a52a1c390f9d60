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
package stimnoise.utils;

/**
 *
 * Array helpers shared by image statistics and spectrum analysis
 */
public class ArrayUtil {

    public static int max(double[] array) {
        return max(array, 0, array.length);
    }
    public static int max(double[] array, int start, int stop) {
        if (start<0) start=0;
        if (stop>array.length) stop=array.length;
        int idxMax = start;
        for (int i = start+1; i<stop; ++i) if (array[i]>array[idxMax]) idxMax=i;
        return idxMax;
    }

    /**
     * @return {min, max} of {@param array}
     */
    public static double[] minAndMax(double[] array) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double v : array) {
            if (v<min) min = v;
            if (v>max) max = v;
        }
        return new double[]{min, max};
    }

    public static double mean(double[] array, int start, int stop) {
        double sum = 0;
        for (int i = start; i<stop; ++i) sum+=array[i];
        return sum / (stop - start);
    }

    /**
     * Two-pass mean and population standard deviation (numpy's default {@code std}, ddof = 0)
     * @param res output array of length 2 or null
     * @return {mean, sigma}
     */
    public static double[] meanSigma(double[] array, int start, int stop, double[] res) {
        if (res==null) res = new double[2];
        double mean = mean(array, start, stop);
        double sum2 = 0;
        for (int i = start; i<stop; ++i) {
            double d = array[i] - mean;
            sum2 += d * d;
        }
        res[0] = mean;
        res[1] = Math.sqrt(sum2 / (stop - start));
        return res;
    }
}
