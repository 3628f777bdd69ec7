/* 
 * Copyright (C) 2025 Scopie developers
 *
 * This File is part of Scopie
 *
 * Scopie is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * Scopie is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with Scopie.  If not, see <http://www.gnu.org/licenses/>.
 */
package scopie.processing.fft;

/**
 * Iterative radix-2 Cooley-Tukey transform on split real / imaginary arrays.
 */
public class FFT {

    /**
     * Forward transform with the analysis scale 2/N applied to the output
     */
    public static void forward(FFTPlan plan, double[] re, double[] im) {
        transform(plan, re, im, 2d / plan.n);
    }

    /**
     * Forward transform without scaling
     */
    public static void unscaled(FFTPlan plan, double[] re, double[] im) {
        transform(plan, re, im, 1);
    }

    /**
     * Inverse of {@link #forward(FFTPlan, double[], double[])}: backward(forward(x)) == x
     */
    public static void backward(FFTPlan plan, double[] re, double[] im) {
        inverse(plan, re, im, 0.5);
    }

    /**
     * Inverse transform computed as conjugate, forward transform, conjugate.
     * @param scale factor applied to the output
     */
    public static void inverse(FFTPlan plan, double[] re, double[] im, double scale) {
        conjugate(im);
        transform(plan, re, im, scale);
        conjugate(im);
    }

    /**
     * In-place decimation-in-time transform.
     * @param plan plan of length N
     * @param re real parts, length N
     * @param im imaginary parts, length N
     * @param scale factor applied to the output
     */
    public static void transform(FFTPlan plan, double[] re, double[] im, double scale) {
        final int n = plan.n;
        if (re.length!=n || im.length!=n) throw new IllegalArgumentException("Input length ("+re.length+", "+im.length+") does not match plan length "+n);
        final int[] rev = plan.bitReverse;
        for (int i = 0; i<n; ++i) {
            int j = rev[i];
            if (j>i) {
                double t = re[i]; re[i] = re[j]; re[j] = t;
                t = im[i]; im[i] = im[j]; im[j] = t;
            }
        }
        final double[] twRe = plan.twiddleRe;
        final double[] twIm = plan.twiddleIm;
        int offset = 0;
        for (int n2 = 2; n2<=n; n2<<=1) {
            final int half = n2>>1;
            for (int i = 0; i<n; i+=n2) {
                for (int k = 0; k<half; ++k) {
                    int e = i+k;
                    int o = e+half;
                    double tRe = twRe[offset+k];
                    double tIm = twIm[offset+k];
                    double oRe = re[o]*tRe - im[o]*tIm;
                    double oIm = re[o]*tIm + im[o]*tRe;
                    re[o] = re[e] - oRe;
                    im[o] = im[e] - oIm;
                    re[e] += oRe;
                    im[e] += oIm;
                }
            }
            offset += half;
        }
        if (scale!=1) {
            for (int i = 0; i<n; ++i) {
                re[i] *= scale;
                im[i] *= scale;
            }
        }
    }

    private static void conjugate(double[] im) {
        for (int i = 0; i<im.length; ++i) im[i] = -im[i];
    }
}
