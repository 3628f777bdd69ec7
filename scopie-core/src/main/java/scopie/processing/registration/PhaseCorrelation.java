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
package scopie.processing.registration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import scopie.image.BoundingBox;
import scopie.image.ImageComplex;
import scopie.image.RawImage;
import scopie.processing.fft.FFT2D;

/**
 * Estimates the translation of probe images relative to a reference image, from the peak of the inverse transform of their cross-power spectrum.
 * <p>
 * Both images are center-cropped to a square working window of size S (a power of two). The reference spectrum is computed once at construction and is read-only afterwards, so {@link #offset(RawImage)} can be called concurrently.
 * Offsets are refined to sub-pixel precision with a 3-point parabola on each axis and wrapped into (-S/2, S/2].
 */
public class PhaseCorrelation {
    public final static Logger logger = LoggerFactory.getLogger(PhaseCorrelation.class);
    final int workingSize;
    final boolean normalize;
    final FFT2D fft;
    final ImageComplex referenceSpectrum;

    /**
     * @param reference reference frame
     * @param requestedSize requested working size in pixels, non-positive means as large as possible
     * @param maxSize upper limit of the working size, non-positive means no limit
     */
    public PhaseCorrelation(RawImage<?> reference, int requestedSize, int maxSize) {
        this(reference, requestedSize, maxSize, false);
    }

    /**
     * @param reference reference frame
     * @param requestedSize requested working size in pixels, non-positive means as large as possible
     * @param maxSize upper limit of the working size, non-positive means no limit
     * @param normalize whether the cross-power spectrum is normalized to unit magnitude
     */
    public PhaseCorrelation(RawImage<?> reference, int requestedSize, int maxSize, boolean normalize) {
        this.workingSize = getWorkingSize(reference.sizeX(), reference.sizeY(), requestedSize, maxSize);
        this.normalize = normalize;
        this.fft = new FFT2D(workingSize, workingSize);
        this.referenceSpectrum = fft.forward(centerCrop(reference, workingSize));
        logger.debug("reference {}: working size {} (requested: {}, max: {})", reference, workingSize, requestedSize, maxSize);
    }

    /**
     * @return largest power of two not exceeding the smallest image dimension, {@param requestedSize} and {@param maxSize} (non-positive limits are ignored)
     */
    public static int getWorkingSize(int sizeX, int sizeY, int requestedSize, int maxSize) {
        int size = Math.min(sizeX, sizeY);
        if (requestedSize>0) size = Math.min(size, requestedSize);
        if (maxSize>0) size = Math.min(size, maxSize);
        if (size<2) throw new IllegalArgumentException("Working size must be at least 2 pixels (image: "+sizeX+"x"+sizeY+", requested: "+requestedSize+", max: "+maxSize+")");
        return Integer.highestOneBit(size);
    }

    public int getWorkingSize() {
        return workingSize;
    }

    public boolean isNormalized() {
        return normalize;
    }

    public static RawImage<?> centerCrop(RawImage<?> image, int size) {
        if (image.sizeX()<size || image.sizeY()<size) throw new IllegalArgumentException("Image "+image+" is smaller than working size "+size);
        if (image.sizeX()==size && image.sizeY()==size) return image;
        return image.crop(BoundingBox.centeredWindow(image, size, size));
    }

    /**
     * @param probe frame to register, at least as large as the working size in both dimensions
     * @return translation of {@param probe} relative to the reference
     */
    public PixelOffset offset(RawImage<?> probe) {
        ImageComplex spectrum = fft.forward(centerCrop(probe, workingSize));
        ImageComplex correlation = fft.inverse(crossPowerSpectrum(spectrum, referenceSpectrum, normalize));
        return locatePeak(correlation);
    }

    /**
     * @return element-wise product of {@param spectrum} and the conjugate of {@param reference}
     */
    static ImageComplex crossPowerSpectrum(ImageComplex spectrum, ImageComplex reference, boolean normalize) {
        double[] aRe = spectrum.getRealArray(), aIm = spectrum.getImaginaryArray();
        double[] bRe = reference.getRealArray(), bIm = reference.getImaginaryArray();
        double[] re = new double[aRe.length];
        double[] im = new double[aRe.length];
        for (int i = 0; i<re.length; ++i) {
            double pRe = aRe[i]*bRe[i] + aIm[i]*bIm[i];
            double pIm = aIm[i]*bRe[i] - aRe[i]*bIm[i];
            if (normalize) {
                double norm = Math.sqrt(pRe*pRe + pIm*pIm);
                if (norm>0) {
                    pRe /= norm;
                    pIm /= norm;
                }
            }
            re[i] = pRe;
            im[i] = pIm;
        }
        return new ImageComplex("cross-power spectrum", spectrum.sizeX(), re, im);
    }

    /**
     * Sub-pixel location of the maximum of a square correlation map.
     * The zero-lag bin is first replaced by the average of its 4 neighbours: readout noise correlates strongly with itself at zero lag. This heuristic tends to align noise patterns anyway and its correctness is unproven.
     */
    static PixelOffset locatePeak(ImageComplex correlation) {
        final int size = correlation.sizeX();
        double[] magnitude = new double[correlation.getSizeXY()];
        for (int i = 0; i<magnitude.length; ++i) magnitude[i] = correlation.getPixel(i);
        magnitude[0] = (magnitude[idx(1, 0, size)] + magnitude[idx(-1, 0, size)] + magnitude[idx(0, 1, size)] + magnitude[idx(0, -1, size)]) / 4;
        int maxIdx = 0;
        for (int i = 1; i<magnitude.length; ++i) {
            if (magnitude[i]>magnitude[maxIdx]) maxIdx = i;
        }
        int x0 = maxIdx % size;
        int y0 = maxIdx / size;
        double dx = x0 + parabolicPeak(magnitude[idx(x0-1, y0, size)], magnitude[maxIdx], magnitude[idx(x0+1, y0, size)]);
        double dy = y0 + parabolicPeak(magnitude[idx(x0, y0-1, size)], magnitude[maxIdx], magnitude[idx(x0, y0+1, size)]);
        if (logger.isTraceEnabled()) logger.trace("correlation peak @ ({}, {}) value: {} refined: ({}, {})", x0, y0, magnitude[maxIdx], dx, dy);
        return new PixelOffset(wrap(dx, size), wrap(dy, size));
    }

    /**
     * @return position of the vertex of the parabola through (-1, left), (0, center), (1, right)
     */
    static double parabolicPeak(double left, double center, double right) {
        double denominator = 2 * (left + right - 2 * center);
        if (denominator==0) return 0;
        return (left - right) / denominator;
    }

    static double wrap(double coord, int size) {
        return coord > size/2d ? coord - size : coord;
    }

    private static int idx(int x, int y, int size) {
        return Math.floorMod(x, size) + Math.floorMod(y, size) * size;
    }
}
