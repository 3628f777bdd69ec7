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

import scopie.image.BoundingBox;
import scopie.image.ImageByte;
import scopie.image.ImageComplex;
import scopie.image.ImageShort;
import scopie.image.RawImage;

import java.util.Arrays;

/**
 * 2D transform of images of a fixed size: 1D transform of every row followed by 1D transform of every column.
 * Both dimensions must be powers of two. Instances are immutable and can be used concurrently.
 */
public class FFT2D {
    final int sizeX, sizeY;
    final FFTPlan rowPlan, columnPlan;

    public FFT2D(int sizeX, int sizeY) {
        this.sizeX = sizeX;
        this.sizeY = sizeY;
        this.rowPlan = FFTPlan.get(sizeX);
        this.columnPlan = FFTPlan.get(sizeY);
    }

    public int sizeX() {return sizeX;}
    public int sizeY() {return sizeY;}

    /**
     * Forward transform of a raw frame. Rows are read directly from the raw samples.
     * @param image raw image of size sizeX x sizeY
     * @return spectrum
     */
    public ImageComplex forward(RawImage<?> image) {
        checkSize(image);
        double[] re = new double[sizeX*sizeY];
        double[] im = new double[sizeX*sizeY];
        double[] rowRe = new double[sizeX];
        double[] rowIm = new double[sizeX];
        for (int y = 0; y<sizeY; ++y) {
            loadRow(image, y, rowRe);
            Arrays.fill(rowIm, 0);
            FFT.forward(rowPlan, rowRe, rowIm);
            System.arraycopy(rowRe, 0, re, y*sizeX, sizeX);
            System.arraycopy(rowIm, 0, im, y*sizeX, sizeX);
        }
        columnPass(re, im, false);
        return new ImageComplex("FFT of "+image.getName(), sizeX, re, im);
    }

    /**
     * Forward transform of a complex image
     */
    public ImageComplex forward(ImageComplex image) {
        checkSize(image);
        double[] re = image.getRealArray().clone();
        double[] im = image.getImaginaryArray().clone();
        rowPass(re, im, false);
        columnPass(re, im, false);
        return new ImageComplex("FFT of "+image.getName(), sizeX, re, im);
    }

    /**
     * Inverse of {@link #forward(ImageComplex)}
     */
    public ImageComplex inverse(ImageComplex spectrum) {
        checkSize(spectrum);
        double[] re = spectrum.getRealArray().clone();
        double[] im = spectrum.getImaginaryArray().clone();
        rowPass(re, im, true);
        columnPass(re, im, true);
        return new ImageComplex("Inverse FFT of "+spectrum.getName(), sizeX, re, im);
    }

    private void loadRow(RawImage<?> image, int y, double[] row) {
        int off = y * sizeX;
        switch (image.getSampleKind()) {
            case UNSIGNED_8: {
                byte[] pixels = ((ImageByte)image).getPixelArray();
                for (int x = 0; x<sizeX; ++x) row[x] = pixels[off+x] & 0xff;
                break;
            }
            case UNSIGNED_16: {
                short[] pixels = ((ImageShort)image).getPixelArray();
                for (int x = 0; x<sizeX; ++x) row[x] = pixels[off+x] & 0xffff;
                break;
            }
            default:
                throw new IllegalArgumentException("Unsupported sample kind: "+image.getSampleKind());
        }
    }

    private void rowPass(double[] re, double[] im, boolean inverse) {
        double[] rowRe = new double[sizeX];
        double[] rowIm = new double[sizeX];
        for (int y = 0; y<sizeY; ++y) {
            int off = y*sizeX;
            System.arraycopy(re, off, rowRe, 0, sizeX);
            System.arraycopy(im, off, rowIm, 0, sizeX);
            if (inverse) FFT.backward(rowPlan, rowRe, rowIm);
            else FFT.forward(rowPlan, rowRe, rowIm);
            System.arraycopy(rowRe, 0, re, off, sizeX);
            System.arraycopy(rowIm, 0, im, off, sizeX);
        }
    }

    private void columnPass(double[] re, double[] im, boolean inverse) {
        double[] colRe = new double[sizeY];
        double[] colIm = new double[sizeY];
        for (int x = 0; x<sizeX; ++x) {
            for (int y = 0; y<sizeY; ++y) {
                colRe[y] = re[x+y*sizeX];
                colIm[y] = im[x+y*sizeX];
            }
            if (inverse) FFT.backward(columnPlan, colRe, colIm);
            else FFT.forward(columnPlan, colRe, colIm);
            for (int y = 0; y<sizeY; ++y) {
                re[x+y*sizeX] = colRe[y];
                im[x+y*sizeX] = colIm[y];
            }
        }
    }

    private void checkSize(BoundingBox image) {
        if (image.sizeX()!=sizeX || image.sizeY()!=sizeY) throw new IllegalArgumentException("Image size "+image.sizeX()+"x"+image.sizeY()+" does not match transform size "+sizeX+"x"+sizeY);
    }
}
