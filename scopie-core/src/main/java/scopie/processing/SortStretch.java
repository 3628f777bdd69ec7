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
package scopie.processing;

import scopie.image.ImageByte;
import scopie.image.ImageShort;
import scopie.image.RawImage;
import scopie.image.SampleKind;

/**
 * Rank-based histogram equalization: the sample of rank i (among n samples, ties ordered by position) is mapped to {@code i * max / n}, max being the largest value of the sample kind.
 */
public class SortStretch {

    public static RawImage<?> stretch(RawImage<?> image) {
        switch (image.getSampleKind()) {
            case UNSIGNED_8:
                return stretch((ImageByte)image);
            case UNSIGNED_16:
                return stretch((ImageShort)image);
            default:
                throw new IllegalArgumentException("Unsupported sample kind: "+image.getSampleKind());
        }
    }

    public static ImageByte stretch(ImageByte image) {
        byte[] pixels = image.getPixelArray();
        int[] ranks = ranks(image, SampleKind.UNSIGNED_8.maxValue + 1);
        float mul = (float)SampleKind.UNSIGNED_8.maxValue / pixels.length;
        byte[] res = new byte[pixels.length];
        for (int i = 0; i<res.length; ++i) res[i] = (byte)(int)(ranks[i] * mul);
        return new ImageByte(image.getName(), image.sizeX(), res);
    }

    public static ImageShort stretch(ImageShort image) {
        short[] pixels = image.getPixelArray();
        int[] ranks = ranks(image, SampleKind.UNSIGNED_16.maxValue + 1);
        float mul = (float)SampleKind.UNSIGNED_16.maxValue / pixels.length;
        short[] res = new short[pixels.length];
        for (int i = 0; i<res.length; ++i) res[i] = (short)(int)(ranks[i] * mul);
        return new ImageShort(image.getName(), image.sizeX(), res);
    }

    /**
     * Counting sort of sample values
     * @return rank of each sample in the stable ascending order of values
     */
    static int[] ranks(RawImage<?> image, int valueCount) {
        int n = image.getSizeXY();
        int[] next = new int[valueCount];
        for (int i = 0; i<n; ++i) ++next[image.getPixelInt(i)];
        int start = 0;
        for (int v = 0; v<valueCount; ++v) {
            int count = next[v];
            next[v] = start;
            start += count;
        }
        int[] ranks = new int[n];
        for (int i = 0; i<n; ++i) ranks[i] = next[image.getPixelInt(i)]++;
        return ranks;
    }
}
