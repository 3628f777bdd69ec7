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
package scopie.image;

/**
 * Raw camera frame with unsigned integer samples. The only implementations are {@link ImageByte} and {@link ImageShort}, dispatched on {@link #getSampleKind()}.
 * @param <I> concrete image type
 */
public abstract class RawImage<I extends RawImage<I>> extends Image<I> {

    RawImage(String name, int sizeX, int sizeY) {
        super(name, sizeX, sizeY);
    }

    public abstract SampleKind getSampleKind();
    public abstract int getPixelInt(int x, int y);
    public abstract int getPixelInt(int xy);

    @Override public double getPixel(int x, int y) {
        return getPixelInt(x, y);
    }
    @Override public double getPixel(int xy) {
        return getPixelInt(xy);
    }
    @Override public int getBitDepth() {
        return getSampleKind().bitDepth;
    }

    /**
     * @param name
     * @param pixelArray byte[] (8-bit samples) or short[] (16-bit samples)
     * @param sizeX width of the image
     * @return image wrapping {@param pixelArray}
     */
    public static RawImage<?> createImageFrom2DPixelArray(String name, Object pixelArray, int sizeX) {
        if (pixelArray instanceof byte[]) return new ImageByte(name, sizeX, (byte[])pixelArray);
        else if (pixelArray instanceof short[]) return new ImageShort(name, sizeX, (short[])pixelArray);
        else throw new IllegalArgumentException("Pixel Array should be of type byte or short");
    }
}
