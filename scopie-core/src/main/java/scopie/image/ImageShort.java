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
 * Image with unsigned 16-bit samples.
 */
public class ImageShort extends RawImage<ImageShort> {

    final private short[] pixels;

    /**
     * @param name name of the image
     * @param sizeX width
     * @param pixels samples in row-major order, owned by the new image
     */
    public ImageShort(String name, int sizeX, short[] pixels) {
        super(name, sizeX, computeSizeY(sizeX, pixels.length));
        this.pixels=pixels;
    }

    @Override public SampleKind getSampleKind() {
        return SampleKind.UNSIGNED_16;
    }

    @Override
    public int getPixelInt(int x, int y) {
        return pixels[x+y*sizeX] & 0xffff;
    }

    @Override
    public int getPixelInt(int xy) {
        return pixels[xy] & 0xffff;
    }

    /**
     * @return backing array, must not be modified
     */
    public short[] getPixelArray() {
        return pixels;
    }

    @Override
    protected ImageShort cropInternal(BoundingBox bounds) {
        short[] newPixels = new short[bounds.getSizeXY()];
        copyRows(pixels, sizeX, bounds, newPixels);
        return new ImageShort(name, bounds.sizeX(), newPixels);
    }

    @Override
    public ImageShort duplicate(String name) {
        short[] newPixels = new short[sizeXY];
        System.arraycopy(pixels, 0, newPixels, 0, sizeXY);
        return new ImageShort(name, sizeX, newPixels);
    }
}
