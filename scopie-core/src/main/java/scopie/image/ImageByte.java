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
 * Image with unsigned 8-bit samples.
 */
public class ImageByte extends RawImage<ImageByte> {

    final private byte[] pixels;

    /**
     * @param name name of the image
     * @param sizeX width
     * @param pixels samples in row-major order, owned by the new image
     */
    public ImageByte(String name, int sizeX, byte[] pixels) {
        super(name, sizeX, computeSizeY(sizeX, pixels.length));
        this.pixels=pixels;
    }

    @Override public SampleKind getSampleKind() {
        return SampleKind.UNSIGNED_8;
    }

    @Override
    public int getPixelInt(int x, int y) {
        return pixels[x+y*sizeX] & 0xff;
    }

    @Override
    public int getPixelInt(int xy) {
        return pixels[xy] & 0xff;
    }

    /**
     * @return backing array, must not be modified
     */
    public byte[] getPixelArray() {
        return pixels;
    }

    @Override
    protected ImageByte cropInternal(BoundingBox bounds) {
        byte[] newPixels = new byte[bounds.getSizeXY()];
        copyRows(pixels, sizeX, bounds, newPixels);
        return new ImageByte(name, bounds.sizeX(), newPixels);
    }

    @Override
    public ImageByte duplicate(String name) {
        byte[] newPixels = new byte[sizeXY];
        System.arraycopy(pixels, 0, newPixels, 0, sizeXY);
        return new ImageByte(name, sizeX, newPixels);
    }
}
