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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rectangular single-plane image. Images are never modified after construction: cropping or transforming an image produces a new instance.
 * @param <I> concrete image type
 */
public abstract class Image<I extends Image<I>> implements BoundingBox {
    public final static Logger logger = LoggerFactory.getLogger(Image.class);
    protected final String name;
    protected final int sizeX, sizeY, sizeXY;

    protected Image(String name, int sizeX, int sizeY) {
        if (sizeX<=0 || sizeY<=0) throw new IllegalArgumentException("Invalid image dimensions: "+sizeX+"x"+sizeY);
        this.name = name==null ? "" : name;
        this.sizeX = sizeX;
        this.sizeY = sizeY;
        this.sizeXY = sizeX * sizeY;
    }

    protected static int computeSizeY(int sizeX, int length) {
        if (sizeX<=0 || length%sizeX!=0) throw new IllegalArgumentException("Pixel array of length "+length+" is not compatible with width "+sizeX);
        return length/sizeX;
    }

    public String getName() {
        return name;
    }

    @Override public int xMin() {return 0;}
    @Override public int xMax() {return sizeX-1;}
    @Override public int yMin() {return 0;}
    @Override public int yMax() {return sizeY-1;}
    @Override public int sizeX() {return sizeX;}
    @Override public int sizeY() {return sizeY;}
    @Override public int getSizeXY() {return sizeXY;}

    public SimpleBoundingBox getBoundingBox() {
        return new SimpleBoundingBox(0, sizeX-1, 0, sizeY-1);
    }

    public abstract double getPixel(int x, int y);
    public abstract double getPixel(int xy);
    public abstract int getBitDepth();

    /**
     * Copies the region {@param bounds} into a new image
     * @param bounds region in image coordinates, must be included in the image
     * @return cropped image
     */
    public I crop(BoundingBox bounds) {
        if (bounds.isEmpty()) throw new IllegalArgumentException("Cannot crop empty region: "+bounds);
        if (!getBoundingBox().contains(bounds)) throw new IllegalArgumentException("Crop region "+bounds+" exceeds image bounds "+getBoundingBox());
        return cropInternal(bounds);
    }
    protected abstract I cropInternal(BoundingBox bounds);

    public abstract I duplicate(String name);

    /**
     * Copies rows of {@param bounds} from {@param source} into a new array of the same type
     */
    protected static void copyRows(Object source, int sourceSizeX, BoundingBox bounds, Object dest) {
        int offSource = bounds.xMin() + bounds.yMin() * sourceSizeX;
        int offDest = 0;
        for (int y = 0; y<bounds.sizeY(); ++y) {
            System.arraycopy(source, offSource, dest, offDest, bounds.sizeX());
            offSource += sourceSizeX;
            offDest += bounds.sizeX();
        }
    }

    @Override
    public String toString() {
        return name+" ("+getClass().getSimpleName()+" "+sizeX+"x"+sizeY+")";
    }
}
