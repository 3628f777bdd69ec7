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
 * Rectangular 2D region, bounds are inclusive.
 */
public interface BoundingBox {
    int xMin();
    int xMax();
    int yMin();
    int yMax();
    default int sizeX() {return xMax()-xMin()+1;}
    default int sizeY() {return yMax()-yMin()+1;}
    default int getSizeXY() {return sizeX() * sizeY();}
    default boolean isEmpty() {return sizeX()<=0 || sizeY()<=0;}
    default boolean sameDimensions(BoundingBox other) {
        return sizeX()==other.sizeX() && sizeY()==other.sizeY();
    }
    default boolean sameBounds(BoundingBox other) {
        return xMin()==other.xMin() && xMax()==other.xMax() && yMin()==other.yMin() && yMax()==other.yMax();
    }
    /**
     * @param other
     * @return whether {@param other} lies entirely within this box
     */
    default boolean contains(BoundingBox other) {
        return other.xMin()>=xMin() && other.xMax()<=xMax() && other.yMin()>=yMin() && other.yMax()<=yMax();
    }

    /**
     * Centered window of size {@param sizeX} x {@param sizeY} within {@param container}. When the difference of sizes is odd, the extra pixel is left after the window.
     * @param container
     * @param sizeX
     * @param sizeY
     * @return window
     */
    static SimpleBoundingBox centeredWindow(BoundingBox container, int sizeX, int sizeY) {
        if (sizeX>container.sizeX() || sizeY>container.sizeY()) throw new IllegalArgumentException("Window "+sizeX+"x"+sizeY+" does not fit in "+container);
        int x0 = container.xMin() + (container.sizeX()-sizeX)/2;
        int y0 = container.yMin() + (container.sizeY()-sizeY)/2;
        return new SimpleBoundingBox(0, sizeX-1, 0, sizeY-1).translate(x0, y0);
    }
}
