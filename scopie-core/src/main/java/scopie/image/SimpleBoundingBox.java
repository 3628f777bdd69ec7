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
 * Immutable bounding box.
 */
public class SimpleBoundingBox implements BoundingBox {
    final int xMin, xMax, yMin, yMax;

    public SimpleBoundingBox(int xMin, int xMax, int yMin, int yMax) {
        this.xMin = xMin;
        this.xMax = xMax;
        this.yMin = yMin;
        this.yMax = yMax;
    }
    @Override public int xMin() { return xMin; }
    @Override public int xMax() { return xMax; }
    @Override public int yMin() { return yMin; }
    @Override public int yMax() { return yMax; }

    /**
     * @param dX translation in the X-Axis in pixels
     * @param dY translation in the Y-Axis in pixels
     * @return a new bounding box translated by ({@param dX}, {@param dY})
     */
    public SimpleBoundingBox translate(int dX, int dY) {
        return new SimpleBoundingBox(xMin+dX, xMax+dX, yMin+dY, yMax+dY);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof SimpleBoundingBox)) return false;
        return sameBounds((SimpleBoundingBox)obj);
    }

    @Override
    public int hashCode() {
        int hash = 7;
        hash = 29 * hash + xMin;
        hash = 29 * hash + xMax;
        hash = 29 * hash + yMin;
        hash = 29 * hash + yMax;
        return hash;
    }

    @Override
    public String toString() {
        return "[x:["+xMin+";"+xMax+"], y:["+yMin+";"+yMax+"]]";
    }
}
