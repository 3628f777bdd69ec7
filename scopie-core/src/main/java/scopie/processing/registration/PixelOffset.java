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

import java.util.Locale;

/**
 * Translation (in pixels) of a probe image relative to a reference image.
 */
public class PixelOffset {
    final double dx, dy;

    public PixelOffset(double dx, double dy) {
        this.dx = dx;
        this.dy = dy;
    }

    public double getDx() {return dx;}
    public double getDy() {return dy;}

    public double norm() {
        return Math.sqrt(dx*dx + dy*dy);
    }

    public PixelOffset subtract(PixelOffset other) {
        return new PixelOffset(dx - other.dx, dy - other.dy);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof PixelOffset)) return false;
        PixelOffset other = (PixelOffset)obj;
        return Double.compare(dx, other.dx)==0 && Double.compare(dy, other.dy)==0;
    }

    @Override
    public int hashCode() {
        int hash = 7;
        hash = 29 * hash + Double.hashCode(dx);
        hash = 29 * hash + Double.hashCode(dy);
        return hash;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "(%.3f, %.3f)", dx, dy);
    }
}
