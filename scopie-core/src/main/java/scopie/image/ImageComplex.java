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
 * Complex double-precision image, used for spectra and correlation maps. Real and imaginary parts are stored in two row-major planes.
 */
public class ImageComplex extends Image<ImageComplex> {

    final private double[] real, imaginary;

    /**
     * @param name name of the image
     * @param sizeX width
     * @param real real parts, owned by the new image
     * @param imaginary imaginary parts, owned by the new image
     */
    public ImageComplex(String name, int sizeX, double[] real, double[] imaginary) {
        super(name, sizeX, computeSizeY(sizeX, real.length));
        if (imaginary.length!=real.length) throw new IllegalArgumentException("Real and imaginary planes differ in size: "+real.length+" vs "+imaginary.length);
        this.real = real;
        this.imaginary = imaginary;
    }

    public double getReal(int x, int y) {
        return real[x+y*sizeX];
    }
    public double getImaginary(int x, int y) {
        return imaginary[x+y*sizeX];
    }
    public double getSquaredMagnitude(int xy) {
        return real[xy]*real[xy] + imaginary[xy]*imaginary[xy];
    }

    /**
     * @return modulus at ({@param x}, {@param y})
     */
    @Override
    public double getPixel(int x, int y) {
        return getPixel(x+y*sizeX);
    }
    @Override
    public double getPixel(int xy) {
        return Math.sqrt(getSquaredMagnitude(xy));
    }

    @Override public int getBitDepth() {return 128;}

    /**
     * @return backing array of real parts, must not be modified
     */
    public double[] getRealArray() {
        return real;
    }
    /**
     * @return backing array of imaginary parts, must not be modified
     */
    public double[] getImaginaryArray() {
        return imaginary;
    }

    @Override
    protected ImageComplex cropInternal(BoundingBox bounds) {
        double[] newReal = new double[bounds.getSizeXY()];
        double[] newImaginary = new double[bounds.getSizeXY()];
        copyRows(real, sizeX, bounds, newReal);
        copyRows(imaginary, sizeX, bounds, newImaginary);
        return new ImageComplex(name, bounds.sizeX(), newReal, newImaginary);
    }

    @Override
    public ImageComplex duplicate(String name) {
        return new ImageComplex(name, sizeX, real.clone(), imaginary.clone());
    }
}
