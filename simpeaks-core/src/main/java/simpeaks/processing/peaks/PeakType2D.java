/* 
 * Copyright (C) 2022 SimPeaks developers
 *
 * This File is part of SimPeaks
 *
 * SimPeaks is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * SimPeaks is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with SimPeaks.  If not, see <http://www.gnu.org/licenses/>.
 */
package simpeaks.processing.peaks;

/**
 * Shapes available for 2D frames. Ordinals are exchanged with clients and must not change
 */
public enum PeakType2D {
    NONE("None", (p, x, y) -> 0.0),
    SQUARE("Square", PeakShapes::square2D),
    PYRAMID("Pyramid", PeakShapes::pyramid2D),
    CONE("Cone", PeakShapes::cone2D),
    GAUSSIAN("Gaussian", PeakShapes::gaussian2D),
    LORENTZ("Lorentz", PeakShapes::lorentz2D),
    PSEUDO_VOIGT("Pseudo-Voigt", PeakShapes::pseudoVoigt2D),
    LAPLACE("Laplace", PeakShapes::laplace2D),
    MOFFAT("Moffat", PeakShapes::moffat2D),
    SMOOTH_STEP("SmoothStep", PeakShapes::smoothStep2D);

    @FunctionalInterface
    public interface Shape2D {
        double value(PeakSpec peak, double x, double y);
    }

    private final String name;
    private final Shape2D shape;

    PeakType2D(String name, Shape2D shape) {
        this.name = name;
        this.shape = shape;
    }

    public String getName() {
        return name;
    }

    public double value(PeakSpec peak, double x, double y) {
        return shape.value(peak, x, y);
    }

    public static PeakType2D fromOrdinal(int ordinal) {
        PeakType2D[] values = values();
        if (ordinal<0 || ordinal>=values.length) throw new IllegalArgumentException("Invalid 2D peak type: "+ordinal);
        return values[ordinal];
    }

    @Override
    public String toString() {
        return name;
    }
}
