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
 * Shapes available for 1D frames. Ordinals are exchanged with clients and must not change
 */
public enum PeakType1D {
    NONE("None", (p, x) -> 0.0),
    SQUARE("Square", PeakShapes::square),
    TRIANGLE("Triangle", PeakShapes::triangle),
    GAUSSIAN("Gaussian", PeakShapes::gaussian),
    LORENTZ("Lorentz", PeakShapes::lorentz),
    PSEUDO_VOIGT("Pseudo-Voigt", PeakShapes::pseudoVoigt),
    LAPLACE("Laplace", PeakShapes::laplace),
    MOFFAT("Moffat", PeakShapes::moffat),
    SMOOTH_STEP("SmoothStep", PeakShapes::smoothStep);

    @FunctionalInterface
    public interface Shape1D {
        double value(PeakSpec peak, double x);
    }

    private final String name;
    private final Shape1D shape;

    PeakType1D(String name, Shape1D shape) {
        this.name = name;
        this.shape = shape;
    }

    public String getName() {
        return name;
    }

    public double value(PeakSpec peak, double x) {
        return shape.value(peak, x);
    }

    public static PeakType1D fromOrdinal(int ordinal) {
        PeakType1D[] values = values();
        if (ordinal<0 || ordinal>=values.length) throw new IllegalArgumentException("Invalid 1D peak type: "+ordinal);
        return values[ordinal];
    }

    @Override
    public String toString() {
        return name;
    }
}
