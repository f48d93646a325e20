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
package simpeaks.processing.background;

import java.util.Arrays;

/**
 * Background along one axis: c0 + c1 (b-shift) + c2 (b-shift)^2 + c3 (b-shift)^3 for {@link BackgroundType#POLYNOMIAL}, c0 + c1 exp(c2 (b-shift)) for {@link BackgroundType#EXPONENTIAL}
 */
public final class BackgroundSpec {
    public final static BackgroundSpec NONE = new BackgroundSpec(BackgroundType.NONE, 0, 0, 0, 0, 0);
    private final BackgroundType type;
    private final double[] coefficients;
    private final double shift;

    public BackgroundSpec(BackgroundType type, double c0, double c1, double c2, double c3, double shift) {
        if (type==null) throw new IllegalArgumentException("Background type cannot be null");
        this.type = type;
        this.coefficients = new double[]{c0, c1, c2, c3};
        this.shift = shift;
    }

    public BackgroundType getType() {
        return type;
    }

    public double getCoefficient(int index) {
        return coefficients[index];
    }

    public double getShift() {
        return shift;
    }

    @Override
    public String toString() {
        return type+" c="+Arrays.toString(coefficients)+" shift="+shift;
    }
}
