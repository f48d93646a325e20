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

public class BackgroundGenerator {
    private BackgroundGenerator() {}

    /**
     * @param spec background along one axis
     * @param bin coordinate along this axis
     * @return background value at {@param bin}
     */
    public static double value(BackgroundSpec spec, double bin) {
        double d = bin - spec.getShift();
        switch (spec.getType()) {
            case NONE:
            default:
                return 0;
            case POLYNOMIAL:
                return spec.getCoefficient(0) + d * spec.getCoefficient(1) + d * d * spec.getCoefficient(2) + d * d * d * spec.getCoefficient(3);
            case EXPONENTIAL:
                return spec.getCoefficient(0) + spec.getCoefficient(1) * Math.exp(d * spec.getCoefficient(2));
        }
    }

    /**
     * 2D background: the contributions along X and Y are summed
     */
    public static double value(BackgroundSpec specX, BackgroundSpec specY, double x, double y) {
        return value(specX, x) + value(specY, y);
    }
}
