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
 * Scale factors making the rendered height of a peak at its center equal to its amplitude
 */
public class PeakNormalization {
    private PeakNormalization() {}

    public static double scale(PeakType1D type, PeakSpec peak) {
        return scale(type.value(peak, peak.getPositionX()), peak.getAmplitude());
    }

    public static double scale(PeakType2D type, PeakSpec peak) {
        return scale(type.value(peak, peak.getPositionX(), peak.getPositionY()), peak.getAmplitude());
    }

    /**
     * @param centerHeight unnormalized value at the peak center
     * @param amplitude requested height
     * @return amplitude / centerHeight, or 1 if centerHeight is zero or not finite
     */
    public static double scale(double centerHeight, double amplitude) {
        if (Double.isNaN(centerHeight) || Double.isInfinite(centerHeight) || Math.abs(centerHeight) < PeakShapes.ZERO_CHECK) return 1.0;
        return amplitude / centerHeight;
    }
}
