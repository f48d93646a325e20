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
package simpeaks.processing.noise;

public enum NoiseType {
    NONE("None"),
    UNIFORM("Uniform"),
    GAUSSIAN("Gaussian");

    private final String name;

    NoiseType(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public static NoiseType fromOrdinal(int ordinal) {
        NoiseType[] values = values();
        if (ordinal<0 || ordinal>=values.length) throw new IllegalArgumentException("Invalid noise type: "+ordinal);
        return values[ordinal];
    }

    @Override
    public String toString() {
        return name;
    }
}
