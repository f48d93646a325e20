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
package simpeaks.image;

public class SimpleBoundingBox implements BoundingBox {
    int xMin, xMax, yMin, yMax;

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

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof BoundingBox)) return false;
        return sameBounds((BoundingBox)other);
    }

    @Override
    public int hashCode() {
        int hash = 7;
        hash = 29 * hash + this.xMin;
        hash = 29 * hash + this.xMax;
        hash = 29 * hash + this.yMin;
        hash = 29 * hash + this.yMax;
        return hash;
    }

    @Override
    public String toString() {
        return "[x:["+xMin+";"+xMax+"], y:["+yMin+";"+yMax+"]]";
    }
}
