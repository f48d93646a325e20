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

/**
 * Inclusive 2D bin range.
 */
public interface BoundingBox {
    int xMin();
    int xMax();
    int yMin();
    int yMax();
    default int sizeX() {return xMax()-xMin()+1;}
    default int sizeY() {return yMax()-yMin()+1;}
    default int getSizeXY() {return isValid() ? sizeX() * sizeY() : 0;}
    default boolean isValid() {
        return xMin()<=xMax() && yMin()<=yMax();
    }
    default boolean sameBounds(BoundingBox other) {
        return xMin()==other.xMin() && xMax()==other.xMax() && yMin()==other.yMin() && yMax()==other.yMax();
    }

    /**
     * @return intersection of {@param b1} and {@param b2}. The result is not valid (see {@link #isValid()}) when the boxes do not intersect
     */
    static SimpleBoundingBox getIntersection2D(BoundingBox b1, BoundingBox b2) {
        if (!b1.isValid() || !b2.isValid()) return new SimpleBoundingBox(1, -1, 1, -1);
        return new SimpleBoundingBox(Math.max(b1.xMin(), b2.xMin()), Math.min(b1.xMax(), b2.xMax()), Math.max(b1.yMin(), b2.yMin()), Math.min(b1.yMax(), b2.yMax()));
    }

    static void loop(BoundingBox bb, LoopFunction function) {
        for (int y = bb.yMin(); y<=bb.yMax(); ++y) {
            for (int x=bb.xMin(); x<=bb.xMax(); ++x) {
                function.loop(x, y);
            }
        }
    }

    interface LoopFunction {
        void loop(int x, int y);
    }
}
