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
 * Geometry and element type of a frame. Frames are 2D arrays of sizeX x sizeY bins, 1D frames having sizeY = 1
 */
public interface FrameProperties {
    String getName();
    int sizeX();
    int sizeY();
    default int getSizeXY() {return sizeX() * sizeY();}
    DataType getDataType();
    default long getByteSize() {return (long)getSizeXY() * getDataType().byteCount();}
    default boolean sameDimensions(FrameProperties other) {
        return sizeX()==other.sizeX() && sizeY()==other.sizeY();
    }
    default boolean sameProperties(FrameProperties other) {
        return sameDimensions(other) && getDataType().equals(other.getDataType());
    }
    default boolean sameProperties(int sizeX, int sizeY, DataType dataType) {
        return sizeX()==sizeX && sizeY()==sizeY && getDataType().equals(dataType);
    }
}
