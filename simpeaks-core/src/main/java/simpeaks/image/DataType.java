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
 * Element type of a frame. The ordinal order is the one exposed to clients (areaDetector NDDataType order) and must not change.
 */
public enum DataType {
    INT8("Int8", 1, true, false),
    UINT8("UInt8", 1, false, false),
    INT16("Int16", 2, true, false),
    UINT16("UInt16", 2, false, false),
    INT32("Int32", 4, true, false),
    UINT32("UInt32", 4, false, false),
    INT64("Int64", 8, true, false),
    UINT64("UInt64", 8, false, false),
    FLOAT32("Float32", 4, true, true),
    FLOAT64("Float64", 8, true, true);

    private final String name;
    private final int byteCount;
    private final boolean signed, floatingPoint;

    DataType(String name, int byteCount, boolean signed, boolean floatingPoint) {
        this.name = name;
        this.byteCount = byteCount;
        this.signed = signed;
        this.floatingPoint = floatingPoint;
    }

    public String getName() {
        return name;
    }

    public int byteCount() {
        return byteCount;
    }

    public boolean signed() {
        return signed;
    }

    public boolean floatingPoint() {
        return floatingPoint;
    }

    /**
     * @param ordinal index of the type as exposed to clients
     * @return the corresponding type
     * @throws IllegalArgumentException if {@param ordinal} does not correspond to any type
     */
    public static DataType fromOrdinal(int ordinal) {
        DataType[] values = values();
        if (ordinal<0 || ordinal>=values.length) throw new IllegalArgumentException("Invalid data type: "+ordinal);
        return values[ordinal];
    }

    @Override
    public String toString() {
        return name;
    }
}
