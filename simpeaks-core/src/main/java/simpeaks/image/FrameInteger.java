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
 * Frame storing integer values. Signed and unsigned element types share the same Java storage type, unsigned values are masked on read.
 * @param <F> concrete frame type
 */
public abstract class FrameInteger<F extends FrameInteger<F>> extends Frame<F> {
    protected final boolean unsigned;

    protected FrameInteger(String name, int sizeX, int sizeY, DataType dataType, int byteCount) {
        super(name, sizeX, sizeY, dataType);
        if (dataType.floatingPoint() || dataType.byteCount()!=byteCount) throw new IllegalArgumentException("Data type "+dataType+" cannot be stored in "+getClass().getSimpleName());
        this.unsigned = !dataType.signed();
    }

    public boolean isUnsigned() {
        return unsigned;
    }

    /**
     * Java narrowing conversion of a double to a 64-bit integer, extended to the unsigned range so that values in [2^63, 2^64) keep their low bits
     * @param value value to convert
     * @return the long whose low bits are stored
     */
    protected static long toLong(double value) {
        if (value >= 0x1p63 && value < 0x1p64) return (long)(value - 0x1p63) + Long.MIN_VALUE;
        return (long)value;
    }

    public abstract long getPixelLong(int xy);
}
