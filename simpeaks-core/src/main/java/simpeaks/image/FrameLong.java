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

import java.util.Arrays;

public class FrameLong extends FrameInteger<FrameLong> {
    private final long[] pixels;

    public FrameLong(String name, int sizeX, int sizeY, DataType dataType) {
        super(name, sizeX, sizeY, dataType, 8);
        this.pixels = new long[sizeXY];
    }

    @Override
    public double getPixel(int xy) {
        long v = pixels[xy];
        if (!unsigned || v>=0) return v;
        // unsigned value >= 2^63
        return ((v >>> 1) | (v & 1)) * 2.0;
    }

    /**
     * For unsigned frames the returned value must be interpreted with {@link Long#toUnsignedString(long)}
     */
    @Override
    public long getPixelLong(int xy) {
        return pixels[xy];
    }

    @Override
    public void setPixel(int xy, double value) {
        pixels[xy] = toLong(value);
    }

    @Override
    public void addPixel(int xy, double value) {
        pixels[xy] += toLong(value);
    }

    @Override
    public void reset() {
        Arrays.fill(pixels, 0L);
    }

    @Override
    public FrameLong duplicate(String name) {
        FrameLong res = new FrameLong(name, sizeX, sizeY, dataType);
        System.arraycopy(pixels, 0, res.pixels, 0, sizeXY);
        return copyMetadata(res);
    }
}
