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

public class FrameInt extends FrameInteger<FrameInt> {
    private final int[] pixels;

    public FrameInt(String name, int sizeX, int sizeY, DataType dataType) {
        super(name, sizeX, sizeY, dataType, 4);
        this.pixels = new int[sizeXY];
    }

    @Override
    public double getPixel(int xy) {
        return unsigned ? pixels[xy] & 0xffffffffL : pixels[xy];
    }

    @Override
    public long getPixelLong(int xy) {
        return unsigned ? pixels[xy] & 0xffffffffL : pixels[xy];
    }

    @Override
    public void setPixel(int xy, double value) {
        pixels[xy] = (int)toLong(value);
    }

    @Override
    public void addPixel(int xy, double value) {
        pixels[xy] += (int)toLong(value);
    }

    @Override
    public void reset() {
        Arrays.fill(pixels, 0);
    }

    @Override
    public FrameInt duplicate(String name) {
        FrameInt res = new FrameInt(name, sizeX, sizeY, dataType);
        System.arraycopy(pixels, 0, res.pixels, 0, sizeXY);
        return copyMetadata(res);
    }
}
