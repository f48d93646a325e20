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

public class FrameFloat extends Frame<FrameFloat> {
    private final float[] pixels;

    public FrameFloat(String name, int sizeX, int sizeY) {
        super(name, sizeX, sizeY, DataType.FLOAT32);
        this.pixels = new float[sizeXY];
    }

    @Override
    public double getPixel(int xy) {
        return pixels[xy];
    }

    @Override
    public void setPixel(int xy, double value) {
        pixels[xy] = (float)value;
    }

    @Override
    public void addPixel(int xy, double value) {
        pixels[xy] += (float)value;
    }

    @Override
    public void reset() {
        Arrays.fill(pixels, 0f);
    }

    @Override
    public FrameFloat duplicate(String name) {
        FrameFloat res = new FrameFloat(name, sizeX, sizeY);
        System.arraycopy(pixels, 0, res.pixels, 0, sizeXY);
        return copyMetadata(res);
    }
}
