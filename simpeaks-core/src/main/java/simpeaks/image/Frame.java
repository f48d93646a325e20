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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.stream.DoubleStream;
import java.util.stream.IntStream;

/**
 * Owned contiguous typed buffer of sizeX x sizeY bins, stored row-major (index = x + y * sizeX).
 * Values are written through {@link #setPixel(int, double)} / {@link #addPixel(int, double)} which cast the value to the element type the way a Java narrowing conversion does: truncation toward zero, then two's-complement wrap at the element width.
 * @param <F> concrete frame type
 */
public abstract class Frame<F extends Frame<F>> implements FrameProperties, BoundingBox {
    public final static Logger logger = LoggerFactory.getLogger(Frame.class);
    protected String name;
    protected final int sizeX, sizeY, sizeXY;
    protected final DataType dataType;
    protected long uniqueId;
    protected double timeStamp;

    protected Frame(String name, int sizeX, int sizeY, DataType dataType) {
        if (sizeX<=0 || sizeY<=0) throw new IllegalArgumentException("Invalid frame dimensions: "+sizeX+"x"+sizeY);
        this.name = name;
        this.sizeX = sizeX;
        this.sizeY = sizeY;
        this.sizeXY = sizeX * sizeY;
        this.dataType = dataType;
    }

    public static Frame createEmptyFrame(String name, int sizeX, int sizeY, DataType dataType) {
        switch (dataType) {
            case INT8:
            case UINT8:
                return new FrameByte(name, sizeX, sizeY, dataType);
            case INT16:
            case UINT16:
                return new FrameShort(name, sizeX, sizeY, dataType);
            case INT32:
            case UINT32:
                return new FrameInt(name, sizeX, sizeY, dataType);
            case INT64:
            case UINT64:
                return new FrameLong(name, sizeX, sizeY, dataType);
            case FLOAT32:
                return new FrameFloat(name, sizeX, sizeY);
            case FLOAT64:
                return new FrameDouble(name, sizeX, sizeY);
            default:
                throw new IllegalArgumentException("Unsupported data type: "+dataType);
        }
    }

    @Override public String getName() {return name;}
    public F setName(String name) {
        this.name = name;
        return (F)this;
    }
    @Override public int sizeX() {return sizeX;}
    @Override public int sizeY() {return sizeY;}
    @Override public int getSizeXY() {return sizeXY;}
    @Override public DataType getDataType() {return dataType;}
    // bounding box in bin coordinates
    @Override public int xMin() {return 0;}
    @Override public int xMax() {return sizeX-1;}
    @Override public int yMin() {return 0;}
    @Override public int yMax() {return sizeY-1;}

    public long getUniqueId() {return uniqueId;}
    public double getTimeStamp() {return timeStamp;}
    public F setUniqueId(long uniqueId) {
        this.uniqueId = uniqueId;
        return (F)this;
    }
    public F setTimeStamp(double timeStamp) {
        this.timeStamp = timeStamp;
        return (F)this;
    }

    public double getPixel(int x, int y) {return getPixel(x + y * sizeX);}
    public abstract double getPixel(int xy);
    public void setPixel(int x, int y, double value) {setPixel(x + y * sizeX, value);}
    public abstract void setPixel(int xy, double value);
    public void addPixel(int x, int y, double value) {addPixel(x + y * sizeX, value);}
    public abstract void addPixel(int xy, double value);
    /**
     * Sets all bins to zero
     */
    public abstract void reset();
    /**
     * @param name name of the copy
     * @return a detached copy of this frame, including unique id and time stamp
     */
    public abstract F duplicate(String name);
    public F duplicate() {return duplicate(name);}

    protected F copyMetadata(F other) {
        other.uniqueId = uniqueId;
        other.timeStamp = timeStamp;
        return other;
    }

    public DoubleStream stream() {
        return IntStream.range(0, sizeXY).mapToDouble(this::getPixel);
    }

    public double[] getMinAndMax() {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (int xy = 0; xy<sizeXY; ++xy) {
            double v = getPixel(xy);
            if (v<min) min = v;
            if (v>max) max = v;
        }
        return new double[]{min, max};
    }

    @Override
    public String toString() {
        return name+" ["+dataType+"] "+sizeX+"x"+sizeY+" id="+uniqueId;
    }
}
