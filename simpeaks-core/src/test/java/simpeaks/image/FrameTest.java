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

import org.junit.Test;

import static org.junit.Assert.*;

public class FrameTest {

    @Test
    public void testCreateEmptyFrame() {
        assertTrue("int8", Frame.createEmptyFrame("", 2, 1, DataType.INT8) instanceof FrameByte);
        assertTrue("uint8", Frame.createEmptyFrame("", 2, 1, DataType.UINT8) instanceof FrameByte);
        assertTrue("uint16", Frame.createEmptyFrame("", 2, 1, DataType.UINT16) instanceof FrameShort);
        assertTrue("int32", Frame.createEmptyFrame("", 2, 1, DataType.INT32) instanceof FrameInt);
        assertTrue("uint64", Frame.createEmptyFrame("", 2, 1, DataType.UINT64) instanceof FrameLong);
        assertTrue("float32", Frame.createEmptyFrame("", 2, 1, DataType.FLOAT32) instanceof FrameFloat);
        assertTrue("float64", Frame.createEmptyFrame("", 2, 1, DataType.FLOAT64) instanceof FrameDouble);
        Frame f = Frame.createEmptyFrame("f", 4, 3, DataType.UINT16);
        assertEquals("data type", DataType.UINT16, f.getDataType());
        assertEquals("size", 12, f.getSizeXY());
        assertEquals("byte size", 24, f.getByteSize());
        assertTrue("properties", f.sameProperties(4, 3, DataType.UINT16));
        assertFalse("properties type", f.sameProperties(4, 3, DataType.INT16));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidDimensions() {
        Frame.createEmptyFrame("", 0, 1, DataType.INT8);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidStorageType() {
        new FrameShort("", 1, 1, DataType.INT32);
    }

    @Test
    public void testNarrowingCast() {
        FrameByte signed = new FrameByte("", 3, 1, false);
        signed.addPixel(0, 200);
        assertEquals("int8 wraps", -56, signed.getPixel(0), 0);
        signed.addPixel(1, 2.9);
        assertEquals("truncation", 2, signed.getPixel(1), 0);
        signed.addPixel(2, -2.9);
        assertEquals("truncation toward zero", -2, signed.getPixel(2), 0);

        FrameByte unsigned = new FrameByte("", 1, 1, true);
        unsigned.addPixel(0, 200);
        assertEquals("uint8", 200, unsigned.getPixel(0), 0);
        unsigned.addPixel(0, 100);
        assertEquals("uint8 wraps", 44, unsigned.getPixel(0), 0);

        FrameShort s = new FrameShort("", 1, 1, DataType.UINT16);
        s.setPixel(0, 70000);
        assertEquals("uint16 wraps", 70000 - 65536, s.getPixel(0), 0);

        FrameInt i = new FrameInt("", 1, 1, DataType.UINT32);
        i.setPixel(0, -1);
        assertEquals("uint32 read as unsigned", 4294967295d, i.getPixel(0), 0);
        assertEquals("uint32 long value", 4294967295L, i.getPixelLong(0));
    }

    @Test
    public void testContributionsCastBeforeAccumulation() {
        FrameInt f = new FrameInt("", 1, 1, DataType.INT32);
        for (int k = 0; k<10; ++k) f.addPixel(0, 0.5);
        assertEquals("each contribution truncated", 0, f.getPixel(0), 0);
        FrameDouble d = new FrameDouble("", 1, 1);
        for (int k = 0; k<10; ++k) d.addPixel(0, 0.5);
        assertEquals("float accumulation", 5, d.getPixel(0), 1e-12);
    }

    @Test
    public void testUnsigned64() {
        FrameLong f = new FrameLong("", 2, 1, DataType.UINT64);
        f.setPixel(0, 0x1p63);
        assertEquals("2^63", 0x1p63, f.getPixel(0), 0);
        assertEquals("2^63 bits", Long.MIN_VALUE, f.getPixelLong(0));
        f.setPixel(1, 0x1p63 + 4096);
        assertEquals("2^63 + 4096", 0x1p63 + 4096, f.getPixel(1), 0);
        FrameLong signed = new FrameLong("", 1, 1, DataType.INT64);
        signed.setPixel(0, -5);
        assertEquals("int64", -5, signed.getPixel(0), 0);
    }

    @Test
    public void testDuplicateAndReset() {
        FrameFloat f = new FrameFloat("f", 3, 2);
        f.setPixel(1, 1, 4.5);
        f.setUniqueId(7).setTimeStamp(12.5);
        FrameFloat dup = f.duplicate("copy");
        assertEquals("name", "copy", dup.getName());
        assertEquals("value", 4.5, dup.getPixel(1, 1), 0);
        assertEquals("id", 7, dup.getUniqueId());
        assertEquals("time stamp", 12.5, dup.getTimeStamp(), 0);
        f.reset();
        assertEquals("reset", 0, f.getPixel(1, 1), 0);
        assertEquals("duplicate is detached", 4.5, dup.getPixel(1, 1), 0);
    }

    @Test
    public void testMinAndMax() {
        FrameShort f = new FrameShort("", 4, 1, DataType.INT16);
        f.setPixel(0, -3);
        f.setPixel(2, 8);
        assertArrayEquals("min and max", new double[]{-3, 8}, f.getMinAndMax(), 0);
        assertEquals("stream", 5, f.stream().sum(), 0);
    }
}
