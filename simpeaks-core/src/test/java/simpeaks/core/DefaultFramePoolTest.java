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
package simpeaks.core;

import org.junit.Test;
import simpeaks.image.DataType;
import simpeaks.image.Frame;
import simpeaks.image.FrameShort;

import static org.junit.Assert.*;

public class DefaultFramePoolTest {
    @Test
    public void testAllocate() {
        DefaultFramePool pool = new DefaultFramePool(0, 0);
        Frame f = pool.allocate(8, 4, DataType.UINT16);
        assertTrue("storage", f instanceof FrameShort);
        assertTrue("geometry", f.sameProperties(8, 4, DataType.UINT16));
        assertEquals("memory", 64, pool.getMemory());
        assertEquals("in use", 1, pool.getNumberOfFramesInUse());
    }

    @Test
    public void testReuse() {
        DefaultFramePool pool = new DefaultFramePool(0, 0);
        Frame f = pool.allocate(8, 1, DataType.FLOAT64);
        f.setPixel(3, 5);
        pool.release(f);
        assertEquals("free", 1, pool.getNumberOfFreeFrames());
        Frame other = pool.allocate(4, 1, DataType.FLOAT64);
        assertNotSame("different geometry", f, other);
        Frame same = pool.allocate(8, 1, DataType.FLOAT64);
        assertSame("reused", f, same);
        assertEquals("reset on reuse", 0, same.getPixel(3), 0);
        assertEquals("memory", 96, pool.getMemory());
    }

    @Test
    public void testMaxBuffers() {
        DefaultFramePool pool = new DefaultFramePool(2, 0);
        Frame f1 = pool.allocate(2, 2, DataType.INT8);
        assertNotNull("first", f1);
        assertNotNull("second", pool.allocate(2, 2, DataType.INT8));
        assertNull("exhausted", pool.allocate(2, 2, DataType.INT8));
        pool.release(f1);
        assertNotNull("released buffer available", pool.allocate(2, 2, DataType.INT8));
    }

    @Test
    public void testMaxMemory() {
        DefaultFramePool pool = new DefaultFramePool(0, 100);
        Frame f = pool.allocate(10, 1, DataType.FLOAT64);
        assertNotNull("80 bytes", f);
        assertNull("160 bytes", pool.allocate(10, 1, DataType.FLOAT64));
        pool.release(f);
        Frame small = pool.allocate(6, 1, DataType.INT32);
        assertNotNull("released frame evicted", small);
        assertEquals("memory after eviction", 24, pool.getMemory());
        assertEquals("no free frame", 0, pool.getNumberOfFreeFrames());
        assertNull("too large for the pool", pool.allocate(200, 1, DataType.INT8));
    }

    @Test
    public void testReleasedFramesAreBounded() {
        DefaultFramePool pool = new DefaultFramePool(0, 0);
        for (int sizeX = 1; sizeX<=200; ++sizeX) pool.release(pool.allocate(sizeX, 1, DataType.FLOAT64));
        assertEquals("one released frame kept", 1, pool.getNumberOfFreeFrames());
        assertEquals("memory of the last frame", 200 * 8, pool.getMemory());

        DefaultFramePool bounded = new DefaultFramePool(3, 0);
        for (int sizeX = 1; sizeX<=10; ++sizeX) bounded.release(bounded.allocate(sizeX, 1, DataType.INT8));
        assertEquals("max buffers released frames kept", 3, bounded.getNumberOfFreeFrames());
        assertEquals("memory of the last frames", 8 + 9 + 10, bounded.getMemory());
    }

    @Test
    public void testCopyIsNotTracked() {
        DefaultFramePool pool = new DefaultFramePool(1, 0);
        Frame f = pool.allocate(3, 1, DataType.FLOAT32);
        f.setPixel(1, 2);
        Frame copy = pool.copy(f);
        assertNotSame("copy", f, copy);
        assertEquals("copied value", 2, copy.getPixel(1), 0);
        assertEquals("in use", 1, pool.getNumberOfFramesInUse());
        pool.release(copy);
        assertEquals("foreign frame ignored", 0, pool.getNumberOfFreeFrames());
        pool.release(f);
        pool.clear();
        assertEquals("cleared", 0, pool.getMemory());
    }
}
