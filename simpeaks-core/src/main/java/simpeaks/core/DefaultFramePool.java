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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import simpeaks.image.DataType;
import simpeaks.image.Frame;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

/**
 * In-memory pool limiting the number of frames in use and the memory they occupy. Released frames are kept and reused for identical requests (same geometry and data type).
 * At most max(1, maxBuffers) released frames are kept.
 * Copies are not accounted for.
 */
public class DefaultFramePool implements FramePool {
    public final static Logger logger = LoggerFactory.getLogger(DefaultFramePool.class);
    final int maxBuffers;
    final long maxMemory;
    final Set<Frame> inUse = Collections.newSetFromMap(new IdentityHashMap<>());
    final List<Frame> free = new ArrayList<>();
    long memory;

    /**
     * @param maxBuffers maximum number of frames in use, 0 for no limit
     * @param maxMemory maximum number of bytes held by the pool (frames in use and released frames), 0 for no limit
     */
    public DefaultFramePool(int maxBuffers, long maxMemory) {
        if (maxBuffers<0 || maxMemory<0) throw new IllegalArgumentException("Limits cannot be negative");
        this.maxBuffers = maxBuffers;
        this.maxMemory = maxMemory;
    }

    @Override
    public synchronized Frame allocate(int sizeX, int sizeY, DataType dataType) {
        if (maxBuffers>0 && inUse.size()>=maxBuffers) {
            logger.warn("cannot allocate frame: {} buffers in use", inUse.size());
            return null;
        }
        Iterator<Frame> it = free.iterator();
        while (it.hasNext()) {
            Frame f = it.next();
            if (f.sameProperties(sizeX, sizeY, dataType)) {
                it.remove();
                f.reset();
                f.setUniqueId(0).setTimeStamp(0);
                inUse.add(f);
                return f;
            }
        }
        long size = (long)sizeX * sizeY * dataType.byteCount();
        if (maxMemory>0) {
            // drop released frames until the new one fits
            while (memory + size > maxMemory && !free.isEmpty()) {
                Frame f = free.remove(0);
                memory -= f.getByteSize();
            }
            if (memory + size > maxMemory) {
                logger.warn("cannot allocate frame of {} bytes: {} bytes used / {}", size, memory, maxMemory);
                return null;
            }
        }
        Frame f = Frame.createEmptyFrame("frame", sizeX, sizeY, dataType);
        memory += size;
        inUse.add(f);
        logger.debug("allocated frame {} ({} bytes in pool)", f, memory);
        return f;
    }

    @Override
    public synchronized void release(Frame frame) {
        if (frame==null) return;
        if (!inUse.remove(frame)) {
            logger.warn("frame {} does not belong to the pool", frame);
            return;
        }
        free.add(frame);
        // at most max(1, maxBuffers) released frames are kept, the oldest are dropped first
        int maxFree = Math.max(1, maxBuffers);
        while (free.size() > maxFree) {
            Frame f = free.remove(0);
            memory -= f.getByteSize();
            logger.debug("dropped released frame {}", f);
        }
    }

    @Override
    public Frame copy(Frame frame) {
        return frame.duplicate();
    }

    public synchronized int getNumberOfFramesInUse() {
        return inUse.size();
    }

    public synchronized int getNumberOfFreeFrames() {
        return free.size();
    }

    public synchronized long getMemory() {
        return memory;
    }

    /**
     * Drops released frames
     */
    public synchronized void clear() {
        for (Frame f : free) memory -= f.getByteSize();
        free.clear();
    }
}
