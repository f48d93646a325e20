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

import simpeaks.image.DataType;
import simpeaks.image.Frame;

/**
 * Source of frame buffers
 */
public interface FramePool {
    /**
     * @return a zeroed frame, or null if the pool cannot provide one (buffer count or memory limit reached)
     */
    Frame allocate(int sizeX, int sizeY, DataType dataType);

    /**
     * Returns {@param frame} to the pool
     */
    void release(Frame frame);

    /**
     * @return a detached copy of {@param frame}, owned by the caller
     */
    Frame copy(Frame frame);
}
