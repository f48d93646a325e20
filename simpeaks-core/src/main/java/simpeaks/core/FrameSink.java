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

import simpeaks.image.Frame;

/**
 * Receives each frame produced while array callbacks are enabled.
 * Called from the acquisition thread. Unless the detector integrates, the published frame is the working buffer of the detector and is overwritten by the next frame: implementations keeping it must duplicate it
 */
@FunctionalInterface
public interface FrameSink {
    void publish(Frame frame, long uniqueId, double timeStamp);
}
