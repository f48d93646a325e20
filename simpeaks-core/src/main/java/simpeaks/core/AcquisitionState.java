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

/**
 * Snapshot of the acquisition state of a detector
 */
public class AcquisitionState {
    final boolean acquiring;
    final ImageMode imageMode;
    final int framesCompleted;
    final double elapsedSinceStart;

    public AcquisitionState(boolean acquiring, ImageMode imageMode, int framesCompleted, double elapsedSinceStart) {
        this.acquiring = acquiring;
        this.imageMode = imageMode;
        this.framesCompleted = framesCompleted;
        this.elapsedSinceStart = elapsedSinceStart;
    }

    public boolean isAcquiring() {
        return acquiring;
    }

    public ImageMode getImageMode() {
        return imageMode;
    }

    /**
     * @return number of frames produced since the start of the current (or last) acquisition
     */
    public int getFramesCompleted() {
        return framesCompleted;
    }

    /**
     * @return time in seconds between the start of the current (or last) acquisition and its last frame
     */
    public double getElapsedSinceStart() {
        return elapsedSinceStart;
    }

    @Override
    public String toString() {
        return (acquiring ? "Acquiring" : "Idle") + " mode=" + imageMode + " frames=" + framesCompleted + " elapsed=" + elapsedSinceStart + "s";
    }
}
