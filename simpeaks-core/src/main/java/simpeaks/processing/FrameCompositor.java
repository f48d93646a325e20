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
package simpeaks.processing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import simpeaks.image.BoundingBox;
import simpeaks.image.Frame;
import simpeaks.processing.background.BackgroundGenerator;
import simpeaks.processing.background.BackgroundSpec;
import simpeaks.processing.background.BackgroundType;
import simpeaks.processing.noise.NoiseGenerator;
import simpeaks.processing.noise.NoiseSpec;
import simpeaks.processing.peaks.PeakNormalization;
import simpeaks.processing.peaks.PeakSpec;

/**
 * Renders background, peaks and noise into a frame.
 * Every contribution is converted to the element type of the frame before being accumulated
 */
public class FrameCompositor {
    public final static Logger logger = LoggerFactory.getLogger(FrameCompositor.class);
    final NoiseGenerator noiseGenerator;

    public FrameCompositor(NoiseGenerator noiseGenerator) {
        this.noiseGenerator = noiseGenerator;
    }

    /**
     * @param frame destination, with the geometry given by {@param settings}
     * @param settings content of the frame
     * @param integrate whether contributions are added to the previous content of the frame
     * @param needsReset whether the frame must be zeroed even when integrating. The caller is responsible for clearing its reset request
     */
    public void compose(Frame frame, FrameSettings settings, boolean integrate, boolean needsReset) {
        if (frame == null) throw new NullPointerException("Frame cannot be null");
        if (!integrate || needsReset) frame.reset();
        addBackground(frame, settings);
        for (FrameSettings.Peak peak : settings.getPeaks()) addPeak(frame, peak, settings.isOneDimensional());
        addNoise(frame, settings.getNoise());
    }

    static void addBackground(Frame frame, FrameSettings settings) {
        BackgroundSpec bgX = settings.getBackgroundX();
        BackgroundSpec bgY = settings.getBackgroundY();
        boolean hasX = bgX.getType()!=BackgroundType.NONE;
        boolean hasY = !settings.isOneDimensional() && bgY.getType()!=BackgroundType.NONE;
        if (hasX && hasY) BoundingBox.loop(frame, (x, y) -> frame.addPixel(x, y, BackgroundGenerator.value(bgX, bgY, x, y))); // sum converted once per bin
        else if (hasX) BoundingBox.loop(frame, (x, y) -> frame.addPixel(x, y, BackgroundGenerator.value(bgX, x)));
        else if (hasY) BoundingBox.loop(frame, (x, y) -> frame.addPixel(x, y, BackgroundGenerator.value(bgY, y)));
    }

    static void addPeak(Frame frame, FrameSettings.Peak peak, boolean oneDimensional) {
        if (!peak.isEnabled()) return;
        PeakSpec spec = peak.getSpec();
        BoundingBox area = frame;
        if (spec.hasBounds()) {
            area = BoundingBox.getIntersection2D(spec.getBounds(), frame);
            if (!area.isValid()) {
                logger.trace("peak {} outside of frame", peak);
                return;
            }
        }
        if (oneDimensional) {
            double scale = PeakNormalization.scale(peak.getType1D(), spec);
            BoundingBox.loop(area, (x, y) -> frame.addPixel(x, y, scale * peak.getType1D().value(spec, x)));
        } else {
            double scale = PeakNormalization.scale(peak.getType2D(), spec);
            BoundingBox.loop(area, (x, y) -> frame.addPixel(x, y, scale * peak.getType2D().value(spec, x, y)));
        }
    }

    void addNoise(Frame frame, NoiseSpec noise) {
        if (!noise.isEnabled()) return;
        for (int xy = 0; xy<frame.getSizeXY(); ++xy) frame.addPixel(xy, noiseGenerator.next(noise));
    }
}
