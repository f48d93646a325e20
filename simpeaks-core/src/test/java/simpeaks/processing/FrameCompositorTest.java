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

import org.junit.Test;
import simpeaks.image.DataType;
import simpeaks.image.Frame;
import simpeaks.image.FrameByte;
import simpeaks.image.FrameDouble;
import simpeaks.image.SimpleBoundingBox;
import simpeaks.processing.background.BackgroundSpec;
import simpeaks.processing.background.BackgroundType;
import simpeaks.processing.noise.NoiseGenerator;
import simpeaks.processing.noise.NoiseSpec;
import simpeaks.processing.noise.NoiseType;
import simpeaks.processing.peaks.PeakSpec;
import simpeaks.processing.peaks.PeakType1D;
import simpeaks.processing.peaks.PeakType2D;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.*;
import static simpeaks.test_utils.TestUtils.assertFrame;

public class FrameCompositorTest {
    final FrameCompositor compositor = new FrameCompositor(new NoiseGenerator(0));

    static FrameSettings settings1D(int sizeX, DataType type, NoiseSpec noise, FrameSettings.Peak... peaks) {
        return new FrameSettings(true, sizeX, 1, type, BackgroundSpec.NONE, BackgroundSpec.NONE, noise, Arrays.asList(peaks));
    }

    static FrameSettings.Peak gaussian(double pos, double amp) {
        return FrameSettings.Peak.of(PeakType1D.GAUSSIAN, PeakSpec.builder().setPosition(pos).setFwhm(2).setAmplitude(amp).build());
    }

    @Test
    public void testRepeatedFramesAreIdentical() {
        FrameSettings settings = settings1D(16, DataType.FLOAT64, NoiseSpec.NONE, gaussian(8, 10));
        FrameDouble frame = new FrameDouble("", 16, 1);
        compositor.compose(frame, settings, false, false);
        FrameDouble first = frame.duplicate();
        assertEquals("peak height", 10, first.getPixel(8), 1e-9);
        compositor.compose(frame, settings, false, false);
        assertFrame("second frame", first, frame, 0);
    }

    @Test
    public void testIntegrate() {
        FrameSettings settings = settings1D(16, DataType.FLOAT64, NoiseSpec.NONE, gaussian(8, 10));
        FrameDouble frame = new FrameDouble("", 16, 1);
        compositor.compose(frame, settings, true, true);
        compositor.compose(frame, settings, true, false);
        compositor.compose(frame, settings, true, false);
        assertEquals("accumulated", 30, frame.getPixel(8), 1e-9);
        compositor.compose(frame, settings, true, true);
        assertEquals("reset", 10, frame.getPixel(8), 1e-9);
    }

    @Test
    public void testSumOfPeaks() {
        FrameSettings.Peak square = FrameSettings.Peak.of(PeakType1D.SQUARE, PeakSpec.builder().setPosition(4).setFwhm(4).setAmplitude(3).build());
        FrameDouble both = new FrameDouble("", 16, 1);
        compositor.compose(both, settings1D(16, DataType.FLOAT64, NoiseSpec.NONE, gaussian(10, 5), square), false, false);
        FrameDouble expected = new FrameDouble("", 16, 1);
        compositor.compose(expected, settings1D(16, DataType.FLOAT64, NoiseSpec.NONE, gaussian(10, 5)), true, false);
        compositor.compose(expected, settings1D(16, DataType.FLOAT64, NoiseSpec.NONE, square), true, false);
        assertFrame("superposition", expected, both, 1e-12);
    }

    @Test
    public void testBounds() {
        PeakSpec spec = PeakSpec.builder().setPosition(8).setFwhm(4).setAmplitude(2).setBounds(new SimpleBoundingBox(0, 8, 0, 0)).build();
        FrameDouble frame = new FrameDouble("", 16, 1);
        compositor.compose(frame, settings1D(16, DataType.FLOAT64, NoiseSpec.NONE, FrameSettings.Peak.of(PeakType1D.SQUARE, spec)), false, false);
        assertEquals("before square", 0, frame.getPixel(6), 0);
        assertEquals("inside bounds", 2, frame.getPixel(7), 0);
        assertEquals("last bin of bounds", 2, frame.getPixel(8), 0);
        assertEquals("outside bounds", 0, frame.getPixel(9), 0);
        assertEquals("outside bounds", 0, frame.getPixel(10), 0);

        PeakSpec outside = PeakSpec.builder().setPosition(8).setFwhm(4).setAmplitude(2).setBounds(new SimpleBoundingBox(20, 30, 0, 0)).build();
        compositor.compose(frame, settings1D(16, DataType.FLOAT64, NoiseSpec.NONE, FrameSettings.Peak.of(PeakType1D.SQUARE, outside)), false, false);
        assertEquals("nothing rendered", 0, frame.stream().sum(), 0);
    }

    @Test
    public void testIntegerWrap() {
        FrameSettings.Peak square = FrameSettings.Peak.of(PeakType1D.SQUARE, PeakSpec.builder().setPosition(2).setFwhm(2).setAmplitude(200).build());
        FrameByte frame = new FrameByte("", 4, 1, false);
        compositor.compose(frame, settings1D(4, DataType.INT8, NoiseSpec.NONE, square), false, false);
        assertEquals("int8 wraps", -56, frame.getPixel(2), 0);
        assertEquals("outside", 0, frame.getPixel(0), 0);
    }

    @Test
    public void testBackground2D() {
        BackgroundSpec bgX = new BackgroundSpec(BackgroundType.POLYNOMIAL, 0, 1, 0, 0, 0);
        BackgroundSpec bgY = new BackgroundSpec(BackgroundType.POLYNOMIAL, 10, 0, 0, 0, 0);
        FrameSettings settings = new FrameSettings(false, 4, 3, DataType.FLOAT64, bgX, bgY, NoiseSpec.NONE, Collections.emptyList());
        Frame frame = Frame.createEmptyFrame("", 4, 3, DataType.FLOAT64);
        compositor.compose(frame, settings, false, false);
        for (int y = 0; y<3; ++y) {
            for (int x = 0; x<4; ++x) assertEquals("background at "+x+";"+y, 10 + x, frame.getPixel(x, y), 1e-12);
        }
    }

    @Test
    public void testBackground2DIntegerSum() {
        BackgroundSpec half = new BackgroundSpec(BackgroundType.POLYNOMIAL, 0.5, 0, 0, 0, 0);
        FrameSettings settings = new FrameSettings(false, 4, 3, DataType.INT32, half, half, NoiseSpec.NONE, Collections.emptyList());
        Frame frame = Frame.createEmptyFrame("", 4, 3, DataType.INT32);
        compositor.compose(frame, settings, false, false);
        for (int y = 0; y<3; ++y) {
            for (int x = 0; x<4; ++x) assertEquals("summed background at "+x+";"+y, 1, frame.getPixel(x, y), 0);
        }
    }

    @Test
    public void testBackgroundY1DIgnored() {
        BackgroundSpec bgY = new BackgroundSpec(BackgroundType.POLYNOMIAL, 10, 0, 0, 0, 0);
        FrameSettings settings = new FrameSettings(true, 4, 7, DataType.FLOAT64, BackgroundSpec.NONE, bgY, NoiseSpec.NONE, Collections.emptyList());
        assertEquals("1D height", 1, settings.getSizeY());
        FrameDouble frame = new FrameDouble("", 4, 1);
        compositor.compose(frame, settings, false, false);
        assertEquals("no Y background", 0, frame.stream().sum(), 0);
    }

    @Test
    public void testPeak2D() {
        PeakSpec spec = PeakSpec.builder().setPosition(3, 2).setFwhm(2, 2).setAmplitude(7).build();
        List<FrameSettings.Peak> peaks = Collections.singletonList(FrameSettings.Peak.of(PeakType2D.GAUSSIAN, spec));
        FrameSettings settings = new FrameSettings(false, 8, 6, DataType.FLOAT32, BackgroundSpec.NONE, BackgroundSpec.NONE, NoiseSpec.NONE, peaks);
        Frame frame = Frame.createEmptyFrame("", 8, 6, DataType.FLOAT32);
        compositor.compose(frame, settings, false, false);
        assertEquals("center", 7, frame.getPixel(3, 2), 1e-5);
        assertEquals("max at center", 7, frame.getMinAndMax()[1], 1e-5);
        assertEquals("symmetry", frame.getPixel(2, 2), frame.getPixel(4, 2), 1e-6);
    }

    @Test
    public void testNoise() {
        FrameDouble frame = new FrameDouble("", 64, 1);
        compositor.compose(frame, settings1D(64, DataType.FLOAT64, new NoiseSpec(NoiseType.UNIFORM, 1, false, 0, 0)), false, false);
        double[] mm = frame.getMinAndMax();
        assertTrue("noise range", mm[0]>=-1 && mm[1]<=1);
        assertTrue("noise present", mm[1] > mm[0]);
    }

    @Test(expected = NullPointerException.class)
    public void testNullFrame() {
        compositor.compose(null, settings1D(4, DataType.FLOAT64, NoiseSpec.NONE), false, false);
    }
}
