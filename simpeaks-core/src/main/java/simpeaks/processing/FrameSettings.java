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

import simpeaks.configuration.ParameterStore;
import simpeaks.configuration.SimPeaksParameter;
import simpeaks.image.BoundingBox;
import simpeaks.image.DataType;
import simpeaks.image.SimpleBoundingBox;
import simpeaks.processing.background.BackgroundSpec;
import simpeaks.processing.background.BackgroundType;
import simpeaks.processing.noise.NoiseSpec;
import simpeaks.processing.noise.NoiseType;
import simpeaks.processing.peaks.PeakSpec;
import simpeaks.processing.peaks.PeakType1D;
import simpeaks.processing.peaks.PeakType2D;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static simpeaks.configuration.SimPeaksParameter.*;

/**
 * Snapshot of everything needed to compute one frame. Each field is read independently from the parameter store
 */
public class FrameSettings {
    final boolean oneDimensional;
    final int sizeX, sizeY;
    final DataType dataType;
    final BackgroundSpec backgroundX, backgroundY;
    final NoiseSpec noise;
    final List<Peak> peaks;

    public FrameSettings(boolean oneDimensional, int sizeX, int sizeY, DataType dataType, BackgroundSpec backgroundX, BackgroundSpec backgroundY, NoiseSpec noise, List<Peak> peaks) {
        this.oneDimensional = oneDimensional;
        this.sizeX = sizeX;
        this.sizeY = oneDimensional ? 1 : sizeY;
        this.dataType = dataType;
        this.backgroundX = backgroundX;
        this.backgroundY = oneDimensional ? BackgroundSpec.NONE : backgroundY;
        this.noise = noise;
        this.peaks = Collections.unmodifiableList(new ArrayList<>(peaks));
    }

    /**
     * Reads the settings of the next frame
     * @param store parameter source
     * @param maxPeaks number of instances of addressable parameters
     * @param oneDimensional whether 1D peak shapes are used and the Y axis is ignored
     * @return settings of the next frame, containing only enabled peaks
     * @throws IllegalArgumentException if an enumeration value read from {@param store} is invalid
     */
    public static FrameSettings read(ParameterStore store, int maxPeaks, boolean oneDimensional) {
        int sizeX = store.getInt(SIZE_X);
        int sizeY = oneDimensional ? 1 : store.getInt(SIZE_Y);
        DataType dataType = DataType.fromOrdinal(store.getInt(DATA_TYPE));
        BackgroundSpec bgX = readBackground(store, BG_TYPE_X, BG_C0_X, BG_C1_X, BG_C2_X, BG_C3_X, BG_SHIFT_X);
        BackgroundSpec bgY = oneDimensional ? BackgroundSpec.NONE : readBackground(store, BG_TYPE_Y, BG_C0_Y, BG_C1_Y, BG_C2_Y, BG_C3_Y, BG_SHIFT_Y);
        NoiseSpec noise = new NoiseSpec(NoiseType.fromOrdinal(store.getInt(NOISE_TYPE)), store.getDouble(NOISE_LEVEL), store.getBoolean(NOISE_CLAMP), store.getDouble(NOISE_LOWER), store.getDouble(NOISE_UPPER));
        List<Peak> peaks = new ArrayList<>();
        for (int i = 0; i<maxPeaks; ++i) {
            Peak peak = oneDimensional ? new Peak(PeakType1D.fromOrdinal(store.getInt(PEAK_TYPE_1D, i)), null, null) : new Peak(null, PeakType2D.fromOrdinal(store.getInt(PEAK_TYPE_2D, i)), null);
            if (!peak.isEnabled()) continue;
            PeakSpec.Builder builder = PeakSpec.builder()
                    .setPosition(store.getDouble(PEAK_POS_X, i), store.getDouble(PEAK_POS_Y, i))
                    .setFwhm(store.getDouble(PEAK_FWHM_X, i), store.getDouble(PEAK_FWHM_Y, i))
                    .setAmplitude(store.getDouble(PEAK_AMP, i))
                    .setCorrelation(store.getDouble(PEAK_COR, i))
                    .setParams(store.getDouble(PEAK_P1, i), store.getDouble(PEAK_P2, i));
            if (store.getBoolean(PEAK_BOUND, i)) {
                BoundingBox bounds = oneDimensional ? new SimpleBoundingBox(store.getInt(PEAK_MIN_X, i), store.getInt(PEAK_MAX_X, i), 0, 0)
                        : new SimpleBoundingBox(store.getInt(PEAK_MIN_X, i), store.getInt(PEAK_MAX_X, i), store.getInt(PEAK_MIN_Y, i), store.getInt(PEAK_MAX_Y, i));
                builder.setBounds(bounds);
            }
            peaks.add(new Peak(peak.type1D, peak.type2D, builder.build()));
        }
        return new FrameSettings(oneDimensional, sizeX, sizeY, dataType, bgX, bgY, noise, peaks);
    }

    static BackgroundSpec readBackground(ParameterStore store, SimPeaksParameter type, SimPeaksParameter c0, SimPeaksParameter c1, SimPeaksParameter c2, SimPeaksParameter c3, SimPeaksParameter shift) {
        return new BackgroundSpec(BackgroundType.fromOrdinal(store.getInt(type)), store.getDouble(c0), store.getDouble(c1), store.getDouble(c2), store.getDouble(c3), store.getDouble(shift));
    }

    public boolean isOneDimensional() {return oneDimensional;}
    public int getSizeX() {return sizeX;}
    public int getSizeY() {return sizeY;}
    public DataType getDataType() {return dataType;}
    public BackgroundSpec getBackgroundX() {return backgroundX;}
    public BackgroundSpec getBackgroundY() {return backgroundY;}
    public NoiseSpec getNoise() {return noise;}
    public List<Peak> getPeaks() {return peaks;}

    /**
     * A peak and the shape it is rendered with: the 1D shape for 1D frames, the 2D shape otherwise
     */
    public static class Peak {
        final PeakType1D type1D;
        final PeakType2D type2D;
        final PeakSpec spec;

        public Peak(PeakType1D type1D, PeakType2D type2D, PeakSpec spec) {
            this.type1D = type1D;
            this.type2D = type2D;
            this.spec = spec;
        }
        public static Peak of(PeakType1D type, PeakSpec spec) {
            return new Peak(type, null, spec);
        }
        public static Peak of(PeakType2D type, PeakSpec spec) {
            return new Peak(null, type, spec);
        }
        public PeakType1D getType1D() {return type1D;}
        public PeakType2D getType2D() {return type2D;}
        public PeakSpec getSpec() {return spec;}
        public boolean isEnabled() {
            return (type1D!=null && type1D!=PeakType1D.NONE) || (type2D!=null && type2D!=PeakType2D.NONE);
        }
        @Override
        public String toString() {
            return (type1D!=null ? type1D : type2D) + " " + spec;
        }
    }
}
