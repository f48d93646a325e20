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
package simpeaks.configuration;

import simpeaks.configuration.parameters.BooleanParameter;
import simpeaks.configuration.parameters.BoundedNumberParameter;
import simpeaks.configuration.parameters.EnumChoiceParameter;
import simpeaks.configuration.parameters.ParameterImpl;
import simpeaks.core.DetectorStatus;
import simpeaks.core.ImageMode;
import simpeaks.image.DataType;
import simpeaks.processing.background.BackgroundType;
import simpeaks.processing.noise.NoiseType;
import simpeaks.processing.peaks.PeakType1D;
import simpeaks.processing.peaks.PeakType2D;

import java.util.function.BiFunction;

/**
 * Catalogue of the parameters of a simulated detector.
 * Addressable parameters have one instance per peak. Read-back parameters are written by the acquisition loop and are not saved with the setup
 */
public enum SimPeaksParameter {
    // acquisition
    ACQUIRE("ADSP_ACQUIRE", false, true, (k, c) -> new BooleanParameter(k, false)),
    IMAGE_MODE("ADSP_IMAGE_MODE", false, false, (k, c) -> new EnumChoiceParameter<>(k, ImageMode.values(), ImageMode.SINGLE, ImageMode::getName)),
    NUM_IMAGES("ADSP_NUM_IMAGES", false, false, (k, c) -> new BoundedNumberParameter(k, 0, 1, 1, null)),
    ACQUIRE_PERIOD("ADSP_ACQUIRE_PERIOD", false, false, (k, c) -> new BoundedNumberParameter(k, 3, 1.0, 0.0, null)),
    ARRAY_CALLBACKS("ADSP_ARRAY_CALLBACKS", false, false, (k, c) -> new BooleanParameter(k, true)),
    DATA_TYPE("ADSP_DATA_TYPE", false, false, (k, c) -> new EnumChoiceParameter<>(k, DataType.values(), c.getDataType(), DataType::getName)),
    SIZE_X("ADSP_SIZE_X", false, false, (k, c) -> new BoundedNumberParameter(k, 0, c.getMaxSizeX(), 1, c.getMaxSizeX())),
    SIZE_Y("ADSP_SIZE_Y", false, false, (k, c) -> new BoundedNumberParameter(k, 0, maxSizeY(c), 1, maxSizeY(c))),
    INTEGRATE("ADSP_INTEGRATE", false, false, (k, c) -> new BooleanParameter(k, false)),
    RESET("ADSP_RESET", false, true, (k, c) -> new BooleanParameter(k, false)),
    // read-back
    STATUS("ADSP_STATUS", false, true, (k, c) -> new EnumChoiceParameter<>(k, DetectorStatus.values(), DetectorStatus.IDLE, DetectorStatus::getName)),
    ARRAY_COUNTER("ADSP_ARRAY_COUNTER", false, true, (k, c) -> new BoundedNumberParameter(k, 0, 0, 0, null)),
    NUM_IMAGES_COUNTER("ADSP_NUM_IMAGES_COUNTER", false, true, (k, c) -> new BoundedNumberParameter(k, 0, 0, 0, null)),
    TIMESTAMP("ADSP_TIMESTAMP", false, true, (k, c) -> new BoundedNumberParameter(k, 6, 0.0)),
    ELAPSED_TIME("ADSP_ELAPSED_TIME", false, true, (k, c) -> new BoundedNumberParameter(k, 6, 0.0, 0.0, null)),
    MAX_SIZE_X("ADSP_MAX_SIZE_X", false, true, (k, c) -> new BoundedNumberParameter(k, 0, c.getMaxSizeX(), c.getMaxSizeX(), c.getMaxSizeX())),
    MAX_SIZE_Y("ADSP_MAX_SIZE_Y", false, true, (k, c) -> new BoundedNumberParameter(k, 0, maxSizeY(c), maxSizeY(c), maxSizeY(c))),
    // background
    BG_TYPE_X("ADSP_BG_TYPE_X", false, false, (k, c) -> backgroundType(k)),
    BG_TYPE_Y("ADSP_BG_TYPE_Y", false, false, (k, c) -> backgroundType(k)),
    BG_C0_X("ADSP_BG_C0_X", false, false, (k, c) -> real(k, 0)),
    BG_C1_X("ADSP_BG_C1_X", false, false, (k, c) -> real(k, 0)),
    BG_C2_X("ADSP_BG_C2_X", false, false, (k, c) -> real(k, 0)),
    BG_C3_X("ADSP_BG_C3_X", false, false, (k, c) -> real(k, 0)),
    BG_SHIFT_X("ADSP_BG_SHIFT_X", false, false, (k, c) -> real(k, 0)),
    BG_C0_Y("ADSP_BG_C0_Y", false, false, (k, c) -> real(k, 0)),
    BG_C1_Y("ADSP_BG_C1_Y", false, false, (k, c) -> real(k, 0)),
    BG_C2_Y("ADSP_BG_C2_Y", false, false, (k, c) -> real(k, 0)),
    BG_C3_Y("ADSP_BG_C3_Y", false, false, (k, c) -> real(k, 0)),
    BG_SHIFT_Y("ADSP_BG_SHIFT_Y", false, false, (k, c) -> real(k, 0)),
    // noise
    NOISE_TYPE("ADSP_NOISE_TYPE", false, false, (k, c) -> new EnumChoiceParameter<>(k, NoiseType.values(), NoiseType.NONE, NoiseType::getName)),
    NOISE_LEVEL("ADSP_NOISE_LEVEL", false, false, (k, c) -> real(k, 0)),
    NOISE_CLAMP("ADSP_NOISE_CLAMP", false, false, (k, c) -> new BooleanParameter(k, false)),
    NOISE_LOWER("ADSP_NOISE_LOWER", false, false, (k, c) -> real(k, 0)),
    NOISE_UPPER("ADSP_NOISE_UPPER", false, false, (k, c) -> real(k, 0)),
    // peaks
    PEAK_TYPE_1D("ADSP_PEAK_TYPE_1D", true, false, (k, c) -> new EnumChoiceParameter<>(k, PeakType1D.values(), PeakType1D.NONE, PeakType1D::getName)),
    PEAK_TYPE_2D("ADSP_PEAK_TYPE_2D", true, false, (k, c) -> new EnumChoiceParameter<>(k, PeakType2D.values(), PeakType2D.NONE, PeakType2D::getName)),
    PEAK_POS_X("ADSP_PEAK_POS_X", true, false, (k, c) -> real(k, 0)),
    PEAK_POS_Y("ADSP_PEAK_POS_Y", true, false, (k, c) -> real(k, 0)),
    PEAK_FWHM_X("ADSP_PEAK_FWHM_X", true, false, (k, c) -> real(k, 1)),
    PEAK_FWHM_Y("ADSP_PEAK_FWHM_Y", true, false, (k, c) -> real(k, 1)),
    PEAK_AMP("ADSP_PEAK_AMP", true, false, (k, c) -> real(k, 0)),
    PEAK_COR("ADSP_PEAK_COR", true, false, (k, c) -> real(k, 0)),
    PEAK_P1("ADSP_PEAK_P1", true, false, (k, c) -> real(k, 0)),
    PEAK_P2("ADSP_PEAK_P2", true, false, (k, c) -> real(k, 0)),
    PEAK_BOUND("ADSP_PEAK_BOUND", true, false, (k, c) -> new BooleanParameter(k, false)),
    PEAK_MIN_X("ADSP_PEAK_MIN_X", true, false, (k, c) -> new BoundedNumberParameter(k, 0, 0)),
    PEAK_MAX_X("ADSP_PEAK_MAX_X", true, false, (k, c) -> new BoundedNumberParameter(k, 0, 0)),
    PEAK_MIN_Y("ADSP_PEAK_MIN_Y", true, false, (k, c) -> new BoundedNumberParameter(k, 0, 0)),
    PEAK_MAX_Y("ADSP_PEAK_MAX_Y", true, false, (k, c) -> new BoundedNumberParameter(k, 0, 0));

    private final String key;
    private final boolean addressable, readBack;
    private final BiFunction<String, SimPeaksConfig, ParameterImpl> factory;

    SimPeaksParameter(String key, boolean addressable, boolean readBack, BiFunction<String, SimPeaksConfig, ParameterImpl> factory) {
        this.key = key;
        this.addressable = addressable;
        this.readBack = readBack;
        this.factory = factory;
    }

    public String getKey() {
        return key;
    }

    /**
     * @return whether there is one instance of this parameter per peak
     */
    public boolean isAddressable() {
        return addressable;
    }

    /**
     * @return whether the parameter reflects the state of the detector (counters, status, command flags) rather than its setup
     */
    public boolean isReadBack() {
        return readBack;
    }

    /**
     * @return a new parameter instance holding the default value for {@param config}
     */
    public ParameterImpl createParameter(SimPeaksConfig config) {
        return factory.apply(key, config);
    }

    public static SimPeaksParameter fromKey(String key) {
        for (SimPeaksParameter p : values()) {
            if (p.key.equals(key)) return p;
        }
        throw new IllegalArgumentException("Unknown parameter: "+key);
    }

    static int maxSizeY(SimPeaksConfig config) {
        return config.is1D() ? 1 : config.getMaxSizeY();
    }

    static BoundedNumberParameter real(String key, double defaultValue) {
        return new BoundedNumberParameter(key, 6, defaultValue);
    }

    static EnumChoiceParameter<BackgroundType> backgroundType(String key) {
        return new EnumChoiceParameter<>(key, BackgroundType.values(), BackgroundType.NONE, BackgroundType::getName);
    }

    @Override
    public String toString() {
        return key;
    }
}
