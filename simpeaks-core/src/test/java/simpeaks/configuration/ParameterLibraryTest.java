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

import org.json.simple.JSONArray;
import org.json.simple.JSONObject;
import org.junit.Before;
import org.junit.Test;
import simpeaks.core.DetectorStatus;
import simpeaks.core.ImageMode;
import simpeaks.image.DataType;
import simpeaks.processing.peaks.PeakType1D;
import simpeaks.utils.JSONUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import static org.junit.Assert.*;
import static simpeaks.configuration.SimPeaksParameter.*;
import static simpeaks.test_utils.TestUtils.sleep;

public class ParameterLibraryTest {
    ParameterLibrary store;

    @Before
    public void setUp() {
        store = new ParameterLibrary(new SimPeaksConfig().setMaxSizeX(100).setMaxPeaks(3).setDataType(DataType.UINT16));
    }

    @Test
    public void testDefaults() {
        assertEquals("image mode", ImageMode.SINGLE.ordinal(), store.getInt(IMAGE_MODE));
        assertEquals("num images", 1, store.getInt(NUM_IMAGES));
        assertEquals("period", 1.0, store.getDouble(ACQUIRE_PERIOD), 0);
        assertTrue("callbacks", store.getBoolean(ARRAY_CALLBACKS));
        assertEquals("data type", DataType.UINT16.ordinal(), store.getInt(DATA_TYPE));
        assertEquals("size x", 100, store.getInt(SIZE_X));
        assertEquals("size y", 1, store.getInt(SIZE_Y));
        assertEquals("max size x", 100, store.getInt(MAX_SIZE_X));
        assertEquals("max size y in 1D", 1, store.getInt(MAX_SIZE_Y));
        assertEquals("status", DetectorStatus.IDLE.ordinal(), store.getInt(STATUS));
        assertEquals("fwhm", 1, store.getDouble(PEAK_FWHM_X, 2), 0);
        assertEquals("peak type", PeakType1D.NONE.ordinal(), store.getInt(PEAK_TYPE_1D, 1));
    }

    @Test
    public void testAddressable() {
        store.setDouble(PEAK_POS_X, 1, 12.5);
        assertEquals("index 1", 12.5, store.getDouble(PEAK_POS_X, 1), 0);
        assertEquals("index 0 untouched", 0, store.getDouble(PEAK_POS_X, 0), 0);
        assertEquals("by key", 12.5, store.getDouble("ADSP_PEAK_POS_X", 1), 0);
        try {
            store.getDouble(PEAK_POS_X, 3);
            fail("index out of range");
        } catch (IllegalArgumentException e) {}
        try {
            store.getInt(SIZE_X, 1);
            fail("index on a non-addressable parameter");
        } catch (IllegalArgumentException e) {}
    }

    @Test
    public void testTypeChecking() {
        try {
            store.getDouble(SIZE_X);
            fail("integer parameter read as double");
        } catch (IllegalArgumentException e) {}
        try {
            store.setInt(PEAK_AMP, 0, 3);
            fail("double parameter written as integer");
        } catch (IllegalArgumentException e) {}
        try {
            store.getInt("ADSP_UNKNOWN");
            fail("unknown key");
        } catch (IllegalArgumentException e) {}
        try {
            store.setInt(IMAGE_MODE, 3);
            fail("invalid enumeration value");
        } catch (IllegalArgumentException e) {}
        assertEquals("unchanged", ImageMode.SINGLE.ordinal(), store.getInt(IMAGE_MODE));
    }

    @Test
    public void testClamping() {
        store.setInt(SIZE_X, 1000);
        assertEquals("upper bound", 100, store.getInt(SIZE_X));
        store.setInt(SIZE_X, 0);
        assertEquals("lower bound", 1, store.getInt(SIZE_X));
        store.setInt(SIZE_Y, 20);
        assertEquals("1D", 1, store.getInt(SIZE_Y));
        store.setDouble(ACQUIRE_PERIOD, -2);
        assertEquals("negative period", 0, store.getDouble(ACQUIRE_PERIOD), 0);
        store.setInt(ACQUIRE, 5);
        assertEquals("boolean", 1, store.getInt(ACQUIRE));
    }

    @Test
    public void testListeners() {
        List<Number> values = new ArrayList<>();
        Consumer<Number> listener = values::add;
        store.addListener(NUM_IMAGES, listener);
        store.setInt(NUM_IMAGES, 5);
        store.setInt(NUM_IMAGES, 0);
        store.setInt(SIZE_X, 5);
        assertEquals("calls", 2, values.size());
        assertEquals("value", 5, values.get(0).intValue());
        assertEquals("clamped value", 1, values.get(1).intValue());
        store.removeListener(NUM_IMAGES.getKey(), listener);
        store.setInt(NUM_IMAGES, 3);
        assertEquals("removed", 2, values.size());
    }

    @Test
    public void testListenerCanWriteStore() {
        store.addListener(ACQUIRE, v -> store.setInt(STATUS, v.intValue()==1 ? DetectorStatus.ACQUIRE.ordinal() : DetectorStatus.IDLE.ordinal()));
        store.setInt(ACQUIRE, 1);
        assertEquals("status", DetectorStatus.ACQUIRE.ordinal(), store.getInt(STATUS));
    }

    @Test
    public void testNotificationsFollowWriteOrder() throws InterruptedException {
        List<Number> values = Collections.synchronizedList(new ArrayList<>());
        CountDownLatch firstNotified = new CountDownLatch(1);
        store.addListener(ACQUIRE, v -> {
            if (v.intValue()==1) {
                firstNotified.countDown();
                sleep(50);
            }
            values.add(v);
        });
        Thread writer = new Thread(() -> store.setInt(ACQUIRE, 1));
        writer.start();
        assertTrue("first write notified", firstNotified.await(2, TimeUnit.SECONDS));
        store.setInt(ACQUIRE, 0);
        writer.join(2000);
        assertEquals("notification order", Arrays.asList(1, 0), values);
        assertEquals("stored value", 0, store.getInt(ACQUIRE));
    }

    @Test
    public void testJSON() throws Exception {
        store.setInt(IMAGE_MODE, ImageMode.MULTIPLE.ordinal());
        store.setInt(NUM_IMAGES, 4);
        store.setInt(PEAK_TYPE_1D, 2, PeakType1D.LORENTZ.ordinal());
        store.setDouble(PEAK_AMP, 2, 7.25);
        store.setInt(ARRAY_COUNTER, 12);
        JSONObject json = JSONUtils.parse(JSONUtils.serialize(store));
        assertFalse("read-back parameters are not saved", json.containsKey(ARRAY_COUNTER.getKey()));
        assertEquals("enumeration saved by name", "Multiple", json.get(IMAGE_MODE.getKey()));
        assertEquals("one entry per peak", 3, ((JSONArray)json.get(PEAK_AMP.getKey())).size());

        ParameterLibrary other = new ParameterLibrary(store.getConfig());
        other.initFromJSONEntry(json);
        assertEquals("image mode", ImageMode.MULTIPLE.ordinal(), other.getInt(IMAGE_MODE));
        assertEquals("num images", 4, other.getInt(NUM_IMAGES));
        assertEquals("peak type", PeakType1D.LORENTZ.ordinal(), other.getInt(PEAK_TYPE_1D, 2));
        assertEquals("amplitude", 7.25, other.getDouble(PEAK_AMP, 2), 0);
        assertEquals("counter", 0, other.getInt(ARRAY_COUNTER));
    }

    @Test
    public void testJSONSingleValueForAllPeaks() throws Exception {
        store.initFromJSONEntry(JSONUtils.parse("{\"ADSP_PEAK_FWHM_X\": 3.5, \"ADSP_PEAK_TYPE_1D\": \"Gaussian\", \"ADSP_ARRAY_COUNTER\": 9, \"ADSP_FOO\": 1}"));
        for (int i = 0; i<3; ++i) {
            assertEquals("fwhm "+i, 3.5, store.getDouble(PEAK_FWHM_X, i), 0);
            assertEquals("type "+i, PeakType1D.GAUSSIAN.ordinal(), store.getInt(PEAK_TYPE_1D, i));
        }
        assertEquals("read-back ignored", 0, store.getInt(ARRAY_COUNTER));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testJSONInvalidValue() throws Exception {
        store.initFromJSONEntry(JSONUtils.parse("{\"ADSP_PEAK_AMP\": \"high\"}"));
    }

    @Test
    public void testParameterKeys() {
        assertEquals("from key", PEAK_COR, SimPeaksParameter.fromKey("ADSP_PEAK_COR"));
        assertTrue("addressable", PEAK_BOUND.isAddressable());
        assertFalse("not addressable", NOISE_LEVEL.isAddressable());
        assertTrue("read-back", TIMESTAMP.isReadBack());
        assertFalse("setup", INTEGRATE.isReadBack());
    }
}
