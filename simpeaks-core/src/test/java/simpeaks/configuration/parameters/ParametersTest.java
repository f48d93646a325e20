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
package simpeaks.configuration.parameters;

import org.json.simple.JSONArray;
import org.junit.Test;
import simpeaks.core.ImageMode;

import java.util.Arrays;

import static org.junit.Assert.*;

public class ParametersTest {
    @Test
    public void testBoundedNumberParameter() {
        BoundedNumberParameter p = new BoundedNumberParameter("n", 0, 5, 1, 10);
        assertTrue("integer", p.isInteger());
        assertTrue("stored as long", p.getValue() instanceof Long);
        p.setValue(2.7);
        assertEquals("truncated", 2, p.getIntValue());
        p.setValue(20);
        assertEquals("upper bound", 10, p.getIntValue());
        p.setValue(-20);
        assertEquals("lower bound", 1, p.getIntValue());
        BoundedNumberParameter d = new BoundedNumberParameter("d", 3, 1.5, 0.0, null);
        d.setValue(1e9);
        assertEquals("no upper bound", 1e9, d.getDoubleValue(), 0);
        assertEquals("display", "d: 0.123", new BoundedNumberParameter("d", 3, 0.12345).toString());
        d.setValue(-1);
        assertEquals("lower bound only", 0, d.getDoubleValue(), 0);
    }

    @Test
    public void testNumberJSON() {
        BoundedNumberParameter p = new BoundedNumberParameter("n", 2, 0);
        assertEquals("json", 0.0, p.toJSONEntry());
        p.initFromJSONEntry(5.5);
        assertEquals("json sets value", 5.5, p.getDoubleValue(), 0);
        try {
            p.initFromJSONEntry("x");
            fail("not a number");
        } catch (IllegalArgumentException e) {}
    }

    @Test
    public void testBooleanParameter() {
        BooleanParameter b = new BooleanParameter("b", false);
        b.setValue(3);
        assertTrue("non zero", b.getSelected());
        assertEquals("int value", 1, b.getIntValue());
        b.initFromJSONEntry(Boolean.FALSE);
        assertFalse("json boolean", b.getSelected());
        b.initFromJSONEntry(1L);
        assertTrue("json number", b.getSelected());
    }

    @Test
    public void testEnumChoiceParameter() {
        EnumChoiceParameter<ImageMode> p = new EnumChoiceParameter<>("mode", ImageMode.values(), ImageMode.SINGLE, ImageMode::getName);
        p.setSelectedIndex(2);
        assertEquals("by index", ImageMode.CONTINUOUS, p.getSelectedEnum());
        p.setSelectedItem("Multiple");
        assertEquals("by display name", ImageMode.MULTIPLE, p.getSelectedEnum());
        p.setSelectedItem("SINGLE");
        assertEquals("by constant name", ImageMode.SINGLE, p.getSelectedEnum());
        assertEquals("json", "Single", p.toJSONEntry());
        p.initFromJSONEntry(1L);
        assertEquals("json ordinal", 1, p.getSelectedIndex());
        try {
            p.setSelectedIndex(3);
            fail("invalid index");
        } catch (IllegalArgumentException e) {}
        try {
            p.setSelectedItem("Burst");
            fail("invalid item");
        } catch (IllegalArgumentException e) {}
        assertEquals("unchanged", ImageMode.MULTIPLE, p.getSelectedEnum());
    }

    @Test
    public void testIndexedParameter() {
        IndexedParameter<BoundedNumberParameter> p = new IndexedParameter<>("amp", () -> new BoundedNumberParameter("amp", 4, 1.0), 3);
        assertEquals("size", 3, p.size());
        p.get(1).setValue(5);
        assertEquals("independent instances", 1, p.get(0).getDoubleValue(), 0);
        JSONArray json = (JSONArray)p.toJSONEntry();
        assertEquals("json", Arrays.asList(1.0, 5.0, 1.0), json);
        p.initFromJSONEntry(2.0);
        for (int i = 0; i<3; ++i) assertEquals("single value at "+i, 2, p.get(i).getDoubleValue(), 0);
        p.initFromJSONEntry(Arrays.asList(7.0, 8.0));
        assertEquals("array", 8, p.get(1).getDoubleValue(), 0);
        assertEquals("missing values keep their value", 2, p.get(2).getDoubleValue(), 0);
        try {
            p.get(3);
            fail("out of range");
        } catch (IllegalArgumentException e) {}
    }
}
