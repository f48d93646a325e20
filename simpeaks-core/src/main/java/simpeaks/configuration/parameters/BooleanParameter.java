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

/**
 * On/off parameter, exchanged as an integer (0 = false, any other value = true)
 */
public class BooleanParameter extends ParameterImpl<BooleanParameter> {
    volatile boolean value;

    public BooleanParameter(String name, boolean defaultValue) {
        super(name);
        this.value = defaultValue;
    }
    public boolean getSelected() {
        return value;
    }
    public void setSelected(boolean value) {
        this.value = value;
    }
    public int getIntValue() {
        return value ? 1 : 0;
    }
    public void setValue(Number value) {
        setSelected(value.intValue()!=0);
    }
    @Override
    public Object toJSONEntry() {
        return value;
    }
    @Override
    public void initFromJSONEntry(Object jsonEntry) {
        if (jsonEntry instanceof Boolean) setSelected((Boolean)jsonEntry);
        else if (jsonEntry instanceof Number) setValue((Number)jsonEntry);
        else throw new IllegalArgumentException("Parameter "+name+": a boolean is expected, found: "+jsonEntry);
    }
    @Override
    public String toString() {
        return name+": "+value;
    }
}
