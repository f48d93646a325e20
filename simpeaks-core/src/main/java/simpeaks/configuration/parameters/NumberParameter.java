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

import java.text.DecimalFormat;
import java.text.NumberFormat;
import java.util.Locale;

/**
 * Numeric parameter. decimalPlaces = 0 denotes an integer parameter: values are stored as {@link Long} and truncated on write
 */
public class NumberParameter<P extends NumberParameter<P>> extends ParameterImpl<P> {
    volatile Number value;
    int decimalPlaces;

    public NumberParameter(String name, int decimalPlaces) {
        super(name);
        this.decimalPlaces=decimalPlaces;
    }

    public NumberParameter(String name, int decimalPlaces, Number defaultValue) {
        this(name, decimalPlaces);
        this.value=convert(defaultValue);
    }

    public boolean isInteger() {
        return decimalPlaces==0;
    }

    protected Number convert(Number value) {
        if (value==null) return null;
        return isInteger() ? (Number)value.longValue() : (Number)value.doubleValue();
    }

    public Number getValue() {
        return value;
    }
    public int getIntValue() {return value.intValue();}

    public long getLongValue() {return value.longValue();}

    public double getDoubleValue() {return value.doubleValue();}

    public void setValue(Number value) {
        this.value=convert(value);
    }
    @Override
    public String toString() {
        return name+": "+ (value==null? "":trimDecimalPlaces(value, decimalPlaces));
    }

    @Override
    public Object toJSONEntry() {
        return value;
    }

    @Override
    public void initFromJSONEntry(Object jsonEntry) {
        if (!(jsonEntry instanceof Number)) throw new IllegalArgumentException("Parameter "+name+": a number is expected, found: "+jsonEntry);
        setValue((Number)jsonEntry);
    }

    public static String trimDecimalPlaces(Number n, int digits) {
        DecimalFormat df = (DecimalFormat)NumberFormat.getInstance(Locale.US);
        df.setMaximumFractionDigits(digits);
        return df.format(n);
    }
}
