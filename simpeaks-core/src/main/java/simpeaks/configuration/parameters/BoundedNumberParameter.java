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
 * Number parameter whose written values are clamped to [lowerBound; upperBound] (null bound = unbounded)
 */
public class BoundedNumberParameter extends NumberParameter<BoundedNumberParameter> {
    Number lowerBound, upperBound;

    public BoundedNumberParameter(String name, int decimalPlaces, Number defaultValue) {
        this(name, decimalPlaces, defaultValue, null, null);
    }

    public BoundedNumberParameter(String name, int decimalPlaces, Number defaultValue, Number lowerBound, Number upperBound) {
        super(name, decimalPlaces, defaultValue);
        this.lowerBound=lowerBound;
        this.upperBound=upperBound;
    }

    @Override
    public void setValue(Number value) {
        if (lowerBound!=null && compare(value, lowerBound)<0) value=lowerBound;
        if (upperBound!=null && compare(value, upperBound)>0) value=upperBound;
        super.setValue(value);
    }

    public static int compare(Number a, Number b){
        if (a instanceof Double || b instanceof Double || a instanceof Float || b instanceof Float) return Double.compare(a.doubleValue(), b.doubleValue());
        else return Long.compare(a.longValue(), b.longValue());
    }
}
