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

import java.util.function.Consumer;

/**
 * Typed parameter access shared by clients and the acquisition loop.
 * Integer parameters include on/off flags (0/1) and enumerations (ordinal). Addressable parameters are accessed with an index in [0; max peaks).
 * Unknown keys, type mismatches, and indices out of range throw {@link IllegalArgumentException}
 */
public interface ParameterStore {
    int getInt(String key, int index);
    double getDouble(String key, int index);
    void setInt(String key, int index, int value);
    void setDouble(String key, int index, double value);
    /**
     * @param key parameter key
     * @param listener called with the new value each time the parameter (or any instance of an addressable parameter) is written, even if the value is unchanged
     */
    void addListener(String key, Consumer<Number> listener);
    void removeListener(String key, Consumer<Number> listener);

    default int getInt(String key) {return getInt(key, 0);}
    default double getDouble(String key) {return getDouble(key, 0);}
    default void setInt(String key, int value) {setInt(key, 0, value);}
    default void setDouble(String key, double value) {setDouble(key, 0, value);}

    default int getInt(SimPeaksParameter p) {return getInt(p.getKey(), 0);}
    default int getInt(SimPeaksParameter p, int index) {return getInt(p.getKey(), index);}
    default double getDouble(SimPeaksParameter p) {return getDouble(p.getKey(), 0);}
    default double getDouble(SimPeaksParameter p, int index) {return getDouble(p.getKey(), index);}
    default void setInt(SimPeaksParameter p, int value) {setInt(p.getKey(), 0, value);}
    default void setInt(SimPeaksParameter p, int index, int value) {setInt(p.getKey(), index, value);}
    default void setDouble(SimPeaksParameter p, double value) {setDouble(p.getKey(), 0, value);}
    default void setDouble(SimPeaksParameter p, int index, double value) {setDouble(p.getKey(), index, value);}
    default boolean getBoolean(SimPeaksParameter p) {return getInt(p)!=0;}
    default boolean getBoolean(SimPeaksParameter p, int index) {return getInt(p, index)!=0;}
    default void addListener(SimPeaksParameter p, Consumer<Number> listener) {addListener(p.getKey(), listener);}
}
