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

import org.json.simple.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import simpeaks.configuration.parameters.BooleanParameter;
import simpeaks.configuration.parameters.EnumChoiceParameter;
import simpeaks.configuration.parameters.IndexedParameter;
import simpeaks.configuration.parameters.NumberParameter;
import simpeaks.configuration.parameters.ParameterImpl;
import simpeaks.utils.JSONSerializable;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory {@link ParameterStore} holding one parameter per {@link SimPeaksParameter}, addressable parameters having {@link SimPeaksConfig#getMaxPeaks()} instances.
 * Accesses are synchronized on the library. Listeners are called by the writing thread, outside of the library lock.
 * Writes to the same key and the notifications they trigger are serialized, so listeners of a key receive values in the order they were stored.
 */
public class ParameterLibrary implements ParameterStore, JSONSerializable {
    public final static Logger logger = LoggerFactory.getLogger(ParameterLibrary.class);
    final SimPeaksConfig config;
    final Map<SimPeaksParameter, ParameterImpl> parameters = new EnumMap<>(SimPeaksParameter.class);
    final Map<String, List<Consumer<Number>>> listeners = new HashMap<>();
    final Map<String, Object> keyLocks = new ConcurrentHashMap<>();

    public ParameterLibrary(SimPeaksConfig config) {
        this.config = config;
        for (SimPeaksParameter p : SimPeaksParameter.values()) {
            ParameterImpl param = p.isAddressable() ? new IndexedParameter(p.getKey(), () -> p.createParameter(config), config.getMaxPeaks()) : p.createParameter(config);
            parameters.put(p, param);
        }
    }

    public SimPeaksConfig getConfig() {
        return config;
    }

    public int getMaxPeaks() {
        return config.getMaxPeaks();
    }

    /**
     * @return the parameter addressed by {@param key} and {@param index}
     * @throws IllegalArgumentException for an unknown key or an index out of range
     */
    protected ParameterImpl getParameter(String key, int index) {
        SimPeaksParameter p = SimPeaksParameter.fromKey(key);
        ParameterImpl param = parameters.get(p);
        if (param instanceof IndexedParameter) return ((IndexedParameter)param).get(index);
        if (index!=0) throw new IllegalArgumentException("Parameter "+key+" is not addressable, invalid index: "+index);
        return param;
    }

    @Override
    public synchronized int getInt(String key, int index) {
        ParameterImpl param = getParameter(key, index);
        if (param instanceof BooleanParameter) return ((BooleanParameter)param).getIntValue();
        if (param instanceof EnumChoiceParameter) return ((EnumChoiceParameter)param).getSelectedIndex();
        if (param instanceof NumberParameter && ((NumberParameter)param).isInteger()) return ((NumberParameter)param).getIntValue();
        throw new IllegalArgumentException("Parameter "+key+" is not an integer parameter");
    }

    @Override
    public synchronized double getDouble(String key, int index) {
        ParameterImpl param = getParameter(key, index);
        if (param instanceof NumberParameter && !((NumberParameter)param).isInteger()) return ((NumberParameter)param).getDoubleValue();
        throw new IllegalArgumentException("Parameter "+key+" is not a floating point parameter");
    }

    /**
     * Enumeration parameters reject values that are not an ordinal of their enumeration, bounded parameters clamp the value to their range
     */
    @Override
    public void setInt(String key, int index, int value) {
        synchronized (keyLock(key)) {
            Number stored;
            synchronized (this) {
                ParameterImpl param = getParameter(key, index);
                if (param instanceof BooleanParameter) ((BooleanParameter)param).setValue(value);
                else if (param instanceof EnumChoiceParameter) ((EnumChoiceParameter)param).setSelectedIndex(value);
                else if (param instanceof NumberParameter && ((NumberParameter)param).isInteger()) ((NumberParameter)param).setValue(value);
                else throw new IllegalArgumentException("Parameter "+key+" is not an integer parameter");
                stored = getInt(key, index);
            }
            fireListeners(key, stored);
        }
    }

    @Override
    public void setDouble(String key, int index, double value) {
        synchronized (keyLock(key)) {
            Number stored;
            synchronized (this) {
                ParameterImpl param = getParameter(key, index);
                if (param instanceof NumberParameter && !((NumberParameter)param).isInteger()) ((NumberParameter)param).setValue(value);
                else throw new IllegalArgumentException("Parameter "+key+" is not a floating point parameter");
                stored = getDouble(key, index);
            }
            fireListeners(key, stored);
        }
    }

    // always taken before the library lock
    protected Object keyLock(String key) {
        return keyLocks.computeIfAbsent(key, k -> new Object());
    }

    @Override
    public void addListener(String key, Consumer<Number> listener) {
        SimPeaksParameter.fromKey(key);
        synchronized (listeners) {
            listeners.computeIfAbsent(key, k -> new CopyOnWriteArrayList<>()).add(listener);
        }
    }

    @Override
    public void removeListener(String key, Consumer<Number> listener) {
        synchronized (listeners) {
            List<Consumer<Number>> l = listeners.get(key);
            if (l!=null) l.remove(listener);
        }
    }

    /**
     * Called outside of the library lock and within the lock of {@param key}, with the value as stored (after clamping)
     */
    protected void fireListeners(String key, Number value) {
        List<Consumer<Number>> l;
        synchronized (listeners) {
            l = listeners.get(key);
        }
        if (l==null) return;
        for (Consumer<Number> listener : l) listener.accept(value);
    }

    /**
     * @return setup parameters (read-back parameters excluded), keyed by parameter key
     */
    @Override
    public synchronized JSONObject toJSONEntry() {
        JSONObject res = new JSONObject();
        for (Map.Entry<SimPeaksParameter, ParameterImpl> e : parameters.entrySet()) {
            if (e.getKey().isReadBack()) continue;
            res.put(e.getKey().getKey(), e.getValue().toJSONEntry());
        }
        return res;
    }

    /**
     * Sets parameters from a JSON object keyed by parameter key. Addressable parameters accept either a single value (applied to every peak) or an array.
     * Unknown keys are ignored. Listeners are not called.
     * @throws IllegalArgumentException if a value does not fit its parameter
     */
    @Override
    public synchronized void initFromJSONEntry(Object jsonEntry) {
        if (!(jsonEntry instanceof JSONObject)) throw new IllegalArgumentException("Parameters should be a JSON object");
        JSONObject json = (JSONObject)jsonEntry;
        for (Object k : json.keySet()) {
            String key = (String)k;
            SimPeaksParameter p;
            try {
                p = SimPeaksParameter.fromKey(key);
            } catch (IllegalArgumentException e) {
                logger.warn("Unknown parameter {} ignored", key);
                continue;
            }
            if (p.isReadBack()) logger.warn("Parameter {} is set by the detector, value from setup ignored", key);
            else parameters.get(p).initFromJSONEntry(json.get(key));
        }
    }

    @Override
    public synchronized String toString() {
        StringBuilder sb = new StringBuilder();
        for (ParameterImpl p : parameters.values()) {
            if (p instanceof IndexedParameter) {
                List<ParameterImpl> children = ((IndexedParameter)p).getChildren();
                for (int i = 0; i<children.size(); ++i) sb.append(children.get(i)).append(" [").append(i).append("]\n");
            } else sb.append(p).append("\n");
        }
        return sb.toString();
    }
}
