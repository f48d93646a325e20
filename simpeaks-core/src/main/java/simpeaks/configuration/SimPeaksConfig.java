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
import simpeaks.image.DataType;
import simpeaks.utils.JSONSerializable;
import simpeaks.utils.JSONUtils;

/**
 * Construction parameters of a simulated detector.
 * maxSizeY = 0 configures a 1D detector. maxBuffers = 0 and maxMemory = 0 mean unlimited
 */
public class SimPeaksConfig implements JSONSerializable {
    String portName = "SIM1";
    int maxSizeX = 1024;
    int maxSizeY = 0;
    int maxPeaks = 10;
    DataType dataType = DataType.FLOAT64;
    int maxBuffers = 0;
    long maxMemory = 0;

    public SimPeaksConfig() {}

    public SimPeaksConfig(String portName, int maxSizeX, int maxSizeY, int maxPeaks, DataType dataType, int maxBuffers, long maxMemory) {
        setPortName(portName);
        setMaxSizeX(maxSizeX);
        setMaxSizeY(maxSizeY);
        setMaxPeaks(maxPeaks);
        setDataType(dataType);
        setMaxBuffers(maxBuffers);
        setMaxMemory(maxMemory);
    }

    public String getPortName() {
        return portName;
    }

    public SimPeaksConfig setPortName(String portName) {
        if (portName==null || portName.isEmpty()) throw new IllegalArgumentException("Port name cannot be empty");
        this.portName = portName;
        return this;
    }

    public int getMaxSizeX() {
        return maxSizeX;
    }

    public SimPeaksConfig setMaxSizeX(int maxSizeX) {
        if (maxSizeX<1) throw new IllegalArgumentException("Max size X must be at least 1: "+maxSizeX);
        this.maxSizeX = maxSizeX;
        return this;
    }

    /**
     * @return max size in Y, 0 for a 1D detector
     */
    public int getMaxSizeY() {
        return maxSizeY;
    }

    public SimPeaksConfig setMaxSizeY(int maxSizeY) {
        if (maxSizeY<0) throw new IllegalArgumentException("Max size Y cannot be negative: "+maxSizeY);
        this.maxSizeY = maxSizeY;
        return this;
    }

    public boolean is1D() {
        return maxSizeY == 0;
    }

    public int getMaxPeaks() {
        return maxPeaks;
    }

    public SimPeaksConfig setMaxPeaks(int maxPeaks) {
        if (maxPeaks<1) throw new IllegalArgumentException("Max peaks must be at least 1: "+maxPeaks);
        this.maxPeaks = maxPeaks;
        return this;
    }

    public DataType getDataType() {
        return dataType;
    }

    public SimPeaksConfig setDataType(DataType dataType) {
        if (dataType==null) throw new IllegalArgumentException("Data type cannot be null");
        this.dataType = dataType;
        return this;
    }

    public int getMaxBuffers() {
        return maxBuffers;
    }

    public SimPeaksConfig setMaxBuffers(int maxBuffers) {
        if (maxBuffers<0) throw new IllegalArgumentException("Max buffers cannot be negative: "+maxBuffers);
        this.maxBuffers = maxBuffers;
        return this;
    }

    public long getMaxMemory() {
        return maxMemory;
    }

    public SimPeaksConfig setMaxMemory(long maxMemory) {
        if (maxMemory<0) throw new IllegalArgumentException("Max memory cannot be negative: "+maxMemory);
        this.maxMemory = maxMemory;
        return this;
    }

    @Override
    public JSONObject toJSONEntry() {
        JSONObject res = new JSONObject();
        res.put("portName", portName);
        res.put("maxSizeX", maxSizeX);
        res.put("maxSizeY", maxSizeY);
        res.put("maxPeaks", maxPeaks);
        res.put("dataType", dataType.getName());
        res.put("maxBuffers", maxBuffers);
        res.put("maxMemory", maxMemory);
        return res;
    }

    /**
     * Missing entries keep their current value. The data type can be given by name or ordinal
     */
    @Override
    public void initFromJSONEntry(Object jsonEntry) {
        if (!(jsonEntry instanceof JSONObject)) throw new IllegalArgumentException("Configuration should be a JSON object");
        JSONObject json = (JSONObject)jsonEntry;
        if (json.containsKey("portName")) setPortName((String)json.get("portName"));
        setMaxSizeX(JSONUtils.getInt(json, "maxSizeX", maxSizeX));
        setMaxSizeY(JSONUtils.getInt(json, "maxSizeY", maxSizeY));
        setMaxPeaks(JSONUtils.getInt(json, "maxPeaks", maxPeaks));
        Object dt = json.get("dataType");
        if (dt instanceof Number) setDataType(DataType.fromOrdinal(((Number)dt).intValue()));
        else if (dt instanceof String) setDataType(parseDataType((String)dt));
        else if (dt != null) throw new IllegalArgumentException("Invalid data type: "+dt);
        setMaxBuffers(JSONUtils.getInt(json, "maxBuffers", maxBuffers));
        setMaxMemory(JSONUtils.getLong(json, "maxMemory", maxMemory));
    }

    static DataType parseDataType(String name) {
        for (DataType t : DataType.values()) {
            if (t.getName().equalsIgnoreCase(name) || t.name().equalsIgnoreCase(name)) return t;
        }
        throw new IllegalArgumentException("Invalid data type: "+name);
    }

    @Override
    public String toString() {
        return "port="+portName+" maxSize="+maxSizeX+"x"+maxSizeY+" maxPeaks="+maxPeaks+" dataType="+dataType+" maxBuffers="+maxBuffers+" maxMemory="+maxMemory;
    }
}
