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
package simpeaks.utils;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.json.simple.JSONAware;
import org.json.simple.JSONObject;
import org.json.simple.parser.JSONParser;
import org.json.simple.parser.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import simpeaks.core.SimPeaksException;

public class JSONUtils {
    public final static Logger logger = LoggerFactory.getLogger(JSONUtils.class);

    public static String serialize(JSONSerializable o) {
        Object entry = o.toJSONEntry();
        if (entry instanceof JSONAware) return ((JSONAware)entry).toJSONString();
        else return entry.toString();
    }
    public static JSONObject parse(String s) throws ParseException {
        Object res = new JSONParser().parse(s);
        if (!(res instanceof JSONObject)) throw new ParseException(ParseException.ERROR_UNEXPECTED_TOKEN, "a JSON object is expected");
        return (JSONObject)res;
    }

    /**
     * Reads a JSON object from a file
     * @param path file to read
     * @return the parsed object
     * @throws IOException if the file cannot be read
     * @throws SimPeaksException if the content is not a valid JSON object
     */
    public static JSONObject readJSONObject(Path path) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            Object res = new JSONParser().parse(reader);
            if (!(res instanceof JSONObject)) throw new SimPeaksException("File "+path+" does not contain a JSON object");
            return (JSONObject)res;
        } catch (ParseException e) {
            throw new SimPeaksException("Invalid JSON in file "+path+" at position "+e.getPosition(), e);
        }
    }

    public static void writeJSONObject(Path path, JSONObject object) throws IOException {
        try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            writer.write(object.toJSONString());
        }
    }

    public static int getInt(JSONObject object, String key, int defaultValue) {
        Object v = object.get(key);
        if (v == null) return defaultValue;
        if (!(v instanceof Number)) throw new IllegalArgumentException("Value of "+key+" should be a number: "+v);
        return ((Number)v).intValue();
    }

    public static long getLong(JSONObject object, String key, long defaultValue) {
        Object v = object.get(key);
        if (v == null) return defaultValue;
        if (!(v instanceof Number)) throw new IllegalArgumentException("Value of "+key+" should be a number: "+v);
        return ((Number)v).longValue();
    }
}
