/* 
 * Copyright (C) 2024 STIMNOISE authors
 *
 * This File is part of STIMNOISE
 *
 * STIMNOISE is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * STIMNOISE is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with STIMNOISE.  If not, see <http://www.gnu.org/licenses/>.
 */
package stimnoise.utils;

import org.json.simple.JSONArray;
import org.json.simple.JSONObject;
import org.json.simple.parser.JSONParser;
import org.json.simple.parser.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 *
 * json-simple conversions
 */
public class JSONUtils {
    public final static Logger logger = LoggerFactory.getLogger(JSONUtils.class);

    public static JSONObject parse(String s) throws ParseException {
        JSONParser parser = new JSONParser();
        Object res = parser.parse(s);
        if (res instanceof JSONObject) return (JSONObject)res;
        throw new ParseException(ParseException.ERROR_UNEXPECTED_TOKEN, res);
    }

    public static JSONObject toJSONObject(Map<String, ?> map) {
        JSONObject res = new JSONObject();
        for (Map.Entry<String, ?> e : map.entrySet()) res.put(e.getKey(), toJSONEntry(e.getValue()));
        return res;
    }

    public static Object toJSONEntry(Object o) {
        if (o==null) return null;
        else if (o instanceof JSONObject || o instanceof JSONArray) return o;
        else if (o instanceof JSONSerializable) return ((JSONSerializable)o).toJSONEntry();
        else if (o instanceof double[]) return toJSONArray((double[])o);
        else if (o instanceof int[]) return toJSONArray((int[])o);
        else if (o instanceof Number || o instanceof Boolean || o instanceof String) return o;
        else if (o instanceof Enum) return o.toString();
        else if (o instanceof List) {
            JSONArray l = new JSONArray();
            ((List<?>)o).forEach(oo -> l.add(toJSONEntry(oo)));
            return l;
        }
        else if (o instanceof Map) return toJSONObject((Map<String, ?>)o);
        logger.error("Could not convert object of class {} to JSON entry", o.getClass());
        throw new IllegalArgumentException("Type not supported: "+o.getClass());
    }

    public static JSONArray toJSONArray(double[] array) {
        JSONArray res = new JSONArray();
        for (double d : array) res.add(d);
        return res;
    }
    public static JSONArray toJSONArray(int[] array) {
        JSONArray res = new JSONArray();
        for (int i : array) res.add(i);
        return res;
    }

    /**
     * @param name of the entry, used in error messages
     * @throws ConfigurationException if an element is not a number
     */
    public static double[] fromDoubleArray(List array, String name) {
        double[] res = new double[array.size()];
        for (int i = 0; i<res.length; ++i) {
            if (!(array.get(i) instanceof Number)) throw new ConfigurationException(name+" should contain numbers (found: "+array+")");
            res[i] = ((Number)array.get(i)).doubleValue();
        }
        return res;
    }

    /**
     * @param name of the entry, used in error messages
     * @throws ConfigurationException if an element is not a whole number
     */
    public static int[] fromIntArray(List array, String name) {
        int[] res = new int[array.size()];
        for (int i = 0; i<res.length; ++i) {
            Long v = asWholeNumber(array.get(i));
            if (v==null || v<Integer.MIN_VALUE || v>Integer.MAX_VALUE) throw new ConfigurationException(name+" should contain integers (found: "+array+")");
            res[i] = v.intValue();
        }
        return res;
    }

    /**
     * @throws ConfigurationException if {@param value} is not a whole number
     */
    public static long toLong(Object value, String name) {
        Long v = asWholeNumber(value);
        if (v==null) throw new ConfigurationException(name+" should be an integer (found: "+value+")");
        return v;
    }

    /**
     * json-simple reads integers as {@link Long} and decimals as {@link Double}; decimals holding a whole value are accepted
     * @return null if {@param value} is not a whole number
     */
    private static Long asWholeNumber(Object value) {
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) return ((Number)value).longValue();
        if (value instanceof Number) {
            double d = ((Number)value).doubleValue();
            if (Double.isFinite(d) && d==Math.rint(d) && Math.abs(d)<=Long.MAX_VALUE) return (long)d;
        }
        return null;
    }
}
