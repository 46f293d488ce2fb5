package com.example.workflowguard.domain;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Helpers for JSON-like values (maps, lists, strings, numbers, booleans, null) held in parameter bags.
 */
public final class JsonValues {

    private JsonValues() {
    }

    /**
     * Structural deep copy. Maps keep their key order; scalars are immutable and shared.
     */
    public static Object deepCopy(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), deepCopy(v)));
            return copy;
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object item : list) {
                copy.add(deepCopy(item));
            }
            return copy;
        }
        return value;
    }

    /**
     * A whole number as an {@code Integer} (or {@code Long} when out of int range); any other value as
     * given, so {@code 4.2} stays {@code 4.2} and {@code 4.0} is written back as {@code 4}.
     */
    public static Number compactNumber(Number value) {
        if (value == null || value instanceof Integer || value instanceof Long) {
            return value;
        }
        double d = value.doubleValue();
        if (d != Math.rint(d) || Double.isInfinite(d) || Math.abs(d) >= Long.MAX_VALUE) {
            return value;
        }
        long whole = (long) d;
        if (whole >= Integer.MIN_VALUE && whole <= Integer.MAX_VALUE) {
            return (int) whole;
        }
        return whole;
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> deepCopyMap(Map<String, Object> map) {
        return map != null ? (Map<String, Object>) deepCopy(map) : null;
    }

    /**
     * Removes null-valued keys from the map and from every nested map reachable through map values.
     * Lists are kept verbatim, including null elements and the maps inside them.
     */
    public static Map<String, Object> stripNulls(Map<String, Object> map) {
        Map<String, Object> cleaned = new LinkedHashMap<>();
        if (map == null) {
            return cleaned;
        }
        map.forEach((key, value) -> {
            if (value == null) {
                return;
            }
            if (value instanceof Map<?, ?> nested) {
                cleaned.put(key, stripNulls(asStringKeyed(nested)));
            } else {
                cleaned.put(key, value);
            }
        });
        return cleaned;
    }

    /**
     * Copy with every map replaced by a key-sorted map, for stable serialization.
     */
    public static Object canonical(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> sorted = new TreeMap<>();
            map.forEach((k, v) -> sorted.put(String.valueOf(k), canonical(v)));
            return sorted;
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object item : list) {
                copy.add(canonical(item));
            }
            return copy;
        }
        return value;
    }

    private static Map<String, Object> asStringKeyed(Map<?, ?> map) {
        Map<String, Object> result = new LinkedHashMap<>();
        map.forEach((k, v) -> result.put(String.valueOf(k), v));
        return result;
    }
}
