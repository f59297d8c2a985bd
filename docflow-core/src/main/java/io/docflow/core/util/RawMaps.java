package io.docflow.core.util;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Typed accessors over raw, JSON-shaped definition maps.
///
/// Raw definitions arrive as `Map<String, Object>` trees (maps, lists, strings,
/// numbers, booleans). These helpers return null or empty values instead of throwing
/// when a field is absent or has an unexpected type; the validator reports type errors.
/// Map and list results are copies, never views of the input.
public final class RawMaps {

    private RawMaps() {}

    public static String string(Map<String, Object> map, String key) {
        return map.get(key) instanceof String value ? value : null;
    }

    public static Boolean bool(Map<String, Object> map, String key) {
        return map.get(key) instanceof Boolean value ? value : null;
    }

    public static boolean bool(Map<String, Object> map, String key, boolean defaultValue) {
        Boolean value = bool(map, key);
        return value != null ? value : defaultValue;
    }

    public static Map<String, Object> map(Map<String, Object> map, String key) {
        return asMap(map.get(key));
    }

    public static List<Object> list(Map<String, Object> map, String key) {
        return asList(map.get(key));
    }

    /// Returns a string-keyed copy of a map value.
    ///
    /// @return copy in iteration order, or null if the value is not a map
    public static Map<String, Object> asMap(Object value) {
        if (!(value instanceof Map<?, ?> raw)) {
            return null;
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        raw.forEach((key, element) -> copy.put(String.valueOf(key), element));
        return copy;
    }

    /// Returns a copy of a list value, or null if the value is not a list.
    public static List<Object> asList(Object value) {
        return value instanceof List<?> raw ? new ArrayList<>(raw) : null;
    }

    /// Returns the string elements of a list field, skipping non-string elements.
    ///
    /// @return list of strings, empty if the field is absent, never null
    public static List<String> strings(Map<String, Object> map, String key) {
        List<Object> raw = list(map, key);
        if (raw == null) {
            return Collections.emptyList();
        }
        List<String> result = new ArrayList<>();
        for (Object element : raw) {
            if (element instanceof String text) {
                result.add(text);
            }
        }
        return result;
    }

    /// Returns the map elements of a list field, skipping non-map elements.
    ///
    /// @return list of maps, empty if the field is absent, never null
    public static List<Map<String, Object>> maps(Map<String, Object> map, String key) {
        List<Object> raw = list(map, key);
        if (raw == null) {
            return Collections.emptyList();
        }
        List<Map<String, Object>> result = new ArrayList<>();
        for (Object element : raw) {
            Map<String, Object> entry = asMap(element);
            if (entry != null) {
                result.add(entry);
            }
        }
        return result;
    }

    /// Returns a deep, unmodifiable copy of a JSON-shaped value.
    ///
    /// Maps and lists are copied at every level; scalars are returned as is.
    public static Object freeze(Object value) {
        if (value instanceof Map<?, ?> map) {
            return freezeMap(map);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object element : list) {
                copy.add(freeze(element));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    /// Returns a deep, unmodifiable, string-keyed copy of a map.
    ///
    /// @param map map to copy, may be null
    /// @return frozen copy in iteration order, empty for null
    public static Map<String, Object> freezeMap(Map<?, ?> map) {
        if (map == null) {
            return Map.of();
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        map.forEach((key, element) -> copy.put(String.valueOf(key), freeze(element)));
        return Collections.unmodifiableMap(copy);
    }

    /// Returns whether a value is an integral number (booleans excluded).
    public static boolean isInteger(Object value) {
        return value instanceof Integer
                || value instanceof Long
                || value instanceof Short
                || value instanceof BigInteger;
    }
}
