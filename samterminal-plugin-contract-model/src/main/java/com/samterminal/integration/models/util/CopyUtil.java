package com.samterminal.integration.models.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Unmodifiable deep copies of the JSON-like values held by flow models. Null values and null
 * elements are kept, unlike {@code Map.copyOf}.
 */
public final class CopyUtil {

    private CopyUtil() {}

    public static Map<String, Object> immutableMap(Map<String, ?> source) {
        if (source == null) {
            return Map.of();
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> copy.put(key, immutableValue(value)));
        return Collections.unmodifiableMap(copy);
    }

    public static <T> List<T> immutableList(List<? extends T> source) {
        if (source == null) {
            return List.of();
        }
        List<T> copy = new ArrayList<>(source);
        return Collections.unmodifiableList(copy);
    }

    // recursive method
    public static Object immutableValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            map.forEach((key, nested) -> copy.put(key, immutableValue(nested)));
            return Collections.unmodifiableMap(copy);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(nested -> copy.add(immutableValue(nested)));
            return Collections.unmodifiableList(copy);
        }
        return value;
    }
}
