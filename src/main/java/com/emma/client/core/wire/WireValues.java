package com.emma.client.core.wire;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Helpers for reading decoded JSON values: maps, lists, numbers, strings and booleans.
 */
public final class WireValues {

    private WireValues() {
    }

    /**
     * Whether an API result counts as success. Null, false, zero and empty
     * strings or containers do not.
     */
    public static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            return n.doubleValue() != 0;
        }
        if (value instanceof CharSequence s) {
            return s.length() > 0;
        }
        if (value instanceof Collection<?> c) {
            return !c.isEmpty();
        }
        if (value instanceof Map<?, ?> m) {
            return !m.isEmpty();
        }
        return true;
    }

    public static Long asLong(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number n) {
            return n.longValue();
        }
        if (value instanceof String s && !s.isBlank()) {
            try {
                return Long.parseLong(s.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Not a numeric identifier: " + s, e);
            }
        }
        throw new IllegalArgumentException("Not a numeric identifier: " + value);
    }

    public static String asString(Object value) {
        return value != null ? value.toString() : null;
    }

    /**
     * Copies a decoded JSON object into a mutable map with string keys.
     *
     * @throws IllegalArgumentException if the value is not an object
     */
    public static Map<String, Object> asMap(Object value) {
        if (!(value instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException("Expected a JSON object but got: " + value);
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        map.forEach((k, v) -> copy.put(String.valueOf(k), v));
        return copy;
    }

    /**
     * Reads a decoded JSON array. Null (a 404 result) reads as an empty list.
     *
     * @throws IllegalArgumentException if the value is neither null nor an array
     */
    public static List<Object> asList(Object value) {
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof Collection<?> collection)) {
            throw new IllegalArgumentException("Expected a JSON array but got: " + value);
        }
        return new ArrayList<>(collection);
    }

    /**
     * Percent-encodes a value for use as a single URL path segment, such as an
     * email address. {@code @} is a legal path character and is kept.
     */
    public static String pathSegment(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8)
                .replace("+", "%20")
                .replace("%40", "@");
    }
}
