package com.netcracker.core.provisioning.model;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Helpers for plain attribute values as stored in state and returned by providers.
 */
public final class Values {

    private Values() {
    }

    /**
     * Normalizes numbers recursively so values coming from declarations, providers and
     * deserialized state compare equal: integral numbers as {@link Long}, others as {@link Double}.
     */
    public static Object normalize(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof BigInteger big) {
            return big.bitLength() < 64 ? big.longValue() : big;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.stripTrailingZeros().scale() <= 0 ? normalize(decimal.toBigInteger()) : decimal.doubleValue();
        }
        if (value instanceof Float || value instanceof Double) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof List<?> list) {
            List<Object> normalized = new ArrayList<>(list.size());
            for (Object item : list) {
                normalized.add(normalize(item));
            }
            return normalized;
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> normalized = new LinkedHashMap<>();
            map.forEach((k, v) -> normalized.put(String.valueOf(k), normalize(v)));
            return normalized;
        }
        return value;
    }

    public static Map<String, Object> normalizeAll(Map<String, ?> attributes) {
        Map<String, Object> normalized = new LinkedHashMap<>();
        if (attributes != null) {
            attributes.forEach((k, v) -> normalized.put(k, normalize(v)));
        }
        return normalized;
    }

    /**
     * Reads a dot separated path ({@code tags.Name}, {@code ips.0}) from a plain value tree.
     *
     * @return the value at the path, or {@code null} when any segment is absent
     */
    public static Object readPath(Map<String, ?> root, String path) {
        Object current = root;
        for (String segment : path.split("\\.")) {
            if (current instanceof Map<?, ?> map) {
                current = map.get(segment);
            } else if (current instanceof List<?> list && isIndex(segment)) {
                int i = Integer.parseInt(segment);
                current = i < list.size() ? list.get(i) : null;
            } else {
                return null;
            }
        }
        return current;
    }

    private static boolean isIndex(String segment) {
        return !segment.isEmpty() && segment.chars().allMatch(Character::isDigit);
    }
}
