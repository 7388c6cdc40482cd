package com.ryuqq.ramify.core.document;

import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Static helpers for type-erased documents.
 *
 * <p>A document is a {@code Map<String, Object>} whose values are atomic values
 * (strings, numbers, booleans, dates, patterns, ...), nested maps or lists.</p>
 *
 * @author Ramify Team
 * @since 1.0.0
 */
public final class Documents {

    // Utility class - prevent instantiation
    private Documents() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Whether the value is a nested container (map or list) that can be wrapped or copied.
     *
     * <p>Atomic values such as dates and {@link java.util.regex.Pattern} are never containers.</p>
     *
     * @param value value (null 허용)
     * @return true for {@link Map} and {@link List}
     */
    public static boolean isContainer(Object value) {
        return value instanceof Map || value instanceof List;
    }

    /**
     * Deep-copies a document.
     *
     * <p>Maps become {@link LinkedHashMap} (iteration order kept), lists become
     * {@link ArrayList}, mutable {@link Date} instances are cloned. Other values are
     * immutable and shared.</p>
     *
     * @param document document to copy
     * @return private deep copy
     * @throws IllegalArgumentException document가 null인 경우
     */
    public static Map<String, Object> deepCopy(Map<String, ?> document) {
        if (document == null) {
            throw new IllegalArgumentException("document cannot be null");
        }
        Map<String, Object> copy = new LinkedHashMap<>(Math.max(16, document.size() * 2));
        for (Map.Entry<String, ?> entry : document.entrySet()) {
            copy.put(entry.getKey(), copyValue(entry.getValue()));
        }
        return copy;
    }

    /**
     * Deep-copies any document value.
     *
     * @param value value (null 허용)
     * @return copy for containers and dates, the value itself otherwise
     */
    @SuppressWarnings("unchecked")
    public static Object copyValue(Object value) {
        if (value instanceof Map) {
            return deepCopy((Map<String, ?>) value);
        }
        if (value instanceof List) {
            List<?> source = (List<?>) value;
            List<Object> copy = new ArrayList<>(source.size());
            for (Object element : source) {
                copy.add(copyValue(element));
            }
            return copy;
        }
        if (value instanceof Date) {
            return ((Date) value).clone();
        }
        return value;
    }

    /**
     * Convenience builder for small documents: alternating keys and values.
     *
     * <pre>
     * Map&lt;String, Object&gt; user = Documents.of("id", "1", "email", "a@x.com");
     * </pre>
     *
     * @param keyValues alternating String keys and values
     * @return mutable insertion-ordered document
     * @throws IllegalArgumentException 인자 개수가 홀수이거나 key가 String이 아닌 경우
     */
    public static Map<String, Object> of(Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("keyValues must contain an even number of elements");
        }
        Map<String, Object> document = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            if (!(keyValues[i] instanceof String)) {
                throw new IllegalArgumentException("key at position " + i + " must be a String");
            }
            document.put((String) keyValues[i], keyValues[i + 1]);
        }
        return document;
    }
}
