package com.ryuqq.ramify.core.document;

import java.util.List;
import java.util.Map;

/**
 * Parsed dot-notation path into a type-erased document.
 *
 * <p>Resolution is a small interpreter over the split segments:</p>
 * <ul>
 *   <li>{@link Map} container: the segment is the key</li>
 *   <li>{@link List} container: the segment must be a non-negative index within bounds</li>
 *   <li>anything else, or a missing step: the path resolves to {@code null}</li>
 * </ul>
 *
 * <p>Paths are immutable. Long-lived owners (indexes, the primary key, queries) parse their
 * path once and keep the instance.</p>
 *
 * @author Ramify Team
 * @since 1.0.0
 */
public final class FieldPath {

    private final String path;
    private final String[] segments;

    private FieldPath(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("path cannot be null or blank");
        }
        String[] parts = path.split("\\.", -1);
        for (String part : parts) {
            if (part.isEmpty()) {
                throw new IllegalArgumentException("path contains an empty segment: " + path);
            }
        }
        this.path = path;
        this.segments = parts;
    }

    /**
     * Parses a path.
     *
     * @param path dot-notation path, e.g. {@code stats.level}
     * @return FieldPath 인스턴스
     * @throws IllegalArgumentException path가 null/blank이거나 빈 segment를 포함한 경우
     */
    public static FieldPath of(String path) {
        return new FieldPath(path);
    }

    /**
     * Shortcut for {@code FieldPath.of(path).resolve(document)}.
     *
     * @param document root document (null 허용)
     * @param path dot-notation path
     * @return resolved value, or null when any step is missing
     */
    public static Object resolve(Object document, String path) {
        return of(path).resolve(document);
    }

    /**
     * Resolves this path against a document.
     *
     * @param document root document (null 허용)
     * @return resolved value, or null when any step is missing
     */
    public Object resolve(Object document) {
        Object current = document;
        for (String segment : segments) {
            current = step(current, segment);
            if (current == null) {
                return null;
            }
        }
        return current;
    }

    /**
     * Whether a write to the top-level field {@code field} can change the value at this path.
     *
     * @param field top-level field name
     * @return true when the field is this path's root
     */
    public boolean isAffectedBy(String field) {
        return segments[0].equals(field);
    }

    /**
     * The original dotted string.
     */
    public String value() {
        return path;
    }

    static Object step(Object container, String segment) {
        if (container instanceof Map) {
            return ((Map<?, ?>) container).get(segment);
        }
        if (container instanceof List) {
            List<?> list = (List<?>) container;
            int index = parseIndex(segment);
            return index >= 0 && index < list.size() ? list.get(index) : null;
        }
        return null;
    }

    private static int parseIndex(String segment) {
        for (int i = 0; i < segment.length(); i++) {
            if (!Character.isDigit(segment.charAt(i))) {
                return -1;
            }
        }
        try {
            return Integer.parseInt(segment);
        } catch (NumberFormatException tooLarge) {
            return -1;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return path.equals(((FieldPath) o).path);
    }

    @Override
    public int hashCode() {
        return path.hashCode();
    }

    @Override
    public String toString() {
        return "FieldPath{" + path + '}';
    }
}
