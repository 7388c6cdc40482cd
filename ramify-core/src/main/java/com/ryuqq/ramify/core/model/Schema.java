package com.ryuqq.ramify.core.model;

import com.ryuqq.ramify.core.document.FieldPath;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Static, per-collection configuration (불변 record).
 *
 * <p>A schema is consumed once, when the collection is created, and never changes afterwards.
 * Adding an index later means building a new collection.</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>primaryKey: path of the unique identifier field (must hold a primitive value)</li>
 *   <li>indexes: secondary index paths, dot notation for nested fields (기본: 없음)</li>
 *   <li>multiEntry: list-valued paths indexed once per element (기본: 없음)</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * Schema schema = Schema.of("id")
 *     .withIndexes("email", "profile.city")
 *     .withMultiEntry("tags");
 * </pre>
 *
 * @author Ramify Team
 * @since 1.0.0
 * @param primaryKey primary key path (null/blank 불가)
 * @param indexes secondary index paths
 * @param multiEntry multi-entry index paths
 */
public record Schema(
    String primaryKey,
    List<String> indexes,
    List<String> multiEntry
) {

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public Schema {
        if (primaryKey == null || primaryKey.isBlank()) {
            throw new IllegalArgumentException("primaryKey cannot be null or blank");
        }
        FieldPath.of(primaryKey);
        indexes = indexes == null ? List.of() : indexes;
        multiEntry = multiEntry == null ? List.of() : multiEntry;

        Set<String> seen = new HashSet<>();
        seen.add(primaryKey);
        for (String path : indexes) {
            checkIndexPath(path, seen, "indexes");
        }
        for (String path : multiEntry) {
            checkIndexPath(path, seen, "multiEntry");
        }
        indexes = List.copyOf(indexes);
        multiEntry = List.copyOf(multiEntry);
    }

    /**
     * Schema with only a primary key.
     *
     * @param primaryKey primary key path
     * @return Schema 인스턴스
     */
    public static Schema of(String primaryKey) {
        return new Schema(primaryKey, List.of(), List.of());
    }

    /**
     * indexes만 변경한 새 인스턴스 생성.
     */
    public Schema withIndexes(String... paths) {
        return new Schema(primaryKey, Arrays.asList(paths), multiEntry);
    }

    /**
     * multiEntry만 변경한 새 인스턴스 생성.
     */
    public Schema withMultiEntry(String... paths) {
        return new Schema(primaryKey, indexes, Arrays.asList(paths));
    }

    /**
     * All index paths, secondary first, then multi-entry, in declaration order.
     *
     * @return unmodifiable list of index paths
     */
    public List<String> allIndexes() {
        List<String> all = new ArrayList<>(indexes.size() + multiEntry.size());
        all.addAll(indexes);
        all.addAll(multiEntry);
        return List.copyOf(all);
    }

    /**
     * Whether the field is the primary key.
     */
    public boolean isPrimaryKey(String field) {
        return primaryKey.equals(field);
    }

    /**
     * Whether the field is a declared secondary or multi-entry index.
     */
    public boolean isIndexed(String field) {
        return indexes.contains(field) || multiEntry.contains(field);
    }

    /**
     * Whether the field is a declared multi-entry index.
     */
    public boolean isMultiEntry(String field) {
        return multiEntry.contains(field);
    }

    /**
     * Whether the field can be used with {@code where(field)}.
     *
     * @param field field path
     * @return true for the primary key or a declared index
     */
    public boolean isQueryable(String field) {
        return isPrimaryKey(field) || isIndexed(field);
    }

    private static void checkIndexPath(String path, Set<String> seen, String listName) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException(listName + " cannot contain null or blank paths");
        }
        FieldPath.of(path);
        if (!seen.add(path)) {
            throw new IllegalArgumentException(
                "path declared more than once (path: " + path + ", list: " + listName + ")"
            );
        }
    }
}
