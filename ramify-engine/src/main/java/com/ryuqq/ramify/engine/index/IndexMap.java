package com.ryuqq.ramify.engine.index;

import com.ryuqq.ramify.core.document.Documents;
import com.ryuqq.ramify.core.document.FieldPath;
import com.ryuqq.ramify.core.exception.InvalidFieldValueException;
import com.ryuqq.ramify.core.model.IndexValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeMap;

/**
 * One secondary index: indexed value → (primary key → document).
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>buckets:</strong> TreeMap&lt;IndexValue, LinkedHashMap&lt;IndexValue, Document&gt;&gt;
 *       - ordered by {@link IndexValue} so range lookups read a contiguous sub-map</li>
 *   <li>Each bucket keeps insertion order of its documents</li>
 * </ul>
 *
 * <p><strong>Invariants:</strong></p>
 * <ul>
 *   <li>The bucket for value V holds exactly the documents whose path resolves to V
 *       (or, for multi-entry indexes, whose list contains V)</li>
 *   <li>Empty buckets are removed immediately</li>
 *   <li>Documents whose path resolves to {@code null} are not indexed</li>
 * </ul>
 *
 * <p><strong>Performance Characteristics:</strong></p>
 * <ul>
 *   <li><strong>add/remove:</strong> O(E log B) - E entries per document, B buckets</li>
 *   <li><strong>bucket:</strong> O(log B)</li>
 *   <li><strong>range:</strong> O(log B + R) - R documents in range</li>
 * </ul>
 *
 * <p>Only the owning collection mutates an index, from the calling thread.</p>
 *
 * @author Ramify Team
 * @since 1.0.0
 */
public final class IndexMap {

    private final FieldPath path;
    private final boolean multiEntry;
    private final NavigableMap<IndexValue, Map<IndexValue, Map<String, Object>>> buckets;

    /**
     * Creates an empty index.
     *
     * @param path indexed field path
     * @param multiEntry true to index list values per element
     * @throws IllegalArgumentException path가 유효하지 않은 경우
     */
    public IndexMap(String path, boolean multiEntry) {
        this.path = FieldPath.of(path);
        this.multiEntry = multiEntry;
        this.buckets = new TreeMap<>();
    }

    /**
     * Computes (and validates) the index entries a document contributes.
     *
     * <p>Called before any state changes, so an invalid document is rejected while the
     * collection is still untouched.</p>
     *
     * @param document document to index
     * @return distinct index values, empty when the path resolves to null
     * @throws InvalidFieldValueException the value (or a multi-entry element) is not primitive
     */
    public List<IndexValue> entriesFor(Map<String, Object> document) {
        Object value = path.resolve(document);
        if (value == null) {
            return List.of();
        }
        if (multiEntry && value instanceof List) {
            Set<IndexValue> entries = new LinkedHashSet<>();
            for (Object element : (List<?>) value) {
                if (!IndexValue.isPrimitive(element)) {
                    throw new InvalidFieldValueException(path.value(),
                        "multi-entry element must be a primitive value, got " + describe(element));
                }
                entries.add(IndexValue.of(element));
            }
            return new ArrayList<>(entries);
        }
        if (!IndexValue.isPrimitive(value)) {
            throw new InvalidFieldValueException(path.value(),
                "indexed value must be a primitive value, got " + describe(value));
        }
        return List.of(IndexValue.of(value));
    }

    /**
     * Adds a document under the given entries.
     *
     * @param primaryKey document primary key
     * @param document stored document
     * @param entries values from {@link #entriesFor(Map)}
     */
    public void add(IndexValue primaryKey, Map<String, Object> document, List<IndexValue> entries) {
        for (IndexValue entry : entries) {
            buckets.computeIfAbsent(entry, k -> new LinkedHashMap<>()).put(primaryKey, document);
        }
    }

    /**
     * Removes a document from the given entries, pruning buckets that become empty.
     *
     * @param primaryKey document primary key
     * @param entries values the document was indexed under
     */
    public void remove(IndexValue primaryKey, List<IndexValue> entries) {
        for (IndexValue entry : entries) {
            Map<IndexValue, Map<String, Object>> bucket = buckets.get(entry);
            if (bucket != null) {
                bucket.remove(primaryKey);
                if (bucket.isEmpty()) {
                    buckets.remove(entry);
                }
            }
        }
    }

    /**
     * Documents indexed under exactly this value.
     *
     * @param value index value
     * @return unmodifiable bucket (empty if none)
     */
    public Map<IndexValue, Map<String, Object>> bucket(IndexValue value) {
        Map<IndexValue, Map<String, Object>> bucket = buckets.get(value);
        return bucket == null ? Map.of() : Collections.unmodifiableMap(bucket);
    }

    /**
     * Size of the bucket for a value without materializing it.
     */
    public int bucketSize(IndexValue value) {
        Map<IndexValue, Map<String, Object>> bucket = buckets.get(value);
        return bucket == null ? 0 : bucket.size();
    }

    /**
     * Documents indexed under values inside a range of the same kind as its bounds.
     *
     * <p>A null bound leaves that side open. Values of other kinds than the bounds are skipped,
     * so a numeric range never returns string-valued entries.</p>
     *
     * @param lower lower bound (null 허용)
     * @param lowerInclusive whether the lower bound matches
     * @param upper upper bound (null 허용)
     * @param upperInclusive whether the upper bound matches
     * @return primary key → document, ordered by index value
     * @throws IllegalArgumentException 두 bound가 모두 null이거나 kind가 다른 경우
     */
    public Map<IndexValue, Map<String, Object>> range(IndexValue lower, boolean lowerInclusive,
                                                       IndexValue upper, boolean upperInclusive) {
        if (lower == null && upper == null) {
            throw new IllegalArgumentException("range needs at least one bound");
        }
        if (lower != null && upper != null && lower.kind() != upper.kind()) {
            throw new IllegalArgumentException(
                "range bounds must be of the same kind (lower: " + lower.kind() + ", upper: " + upper.kind() + ")"
            );
        }
        IndexValue.Kind kind = lower != null ? lower.kind() : upper.kind();
        if (lower != null && upper != null && lower.compareTo(upper) > 0) {
            return Map.of();
        }

        NavigableMap<IndexValue, Map<IndexValue, Map<String, Object>>> view = buckets;
        if (lower != null) {
            view = view.tailMap(lower, lowerInclusive);
        }
        if (upper != null) {
            view = view.headMap(upper, upperInclusive);
        }

        Map<IndexValue, Map<String, Object>> matches = new LinkedHashMap<>();
        for (Map.Entry<IndexValue, Map<IndexValue, Map<String, Object>>> bucket : view.entrySet()) {
            if (bucket.getKey().kind() == kind) {
                matches.putAll(bucket.getValue());
            }
        }
        return matches;
    }

    /**
     * Read-only snapshot: raw index value → raw primary keys, in index order.
     *
     * @return detached snapshot
     */
    public Map<Object, List<Object>> snapshot() {
        Map<Object, List<Object>> snapshot = new LinkedHashMap<>();
        for (Map.Entry<IndexValue, Map<IndexValue, Map<String, Object>>> bucket : buckets.entrySet()) {
            List<Object> keys = new ArrayList<>(bucket.getValue().size());
            for (IndexValue key : bucket.getValue().keySet()) {
                keys.add(key.raw());
            }
            snapshot.put(bucket.getKey().raw(), Collections.unmodifiableList(keys));
        }
        return Collections.unmodifiableMap(snapshot);
    }

    /**
     * Number of distinct indexed values (buckets).
     */
    public int bucketCount() {
        return buckets.size();
    }

    public void clear() {
        buckets.clear();
    }

    public String path() {
        return path.value();
    }

    /**
     * Whether writing the top-level field can change the value this index reads.
     */
    public boolean isAffectedBy(String field) {
        return path.isAffectedBy(field);
    }

    public boolean isMultiEntry() {
        return multiEntry;
    }

    private static String describe(Object value) {
        if (value == null) {
            return "null";
        }
        return Documents.isContainer(value) ? value.getClass().getSimpleName() + " container" : value.getClass().getName();
    }
}
