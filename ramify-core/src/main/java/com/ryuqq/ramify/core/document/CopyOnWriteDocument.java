package com.ryuqq.ramify.core.document;

import java.util.AbstractMap;
import java.util.AbstractSet;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * Mutation-isolating view of a stored document.
 *
 * <p>Every document leaving a collection is wrapped in this view so that callers can read and
 * even modify what they received without ever touching stored state.</p>
 *
 * <p><strong>Semantics:</strong></p>
 * <ul>
 *   <li><strong>Reads</strong> forward transparently to the stored original (no copy)</li>
 *   <li><strong>First write</strong> ({@code put}, {@code remove}, {@code clear},
 *       {@code putAll}, {@code Entry.setValue}, iterator removal) deep-copies the whole root
 *       document into a private value. All later reads and writes use that copy</li>
 *   <li><strong>Nested maps and lists</strong> read before the copy are returned as views
 *       sharing this root, so a write at any depth triggers the same copy-on-write</li>
 *   <li><strong>After the copy</strong> nested values come from the private copy directly</li>
 *   <li><strong>Atomic values</strong> (strings, numbers, dates, patterns) are never wrapped</li>
 * </ul>
 *
 * <p><strong>Guarantee:</strong> mutating a view, at any depth, never changes what a later read
 * from the collection returns for that key.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * Map&lt;String, Object&gt; user = users.get("1").orElseThrow();
 * user.put("name", "mutated");           // clones privately
 * users.get("1").orElseThrow().get("name"); // still the stored name
 * </pre>
 *
 * <p>Not thread-safe, like the collections that hand it out.</p>
 *
 * @author Ramify Team
 * @since 1.0.0
 */
public final class CopyOnWriteDocument extends AbstractMap<String, Object> {

    private final CopyOnWriteState state;
    private final List<String> path;

    CopyOnWriteDocument(CopyOnWriteState state, List<String> path) {
        this.state = state;
        this.path = path;
    }

    /**
     * Wraps a stored document.
     *
     * @param original stored document (never modified through the view)
     * @return root view
     * @throws IllegalArgumentException original이 null인 경우
     */
    public static CopyOnWriteDocument of(Map<String, Object> original) {
        if (original == null) {
            throw new IllegalArgumentException("original cannot be null");
        }
        return new CopyOnWriteDocument(new CopyOnWriteState(original), List.of());
    }

    /**
     * Whether a write already detached this view's tree from the stored original.
     *
     * @return true after the first write through any view of the same root
     */
    public boolean isCopied() {
        return state.isCopied();
    }

    @Override
    public Object get(Object key) {
        Object value = target().get(key);
        return value == null ? null : state.view(value, path, String.valueOf(key));
    }

    @Override
    public boolean containsKey(Object key) {
        return target().containsKey(key);
    }

    @Override
    public int size() {
        return target().size();
    }

    @Override
    public boolean isEmpty() {
        return target().isEmpty();
    }

    @Override
    public Object put(String key, Object value) {
        return writableTarget().put(key, value);
    }

    @Override
    public Object remove(Object key) {
        return writableTarget().remove(key);
    }

    @Override
    public void putAll(Map<? extends String, ?> m) {
        writableTarget().putAll(m);
    }

    @Override
    public void clear() {
        writableTarget().clear();
    }

    @Override
    public Set<Map.Entry<String, Object>> entrySet() {
        return new EntrySet();
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> target() {
        Object resolved = state.resolve(path, false);
        return resolved instanceof Map ? (Map<String, Object>) resolved : Map.of();
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> writableTarget() {
        Object resolved = state.resolve(path, true);
        if (!(resolved instanceof Map)) {
            throw new IllegalStateException("nested value is no longer a map (path: " + String.join(".", path) + ")");
        }
        return (Map<String, Object>) resolved;
    }

    private final class EntrySet extends AbstractSet<Map.Entry<String, Object>> {

        @Override
        public int size() {
            return CopyOnWriteDocument.this.size();
        }

        @Override
        public Iterator<Map.Entry<String, Object>> iterator() {
            List<String> keys = new ArrayList<>(target().keySet());
            return new Iterator<>() {
                private int cursor;
                private String last;

                @Override
                public boolean hasNext() {
                    return cursor < keys.size();
                }

                @Override
                public Map.Entry<String, Object> next() {
                    if (!hasNext()) {
                        throw new NoSuchElementException();
                    }
                    last = keys.get(cursor++);
                    return new ViewEntry(last, get(last));
                }

                @Override
                public void remove() {
                    if (last == null) {
                        throw new IllegalStateException("next() has not been called");
                    }
                    CopyOnWriteDocument.this.remove(last);
                    last = null;
                }
            };
        }
    }

    private final class ViewEntry extends SimpleEntry<String, Object> {

        private static final long serialVersionUID = 1L;

        ViewEntry(String key, Object value) {
            super(key, value);
        }

        @Override
        public Object setValue(Object value) {
            Object previous = super.setValue(value);
            put(getKey(), value);
            return previous;
        }
    }
}
