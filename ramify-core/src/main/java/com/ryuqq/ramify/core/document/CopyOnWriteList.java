package com.ryuqq.ramify.core.document;

import java.util.AbstractList;
import java.util.List;
import java.util.RandomAccess;

/**
 * List counterpart of {@link CopyOnWriteDocument}, handed out for list-valued fields read
 * through a document view that has not been copied yet.
 *
 * <p>Writes ({@code set}, {@code add}, {@code remove}, {@code clear}) copy the root document
 * first and then apply to the copied list.</p>
 *
 * @author Ramify Team
 * @since 1.0.0
 */
public final class CopyOnWriteList extends AbstractList<Object> implements RandomAccess {

    private final CopyOnWriteState state;
    private final List<String> path;

    CopyOnWriteList(CopyOnWriteState state, List<String> path) {
        this.state = state;
        this.path = path;
    }

    @Override
    public Object get(int index) {
        Object value = target().get(index);
        return value == null ? null : state.view(value, path, String.valueOf(index));
    }

    @Override
    public int size() {
        return target().size();
    }

    @Override
    public Object set(int index, Object element) {
        return writableTarget().set(index, element);
    }

    @Override
    public void add(int index, Object element) {
        writableTarget().add(index, element);
    }

    @Override
    public Object remove(int index) {
        return writableTarget().remove(index);
    }

    @SuppressWarnings("unchecked")
    private List<Object> target() {
        Object resolved = state.resolve(path, false);
        return resolved instanceof List ? (List<Object>) resolved : List.of();
    }

    @SuppressWarnings("unchecked")
    private List<Object> writableTarget() {
        Object resolved = state.resolve(path, true);
        if (!(resolved instanceof List)) {
            throw new IllegalStateException("nested value is no longer a list (path: " + String.join(".", path) + ")");
        }
        return (List<Object>) resolved;
    }
}
