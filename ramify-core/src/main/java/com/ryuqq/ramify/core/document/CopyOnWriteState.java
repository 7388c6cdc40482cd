package com.ryuqq.ramify.core.document;

import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Map;

/**
 * Shared state behind one root {@link CopyOnWriteDocument} and every nested view handed out
 * from it.
 *
 * <p>Until the first write the state reads straight from the stored original. The first write
 * through any view of the tree deep-copies the whole root once; from then on every view of the
 * tree resolves against the private copy.</p>
 */
final class CopyOnWriteState {

    private final Map<String, Object> original;
    private Map<String, Object> copy;

    CopyOnWriteState(Map<String, Object> original) {
        this.original = original;
    }

    boolean isCopied() {
        return copy != null;
    }

    Object resolve(List<String> path, boolean forWrite) {
        Object current = forWrite ? ensureCopied() : (copy != null ? copy : original);
        for (String segment : path) {
            current = FieldPath.step(current, segment);
            if (current == null) {
                return null;
            }
        }
        return current;
    }

    // Nested containers are wrapped only while the tree is still shared with the original.
    // Shared dates are mutable, so readers get a clone.
    Object view(Object value, List<String> parentPath, String segment) {
        if (copy != null) {
            return value;
        }
        if (value instanceof Date) {
            return ((Date) value).clone();
        }
        if (!Documents.isContainer(value)) {
            return value;
        }
        List<String> childPath = new ArrayList<>(parentPath.size() + 1);
        childPath.addAll(parentPath);
        childPath.add(segment);
        if (value instanceof Map) {
            return new CopyOnWriteDocument(this, List.copyOf(childPath));
        }
        return new CopyOnWriteList(this, List.copyOf(childPath));
    }

    private Map<String, Object> ensureCopied() {
        if (copy == null) {
            copy = Documents.deepCopy(original);
        }
        return copy;
    }
}
