package com.ryuqq.ramify.core.model;

import java.util.List;

/**
 * One change notification: the operation kind and the primary keys it touched.
 *
 * <p>The key list is copied and unmodifiable. For coalesced notifications it
 * preserves the order in which the underlying mutations happened.</p>
 *
 * @param operation the operation kind
 * @param keys affected primary keys (empty for CLEAR or reduced-precision events)
 *
 * @author Ramify Team
 * @since 1.0.0
 */
public record ChangeEvent(
    CollectionOperation operation,
    List<Object> keys
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException operation 또는 keys가 null인 경우
     */
    public ChangeEvent {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        if (keys == null) {
            throw new IllegalArgumentException("keys cannot be null");
        }
        keys = List.copyOf(keys);
    }

    /**
     * Creates an event.
     *
     * @param operation the operation kind
     * @param keys affected primary keys
     * @return ChangeEvent 인스턴스
     */
    public static ChangeEvent of(CollectionOperation operation, List<Object> keys) {
        return new ChangeEvent(operation, keys);
    }

    /**
     * Creates an event without key precision.
     *
     * @param operation the operation kind
     * @return ChangeEvent 인스턴스 (빈 key 목록)
     */
    public static ChangeEvent keyless(CollectionOperation operation) {
        return new ChangeEvent(operation, List.of());
    }
}
