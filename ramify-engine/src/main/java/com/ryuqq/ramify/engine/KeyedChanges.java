package com.ryuqq.ramify.engine;

import java.util.Map;

/**
 * One entry of a bulk update: the target key and the field changes to merge.
 *
 * @param key primary key (null 불가)
 * @param changes top-level field → new value (null 불가)
 *
 * @author Ramify Team
 * @since 1.0.0
 */
public record KeyedChanges(
    Object key,
    Map<String, Object> changes
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException key 또는 changes가 null인 경우
     */
    public KeyedChanges {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (changes == null) {
            throw new IllegalArgumentException("changes cannot be null");
        }
    }

    public static KeyedChanges of(Object key, Map<String, Object> changes) {
        return new KeyedChanges(key, changes);
    }
}
