package com.ryuqq.ramify.core.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ChangeEvent 테스트.
 *
 * @author Ramify Team
 * @since 1.0.0
 */
class ChangeEventTest {

    @Test
    void of_CopiesKeys() {
        // Given
        List<Object> keys = new ArrayList<>(List.of("1", "2"));

        // When
        ChangeEvent event = ChangeEvent.of(CollectionOperation.CREATE, keys);
        keys.add("3");

        // Then
        assertEquals(List.of("1", "2"), event.keys());
        assertThrows(UnsupportedOperationException.class, () -> event.keys().add("4"));
    }

    @Test
    void keyless_HasEmptyKeys() {
        ChangeEvent event = ChangeEvent.keyless(CollectionOperation.CLEAR);

        assertEquals(CollectionOperation.CLEAR, event.operation());
        assertTrue(event.keys().isEmpty());
    }

    @Test
    void constructor_NullOperation_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> ChangeEvent.of(null, List.of())
        );
        assertTrue(exception.getMessage().contains("cannot be null"));
    }
}
