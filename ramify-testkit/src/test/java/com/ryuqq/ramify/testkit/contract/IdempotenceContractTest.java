package com.ryuqq.ramify.testkit.contract;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract: putting the same document twice leaves the same state as putting it once.
 *
 * @author Ramify Team
 * @since 1.0.0
 */
class IdempotenceContractTest extends AbstractCollectionContractTest {

    @Test
    void testPut_SameDocumentTwice_SameCountAndIndexes() {
        // Given
        Map<String, Object> alice = user("1", "Alice", 30, true, "admin", "user");
        users.put(alice);
        int count = users.count();
        Map<Object, List<Object>> names = users.indexKeys("name");
        Map<Object, List<Object>> roles = users.indexKeys("roles");

        // When
        users.put(alice);

        // Then
        assertEquals(count, users.count());
        assertEquals(names, users.indexKeys("name"));
        assertEquals(roles, users.indexKeys("roles"));
        assertIndexConsistent();
    }

    @Test
    void testPut_DuplicateElementsInMultiEntryList_IndexedOnce() {
        users.put(user("1", "Alice", 30, true, "admin", "admin"));

        assertEquals(List.of("1"), users.indexKeys("roles").get("admin"));
        assertEquals(1, users.where("roles").equalTo("admin").count());
    }

    @Test
    void testBulkPut_SameDocumentRepeated_SingleDocument() {
        Map<String, Object> bob = user("2", "Bob", 25, true, "user");

        List<Object> keys = users.bulkPut(List.of(bob, bob, bob));

        assertEquals(List.of("2", "2", "2"), keys);
        assertEquals(1, users.count());
        assertIndexConsistent();
    }
}
