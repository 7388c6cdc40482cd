package com.ryuqq.ramify.testkit.contract;

import com.ryuqq.ramify.core.document.Documents;
import com.ryuqq.ramify.core.model.Schema;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract: documents handed out by the collection, and documents handed in, never alias
 * stored state for writes.
 *
 * @author Ramify Team
 * @since 1.0.0
 */
class IsolationContractTest extends AbstractCollectionContractTest {

    @Override
    protected Schema usersSchema() {
        Schema base = super.usersSchema();
        List<String> indexes = new ArrayList<>(base.indexes());
        indexes.add("joinedAt");
        return new Schema(base.primaryKey(), indexes, base.multiEntry());
    }

    @Test
    void testGet_DateMutated_StoredDateAndIndexUnchanged() {
        // Given
        users.put(Documents.of("id", "1", "name", "Alice", "joinedAt", new Date(1_000L)));

        // When
        Map<String, Object> document = users.get("1").orElseThrow();
        ((Date) document.get("joinedAt")).setTime(999_999L);
        ((Date) users.where("name").equalTo("Alice").first().orElseThrow().get("joinedAt")).setTime(999_999L);
        ((Date) users.indexKeys("joinedAt").keySet().iterator().next()).setTime(999_999L);

        // Then
        assertField("1", "joinedAt", new Date(1_000L));
        assertEquals(1, users.where("joinedAt").equalTo(new Date(1_000L)).count());
        assertEquals(0, users.where("joinedAt").equalTo(new Date(999_999L)).count());
        assertEquals(List.of(new Date(1_000L)), new ArrayList<>(users.indexKeys("joinedAt").keySet()));
        assertIndexConsistent();
    }

    @Test
    @SuppressWarnings("unchecked")
    void testGet_NestedWrite_StoredDocumentUnchanged() {
        // Given
        users.put(Documents.of("id", "1", "name", "A", "profile", Documents.of("city", "Seoul")));

        // When
        Map<String, Object> document = users.get("1").orElseThrow();
        ((Map<String, Object>) document.get("profile")).put("city", "Busan");

        // Then
        assertEquals("Busan", ((Map<String, Object>) document.get("profile")).get("city"));
        assertField("1", "profile.city", "Seoul");
        assertEquals(1, users.where("profile.city").equalTo("Seoul").count());
    }

    @Test
    @SuppressWarnings("unchecked")
    void testQueryResult_ListWrite_StoredDocumentUnchanged() {
        // Given
        seedUsers();

        // When
        Map<String, Object> alice = users.where("name").equalTo("Alice").first().orElseThrow();
        ((List<Object>) alice.get("roles")).add("owner");
        alice.remove("email");

        // Then
        assertField("1", "roles", List.of("admin", "user"));
        assertField("1", "email", "alice@example.com");
        assertIndexConsistent();
    }

    @Test
    void testPut_CallerMutatesInputAfterwards_StoredDocumentUnchanged() {
        // Given
        List<Object> roles = new ArrayList<>(List.of("user"));
        Map<String, Object> input = Documents.of("id", "1", "name", "Alice", "roles", roles);
        users.put(input);

        // When
        input.put("name", "Mallory");
        roles.add("admin");

        // Then
        assertField("1", "name", "Alice");
        assertEquals(0, users.where("roles").equalTo("admin").count());
        assertIndexConsistent();
    }

    @Test
    void testToArray_EveryViewIndependent() {
        // Given
        seedUsers();

        // When
        for (Map<String, Object> document : users.toArray()) {
            document.put("name", "X");
        }

        // Then
        assertEquals(0, users.where("name").equalTo("X").count());
        assertField("4", "name", "Dave");
    }
}
