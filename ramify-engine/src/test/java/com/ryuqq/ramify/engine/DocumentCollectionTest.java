package com.ryuqq.ramify.engine;

import com.ryuqq.ramify.core.document.CopyOnWriteDocument;
import com.ryuqq.ramify.core.document.Documents;
import com.ryuqq.ramify.core.exception.DuplicateKeyException;
import com.ryuqq.ramify.core.exception.InvalidFieldValueException;
import com.ryuqq.ramify.core.exception.UnindexedFieldException;
import com.ryuqq.ramify.core.model.CollectionOperation;
import com.ryuqq.ramify.core.model.Schema;
import com.ryuqq.ramify.core.spi.Observer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

/**
 * DocumentCollection 유닛 테스트.
 *
 * <ul>
 *   <li>put / add / get / delete / clear 기본 동작</li>
 *   <li>update: in-place 병합 vs 재색인, primary key 변경</li>
 *   <li>bulk 연산 결과와 알림 병합</li>
 *   <li>반환 문서의 copy-on-write 격리</li>
 * </ul>
 *
 * @author Ramify Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class DocumentCollectionTest {

    @Mock
    private Observer observer;

    private DocumentCollection players;

    @BeforeEach
    void setUp() {
        Schema schema = Schema.of("id").withIndexes("name", "stats.level").withMultiEntry("tags");
        players = new DocumentCollection("players", schema);
    }

    @AfterEach
    void tearDown() {
        players.close();
    }

    private static Map<String, Object> player(String id, String name, int level, String... tags) {
        return Documents.of("id", id, "name", name, "stats", Documents.of("level", level), "tags", List.of(tags));
    }

    @Test
    void put_ReturnsKeyAndStoresDocument() {
        // when
        Object key = players.put(player("p1", "Kim", 3, "red"));

        // then
        assertThat(key).isEqualTo("p1");
        assertThat(players.count()).isEqualTo(1);
        assertThat(players.get("p1")).get().satisfies(document -> {
            assertThat(document).isInstanceOf(CopyOnWriteDocument.class);
            assertThat(document.get("name")).isEqualTo("Kim");
        });
    }

    @Test
    void put_ExistingKey_ReplacesAndMovesToEnd() {
        players.put(player("p1", "Kim", 3));
        players.put(player("p2", "Lee", 4));

        players.put(player("p1", "Park", 5));

        assertThat(players.keys()).containsExactly("p2", "p1");
        assertThat(players.get("p1").orElseThrow().get("name")).isEqualTo("Park");
        assertThat(players.indexKeys("name")).containsOnlyKeys("Lee", "Park");
    }

    @Test
    void add_ExistingKey_ThrowsDuplicateKey() {
        players.add(player("p1", "Kim", 3));

        assertThatThrownBy(() -> players.add(player("p1", "Lee", 4)))
            .isInstanceOf(DuplicateKeyException.class)
            .hasMessageContaining("p1")
            .hasMessageContaining("players");
    }

    @Test
    void get_MissingOrNonPrimitiveKey_Empty() {
        assertThat(players.get("missing")).isEmpty();
        assertThat(players.get(List.of("p1"))).isEmpty();
        assertThat(players.has(Map.of())).isFalse();
        assertThatThrownBy(() -> players.get(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("key cannot be null");
    }

    @Test
    void bulkGet_KeepsInputOrder() {
        players.bulkPut(List.of(player("p1", "Kim", 1), player("p2", "Lee", 2)));

        List<Optional<Map<String, Object>>> found = players.bulkGet(List.of("p2", "x", "p1"));

        assertThat(found).hasSize(3);
        assertThat(found.get(0)).get().extracting(d -> d.get("name")).isEqualTo("Lee");
        assertThat(found.get(1)).isEmpty();
        assertThat(found.get(2)).get().extracting(d -> d.get("name")).isEqualTo("Kim");
    }

    @Test
    void update_NonIndexedField_KeepsPositionWithoutReindex() {
        // given
        players.put(player("p1", "Kim", 3));
        players.put(player("p2", "Lee", 4));
        Map<String, Object> before = players.get("p1").orElseThrow();

        // when
        Optional<Object> key = players.update("p1", Map.of("score", 99));

        // then
        assertThat(key).contains("p1");
        assertThat(players.get("p1").orElseThrow()).containsEntry("score", 99).containsEntry("name", "Kim");
        assertThat(players.keys()).containsExactly("p1", "p2");
        assertThat(players.where("name").equalTo("Kim").first()).get()
            .extracting(d -> d.get("score")).isEqualTo(99);
        assertThat(before).doesNotContainKey("score");
    }

    @Test
    void update_NestedIndexRoot_Reindexes() {
        // given
        players.put(player("p1", "Kim", 3));

        // when
        players.update("p1", Map.of("stats", Documents.of("level", 9)));

        // then
        assertThat(players.indexKeys("stats.level")).containsOnlyKeys(9);
        assertThat(players.where("stats.level").equalTo(9).keys()).containsExactly("p1");
    }

    @Test
    void update_PrimaryKeyOntoExistingKey_ThrowsAndKeepsBoth() {
        players.put(player("p1", "Kim", 3));
        players.put(player("p2", "Lee", 4));

        assertThatThrownBy(() -> players.update("p1", Map.of("id", "p2")))
            .isInstanceOf(DuplicateKeyException.class);
        assertThat(players.get("p1").orElseThrow().get("name")).isEqualTo("Kim");
        assertThat(players.get("p2").orElseThrow().get("name")).isEqualTo("Lee");
    }

    @Test
    void update_InvalidIndexedValue_RejectedWithoutChange() {
        players.put(player("p1", "Kim", 3, "red"));

        assertThatThrownBy(() -> players.update("p1", Map.of("tags", List.of(List.of("nested")))))
            .isInstanceOf(InvalidFieldValueException.class);
        assertThat(players.indexKeys("tags")).containsOnlyKeys("red");
    }

    @Test
    void update_MissingKey_ReturnsEmptyWithoutNotification() {
        players.subscribe(observer);

        assertThat(players.update("missing", Map.of("name", "x"))).isEmpty();
        verifyNoInteractions(observer);
    }

    @Test
    void delete_ReturnsKeyOnceThenEmpty() {
        players.put(player("p1", "Kim", 3, "red"));

        assertThat(players.delete("p1")).contains("p1");
        assertThat(players.delete("p1")).isEmpty();
        assertThat(players.indexKeys("tags")).isEmpty();
    }

    @Test
    void mutations_NotifyObserverWithKeys() {
        // given
        players.subscribe(observer);

        // when
        players.put(player("p1", "Kim", 3));
        players.bulkPut(List.of(player("p2", "Lee", 1), player("p3", "Park", 2)));
        players.bulkDelete(List.of("p1", "p9"));
        players.clear();

        // then
        verify(observer).onChange(CollectionOperation.CREATE, List.of("p1"));
        verify(observer).onChange(CollectionOperation.CREATE, List.of("p2", "p3"));
        verify(observer).onChange(CollectionOperation.DELETE, List.of("p1"));
        verify(observer).onChange(CollectionOperation.CLEAR, List.of());
        verifyNoMoreInteractions(observer);
    }

    @Test
    void observerFailure_DoesNotFailMutation() {
        players.subscribe((operation, keys) -> {
            throw new IllegalStateException("observer failure");
        });

        Object key = players.put(player("p1", "Kim", 3));

        assertThat(key).isEqualTo("p1");
        assertThat(players.has("p1")).isTrue();
    }

    @Test
    void bulkDelete_ReturnsPerKeyResult() {
        players.put(player("p1", "Kim", 3));

        List<Optional<Object>> results = players.bulkDelete(List.of("p1", "p2"));

        assertThat(results).containsExactly(Optional.of("p1"), Optional.empty());
    }

    @Test
    void each_ConsumerMayDeleteWhileIterating() {
        players.bulkPut(List.of(player("p1", "Kim", 1), player("p2", "Lee", 2)));
        List<Object> seen = new ArrayList<>();

        players.each(document -> {
            seen.add(document.get("id"));
            players.delete(document.get("id"));
        });

        assertThat(seen).containsExactly("p1", "p2");
        assertThat(players.count()).isZero();
    }

    @Test
    void shortcuts_ScanWholeCollection() {
        players.bulkPut(List.of(player("p1", "Kim", 5), player("p2", "Lee", 2), player("p3", "Park", 9)));

        assertThat(players.orderBy("stats.level").keys()).containsExactly("p2", "p1", "p3");
        assertThat(players.sortBy("name").reverse().keys()).containsExactly("p3", "p2", "p1");
        assertThat(players.offset(1).limit(1).keys()).containsExactly("p2");
        assertThat(players.limit(2).count()).isEqualTo(2);
        assertThat(players.filter(d -> d.get("name").toString().startsWith("P")).keys()).containsExactly("p3");
    }

    @Test
    void indexKeys_UndeclaredPath_Throws() {
        assertThatThrownBy(() -> players.indexKeys("score"))
            .isInstanceOf(UnindexedFieldException.class);
    }

    @Test
    void constructor_InvalidArguments_ThrowsException() {
        Schema schema = Schema.of("id");

        assertThatThrownBy(() -> new DocumentCollection(" ", schema))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DocumentCollection("players", null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DocumentCollection("players", schema, null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
