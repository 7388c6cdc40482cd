package com.ryuqq.ramify.engine.index;

import com.ryuqq.ramify.core.document.Documents;
import com.ryuqq.ramify.core.exception.InvalidFieldValueException;
import com.ryuqq.ramify.core.model.IndexValue;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * IndexMap 유닛 테스트.
 *
 * <ul>
 *   <li>단일 값 / multi-entry entry 계산</li>
 *   <li>빈 bucket 제거</li>
 *   <li>순서 기반 range 조회</li>
 * </ul>
 *
 * @author Ramify Team
 * @since 1.0.0
 */
class IndexMapTest {

    private static IndexValue key(Object value) {
        return IndexValue.of(value);
    }

    private static void index(IndexMap index, Map<String, Object> document) {
        index.add(key(document.get("id")), document, index.entriesFor(document));
    }

    @Test
    void entriesFor_ScalarNestedAndMissing() {
        IndexMap city = new IndexMap("profile.city", false);

        assertThat(city.entriesFor(Documents.of("profile", Documents.of("city", "Seoul"))))
            .containsExactly(key("Seoul"));
        assertThat(city.entriesFor(Documents.of("profile", Documents.of()))).isEmpty();
        assertThat(city.entriesFor(Documents.of("id", 1))).isEmpty();
    }

    @Test
    void entriesFor_MultiEntry_OneEntryPerDistinctElement() {
        IndexMap tags = new IndexMap("tags", true);

        assertThat(tags.entriesFor(Documents.of("tags", List.of("x", "y", "x"))))
            .containsExactly(key("x"), key("y"));
        assertThat(tags.entriesFor(Documents.of("tags", "solo"))).containsExactly(key("solo"));
    }

    @Test
    void entriesFor_NonPrimitiveValues_Rejected() {
        IndexMap name = new IndexMap("name", false);
        IndexMap tags = new IndexMap("tags", true);

        assertThatThrownBy(() -> name.entriesFor(Documents.of("name", List.of("a"))))
            .isInstanceOf(InvalidFieldValueException.class)
            .hasMessageContaining("field: name");
        assertThatThrownBy(() -> tags.entriesFor(Documents.of("tags", List.of(Map.of("a", 1)))))
            .isInstanceOf(InvalidFieldValueException.class)
            .hasMessageContaining("multi-entry element");
    }

    @Test
    void remove_LastDocument_PrunesBucket() {
        // given
        IndexMap tags = new IndexMap("tags", true);
        Map<String, Object> first = Documents.of("id", "1", "tags", List.of("x", "y"));
        Map<String, Object> second = Documents.of("id", "2", "tags", List.of("y"));
        index(tags, first);
        index(tags, second);

        // when
        tags.remove(key("1"), tags.entriesFor(first));

        // then
        assertThat(tags.bucketCount()).isEqualTo(1);
        assertThat(tags.bucketSize(key("x"))).isZero();
        assertThat(tags.bucket(key("y"))).containsOnlyKeys(key("2"));
        assertThat(tags.snapshot()).containsOnlyKeys("y");
    }

    @Test
    void bucket_IsReadOnly() {
        IndexMap name = new IndexMap("name", false);
        index(name, Documents.of("id", "1", "name", "A"));

        assertThatThrownBy(() -> name.bucket(key("A")).clear())
            .isInstanceOf(UnsupportedOperationException.class);
        assertThat(name.bucket(key("missing"))).isEmpty();
    }

    @Test
    void range_ReturnsOrderedSubRangeOfSameKind() {
        // given
        IndexMap age = new IndexMap("age", false);
        index(age, Documents.of("id", "a", "age", 40));
        index(age, Documents.of("id", "b", "age", 10));
        index(age, Documents.of("id", "c", "age", 25));
        index(age, Documents.of("id", "d", "age", "unknown"));
        index(age, Documents.of("id", "e", "age", true));

        // when & then
        assertThat(age.range(key(10), true, key(40), false).keySet())
            .containsExactly(key("b"), key("c"));
        assertThat(age.range(key(10), false, null, false).keySet())
            .containsExactly(key("c"), key("a"));
        assertThat(age.range(null, false, key(25), true).keySet())
            .containsExactly(key("b"), key("c"));
        assertThat(age.range(key(50), true, key(10), true)).isEmpty();
    }

    @Test
    void range_InvalidBounds_Rejected() {
        IndexMap age = new IndexMap("age", false);

        assertThatThrownBy(() -> age.range(null, true, null, true))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> age.range(key(1), true, key(Instant.EPOCH), true))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("same kind");
    }

    @Test
    void snapshot_RawValuesToRawKeys() {
        IndexMap name = new IndexMap("name", false);
        index(name, Documents.of("id", "2", "name", "B"));
        index(name, Documents.of("id", "1", "name", "A"));
        index(name, Documents.of("id", "3", "name", "A"));

        assertThat(name.snapshot()).containsExactly(
            Map.entry("A", List.<Object>of("1", "3")),
            Map.entry("B", List.<Object>of("2"))
        );
    }
}
