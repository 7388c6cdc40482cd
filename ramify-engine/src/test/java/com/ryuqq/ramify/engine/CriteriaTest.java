package com.ryuqq.ramify.engine;

import com.ryuqq.ramify.core.document.Documents;
import com.ryuqq.ramify.core.exception.InvalidFieldValueException;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Criteria 테스트.
 *
 * @author Ramify Team
 * @since 1.0.0
 */
class CriteriaTest {

    @Test
    void and_ReturnsNewInstance() {
        // given
        Criteria base = Criteria.eq("status", "PAID");

        // when
        Criteria extended = base.andIn("tier", List.of("gold", "silver"));

        // then
        assertThat(base.fields()).containsExactly("status");
        assertThat(extended.fields()).containsExactly("status", "tier");
        assertThat(extended.conditions()).extracting(Condition::operator)
            .containsExactly(WhereOperator.EQUALS, WhereOperator.ANY_OF);
    }

    @Test
    void from_KeepsMapOrder() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("b", 1);
        map.put("a", "x");

        Criteria criteria = Criteria.from(map);

        assertThat(criteria.fields()).containsExactly("b", "a");
        assertThat(Criteria.from(Map.of()).isEmpty()).isTrue();
    }

    @Test
    void conditions_MatchDocuments() {
        Map<String, Object> document = Documents.of("status", "PAID", "tags", List.of("a", "b"));

        assertThat(Criteria.eq("tags", List.of("b", "a")).conditions().get(0).matches(document)).isTrue();
        assertThat(Criteria.eq("tags", List.of("a")).conditions().get(0).matches(document)).isFalse();
        assertThat(Criteria.eq("tags", "b").conditions().get(0).matches(document)).isTrue();
        assertThat(Criteria.in("status", List.of("NEW", "PAID")).conditions().get(0).matches(document)).isTrue();
    }

    @Test
    void nonPrimitiveValue_Rejected() {
        assertThatThrownBy(() -> Criteria.eq("status", Map.of("nested", true)))
            .isInstanceOf(InvalidFieldValueException.class)
            .hasMessageContaining("primitive");
        assertThatThrownBy(() -> Criteria.in("status", null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Criteria.from(null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
