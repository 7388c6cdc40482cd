package com.ryuqq.ramify.engine;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable conjunction of equality-style conditions for {@code where(Criteria)}.
 *
 * <p><strong>Operators:</strong></p>
 * <ul>
 *   <li>{@code eq(field, scalar)}: stored value equals it, or a stored list contains it</li>
 *   <li>{@code eq(field, list)}: stored list has exactly these elements, in any order</li>
 *   <li>{@code in(field, values)}: stored value (or any stored element) is one of the values</li>
 * </ul>
 *
 * <p>At least one field must be the primary key or a declared index so the planner can
 * start from a lookup. Other fields are allowed and are re-checked on every candidate.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * users.where(Criteria.eq("active", true).andIn("role", List.of("admin", "owner")))
 *      .toArray();
 * </pre>
 *
 * @author Ramify Team
 * @since 1.0.0
 */
public final class Criteria {

    private static final Criteria EMPTY = new Criteria(List.of());

    private final List<Condition> conditions;

    private Criteria(List<Condition> conditions) {
        this.conditions = conditions;
    }

    /**
     * Criteria without conditions (matches everything).
     */
    public static Criteria empty() {
        return EMPTY;
    }

    /**
     * Starts criteria with an equality condition.
     *
     * @param field field path
     * @param value primitive value or list of primitives
     * @return Criteria 인스턴스
     */
    public static Criteria eq(String field, Object value) {
        return EMPTY.andEq(field, value);
    }

    /**
     * Starts criteria with a membership condition.
     *
     * @param field field path
     * @param values accepted primitive values
     * @return Criteria 인스턴스
     */
    public static Criteria in(String field, Collection<?> values) {
        return EMPTY.andIn(field, values);
    }

    /**
     * Converts a plain field → value map, every entry becoming an {@code eq} condition.
     *
     * @param criteria field → value (null 불가)
     * @return Criteria 인스턴스
     */
    public static Criteria from(Map<String, ?> criteria) {
        if (criteria == null) {
            throw new IllegalArgumentException("criteria cannot be null");
        }
        Criteria result = EMPTY;
        for (Map.Entry<String, ?> entry : criteria.entrySet()) {
            result = result.andEq(entry.getKey(), entry.getValue());
        }
        return result;
    }

    /**
     * Adds an equality condition.
     *
     * @return new Criteria 인스턴스
     */
    public Criteria andEq(String field, Object value) {
        return with(Condition.equalTo(field, value));
    }

    /**
     * Adds a membership condition.
     *
     * @return new Criteria 인스턴스
     */
    public Criteria andIn(String field, Collection<?> values) {
        return with(Condition.anyOf(field, values));
    }

    public boolean isEmpty() {
        return conditions.isEmpty();
    }

    /**
     * Fields named by the conditions, in declaration order.
     */
    public Set<String> fields() {
        Set<String> fields = new LinkedHashSet<>();
        for (Condition condition : conditions) {
            fields.add(condition.field());
        }
        return Collections.unmodifiableSet(fields);
    }

    List<Condition> conditions() {
        return conditions;
    }

    @Override
    public String toString() {
        return "Criteria" + conditions;
    }

    private Criteria with(Condition condition) {
        List<Condition> next = new ArrayList<>(conditions.size() + 1);
        next.addAll(conditions);
        next.add(condition);
        return new Criteria(Collections.unmodifiableList(next));
    }
}
