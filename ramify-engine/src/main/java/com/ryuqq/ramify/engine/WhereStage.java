package com.ryuqq.ramify.engine;

import java.util.Collection;

/**
 * Operators available after {@code where(field)}.
 *
 * <p>Equality operators accept any primitive value. Range operators accept numbers and
 * date-like values; documents whose value has another kind simply do not match. Against a
 * multi-entry (list) field every operator matches when any element satisfies it, except
 * {@link #allOf(Collection)} which needs all operands present.</p>
 *
 * @author Ramify Team
 * @since 1.0.0
 */
public interface WhereStage {

    /**
     * Equal to the value (scalar), or exactly these elements in any order (list value).
     * A stored list matches a scalar when it contains it.
     */
    ExecutableStage equalTo(Object value);

    /**
     * Equal to (or, for lists, containing) any of the values.
     */
    ExecutableStage anyOf(Collection<?> values);

    /**
     * Varargs form of {@link #anyOf(Collection)}.
     */
    ExecutableStage anyOf(Object... values);

    /**
     * Stored list contains every value. Multi-entry fields only.
     *
     * @throws com.ryuqq.ramify.core.exception.InvalidFieldValueException field가 multi-entry가 아닌 경우
     */
    ExecutableStage allOf(Collection<?> values);

    /**
     * Varargs form of {@link #allOf(Collection)}.
     */
    ExecutableStage allOf(Object... values);

    /**
     * Present and not equal to the value (for lists: not containing it).
     */
    ExecutableStage notEqualTo(Object value);

    ExecutableStage above(Object bound);

    ExecutableStage aboveOrEqual(Object bound);

    ExecutableStage below(Object bound);

    ExecutableStage belowOrEqual(Object bound);

    /**
     * Lower bound inclusive, upper bound exclusive.
     */
    ExecutableStage between(Object lower, Object upper);

    /**
     * Range with explicit inclusivity.
     *
     * @param lower lower bound
     * @param upper upper bound
     * @param lowerInclusive whether the lower bound matches
     * @param upperInclusive whether the upper bound matches
     */
    ExecutableStage between(Object lower, Object upper, boolean lowerInclusive, boolean upperInclusive);
}
