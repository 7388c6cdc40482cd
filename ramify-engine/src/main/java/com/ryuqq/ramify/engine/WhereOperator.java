package com.ryuqq.ramify.engine;

/**
 * Comparison applied by one query condition.
 *
 * @author Ramify Team
 * @since 1.0.0
 */
public enum WhereOperator {
    EQUALS,
    ANY_OF,
    ALL_OF,
    NOT_EQUALS,
    ABOVE,
    ABOVE_OR_EQUAL,
    BELOW,
    BELOW_OR_EQUAL,
    BETWEEN;

    /**
     * Whether the operator compares by order (numbers and dates only).
     */
    public boolean isRange() {
        return this == ABOVE || this == ABOVE_OR_EQUAL || this == BELOW
            || this == BELOW_OR_EQUAL || this == BETWEEN;
    }
}
