package com.ryuqq.ramify.engine;

import com.ryuqq.ramify.core.document.FieldPath;
import com.ryuqq.ramify.core.exception.InvalidFieldValueException;
import com.ryuqq.ramify.core.model.IndexValue;
import com.ryuqq.ramify.engine.index.IndexMap;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * One field condition: a path, an operator and its normalized operands.
 *
 * <p>A condition answers two questions:</p>
 * <ul>
 *   <li>{@link #matches(Map)}: does a stored document satisfy it (always re-checked)</li>
 *   <li>{@link #candidates(IndexMap)}: which documents an index can narrow it to, or
 *       {@code null} when the index cannot help</li>
 * </ul>
 *
 * <p><strong>Matching rules:</strong></p>
 * <ul>
 *   <li>EQUALS scalar: equal value, or a stored list containing it</li>
 *   <li>EQUALS list: stored list with the same elements (any order, same length)</li>
 *   <li>ANY_OF: stored value, or any stored element, among the operands</li>
 *   <li>ALL_OF: stored list containing every operand</li>
 *   <li>NOT_EQUALS: a primitive (or list of primitives) not equal to / not containing the operand</li>
 *   <li>Range: stored value (or any stored element) of the bounds' kind, inside the bounds.
 *       Values of another kind never match</li>
 * </ul>
 */
final class Condition {

    private final String field;
    private final FieldPath path;
    private final WhereOperator operator;
    private final List<IndexValue> operands;
    private final Set<IndexValue> operandSet;
    private final boolean listEquality;
    private final IndexValue lower;
    private final boolean lowerInclusive;
    private final IndexValue upper;
    private final boolean upperInclusive;

    private Condition(String field, WhereOperator operator, List<IndexValue> operands, boolean listEquality,
                      IndexValue lower, boolean lowerInclusive, IndexValue upper, boolean upperInclusive) {
        this.field = field;
        this.path = FieldPath.of(field);
        this.operator = operator;
        this.operands = operands;
        this.operandSet = new LinkedHashSet<>(operands);
        this.listEquality = listEquality;
        this.lower = lower;
        this.lowerInclusive = lowerInclusive;
        this.upper = upper;
        this.upperInclusive = upperInclusive;
    }

    static Condition equalTo(String field, Object value) {
        if (value instanceof List) {
            List<IndexValue> elements = new ArrayList<>();
            for (Object element : (List<?>) value) {
                elements.add(operand(field, element));
            }
            return new Condition(field, WhereOperator.EQUALS, elements, true, null, false, null, false);
        }
        return new Condition(field, WhereOperator.EQUALS, List.of(operand(field, value)), false,
            null, false, null, false);
    }

    static Condition anyOf(String field, Collection<?> values) {
        return new Condition(field, WhereOperator.ANY_OF, distinctOperands(field, values), false,
            null, false, null, false);
    }

    static Condition allOf(String field, Collection<?> values) {
        return new Condition(field, WhereOperator.ALL_OF, distinctOperands(field, values), false,
            null, false, null, false);
    }

    static Condition notEqualTo(String field, Object value) {
        return new Condition(field, WhereOperator.NOT_EQUALS, List.of(operand(field, value)), false,
            null, false, null, false);
    }

    static Condition above(String field, Object bound, boolean inclusive) {
        return new Condition(field, inclusive ? WhereOperator.ABOVE_OR_EQUAL : WhereOperator.ABOVE, List.of(), false,
            bound(field, bound), inclusive, null, false);
    }

    static Condition below(String field, Object bound, boolean inclusive) {
        return new Condition(field, inclusive ? WhereOperator.BELOW_OR_EQUAL : WhereOperator.BELOW, List.of(), false,
            null, false, bound(field, bound), inclusive);
    }

    static Condition between(String field, Object lower, Object upper,
                             boolean lowerInclusive, boolean upperInclusive) {
        IndexValue from = bound(field, lower);
        IndexValue to = bound(field, upper);
        if (from.kind() != to.kind()) {
            throw new InvalidFieldValueException(field,
                "between bounds must be of the same kind (lower: " + from.kind() + ", upper: " + to.kind() + ")");
        }
        return new Condition(field, WhereOperator.BETWEEN, List.of(), false,
            from, lowerInclusive, to, upperInclusive);
    }

    String field() {
        return field;
    }

    WhereOperator operator() {
        return operator;
    }

    /**
     * Evaluates the condition against a stored document.
     */
    boolean matches(Map<String, Object> document) {
        Object value = path.resolve(document);
        switch (operator) {
            case EQUALS:
                return listEquality ? sameElements(value) : anyValue(value, operandSet::contains);
            case ANY_OF:
                return anyValue(value, operandSet::contains);
            case ALL_OF:
                return value instanceof List && keysOf((List<?>) value).containsAll(operandSet);
            case NOT_EQUALS:
                if (value instanceof List) {
                    return !keysOf((List<?>) value).contains(operands.get(0));
                }
                return IndexValue.isPrimitive(value) && !IndexValue.of(value).equals(operands.get(0));
            default:
                return anyValue(value, this::inRange);
        }
    }

    /**
     * Primary keys this condition pins down when it targets the primary key.
     *
     * @return keys to look up, or null when the condition cannot be answered by lookups
     */
    List<IndexValue> primaryKeyLookups() {
        if (operator == WhereOperator.EQUALS) {
            return listEquality ? List.of() : operands;
        }
        if (operator == WhereOperator.ANY_OF) {
            return operands;
        }
        return null;
    }

    /**
     * Narrows the candidates through an index on this condition's field.
     *
     * @param index index on {@link #field()}
     * @return primary key → document, or null when the index cannot narrow this condition
     */
    Map<IndexValue, Map<String, Object>> candidates(IndexMap index) {
        switch (operator) {
            case EQUALS:
                if (!listEquality) {
                    return index.bucket(operands.get(0));
                }
                if (!index.isMultiEntry()) {
                    return Map.of();
                }
                return smallestBucket(index);
            case ANY_OF:
                Map<IndexValue, Map<String, Object>> union = new LinkedHashMap<>();
                for (IndexValue operand : operands) {
                    union.putAll(index.bucket(operand));
                }
                return union;
            case ALL_OF:
                return smallestBucket(index);
            case NOT_EQUALS:
                return null;
            default:
                return index.range(lower, lowerInclusive, upper, upperInclusive);
        }
    }

    @Override
    public String toString() {
        if (operator.isRange()) {
            return field + " " + operator + " [" + (lower == null ? "-" : lower.raw()) + ", "
                + (upper == null ? "-" : upper.raw()) + "]";
        }
        return field + " " + operator + " " + operands;
    }

    // smallest single-value bucket; every matching document is in all of them
    private Map<IndexValue, Map<String, Object>> smallestBucket(IndexMap index) {
        if (operands.isEmpty()) {
            return null;
        }
        IndexValue smallest = operands.get(0);
        for (IndexValue operand : operands) {
            if (index.bucketSize(operand) < index.bucketSize(smallest)) {
                smallest = operand;
            }
        }
        return index.bucket(smallest);
    }

    private boolean sameElements(Object value) {
        if (!(value instanceof List)) {
            return false;
        }
        List<?> stored = (List<?>) value;
        if (stored.size() != operands.size()) {
            return false;
        }
        List<IndexValue> storedKeys = new ArrayList<>(stored.size());
        for (Object element : stored) {
            if (!IndexValue.isPrimitive(element)) {
                return false;
            }
            storedKeys.add(IndexValue.of(element));
        }
        List<IndexValue> expected = new ArrayList<>(operands);
        Collections.sort(storedKeys);
        Collections.sort(expected);
        return storedKeys.equals(expected);
    }

    private boolean inRange(IndexValue value) {
        IndexValue reference = lower != null ? lower : upper;
        if (value.kind() != reference.kind()) {
            return false;
        }
        if (lower != null) {
            int cmp = value.compareTo(lower);
            if (cmp < 0 || (cmp == 0 && !lowerInclusive)) {
                return false;
            }
        }
        if (upper != null) {
            int cmp = value.compareTo(upper);
            if (cmp > 0 || (cmp == 0 && !upperInclusive)) {
                return false;
            }
        }
        return true;
    }

    private static boolean anyValue(Object value, Predicate<IndexValue> test) {
        if (value instanceof List) {
            for (Object element : (List<?>) value) {
                if (IndexValue.isPrimitive(element) && test.test(IndexValue.of(element))) {
                    return true;
                }
            }
            return false;
        }
        return IndexValue.isPrimitive(value) && test.test(IndexValue.of(value));
    }

    private static Set<IndexValue> keysOf(List<?> values) {
        Set<IndexValue> keys = new LinkedHashSet<>();
        for (Object element : values) {
            if (IndexValue.isPrimitive(element)) {
                keys.add(IndexValue.of(element));
            }
        }
        return keys;
    }

    private static List<IndexValue> distinctOperands(String field, Collection<?> values) {
        if (values == null) {
            throw new IllegalArgumentException("values cannot be null");
        }
        Set<IndexValue> distinct = new LinkedHashSet<>();
        for (Object value : values) {
            distinct.add(operand(field, value));
        }
        return List.copyOf(distinct);
    }

    private static IndexValue operand(String field, Object value) {
        if (!IndexValue.isPrimitive(value)) {
            throw new InvalidFieldValueException(field,
                "query value must be a primitive value, got " + (value == null ? "null" : value.getClass().getName()));
        }
        return IndexValue.of(value);
    }

    private static IndexValue bound(String field, Object value) {
        IndexValue bound = operand(field, value);
        if (!bound.isOrdinal()) {
            throw new InvalidFieldValueException(field,
                "range bound must be a number or a date-like value, got " + bound.kind());
        }
        return bound;
    }
}
