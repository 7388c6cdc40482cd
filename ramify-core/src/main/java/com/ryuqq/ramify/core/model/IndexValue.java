package com.ryuqq.ramify.core.model;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Date;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Tagged primitive key used by the primary map and every secondary index.
 *
 * <p>Document values are type-erased ({@code Object}), so keys are normalized into one of
 * four kinds before they are hashed or compared:</p>
 * <ul>
 *   <li><strong>BOOLEAN:</strong> {@link Boolean}</li>
 *   <li><strong>NUMBER:</strong> any {@link Number}. Integral values collapse to {@code long},
 *       so {@code 1}, {@code 1L} and {@code 1.0} are the same key</li>
 *   <li><strong>STRING:</strong> {@link String}, {@link Character}</li>
 *   <li><strong>INSTANT:</strong> date-like values ({@link Instant}, {@link Date},
 *       {@link LocalDate} and {@link LocalDateTime} at UTC, {@link OffsetDateTime},
 *       {@link ZonedDateTime})</li>
 * </ul>
 *
 * <p><strong>Ordering:</strong> total. Kinds are ordered BOOLEAN &lt; NUMBER &lt; STRING &lt;
 * INSTANT, values within a kind by their natural order. Ordered index structures rely on
 * this to answer range queries on a contiguous sub-range.</p>
 *
 * <p>The raw value the key was built from is retained and returned by {@link #raw()},
 * which is what callers see as "the primary key".</p>
 *
 * @author Ramify Team
 * @since 1.0.0
 */
public final class IndexValue implements Comparable<IndexValue> {

    /**
     * Key kinds in their sort order.
     */
    public enum Kind {
        BOOLEAN,
        NUMBER,
        STRING,
        INSTANT
    }

    private final Kind kind;
    private final Comparable<?> normalized;
    private final Object raw;

    private IndexValue(Kind kind, Comparable<?> normalized, Object raw) {
        this.kind = kind;
        this.normalized = normalized;
        this.raw = raw;
    }

    /**
     * Checks whether the value can be used as a key.
     *
     * @param value candidate value (null 허용)
     * @return true if {@link #of(Object)} would accept it
     */
    public static boolean isPrimitive(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Double || value instanceof Float) {
            return !Double.isNaN(((Number) value).doubleValue());
        }
        return value instanceof Boolean
            || value instanceof Number
            || value instanceof String
            || value instanceof Character
            || isDateLike(value);
    }

    /**
     * Creates a key from a primitive value.
     *
     * @param value primitive value
     * @return IndexValue 인스턴스
     * @throws IllegalArgumentException value가 null이거나 primitive가 아닌 경우
     */
    public static IndexValue of(Object value) {
        if (!isPrimitive(value)) {
            throw new IllegalArgumentException(
                "value is not a primitive key: " + describe(value)
            );
        }
        if (value instanceof Boolean) {
            return new IndexValue(Kind.BOOLEAN, (Boolean) value, value);
        }
        if (value instanceof Number) {
            return new IndexValue(Kind.NUMBER, normalizeNumber((Number) value), value);
        }
        if (value instanceof String || value instanceof Character) {
            return new IndexValue(Kind.STRING, value.toString(), value);
        }
        Object raw = value instanceof Date ? ((Date) value).clone() : value;
        return new IndexValue(Kind.INSTANT, toInstant(value), raw);
    }

    /**
     * Key kind.
     *
     * @return kind
     */
    public Kind kind() {
        return kind;
    }

    /**
     * The original value this key was created from.
     *
     * <p>{@link Date} is mutable, so it is cloned on the way in and on the way out.</p>
     *
     * @return raw value
     */
    public Object raw() {
        return raw instanceof Date ? ((Date) raw).clone() : raw;
    }

    /**
     * Whether ordered comparisons (above/below/between) are meaningful for this key.
     *
     * @return true for NUMBER and INSTANT keys
     */
    public boolean isOrdinal() {
        return kind == Kind.NUMBER || kind == Kind.INSTANT;
    }

    @Override
    public int compareTo(IndexValue other) {
        int byKind = kind.compareTo(other.kind);
        if (byKind != 0) {
            return byKind;
        }
        switch (kind) {
            case BOOLEAN:
                return Boolean.compare((Boolean) normalized, (Boolean) other.normalized);
            case NUMBER:
                return compareNumbers(normalized, other.normalized);
            case STRING:
                return ((String) normalized).compareTo((String) other.normalized);
            default:
                return ((Instant) normalized).compareTo((Instant) other.normalized);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        IndexValue that = (IndexValue) o;
        return kind == that.kind && normalized.equals(that.normalized);
    }

    @Override
    public int hashCode() {
        return 31 * kind.hashCode() + normalized.hashCode();
    }

    @Override
    public String toString() {
        return "IndexValue{" + kind + ":" + normalized + '}';
    }

    private static boolean isDateLike(Object value) {
        return value instanceof Instant
            || value instanceof Date
            || value instanceof LocalDate
            || value instanceof LocalDateTime
            || value instanceof OffsetDateTime
            || value instanceof ZonedDateTime;
    }

    private static Instant toInstant(Object value) {
        if (value instanceof Instant) {
            return (Instant) value;
        }
        if (value instanceof Date) {
            return ((Date) value).toInstant();
        }
        if (value instanceof LocalDate) {
            return ((LocalDate) value).atStartOfDay(ZoneOffset.UTC).toInstant();
        }
        if (value instanceof LocalDateTime) {
            return ((LocalDateTime) value).toInstant(ZoneOffset.UTC);
        }
        if (value instanceof OffsetDateTime) {
            return ((OffsetDateTime) value).toInstant();
        }
        return ((ZonedDateTime) value).toInstant();
    }

    // Integral values become Long, everything else Double
    private static Comparable<?> normalizeNumber(Number number) {
        if (number instanceof Long || number instanceof Integer || number instanceof Short
            || number instanceof Byte || number instanceof AtomicInteger || number instanceof AtomicLong) {
            return number.longValue();
        }
        if (number instanceof BigInteger) {
            BigInteger big = (BigInteger) number;
            return big.bitLength() < 64 ? (Comparable<?>) big.longValue() : (Comparable<?>) big.doubleValue();
        }
        if (number instanceof BigDecimal) {
            BigDecimal decimal = (BigDecimal) number;
            if (decimal.signum() == 0 || decimal.stripTrailingZeros().scale() <= 0) {
                try {
                    return decimal.longValueExact();
                } catch (ArithmeticException overflow) {
                    return decimal.doubleValue();
                }
            }
            return decimal.doubleValue();
        }
        double d = number.doubleValue();
        if (!Double.isInfinite(d) && d == Math.rint(d)
            && d >= Long.MIN_VALUE && d < (double) Long.MAX_VALUE) {
            return (long) d;
        }
        return d;
    }

    private static int compareNumbers(Comparable<?> left, Comparable<?> right) {
        if (left instanceof Long && right instanceof Long) {
            return Long.compare((Long) left, (Long) right);
        }
        double l = ((Number) left).doubleValue();
        double r = ((Number) right).doubleValue();
        if (Double.isInfinite(l) || Double.isInfinite(r)) {
            return Double.compare(l, r);
        }
        return toBigDecimal((Number) left).compareTo(toBigDecimal((Number) right));
    }

    private static BigDecimal toBigDecimal(Number number) {
        return number instanceof Long ? BigDecimal.valueOf((Long) number) : BigDecimal.valueOf(number.doubleValue());
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getName();
    }
}
