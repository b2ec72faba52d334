package com.warden.core.model;

import java.io.Serializable;
import java.math.BigDecimal;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only context attached to an {@link Action}.
 * <p>
 * Condition operators never read the raw map directly; they go through the
 * typed accessors below so that every coercion rule lives in one place.
 * Numeric comparisons are exact and value-based: {@code 5}, {@code 5L} and
 * {@code 5.0} are the same value, and longs above 2^53 keep every digit. A
 * non-numeric value read as a number is an error, never a silent zero.
 */
public final class ActionMetadata implements Serializable {

    private static final ActionMetadata EMPTY = new ActionMetadata(Map.of());

    private final Map<String, Object> values;

    private ActionMetadata(Map<String, Object> values) {
        this.values = values;
    }

    public static ActionMetadata of(Map<String, ?> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        return new ActionMetadata(ImmutableValues.copyOf(values));
    }

    public static ActionMetadata empty() {
        return EMPTY;
    }

    public boolean containsKey(String key) {
        return values.containsKey(key);
    }

    /** Raw value, or {@code null} when absent. */
    public Object get(String key) {
        return values.get(key);
    }

    public Optional<String> getString(String key) {
        Object value = values.get(key);
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof String s) {
            return Optional.of(s);
        }
        throw new IllegalArgumentException(
                "Metadata '" + key + "' is not a string: " + value.getClass().getSimpleName());
    }

    /**
     * Compares the numeric value of {@code key} with {@code other} exactly,
     * reading an absent or null value as zero.
     *
     * @return negative, zero or positive as the value is less than, equal to or greater than {@code other}
     * @throws IllegalArgumentException if the value is present but not a number
     */
    public int compareNumber(String key, Number other) {
        Object value = values.get(key);
        if (value == null) {
            return compare(BigDecimal.ZERO, other);
        }
        if (value instanceof Number n) {
            return compare(n, other);
        }
        throw new IllegalArgumentException(
                "Metadata '" + key + "' is not numeric: " + value);
    }

    public boolean valueEquals(String key, Object expected) {
        return sameValue(values.get(key), expected);
    }

    /** True when the value of {@code key} (null when absent) is a member of {@code allowed}. */
    public boolean valueIn(String key, Collection<?> allowed) {
        Object actual = values.get(key);
        for (Object candidate : allowed) {
            if (sameValue(actual, candidate)) {
                return true;
            }
        }
        return false;
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    static boolean sameValue(Object a, Object b) {
        if (a instanceof Number x && b instanceof Number y) {
            return compare(x, y) == 0;
        }
        return Objects.equals(a, b);
    }

    private static int compare(Number x, Number y) {
        try {
            return new BigDecimal(x.toString()).compareTo(new BigDecimal(y.toString()));
        } catch (NumberFormatException e) {
            // NaN and infinities have no BigDecimal form
            return Double.compare(x.doubleValue(), y.doubleValue());
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ActionMetadata other)) return false;
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
