package com.lookup.matching.core.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * A typed scalar cell of a reference row.
 * Raw values are converted once, at dataset ingestion, through {@link #of(Object)}.
 */
public final class ReferenceValue {

    public static final ReferenceValue NULL = new ReferenceValue(ValueType.NULL, null);
    private static final ReferenceValue TRUE = new ReferenceValue(ValueType.BOOLEAN, Boolean.TRUE);
    private static final ReferenceValue FALSE = new ReferenceValue(ValueType.BOOLEAN, Boolean.FALSE);

    private final ValueType type;
    private final Object value;

    private ReferenceValue(ValueType type, Object value) {
        this.type = type;
        this.value = value;
    }

    /**
     * Converts a raw cell value.
     *
     * @param raw a {@link String}, {@link Number}, {@link Boolean}, existing {@code ReferenceValue} or {@code null}
     * @throws IllegalArgumentException for any other type, or a non-finite number
     */
    public static ReferenceValue of(Object raw) {
        if (raw == null) {
            return NULL;
        }
        if (raw instanceof ReferenceValue rv) {
            return rv;
        }
        if (raw instanceof String s) {
            return ofString(s);
        }
        if (raw instanceof Boolean b) {
            return ofBoolean(b);
        }
        if (raw instanceof BigDecimal bd) {
            return new ReferenceValue(ValueType.NUMBER, bd);
        }
        if (raw instanceof Double || raw instanceof Float) {
            double d = ((Number) raw).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new IllegalArgumentException("Reference values must be finite numbers, got " + raw);
            }
            return new ReferenceValue(ValueType.NUMBER, BigDecimal.valueOf(d));
        }
        if (raw instanceof Number n) {
            return new ReferenceValue(ValueType.NUMBER, new BigDecimal(n.toString()));
        }
        throw new IllegalArgumentException("Unsupported reference value type: " + raw.getClass().getName());
    }

    public static ReferenceValue ofString(String value) {
        return value == null ? NULL : new ReferenceValue(ValueType.STRING, value);
    }

    public static ReferenceValue ofBoolean(boolean value) {
        return value ? TRUE : FALSE;
    }

    public static ReferenceValue ofNumber(BigDecimal value) {
        return value == null ? NULL : new ReferenceValue(ValueType.NUMBER, value);
    }

    public ValueType getType() {
        return type;
    }

    public boolean isNull() {
        return type == ValueType.NULL;
    }

    /**
     * Returns the underlying Java value: a String, BigDecimal, Boolean or {@code null}.
     */
    public Object getValue() {
        return value;
    }

    /**
     * Text used when comparing this value against lookup input.
     * Numbers render in plain notation without trailing zeros; {@code NULL} renders as {@code null}.
     */
    public String asText() {
        return switch (type) {
            case STRING -> (String) value;
            case NUMBER -> ((BigDecimal) value).stripTrailingZeros().toPlainString();
            case BOOLEAN -> value.toString();
            case NULL -> null;
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ReferenceValue that = (ReferenceValue) o;
        if (type != that.type) return false;
        if (type == ValueType.NUMBER) {
            return ((BigDecimal) value).compareTo((BigDecimal) that.value) == 0;
        }
        return Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        if (type == ValueType.NUMBER) {
            return Objects.hash(type, ((BigDecimal) value).stripTrailingZeros());
        }
        return Objects.hash(type, value);
    }

    @Override
    public String toString() {
        return type == ValueType.STRING ? "\"" + value + "\"" : String.valueOf(value);
    }
}
