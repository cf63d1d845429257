package com.lookup.matching.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One immutable row of a reference dataset: column name to typed value.
 * An absent column ({@link #get} returns {@code null}) is distinct from a present
 * {@link ReferenceValue#NULL} cell.
 */
public final class ReferenceRow {

    private final Map<String, ReferenceValue> values;

    private ReferenceRow(Map<String, ReferenceValue> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    /**
     * Creates a row from raw values, converting each with {@link ReferenceValue#of(Object)}.
     *
     * @throws IllegalArgumentException if a value has an unsupported type or a column name is null
     */
    public static ReferenceRow of(Map<String, ?> raw) {
        Objects.requireNonNull(raw, "raw values are required");
        Map<String, ReferenceValue> converted = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : raw.entrySet()) {
            if (entry.getKey() == null) {
                throw new IllegalArgumentException("Column names must not be null");
            }
            converted.put(entry.getKey(), ReferenceValue.of(entry.getValue()));
        }
        return new ReferenceRow(converted);
    }

    /**
     * Returns the value of a column, or {@code null} if the row has no such column.
     */
    public ReferenceValue get(String column) {
        return column == null ? null : values.get(column);
    }

    /**
     * Returns the comparison text of a column, or {@code null} if absent or NULL.
     */
    public String getText(String column) {
        ReferenceValue value = get(column);
        return value == null ? null : value.asText();
    }

    public boolean hasColumn(String column) {
        return column != null && values.containsKey(column);
    }

    public Set<String> columns() {
        return values.keySet();
    }

    public Map<String, ReferenceValue> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return values.equals(((ReferenceRow) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "ReferenceRow" + values;
    }
}
