package com.lookup.matching.core.model;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A named, columnar reference dataset: an ordered list of rows sharing a fixed column set.
 * Validated once at construction so that lookups never re-check row shape.
 */
public final class ReferenceDataset {

    private final String id;
    private final String name;
    private final List<String> columns;
    private final List<ReferenceRow> rows;

    private ReferenceDataset(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.name = builder.name != null ? builder.name : builder.id;
        this.columns = List.copyOf(builder.columns);
        this.rows = List.copyOf(builder.rows);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public List<String> getColumns() {
        return columns;
    }

    public List<ReferenceRow> getRows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public boolean hasColumn(String column) {
        return column != null && columns.contains(column);
    }

    public DatasetMetadata metadata() {
        return new DatasetMetadata(id, name, columns, rows.size());
    }

    @Override
    public String toString() {
        return "ReferenceDataset{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", columns=" + columns +
                ", rows=" + rows.size() +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String name;
        private final Set<String> columns = new LinkedHashSet<>();
        private boolean columnsDeclared = false;
        private final List<ReferenceRow> rows = new ArrayList<>();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        /**
         * Declares the dataset's columns. When omitted, columns are inferred from
         * the rows in first-seen order.
         *
         * @throws IllegalArgumentException on duplicate or null column names
         */
        public Builder columns(List<String> columns) {
            for (String column : columns) {
                if (column == null) {
                    throw new IllegalArgumentException("Column names must not be null");
                }
                if (!this.columns.add(column)) {
                    throw new IllegalArgumentException("Duplicate column: " + column);
                }
            }
            this.columnsDeclared = true;
            return this;
        }

        public Builder columns(String... columns) {
            return columns(List.of(columns));
        }

        public Builder row(ReferenceRow row) {
            rows.add(Objects.requireNonNull(row, "row must not be null"));
            return this;
        }

        public Builder row(Map<String, ?> raw) {
            return row(ReferenceRow.of(raw));
        }

        public Builder rows(List<? extends Map<String, ?>> raw) {
            raw.forEach(r -> row(ReferenceRow.of(r)));
            return this;
        }

        /**
         * @throws IllegalArgumentException if a row uses a column that was not declared
         */
        public ReferenceDataset build() {
            for (int i = 0; i < rows.size(); i++) {
                for (String column : rows.get(i).columns()) {
                    if (columnsDeclared && !columns.contains(column)) {
                        throw new IllegalArgumentException(
                                "Row " + i + " uses undeclared column '" + column + "'");
                    }
                    columns.add(column);
                }
            }
            return new ReferenceDataset(this);
        }
    }
}
