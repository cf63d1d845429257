package com.lookup.matching.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * What to match on and what to bring back for one lookup field.
 *
 * <p>Column names are not checked against any dataset here: a column that a dataset
 * does not have simply produces no match for that dataset.</p>
 *
 * @param sourceColumn   reference column compared against the input
 * @param targetColumn   reference column returned as the matched value
 * @param fuzzyThreshold minimum composite similarity for a fuzzy match, in [0, 1]
 * @param alsoGet        derived fields copied from the matched row
 */
public record MatchConfig(
        String sourceColumn,
        String targetColumn,
        double fuzzyThreshold,
        List<DerivedField> alsoGet
) {
    public static final double DEFAULT_FUZZY_THRESHOLD = 0.8;

    public MatchConfig {
        if (fuzzyThreshold < 0.0 || fuzzyThreshold > 1.0 || Double.isNaN(fuzzyThreshold)) {
            throw new IllegalArgumentException("fuzzyThreshold must be between 0.0 and 1.0");
        }
        alsoGet = alsoGet != null ? List.copyOf(alsoGet) : List.of();
    }

    /**
     * Returns true if both columns are named. An unnamed column can never resolve.
     */
    public boolean hasColumns() {
        return sourceColumn != null && !sourceColumn.isBlank()
                && targetColumn != null && !targetColumn.isBlank();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String sourceColumn;
        private String targetColumn;
        private double fuzzyThreshold = DEFAULT_FUZZY_THRESHOLD;
        private final List<DerivedField> alsoGet = new ArrayList<>();

        public Builder sourceColumn(String sourceColumn) {
            this.sourceColumn = sourceColumn;
            return this;
        }

        public Builder targetColumn(String targetColumn) {
            this.targetColumn = targetColumn;
            return this;
        }

        /**
         * Shorthand for matching on and returning the same column.
         */
        public Builder column(String column) {
            this.sourceColumn = column;
            this.targetColumn = column;
            return this;
        }

        public Builder fuzzyThreshold(double fuzzyThreshold) {
            this.fuzzyThreshold = fuzzyThreshold;
            return this;
        }

        public Builder alsoGet(String sourceColumn, String targetFieldName) {
            this.alsoGet.add(new DerivedField(sourceColumn, targetFieldName));
            return this;
        }

        public Builder alsoGet(List<DerivedField> derivedFields) {
            this.alsoGet.addAll(derivedFields);
            return this;
        }

        public MatchConfig build() {
            return new MatchConfig(sourceColumn, targetColumn, fuzzyThreshold, alsoGet);
        }
    }
}
