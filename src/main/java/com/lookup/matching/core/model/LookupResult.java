package com.lookup.matching.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of resolving one input value against one reference dataset.
 * Produced fresh for every lookup and never mutated.
 */
public final class LookupResult {

    private final String inputValue;
    private final boolean matched;
    private final double confidence;
    private final MatchType matchType;
    private final ReferenceValue matchedValue;
    private final Map<String, ReferenceValue> derivedValues;
    private final List<LookupSuggestion> suggestions;
    private final ReferenceRow matchedRow;

    private LookupResult(Builder builder) {
        if (builder.confidence < 0.0 || builder.confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be between 0.0 and 1.0");
        }
        this.inputValue = builder.inputValue != null ? builder.inputValue : "";
        this.matchType = Objects.requireNonNull(builder.matchType, "matchType is required");
        this.matched = matchType != MatchType.NONE;
        this.confidence = matched ? builder.confidence : 0.0;
        this.matchedValue = matched && builder.matchedValue != null ? builder.matchedValue : ReferenceValue.NULL;
        this.derivedValues = matched
                ? Collections.unmodifiableMap(new LinkedHashMap<>(builder.derivedValues))
                : Map.of();
        this.suggestions = builder.suggestions != null ? List.copyOf(builder.suggestions) : List.of();
        this.matchedRow = matched ? builder.matchedRow : null;
    }

    /**
     * Creates a no-match result carrying no suggestions.
     */
    public static LookupResult noMatch(String inputValue) {
        return builder().inputValue(inputValue).matchType(MatchType.NONE).build();
    }

    /**
     * Creates a no-match result that still offers the closest candidates.
     */
    public static LookupResult noMatch(String inputValue, List<LookupSuggestion> suggestions) {
        return builder().inputValue(inputValue).matchType(MatchType.NONE).suggestions(suggestions).build();
    }

    public String getInputValue() {
        return inputValue;
    }

    public boolean isMatched() {
        return matched;
    }

    public double getConfidence() {
        return confidence;
    }

    public MatchType getMatchType() {
        return matchType;
    }

    /**
     * The matched row's target-column value; {@link ReferenceValue#NULL} when unmatched.
     */
    public ReferenceValue getMatchedValue() {
        return matchedValue;
    }

    public Map<String, ReferenceValue> getDerivedValues() {
        return derivedValues;
    }

    public List<LookupSuggestion> getSuggestions() {
        return suggestions;
    }

    /**
     * The reference row that won, or {@code null} when unmatched.
     */
    public ReferenceRow getMatchedRow() {
        return matchedRow;
    }

    @Override
    public String toString() {
        return "LookupResult{" +
                "inputValue='" + inputValue + '\'' +
                ", matched=" + matched +
                ", matchType=" + matchType +
                ", confidence=" + confidence +
                ", matchedValue=" + matchedValue +
                ", derivedValues=" + derivedValues +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String inputValue;
        private double confidence;
        private MatchType matchType;
        private ReferenceValue matchedValue;
        private final Map<String, ReferenceValue> derivedValues = new LinkedHashMap<>();
        private List<LookupSuggestion> suggestions;
        private ReferenceRow matchedRow;

        public Builder inputValue(String inputValue) {
            this.inputValue = inputValue;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder matchType(MatchType matchType) {
            this.matchType = matchType;
            return this;
        }

        public Builder matchedValue(ReferenceValue matchedValue) {
            this.matchedValue = matchedValue;
            return this;
        }

        public Builder derivedValue(String fieldName, ReferenceValue value) {
            this.derivedValues.put(fieldName, value);
            return this;
        }

        public Builder suggestions(List<LookupSuggestion> suggestions) {
            this.suggestions = suggestions;
            return this;
        }

        public Builder matchedRow(ReferenceRow matchedRow) {
            this.matchedRow = matchedRow;
            return this;
        }

        public LookupResult build() {
            return new LookupResult(this);
        }
    }
}
