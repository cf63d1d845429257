package com.lookup.matching.review;

import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A fuzzy match under review. Immutable: status and selection changes produce a copy.
 */
public final class FuzzyMatchForReview {

    private static final Pattern ROW_ID = Pattern.compile("^row_(\\d+)");
    // Matches below this confidence carry their own value as an explicit suggestion
    private static final double SUGGESTION_CONFIDENCE_CEILING = 0.8;
    private static final String SUGGESTION_REASON = "Fuzzy match suggestion";

    private final String id;
    private final String rowId;
    private final String fieldName;
    private final String inputValue;
    private final String suggestedValue;
    private final double confidence;
    private final int rowIndex;
    private final List<ReviewSuggestion> suggestions;
    private final ReviewStatus status;
    private final String manualValue;
    private final boolean selected;

    private FuzzyMatchForReview(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.rowId = Objects.requireNonNull(builder.rowId, "rowId is required");
        this.fieldName = Objects.requireNonNull(builder.fieldName, "fieldName is required");
        this.inputValue = builder.inputValue;
        this.suggestedValue = builder.suggestedValue;
        this.confidence = builder.confidence;
        this.rowIndex = builder.rowIndex;
        this.suggestions = builder.suggestions != null ? List.copyOf(builder.suggestions) : List.of();
        this.status = builder.status != null ? builder.status : ReviewStatus.PENDING;
        this.manualValue = builder.manualValue;
        this.selected = builder.selected;
    }

    /**
     * Wraps a fuzzy match loaded at the given position of a review batch.
     * The ID is derived from the row ID, field name and position, so reloading
     * the same batch yields the same IDs.
     */
    public static FuzzyMatchForReview from(FuzzyMatch match, int ordinal) {
        List<ReviewSuggestion> suggestions = match.confidence() < SUGGESTION_CONFIDENCE_CEILING
                ? List.of(new ReviewSuggestion(match.suggestedValue(), match.confidence(), SUGGESTION_REASON))
                : List.of();
        return builder()
                .id("match_" + match.rowId() + "_" + match.fieldName() + "_" + ordinal)
                .rowId(match.rowId())
                .fieldName(match.fieldName())
                .inputValue(match.inputValue())
                .suggestedValue(match.suggestedValue())
                .confidence(match.confidence())
                .rowIndex(rowIndex(match.rowId(), ordinal))
                .suggestions(suggestions)
                .build();
    }

    static int rowIndex(String rowId, int ordinal) {
        Matcher m = ROW_ID.matcher(rowId);
        if (m.find()) {
            try {
                return Integer.parseInt(m.group(1));
            } catch (NumberFormatException e) {
                return ordinal;
            }
        }
        return ordinal;
    }

    public String getId() {
        return id;
    }

    public String getRowId() {
        return rowId;
    }

    public String getFieldName() {
        return fieldName;
    }

    public String getInputValue() {
        return inputValue;
    }

    public String getSuggestedValue() {
        return suggestedValue;
    }

    public double getConfidence() {
        return confidence;
    }

    public int getRowIndex() {
        return rowIndex;
    }

    public List<ReviewSuggestion> getSuggestions() {
        return suggestions;
    }

    public ReviewStatus getStatus() {
        return status;
    }

    /**
     * The accepted or manually entered value; null while pending or when rejected before any decision.
     */
    public String getManualValue() {
        return manualValue;
    }

    public boolean isSelected() {
        return selected;
    }

    public boolean isPending() {
        return status == ReviewStatus.PENDING;
    }

    /**
     * The value this match resolves to under its current decision, or null if pending or rejected.
     */
    public String getResolvedValue() {
        return status == ReviewStatus.ACCEPTED || status == ReviewStatus.MANUAL ? manualValue : null;
    }

    FuzzyMatchForReview accepted(String value) {
        return toBuilder().status(ReviewStatus.ACCEPTED).manualValue(value != null ? value : suggestedValue).build();
    }

    FuzzyMatchForReview rejected() {
        return toBuilder().status(ReviewStatus.REJECTED).build();
    }

    FuzzyMatchForReview manual(String value) {
        return toBuilder().status(ReviewStatus.MANUAL).manualValue(value).build();
    }

    FuzzyMatchForReview withSelected(boolean selected) {
        if (this.selected == selected) {
            return this;
        }
        return toBuilder().selected(selected).build();
    }

    FuzzyMatchForReview reset() {
        if (status == ReviewStatus.PENDING && manualValue == null && !selected) {
            return this;
        }
        return toBuilder().status(ReviewStatus.PENDING).manualValue(null).selected(false).build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FuzzyMatchForReview that = (FuzzyMatchForReview) o;
        return Double.compare(that.confidence, confidence) == 0
                && rowIndex == that.rowIndex
                && selected == that.selected
                && id.equals(that.id)
                && rowId.equals(that.rowId)
                && fieldName.equals(that.fieldName)
                && Objects.equals(inputValue, that.inputValue)
                && Objects.equals(suggestedValue, that.suggestedValue)
                && suggestions.equals(that.suggestions)
                && status == that.status
                && Objects.equals(manualValue, that.manualValue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, status, manualValue, selected);
    }

    @Override
    public String toString() {
        return "FuzzyMatchForReview{" +
                "id='" + id + '\'' +
                ", input='" + inputValue + '\'' +
                ", suggested='" + suggestedValue + '\'' +
                ", confidence=" + confidence +
                ", status=" + status +
                '}';
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .rowId(rowId)
                .fieldName(fieldName)
                .inputValue(inputValue)
                .suggestedValue(suggestedValue)
                .confidence(confidence)
                .rowIndex(rowIndex)
                .suggestions(suggestions)
                .status(status)
                .manualValue(manualValue)
                .selected(selected);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String rowId;
        private String fieldName;
        private String inputValue;
        private String suggestedValue;
        private double confidence;
        private int rowIndex;
        private List<ReviewSuggestion> suggestions;
        private ReviewStatus status;
        private String manualValue;
        private boolean selected;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder rowId(String rowId) {
            this.rowId = rowId;
            return this;
        }

        public Builder fieldName(String fieldName) {
            this.fieldName = fieldName;
            return this;
        }

        public Builder inputValue(String inputValue) {
            this.inputValue = inputValue;
            return this;
        }

        public Builder suggestedValue(String suggestedValue) {
            this.suggestedValue = suggestedValue;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder rowIndex(int rowIndex) {
            this.rowIndex = rowIndex;
            return this;
        }

        public Builder suggestions(List<ReviewSuggestion> suggestions) {
            this.suggestions = suggestions;
            return this;
        }

        public Builder status(ReviewStatus status) {
            this.status = status;
            return this;
        }

        public Builder manualValue(String manualValue) {
            this.manualValue = manualValue;
            return this;
        }

        public Builder selected(boolean selected) {
            this.selected = selected;
            return this;
        }

        public FuzzyMatchForReview build() {
            return new FuzzyMatchForReview(this);
        }
    }
}
