package com.lookup.matching.review;

import java.util.Objects;

/**
 * A fuzzy lookup outcome handed to review.
 *
 * @param rowId          the imported row
 * @param fieldName      the lookup field
 * @param inputValue     the raw imported value
 * @param suggestedValue the value the lookup matched
 * @param confidence     match confidence in [0, 1]
 */
public record FuzzyMatch(String rowId, String fieldName, String inputValue, String suggestedValue,
                         double confidence) {

    public FuzzyMatch {
        Objects.requireNonNull(rowId, "rowId is required");
        Objects.requireNonNull(fieldName, "fieldName is required");
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be between 0.0 and 1.0, got " + confidence);
        }
    }
}
