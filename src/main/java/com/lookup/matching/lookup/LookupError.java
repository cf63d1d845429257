package com.lookup.matching.lookup;

import java.util.List;
import java.util.Objects;

/**
 * A value that could not be resolved, with any near candidates.
 *
 * @param rowId       the row the value came from
 * @param fieldName   the lookup field
 * @param inputValue  the raw value
 * @param type        why it was not resolved
 * @param message     human-readable description
 * @param suggestions candidate texts, best first
 */
public record LookupError(
        String rowId,
        String fieldName,
        String inputValue,
        LookupErrorType type,
        String message,
        List<String> suggestions
) {
    public LookupError {
        Objects.requireNonNull(type, "type is required");
        suggestions = suggestions != null ? List.copyOf(suggestions) : List.of();
    }
}
