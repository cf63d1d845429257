package com.lookup.matching.core.model;

/**
 * An alternative candidate offered alongside a fuzzy lookup result.
 *
 * @param value       the candidate's target-column value
 * @param matchedText the candidate's source-column text that was scored
 * @param confidence  composite similarity of the candidate
 * @param reason      short human-readable explanation
 */
public record LookupSuggestion(ReferenceValue value, String matchedText, double confidence, String reason) {
}
