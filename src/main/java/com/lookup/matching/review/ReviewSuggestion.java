package com.lookup.matching.review;

/**
 * An alternative value shown next to a match under review.
 */
public record ReviewSuggestion(String value, double confidence, String reason) {
}
