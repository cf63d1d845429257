package com.lookup.matching.lookup;

/**
 * Options for {@link LookupProcessor}.
 *
 * @param minConfidence   fuzzy matches below this confidence are queued for review
 * @param maxFuzzyMatches cap on queued review items
 */
public record ProcessingOptions(double minConfidence, int maxFuzzyMatches) {

    public static final double DEFAULT_MIN_CONFIDENCE = 0.7;
    public static final int DEFAULT_MAX_FUZZY_MATCHES = 100;

    public ProcessingOptions {
        if (minConfidence < 0.0 || minConfidence > 1.0) {
            throw new IllegalArgumentException("minConfidence must be between 0.0 and 1.0");
        }
        if (maxFuzzyMatches < 0) {
            throw new IllegalArgumentException("maxFuzzyMatches must not be negative");
        }
    }

    public static ProcessingOptions defaults() {
        return new ProcessingOptions(DEFAULT_MIN_CONFIDENCE, DEFAULT_MAX_FUZZY_MATCHES);
    }
}
