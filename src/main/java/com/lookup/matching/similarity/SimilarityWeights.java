package com.lookup.matching.similarity;

/**
 * Configuration for similarity algorithm weights in composite scoring.
 * Weights need not sum to 1.0; {@link #normalized()} rescales them before use.
 */
public record SimilarityWeights(
        double levenshteinWeight,
        double jaroWeight,
        double jaroWinklerWeight
) {
    public SimilarityWeights {
        if (levenshteinWeight < 0 || jaroWeight < 0 || jaroWinklerWeight < 0) {
            throw new IllegalArgumentException("Weights must be non-negative");
        }
        if (levenshteinWeight + jaroWeight + jaroWinklerWeight <= 0) {
            throw new IllegalArgumentException("At least one weight must be positive");
        }
    }

    /**
     * Default weights: 0.4 Levenshtein, 0.3 Jaro, 0.3 Jaro-Winkler.
     */
    public static SimilarityWeights defaultWeights() {
        return new SimilarityWeights(0.4, 0.3, 0.3);
    }

    /**
     * Weights favoring edit distance (good for typo detection).
     */
    public static SimilarityWeights editDistanceFocused() {
        return new SimilarityWeights(0.6, 0.2, 0.2);
    }

    /**
     * Weights favoring Jaro-Winkler (good for codes and names with common prefixes).
     */
    public static SimilarityWeights prefixFocused() {
        return new SimilarityWeights(0.2, 0.3, 0.5);
    }

    /**
     * Returns these weights rescaled so that they sum to 1.0.
     */
    public SimilarityWeights normalized() {
        double sum = levenshteinWeight + jaroWeight + jaroWinklerWeight;
        return new SimilarityWeights(levenshteinWeight / sum, jaroWeight / sum, jaroWinklerWeight / sum);
    }
}
