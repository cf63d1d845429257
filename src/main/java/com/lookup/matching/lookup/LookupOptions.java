package com.lookup.matching.lookup;

import com.lookup.matching.normalization.NormalizationOptions;
import com.lookup.matching.similarity.SimilarityWeights;

/**
 * Engine-wide options for lookup matching.
 * Per-field settings (columns, threshold, derived fields) live in
 * {@link com.lookup.matching.core.model.MatchConfig}.
 */
public class LookupOptions {

    private static final double DEFAULT_NORMALIZED_CONFIDENCE = 0.95;
    private static final int DEFAULT_MAX_SUGGESTIONS = 3;
    private static final int DEFAULT_BATCH_SIZE = 1_000;

    private final double normalizedConfidence;
    private final boolean fuzzyMatchingEnabled;
    private final int maxSuggestions;
    private final NormalizationOptions normalization;
    private final SimilarityWeights similarityWeights;
    private final int batchSize;

    private LookupOptions(Builder builder) {
        this.normalizedConfidence = builder.normalizedConfidence;
        this.fuzzyMatchingEnabled = builder.fuzzyMatchingEnabled;
        this.maxSuggestions = builder.maxSuggestions;
        this.normalization = builder.normalization;
        this.similarityWeights = builder.similarityWeights;
        this.batchSize = builder.batchSize;
    }

    /**
     * Fixed confidence assigned to normalized-tier matches.
     */
    public double getNormalizedConfidence() {
        return normalizedConfidence;
    }

    public boolean isFuzzyMatchingEnabled() {
        return fuzzyMatchingEnabled;
    }

    public int getMaxSuggestions() {
        return maxSuggestions;
    }

    public NormalizationOptions getNormalization() {
        return normalization;
    }

    public SimilarityWeights getSimilarityWeights() {
        return similarityWeights;
    }

    /**
     * Number of inputs between progress reports in batch lookups.
     */
    public int getBatchSize() {
        return batchSize;
    }

    public static LookupOptions defaults() {
        return builder().build();
    }

    /**
     * Exact and normalized tiers only, no guessing.
     */
    public static LookupOptions strict() {
        return builder().fuzzyMatchingEnabled(false).maxSuggestions(0).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private double normalizedConfidence = DEFAULT_NORMALIZED_CONFIDENCE;
        private boolean fuzzyMatchingEnabled = true;
        private int maxSuggestions = DEFAULT_MAX_SUGGESTIONS;
        private NormalizationOptions normalization = NormalizationOptions.defaults();
        private SimilarityWeights similarityWeights = SimilarityWeights.defaultWeights();
        private int batchSize = DEFAULT_BATCH_SIZE;

        public Builder normalizedConfidence(double normalizedConfidence) {
            if (normalizedConfidence < 0.0 || normalizedConfidence > 1.0) {
                throw new IllegalArgumentException("normalizedConfidence must be between 0.0 and 1.0");
            }
            this.normalizedConfidence = normalizedConfidence;
            return this;
        }

        public Builder fuzzyMatchingEnabled(boolean fuzzyMatchingEnabled) {
            this.fuzzyMatchingEnabled = fuzzyMatchingEnabled;
            return this;
        }

        public Builder maxSuggestions(int maxSuggestions) {
            if (maxSuggestions < 0) {
                throw new IllegalArgumentException("maxSuggestions must not be negative");
            }
            this.maxSuggestions = maxSuggestions;
            return this;
        }

        public Builder normalization(NormalizationOptions normalization) {
            this.normalization = normalization;
            return this;
        }

        public Builder similarityWeights(SimilarityWeights similarityWeights) {
            this.similarityWeights = similarityWeights;
            return this;
        }

        public Builder batchSize(int batchSize) {
            if (batchSize <= 0) {
                throw new IllegalArgumentException("batchSize must be positive");
            }
            this.batchSize = batchSize;
            return this;
        }

        public LookupOptions build() {
            return new LookupOptions(this);
        }
    }

    @Override
    public String toString() {
        return "LookupOptions{" +
                "normalizedConfidence=" + normalizedConfidence +
                ", fuzzyMatchingEnabled=" + fuzzyMatchingEnabled +
                ", maxSuggestions=" + maxSuggestions +
                ", normalization=" + normalization +
                ", similarityWeights=" + similarityWeights +
                ", batchSize=" + batchSize +
                '}';
    }
}
