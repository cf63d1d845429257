package com.lookup.matching.review;

/**
 * Fixed confidence buckets used in review statistics, highest first.
 */
public enum ConfidenceBucket {
    VERY_HIGH("0.9-1.0", 0.9),
    HIGH("0.8-0.9", 0.8),
    MEDIUM("0.7-0.8", 0.7),
    LOW("0.6-0.7", 0.6),
    VERY_LOW("0.0-0.6", 0.0);

    private final String label;
    private final double lowerBound;

    ConfidenceBucket(String label, double lowerBound) {
        this.label = label;
        this.lowerBound = lowerBound;
    }

    public String getLabel() {
        return label;
    }

    public double getLowerBound() {
        return lowerBound;
    }

    public static ConfidenceBucket forConfidence(double confidence) {
        for (ConfidenceBucket bucket : values()) {
            if (confidence >= bucket.lowerBound) {
                return bucket;
            }
        }
        return VERY_LOW;
    }
}
