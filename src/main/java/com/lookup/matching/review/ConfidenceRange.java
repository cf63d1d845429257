package com.lookup.matching.review;

/**
 * Inclusive confidence interval.
 *
 * @param min lower bound, inclusive
 * @param max upper bound, inclusive
 */
public record ConfidenceRange(double min, double max) {

    public ConfidenceRange {
        if (Double.isNaN(min) || Double.isNaN(max) || min > max) {
            throw new IllegalArgumentException("Invalid confidence range [" + min + ", " + max + "]");
        }
    }

    public static ConfidenceRange of(double min, double max) {
        return new ConfidenceRange(min, max);
    }

    public boolean contains(double confidence) {
        return confidence >= min && confidence <= max;
    }
}
