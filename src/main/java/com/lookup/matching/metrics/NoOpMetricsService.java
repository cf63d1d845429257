package com.lookup.matching.metrics;

import com.lookup.matching.core.model.MatchType;
import com.lookup.matching.review.ReviewEventKind;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordLookupDuration(MatchType matchType, Duration duration) {
    }

    @Override
    public void recordConfidence(double confidence) {
    }

    @Override
    public void recordBatchSize(int size) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }

    @Override
    public void incrementReviewDecision(ReviewEventKind kind, int matchCount) {
    }
}
