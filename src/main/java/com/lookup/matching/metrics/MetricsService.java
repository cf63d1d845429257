package com.lookup.matching.metrics;

import com.lookup.matching.core.model.MatchType;
import com.lookup.matching.review.ReviewEventKind;

import java.time.Duration;

/**
 * Interface for recording lookup and review metrics.
 * The default {@link NoOpMetricsService} does nothing, so the library works
 * without a metrics registry wired in.
 */
public interface MetricsService {

    void recordLookupDuration(MatchType matchType, Duration duration);

    void recordConfidence(double confidence);

    void recordBatchSize(int size);

    void recordCacheHit();

    void recordCacheMiss();

    void incrementReviewDecision(ReviewEventKind kind, int matchCount);
}
