package com.lookup.matching.metrics;

import com.lookup.matching.core.model.MatchType;
import com.lookup.matching.review.ReviewEventKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code lookup.duration}: Timer (tag: matchType)</li>
 *   <li>{@code lookup.confidence}: DistributionSummary</li>
 *   <li>{@code lookup.batch.size}: DistributionSummary</li>
 *   <li>{@code lookup.cache.hit}: Counter</li>
 *   <li>{@code lookup.cache.miss}: Counter</li>
 *   <li>{@code review.decisions}: Counter (tag: kind), incremented by affected match count</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<MatchType, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<ReviewEventKind, Counter> decisionCounters = new ConcurrentHashMap<>();
    private final DistributionSummary confidenceSummary;
    private final DistributionSummary batchSizeSummary;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.confidenceSummary = DistributionSummary.builder("lookup.confidence")
                .description("Distribution of confidence scores of matched lookups")
                .register(registry);
        this.batchSizeSummary = DistributionSummary.builder("lookup.batch.size")
                .description("Distribution of batch lookup sizes")
                .register(registry);
        this.cacheHitCounter = Counter.builder("lookup.cache.hit")
                .description("Number of lookup cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("lookup.cache.miss")
                .description("Number of lookup cache misses")
                .register(registry);
    }

    @Override
    public void recordLookupDuration(MatchType matchType, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(matchType, type ->
                Timer.builder("lookup.duration")
                        .description("Duration of single lookups")
                        .tag("matchType", type.name())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordConfidence(double confidence) {
        confidenceSummary.record(confidence);
    }

    @Override
    public void recordBatchSize(int size) {
        batchSizeSummary.record(size);
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }

    @Override
    public void incrementReviewDecision(ReviewEventKind kind, int matchCount) {
        Counter counter = decisionCounters.computeIfAbsent(kind, k ->
                Counter.builder("review.decisions")
                        .description("Number of matches resolved in review, by decision kind")
                        .tag("kind", k.name())
                        .register(registry));
        counter.increment(matchCount);
    }
}
