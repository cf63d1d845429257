package com.lookup.matching.cache;

import java.time.Duration;
import java.util.Objects;

/**
 * Sizing and retention of cached lookup results.
 *
 * @param maxEntries           total entries across all datasets
 * @param maxEntriesPerDataset entries any one dataset may hold, 0 for no per-dataset cap
 * @param ttl                  how long a result stays valid after it was computed
 * @param cacheUnmatched       whether no-match results are cached
 * @param enabled              whether lookups are cached at all
 */
public record CacheConfig(int maxEntries, int maxEntriesPerDataset, Duration ttl,
                          boolean cacheUnmatched, boolean enabled) {

    public static final int DEFAULT_MAX_ENTRIES = 10_000;
    public static final int DEFAULT_MAX_ENTRIES_PER_DATASET = 0;
    public static final Duration DEFAULT_TTL = Duration.ofMinutes(5);

    public CacheConfig {
        Objects.requireNonNull(ttl, "ttl is required");
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be > 0, got " + maxEntries);
        }
        if (maxEntriesPerDataset < 0 || maxEntriesPerDataset > maxEntries) {
            throw new IllegalArgumentException("maxEntriesPerDataset must be between 0 and maxEntries, got "
                    + maxEntriesPerDataset);
        }
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive, got " + ttl);
        }
    }

    public static CacheConfig defaults() {
        return builder().build();
    }

    public static CacheConfig disabled() {
        return builder().enabled(false).build();
    }

    /**
     * True if the given dataset may hold {@code currentEntries + 1} entries.
     */
    boolean admits(int currentEntries) {
        return maxEntriesPerDataset == 0 || currentEntries < maxEntriesPerDataset;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int maxEntries = DEFAULT_MAX_ENTRIES;
        private int maxEntriesPerDataset = DEFAULT_MAX_ENTRIES_PER_DATASET;
        private Duration ttl = DEFAULT_TTL;
        private boolean cacheUnmatched = true;
        private boolean enabled = true;

        public Builder maxEntries(int maxEntries) {
            this.maxEntries = maxEntries;
            return this;
        }

        public Builder maxEntriesPerDataset(int maxEntriesPerDataset) {
            this.maxEntriesPerDataset = maxEntriesPerDataset;
            return this;
        }

        public Builder ttl(Duration ttl) {
            this.ttl = ttl;
            return this;
        }

        public Builder cacheUnmatched(boolean cacheUnmatched) {
            this.cacheUnmatched = cacheUnmatched;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public CacheConfig build() {
            return new CacheConfig(maxEntries, maxEntriesPerDataset, ttl, cacheUnmatched, enabled);
        }
    }
}
