package com.lookup.matching.cache;

/**
 * Snapshot of lookup cache activity.
 *
 * @param hits                 lookups answered from the cache
 * @param misses               lookups that had to be computed
 * @param evictions            entries dropped for size or age
 * @param entries              cached results right now
 * @param datasets             datasets with at least one cached result
 * @param datasetInvalidations times a dataset's results were dropped because it changed
 * @param rejected             results not cached: unmatched when those are excluded, or over a dataset's cap
 */
public record CacheStats(long hits, long misses, long evictions, long entries,
                         int datasets, long datasetInvalidations, long rejected) {

    private static final CacheStats EMPTY = new CacheStats(0, 0, 0, 0, 0, 0, 0);

    /**
     * Share of lookups answered from the cache, 0 when nothing was looked up.
     */
    public double hitRate() {
        long total = hits + misses;
        return total == 0 ? 0.0 : (double) hits / total;
    }

    public static CacheStats empty() {
        return EMPTY;
    }
}
