package com.lookup.matching.cache;

import com.lookup.matching.core.model.LookupResult;
import com.lookup.matching.core.model.MatchConfig;

import java.util.Optional;

/**
 * Cache of lookup results for stored datasets.
 * Keyed by dataset ID + match configuration + raw input value.
 */
public interface LookupCache {

    /**
     * Gets a cached lookup result.
     *
     * @return the cached result, or empty if not cached
     */
    Optional<LookupResult> get(String datasetId, MatchConfig config, String inputValue);

    /**
     * Caches a lookup result.
     */
    void put(String datasetId, MatchConfig config, String inputValue, LookupResult result);

    /**
     * Invalidates all entries computed against the given dataset.
     *
     * @param datasetId the dataset whose entries should be invalidated
     */
    void invalidate(String datasetId);

    /**
     * Invalidates all cache entries.
     */
    void invalidateAll();

    /**
     * Returns cache statistics.
     */
    CacheStats getStats();

    /**
     * Creates the cache described by a configuration: Caffeine-backed when enabled, a no-op otherwise.
     */
    static LookupCache create(CacheConfig config) {
        return config != null && config.enabled() ? new CaffeineLookupCache(config) : new NoOpLookupCache();
    }
}
