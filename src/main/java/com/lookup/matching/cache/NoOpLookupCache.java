package com.lookup.matching.cache;

import com.lookup.matching.core.model.LookupResult;
import com.lookup.matching.core.model.MatchConfig;

import java.util.Optional;

/**
 * No-op cache implementation. Used as the default when caching is disabled.
 */
public class NoOpLookupCache implements LookupCache {

    @Override
    public Optional<LookupResult> get(String datasetId, MatchConfig config, String inputValue) {
        return Optional.empty();
    }

    @Override
    public void put(String datasetId, MatchConfig config, String inputValue, LookupResult result) {
        // no-op
    }

    @Override
    public void invalidate(String datasetId) {
        // no-op
    }

    @Override
    public void invalidateAll() {
        // no-op
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
