package com.lookup.matching.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.lookup.matching.core.model.LookupResult;
import com.lookup.matching.core.model.MatchConfig;
import com.lookup.matching.store.DatasetChangeListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Caffeine-backed lookup cache with a dataset ID index for targeted invalidation.
 * Implements {@link DatasetChangeListener} so that registering it with a store
 * drops stale entries whenever a dataset is replaced or deleted.
 *
 * <p>A dataset that reached its entry cap stops admitting new results until some of its
 * entries expire, are evicted or are invalidated; other datasets are unaffected.</p>
 */
public class CaffeineLookupCache implements LookupCache, DatasetChangeListener {
    private static final Logger log = LoggerFactory.getLogger(CaffeineLookupCache.class);

    private final CacheConfig config;
    private final Cache<CacheKey, LookupResult> cache;
    // Secondary index: datasetId -> keys computed against that dataset
    private final ConcurrentMap<String, Set<CacheKey>> datasetIndex = new ConcurrentHashMap<>();
    private final AtomicLong datasetInvalidations = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();

    public CaffeineLookupCache(CacheConfig config) {
        this.config = config;
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxEntries())
                .expireAfterWrite(config.ttl())
                .recordStats()
                // Run removal callbacks inline so the index never lags behind the cache
                .executor(Runnable::run)
                .removalListener((key, value, cause) -> {
                    if (key instanceof CacheKey ck && cause != RemovalCause.REPLACED) {
                        removeFromIndex(ck);
                    }
                })
                .build();
        log.info("CaffeineLookupCache initialized: maxEntries={}, maxEntriesPerDataset={}, ttl={}, cacheUnmatched={}",
                config.maxEntries(), config.maxEntriesPerDataset(), config.ttl(), config.cacheUnmatched());
    }

    @Override
    public Optional<LookupResult> get(String datasetId, MatchConfig matchConfig, String inputValue) {
        return Optional.ofNullable(cache.getIfPresent(new CacheKey(datasetId, matchConfig, inputValue)));
    }

    @Override
    public void put(String datasetId, MatchConfig matchConfig, String inputValue, LookupResult result) {
        if (!result.isMatched() && !config.cacheUnmatched()) {
            rejected.incrementAndGet();
            return;
        }
        CacheKey key = new CacheKey(datasetId, matchConfig, inputValue);
        Set<CacheKey> keys = datasetIndex.computeIfAbsent(datasetId, k -> ConcurrentHashMap.newKeySet());
        if (!keys.contains(key) && !config.admits(keys.size())) {
            rejected.incrementAndGet();
            log.debug("lookup.cache.full datasetId={} entries={}", datasetId, keys.size());
            return;
        }
        keys.add(key);
        cache.put(key, result);
    }

    @Override
    public void invalidate(String datasetId) {
        Set<CacheKey> keys = datasetIndex.remove(datasetId);
        if (keys != null) {
            datasetInvalidations.incrementAndGet();
            keys.forEach(cache::invalidate);
            log.debug("Invalidated {} cache entries for dataset {}", keys.size(), datasetId);
        }
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        datasetIndex.clear();
        log.debug("Invalidated all cache entries");
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new CacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                caffeineStats.evictionCount(),
                cache.estimatedSize(),
                (int) datasetIndex.values().stream().filter(keys -> !keys.isEmpty()).count(),
                datasetInvalidations.get(),
                rejected.get()
        );
    }

    @Override
    public void onDatasetChanged(String datasetId) {
        invalidate(datasetId);
    }

    private void removeFromIndex(CacheKey key) {
        Set<CacheKey> keys = datasetIndex.get(key.datasetId());
        if (keys != null) {
            keys.remove(key);
        }
    }

    record CacheKey(String datasetId, MatchConfig config, String inputValue) {}
}
