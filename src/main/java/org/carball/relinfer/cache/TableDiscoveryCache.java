package org.carball.relinfer.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import lombok.extern.slf4j.Slf4j;
import org.carball.relinfer.model.dataset.DatasetProfile;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Function;

/**
 * Profiled tables keyed by data source id, bounded in size and expired after a
 * fixed time. Owned by the caller and handed to the engine.
 */
@Slf4j
public class TableDiscoveryCache {

    private final Cache<String, DatasetProfile> profiles;

    public TableDiscoveryCache(long maxSize, Duration expireAfterWrite) {
        this(maxSize, expireAfterWrite, Ticker.systemTicker());
    }

    TableDiscoveryCache(long maxSize, Duration expireAfterWrite, Ticker ticker) {
        this.profiles = Caffeine.newBuilder()
                .maximumSize(maxSize)
                .expireAfterWrite(expireAfterWrite)
                .ticker(ticker)
                .recordStats()
                .build();

        log.debug("Table discovery cache created: maxSize={}, expireAfterWrite={}", maxSize, expireAfterWrite);
    }

    public DatasetProfile get(String sourceId, Function<String, DatasetProfile> loader) {
        return profiles.get(sourceId, loader);
    }

    public Optional<DatasetProfile> getIfPresent(String sourceId) {
        return Optional.ofNullable(profiles.getIfPresent(sourceId));
    }

    public void invalidate(String sourceId) {
        profiles.invalidate(sourceId);
        log.debug("Invalidated cached tables for {}", sourceId);
    }

    public void invalidateAll() {
        profiles.invalidateAll();
    }

    public CacheStats stats() {
        return profiles.stats();
    }
}
