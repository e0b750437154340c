package com.disease.normalization.cache;

import com.disease.normalization.api.NormalizationResult;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Caffeine-backed normalization cache.
 * Implements {@link RebuildListener} so that a committed rebuild empties it.
 */
public class CaffeineNormalizationCache implements NormalizationCache, RebuildListener {
    private static final Logger log = LoggerFactory.getLogger(CaffeineNormalizationCache.class);

    private final Cache<String, NormalizationResult> cache;
    private final AtomicLong generation = new AtomicLong();

    public CaffeineNormalizationCache(CacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .recordStats()
                .build();
        log.info("cache.initialized maxSize={} ttlSeconds={}", config.maxSize(), config.ttlSeconds());
    }

    @Override
    public Optional<NormalizationResult> get(String query) {
        return Optional.ofNullable(cache.getIfPresent(key(query)));
    }

    @Override
    public void put(String query, NormalizationResult result) {
        cache.put(key(query), result);
    }

    @Override
    public long generation() {
        return generation.get();
    }

    @Override
    public void put(String query, NormalizationResult result, long generation) {
        if (this.generation.get() != generation) {
            log.debug("cache.put.skipped reason=invalidated");
            return;
        }
        String key = key(query);
        cache.put(key, result);
        // An invalidation that bumped the generation before this point may have run its invalidateAll before the put.
        if (this.generation.get() != generation) {
            cache.invalidate(key);
        }
    }

    @Override
    public void invalidateAll() {
        generation.incrementAndGet();
        cache.invalidateAll();
        log.debug("cache.invalidated");
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new CacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                caffeineStats.evictionCount(),
                cache.estimatedSize()
        );
    }

    @Override
    public void onRebuild(int groupCount, int mergedRecordCount) {
        invalidateAll();
    }

    private static String key(String query) {
        return query.toLowerCase(Locale.ROOT);
    }
}
