package com.disease.normalization.cache;

import com.disease.normalization.api.NormalizationResult;

import java.util.Optional;

/**
 * Cache that never stores anything. Used when caching is disabled.
 */
public class NoOpNormalizationCache implements NormalizationCache {

    @Override
    public Optional<NormalizationResult> get(String query) {
        return Optional.empty();
    }

    @Override
    public void put(String query, NormalizationResult result) {
        // no-op
    }

    @Override
    public long generation() {
        return 0;
    }

    @Override
    public void put(String query, NormalizationResult result, long generation) {
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
