package com.disease.normalization.cache;

/**
 * Configuration for the normalization cache.
 *
 * @param maxSize    maximum number of cached queries
 * @param ttlSeconds time-to-live in seconds for each entry
 * @param enabled    whether caching is enabled
 */
public record CacheConfig(int maxSize, int ttlSeconds, boolean enabled) {

    public CacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be > 0");
        }
    }

    /**
     * 50,000 entries, one hour TTL, enabled. Entries are also dropped on every rebuild.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(50_000, 3_600, true);
    }

    public static CacheConfig disabled() {
        return new CacheConfig(1, 1, false);
    }
}
