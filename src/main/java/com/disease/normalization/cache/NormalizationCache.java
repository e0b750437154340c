package com.disease.normalization.cache;

import com.disease.normalization.api.NormalizationResult;

import java.util.Optional;

/**
 * Cache of normalize results keyed by the case-folded query.
 * Since matching ignores case, queries differing only in case share an entry.
 */
public interface NormalizationCache {

    Optional<NormalizationResult> get(String query);

    void put(String query, NormalizationResult result);

    /**
     * Count of invalidations so far. Read it before computing a result that is
     * later stored with {@link #put(String, NormalizationResult, long)}.
     */
    long generation();

    /**
     * Stores the result unless an invalidation happened after {@code generation}
     * was read, so a result computed against an older merged set is never kept.
     */
    void put(String query, NormalizationResult result, long generation);

    /**
     * Drops every entry; called when a new merged set becomes visible.
     */
    void invalidateAll();

    CacheStats getStats();
}
