package com.disease.normalization.api;

import com.disease.normalization.cache.CacheConfig;

/**
 * Options for a {@link DiseaseNormalizer}.
 */
public class NormalizerOptions {

    private final CacheConfig cacheConfig;
    private final boolean createIndexes;
    private final boolean rebuildOnStartup;

    private NormalizerOptions(Builder builder) {
        this.cacheConfig = builder.cacheConfig;
        this.createIndexes = builder.createIndexes;
        this.rebuildOnStartup = builder.rebuildOnStartup;
    }

    public CacheConfig getCacheConfig() {
        return cacheConfig;
    }

    /**
     * Whether the graph store should create its indexes and version pointer on startup.
     */
    public boolean isCreateIndexes() {
        return createIndexes;
    }

    /**
     * Whether a rebuild runs when the normalizer is built and the store holds
     * source records but no merged records yet.
     */
    public boolean isRebuildOnStartup() {
        return rebuildOnStartup;
    }

    public static NormalizerOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private CacheConfig cacheConfig = CacheConfig.defaults();
        private boolean createIndexes = true;
        private boolean rebuildOnStartup = false;

        public Builder cacheConfig(CacheConfig cacheConfig) {
            if (cacheConfig == null) {
                throw new IllegalArgumentException("cacheConfig must not be null");
            }
            this.cacheConfig = cacheConfig;
            return this;
        }

        public Builder createIndexes(boolean createIndexes) {
            this.createIndexes = createIndexes;
            return this;
        }

        public Builder rebuildOnStartup(boolean rebuildOnStartup) {
            this.rebuildOnStartup = rebuildOnStartup;
            return this;
        }

        public NormalizerOptions build() {
            return new NormalizerOptions(this);
        }
    }

    @Override
    public String toString() {
        return "NormalizerOptions{" +
                "cacheConfig=" + cacheConfig +
                ", createIndexes=" + createIndexes +
                ", rebuildOnStartup=" + rebuildOnStartup +
                '}';
    }
}
