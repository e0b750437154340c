package com.disease.normalization.api;

import com.disease.normalization.cache.CaffeineNormalizationCache;
import com.disease.normalization.cache.NoOpNormalizationCache;
import com.disease.normalization.cache.NormalizationCache;
import com.disease.normalization.cache.RebuildListener;
import com.disease.normalization.core.model.SourceName;
import com.disease.normalization.graph.CypherExecutor;
import com.disease.normalization.graph.FalkorDBConnection;
import com.disease.normalization.graph.GraphConnection;
import com.disease.normalization.health.ConceptStoreHealthCheck;
import com.disease.normalization.health.FalkorDBHealthCheck;
import com.disease.normalization.health.HealthCheckRegistry;
import com.disease.normalization.health.HealthStatus;
import com.disease.normalization.logging.LogContext;
import com.disease.normalization.merge.CrossReferenceGraphBuilder;
import com.disease.normalization.merge.MergeRebuilder;
import com.disease.normalization.merge.RebuildFailedException;
import com.disease.normalization.merge.RebuildResult;
import com.disease.normalization.merge.RecordMerger;
import com.disease.normalization.metrics.MetricsService;
import com.disease.normalization.metrics.NoOpMetricsService;
import com.disease.normalization.store.ConceptStore;
import com.disease.normalization.store.GraphConceptStore;
import com.disease.normalization.store.InMemoryConceptStore;
import com.disease.normalization.tracing.NoOpTracingService;
import com.disease.normalization.tracing.Span;
import com.disease.normalization.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Main entry point of the disease normalizer.
 *
 * <p>Wires a {@link ConceptStore} to the {@link MergeRebuilder} and the
 * {@link MatchEngine}, and adds caching, metrics, tracing and health checks
 * around them.</p>
 *
 * <h2>Example usage:</h2>
 * <pre>
 * DiseaseNormalizer normalizer = DiseaseNormalizer.builder()
 *     .falkorDB("localhost", 6379, "diseases")
 *     .build();
 *
 * RebuildResult rebuild = normalizer.rebuildMerges();
 * NormalizationResult result = normalizer.normalize("NSCLC");
 * result.getNormalized().ifPresent(r -&gt; System.out.println(r.conceptId()));
 * </pre>
 *
 * <p>Queries may run concurrently with each other and with a rebuild. Rebuilds
 * are serialized: a call made while another rebuild is running fails at once.</p>
 */
public class DiseaseNormalizer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(DiseaseNormalizer.class);

    /** Error message of a rebuild rejected because another one holds the lock. */
    public static final String REBUILD_IN_PROGRESS = "A rebuild is already in progress";

    private final ConceptStore store;
    private final GraphConnection connection;
    private final boolean ownsConnection;
    private final MergeRebuilder rebuilder;
    private final MatchEngine matchEngine;
    private final NormalizationCache cache;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final HealthCheckRegistry healthCheckRegistry;
    private final ReentrantLock rebuildLock = new ReentrantLock();

    private DiseaseNormalizer(Builder builder) {
        this.connection = builder.connection;
        this.ownsConnection = builder.ownsConnection;
        NormalizerOptions options = builder.options;
        this.metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        this.tracingService = builder.tracingService != null
                ? builder.tracingService : new NoOpTracingService();

        if (builder.store != null) {
            this.store = builder.store;
        } else if (connection != null) {
            this.store = new GraphConceptStore(new CypherExecutor(connection), options.isCreateIndexes());
        } else {
            this.store = new InMemoryConceptStore();
        }

        if (builder.cache != null) {
            this.cache = builder.cache;
        } else if (options.getCacheConfig().enabled()) {
            this.cache = new CaffeineNormalizationCache(options.getCacheConfig());
        } else {
            this.cache = new NoOpNormalizationCache();
        }

        RecordMerger recordMerger = new RecordMerger();
        this.rebuilder = new MergeRebuilder(store, new CrossReferenceGraphBuilder(), recordMerger,
                metricsService, tracingService);
        if (cache instanceof RebuildListener rebuildListener) {
            rebuilder.addRebuildListener(rebuildListener);
        }
        this.matchEngine = new MatchEngine(store, recordMerger);

        this.healthCheckRegistry = new HealthCheckRegistry();
        if (connection != null) {
            healthCheckRegistry.register(new FalkorDBHealthCheck(connection));
        }
        healthCheckRegistry.register(new ConceptStoreHealthCheck(store));

        log.info("normalizer.initialized store={} options={}", store.getClass().getSimpleName(), options);

        if (options.isRebuildOnStartup() && !store.isPopulated()) {
            RebuildResult result = rebuildMerges();
            if (result.isFailure()) {
                log.warn("normalizer.startup.rebuild.failed error={}", result.errorMessage());
            }
        }
    }

    // ========== Rebuild API ==========

    /**
     * Recomputes all merge groups and commits the new merged set.
     * Never throws for storage problems; failures come back as a failed result
     * and leave the previous merged set in place.
     */
    public RebuildResult rebuildMerges() {
        long startNanos = System.nanoTime();
        if (!rebuildLock.tryLock()) {
            RebuildFailedException rejected = new RebuildFailedException(REBUILD_IN_PROGRESS);
            log.warn("rebuild.rejected reason={}", rejected.getMessage());
            return RebuildResult.failure(rejected.getMessage(), Duration.ofNanos(System.nanoTime() - startNanos));
        }
        try {
            return rebuilder.rebuild();
        } catch (RebuildFailedException e) {
            return RebuildResult.failure(e.getMessage(), Duration.ofNanos(System.nanoTime() - startNanos));
        } finally {
            rebuildLock.unlock();
        }
    }

    /**
     * Returns true while a rebuild holds the rebuild lock.
     */
    public boolean isRebuildInProgress() {
        return rebuildLock.isLocked();
    }

    // ========== Query API ==========

    /**
     * Normalizes a free-text term or concept id to a merged disease concept.
     */
    public NormalizationResult normalize(String query) {
        String q = query != null ? query : "";
        long startNanos = System.nanoTime();
        try (LogContext logCtx = LogContext.forQuery(LogContext.generateCorrelationId(), "normalize", q);
             Span span = tracingService.startSpan(TracingService.NORMALIZE)) {

            Optional<NormalizationResult> cached = cache.get(q);
            if (cached.isPresent()) {
                metricsService.recordCacheHit();
                span.setAttribute("cacheHit", "true");
                span.setStatus(Span.SpanStatus.OK);
                return cached.get();
            }
            metricsService.recordCacheMiss();

            long generation = cache.generation();
            NormalizationResult result = matchEngine.normalize(q);
            cache.put(q, result, generation);

            span.setAttribute("matchType", result.matchType().name());
            span.setStatus(Span.SpanStatus.OK);
            metricsService.recordNormalizeDuration(result.matchType(),
                    Duration.ofNanos(System.nanoTime() - startNanos));
            log.debug("normalize.completed matchType={} conceptId={}", result.matchType(),
                    result.getNormalized().map(r -> r.conceptId()).orElse(null));
            return result;
        }
    }

    /**
     * Searches every source allowed by the filter.
     */
    public SearchResult search(String query, SourceFilter filter) {
        long startNanos = System.nanoTime();
        try (LogContext logCtx = LogContext.forQuery(LogContext.generateCorrelationId(), "search",
                query != null ? query : "");
             Span span = tracingService.startSpan(TracingService.SEARCH,
                     Map.of("sources", String.valueOf(filter.sources().size())))) {
            SearchResult result = matchEngine.search(query, filter);
            span.setStatus(Span.SpanStatus.OK);
            metricsService.recordSearchDuration(Duration.ofNanos(System.nanoTime() - startNanos));
            return result;
        }
    }

    /**
     * Searches with comma-separated include or exclude source lists.
     *
     * @throws InvalidParameterException if both lists are given or a source name is unknown
     */
    public SearchResult search(String query, String incl, String excl) {
        return search(query, SourceFilter.of(incl, excl));
    }

    /**
     * Searches a single source.
     */
    public SourceMatches search(SourceName source, String query) {
        return search(query, SourceFilter.only(source)).forSource(source);
    }

    // ========== Health & access ==========

    public HealthStatus health() {
        return healthCheckRegistry.checkAll();
    }

    public HealthCheckRegistry getHealthCheckRegistry() {
        return healthCheckRegistry;
    }

    public ConceptStore getStore() {
        return store;
    }

    public NormalizationCache getCache() {
        return cache;
    }

    @Override
    public void close() {
        if (ownsConnection && connection != null) {
            try {
                connection.close();
            } catch (Exception e) {
                log.warn("normalizer.close.failed error={}", e.getMessage());
            }
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private GraphConnection connection;
        private boolean ownsConnection = false;
        private ConceptStore store;
        private NormalizerOptions options = NormalizerOptions.defaults();
        private NormalizationCache cache;
        private MetricsService metricsService;
        private TracingService tracingService;

        /**
         * Uses a graph store over an existing connection. The caller keeps ownership.
         */
        public Builder graphConnection(GraphConnection connection) {
            this.connection = connection;
            this.ownsConnection = false;
            return this;
        }

        /**
         * Opens a FalkorDB connection owned and closed by the normalizer.
         */
        public Builder falkorDB(String host, int port, String graphName) {
            this.connection = new FalkorDBConnection(host, port, graphName);
            this.ownsConnection = true;
            return this;
        }

        /**
         * Uses the given store. Takes precedence over a graph connection, which
         * then only backs the FalkorDB health check.
         */
        public Builder store(ConceptStore store) {
            this.store = store;
            return this;
        }

        public Builder options(NormalizerOptions options) {
            this.options = options;
            return this;
        }

        public Builder cache(NormalizationCache cache) {
            this.cache = cache;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        public DiseaseNormalizer build() {
            return new DiseaseNormalizer(this);
        }
    }
}
