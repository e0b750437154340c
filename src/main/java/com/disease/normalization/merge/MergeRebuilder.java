package com.disease.normalization.merge;

import com.disease.normalization.cache.RebuildListener;
import com.disease.normalization.core.model.MergeGroup;
import com.disease.normalization.core.model.MergedRecord;
import com.disease.normalization.core.model.SourceRecord;
import com.disease.normalization.logging.LogContext;
import com.disease.normalization.metrics.MetricsService;
import com.disease.normalization.metrics.NoOpMetricsService;
import com.disease.normalization.store.ConceptStore;
import com.disease.normalization.store.StoreException;
import com.disease.normalization.tracing.NoOpTracingService;
import com.disease.normalization.tracing.Span;
import com.disease.normalization.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Recomputes all merge groups from the stored source records and commits the
 * resulting merged records.
 *
 * <p>Rebuild process:</p>
 * <ol>
 *   <li>load every source record into an immutable {@link SourceRecordSnapshot}</li>
 *   <li>group records with the {@link CrossReferenceGraphBuilder}</li>
 *   <li>merge every multi-member group with the {@link RecordMerger}</li>
 *   <li>replace the stored merged set in one atomic call</li>
 * </ol>
 *
 * <p>Singletons are not persisted; queries synthesize them on demand. A failure
 * while loading or committing raises {@link RebuildFailedException} and leaves
 * the previous merged set visible. Callers are responsible for not running two
 * rebuilds concurrently.</p>
 */
public class MergeRebuilder {
    private static final Logger log = LoggerFactory.getLogger(MergeRebuilder.class);

    private final ConceptStore store;
    private final CrossReferenceGraphBuilder graphBuilder;
    private final RecordMerger recordMerger;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final List<RebuildListener> rebuildListeners = new CopyOnWriteArrayList<>();

    public MergeRebuilder(ConceptStore store) {
        this(store, new CrossReferenceGraphBuilder(), new RecordMerger(),
                new NoOpMetricsService(), new NoOpTracingService());
    }

    public MergeRebuilder(ConceptStore store,
                          CrossReferenceGraphBuilder graphBuilder,
                          RecordMerger recordMerger,
                          MetricsService metricsService,
                          TracingService tracingService) {
        this.store = store;
        this.graphBuilder = graphBuilder;
        this.recordMerger = recordMerger;
        this.metricsService = metricsService;
        this.tracingService = tracingService;
    }

    /**
     * Runs a full rebuild.
     *
     * @return the committed result
     * @throws RebuildFailedException if the snapshot could not be read or the merged set not committed
     */
    public RebuildResult rebuild() {
        long startNanos = System.nanoTime();
        try (LogContext logCtx = LogContext.forRebuild(LogContext.generateCorrelationId());
             Span span = tracingService.startSpan(TracingService.REBUILD)) {
            log.info("rebuild.starting");
            try {
                RebuildResult result = doRebuild(startNanos);
                span.setAttribute("groups", result.groupCount());
                span.setAttribute("mergedRecords", result.mergedRecordCount());
                span.setAttribute("integrityIssues", result.issues().size());
                span.setStatus(Span.SpanStatus.OK);
                metricsService.recordRebuildDuration(true, result.duration());
                metricsService.recordRebuildGroups(result.groupCount(), result.mergedRecordCount());
                metricsService.recordIntegrityIssues(result.issues().size());
                notifyRebuildListeners(result);
                return result;
            } catch (RebuildFailedException e) {
                span.recordException(e);
                span.setStatus(Span.SpanStatus.ERROR);
                metricsService.recordRebuildDuration(false, elapsed(startNanos));
                log.error("rebuild.failed error={}", e.getMessage());
                throw e;
            }
        }
    }

    private RebuildResult doRebuild(long startNanos) {
        List<SourceRecord> loaded;
        try {
            loaded = store.loadAllSourceRecords();
        } catch (StoreException e) {
            throw new RebuildFailedException("Failed to load source records: " + e.getMessage(), e);
        }
        SourceRecordSnapshot snapshot = SourceRecordSnapshot.of(loaded);
        log.debug("rebuild.snapshot records={}", snapshot.size());

        GroupingResult grouping = graphBuilder.build(snapshot);

        List<MergedRecord> merged = new ArrayList<>();
        for (MergeGroup group : grouping.groups()) {
            if (!group.isSingleton()) {
                merged.add(recordMerger.merge(group, grouping.membersOf(group)));
            }
        }

        try {
            store.replaceMergedRecords(merged);
        } catch (StoreException e) {
            throw new RebuildFailedException("Failed to commit merged records: " + e.getMessage(), e);
        }

        RebuildResult result = RebuildResult.success(grouping.groups().size(), merged.size(),
                grouping.issues(), elapsed(startNanos));
        logIntegritySummary(result);
        log.info("rebuild.completed records={} groups={} mergedRecords={} durationMs={}",
                snapshot.size(), result.groupCount(), result.mergedRecordCount(),
                result.duration().toMillis());
        return result;
    }

    private void logIntegritySummary(RebuildResult result) {
        if (result.issues().isEmpty()) {
            return;
        }
        log.warn("rebuild.integrity issues={} byType={}", result.issues().size(), result.issueCounts());
        if (log.isDebugEnabled()) {
            for (DataIntegrityIssue issue : result.issues()) {
                log.debug("rebuild.integrity.issue {}", issue);
            }
        }
    }

    private static Duration elapsed(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    /**
     * Registers a listener called after every committed rebuild.
     */
    public void addRebuildListener(RebuildListener listener) {
        if (listener != null) {
            rebuildListeners.add(listener);
        }
    }

    public void removeRebuildListener(RebuildListener listener) {
        rebuildListeners.remove(listener);
    }

    private void notifyRebuildListeners(RebuildResult result) {
        for (RebuildListener listener : rebuildListeners) {
            try {
                listener.onRebuild(result.groupCount(), result.mergedRecordCount());
            } catch (Exception e) {
                log.warn("rebuild.listener.failed listener={} error={}",
                        listener.getClass().getSimpleName(), e.getMessage());
            }
        }
    }
}
