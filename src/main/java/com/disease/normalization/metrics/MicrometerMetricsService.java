package com.disease.normalization.metrics;

import com.disease.normalization.core.model.MatchType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code disease.rebuild.duration}: Timer (tag: outcome)</li>
 *   <li>{@code disease.rebuild.groups}: DistributionSummary of merge groups per rebuild</li>
 *   <li>{@code disease.rebuild.merged}: DistributionSummary of merged records per rebuild</li>
 *   <li>{@code disease.rebuild.integrity.issues}: Counter</li>
 *   <li>{@code disease.normalize.duration}: Timer (tag: matchType)</li>
 *   <li>{@code disease.search.duration}: Timer</li>
 *   <li>{@code disease.cache.hit} / {@code disease.cache.miss}: Counters</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final DistributionSummary groupSummary;
    private final DistributionSummary mergedSummary;
    private final Counter integrityIssueCounter;
    private final Timer searchTimer;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.groupSummary = DistributionSummary.builder("disease.rebuild.groups")
                .description("Merge groups produced per rebuild")
                .register(registry);
        this.mergedSummary = DistributionSummary.builder("disease.rebuild.merged")
                .description("Multi-member merged records produced per rebuild")
                .register(registry);
        this.integrityIssueCounter = Counter.builder("disease.rebuild.integrity.issues")
                .description("Data integrity issues reported by rebuilds")
                .register(registry);
        this.searchTimer = Timer.builder("disease.search.duration")
                .description("Duration of per-source search queries")
                .register(registry);
        this.cacheHitCounter = Counter.builder("disease.cache.hit")
                .description("Number of normalization cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("disease.cache.miss")
                .description("Number of normalization cache misses")
                .register(registry);
    }

    @Override
    public void recordRebuildDuration(boolean success, Duration duration) {
        String outcome = success ? "success" : "failure";
        Timer timer = timerCache.computeIfAbsent("rebuild:" + outcome, k ->
                Timer.builder("disease.rebuild.duration")
                        .description("Duration of merge rebuilds")
                        .tag("outcome", outcome)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordRebuildGroups(int groupCount, int mergedRecordCount) {
        groupSummary.record(groupCount);
        mergedSummary.record(mergedRecordCount);
    }

    @Override
    public void recordIntegrityIssues(int issueCount) {
        integrityIssueCounter.increment(issueCount);
    }

    @Override
    public void recordNormalizeDuration(MatchType matchType, Duration duration) {
        Timer timer = timerCache.computeIfAbsent("normalize:" + matchType.name(), k ->
                Timer.builder("disease.normalize.duration")
                        .description("Duration of normalize queries")
                        .tag("matchType", matchType.name())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordSearchDuration(Duration duration) {
        searchTimer.record(duration);
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }
}
