package com.disease.normalization.metrics;

import com.disease.normalization.core.model.MatchType;

import java.time.Duration;

/**
 * Records normalizer metrics.
 * The default {@link NoOpMetricsService} does nothing, so the library works
 * without a metrics backend.
 */
public interface MetricsService {

    void recordRebuildDuration(boolean success, Duration duration);

    void recordRebuildGroups(int groupCount, int mergedRecordCount);

    void recordIntegrityIssues(int issueCount);

    void recordNormalizeDuration(MatchType matchType, Duration duration);

    void recordSearchDuration(Duration duration);

    void recordCacheHit();

    void recordCacheMiss();
}
