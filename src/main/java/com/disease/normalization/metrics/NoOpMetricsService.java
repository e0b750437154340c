package com.disease.normalization.metrics;

import com.disease.normalization.core.model.MatchType;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordRebuildDuration(boolean success, Duration duration) {
    }

    @Override
    public void recordRebuildGroups(int groupCount, int mergedRecordCount) {
    }

    @Override
    public void recordIntegrityIssues(int issueCount) {
    }

    @Override
    public void recordNormalizeDuration(MatchType matchType, Duration duration) {
    }

    @Override
    public void recordSearchDuration(Duration duration) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }
}
