package com.disease.normalization.merge;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Outcome of a merge rebuild.
 *
 * @param success           whether the new merged set was committed
 * @param groupCount        number of merge groups, singletons included
 * @param mergedRecordCount number of multi-member merged records committed
 * @param issues            integrity issues found while grouping
 * @param errorMessage      failure reason, null on success
 * @param duration          wall-clock time of the rebuild
 */
public record RebuildResult(
        boolean success,
        int groupCount,
        int mergedRecordCount,
        List<DataIntegrityIssue> issues,
        String errorMessage,
        Duration duration
) {
    public RebuildResult {
        issues = issues != null ? List.copyOf(issues) : List.of();
        duration = duration != null ? duration : Duration.ZERO;
    }

    public static RebuildResult success(int groupCount, int mergedRecordCount,
                                        List<DataIntegrityIssue> issues, Duration duration) {
        return new RebuildResult(true, groupCount, mergedRecordCount, issues, null, duration);
    }

    public static RebuildResult failure(String errorMessage, Duration duration) {
        return new RebuildResult(false, 0, 0, List.of(), errorMessage, duration);
    }

    public boolean isFailure() {
        return !success;
    }

    /**
     * Counts issues per type, in type declaration order.
     */
    public Map<IntegrityIssueType, Long> issueCounts() {
        Map<IntegrityIssueType, Long> counts = new TreeMap<>();
        for (DataIntegrityIssue issue : issues) {
            counts.merge(issue.type(), 1L, Long::sum);
        }
        return counts;
    }
}
