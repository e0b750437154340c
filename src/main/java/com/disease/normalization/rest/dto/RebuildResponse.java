package com.disease.normalization.rest.dto;

import com.disease.normalization.merge.RebuildResult;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Response DTO for a merge rebuild. Issues are reported as counts per type.
 */
public record RebuildResponse(
        boolean success,
        int groupCount,
        int mergedRecordCount,
        int issueCount,
        Map<String, Long> issuesByType,
        String errorMessage,
        long durationMillis
) {
    public static RebuildResponse from(RebuildResult result) {
        return new RebuildResponse(
                result.success(),
                result.groupCount(),
                result.mergedRecordCount(),
                result.issues().size(),
                issuesByType(result),
                result.errorMessage(),
                result.duration().toMillis()
        );
    }

    private static Map<String, Long> issuesByType(RebuildResult result) {
        Map<String, Long> byType = new LinkedHashMap<>();
        result.issueCounts().forEach((type, count) -> byType.put(type.name(), count));
        return byType;
    }
}
