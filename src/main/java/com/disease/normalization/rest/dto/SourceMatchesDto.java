package com.disease.normalization.rest.dto;

import com.disease.normalization.api.SourceMatches;
import com.disease.normalization.core.model.SourceMetadata;

import java.util.List;

/**
 * Per-source part of a search response.
 */
public record SourceMatchesDto(
        String sourceName,
        String matchType,
        int score,
        List<SourceRecordDto> records,
        SourceMetadata sourceMeta
) {
    public static SourceMatchesDto from(SourceMatches matches) {
        return new SourceMatchesDto(
                matches.source().getDisplayName(),
                matches.matchType().name(),
                matches.matchType().getScore(),
                matches.records().stream().map(SourceRecordDto::from).toList(),
                matches.metadata()
        );
    }
}
