package com.disease.normalization.rest.dto;

import com.disease.normalization.api.SearchResult;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Response DTO for multi-source search, keyed by source display name.
 */
public record SearchResponse(
        String query,
        List<WarningDto> warnings,
        Map<String, SourceMatchesDto> sourceMatches
) {
    public static SearchResponse from(SearchResult result) {
        Map<String, SourceMatchesDto> matches = new LinkedHashMap<>();
        result.sourceMatches().forEach((source, sourceMatches) ->
                matches.put(source.getDisplayName(), SourceMatchesDto.from(sourceMatches)));
        return new SearchResponse(result.query(), WarningDto.fromAll(result.warnings()), matches);
    }
}
