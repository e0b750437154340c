package com.disease.normalization.api;

import com.disease.normalization.core.model.SourceName;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Result of a multi-source search.
 *
 * @param query         the query as given
 * @param sourceMatches per-source outcome for every searched source, in priority order
 * @param warnings      query warnings
 */
public record SearchResult(
        String query,
        Map<SourceName, SourceMatches> sourceMatches,
        List<QueryWarning> warnings
) {
    public SearchResult {
        sourceMatches = Collections.unmodifiableMap(new EnumMap<>(sourceMatches));
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public SourceMatches forSource(SourceName source) {
        return sourceMatches.get(source);
    }
}
