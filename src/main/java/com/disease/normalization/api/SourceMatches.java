package com.disease.normalization.api;

import com.disease.normalization.core.model.MatchType;
import com.disease.normalization.core.model.SourceMetadata;
import com.disease.normalization.core.model.SourceName;
import com.disease.normalization.core.model.SourceRecord;

import java.util.List;

/**
 * Search outcome for a single source.
 *
 * @param source    the source searched
 * @param matchType best tier reached in this source, NO_MATCH if none
 * @param records   every record of the source at that tier, sorted by concept id
 * @param metadata  the source's metadata, null if none is stored
 */
public record SourceMatches(
        SourceName source,
        MatchType matchType,
        List<SourceRecord> records,
        SourceMetadata metadata
) {
    public SourceMatches {
        records = records != null ? List.copyOf(records) : List.of();
    }

    public static SourceMatches noMatch(SourceName source, SourceMetadata metadata) {
        return new SourceMatches(source, MatchType.NO_MATCH, List.of(), metadata);
    }
}
