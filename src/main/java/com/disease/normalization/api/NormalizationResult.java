package com.disease.normalization.api;

import com.disease.normalization.core.model.MatchType;
import com.disease.normalization.core.model.MergedRecord;
import com.disease.normalization.core.model.SourceMetadata;
import com.disease.normalization.core.model.SourceName;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Result of normalizing a query to a single disease concept.
 *
 * @param matchType        tier that produced the match, NO_MATCH if nothing matched
 * @param normalized       the merged record of the matched group, null on NO_MATCH
 * @param matchedConceptId the source record whose term matched, null on NO_MATCH
 * @param warnings         query warnings
 * @param sourceMetadata   metadata of the normalized concept's source and of every
 *                         source referenced by its mappings, in that order
 */
public record NormalizationResult(
        MatchType matchType,
        MergedRecord normalized,
        String matchedConceptId,
        List<QueryWarning> warnings,
        Map<SourceName, SourceMetadata> sourceMetadata
) {
    public NormalizationResult {
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
        sourceMetadata = sourceMetadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(sourceMetadata))
                : Map.of();
    }

    public NormalizationResult(MatchType matchType, MergedRecord normalized, String matchedConceptId,
                               List<QueryWarning> warnings) {
        this(matchType, normalized, matchedConceptId, warnings, Map.of());
    }

    public static NormalizationResult noMatch(List<QueryWarning> warnings) {
        return new NormalizationResult(MatchType.NO_MATCH, null, null, warnings);
    }

    public boolean isMatch() {
        return matchType.isMatch();
    }

    public Optional<MergedRecord> getNormalized() {
        return Optional.ofNullable(normalized);
    }

    public boolean hasWarning(QueryWarning.Type type) {
        return warnings.stream().anyMatch(w -> w.type() == type);
    }
}
