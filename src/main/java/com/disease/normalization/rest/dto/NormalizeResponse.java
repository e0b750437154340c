package com.disease.normalization.rest.dto;

import com.disease.normalization.api.NormalizationResult;
import com.disease.normalization.core.model.MergedRecord;
import com.disease.normalization.core.model.SourceMetadata;
import com.disease.normalization.core.model.SourceName;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Response DTO for normalization. {@code normalizedId} and the concept fields
 * are null on NO_MATCH. {@code sourceMeta} is keyed by source display name.
 */
public record NormalizeResponse(
        String query,
        String matchType,
        int score,
        String normalizedId,
        String matchedConceptId,
        String label,
        List<String> aliases,
        Boolean pediatricDisease,
        Boolean oncologicDisease,
        List<ConceptMappingDto> mappings,
        List<WarningDto> warnings,
        Map<String, SourceMetadata> sourceMeta
) {
    public static NormalizeResponse from(String query, NormalizationResult result) {
        List<WarningDto> warnings = WarningDto.fromAll(result.warnings());
        if (!result.isMatch()) {
            return new NormalizeResponse(query, result.matchType().name(), result.matchType().getScore(),
                    null, null, null, List.of(), null, null, List.of(), warnings, Map.of());
        }
        MergedRecord record = result.normalized();
        return new NormalizeResponse(
                query,
                result.matchType().name(),
                result.matchType().getScore(),
                record.conceptId(),
                result.matchedConceptId(),
                record.label(),
                record.aliases(),
                record.pediatricDisease(),
                record.oncologicDisease(),
                mappings(record),
                warnings,
                sourceMeta(result.sourceMetadata())
        );
    }

    static Map<String, SourceMetadata> sourceMeta(Map<SourceName, SourceMetadata> metadata) {
        Map<String, SourceMetadata> byName = new LinkedHashMap<>();
        metadata.forEach((source, meta) -> byName.put(source.getDisplayName(), meta));
        return byName;
    }

    static List<ConceptMappingDto> mappings(MergedRecord record) {
        List<ConceptMappingDto> mappings = new ArrayList<>();
        for (String xref : record.xrefs()) {
            ConceptMappingDto.of(xref, ConceptMappingDto.EXACT_MATCH).ifPresent(mappings::add);
        }
        for (String reference : record.associatedWith()) {
            ConceptMappingDto.of(reference, ConceptMappingDto.RELATED_MATCH).ifPresent(mappings::add);
        }
        return mappings;
    }
}
