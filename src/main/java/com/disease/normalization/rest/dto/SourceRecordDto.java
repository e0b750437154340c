package com.disease.normalization.rest.dto;

import com.disease.normalization.core.model.SourceRecord;

import java.util.List;

/**
 * Response DTO for a single source record.
 */
public record SourceRecordDto(
        String conceptId,
        String sourceName,
        String label,
        List<String> aliases,
        List<String> xrefs,
        List<String> associatedWith,
        Boolean pediatricDisease,
        Boolean oncologicDisease,
        String mergeRef
) {
    public static SourceRecordDto from(SourceRecord record) {
        return new SourceRecordDto(
                record.getConceptId(),
                record.getSourceName() != null ? record.getSourceName().getDisplayName() : null,
                record.getLabel(),
                record.getAliases(),
                record.getXrefs(),
                record.getAssociatedWith(),
                record.getPediatricDisease(),
                record.getOncologicDisease(),
                record.getMergeRef().orElse(null)
        );
    }
}
