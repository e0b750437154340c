package com.disease.normalization.bulk;

/**
 * Result of a term mapping export.
 *
 * @param totalMappings   lines written
 * @param mergedConcepts  lines describing multi-member merged concepts
 * @param sourceConcepts  lines describing a single source record
 */
public record ExportResult(long totalMappings, long mergedConcepts, long sourceConcepts) {

    @Override
    public String toString() {
        return "ExportResult{total=" + totalMappings +
                ", merged=" + mergedConcepts +
                ", source=" + sourceConcepts + '}';
    }
}
