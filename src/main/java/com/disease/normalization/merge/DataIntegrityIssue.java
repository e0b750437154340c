package com.disease.normalization.merge;

import java.util.Objects;

/**
 * A single data-integrity problem found during a merge rebuild.
 *
 * @param type      kind of problem
 * @param conceptId the record the problem was found on
 * @param detail    the offending value or a short explanation
 */
public record DataIntegrityIssue(IntegrityIssueType type, String conceptId, String detail) {

    public DataIntegrityIssue {
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(conceptId, "conceptId is required");
    }

    @Override
    public String toString() {
        return type + "(" + conceptId + (detail != null ? " -> " + detail : "") + ")";
    }
}
