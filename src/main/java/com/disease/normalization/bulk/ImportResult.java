package com.disease.normalization.bulk;

import java.util.List;

/**
 * Result of importing source records.
 *
 * @param totalRecords    non-blank input lines seen
 * @param recordsImported records written to the store
 * @param errors          one entry per line that could not be imported
 */
public record ImportResult(
        long totalRecords,
        long recordsImported,
        List<ImportError> errors
) {
    public ImportResult {
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public long errorCount() {
        return errors.size();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * @param lineNumber 1-based input line, 0 for errors not tied to a line
     * @param conceptId  concept id of the failed record if it could be read, else empty
     * @param message    what went wrong
     */
    public record ImportError(long lineNumber, String conceptId, String message) {}

    @Override
    public String toString() {
        return "ImportResult{total=" + totalRecords +
                ", imported=" + recordsImported +
                ", errors=" + errors.size() + '}';
    }
}
