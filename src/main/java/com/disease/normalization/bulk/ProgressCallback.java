package com.disease.normalization.bulk;

/**
 * Receives progress reports from bulk import and export.
 */
@FunctionalInterface
public interface ProgressCallback {

    /**
     * @param processed records handled so far
     * @param total     total records, or -1 while unknown
     * @param message   short progress message
     */
    void onProgress(long processed, long total, String message);

    ProgressCallback NOOP = (processed, total, message) -> {};
}
