package com.disease.normalization.merge;

/**
 * Runtime exception thrown when a rebuild cannot complete: the snapshot could
 * not be loaded, the new merged set could not be committed, or another rebuild
 * was already running. The previously committed merged set is left in place.
 */
public class RebuildFailedException extends RuntimeException {

    public RebuildFailedException(String message) {
        super(message);
    }

    public RebuildFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
