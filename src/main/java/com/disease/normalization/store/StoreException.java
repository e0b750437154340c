package com.disease.normalization.store;

/**
 * Runtime exception raised by a {@link ConceptStore} backend when it cannot
 * reach or use its underlying storage.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
