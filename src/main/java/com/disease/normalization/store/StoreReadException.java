package com.disease.normalization.store;

/**
 * A read from the concept store failed.
 */
public class StoreReadException extends StoreException {

    public StoreReadException(String message) {
        super(message);
    }

    public StoreReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
