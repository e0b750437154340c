package com.disease.normalization.store;

/**
 * A write to the concept store failed. When thrown from
 * {@link ConceptStore#replaceMergedRecords} the previously committed merged set
 * is still the visible one.
 */
public class StoreWriteException extends StoreException {

    public StoreWriteException(String message) {
        super(message);
    }

    public StoreWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
