package com.disease.normalization.api;

/**
 * Runtime exception for malformed query parameters, such as an unknown source
 * name or a search filter that both includes and excludes sources.
 */
public class InvalidParameterException extends RuntimeException {

    public InvalidParameterException(String message) {
        super(message);
    }
}
