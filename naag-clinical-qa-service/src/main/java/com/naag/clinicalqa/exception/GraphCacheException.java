package com.naag.clinicalqa.exception;

/**
 * A persisted graph could not be read or written. Always recoverable by rebuilding.
 */
public class GraphCacheException extends ClinicalQaException {

    public GraphCacheException(String message) {
        super(message);
    }

    public GraphCacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
