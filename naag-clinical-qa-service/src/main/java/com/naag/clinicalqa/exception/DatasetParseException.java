package com.naag.clinicalqa.exception;

/**
 * The dataset is not a JSON array of records.
 */
public class DatasetParseException extends ClinicalQaException {

    public DatasetParseException(String message) {
        super(message);
    }

    public DatasetParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
