package com.naag.clinicalqa.exception;

/**
 * The dataset source could not be opened or read.
 */
public class DatasetLoadException extends ClinicalQaException {

    public DatasetLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
