package com.naag.clinicalqa.exception;

/**
 * Root of the failures raised by the clinical Q&A core.
 */
public class ClinicalQaException extends RuntimeException {

    public ClinicalQaException(String message) {
        super(message);
    }

    public ClinicalQaException(String message, Throwable cause) {
        super(message, cause);
    }
}
