package com.naag.clinicalqa.exception;

public class EmptyDatasetException extends ClinicalQaException {

    private final int rejectedRecords;

    public EmptyDatasetException(int rejectedRecords) {
        super("No valid prompt/completion records in dataset (" + rejectedRecords + " rejected)");
        this.rejectedRecords = rejectedRecords;
    }

    public int getRejectedRecords() {
        return rejectedRecords;
    }
}
