package com.naag.clinicalqa.exception;

public class DatasetNotLoadedException extends ClinicalQaException {

    public DatasetNotLoadedException() {
        super("Clinical dataset has not been loaded yet");
    }
}
