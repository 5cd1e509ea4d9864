package com.example.studydesign.exception;

/**
 * The calculator cannot produce a defensible design, e.g. CV_intra is missing.
 * Maps to design_failed inside the pipeline and to HTTP 422 on the calculate endpoint.
 */
public class DesignComputationFailedException extends RuntimeException {

    public DesignComputationFailedException(String message) {
        super(message);
    }
}
