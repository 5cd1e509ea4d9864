package com.example.studydesign.exception;

/**
 * The regulatory stage could not run at all, e.g. the project has no design to evaluate.
 * Maps to regulatory_check_failed. Missing PK data is a failing rule, not this exception.
 */
public class RegulatoryCheckException extends RuntimeException {

    public RegulatoryCheckException(String message) {
        super(message);
    }
}
