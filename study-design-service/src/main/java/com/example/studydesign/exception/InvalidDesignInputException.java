package com.example.studydesign.exception;

import lombok.Getter;

/**
 * Malformed or out-of-range calculator input. Never clamped.
 * Maps to HTTP 400, or to design_failed inside the pipeline.
 */
@Getter
public class InvalidDesignInputException extends RuntimeException {

    private final String field;

    public InvalidDesignInputException(String field, String message) {
        super(message);
        this.field = field;
    }
}
