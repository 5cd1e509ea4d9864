package com.example.studydesign.exception;

/**
 * The pipeline worker pool rejected a run (queue full).
 * Maps to HTTP 503.
 */
public class PipelineSaturatedException extends RuntimeException {

    public PipelineSaturatedException(String message, Throwable cause) {
        super(message, cause);
    }
}
