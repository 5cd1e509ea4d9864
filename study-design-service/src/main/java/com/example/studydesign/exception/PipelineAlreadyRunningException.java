package com.example.studydesign.exception;

import java.util.UUID;

/**
 * Exception thrown when a pipeline run is requested for a project that already has one in flight.
 * Maps to HTTP 409.
 */
public class PipelineAlreadyRunningException extends RuntimeException {

    public PipelineAlreadyRunningException(UUID projectId) {
        super("A pipeline run is already active for project " + projectId);
    }

    public PipelineAlreadyRunningException(String message) {
        super(message);
    }
}
