package com.example.studydesign.exception;

import java.util.UUID;

/**
 * Exception thrown when a project has no rendered report yet.
 * Maps to HTTP 404.
 */
public class ReportNotFoundException extends RuntimeException {

    public ReportNotFoundException(UUID projectId) {
        super("No report has been generated for project " + projectId);
    }
}
