package com.example.studydesign.exception;

import java.util.UUID;

/**
 * Exception thrown when a project does not exist.
 * Maps to HTTP 404.
 */
public class ProjectNotFoundException extends RuntimeException {

    public ProjectNotFoundException(UUID id) {
        super("Project not found: " + id);
    }
}
