package com.example.studydesign.exception;

import com.example.studydesign.domain.ProjectStatus;

import java.util.UUID;

/**
 * Exception thrown when a report is requested before the pipeline completed.
 * Maps to HTTP 409.
 */
public class ProjectNotCompletedException extends RuntimeException {

    public ProjectNotCompletedException(UUID projectId, ProjectStatus status) {
        super("Project " + projectId + " is " + status.wireName() + "; a report requires status completed");
    }
}
