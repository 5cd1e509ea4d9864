package com.example.studydesign.exception;

import com.example.studydesign.domain.ProjectStatus;
import lombok.Getter;

import java.util.UUID;

/**
 * Thrown by the project store when a commit finds the project in a different status than expected,
 * or loses an optimistic-lock race. Another run owns the project.
 * Maps to HTTP 409.
 */
@Getter
public class StageCommitConflictException extends RuntimeException {

    private final UUID projectId;

    public StageCommitConflictException(UUID projectId, ProjectStatus expected, ProjectStatus actual) {
        super("Project " + projectId + " is " + actual.wireName() + ", expected " + expected.wireName());
        this.projectId = projectId;
    }

    public StageCommitConflictException(UUID projectId, Throwable cause) {
        super("Concurrent modification of project " + projectId, cause);
        this.projectId = projectId;
    }
}
