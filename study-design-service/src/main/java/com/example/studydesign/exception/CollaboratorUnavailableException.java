package com.example.studydesign.exception;

import lombok.Getter;

/**
 * An external collaborator (literature search, extraction, report rendering) failed, timed out
 * or is behind an open circuit. Eligible for a caller-initiated retry.
 * Maps to HTTP 503.
 */
@Getter
public class CollaboratorUnavailableException extends RuntimeException {

    private final String collaborator;

    public CollaboratorUnavailableException(String collaborator, String message) {
        super(message);
        this.collaborator = collaborator;
    }

    public CollaboratorUnavailableException(String collaborator, String message, Throwable cause) {
        super(message, cause);
        this.collaborator = collaborator;
    }
}
