package com.example.studydesign.exception;

import com.example.studydesign.domain.ProjectStatus;
import lombok.Getter;

/**
 * Thrown when a status change is not in the project transition table.
 * Maps to HTTP 409.
 */
@Getter
public class IllegalStatusTransitionException extends IllegalStateException {

    private final ProjectStatus from;
    private final ProjectStatus to;

    public IllegalStatusTransitionException(ProjectStatus from, ProjectStatus to) {
        super("Illegal status transition: " + from.wireName() + " -> " + to.wireName());
        this.from = from;
        this.to = to;
    }
}
