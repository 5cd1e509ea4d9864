package com.example.studydesign.service;

import com.example.studydesign.domain.ProjectStatus;

import java.util.Arrays;
import java.util.Optional;

/**
 * Pipeline stages in execution order, each with the status it starts from,
 * the status it commits on success and its stage-specific failure status.
 */
public enum PipelineStage {

    SEARCH(ProjectStatus.SEARCHING, ProjectStatus.SEARCHING_COMPLETED, ProjectStatus.SEARCH_FAILED),
    DESIGN(ProjectStatus.SEARCHING_COMPLETED, ProjectStatus.DESIGN_COMPLETED, ProjectStatus.DESIGN_FAILED),
    REGULATORY(ProjectStatus.DESIGN_COMPLETED, ProjectStatus.COMPLETED, ProjectStatus.REGULATORY_CHECK_FAILED);

    private final ProjectStatus entry;
    private final ProjectStatus success;
    private final ProjectStatus failure;

    PipelineStage(ProjectStatus entry, ProjectStatus success, ProjectStatus failure) {
        this.entry = entry;
        this.success = success;
        this.failure = failure;
    }

    public ProjectStatus entry() {
        return entry;
    }

    public ProjectStatus success() {
        return success;
    }

    public ProjectStatus failure() {
        return failure;
    }

    public String metricName() {
        return name().toLowerCase();
    }

    /**
     * Stage that runs next when a project is in {@code status}; empty for terminal statuses.
     */
    public static Optional<PipelineStage> startingAt(ProjectStatus status) {
        return Arrays.stream(values())
                .filter(stage -> stage.entry == status)
                .findFirst();
    }
}
