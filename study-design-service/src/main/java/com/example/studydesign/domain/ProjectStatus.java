package com.example.studydesign.domain;

import com.example.studydesign.exception.IllegalStatusTransitionException;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Lifecycle status of a study design project.
 *
 * <pre>
 * SEARCHING → SEARCHING_COMPLETED → DESIGN_COMPLETED → COMPLETED
 *
 * Stage failures (terminal for the attempt):
 *   SEARCHING           → SEARCH_FAILED
 *   SEARCHING_COMPLETED → DESIGN_FAILED
 *   DESIGN_COMPLETED    → REGULATORY_CHECK_FAILED
 *   any running status  → FAILED (uncategorized fault)
 *
 * Retry (new attempt, resumes at the failed stage):
 *   SEARCH_FAILED           → SEARCHING
 *   FAILED                  → SEARCHING
 *   DESIGN_FAILED           → SEARCHING_COMPLETED
 *   REGULATORY_CHECK_FAILED → DESIGN_COMPLETED
 * </pre>
 *
 * Any transition not listed here is rejected.
 */
public enum ProjectStatus {

    SEARCHING,
    SEARCHING_COMPLETED,
    DESIGN_COMPLETED,
    COMPLETED,
    SEARCH_FAILED,
    DESIGN_FAILED,
    REGULATORY_CHECK_FAILED,
    FAILED;

    private static final Map<ProjectStatus, Set<ProjectStatus>> FORWARD = new EnumMap<>(ProjectStatus.class);
    private static final Map<ProjectStatus, ProjectStatus> RETRY = new EnumMap<>(ProjectStatus.class);

    static {
        FORWARD.put(SEARCHING, EnumSet.of(SEARCHING_COMPLETED, SEARCH_FAILED, FAILED));
        FORWARD.put(SEARCHING_COMPLETED, EnumSet.of(DESIGN_COMPLETED, DESIGN_FAILED, FAILED));
        FORWARD.put(DESIGN_COMPLETED, EnumSet.of(COMPLETED, REGULATORY_CHECK_FAILED, FAILED));
        FORWARD.put(COMPLETED, EnumSet.noneOf(ProjectStatus.class));
        FORWARD.put(SEARCH_FAILED, EnumSet.noneOf(ProjectStatus.class));
        FORWARD.put(DESIGN_FAILED, EnumSet.noneOf(ProjectStatus.class));
        FORWARD.put(REGULATORY_CHECK_FAILED, EnumSet.noneOf(ProjectStatus.class));
        FORWARD.put(FAILED, EnumSet.noneOf(ProjectStatus.class));

        RETRY.put(SEARCH_FAILED, SEARCHING);
        RETRY.put(FAILED, SEARCHING);
        RETRY.put(DESIGN_FAILED, SEARCHING_COMPLETED);
        RETRY.put(REGULATORY_CHECK_FAILED, DESIGN_COMPLETED);
    }

    /**
     * Wire name, e.g. {@code searching_completed}.
     */
    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    /**
     * A terminal status ends the current attempt; no stage is running.
     */
    public boolean isTerminal() {
        return FORWARD.get(this).isEmpty();
    }

    public boolean isFailure() {
        return RETRY.containsKey(this);
    }

    public Set<ProjectStatus> forwardTargets() {
        return Collections.unmodifiableSet(FORWARD.get(this));
    }

    /**
     * Status a new attempt resumes from, if this status allows a retry.
     */
    public Optional<ProjectStatus> retryTarget() {
        return Optional.ofNullable(RETRY.get(this));
    }

    public boolean canAdvanceTo(ProjectStatus next) {
        return FORWARD.get(this).contains(next);
    }

    public boolean canRetryTo(ProjectStatus next) {
        return RETRY.get(this) == next;
    }

    public boolean canTransitionTo(ProjectStatus next) {
        return canAdvanceTo(next) || canRetryTo(next);
    }

    public void requireTransition(ProjectStatus next) {
        if (!canTransitionTo(next)) {
            throw new IllegalStatusTransitionException(this, next);
        }
    }
}
