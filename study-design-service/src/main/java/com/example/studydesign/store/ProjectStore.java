package com.example.studydesign.store;

import com.example.studydesign.domain.DrugIdentifier;
import com.example.studydesign.domain.ExtractedParameter;
import com.example.studydesign.domain.ProjectSnapshot;
import com.example.studydesign.domain.ReportArtifact;
import com.example.studydesign.domain.StageCommit;
import com.example.studydesign.domain.StudyAssumptions;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable record of project state.
 *
 * All writes are atomic. Store faults surface as Spring {@link org.springframework.dao.DataAccessException}s.
 */
public interface ProjectStore {

    /**
     * Creates a project in {@code searching} status, attempt 1.
     *
     * @param manualParameters caller-supplied observations, stored with their given provenance
     */
    ProjectSnapshot create(DrugIdentifier drug, StudyAssumptions assumptions, List<ExtractedParameter> manualParameters);

    Optional<ProjectSnapshot> findById(UUID id);

    /**
     * Compare-and-set status change plus stage results, in one transaction.
     *
     * @throws com.example.studydesign.exception.ProjectNotFoundException        unknown id
     * @throws com.example.studydesign.exception.StageCommitConflictException    project is not in {@code commit.expected()}
     *                                                                            or a concurrent writer won
     * @throws com.example.studydesign.exception.IllegalStatusTransitionException transition not in the table
     */
    ProjectSnapshot commit(UUID id, StageCommit commit);

    /**
     * Stores the latest report reference. Never changes status.
     */
    ProjectSnapshot recordReportArtifact(UUID id, ReportArtifact artifact);

    /**
     * Ids of projects in a running status whose last update is older than {@code before}.
     */
    List<UUID> findStaleRuns(Instant before);
}
