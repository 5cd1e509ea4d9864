package com.example.studydesign.store;

import com.example.studydesign.domain.DrugIdentifier;
import com.example.studydesign.domain.ExtractedParameter;
import com.example.studydesign.domain.ProjectSnapshot;
import com.example.studydesign.domain.ProjectStatus;
import com.example.studydesign.domain.ReportArtifact;
import com.example.studydesign.domain.SearchSummary;
import com.example.studydesign.domain.StageCommit;
import com.example.studydesign.domain.StudyAssumptions;
import com.example.studydesign.entity.StudyProject;
import com.example.studydesign.exception.ProjectNotFoundException;
import com.example.studydesign.exception.StageCommitConflictException;
import com.example.studydesign.repository.StudyProjectRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JPA-backed project store.
 *
 * Transactions are short and never contain collaborator calls. Each stage commit re-reads the
 * project, checks the expected status and flushes under the optimistic lock, so two writers can
 * never both advance the same project.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProjectDataService implements ProjectStore {

    private static final List<ProjectStatus> RUNNING_STATUSES = Arrays.stream(ProjectStatus.values())
            .filter(status -> !status.isTerminal())
            .toList();

    private final StudyProjectRepository projectRepository;

    @Override
    @Transactional
    public ProjectSnapshot create(DrugIdentifier drug, StudyAssumptions assumptions, List<ExtractedParameter> manualParameters) {
        StudyAssumptions effective = assumptions == null ? StudyAssumptions.defaults() : assumptions;
        StudyProject project = StudyProject.builder()
                .innEn(drug.innEn())
                .innRu(drug.innRu())
                .dosage(drug.dosage())
                .dosageForm(drug.dosageForm())
                .additionalSubstances(new ArrayList<>(drug.additionalSubstances()))
                .assumedPower(effective.power())
                .assumedAlpha(effective.alpha())
                .assumedDelta(effective.delta())
                .assumedDropoutRate(effective.dropoutRate())
                .assumedScreenFailRate(effective.screenFailRate())
                .status(ProjectStatus.SEARCHING)
                .attempt(1)
                .build();
        if (manualParameters != null && !manualParameters.isEmpty()) {
            project.replaceParameters(manualParameters.stream().map(ProjectSnapshotMapper::toEntity).toList());
        }

        StudyProject saved = projectRepository.save(project);
        log.debug("Created project id={} for INN '{}' with {} manual parameter(s)",
                saved.getId(), drug.innEn(), saved.getParameters().size());
        return ProjectSnapshotMapper.toSnapshot(saved);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ProjectSnapshot> findById(UUID id) {
        return projectRepository.findById(id).map(ProjectSnapshotMapper::toSnapshot);
    }

    @Override
    @Transactional
    public ProjectSnapshot commit(UUID id, StageCommit commit) {
        StudyProject project = projectRepository.findById(id)
                .orElseThrow(() -> new ProjectNotFoundException(id));

        if (project.getStatus() != commit.expected()) {
            throw new StageCommitConflictException(id, commit.expected(), project.getStatus());
        }
        commit.expected().requireTransition(commit.next());

        if (commit.isRetry()) {
            resetForRetry(project, commit.next());
        }
        if (commit.parameters() != null) {
            project.replaceParameters(commit.parameters().stream().map(ProjectSnapshotMapper::toEntity).toList());
        }
        if (commit.searchSummary() != null) {
            SearchSummary summary = commit.searchSummary();
            project.setDocumentsFound(summary.documentsFound());
            project.setDocumentsProcessed(summary.documentsProcessed());
            project.setParametersAccepted(summary.parametersAccepted());
            project.setCandidatesRejected(summary.candidatesRejected());
        }
        if (commit.design() != null) {
            project.setDesign(ProjectSnapshotMapper.toRecord(commit.design()));
        }
        if (commit.verdict() != null) {
            project.replaceVerdict(
                    commit.verdict().compliant(),
                    commit.verdict().ruleSetVersion(),
                    commit.verdict().outcomes().stream().map(ProjectSnapshotMapper::toRecord).toList(),
                    commit.verdict().warnings());
        }
        project.setStatus(commit.next());
        project.setStatusMessage(commit.message());

        try {
            StudyProject saved = projectRepository.saveAndFlush(project);
            log.debug("Project id={} committed {} -> {} (attempt {})",
                    id, commit.expected().wireName(), commit.next().wireName(), saved.getAttempt());
            return ProjectSnapshotMapper.toSnapshot(saved);
        } catch (ObjectOptimisticLockingFailureException e) {
            throw new StageCommitConflictException(id, e);
        }
    }

    @Override
    @Transactional
    public ProjectSnapshot recordReportArtifact(UUID id, ReportArtifact artifact) {
        StudyProject project = projectRepository.findById(id)
                .orElseThrow(() -> new ProjectNotFoundException(id));
        project.setReportArtifactRef(artifact.artifactRef());
        project.setReportMediaType(artifact.mediaType());
        project.setReportGeneratedAt(artifact.generatedAt());

        try {
            StudyProject saved = projectRepository.saveAndFlush(project);
            log.debug("Project id={} report recorded: {}", id, artifact.artifactRef());
            return ProjectSnapshotMapper.toSnapshot(saved);
        } catch (ObjectOptimisticLockingFailureException e) {
            throw new StageCommitConflictException(id, e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<UUID> findStaleRuns(Instant before) {
        return projectRepository.findIdsByStatusInAndUpdatedAtBefore(RUNNING_STATUSES, before);
    }

    /**
     * A new attempt discards the results of every stage that will run again.
     * Parameters stay until the search stage replaces them.
     */
    private void resetForRetry(StudyProject project, ProjectStatus resumeAt) {
        project.setAttempt(project.getAttempt() + 1);
        project.clearReport();
        project.clearVerdict();
        if (resumeAt == ProjectStatus.SEARCHING || resumeAt == ProjectStatus.SEARCHING_COMPLETED) {
            project.setDesign(null);
        }
        if (resumeAt == ProjectStatus.SEARCHING) {
            project.clearSearchSummary();
        }
    }
}
