package com.example.studydesign.store;

import com.example.studydesign.domain.DrugIdentifier;
import com.example.studydesign.domain.ExtractedParameter;
import com.example.studydesign.domain.ProjectSnapshot;
import com.example.studydesign.domain.ProjectStatus;
import com.example.studydesign.domain.ReportArtifact;
import com.example.studydesign.domain.StageCommit;
import com.example.studydesign.domain.StudyAssumptions;
import com.example.studydesign.exception.ProjectNotFoundException;
import com.example.studydesign.exception.StageCommitConflictException;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Store with the same commit semantics as {@link ProjectDataService}, kept in memory.
 * Can be told to fail the n-th commit to simulate a database outage.
 */
public class InMemoryProjectStore implements ProjectStore {

    private final Map<UUID, ProjectSnapshot> projects = new ConcurrentHashMap<>();
    private final List<StageCommit> commits = new ArrayList<>();
    private final AtomicInteger commitCount = new AtomicInteger();
    private volatile int failOnCommit = -1;

    @Override
    public synchronized ProjectSnapshot create(DrugIdentifier drug, StudyAssumptions assumptions,
                                               List<ExtractedParameter> manualParameters) {
        Instant now = Instant.now();
        ProjectSnapshot snapshot = ProjectSnapshot.builder()
                .id(UUID.randomUUID())
                .drug(drug)
                .assumptions(assumptions)
                .status(ProjectStatus.SEARCHING)
                .attempt(1)
                .parameters(manualParameters)
                .createdAt(now)
                .updatedAt(now)
                .build();
        projects.put(snapshot.id(), snapshot);
        return snapshot;
    }

    @Override
    public Optional<ProjectSnapshot> findById(UUID id) {
        return Optional.ofNullable(projects.get(id));
    }

    @Override
    public synchronized ProjectSnapshot commit(UUID id, StageCommit commit) {
        if (commitCount.incrementAndGet() == failOnCommit) {
            throw new DataAccessResourceFailureException("Simulated store outage");
        }
        ProjectSnapshot current = findById(id).orElseThrow(() -> new ProjectNotFoundException(id));
        if (current.status() != commit.expected()) {
            throw new StageCommitConflictException(id, commit.expected(), current.status());
        }
        commit.expected().requireTransition(commit.next());

        ProjectSnapshot.ProjectSnapshotBuilder next = current.toBuilder();
        if (commit.isRetry()) {
            next.attempt(current.attempt() + 1).report(null).verdict(null);
            if (commit.next() == ProjectStatus.SEARCHING || commit.next() == ProjectStatus.SEARCHING_COMPLETED) {
                next.design(null);
            }
            if (commit.next() == ProjectStatus.SEARCHING) {
                next.searchSummary(null);
            }
        }
        if (commit.parameters() != null) {
            next.parameters(commit.parameters());
        }
        if (commit.searchSummary() != null) {
            next.searchSummary(commit.searchSummary());
        }
        if (commit.design() != null) {
            next.design(commit.design());
        }
        if (commit.verdict() != null) {
            next.verdict(commit.verdict());
        }
        ProjectSnapshot saved = next.status(commit.next())
                .statusMessage(commit.message())
                .updatedAt(Instant.now())
                .build();
        projects.put(id, saved);
        commits.add(commit);
        return saved;
    }

    @Override
    public synchronized ProjectSnapshot recordReportArtifact(UUID id, ReportArtifact artifact) {
        ProjectSnapshot current = findById(id).orElseThrow(() -> new ProjectNotFoundException(id));
        ProjectSnapshot saved = current.toBuilder().report(artifact).updatedAt(Instant.now()).build();
        projects.put(id, saved);
        return saved;
    }

    @Override
    public List<UUID> findStaleRuns(Instant before) {
        return projects.values().stream()
                .filter(p -> !p.status().isTerminal())
                .filter(p -> p.updatedAt().isBefore(before))
                .map(ProjectSnapshot::id)
                .toList();
    }

    /**
     * Replace a stored snapshot as-is, bypassing transition checks.
     */
    public void put(ProjectSnapshot snapshot) {
        projects.put(snapshot.id(), snapshot);
    }

    public void failOnCommit(int commitNumber) {
        this.failOnCommit = commitCount.get() + commitNumber;
    }

    public synchronized List<StageCommit> commits() {
        return List.copyOf(commits);
    }
}
