package com.example.studydesign.service;

import com.example.studydesign.client.ReportRenderer;
import com.example.studydesign.domain.ProjectSnapshot;
import com.example.studydesign.domain.ProjectStatus;
import com.example.studydesign.domain.ReportArtifact;
import com.example.studydesign.exception.CollaboratorUnavailableException;
import com.example.studydesign.exception.ProjectNotCompletedException;
import com.example.studydesign.exception.ProjectNotFoundException;
import com.example.studydesign.store.ProjectStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Report generation for completed projects.
 *
 * Rendering never changes the project status; it only records the latest artifact reference.
 * Safe to repeat.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReportService {

    private final ProjectStore projectStore;
    private final ReportRenderer reportRenderer;

    /**
     * @throws ProjectNotFoundException         unknown project
     * @throws ProjectNotCompletedException     status is not completed
     * @throws CollaboratorUnavailableException the renderer failed
     */
    public ReportArtifact generate(UUID projectId) {
        ProjectSnapshot snapshot = projectStore.findById(projectId)
                .orElseThrow(() -> new ProjectNotFoundException(projectId));
        if (snapshot.status() != ProjectStatus.COMPLETED || snapshot.design() == null || snapshot.verdict() == null) {
            throw new ProjectNotCompletedException(projectId, snapshot.status());
        }

        ReportArtifact artifact;
        try {
            artifact = reportRenderer.render(snapshot.design(), snapshot.verdict(), snapshot.drug());
        } catch (CollaboratorUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CollaboratorUnavailableException(ReportRenderer.NAME, "Report rendering failed: " + e.getMessage(), e);
        }

        projectStore.recordReportArtifact(projectId, artifact);
        log.info("Report generated for project {}: {}", projectId, artifact.artifactRef());
        return artifact;
    }

    /**
     * Same as {@link #generate(UUID)} on the report executor. Failures complete the future exceptionally.
     */
    @Async("reportTaskExecutor")
    public CompletableFuture<ReportArtifact> generateAsync(UUID projectId) {
        try {
            return CompletableFuture.completedFuture(generate(projectId));
        } catch (RuntimeException e) {
            log.warn("Report generation failed for project {}: {}", projectId, e.getMessage());
            return CompletableFuture.failedFuture(e);
        }
    }
}
