package com.example.studydesign.controller;

import com.example.studydesign.domain.ProjectSnapshot;
import com.example.studydesign.dto.mapper.ProjectResponseMapper;
import com.example.studydesign.dto.request.CreateProjectRequest;
import com.example.studydesign.service.StudyProjectService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * REST controller for study design projects.
 *
 * Pipeline runs are asynchronous: create and retry answer 202 with the project id and the caller
 * polls {@code GET /api/v1/projects/{id}}. Report rendering frees the HTTP thread while the
 * rendering service works.
 *
 * Base path: /api/v1/projects
 */
@RestController
@RequestMapping("/api/v1/projects")
@RequiredArgsConstructor
@Slf4j
public class StudyProjectController {

    static final String STARTED_MESSAGE = "Pipeline started; poll the project for progress";
    static final String RETRY_MESSAGE = "Retry started";

    private final StudyProjectService projectService;

    /**
     * POST /api/v1/projects
     * Create a project and start its pipeline run.
     */
    @PostMapping
    public ResponseEntity<Map<String, Object>> createProject(@Valid @RequestBody CreateProjectRequest request) {
        log.info("Creating study design project for '{}' {} {}", request.innEn(), request.dosage(), request.dosageForm());

        ProjectSnapshot created = projectService.startPipeline(
            ProjectResponseMapper.toDrug(request),
            ProjectResponseMapper.toAssumptions(request),
            ProjectResponseMapper.toManualParameters(request.manualParameters()));

        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of(
            "data", ProjectResponseMapper.toStartResponse(created, STARTED_MESSAGE),
            "timestamp", Instant.now().toString()
        ));
    }

    /**
     * GET /api/v1/projects/{id}
     */
    @GetMapping("/{id}")
    public ResponseEntity<Map<String, Object>> getProject(@PathVariable UUID id) {
        ProjectSnapshot snapshot = projectService.getProject(id);
        return ResponseEntity.ok(Map.of(
            "data", ProjectResponseMapper.toResponse(snapshot),
            "timestamp", Instant.now().toString()
        ));
    }

    /**
     * POST /api/v1/projects/{id}/retry
     * New attempt from a failure status. 409 while a run is active or after completion.
     */
    @PostMapping("/{id}/retry")
    public ResponseEntity<Map<String, Object>> retry(@PathVariable UUID id) {
        log.info("Retry requested for project {}", id);

        ProjectSnapshot resumed = projectService.retry(id);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of(
            "data", ProjectResponseMapper.toStartResponse(resumed, RETRY_MESSAGE),
            "timestamp", Instant.now().toString()
        ));
    }

    /**
     * POST /api/v1/projects/{id}/report
     * Render the study synopsis of a completed project (async non-blocking).
     * The project status is never changed by rendering.
     */
    @PostMapping("/{id}/report")
    public CompletableFuture<ResponseEntity<Map<String, Object>>> generateReport(@PathVariable UUID id) {
        log.info("Report requested for project {} (async)", id);

        return projectService.generateReport(id)
            .thenApply(artifact -> ResponseEntity.ok(Map.of(
                "data", ProjectResponseMapper.toResponse(artifact),
                "timestamp", Instant.now().toString()
            )));
    }

    /**
     * GET /api/v1/projects/{id}/report
     * Last rendered artifact; 404 when none was rendered.
     */
    @GetMapping("/{id}/report")
    public ResponseEntity<Map<String, Object>> getReport(@PathVariable UUID id) {
        return ResponseEntity.ok(Map.of(
            "data", ProjectResponseMapper.toResponse(projectService.getReport(id)),
            "timestamp", Instant.now().toString()
        ));
    }
}
