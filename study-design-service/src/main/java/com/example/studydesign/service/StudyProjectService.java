package com.example.studydesign.service;

import com.example.studydesign.calculator.DesignCalculator;
import com.example.studydesign.calculator.ParameterAggregator;
import com.example.studydesign.domain.DesignInput;
import com.example.studydesign.domain.DesignResult;
import com.example.studydesign.domain.DrugIdentifier;
import com.example.studydesign.domain.ExtractedParameter;
import com.example.studydesign.domain.ParameterKind;
import com.example.studydesign.domain.ProjectSnapshot;
import com.example.studydesign.domain.ProjectStatus;
import com.example.studydesign.domain.RegulatoryVerdict;
import com.example.studydesign.domain.ReportArtifact;
import com.example.studydesign.domain.StageCommit;
import com.example.studydesign.domain.StudyAssumptions;
import com.example.studydesign.exception.IllegalStatusTransitionException;
import com.example.studydesign.exception.InvalidDesignInputException;
import com.example.studydesign.exception.PipelineAlreadyRunningException;
import com.example.studydesign.exception.PipelineSaturatedException;
import com.example.studydesign.exception.ProjectNotFoundException;
import com.example.studydesign.exception.ReportNotFoundException;
import com.example.studydesign.exception.StageCommitConflictException;
import com.example.studydesign.metrics.PipelineMetrics;
import com.example.studydesign.regulatory.RegulatoryRuleEvaluator;
import com.example.studydesign.store.ProjectStore;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;

/**
 * Caller-facing operations on study design projects.
 *
 * Runs are dispatched to the pipeline executor and never block the caller. At most one run per
 * project is active: the in-process guard rejects a second trigger, and the store's
 * compare-and-set commit rejects a writer from another instance.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StudyProjectService {

    static final String INTERRUPTED_MESSAGE = "Pipeline run interrupted";
    static final String SATURATED_MESSAGE = "Pipeline executor saturated; retry later";

    private final ProjectStore projectStore;
    private final StudyDesignOrchestrator orchestrator;
    private final ReportService reportService;
    private final PipelineRunGuard runGuard;
    private final ParameterValidator parameterValidator;
    private final ParameterAggregator parameterAggregator;
    private final DesignCalculator designCalculator;
    private final RegulatoryRuleEvaluator ruleEvaluator;
    private final PipelineMetrics metrics;

    @PostConstruct
    void registerGauges() {
        metrics.registerActiveRuns(runGuard);
    }

    /**
     * Create a project in {@code searching} status and dispatch its pipeline run.
     *
     * @throws InvalidDesignInputException an assumption is out of range, or a manual parameter violates
     *                                     the parameter invariants
     * @throws PipelineSaturatedException  the executor rejected the run; the project is marked failed
     */
    public ProjectSnapshot startPipeline(DrugIdentifier drug, StudyAssumptions assumptions,
                                         List<ExtractedParameter> manualParameters) {
        // A design stage that can never succeed would leave a project only retry could revisit
        designCalculator.validateAssumptions(assumptions);
        List<ExtractedParameter> manual = validateManualParameters(manualParameters);
        ProjectSnapshot created = projectStore.create(drug, assumptions, manual);
        log.info("Created project {} for '{}' ({} manual parameter(s))", created.id(), drug.innEn(), manual.size());

        runGuard.tryAcquire(created.id());
        dispatch(created);
        return created;
    }

    public ProjectSnapshot getProject(UUID projectId) {
        return projectStore.findById(projectId)
                .orElseThrow(() -> new ProjectNotFoundException(projectId));
    }

    /**
     * Start a new attempt from a failure status, resuming at the failed stage.
     *
     * @throws PipelineAlreadyRunningException a run is active, or the project is not in a failure status
     *                                         because a run is still in progress
     * @throws IllegalStatusTransitionException the project is completed
     */
    public ProjectSnapshot retry(UUID projectId) {
        ProjectSnapshot snapshot = getProject(projectId);
        ProjectStatus current = snapshot.status();
        if (!current.isTerminal() || runGuard.isRunning(projectId)) {
            throw new PipelineAlreadyRunningException(projectId);
        }
        ProjectStatus resumeAt = current.retryTarget()
                .orElseThrow(() -> new IllegalStatusTransitionException(current, ProjectStatus.SEARCHING));

        if (!runGuard.tryAcquire(projectId)) {
            throw new PipelineAlreadyRunningException(projectId);
        }

        ProjectSnapshot resumed;
        try {
            resumed = projectStore.commit(projectId, StageCommit.builder()
                    .expected(current)
                    .next(resumeAt)
                    .build());
        } catch (StageCommitConflictException e) {
            runGuard.release(projectId);
            throw new PipelineAlreadyRunningException(projectId);
        } catch (RuntimeException e) {
            runGuard.release(projectId);
            throw e;
        }

        log.info("Retrying project {}: {} -> {} (attempt {})",
                projectId, current.wireName(), resumeAt.wireName(), resumed.attempt());
        dispatch(resumed);
        return resumed;
    }

    public CompletableFuture<ReportArtifact> generateReport(UUID projectId) {
        return reportService.generateAsync(projectId);
    }

    public ReportArtifact getReport(UUID projectId) {
        ProjectSnapshot snapshot = getProject(projectId);
        if (snapshot.report() == null) {
            throw new ReportNotFoundException(projectId);
        }
        return snapshot.report();
    }

    /**
     * Stateless design calculation plus rule evaluation from explicit inputs.
     * CV_intra and half-life count as manually supplied observations for the rules.
     */
    public DesignCalculation calculate(DesignInput input) {
        DesignResult design = designCalculator.calculate(input);

        List<ExtractedParameter> observations = new ArrayList<>();
        observations.add(manualObservation(ParameterKind.CV_INTRA, input.cvIntra(), "%"));
        if (input.halfLifeHours() != null) {
            observations.add(manualObservation(ParameterKind.HALF_LIFE, input.halfLifeHours(), "h"));
        }
        RegulatoryVerdict verdict = ruleEvaluator.evaluate(design, observations);
        return new DesignCalculation(design, verdict);
    }

    /**
     * Mark runs that have made no progress for {@code staleAfter} and are not active in this
     * instance as failed, which makes them eligible for retry.
     *
     * @return number of projects marked failed
     */
    public int recoverStaleRuns(Duration staleAfter) {
        Instant cutoff = Instant.now().minus(staleAfter);
        int recovered = 0;
        for (UUID projectId : projectStore.findStaleRuns(cutoff)) {
            if (runGuard.isRunning(projectId)) {
                continue;
            }
            Optional<ProjectSnapshot> snapshot = projectStore.findById(projectId);
            if (snapshot.isEmpty() || snapshot.get().status().isTerminal()) {
                continue;
            }
            try {
                projectStore.commit(projectId, StageCommit.failure(snapshot.get().status(), ProjectStatus.FAILED, INTERRUPTED_MESSAGE));
                recovered++;
                log.warn("⚠️ Project {} stuck in {} since before {}, marked failed",
                        projectId, snapshot.get().status().wireName(), cutoff);
            } catch (StageCommitConflictException e) {
                log.debug("Project {} moved on during recovery: {}", projectId, e.getMessage());
            }
        }
        return recovered;
    }

    private void dispatch(ProjectSnapshot snapshot) {
        try {
            orchestrator.runPipelineAsync(snapshot.id());
        } catch (RejectedExecutionException e) {
            // AbortPolicy: covers TaskRejectedException as well
            log.error("❌ Pipeline queue full, run rejected for project {}. Increase pipeline executor capacity.", snapshot.id());
            metrics.recordRejection();
            try {
                projectStore.commit(snapshot.id(), StageCommit.failure(snapshot.status(), ProjectStatus.FAILED, SATURATED_MESSAGE));
            } finally {
                runGuard.release(snapshot.id());
            }
            throw new PipelineSaturatedException(SATURATED_MESSAGE, e);
        }
    }

    private List<ExtractedParameter> validateManualParameters(List<ExtractedParameter> manualParameters) {
        if (manualParameters == null || manualParameters.isEmpty()) {
            return List.of();
        }
        List<ExtractedParameter> validated = new ArrayList<>();
        for (int i = 0; i < manualParameters.size(); i++) {
            ExtractedParameter parameter = manualParameters.get(i).toBuilder()
                    .sourceRef(ExtractedParameter.MANUAL_SOURCE)
                    .build();
            String field = "manualParameters[" + i + "]";
            parameterValidator.validate(parameter).ifPresent(reason -> {
                throw new InvalidDesignInputException(field, reason);
            });
            validated.add(parameter);
        }
        return validated;
    }

    private static ExtractedParameter manualObservation(ParameterKind kind, Double value, String unit) {
        return ExtractedParameter.builder()
                .kind(kind)
                .value(value)
                .unit(unit)
                .sourceRef(ExtractedParameter.MANUAL_SOURCE)
                .sourceTitle("Calculator input")
                .reliable(true)
                .build();
    }

    /**
     * Result of a stateless calculation.
     */
    public record DesignCalculation(DesignResult design, RegulatoryVerdict verdict) {
    }
}
