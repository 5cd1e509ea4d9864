package com.example.studydesign.service;

import com.example.studydesign.calculator.DesignCalculator;
import com.example.studydesign.calculator.ParameterAggregator;
import com.example.studydesign.client.LiteratureSearchClient;
import com.example.studydesign.client.ParameterExtractionClient;
import com.example.studydesign.domain.DesignInput;
import com.example.studydesign.domain.DesignResult;
import com.example.studydesign.domain.DrugIdentifier;
import com.example.studydesign.domain.ExtractedParameter;
import com.example.studydesign.domain.LiteratureReference;
import com.example.studydesign.domain.ProjectSnapshot;
import com.example.studydesign.domain.ProjectStatus;
import com.example.studydesign.domain.RegulatoryVerdict;
import com.example.studydesign.domain.RuleOutcome;
import com.example.studydesign.domain.SearchSummary;
import com.example.studydesign.domain.StageCommit;
import com.example.studydesign.dto.PipelineRunResult;
import com.example.studydesign.exception.CollaboratorUnavailableException;
import com.example.studydesign.exception.DesignComputationFailedException;
import com.example.studydesign.exception.InvalidDesignInputException;
import com.example.studydesign.exception.ProjectNotFoundException;
import com.example.studydesign.exception.RegulatoryCheckException;
import com.example.studydesign.exception.StageCommitConflictException;
import com.example.studydesign.metrics.PipelineMetrics;
import com.example.studydesign.regulatory.RegulatoryRuleEvaluator;
import com.example.studydesign.store.ProjectStore;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Drives a project through search, design and regulatory stages.
 *
 * CRITICAL DESIGN:
 * - Collaborator calls happen OUTSIDE transactions; each stage ends with one store commit
 * - Stages run strictly in sequence on one worker thread
 * - Every stage error is converted into a persisted failure status; only store faults escape
 * - A commit conflict means another run owns the project: this run stops without writing
 */
@Service
@Slf4j
public class StudyDesignOrchestrator {

    static final String CORRELATION_ID = "correlationId";

    private final ProjectStore projectStore;
    private final LiteratureSearchClient searchClient;
    private final ParameterExtractionClient extractionClient;
    private final ParameterValidator parameterValidator;
    private final ParameterAggregator parameterAggregator;
    private final DesignCalculator designCalculator;
    private final RegulatoryRuleEvaluator ruleEvaluator;
    private final ReportService reportService;
    private final PipelineRunGuard runGuard;
    private final PipelineMetrics metrics;
    private final FallbackSignal fallbackSignal;
    private final int maxDocuments;
    private final boolean autoGenerateReport;

    public StudyDesignOrchestrator(ProjectStore projectStore,
                                   LiteratureSearchClient searchClient,
                                   ParameterExtractionClient extractionClient,
                                   ParameterValidator parameterValidator,
                                   ParameterAggregator parameterAggregator,
                                   DesignCalculator designCalculator,
                                   RegulatoryRuleEvaluator ruleEvaluator,
                                   ReportService reportService,
                                   PipelineRunGuard runGuard,
                                   PipelineMetrics metrics,
                                   FallbackSignal fallbackSignal,
                                   @Value("${pipeline.search.max-documents:5}") int maxDocuments,
                                   @Value("${pipeline.report.auto-generate:false}") boolean autoGenerateReport) {
        this.projectStore = projectStore;
        this.searchClient = searchClient;
        this.extractionClient = extractionClient;
        this.parameterValidator = parameterValidator;
        this.parameterAggregator = parameterAggregator;
        this.designCalculator = designCalculator;
        this.ruleEvaluator = ruleEvaluator;
        this.reportService = reportService;
        this.runGuard = runGuard;
        this.metrics = metrics;
        this.fallbackSignal = fallbackSignal;
        this.maxDocuments = maxDocuments;
        this.autoGenerateReport = autoGenerateReport;
    }

    /**
     * Run the pipeline on the bounded pipeline executor.
     * The caller must have acquired the run guard for {@code projectId}; it is released here.
     */
    @Async("pipelineTaskExecutor")
    public CompletableFuture<PipelineRunResult> runPipelineAsync(UUID projectId) {
        try {
            return CompletableFuture.completedFuture(runPipeline(projectId));
        } catch (RuntimeException e) {
            log.error("❌ Pipeline run for project {} aborted by store fault: {}", projectId, e.getMessage(), e);
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * Run every remaining stage for the project, starting at its current status.
     *
     * @throws DataAccessException      the store failed; the project keeps its last committed status
     * @throws ProjectNotFoundException unknown project
     */
    public PipelineRunResult runPipeline(UUID projectId) {
        long startTime = System.currentTimeMillis();
        String correlationId = MDC.get(CORRELATION_ID);
        if (correlationId == null) {
            correlationId = "PIPELINE-" + UUID.randomUUID().toString().substring(0, 8);
            MDC.put(CORRELATION_ID, correlationId);
        }

        try (FallbackSignal signal = fallbackSignal.acquire()) {
            ProjectSnapshot snapshot = projectStore.findById(projectId)
                    .orElseThrow(() -> new ProjectNotFoundException(projectId));
            log.info("Starting pipeline for project {} at status={} (attempt {})",
                    projectId, snapshot.status().wireName(), snapshot.attempt());

            while (!snapshot.status().isTerminal()) {
                PipelineStage stage = PipelineStage.startingAt(snapshot.status())
                        .orElseThrow(() -> new IllegalStateException("No stage starts at a running status"));
                snapshot = runStage(stage, snapshot, signal);
            }

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordRun(snapshot.status().wireName());
            if (snapshot.status() == ProjectStatus.COMPLETED) {
                log.info("✅ Pipeline completed for project {}: compliant={}, duration={}ms",
                        projectId, snapshot.verdict() != null && snapshot.verdict().compliant(), duration);
                if (autoGenerateReport) {
                    generateReportQuietly(projectId);
                }
            } else {
                log.warn("⚠️ Pipeline for project {} ended in {}: {}",
                        projectId, snapshot.status().wireName(), snapshot.statusMessage());
            }

            return PipelineRunResult.builder()
                    .projectId(projectId)
                    .finalStatus(snapshot.status())
                    .message(snapshot.statusMessage())
                    .correlationId(correlationId)
                    .durationMs(duration)
                    .build();

        } catch (StageCommitConflictException e) {
            log.warn("Pipeline run for project {} abandoned: {}", projectId, e.getMessage());
            metrics.recordRun(PipelineMetrics.OUTCOME_ABANDONED);
            return PipelineRunResult.builder()
                    .projectId(projectId)
                    .abandoned(true)
                    .message(e.getMessage())
                    .correlationId(correlationId)
                    .durationMs(System.currentTimeMillis() - startTime)
                    .build();
        } finally {
            runGuard.release(projectId);
            MDC.remove(CORRELATION_ID);
        }
    }

    /**
     * Execute one stage and commit its outcome. Returns the committed snapshot.
     */
    private ProjectSnapshot runStage(PipelineStage stage, ProjectSnapshot snapshot, FallbackSignal signal) {
        long stageStart = System.nanoTime();
        signal.acquire();
        log.debug("Stage {} starting for project {}", stage, snapshot.id());

        StageCommit commit;
        String outcome;
        try {
            commit = switch (stage) {
                case SEARCH -> searchStage(snapshot, signal);
                case DESIGN -> designStage(snapshot);
                case REGULATORY -> regulatoryStage(snapshot);
            };
            outcome = "success";
        } catch (DataAccessException | StageCommitConflictException e) {
            throw e;
        } catch (CollaboratorUnavailableException | DesignComputationFailedException
                 | InvalidDesignInputException | RegulatoryCheckException e) {
            log.warn("Stage {} failed for project {}: {}", stage, snapshot.id(), e.getMessage());
            commit = StageCommit.failure(stage.entry(), stage.failure(), e.getMessage());
            outcome = "failure";
        } catch (RuntimeException e) {
            log.error("❌ Unexpected error in stage {} for project {}: {}", stage, snapshot.id(), e.getMessage(), e);
            commit = StageCommit.failure(stage.entry(), ProjectStatus.FAILED,
                    "Unexpected error during " + stage.metricName() + " stage: " + e.getMessage());
            outcome = "error";
        }

        ProjectSnapshot committed = projectStore.commit(snapshot.id(), commit);
        metrics.recordStage(stage, outcome, Duration.ofNanos(System.nanoTime() - stageStart));
        log.info("Project {} {} -> {}", snapshot.id(), commit.expected().wireName(), commit.next().wireName());
        return committed;
    }

    /**
     * Literature search plus parameter extraction. Manual parameters survive; extracted ones are replaced.
     */
    private StageCommit searchStage(ProjectSnapshot snapshot, FallbackSignal signal) {
        DrugIdentifier drug = snapshot.drug();

        List<LiteratureReference> references = searchClient.search(drug, maxDocuments);
        requireHealthy(signal);
        log.info("Found {} document(s) for '{}'", references.size(), drug.innEn());

        List<ExtractedParameter> parameters = snapshot.parameters().stream()
                .filter(p -> ExtractedParameter.MANUAL_SOURCE.equals(p.sourceRef()))
                .collect(Collectors.toCollection(ArrayList::new));
        int manualCount = parameters.size();
        int processed = 0;
        int rejected = 0;

        for (LiteratureReference reference : references) {
            String text = searchClient.fetchDocumentText(reference);
            requireHealthy(signal);
            if (text == null || text.isBlank()) {
                log.debug("No text for {}, skipping", reference.sourceRef());
                continue;
            }

            List<ExtractedParameter> candidates = extractionClient.extract(text, drug);
            requireHealthy(signal);
            processed++;

            for (ExtractedParameter candidate : candidates) {
                ExtractedParameter sourced = candidate.toBuilder()
                        .sourceRef(reference.sourceRef())
                        .sourceTitle(reference.title())
                        .build();
                Optional<String> rejection = parameterValidator.validate(sourced);
                if (rejection.isPresent()) {
                    rejected++;
                    metrics.recordParameterRejected(sourced.kind());
                    log.info("Rejected candidate from {}: {}", reference.sourceRef(), rejection.get());
                } else {
                    parameters.add(sourced);
                }
            }
        }

        int accepted = parameters.size() - manualCount;
        SearchSummary summary = new SearchSummary(references.size(), processed, accepted, rejected);
        log.info("Search stage for '{}': processed={}, accepted={}, rejected={}",
                drug.innEn(), processed, accepted, rejected);

        return StageCommit.builder()
                .expected(PipelineStage.SEARCH.entry())
                .next(PipelineStage.SEARCH.success())
                .parameters(parameters)
                .searchSummary(summary)
                .message(references.isEmpty() ? "No literature found for " + drug.innEn() : null)
                .build();
    }

    private StageCommit designStage(ProjectSnapshot snapshot) {
        DesignInput input = parameterAggregator.toDesignInput(snapshot.parameters(), snapshot.assumptions());
        DesignResult design = designCalculator.calculate(input);
        log.info("Design for project {}: {} subjects ({}), enrollment {}, washout {} day(s)",
                snapshot.id(), design.sampleSize(), design.designType().label(),
                design.enrollmentWithScreenFail(), design.washoutDays());

        return StageCommit.builder()
                .expected(PipelineStage.DESIGN.entry())
                .next(PipelineStage.DESIGN.success())
                .design(design)
                .build();
    }

    private StageCommit regulatoryStage(ProjectSnapshot snapshot) {
        if (snapshot.design() == null) {
            throw new RegulatoryCheckException("No design result to evaluate");
        }
        RegulatoryVerdict verdict = ruleEvaluator.evaluate(snapshot.design(), snapshot.parameters());

        String message = null;
        if (!verdict.compliant()) {
            message = "Design is not compliant: " + verdict.outcomes().stream()
                    .filter(outcome -> !outcome.passed())
                    .map(RuleOutcome::ruleId)
                    .collect(Collectors.joining(", "));
        }

        return StageCommit.builder()
                .expected(PipelineStage.REGULATORY.entry())
                .next(PipelineStage.REGULATORY.success())
                .verdict(verdict)
                .message(message)
                .build();
    }

    private void requireHealthy(FallbackSignal signal) {
        signal.degradation().ifPresent(degradation -> {
            throw new CollaboratorUnavailableException(degradation.collaborator(), degradation.reason());
        });
    }

    private void generateReportQuietly(UUID projectId) {
        try {
            reportService.generate(projectId);
        } catch (DataAccessException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("⚠️ Automatic report for project {} failed, status unchanged: {}", projectId, e.getMessage());
        }
    }
}
