package com.example.studydesign.service;

import com.example.studydesign.calculator.DesignCalculator;
import com.example.studydesign.calculator.DesignPolicy;
import com.example.studydesign.calculator.ParameterAggregator;
import com.example.studydesign.domain.DrugIdentifier;
import com.example.studydesign.domain.ExtractedParameter;
import com.example.studydesign.domain.ParameterKind;
import com.example.studydesign.domain.ProjectSnapshot;
import com.example.studydesign.domain.ProjectStatus;
import com.example.studydesign.domain.StageCommit;
import com.example.studydesign.domain.StudyAssumptions;
import com.example.studydesign.dto.PipelineRunResult;
import com.example.studydesign.metrics.PipelineMetrics;
import com.example.studydesign.regulatory.RegulatoryRuleEvaluator;
import com.example.studydesign.store.InMemoryProjectStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;

import java.util.List;
import java.util.UUID;

import static com.example.studydesign.service.FakeCollaborators.candidate;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StudyDesignOrchestratorTest {

    private static final DrugIdentifier IBUPROFEN = new DrugIdentifier("ibuprofen", "400 mg", "film-coated tablets");
    private static final String ABSTRACT_1 = "Ibuprofen 400 mg crossover in healthy volunteers...";
    private static final String ABSTRACT_2 = "Within-subject variability of ibuprofen...";

    private final FallbackSignal signal = new FallbackSignal();
    private final InMemoryProjectStore store = new InMemoryProjectStore();
    private final PipelineRunGuard runGuard = new PipelineRunGuard();
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();

    private FakeCollaborators.Search search;
    private FakeCollaborators.Extraction extraction;
    private FakeCollaborators.Renderer renderer;

    @BeforeEach
    void setUp() {
        search = new FakeCollaborators.Search(signal);
        extraction = new FakeCollaborators.Extraction(signal);
        renderer = new FakeCollaborators.Renderer();
    }

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    private StudyDesignOrchestrator orchestrator(boolean autoReport) {
        DesignPolicy policy = DesignPolicy.defaults();
        ParameterAggregator aggregator = new ParameterAggregator();
        return new StudyDesignOrchestrator(
                store, search, extraction,
                new ParameterValidator(),
                aggregator,
                new DesignCalculator(policy),
                new RegulatoryRuleEvaluator(policy, aggregator),
                new ReportService(store, renderer),
                runGuard,
                new PipelineMetrics(meterRegistry),
                signal,
                5,
                autoReport);
    }

    private UUID newProject(ExtractedParameter... manual) {
        ProjectSnapshot created = store.create(IBUPROFEN, StudyAssumptions.defaults(), List.of(manual));
        runGuard.tryAcquire(created.id());
        return created.id();
    }

    private ProjectSnapshot reload(UUID id) {
        return store.findById(id).orElseThrow();
    }

    private void literatureWithCvAndHalfLife() {
        search.withDocument("PMID:1001", "Bioequivalence of two ibuprofen formulations", ABSTRACT_1)
                .withDocument("PMID:1002", "Ibuprofen pharmacokinetics", ABSTRACT_2);
        extraction.answer(ABSTRACT_1,
                        candidate(ParameterKind.CMAX, 31.2, "ng/mL"),
                        candidate(ParameterKind.HALF_LIFE, 2.1, "h"))
                .answer(ABSTRACT_2, candidate(ParameterKind.CV_INTRA, 25.0, "%"));
    }

    @Test
    void runsAllStagesToCompletion() {
        literatureWithCvAndHalfLife();
        UUID id = newProject();

        PipelineRunResult result = orchestrator(false).runPipeline(id);

        ProjectSnapshot project = reload(id);
        assertThat(result.finalStatus()).isEqualTo(ProjectStatus.COMPLETED);
        assertThat(result.abandoned()).isFalse();
        assertThat(project.status()).isEqualTo(ProjectStatus.COMPLETED);
        assertThat(project.parameters()).hasSize(3)
                .extracting(ExtractedParameter::sourceRef)
                .containsExactly("PMID:1001", "PMID:1001", "PMID:1002");
        assertThat(project.parameters()).allSatisfy(p -> assertThat(p.sourceTitle()).isNotBlank());
        assertThat(project.searchSummary().documentsFound()).isEqualTo(2);
        assertThat(project.searchSummary().parametersAccepted()).isEqualTo(3);
        assertThat(project.design().sampleSize()).isEqualTo(28);
        assertThat(project.design().washoutEstimated()).isFalse();
        assertThat(project.verdict().compliant()).isTrue();
        assertThat(project.statusMessage()).isNull();
        assertThat(project.report()).isNull();

        assertThat(store.commits()).extracting(StageCommit::next).containsExactly(
                ProjectStatus.SEARCHING_COMPLETED, ProjectStatus.DESIGN_COMPLETED, ProjectStatus.COMPLETED);
        assertThat(runGuard.isRunning(id)).isFalse();
        assertThat(meterRegistry.get("design_pipeline_runs_total").tag("outcome", "completed").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void manualParametersSurviveAndTakePartInAggregation() {
        literatureWithCvAndHalfLife();
        ExtractedParameter manualCv = ExtractedParameter.builder()
                .kind(ParameterKind.CV_INTRA).value(30.0).unit("%")
                .sourceRef(ExtractedParameter.MANUAL_SOURCE).reliable(true).build();
        UUID id = newProject(manualCv);

        orchestrator(false).runPipeline(id);

        ProjectSnapshot project = reload(id);
        assertThat(project.parameters()).contains(manualCv);
        assertThat(project.searchSummary().parametersAccepted()).isEqualTo(3);
        assertThat(project.design().cvIntraUsed()).isEqualTo(30.0);
    }

    @Test
    void implausibleCandidatesAreRejectedAndCounted() {
        search.withDocument("PMID:2001", "Ibuprofen PK", ABSTRACT_1);
        extraction.answer(ABSTRACT_1,
                candidate(ParameterKind.CV_INTRA, 250.0, "%"),
                candidate(ParameterKind.HALF_LIFE, -2.0, "h"),
                candidate(ParameterKind.TMAX, 1.5, "h"));
        UUID id = newProject();

        orchestrator(false).runPipeline(id);

        ProjectSnapshot project = reload(id);
        assertThat(project.searchSummary().candidatesRejected()).isEqualTo(2);
        assertThat(project.parameters()).extracting(ExtractedParameter::kind).containsExactly(ParameterKind.TMAX);
        assertThat(meterRegistry.get("design_parameters_rejected_total").tag("kind", "cv_intra").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void missingCvFailsDesignButKeepsParameters() {
        search.withDocument("PMID:3001", "Ibuprofen PK", ABSTRACT_1);
        extraction.answer(ABSTRACT_1, candidate(ParameterKind.HALF_LIFE, 2.0, "h"));
        UUID id = newProject();

        PipelineRunResult result = orchestrator(false).runPipeline(id);

        ProjectSnapshot project = reload(id);
        assertThat(result.finalStatus()).isEqualTo(ProjectStatus.DESIGN_FAILED);
        assertThat(project.statusMessage()).contains("CV_intra");
        assertThat(project.parameters()).hasSize(1);
        assertThat(project.design()).isNull();
        assertThat(project.verdict()).isNull();
    }

    @Test
    void unrepresentableEnrollmentIsADesignFailure() {
        literatureWithCvAndHalfLife();
        ProjectSnapshot created = store.create(IBUPROFEN,
                StudyAssumptions.builder().dropoutRate(99.9999999).build(), List.of());
        runGuard.tryAcquire(created.id());

        PipelineRunResult result = orchestrator(false).runPipeline(created.id());

        ProjectSnapshot project = reload(created.id());
        assertThat(result.finalStatus()).isEqualTo(ProjectStatus.DESIGN_FAILED);
        assertThat(project.statusMessage()).contains("dropoutRate");
        assertThat(project.design()).isNull();
    }

    @Test
    void emptySearchIsValidAndEndsInDesignFailure() {
        UUID id = newProject();

        orchestrator(false).runPipeline(id);

        ProjectSnapshot project = reload(id);
        assertThat(store.commits()).extracting(StageCommit::next)
                .containsExactly(ProjectStatus.SEARCHING_COMPLETED, ProjectStatus.DESIGN_FAILED);
        assertThat(project.searchSummary().documentsFound()).isZero();
        assertThat(project.status()).isEqualTo(ProjectStatus.DESIGN_FAILED);
    }

    @Test
    void unavailableSearchFailsSearchStage() {
        search.unavailable = true;
        UUID id = newProject();

        orchestrator(false).runPipeline(id);

        ProjectSnapshot project = reload(id);
        assertThat(project.status()).isEqualTo(ProjectStatus.SEARCH_FAILED);
        assertThat(project.statusMessage()).contains("PubMed unavailable");
        assertThat(project.searchSummary()).isNull();
        assertThat(runGuard.isRunning(id)).isFalse();
    }

    @Test
    void unavailableExtractionFailsSearchStage() {
        literatureWithCvAndHalfLife();
        extraction.unavailable = true;
        UUID id = newProject();

        orchestrator(false).runPipeline(id);

        assertThat(reload(id).status()).isEqualTo(ProjectStatus.SEARCH_FAILED);
        assertThat(reload(id).statusMessage()).contains("timed out");
    }

    @Test
    void unexpectedErrorBecomesUncategorizedFailure() {
        search.failure = new IllegalStateException("response shape changed");
        UUID id = newProject();

        PipelineRunResult result = orchestrator(false).runPipeline(id);

        assertThat(result.finalStatus()).isEqualTo(ProjectStatus.FAILED);
        assertThat(reload(id).statusMessage()).contains("search stage", "response shape changed");
    }

    @Test
    void storeFaultEscapesAndLeavesLastCommittedStatus() {
        literatureWithCvAndHalfLife();
        UUID id = newProject();
        store.failOnCommit(2);

        assertThatThrownBy(() -> orchestrator(false).runPipeline(id))
                .isInstanceOf(DataAccessException.class);

        assertThat(reload(id).status()).isEqualTo(ProjectStatus.SEARCHING_COMPLETED);
        assertThat(runGuard.isRunning(id)).isFalse();
    }

    @Test
    void runIsAbandonedWhenAnotherWriterMovedTheProject() {
        UUID id = newProject();
        search.withDocument("PMID:4001", "Ibuprofen PK", ABSTRACT_1);
        FakeCollaborators.Extraction racing = new FakeCollaborators.Extraction(signal) {
            @Override
            public List<ExtractedParameter> extract(String documentText, DrugIdentifier drug) {
                store.put(reload(id).toBuilder().status(ProjectStatus.FAILED).statusMessage("recovered").build());
                return List.of();
            }
        };
        extraction = racing;

        PipelineRunResult result = orchestrator(false).runPipeline(id);

        assertThat(result.abandoned()).isTrue();
        assertThat(reload(id).status()).isEqualTo(ProjectStatus.FAILED);
        assertThat(reload(id).statusMessage()).isEqualTo("recovered");
        assertThat(store.commits()).isEmpty();
    }

    @Test
    void nonCompliantVerdictStillCompletesWithFailedRulesInMessage() {
        search.withDocument("PMID:5001", "Ibuprofen PK", ABSTRACT_1);
        extraction.answer(ABSTRACT_1, candidate(ParameterKind.CV_INTRA, 25.0, "%"));
        UUID id = newProject();

        orchestrator(false).runPipeline(id);

        ProjectSnapshot project = reload(id);
        assertThat(project.status()).isEqualTo(ProjectStatus.COMPLETED);
        assertThat(project.verdict().compliant()).isFalse();
        assertThat(project.statusMessage()).contains("WASHOUT_DURATION");
        assertThat(project.design().washoutEstimated()).isTrue();
    }

    @Test
    void retryResumesAtFailedStageWithoutSearchingAgain() {
        search.withDocument("PMID:6001", "Ibuprofen PK", ABSTRACT_1);
        extraction.answer(ABSTRACT_1, candidate(ParameterKind.HALF_LIFE, 2.0, "h"));
        UUID id = newProject();
        StudyDesignOrchestrator orchestrator = orchestrator(false);
        orchestrator.runPipeline(id);
        assertThat(reload(id).status()).isEqualTo(ProjectStatus.DESIGN_FAILED);

        ExtractedParameter manualCv = ExtractedParameter.builder()
                .kind(ParameterKind.CV_INTRA).value(22.0).unit("%")
                .sourceRef(ExtractedParameter.MANUAL_SOURCE).reliable(true).build();
        ProjectSnapshot failed = reload(id);
        store.put(failed.toBuilder()
                .parameters(List.of(failed.parameters().get(0), manualCv))
                .build());
        store.commit(id, StageCommit.builder()
                .expected(ProjectStatus.DESIGN_FAILED)
                .next(ProjectStatus.SEARCHING_COMPLETED)
                .build());
        runGuard.tryAcquire(id);

        PipelineRunResult result = orchestrator.runPipeline(id);

        assertThat(result.finalStatus()).isEqualTo(ProjectStatus.COMPLETED);
        assertThat(search.searches.get()).isEqualTo(1);
        assertThat(reload(id).attempt()).isEqualTo(2);
        assertThat(reload(id).design().cvIntraUsed()).isEqualTo(22.0);
    }

    @Test
    void automaticReportIsRecordedOnCompletion() {
        literatureWithCvAndHalfLife();
        UUID id = newProject();

        orchestrator(true).runPipeline(id);

        assertThat(reload(id).report()).isNotNull();
        assertThat(reload(id).report().artifactRef()).startsWith("synopsis-ibuprofen");
    }

    @Test
    void automaticReportFailureLeavesStatusUnchanged() {
        literatureWithCvAndHalfLife();
        renderer.unavailable = true;
        UUID id = newProject();

        PipelineRunResult result = orchestrator(true).runPipeline(id);

        assertThat(result.finalStatus()).isEqualTo(ProjectStatus.COMPLETED);
        assertThat(reload(id).status()).isEqualTo(ProjectStatus.COMPLETED);
        assertThat(reload(id).report()).isNull();
        assertThat(renderer.renders.get()).isEqualTo(1);
    }

    @Test
    void runGetsItsOwnCorrelationIdWhenNoneIsSet() {
        UUID id = newProject();

        PipelineRunResult result = orchestrator(false).runPipeline(id);

        assertThat(result.correlationId()).startsWith("PIPELINE-");
        assertThat(MDC.get("correlationId")).isNull();
    }

    @Test
    void degradationDoesNotLeakIntoNextRun() {
        search.unavailable = true;
        UUID first = newProject();
        StudyDesignOrchestrator orchestrator = orchestrator(false);
        orchestrator.runPipeline(first);

        search.unavailable = false;
        literatureWithCvAndHalfLife();
        UUID second = newProject();
        orchestrator.runPipeline(second);

        assertThat(reload(first).status()).isEqualTo(ProjectStatus.SEARCH_FAILED);
        assertThat(reload(second).status()).isEqualTo(ProjectStatus.COMPLETED);
    }
}
