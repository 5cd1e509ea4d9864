package com.example.studydesign.service;

import com.example.studydesign.calculator.DesignCalculator;
import com.example.studydesign.calculator.DesignPolicy;
import com.example.studydesign.calculator.ParameterAggregator;
import com.example.studydesign.domain.DesignInput;
import com.example.studydesign.domain.DrugIdentifier;
import com.example.studydesign.domain.ExtractedParameter;
import com.example.studydesign.domain.ParameterKind;
import com.example.studydesign.domain.ProjectSnapshot;
import com.example.studydesign.domain.ProjectStatus;
import com.example.studydesign.domain.StudyAssumptions;
import com.example.studydesign.dto.PipelineRunResult;
import com.example.studydesign.exception.DesignComputationFailedException;
import com.example.studydesign.exception.IllegalStatusTransitionException;
import com.example.studydesign.exception.InvalidDesignInputException;
import com.example.studydesign.exception.PipelineAlreadyRunningException;
import com.example.studydesign.exception.PipelineSaturatedException;
import com.example.studydesign.exception.ProjectNotFoundException;
import com.example.studydesign.exception.ReportNotFoundException;
import com.example.studydesign.metrics.PipelineMetrics;
import com.example.studydesign.regulatory.RegulatoryRuleEvaluator;
import com.example.studydesign.store.InMemoryProjectStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.TaskRejectedException;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StudyProjectServiceTest {

    private static final DrugIdentifier METFORMIN = new DrugIdentifier("metformin", "500 mg", "tablets");

    private final InMemoryProjectStore store = new InMemoryProjectStore();
    private final PipelineRunGuard runGuard = new PipelineRunGuard();
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final List<UUID> dispatched = new CopyOnWriteArrayList<>();

    private boolean rejectDispatch;
    private StudyProjectService service;

    /**
     * Records dispatched runs instead of executing them, so a dispatched run stays "active".
     */
    private class RecordingOrchestrator extends StudyDesignOrchestrator {

        RecordingOrchestrator() {
            super(null, null, null, null, null, null, null, null, null, null, null, 5, false);
        }

        @Override
        public CompletableFuture<PipelineRunResult> runPipelineAsync(UUID projectId) {
            if (rejectDispatch) {
                throw new TaskRejectedException("Executor [pipelineTaskExecutor] did not accept task");
            }
            dispatched.add(projectId);
            return CompletableFuture.completedFuture(null);
        }
    }

    @BeforeEach
    void setUp() {
        DesignPolicy policy = DesignPolicy.defaults();
        ParameterAggregator aggregator = new ParameterAggregator();
        service = new StudyProjectService(
                store,
                new RecordingOrchestrator(),
                new ReportService(store, new FakeCollaborators.Renderer()),
                runGuard,
                new ParameterValidator(),
                aggregator,
                new DesignCalculator(policy),
                new RegulatoryRuleEvaluator(policy, aggregator),
                new PipelineMetrics(meterRegistry));
        service.registerGauges();
    }

    private ProjectSnapshot projectIn(ProjectStatus status) {
        ProjectSnapshot created = store.create(METFORMIN, StudyAssumptions.defaults(), List.of());
        ProjectSnapshot moved = created.toBuilder().status(status).build();
        store.put(moved);
        return moved;
    }

    @Test
    void startPipelineCreatesSearchingProjectAndDispatchesRun() {
        ProjectSnapshot created = service.startPipeline(METFORMIN, StudyAssumptions.defaults(), List.of());

        assertThat(created.status()).isEqualTo(ProjectStatus.SEARCHING);
        assertThat(created.attempt()).isEqualTo(1);
        assertThat(dispatched).containsExactly(created.id());
        assertThat(runGuard.isRunning(created.id())).isTrue();
        assertThat(meterRegistry.get("design_pipeline_active_runs").gauge().value()).isEqualTo(1.0);
    }

    @Test
    void manualParametersAreStoredWithManualProvenance() {
        ExtractedParameter manual = ExtractedParameter.builder()
                .kind(ParameterKind.CV_INTRA).value(18.0).unit("%").sourceRef("whatever").reliable(true).build();

        ProjectSnapshot created = service.startPipeline(METFORMIN, null, List.of(manual));

        assertThat(created.parameters()).singleElement()
                .satisfies(p -> assertThat(p.sourceRef()).isEqualTo(ExtractedParameter.MANUAL_SOURCE));
    }

    @Test
    void implausibleManualParameterIsRejectedBeforeCreation() {
        ExtractedParameter implausible = ExtractedParameter.builder()
                .kind(ParameterKind.CV_INTRA).value(250.0).unit("%").reliable(true).build();

        assertThatThrownBy(() -> service.startPipeline(METFORMIN, null, List.of(implausible)))
                .isInstanceOfSatisfying(InvalidDesignInputException.class,
                        e -> assertThat(e.getField()).isEqualTo("manualParameters[0]"));
        assertThat(store.findStaleRuns(Instant.now().plusSeconds(60))).isEmpty();
        assertThat(dispatched).isEmpty();
    }

    @Test
    void impossibleAssumptionsAreRejectedBeforeCreation() {
        StudyAssumptions totalDropout = StudyAssumptions.builder().dropoutRate(100.0).build();
        StudyAssumptions lowPower = StudyAssumptions.builder().power(30.0).build();

        assertThatThrownBy(() -> service.startPipeline(METFORMIN, totalDropout, List.of()))
                .isInstanceOfSatisfying(InvalidDesignInputException.class,
                        e -> assertThat(e.getField()).isEqualTo("dropoutRate"));
        assertThatThrownBy(() -> service.startPipeline(METFORMIN, lowPower, List.of()))
                .isInstanceOfSatisfying(InvalidDesignInputException.class,
                        e -> assertThat(e.getField()).isEqualTo("power"));
        assertThat(store.findStaleRuns(Instant.now().plusSeconds(60))).isEmpty();
        assertThat(store.commits()).isEmpty();
        assertThat(dispatched).isEmpty();
    }

    @Test
    void saturatedExecutorFailsProjectAndReleasesGuard() {
        rejectDispatch = true;

        assertThatThrownBy(() -> service.startPipeline(METFORMIN, null, List.of()))
                .isInstanceOf(PipelineSaturatedException.class);

        List<UUID> running = store.findStaleRuns(Instant.now().plusSeconds(60));
        assertThat(running).isEmpty();
        assertThat(store.commits()).singleElement().satisfies(commit -> {
            assertThat(commit.next()).isEqualTo(ProjectStatus.FAILED);
            assertThat(commit.message()).isEqualTo(StudyProjectService.SATURATED_MESSAGE);
        });
        assertThat(meterRegistry.get("design_pipeline_active_runs").gauge().value()).isZero();
        assertThat(meterRegistry.get("design_pipeline_rejected_total").counter().count()).isEqualTo(1.0);
    }

    @Test
    void retryResumesAtFailedStage() {
        ProjectSnapshot failed = projectIn(ProjectStatus.DESIGN_FAILED);

        ProjectSnapshot resumed = service.retry(failed.id());

        assertThat(resumed.status()).isEqualTo(ProjectStatus.SEARCHING_COMPLETED);
        assertThat(resumed.attempt()).isEqualTo(2);
        assertThat(dispatched).containsExactly(failed.id());
    }

    @Test
    void retryOfUncategorizedFailureStartsFromSearch() {
        ProjectSnapshot failed = projectIn(ProjectStatus.FAILED);

        assertThat(service.retry(failed.id()).status()).isEqualTo(ProjectStatus.SEARCHING);
    }

    @Test
    void retryWhileRunningIsRejected() {
        ProjectSnapshot running = projectIn(ProjectStatus.SEARCHING_COMPLETED);

        assertThatThrownBy(() -> service.retry(running.id()))
                .isInstanceOf(PipelineAlreadyRunningException.class);
        assertThat(dispatched).isEmpty();
    }

    @Test
    void retryOfCompletedProjectIsRejected() {
        ProjectSnapshot completed = projectIn(ProjectStatus.COMPLETED);

        assertThatThrownBy(() -> service.retry(completed.id()))
                .isInstanceOf(IllegalStatusTransitionException.class);
    }

    @Test
    void concurrentRetriesStartExactlyOneRun() throws Exception {
        ProjectSnapshot failed = projectIn(ProjectStatus.SEARCH_FAILED);
        int callers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger accepted = new AtomicInteger();
        AtomicInteger rejected = new AtomicInteger();

        try {
            List<Future<?>> futures = new CopyOnWriteArrayList<>();
            for (int i = 0; i < callers; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    try {
                        service.retry(failed.id());
                        accepted.incrementAndGet();
                    } catch (PipelineAlreadyRunningException e) {
                        rejected.incrementAndGet();
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(accepted.get()).isEqualTo(1);
        assertThat(rejected.get()).isEqualTo(callers - 1);
        assertThat(dispatched).containsExactly(failed.id());
        assertThat(store.findById(failed.id()).orElseThrow().attempt()).isEqualTo(2);
    }

    @Test
    void staleRunsAreMarkedFailedUnlessActiveHere() {
        Instant longAgo = Instant.now().minus(Duration.ofHours(2));
        ProjectSnapshot stale = projectIn(ProjectStatus.SEARCHING_COMPLETED);
        store.put(stale.toBuilder().updatedAt(longAgo).build());
        ProjectSnapshot activeHere = projectIn(ProjectStatus.SEARCHING);
        store.put(activeHere.toBuilder().updatedAt(longAgo).build());
        runGuard.tryAcquire(activeHere.id());
        ProjectSnapshot recent = projectIn(ProjectStatus.DESIGN_COMPLETED);

        int recovered = service.recoverStaleRuns(Duration.ofMinutes(30));

        assertThat(recovered).isEqualTo(1);
        ProjectSnapshot recoveredProject = store.findById(stale.id()).orElseThrow();
        assertThat(recoveredProject.status()).isEqualTo(ProjectStatus.FAILED);
        assertThat(recoveredProject.statusMessage()).isEqualTo(StudyProjectService.INTERRUPTED_MESSAGE);
        assertThat(store.findById(activeHere.id()).orElseThrow().status()).isEqualTo(ProjectStatus.SEARCHING);
        assertThat(store.findById(recent.id()).orElseThrow().status()).isEqualTo(ProjectStatus.DESIGN_COMPLETED);

        assertThat(service.retry(stale.id()).status()).isEqualTo(ProjectStatus.SEARCHING);
    }

    @Test
    void statelessCalculationReturnsDesignAndVerdict() {
        StudyProjectService.DesignCalculation calculation = service.calculate(DesignInput.builder()
                .cvIntra(25.0)
                .halfLifeHours(12.0)
                .dropoutRate(20.0)
                .screenFailRate(12.0)
                .build());

        assertThat(calculation.design().sampleSize()).isEqualTo(28);
        assertThat(calculation.design().enrollmentWithScreenFail()).isEqualTo(40);
        assertThat(calculation.verdict().compliant()).isTrue();
        assertThat(dispatched).isEmpty();
    }

    @Test
    void statelessCalculationWithoutHalfLifeIsNotCompliant() {
        StudyProjectService.DesignCalculation calculation = service.calculate(DesignInput.builder().cvIntra(25.0).build());

        assertThat(calculation.verdict().compliant()).isFalse();
        assertThat(calculation.design().washoutEstimated()).isTrue();
    }

    @Test
    void statelessCalculationWithoutCvFails() {
        assertThatThrownBy(() -> service.calculate(DesignInput.builder().halfLifeHours(4.0).build()))
                .isInstanceOf(DesignComputationFailedException.class);
    }

    @Test
    void unknownProjectAndMissingReport() {
        assertThatThrownBy(() -> service.getProject(UUID.randomUUID()))
                .isInstanceOf(ProjectNotFoundException.class);

        ProjectSnapshot completed = projectIn(ProjectStatus.COMPLETED);
        assertThatThrownBy(() -> service.getReport(completed.id()))
                .isInstanceOf(ReportNotFoundException.class);
    }
}
