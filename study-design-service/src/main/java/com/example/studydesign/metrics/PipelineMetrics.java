package com.example.studydesign.metrics;

import com.example.studydesign.domain.ParameterKind;
import com.example.studydesign.service.PipelineRunGuard;
import com.example.studydesign.service.PipelineStage;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Metrics component for Prometheus monitoring.
 *
 * Exposes:
 * - design_pipeline_runs_total{outcome}: finished runs by final status (or "abandoned")
 * - design_pipeline_stage_total{stage,outcome}: stage executions by result
 * - design_pipeline_stage_duration_seconds{stage}: stage duration including the commit
 * - design_pipeline_rejected_total: runs rejected by a saturated worker pool
 * - design_parameters_rejected_total{kind}: extraction candidates dropped by validation
 * - design_pipeline_active_runs: runs currently holding the in-process guard
 *
 * Access metrics: /actuator/prometheus
 */
@Component
@Slf4j
public class PipelineMetrics {

    public static final String OUTCOME_ABANDONED = "abandoned";

    private final MeterRegistry meterRegistry;
    private final Counter rejectedCounter;

    public PipelineMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.rejectedCounter = Counter.builder("design_pipeline_rejected_total")
                .description("Pipeline runs rejected because the worker queue was full (AbortPolicy)")
                .register(meterRegistry);
    }

    public void recordRun(String outcome) {
        Counter.builder("design_pipeline_runs_total")
                .description("Finished pipeline runs by outcome")
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment();
    }

    public void recordStage(PipelineStage stage, String outcome, Duration duration) {
        Counter.builder("design_pipeline_stage_total")
                .description("Pipeline stage executions by outcome")
                .tag("stage", stage.metricName())
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment();
        Timer.builder("design_pipeline_stage_duration_seconds")
                .description("Duration of pipeline stages")
                .tag("stage", stage.metricName())
                .register(meterRegistry)
                .record(duration);
    }

    public void recordRejection() {
        rejectedCounter.increment();
        log.debug("Recorded pipeline rejection");
    }

    public void recordParameterRejected(ParameterKind kind) {
        Counter.builder("design_parameters_rejected_total")
                .description("Extracted parameter candidates rejected as implausible")
                .tag("kind", kind == null ? "unknown" : kind.name().toLowerCase())
                .register(meterRegistry)
                .increment();
    }

    /**
     * Register the active-runs gauge (from the service owning the run guard).
     */
    public void registerActiveRuns(PipelineRunGuard runGuard) {
        Gauge.builder("design_pipeline_active_runs", runGuard, PipelineRunGuard::activeRunCount)
                .description("Pipeline runs currently active on this instance")
                .register(meterRegistry);
    }
}
