package com.example.studydesign.scheduler;

import com.example.studydesign.service.StudyProjectService;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.UUID;

/**
 * Marks pipeline runs that died with their process (restart, crash) as failed.
 *
 * A project left in a running status blocks nothing, but it never finishes on its own and
 * cannot be retried until it reaches a failure status. ShedLock keeps the job on one replica.
 */
@Component
@ConditionalOnProperty(name = "pipeline.recovery.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class StaleRunRecoveryScheduler {

    private final StudyProjectService projectService;
    private final Duration staleAfter;

    public StaleRunRecoveryScheduler(StudyProjectService projectService,
                                     @Value("${pipeline.recovery.stale-after:30m}") Duration staleAfter) {
        this.projectService = projectService;
        this.staleAfter = staleAfter;
    }

    @Scheduled(fixedDelayString = "${pipeline.recovery.interval-ms:300000}",
            initialDelayString = "${pipeline.recovery.initial-delay-ms:60000}")
    @SchedulerLock(name = "staleRunRecovery", lockAtMostFor = "9m", lockAtLeastFor = "30s")
    public void recoverStaleRuns() {
        MDC.put("correlationId", "RECOVERY-" + UUID.randomUUID().toString().substring(0, 8));
        try {
            int recovered = projectService.recoverStaleRuns(staleAfter);
            if (recovered > 0) {
                log.warn("Marked {} stale pipeline run(s) as failed (older than {})", recovered, staleAfter);
            } else {
                log.debug("No stale pipeline runs");
            }
        } finally {
            MDC.remove("correlationId");
        }
    }
}
