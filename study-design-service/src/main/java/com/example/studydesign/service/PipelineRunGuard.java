package com.example.studydesign.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process registry of projects with an active pipeline run.
 *
 * Acquired by the caller before a run is dispatched and released by the run when it ends.
 * Across instances the store's compare-and-set commit still rejects a second writer.
 */
@Component
@Slf4j
public class PipelineRunGuard {

    private final Set<UUID> activeRuns = ConcurrentHashMap.newKeySet();

    /**
     * @return false when a run for this project is already active
     */
    public boolean tryAcquire(UUID projectId) {
        boolean acquired = activeRuns.add(projectId);
        if (!acquired) {
            log.debug("Run guard busy for project {}", projectId);
        }
        return acquired;
    }

    public void release(UUID projectId) {
        activeRuns.remove(projectId);
    }

    public boolean isRunning(UUID projectId) {
        return activeRuns.contains(projectId);
    }

    public int activeRunCount() {
        return activeRuns.size();
    }
}
