package com.example.studydesign.dto;

import com.example.studydesign.domain.ProjectStatus;
import lombok.Builder;

import java.util.UUID;

/**
 * Outcome of one pipeline run.
 *
 * @param abandoned true when another run took over the project and this one stopped without writing
 */
@Builder
public record PipelineRunResult(
        UUID projectId,
        ProjectStatus finalStatus,
        boolean abandoned,
        String message,
        String correlationId,
        long durationMs
) {
}
