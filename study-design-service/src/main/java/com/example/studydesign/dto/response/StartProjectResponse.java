package com.example.studydesign.dto.response;

import com.example.studydesign.domain.ProjectStatus;
import lombok.Builder;

import java.util.UUID;

/**
 * Answer to a pipeline trigger (create or retry). The run continues in the background.
 */
@Builder
public record StartProjectResponse(
    UUID projectId,
    ProjectStatus status,
    int attempt,
    String message
) {}
