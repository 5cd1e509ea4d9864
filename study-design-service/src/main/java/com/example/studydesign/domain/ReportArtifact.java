package com.example.studydesign.domain;

import java.time.Instant;

/**
 * Reference to a rendered study synopsis held by the rendering service.
 */
public record ReportArtifact(String artifactRef, String mediaType, Instant generatedAt) {
}
