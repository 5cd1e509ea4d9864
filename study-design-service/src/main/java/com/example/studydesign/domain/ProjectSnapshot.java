package com.example.studydesign.domain;

import lombok.Builder;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Read-only view of a project as last committed to the store.
 * {@code design}, {@code verdict}, {@code report} and {@code searchSummary} are null until produced.
 */
@Builder(toBuilder = true)
public record ProjectSnapshot(
        UUID id,
        DrugIdentifier drug,
        StudyAssumptions assumptions,
        ProjectStatus status,
        String statusMessage,
        int attempt,
        List<ExtractedParameter> parameters,
        SearchSummary searchSummary,
        DesignResult design,
        RegulatoryVerdict verdict,
        ReportArtifact report,
        Instant createdAt,
        Instant updatedAt
) {

    public ProjectSnapshot {
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
        assumptions = assumptions == null ? StudyAssumptions.defaults() : assumptions;
    }
}
