package com.example.studydesign.dto.response;

import com.example.studydesign.domain.ProjectStatus;
import com.example.studydesign.domain.SearchSummary;
import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Full project view. {@code searchSummary}, {@code design}, {@code verdict} and {@code report}
 * are null until the corresponding stage has produced them.
 */
@Builder
public record ProjectResponse(
    UUID id,
    ProjectStatus status,
    String statusMessage,
    int attempt,
    Drug drug,
    Assumptions assumptions,
    List<ParameterResponse> parameters,
    SearchSummary searchSummary,
    DesignResponse design,
    VerdictResponse verdict,
    ReportResponse report,

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss'Z'", timezone = "UTC")
    Instant createdAt,

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss'Z'", timezone = "UTC")
    Instant updatedAt
) {

    public record Drug(
        String innEn,
        String innRu,
        String dosage,
        String dosageForm,
        List<String> additionalSubstances
    ) {}

    public record Assumptions(
        Double power,
        Double alpha,
        Double delta,
        Double dropoutRate,
        Double screenFailRate
    ) {}
}
