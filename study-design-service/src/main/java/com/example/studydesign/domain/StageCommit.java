package com.example.studydesign.domain;

import lombok.Builder;

import java.util.List;

/**
 * One atomic status change plus the results it carries.
 * The store applies it only if the project is still in {@code expected}.
 *
 * @param expected      status the project must currently have
 * @param next          status after the commit
 * @param parameters    replaces the parameter set when non-null
 * @param searchSummary replaces the search summary when non-null
 * @param design        replaces the design when non-null
 * @param verdict       replaces the verdict when non-null
 * @param message       status message; null clears it
 */
@Builder
public record StageCommit(
        ProjectStatus expected,
        ProjectStatus next,
        List<ExtractedParameter> parameters,
        SearchSummary searchSummary,
        DesignResult design,
        RegulatoryVerdict verdict,
        String message
) {

    public static StageCommit failure(ProjectStatus expected, ProjectStatus failureStatus, String message) {
        return StageCommit.builder()
                .expected(expected)
                .next(failureStatus)
                .message(message)
                .build();
    }

    public boolean isRetry() {
        return expected.canRetryTo(next);
    }
}
