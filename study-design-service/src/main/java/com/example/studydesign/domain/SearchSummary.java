package com.example.studydesign.domain;

/**
 * Outcome counters of the literature search and extraction stage.
 */
public record SearchSummary(int documentsFound, int documentsProcessed, int parametersAccepted, int candidatesRejected) {

    public static SearchSummary empty() {
        return new SearchSummary(0, 0, 0, 0);
    }
}
