package com.example.studydesign.domain;

import lombok.Builder;

/**
 * Caller-supplied study assumptions. Null fields fall back to the design policy defaults.
 *
 * @param power          target power, percent
 * @param alpha          significance level, fraction (0.05)
 * @param delta          acceptance margin, percent (20 gives limits 80.00-125.00%)
 * @param dropoutRate    expected dropout, percent
 * @param screenFailRate expected screen failures, percent
 */
@Builder
public record StudyAssumptions(
        Double power,
        Double alpha,
        Double delta,
        Double dropoutRate,
        Double screenFailRate
) {

    public static StudyAssumptions defaults() {
        return new StudyAssumptions(null, null, null, null, null);
    }
}
