package com.example.studydesign.domain;

import lombok.Builder;

/**
 * Inputs to the design calculator. Null optional fields are replaced by policy defaults.
 *
 * @param cvIntra        intra-subject CV, percent; required
 * @param delta          acceptance margin, percent
 * @param power          target power, percent
 * @param alpha          significance level of each one-sided test
 * @param dropoutRate    percent in [0, 100)
 * @param screenFailRate percent in [0, 100)
 * @param halfLifeHours  elimination half-life in hours; optional
 */
@Builder(toBuilder = true)
public record DesignInput(
        Double cvIntra,
        Double delta,
        Double power,
        Double alpha,
        Double dropoutRate,
        Double screenFailRate,
        Double halfLifeHours
) {
}
