package com.example.studydesign.domain;

import lombok.Builder;

import java.time.Duration;

/**
 * Computed study design. Immutable; a re-run produces a new instance.
 *
 * @param sampleSize               evaluable subjects, balanced over the sequences, before attrition
 * @param subjectsPerSequence      {@code sampleSize / sequences}
 * @param enrollmentWithDropout    subjects to randomize so that {@code sampleSize} complete
 * @param enrollmentWithScreenFail subjects to screen
 * @param washoutDays              washout between periods, whole days
 * @param washoutEstimated         true when no half-life was available
 * @param cvIntraUsed              CV_intra the calculation was based on, percent
 * @param halfLifeHoursUsed        half-life used for the washout, hours; null when estimated
 * @param designType               crossover scheme
 * @param power                    power used, percent
 * @param alpha                    alpha used
 * @param delta                    acceptance margin used, percent
 * @param dropoutRate              dropout used, percent
 * @param screenFailRate           screen failure used, percent
 * @param policyVersion            version of the design policy that produced this result
 * @param explanation              human-readable rationale for the design type, size and washout
 */
@Builder(toBuilder = true)
public record DesignResult(
        int sampleSize,
        int subjectsPerSequence,
        int enrollmentWithDropout,
        int enrollmentWithScreenFail,
        int washoutDays,
        boolean washoutEstimated,
        double cvIntraUsed,
        Double halfLifeHoursUsed,
        DesignType designType,
        double power,
        double alpha,
        double delta,
        double dropoutRate,
        double screenFailRate,
        String policyVersion,
        String explanation
) {

    public Duration washoutPeriod() {
        return Duration.ofDays(washoutDays);
    }

    public String randomizationScheme() {
        return designType.randomizationScheme();
    }
}
