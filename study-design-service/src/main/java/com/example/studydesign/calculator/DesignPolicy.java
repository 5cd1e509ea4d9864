package com.example.studydesign.calculator;

import lombok.Builder;

/**
 * Versioned set of design constants. Every {@link com.example.studydesign.domain.DesignResult}
 * records the {@code version} it was computed with; change the version whenever a constant changes.
 *
 * @param version                  policy identifier stored with each design
 * @param alpha                    default significance level of each of the two one-sided tests, so
 *                                 0.05 corresponds to the 90% confidence interval of average
 *                                 bioequivalence and enters the sample size as {@code z(1-alpha)} =
 *                                 1.645, not the two-sided 1.96
 * @param power                    default target power, percent
 * @param delta                    default acceptance margin, percent
 * @param expectedRatio            assumed true test/reference ratio
 * @param highVariabilityThreshold CV_intra (percent) above which a replicate design is required
 * @param standardMinSubjects      minimum evaluable subjects for a 2x2 crossover
 * @param replicateMinSubjects     minimum evaluable subjects for a replicate design
 * @param washoutHalfLives         washout length in elimination half-lives
 * @param minWashoutHours          washout floor regardless of half-life
 * @param fallbackHalfLifeHours    half-life assumed when none is known
 * @param maxSampleSize            upper bound of the sample size search
 */
@Builder(toBuilder = true)
public record DesignPolicy(
        String version,
        double alpha,
        double power,
        double delta,
        double expectedRatio,
        double highVariabilityThreshold,
        int standardMinSubjects,
        int replicateMinSubjects,
        int washoutHalfLives,
        int minWashoutHours,
        double fallbackHalfLifeHours,
        int maxSampleSize
) {

    public static final String DEFAULT_VERSION = "2024.1";

    /**
     * EMA/EAEU bioequivalence defaults.
     */
    public static DesignPolicy defaults() {
        return DesignPolicy.builder()
                .version(DEFAULT_VERSION)
                .alpha(0.05)
                .power(80.0)
                .delta(20.0)
                .expectedRatio(0.95)
                .highVariabilityThreshold(30.0)
                .standardMinSubjects(12)
                .replicateMinSubjects(24)
                .washoutHalfLives(5)
                .minWashoutHours(24)
                .fallbackHalfLifeHours(24.0)
                .maxSampleSize(10_000)
                .build();
    }
}
