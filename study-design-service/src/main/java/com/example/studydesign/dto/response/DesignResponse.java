package com.example.studydesign.dto.response;

import lombok.Builder;

/**
 * Design result as shown to callers. Rates and power are percentages, alpha a fraction.
 */
@Builder
public record DesignResponse(
    String designType,
    String designLabel,
    int periods,
    String randomizationScheme,
    int sampleSize,
    int subjectsPerSequence,
    int enrollmentWithDropout,
    int enrollmentWithScreenFail,
    int washoutDays,
    boolean washoutEstimated,
    double cvIntraUsed,
    Double halfLifeHoursUsed,
    double power,
    double alpha,
    double delta,
    double dropoutRate,
    double screenFailRate,
    String policyVersion,
    String explanation
) {}
