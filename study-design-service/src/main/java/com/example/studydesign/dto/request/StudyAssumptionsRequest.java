package com.example.studydesign.dto.request;

import com.example.studydesign.domain.StudyAssumptions;

/**
 * Optional overrides of the design policy defaults.
 * Ranges are checked by the calculator so that a project and a stateless calculation reject the
 * same values with the same message.
 */
public record StudyAssumptionsRequest(
    Double power,
    Double alpha,
    Double delta,
    Double dropoutRate,
    Double screenFailRate
) {

    public StudyAssumptions toDomain() {
        return new StudyAssumptions(power, alpha, delta, dropoutRate, screenFailRate);
    }
}
