package com.example.studydesign.dto.request;

import com.example.studydesign.domain.DesignInput;

/**
 * Stateless calculation input. A missing {@code cvIntra} is answered with 422 by the calculator,
 * not with a validation error.
 */
public record CalculateDesignRequest(
    Double cvIntra,
    Double halfLifeHours,
    Double power,
    Double alpha,
    Double delta,
    Double dropoutRate,
    Double screenFailRate
) {

    public DesignInput toDesignInput() {
        return DesignInput.builder()
            .cvIntra(cvIntra)
            .halfLifeHours(halfLifeHours)
            .power(power)
            .alpha(alpha)
            .delta(delta)
            .dropoutRate(dropoutRate)
            .screenFailRate(screenFailRate)
            .build();
    }
}
