package com.example.studydesign.domain;

import lombok.Builder;

/**
 * One pharmacokinetic observation, either extracted from a literature source or supplied manually.
 *
 * @param kind        parameter kind
 * @param value       numeric value in {@code unit}
 * @param unit        unit as reported (CV_intra always in %)
 * @param sourceRef   provenance, e.g. {@code PMID:31234567} or {@code MANUAL}
 * @param sourceTitle title of the source document, if known
 * @param reliable    false when the observation should not drive the design
 */
@Builder(toBuilder = true)
public record ExtractedParameter(
        ParameterKind kind,
        double value,
        String unit,
        String sourceRef,
        String sourceTitle,
        boolean reliable
) {

    public static final String MANUAL_SOURCE = "MANUAL";
}
