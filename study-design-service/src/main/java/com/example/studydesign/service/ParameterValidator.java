package com.example.studydesign.service;

import com.example.studydesign.domain.ExtractedParameter;
import com.example.studydesign.domain.ParameterKind;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Checks a parameter candidate against the stored-parameter invariants.
 * Violations are rejected, never clamped.
 */
@Component
public class ParameterValidator {

    public static final double MAX_CV_PERCENT = 200.0;

    /**
     * @return the rejection reason, or empty when the candidate is acceptable
     */
    public Optional<String> validate(ExtractedParameter candidate) {
        if (candidate.kind() == null) {
            return Optional.of("missing parameter kind");
        }
        if (!Double.isFinite(candidate.value())) {
            return Optional.of(candidate.kind().label() + " value is not a finite number");
        }
        if (candidate.value() < 0) {
            return Optional.of(candidate.kind().label() + " value " + candidate.value() + " is negative");
        }
        if (candidate.kind() == ParameterKind.CV_INTRA && candidate.value() > MAX_CV_PERCENT) {
            return Optional.of("CV_intra " + candidate.value() + "% exceeds the plausible maximum of " + MAX_CV_PERCENT + "%");
        }
        if (candidate.sourceRef() == null || candidate.sourceRef().isBlank()) {
            return Optional.of(candidate.kind().label() + " has no provenance");
        }
        return Optional.empty();
    }
}
