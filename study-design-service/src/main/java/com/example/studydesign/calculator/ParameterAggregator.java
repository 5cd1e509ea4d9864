package com.example.studydesign.calculator;

import com.example.studydesign.domain.DesignInput;
import com.example.studydesign.domain.ExtractedParameter;
import com.example.studydesign.domain.ParameterKind;
import com.example.studydesign.domain.StudyAssumptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Locale;
import java.util.OptionalDouble;

/**
 * Selects the values the calculator works with when several sources report the same parameter.
 *
 * Policy: only reliable observations count, and the most conservative one wins
 * (highest CV_intra, longest half-life).
 */
@Component
@Slf4j
public class ParameterAggregator {

    public OptionalDouble mostConservativeCvIntra(Collection<ExtractedParameter> parameters) {
        return parameters.stream()
                .filter(p -> p.kind() == ParameterKind.CV_INTRA && p.reliable())
                .mapToDouble(ExtractedParameter::value)
                .max();
    }

    public OptionalDouble longestHalfLifeHours(Collection<ExtractedParameter> parameters) {
        return parameters.stream()
                .filter(p -> p.kind() == ParameterKind.HALF_LIFE && p.reliable())
                .mapToDouble(p -> toHours(p.value(), p.unit()))
                .max();
    }

    /**
     * Builds calculator input from the project's parameters and the caller's assumptions.
     * CV_intra stays null when no reliable observation exists.
     */
    public DesignInput toDesignInput(Collection<ExtractedParameter> parameters, StudyAssumptions assumptions) {
        OptionalDouble cv = mostConservativeCvIntra(parameters);
        OptionalDouble halfLife = longestHalfLifeHours(parameters);
        return DesignInput.builder()
                .cvIntra(cv.isPresent() ? cv.getAsDouble() : null)
                .halfLifeHours(halfLife.isPresent() ? halfLife.getAsDouble() : null)
                .power(assumptions.power())
                .alpha(assumptions.alpha())
                .delta(assumptions.delta())
                .dropoutRate(assumptions.dropoutRate())
                .screenFailRate(assumptions.screenFailRate())
                .build();
    }

    double toHours(double value, String unit) {
        String normalized = unit == null ? "" : unit.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "h", "hr", "hrs", "hour", "hours" -> {
                return value;
            }
            case "min", "mins", "minute", "minutes" -> {
                return value / 60.0;
            }
            case "d", "day", "days" -> {
                return value * 24.0;
            }
            default -> {
                log.warn("Unknown half-life unit '{}', treating value {} as hours", unit, value);
                return value;
            }
        }
    }
}
