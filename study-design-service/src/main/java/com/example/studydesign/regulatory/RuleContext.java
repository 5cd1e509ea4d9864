package com.example.studydesign.regulatory;

import com.example.studydesign.calculator.DesignPolicy;
import com.example.studydesign.domain.DesignResult;
import com.example.studydesign.domain.ExtractedParameter;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Everything a rule may look at. Aggregates are precomputed once per evaluation.
 *
 * @param design               design under review, never null
 * @param parameters           the project's parameter set
 * @param policy               policy constants
 * @param reliableCvIntra      most conservative reliable CV_intra, if any
 * @param longestHalfLifeHours longest reliable half-life in hours, if any
 */
public record RuleContext(
        DesignResult design,
        List<ExtractedParameter> parameters,
        DesignPolicy policy,
        OptionalDouble reliableCvIntra,
        OptionalDouble longestHalfLifeHours
) {
}
