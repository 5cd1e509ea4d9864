package com.example.studydesign.regulatory;

import com.example.studydesign.calculator.DesignPolicy;
import com.example.studydesign.calculator.ParameterAggregator;
import com.example.studydesign.domain.DesignResult;
import com.example.studydesign.domain.ExtractedParameter;
import com.example.studydesign.domain.RegulatoryVerdict;
import com.example.studydesign.domain.RuleOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Applies the regulatory rule table to a design and its parameter set.
 *
 * Rules run in a fixed order, each one independently. The verdict is compliant only if every rule
 * passes; order affects presentation only. Advisory warnings are attached separately and never
 * change the verdict. Approximates EAEU Decision 85 and EMA bioequivalence guidance.
 */
@Component
@Slf4j
public class RegulatoryRuleEvaluator {

    public static final String RULE_SET_VERSION = "EAEU85-EMA-2024.1";

    private static final double VERY_HIGH_CV = 50.0;
    private static final double VERY_LOW_CV = 5.0;
    private static final int LONG_WASHOUT_DAYS = 90;

    private final DesignPolicy policy;
    private final ParameterAggregator aggregator;
    private final List<RegulatoryRule> rules;

    public RegulatoryRuleEvaluator(DesignPolicy policy, ParameterAggregator aggregator) {
        this.policy = policy;
        this.aggregator = aggregator;
        this.rules = List.of(
                new CvIntraSourceRule(),
                new MinSampleSizeRule(),
                new HighVariabilityDesignRule(),
                new ReplicateMinSubjectsRule(),
                new WashoutDurationRule(),
                new EnrollmentConsistencyRule());
    }

    public List<String> ruleIds() {
        return rules.stream().map(RegulatoryRule::id).toList();
    }

    public RegulatoryVerdict evaluate(DesignResult design, List<ExtractedParameter> parameters) {
        List<ExtractedParameter> params = parameters == null ? List.of() : parameters;
        if (design == null) {
            List<RuleOutcome> outcomes = rules.stream()
                    .map(rule -> RuleOutcome.fail(rule.id(), "No design result to evaluate"))
                    .toList();
            return RegulatoryVerdict.of(outcomes, List.of(), RULE_SET_VERSION);
        }

        RuleContext context = new RuleContext(design, params, policy,
                aggregator.mostConservativeCvIntra(params),
                aggregator.longestHalfLifeHours(params));

        List<RuleOutcome> outcomes = rules.stream()
                .map(rule -> rule.evaluate(context))
                .toList();
        RegulatoryVerdict verdict = RegulatoryVerdict.of(outcomes, warnings(design), RULE_SET_VERSION);

        if (log.isDebugEnabled()) {
            outcomes.stream()
                    .filter(outcome -> !outcome.passed())
                    .forEach(outcome -> log.debug("Rule {} failed: {}", outcome.ruleId(), outcome.message()));
        }
        return verdict;
    }

    private List<String> warnings(DesignResult design) {
        List<String> warnings = new ArrayList<>();
        double cv = design.cvIntraUsed();
        if (cv > VERY_HIGH_CV) {
            warnings.add("Very high intra-subject variability (" + RuleFormat.number(cv)
                    + "%). Consider reference-scaled average bioequivalence.");
        }
        if (cv < VERY_LOW_CV) {
            warnings.add("Very low intra-subject variability (" + RuleFormat.number(cv) + "%). Verify the data source.");
        }
        if (design.washoutDays() > LONG_WASHOUT_DAYS) {
            warnings.add("Very long washout period (" + design.washoutDays()
                    + " days). Check practical feasibility and volunteer retention.");
        }
        if (design.washoutEstimated()) {
            warnings.add("Washout estimated from a fallback half-life of "
                    + RuleFormat.number(policy.fallbackHalfLifeHours()) + " h; no half-life was available.");
        }
        if (design.policyVersion() != null && !design.policyVersion().equals(policy.version())) {
            warnings.add("Design was computed under policy " + design.policyVersion()
                    + " but checked against policy " + policy.version() + "; recalculate before relying on the verdict.");
        }
        return warnings;
    }
}
