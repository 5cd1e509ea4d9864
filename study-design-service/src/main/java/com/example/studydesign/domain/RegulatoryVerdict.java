package com.example.studydesign.domain;

import java.util.List;

/**
 * Aggregate outcome of the regulatory rule table.
 *
 * @param compliant      logical AND of every rule outcome
 * @param outcomes       one entry per rule, in evaluation order
 * @param warnings       advisory notes that never affect {@code compliant}
 * @param ruleSetVersion version of the rule table
 */
public record RegulatoryVerdict(
        boolean compliant,
        List<RuleOutcome> outcomes,
        List<String> warnings,
        String ruleSetVersion
) {

    public RegulatoryVerdict {
        outcomes = List.copyOf(outcomes);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static RegulatoryVerdict of(List<RuleOutcome> outcomes, List<String> warnings, String ruleSetVersion) {
        boolean compliant = outcomes.stream().allMatch(RuleOutcome::passed);
        return new RegulatoryVerdict(compliant, outcomes, warnings, ruleSetVersion);
    }
}
