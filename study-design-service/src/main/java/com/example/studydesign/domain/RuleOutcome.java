package com.example.studydesign.domain;

/**
 * Result of one regulatory rule.
 */
public record RuleOutcome(String ruleId, boolean passed, String message) {

    public static RuleOutcome pass(String ruleId, String message) {
        return new RuleOutcome(ruleId, true, message);
    }

    public static RuleOutcome fail(String ruleId, String message) {
        return new RuleOutcome(ruleId, false, message);
    }
}
