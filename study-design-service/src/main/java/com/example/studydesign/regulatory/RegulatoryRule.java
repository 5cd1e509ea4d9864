package com.example.studydesign.regulatory;

import com.example.studydesign.domain.RuleOutcome;

/**
 * One acceptance rule. Implementations are stateless and never throw; missing data is a failing outcome.
 */
public interface RegulatoryRule {

    String id();

    RuleOutcome evaluate(RuleContext context);
}
