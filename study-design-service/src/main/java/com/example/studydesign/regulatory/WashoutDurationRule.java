package com.example.studydesign.regulatory;

import com.example.studydesign.domain.RuleOutcome;

class WashoutDurationRule implements RegulatoryRule {

    static final String ID = "WASHOUT_DURATION";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public RuleOutcome evaluate(RuleContext context) {
        int washoutDays = context.design().washoutDays();
        if (context.longestHalfLifeHours().isEmpty()) {
            return RuleOutcome.fail(ID, "No reliable half-life on record; washout of " + washoutDays + " day(s) cannot be verified");
        }
        double halfLife = context.longestHalfLifeHours().getAsDouble();
        int multiple = context.policy().washoutHalfLives();
        double requiredHours = multiple * halfLife;
        if (washoutDays * 24.0 < requiredHours) {
            return RuleOutcome.fail(ID, String.format("Washout of %d day(s) is shorter than %d x T1/2 (%s h)",
                    washoutDays, multiple, RuleFormat.number(requiredHours)));
        }
        return RuleOutcome.pass(ID, String.format("Washout of %d day(s) covers %d x T1/2 (%s h)",
                washoutDays, multiple, RuleFormat.number(requiredHours)));
    }
}
