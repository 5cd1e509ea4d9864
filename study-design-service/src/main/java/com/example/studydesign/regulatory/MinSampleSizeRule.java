package com.example.studydesign.regulatory;

import com.example.studydesign.domain.RuleOutcome;

class MinSampleSizeRule implements RegulatoryRule {

    static final String ID = "MIN_SAMPLE_SIZE";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public RuleOutcome evaluate(RuleContext context) {
        int sampleSize = context.design().sampleSize();
        int floor = context.policy().standardMinSubjects();
        if (sampleSize < floor) {
            return RuleOutcome.fail(ID, "Sample size " + sampleSize + " is below the minimum of " + floor + " evaluable subjects");
        }
        return RuleOutcome.pass(ID, "Sample size " + sampleSize + " meets the minimum of " + floor);
    }
}
