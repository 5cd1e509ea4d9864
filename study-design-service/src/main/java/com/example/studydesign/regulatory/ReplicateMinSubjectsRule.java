package com.example.studydesign.regulatory;

import com.example.studydesign.domain.DesignType;
import com.example.studydesign.domain.RuleOutcome;

class ReplicateMinSubjectsRule implements RegulatoryRule {

    static final String ID = "REPLICATE_MIN_SUBJECTS";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public RuleOutcome evaluate(RuleContext context) {
        if (context.design().designType() != DesignType.REPLICATE) {
            return RuleOutcome.pass(ID, "Not applicable to a standard crossover");
        }
        int sampleSize = context.design().sampleSize();
        int floor = context.policy().replicateMinSubjects();
        if (sampleSize < floor) {
            return RuleOutcome.fail(ID, "Replicate design with " + sampleSize + " subjects is below the minimum of " + floor);
        }
        return RuleOutcome.pass(ID, "Replicate design with " + sampleSize + " subjects meets the minimum of " + floor);
    }
}
