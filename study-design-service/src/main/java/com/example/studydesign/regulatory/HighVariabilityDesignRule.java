package com.example.studydesign.regulatory;

import com.example.studydesign.domain.DesignType;
import com.example.studydesign.domain.RuleOutcome;

class HighVariabilityDesignRule implements RegulatoryRule {

    static final String ID = "HIGH_VARIABILITY_DESIGN";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public RuleOutcome evaluate(RuleContext context) {
        double cv = context.design().cvIntraUsed();
        double threshold = context.policy().highVariabilityThreshold();
        DesignType designType = context.design().designType();
        if (cv <= threshold) {
            return RuleOutcome.pass(ID, "CV_intra " + RuleFormat.number(cv) + "% does not require a replicate design");
        }
        if (designType != DesignType.REPLICATE) {
            return RuleOutcome.fail(ID, "CV_intra " + RuleFormat.number(cv) + "% exceeds " + RuleFormat.number(threshold)
                    + "% but the design is " + (designType == null ? "unspecified" : designType.label()));
        }
        return RuleOutcome.pass(ID, "Highly variable drug planned as " + designType.label());
    }
}
