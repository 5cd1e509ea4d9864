package com.example.studydesign.regulatory;

import com.example.studydesign.domain.DesignResult;
import com.example.studydesign.domain.RuleOutcome;

class EnrollmentConsistencyRule implements RegulatoryRule {

    static final String ID = "ENROLLMENT_CONSISTENCY";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public RuleOutcome evaluate(RuleContext context) {
        DesignResult design = context.design();
        String figures = design.sampleSize() + " <= " + design.enrollmentWithDropout() + " <= " + design.enrollmentWithScreenFail();
        boolean consistent = design.sampleSize() > 0
                && design.sampleSize() <= design.enrollmentWithDropout()
                && design.enrollmentWithDropout() <= design.enrollmentWithScreenFail();
        return consistent
                ? RuleOutcome.pass(ID, "Enrollment figures consistent: " + figures)
                : RuleOutcome.fail(ID, "Enrollment figures inconsistent: expected " + figures);
    }
}
