package com.example.studydesign.regulatory;

import com.example.studydesign.domain.ExtractedParameter;
import com.example.studydesign.domain.ParameterKind;
import com.example.studydesign.domain.RuleOutcome;

class CvIntraSourceRule implements RegulatoryRule {

    static final String ID = "CV_INTRA_SOURCE";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public RuleOutcome evaluate(RuleContext context) {
        if (context.reliableCvIntra().isEmpty()) {
            return RuleOutcome.fail(ID, "No reliable CV_intra observation backs the design");
        }
        long sources = context.parameters().stream()
                .filter(p -> p.kind() == ParameterKind.CV_INTRA && p.reliable())
                .map(ExtractedParameter::sourceRef)
                .distinct()
                .count();
        return RuleOutcome.pass(ID, String.format("CV_intra %s%% backed by %d reliable source(s)",
                RuleFormat.number(context.reliableCvIntra().getAsDouble()), sources));
    }
}
