package com.example.studydesign.dto.response;

import lombok.Builder;

import java.util.List;

@Builder
public record VerdictResponse(
    boolean compliant,
    List<RuleResult> rules,
    List<String> warnings,
    String ruleSetVersion
) {

    public record RuleResult(
        String ruleId,
        boolean passed,
        String message
    ) {}
}
