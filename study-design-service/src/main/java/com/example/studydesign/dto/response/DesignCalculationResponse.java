package com.example.studydesign.dto.response;

public record DesignCalculationResponse(
    DesignResponse design,
    VerdictResponse verdict
) {}
