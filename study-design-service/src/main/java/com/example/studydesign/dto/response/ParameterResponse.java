package com.example.studydesign.dto.response;

import lombok.Builder;

@Builder
public record ParameterResponse(
    String kind,
    double value,
    String unit,
    String sourceRef,
    String sourceTitle,
    boolean reliable
) {}
