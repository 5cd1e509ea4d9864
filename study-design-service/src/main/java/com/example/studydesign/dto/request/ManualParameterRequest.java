package com.example.studydesign.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * Pharmacokinetic observation supplied by the caller.
 * {@code kind} accepts labels and common aliases ("CV_intra", "T1/2", "half-life").
 */
public record ManualParameterRequest(

    @NotBlank(message = "Parameter kind is required")
    String kind,

    @NotNull(message = "Parameter value is required")
    Double value,

    @Size(max = 30, message = "Unit must not exceed 30 characters")
    String unit,

    @Size(max = 500, message = "Source title must not exceed 500 characters")
    String sourceTitle
) {}
