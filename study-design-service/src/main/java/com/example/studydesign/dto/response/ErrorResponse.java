package com.example.studydesign.dto.response;

import lombok.Builder;

/**
 * Uniform error body for every failed request.
 */
@Builder
public record ErrorResponse(
    Error error,
    String timestamp
) {

    @Builder
    public record Error(
        String code,
        String message,
        String field,
        Object details
    ) {}
}
