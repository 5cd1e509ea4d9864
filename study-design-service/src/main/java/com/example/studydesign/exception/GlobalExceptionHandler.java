package com.example.studydesign.exception;

import com.example.studydesign.dto.response.ErrorResponse;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.RejectedExecutionException;

/**
 * Global exception handler for REST controllers.
 * Converts exceptions to consistent ErrorResponse format.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ProjectNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleProjectNotFound(ProjectNotFoundException ex) {
        log.warn("Project not found: {}", ex.getMessage());
        return buildErrorResponse(
            HttpStatus.NOT_FOUND,
            "PROJECT_NOT_FOUND",
            ex.getMessage(),
            null
        );
    }

    @ExceptionHandler(ReportNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleReportNotFound(ReportNotFoundException ex) {
        log.warn("Report not found: {}", ex.getMessage());
        return buildErrorResponse(
            HttpStatus.NOT_FOUND,
            "REPORT_NOT_FOUND",
            ex.getMessage(),
            null
        );
    }

    @ExceptionHandler(PipelineAlreadyRunningException.class)
    public ResponseEntity<ErrorResponse> handleAlreadyRunning(PipelineAlreadyRunningException ex) {
        log.warn("Pipeline already running: {}", ex.getMessage());
        return buildErrorResponse(
            HttpStatus.CONFLICT,
            "PIPELINE_ALREADY_RUNNING",
            ex.getMessage(),
            null
        );
    }

    @ExceptionHandler(ProjectNotCompletedException.class)
    public ResponseEntity<ErrorResponse> handleNotCompleted(ProjectNotCompletedException ex) {
        log.warn("Project not completed: {}", ex.getMessage());
        return buildErrorResponse(
            HttpStatus.CONFLICT,
            "PROJECT_NOT_COMPLETED",
            ex.getMessage(),
            null
        );
    }

    @ExceptionHandler(IllegalStatusTransitionException.class)
    public ResponseEntity<ErrorResponse> handleIllegalTransition(IllegalStatusTransitionException ex) {
        log.warn("Illegal status transition: {}", ex.getMessage());
        return buildErrorResponse(
            HttpStatus.CONFLICT,
            "ILLEGAL_STATUS_TRANSITION",
            ex.getMessage(),
            null
        );
    }

    @ExceptionHandler(StageCommitConflictException.class)
    public ResponseEntity<ErrorResponse> handleCommitConflict(StageCommitConflictException ex) {
        log.warn("Concurrent project modification: {}", ex.getMessage());
        return buildErrorResponse(
            HttpStatus.CONFLICT,
            "CONFLICT",
            "Project was modified concurrently. Please refresh and retry.",
            null
        );
    }

    @ExceptionHandler(InvalidDesignInputException.class)
    public ResponseEntity<ErrorResponse> handleInvalidInput(InvalidDesignInputException ex) {
        log.warn("Invalid design input [{}]: {}", ex.getField(), ex.getMessage());
        return buildErrorResponse(
            HttpStatus.BAD_REQUEST,
            "INVALID_DESIGN_INPUT",
            ex.getMessage(),
            ex.getField()
        );
    }

    @ExceptionHandler(DesignComputationFailedException.class)
    public ResponseEntity<ErrorResponse> handleComputationFailed(DesignComputationFailedException ex) {
        log.warn("Design computation failed: {}", ex.getMessage());
        return buildErrorResponse(
            HttpStatus.UNPROCESSABLE_ENTITY,
            "DESIGN_COMPUTATION_FAILED",
            ex.getMessage(),
            null
        );
    }

    @ExceptionHandler(CollaboratorUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleCollaboratorUnavailable(CollaboratorUnavailableException ex) {
        log.error("Collaborator unavailable [{}]: {}", ex.getCollaborator(), ex.getMessage());
        return buildErrorResponse(
            HttpStatus.SERVICE_UNAVAILABLE,
            "SERVICE_UNAVAILABLE",
            ex.getMessage(),
            null,
            Map.of("collaborator", ex.getCollaborator())
        );
    }

    @ExceptionHandler(PipelineSaturatedException.class)
    public ResponseEntity<ErrorResponse> handleSaturated(PipelineSaturatedException ex) {
        log.warn("Pipeline executor saturated: {}", ex.getMessage());
        return buildErrorResponse(
            HttpStatus.SERVICE_UNAVAILABLE,
            "SERVICE_OVERLOADED",
            ex.getMessage(),
            null
        );
    }

    @ExceptionHandler(RejectedExecutionException.class)
    public ResponseEntity<ErrorResponse> handleRejectedExecution(RejectedExecutionException ex) {
        log.warn("Executor overloaded - rejected task");
        return buildErrorResponse(
            HttpStatus.SERVICE_UNAVAILABLE,
            "SERVICE_OVERLOADED",
            "Service is temporarily overloaded. Please retry later.",
            null
        );
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
        log.warn("Validation error: {}", ex.getMessage());

        Map<String, String> errors = new HashMap<>();
        ex.getBindingResult().getFieldErrors().forEach(error ->
            errors.put(error.getField(), error.getDefaultMessage())
        );

        String firstField = ex.getBindingResult().getFieldErrors().isEmpty()
            ? null
            : ex.getBindingResult().getFieldErrors().get(0).getField();
        String firstMessage = ex.getBindingResult().getFieldErrors().isEmpty()
            ? "Validation failed"
            : ex.getBindingResult().getFieldErrors().get(0).getDefaultMessage();

        return buildErrorResponse(
            HttpStatus.BAD_REQUEST,
            "VALIDATION_ERROR",
            firstMessage,
            firstField,
            errors
        );
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(ConstraintViolationException ex) {
        log.warn("Constraint violation: {}", ex.getMessage());
        return buildErrorResponse(
            HttpStatus.BAD_REQUEST,
            "VALIDATION_ERROR",
            ex.getMessage(),
            null
        );
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        return buildErrorResponse(
            HttpStatus.BAD_REQUEST,
            "BAD_REQUEST",
            "Malformed request body",
            null
        );
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        log.warn("Type mismatch for '{}': {}", ex.getName(), ex.getValue());
        return buildErrorResponse(
            HttpStatus.BAD_REQUEST,
            "BAD_REQUEST",
            "Invalid value for '" + ex.getName() + "'",
            ex.getName()
        );
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneric(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return buildErrorResponse(
            HttpStatus.INTERNAL_SERVER_ERROR,
            "INTERNAL_SERVER_ERROR",
            "An unexpected error occurred",
            null
        );
    }

    private ResponseEntity<ErrorResponse> buildErrorResponse(
        HttpStatus status,
        String code,
        String message,
        String field
    ) {
        return buildErrorResponse(status, code, message, field, null);
    }

    private ResponseEntity<ErrorResponse> buildErrorResponse(
        HttpStatus status,
        String code,
        String message,
        String field,
        Object details
    ) {
        ErrorResponse response = ErrorResponse.builder()
            .error(ErrorResponse.Error.builder()
                .code(code)
                .message(message)
                .field(field)
                .details(details)
                .build())
            .timestamp(Instant.now().toString())
            .build();

        return ResponseEntity.status(status).body(response);
    }
}
