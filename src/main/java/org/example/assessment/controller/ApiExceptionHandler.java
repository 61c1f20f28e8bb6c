package org.example.assessment.controller;

import jakarta.servlet.http.HttpServletRequest;
import org.example.assessment.config.RequestCorrelation;
import org.example.assessment.service.AssessmentError;
import org.example.assessment.service.AssessmentException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps workflow failures to HTTP responses with body {@code {error, category, message, requestId}}.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(AssessmentException.class)
    public ResponseEntity<ApiError> handleAssessmentException(AssessmentException ex, HttpServletRequest request) {
        HttpStatus status = statusFor(ex.getCategory());
        log.warn("Rejected {} {}: {} ({})", request.getMethod(), request.getRequestURI(), ex.getError(), ex.getMessage());
        return ResponseEntity.status(status).body(new ApiError(
                ex.getError().name(),
                ex.getCategory().name(),
                ex.getMessage(),
                RequestCorrelation.resolveRequestId(request)));
    }

    @ExceptionHandler({
            IllegalArgumentException.class,
            HttpMessageNotReadableException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ApiError> handleBadRequest(Exception ex, HttpServletRequest request) {
        log.warn("Bad request {} {}: {}", request.getMethod(), request.getRequestURI(), ex.getMessage());
        return ResponseEntity.badRequest().body(new ApiError(
                "BAD_REQUEST",
                AssessmentError.Category.VALIDATION.name(),
                ex.getMessage(),
                RequestCorrelation.resolveRequestId(request)));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error("Unexpected error on {} {}", request.getMethod(), request.getRequestURI(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(new ApiError(
                "INTERNAL_ERROR",
                "INTERNAL",
                "An unexpected error occurred",
                RequestCorrelation.resolveRequestId(request)));
    }

    static HttpStatus statusFor(AssessmentError.Category category) {
        return switch (category) {
            case AUTHORIZATION, LEDGER -> HttpStatus.FORBIDDEN;
            case STATE_CONFLICT -> HttpStatus.CONFLICT;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case CONFIGURATION -> HttpStatus.SERVICE_UNAVAILABLE;
        };
    }

    public record ApiError(String error, String category, String message, String requestId) {
    }
}
