package com.tasktracker.web;

import com.tasktracker.dto.ErrorResponse;
import com.tasktracker.service.ErrorCategory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Builds error responses for expected failures returned by the service layer.
 */
public final class ErrorResponses {

    private ErrorResponses() {
        // utility class
    }

    public static HttpStatus statusFor(ErrorCategory category) {
        switch (category) {
            case VALIDATION:
                return HttpStatus.BAD_REQUEST;
            case AUTHENTICATION:
                return HttpStatus.UNAUTHORIZED;
            case NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case CONFLICT:
                return HttpStatus.CONFLICT;
            default:
                throw new IllegalArgumentException("Unmapped error category: " + category);
        }
    }

    public static ResponseEntity<ErrorResponse> of(ErrorCategory category, String message) {
        return of(statusFor(category), message);
    }

    public static ResponseEntity<ErrorResponse> of(HttpStatus status, String message) {
        return ResponseEntity.status(status)
                .body(ErrorResponse.of(message, CorrelationIdFilter.currentCorrelationId()));
    }
}
