package com.tasktracker.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * ErrorResponse - The single error body used by every endpoint.
 * 
 * Example Response:
 * <pre>
 * {
 *   "success": false,
 *   "message": "Validation failed",
 *   "errors": [ { "field": "title", "message": "Title is required" } ],
 *   "timestamp": "2024-01-15T10:30:00Z",
 *   "traceId": "3f1c9e0a-..."
 * }
 * </pre>
 * 
 * message is always a fixed, client-safe text; exception messages and stack traces are
 * never copied into it. traceId is the request's correlation ID, matching the server logs.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ErrorResponse {

    @Builder.Default
    private boolean success = false;

    private String message;

    @Builder.Default
    private List<FieldError> errors = new ArrayList<>();

    @Builder.Default
    private Instant timestamp = Instant.now();

    private String traceId;

    public static ErrorResponse of(String message, String traceId) {
        return ErrorResponse.builder()
                .message(message)
                .traceId(traceId)
                .build();
    }

    /**
     * One rejected input field.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class FieldError {
        private String field;
        private String message;
    }
}
