package com.tasktracker.web;

import com.tasktracker.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.List;

/**
 * Global exception handler - the outermost request boundary for controller errors.
 *
 * <p>Expected failures never reach here: services return them as result values and
 * controllers answer them directly. This class covers framework-level input problems
 * (400/404/405) and anything unexpected (500).
 *
 * <p>Unexpected faults are logged once with the stack trace; the MDC correlation ID is on
 * the log line and is returned as {@code traceId}. The response message is fixed and
 * never contains exception text.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    static final String VALIDATION_FAILED = "Validation failed";
    static final String MALFORMED_BODY = "Malformed request body";
    static final String INVALID_PARAMETER = "Invalid request parameter";
    static final String NOT_FOUND = "Resource not found";
    static final String METHOD_NOT_ALLOWED = "Method not allowed";
    static final String INTERNAL_ERROR = "An unexpected error occurred";

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
        List<ErrorResponse.FieldError> errors = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> new ErrorResponse.FieldError(fe.getField(), fe.getDefaultMessage()))
                .toList();
        log.warn("Validation failed on {} field(s)", errors.size());
        ErrorResponse body = ErrorResponse.of(VALIDATION_FAILED, CorrelationIdFilter.currentCorrelationId());
        body.setErrors(errors);
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getClass().getSimpleName());
        return ErrorResponses.of(HttpStatus.BAD_REQUEST, MALFORMED_BODY);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        log.warn("Bad value for parameter '{}'", ex.getName());
        ErrorResponse body = ErrorResponse.of(INVALID_PARAMETER, CorrelationIdFilter.currentCorrelationId());
        body.setErrors(List.of(new ErrorResponse.FieldError(ex.getName(), "Invalid value")));
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ErrorResponse> handleNoResource(NoResourceFoundException ex) {
        return ErrorResponses.of(HttpStatus.NOT_FOUND, NOT_FOUND);
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMethodNotSupported(HttpRequestMethodNotSupportedException ex) {
        return ErrorResponses.of(HttpStatus.METHOD_NOT_ALLOWED, METHOD_NOT_ALLOWED);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex) {
        log.error("Unhandled exception while processing request", ex);
        return ErrorResponses.of(HttpStatus.INTERNAL_SERVER_ERROR, INTERNAL_ERROR);
    }
}
