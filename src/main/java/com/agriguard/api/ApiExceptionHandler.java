package com.agriguard.api;

import com.agriguard.error.AgriGuardException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Renders every rejected operation as
 * {@code {"error_kind": ..., "error_code": ..., "message": ..., "timestamp": ...}}.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(AgriGuardException.class)
    public ResponseEntity<Map<String, Object>> handleDomainError(AgriGuardException ex) {
        log.warn("Rejected {}/{}: {}", ex.getKind(), ex.getCode(), ex.getMessage());
        return ResponseEntity.status(statusFor(ex))
            .body(errorResponse(ex.getKind().name(), ex.getCode().name(), ex.getMessage()));
    }

    @ExceptionHandler({
        MethodArgumentTypeMismatchException.class,
        HttpMessageNotReadableException.class,
        MissingRequestHeaderException.class,
        MissingServletRequestParameterException.class
    })
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleParseErrors(Exception ex) {
        return errorResponse("VALIDATION", "BAD_REQUEST", "request format is invalid: " + ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleIllegalArgument(IllegalArgumentException ex) {
        return errorResponse("VALIDATION", "INVALID_ARGUMENT", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleUnexpected(Exception ex) {
        log.error("Unexpected error", ex);
        return errorResponse("INTERNAL", "INTERNAL_ERROR", "an unexpected error occurred");
    }

    static HttpStatus statusFor(AgriGuardException ex) {
        return switch (ex.getKind()) {
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case AUTHORIZATION -> HttpStatus.FORBIDDEN;
            case STATE -> ex.getCode().isNotFound() ? HttpStatus.NOT_FOUND : HttpStatus.CONFLICT;
            case RESOURCE -> HttpStatus.UNPROCESSABLE_ENTITY;
        };
    }

    private Map<String, Object> errorResponse(String errorKind, String errorCode, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error_kind", errorKind);
        body.put("error_code", errorCode);
        body.put("message", message);
        body.put("timestamp", Instant.now().toString());
        return body;
    }
}
