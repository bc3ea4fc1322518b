package com.apistack.service.config;

import com.apistack.common.exception.ApiStackException;
import com.apistack.common.exception.ErrorCode;
import com.apistack.service.filter.ErrorResponseWriter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Global exception handler for REST endpoints.
 * Uses the same status mapping and body as the pipeline filters.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private final ErrorResponseWriter errorWriter;

    public GlobalExceptionHandler(ErrorResponseWriter errorWriter) {
        this.errorWriter = errorWriter;
    }

    @ExceptionHandler(ApiStackException.class)
    public ResponseEntity<Map<String, Object>> handleApiStackException(ApiStackException ex) {
        HttpStatus status = ErrorResponseWriter.statusFor(ex);
        if (status.is5xxServerError()) {
            log.error("API stack exception: {} - {}", ex.getErrorCode(), ex.getMessage(), ex);
        } else {
            log.warn("API stack exception: {} - {}", ex.getErrorCode(), ex.getMessage());
        }

        ResponseEntity.BodyBuilder response = ResponseEntity.status(status);
        ErrorResponseWriter.headersFor(ex).forEach((name, value) -> response.header(name, value));
        return response.body(errorWriter.body(status, ex.getErrorCode()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Invalid request: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(errorWriter.body(HttpStatus.BAD_REQUEST, ErrorCode.INVALID_REQUEST));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        log.error("Unexpected exception", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(errorWriter.body(HttpStatus.INTERNAL_SERVER_ERROR, ErrorCode.UNKNOWN_ERROR));
    }
}
