package com.apistack.service.filter;

import com.apistack.common.exception.ApiStackException;
import com.apistack.common.exception.AuthException;
import com.apistack.common.exception.DataException;
import com.apistack.common.exception.ErrorCode;
import com.apistack.common.exception.RateLimitExceededException;
import com.apistack.common.exception.StorageException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes the error body shared by filters and the exception handler:
 * {@code {status, errorCode, errorType, timestamp}}. Internal messages are never exposed.
 */
@Component
public class ErrorResponseWriter {

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ErrorResponseWriter(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public void write(HttpServletResponse response, ApiStackException ex) throws IOException {
        HttpStatus status = statusFor(ex);
        response.resetBuffer();
        response.setStatus(status.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        headersFor(ex).forEach(response::setHeader);
        objectMapper.writeValue(response.getOutputStream(), body(status, ex.getErrorCode()));
    }

    public Map<String, Object> body(HttpStatus status, ErrorCode errorCode) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status.value());
        body.put("errorCode", errorCode.getCode());
        body.put("errorType", errorCode.name());
        body.put("timestamp", clock.instant().toString());
        return body;
    }

    public static Map<String, String> headersFor(ApiStackException ex) {
        Map<String, String> headers = new LinkedHashMap<>();
        if (ex instanceof AuthException) {
            AuthException.Kind kind = ((AuthException) ex).getKind();
            headers.put(HttpHeaders.WWW_AUTHENTICATE,
                    kind == AuthException.Kind.MISSING ? "Bearer" : "Bearer error=\"invalid_token\"");
        } else if (ex instanceof RateLimitExceededException) {
            headers.put(HttpHeaders.RETRY_AFTER, String.valueOf(((RateLimitExceededException) ex).getRetryAfterSeconds()));
        }
        return headers;
    }

    public static HttpStatus statusFor(ApiStackException ex) {
        if (ex instanceof AuthException) {
            return HttpStatus.UNAUTHORIZED;
        }
        if (ex instanceof RateLimitExceededException) {
            return HttpStatus.TOO_MANY_REQUESTS;
        }
        if (ex instanceof DataException) {
            switch (((DataException) ex).getKind()) {
                case NOT_FOUND:
                    return HttpStatus.NOT_FOUND;
                case CONFLICT:
                    return HttpStatus.CONFLICT;
                case TIMEOUT:
                case CONNECTION_LOST:
                    return HttpStatus.SERVICE_UNAVAILABLE;
                default:
                    return HttpStatus.INTERNAL_SERVER_ERROR;
            }
        }
        if (ex instanceof StorageException) {
            switch (((StorageException) ex).getKind()) {
                case NOT_FOUND:
                    return HttpStatus.NOT_FOUND;
                case PERMISSION_DENIED:
                    return HttpStatus.FORBIDDEN;
                case UNREACHABLE:
                    return HttpStatus.SERVICE_UNAVAILABLE;
                default:
                    return HttpStatus.INTERNAL_SERVER_ERROR;
            }
        }
        return statusFor(ex.getErrorCode());
    }

    private static HttpStatus statusFor(ErrorCode errorCode) {
        switch (errorCode) {
            case AUTHORIZATION_FAILED:
                return HttpStatus.FORBIDDEN;
            case INVALID_REQUEST:
                return HttpStatus.BAD_REQUEST;
            case CACHE_UNREACHABLE:
            case COUNTER_STORE_UNREACHABLE:
                return HttpStatus.SERVICE_UNAVAILABLE;
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }
}
