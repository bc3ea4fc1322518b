package com.apistack.service.filter;

import com.apistack.common.exception.ApiStackException;
import com.apistack.common.exception.AuthException;
import com.apistack.common.exception.CacheException;
import com.apistack.common.exception.DataException;
import com.apistack.common.exception.ErrorCode;
import com.apistack.common.exception.RateLimitExceededException;
import com.apistack.common.exception.StorageException;
import com.apistack.common.security.Principal;
import com.apistack.common.util.ManualClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.mock.web.MockHttpServletResponse;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the error-to-status mapping shared by filters and the exception handler
 */
public class ErrorResponseWriterTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    void testStatusMapping() {
        assertEquals(HttpStatus.UNAUTHORIZED, ErrorResponseWriter.statusFor(new AuthException(AuthException.Kind.EXPIRED)));
        assertEquals(HttpStatus.FORBIDDEN,
                ErrorResponseWriter.statusFor(new ApiStackException(ErrorCode.AUTHORIZATION_FAILED)));
        assertEquals(HttpStatus.TOO_MANY_REQUESTS, ErrorResponseWriter.statusFor(new RateLimitExceededException(5)));
        assertEquals(HttpStatus.NOT_FOUND,
                ErrorResponseWriter.statusFor(new DataException(DataException.Kind.NOT_FOUND, "x")));
        assertEquals(HttpStatus.CONFLICT,
                ErrorResponseWriter.statusFor(new DataException(DataException.Kind.CONFLICT, "x")));
        assertEquals(HttpStatus.SERVICE_UNAVAILABLE,
                ErrorResponseWriter.statusFor(new DataException(DataException.Kind.TIMEOUT, "x")));
        assertEquals(HttpStatus.SERVICE_UNAVAILABLE,
                ErrorResponseWriter.statusFor(new DataException(DataException.Kind.CONNECTION_LOST, "x")));
        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR,
                ErrorResponseWriter.statusFor(new DataException(DataException.Kind.OTHER, "x")));
        assertEquals(HttpStatus.NOT_FOUND,
                ErrorResponseWriter.statusFor(new StorageException(StorageException.Kind.NOT_FOUND, "x")));
        assertEquals(HttpStatus.FORBIDDEN,
                ErrorResponseWriter.statusFor(new StorageException(StorageException.Kind.PERMISSION_DENIED, "x")));
        assertEquals(HttpStatus.SERVICE_UNAVAILABLE,
                ErrorResponseWriter.statusFor(new StorageException(StorageException.Kind.UNREACHABLE, "x")));
        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, ErrorResponseWriter.statusFor(new CacheException("x", null)));
    }

    @Test
    void testWriteHidesInternalMessage() throws Exception {
        ErrorResponseWriter writer = new ErrorResponseWriter(new ObjectMapper(), new ManualClock(NOW));
        MockHttpServletResponse response = new MockHttpServletResponse();

        writer.write(response, new DataException(DataException.Kind.CONFLICT, "duplicate key accounts_pkey"));

        assertEquals(409, response.getStatus());
        String body = response.getContentAsString();
        assertTrue(body.contains("\"errorCode\":3002"));
        assertTrue(body.contains("\"errorType\":\"DATA_CONFLICT\""));
        assertTrue(body.contains("\"timestamp\":\"2024-01-01T00:00:00Z\""));
        assertFalse(body.contains("accounts_pkey"));
    }

    @Test
    void testAuthenticatedRequestRechecksExpiry() {
        ManualClock clock = new ManualClock(NOW);
        Principal principal = Principal.builder()
                .subject("alice")
                .issuedAt(NOW)
                .expiresAt(NOW.plusSeconds(60))
                .build();
        AuthenticatedRequest request = new AuthenticatedRequest(principal, clock);

        assertEquals("alice", request.subject());

        clock.advance(Duration.ofSeconds(60));
        AuthException e = assertThrows(AuthException.class, request::principal);
        assertEquals(AuthException.Kind.EXPIRED, e.getKind());
    }
}
