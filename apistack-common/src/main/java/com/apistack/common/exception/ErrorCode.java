package com.apistack.common.exception;

/**
 * Error codes for categorizing failures surfaced to clients.
 * Error codes are organized by category:
 * - 1xxx: Authentication, authorization and client errors
 * - 2xxx: Object storage errors
 * - 3xxx: Data access errors
 * - 4xxx: Shared store (cache / counter) errors
 */
public enum ErrorCode {

    // Client errors (1xxx)
    INVALID_REQUEST(1001, "Invalid request parameters"),
    AUTH_MISSING(1002, "Authentication required"),
    AUTH_MALFORMED(1003, "Malformed credentials"),
    AUTH_EXPIRED(1004, "Credentials expired"),
    AUTH_INVALID_SIGNATURE(1005, "Credentials could not be verified"),
    AUTHORIZATION_FAILED(1008, "Not authorized to perform this operation"),
    RATE_LIMIT_EXCEEDED(1009, "Rate limit exceeded"),

    // Storage errors (2xxx)
    STORAGE_UNREACHABLE(2001, "Object storage is unavailable"),
    STORAGE_NOT_FOUND(2002, "Object does not exist"),
    STORAGE_PERMISSION_DENIED(2003, "Object storage denied the operation"),
    STORAGE_FAILED(2004, "Object storage operation failed"),

    // Data errors (3xxx)
    DATA_NOT_FOUND(3001, "Record does not exist"),
    DATA_CONFLICT(3002, "Record conflicts with existing data"),
    DATA_CONNECTION_LOST(3003, "Database connection lost"),
    DATA_TIMEOUT(3004, "Database operation timed out"),
    DATA_FAILED(3005, "Database operation failed"),

    // Shared store errors (4xxx)
    CACHE_UNREACHABLE(4001, "Cache store is unavailable"),
    COUNTER_STORE_UNREACHABLE(4002, "Counter store is unavailable"),

    // Unknown errors
    UNKNOWN_ERROR(9999, "Unknown error occurred");

    private final int code;
    private final String message;

    ErrorCode(int code, String message) {
        this.code = code;
        this.message = message;
    }

    public int getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
