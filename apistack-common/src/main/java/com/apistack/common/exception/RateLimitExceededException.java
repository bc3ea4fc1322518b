package com.apistack.common.exception;

/**
 * Exception thrown when a caller has used up its request budget for the current window.
 */
public class RateLimitExceededException extends ApiStackException {

    private final long retryAfterSeconds;

    public RateLimitExceededException(long retryAfterSeconds) {
        super(ErrorCode.RATE_LIMIT_EXCEEDED);
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
