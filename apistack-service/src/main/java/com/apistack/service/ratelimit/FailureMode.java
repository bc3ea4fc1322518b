package com.apistack.service.ratelimit;

/**
 * What the limiter does when the counter store cannot be reached.
 */
public enum FailureMode {
    /** admit the request and log the degradation */
    FAIL_OPEN,
    /** reject the request as if the limit had been reached */
    FAIL_CLOSED
}
