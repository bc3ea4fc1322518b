package com.apistack.service.ratelimit;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one admission check.
 */
@Value
@Builder
public class RateLimitDecision {

    boolean admitted;
    long count;
    int limit;
    long remaining;
    long retryAfterSeconds;
    /** true when the counter store failed and the failure mode decided */
    boolean degraded;
}
