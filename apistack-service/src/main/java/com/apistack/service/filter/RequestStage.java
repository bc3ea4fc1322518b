package com.apistack.service.filter;

import java.util.EnumSet;
import java.util.Set;

/**
 * Stages a request passes through in the pipeline. Any stage may short-circuit to RESPONDED.
 */
public enum RequestStage {
    RECEIVED,
    AUTHENTICATED,
    RATE_CHECKED,
    CACHE_HIT,
    CACHE_MISS,
    HANDLED,
    MAYBE_CACHED,
    RESPONDED;

    public boolean canAdvanceTo(RequestStage next) {
        return next == RESPONDED ? this != RESPONDED : successors().contains(next);
    }

    private Set<RequestStage> successors() {
        switch (this) {
            case RECEIVED:
                return EnumSet.of(AUTHENTICATED);
            case AUTHENTICATED:
                return EnumSet.of(RATE_CHECKED);
            case RATE_CHECKED:
                return EnumSet.of(CACHE_HIT, CACHE_MISS);
            case CACHE_MISS:
                return EnumSet.of(HANDLED);
            case HANDLED:
                return EnumSet.of(MAYBE_CACHED);
            default:
                return EnumSet.noneOf(RequestStage.class);
        }
    }
}
