package com.apistack.service.filter;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class RequestStageTest {

    @Test
    void testForwardTransitions() {
        assertTrue(RequestStage.RECEIVED.canAdvanceTo(RequestStage.AUTHENTICATED));
        assertTrue(RequestStage.RATE_CHECKED.canAdvanceTo(RequestStage.CACHE_HIT));
        assertTrue(RequestStage.RATE_CHECKED.canAdvanceTo(RequestStage.CACHE_MISS));
        assertTrue(RequestStage.HANDLED.canAdvanceTo(RequestStage.MAYBE_CACHED));
    }

    @Test
    void testStagesCannotBeSkipped() {
        assertFalse(RequestStage.RECEIVED.canAdvanceTo(RequestStage.RATE_CHECKED));
        assertFalse(RequestStage.CACHE_HIT.canAdvanceTo(RequestStage.HANDLED));
        assertFalse(RequestStage.AUTHENTICATED.canAdvanceTo(RequestStage.CACHE_MISS));
    }

    @Test
    void testShortCircuitToResponded() {
        for (RequestStage stage : RequestStage.values()) {
            assertEquals(stage != RequestStage.RESPONDED, stage.canAdvanceTo(RequestStage.RESPONDED));
        }
    }

    @Test
    void testContextRejectsIllegalTransition() {
        PipelineContext context = new PipelineContext("req-1", RoutePolicy.builder().id("r").pathPattern("/").build());

        assertThrows(IllegalStateException.class, () -> context.advance(RequestStage.HANDLED));

        context.advance(RequestStage.RESPONDED);
        context.finish();
        assertEquals(RequestStage.RESPONDED, context.getStage());
    }
}
