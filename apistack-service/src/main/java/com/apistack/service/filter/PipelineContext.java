package com.apistack.service.filter;

import com.apistack.common.security.Principal;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Per-request pipeline state, carried as a request attribute from the outermost filter inward.
 */
@Slf4j
public class PipelineContext {

    public static final String ATTRIBUTE = PipelineContext.class.getName();

    private final String requestId;
    private final RoutePolicy route;
    private final List<RequestStage> history = new ArrayList<>();
    private RequestStage stage = RequestStage.RECEIVED;
    private Principal principal;

    public PipelineContext(String requestId, RoutePolicy route) {
        this.requestId = requestId;
        this.route = route;
        this.history.add(RequestStage.RECEIVED);
    }

    public static PipelineContext from(HttpServletRequest request) {
        Object context = request.getAttribute(ATTRIBUTE);
        if (!(context instanceof PipelineContext)) {
            throw new IllegalStateException("No pipeline context on request " + request.getRequestURI());
        }
        return (PipelineContext) context;
    }

    public void advance(RequestStage next) {
        if (!stage.canAdvanceTo(next)) {
            throw new IllegalStateException("Illegal pipeline transition " + stage + " -> " + next);
        }
        log.trace("Request {} {} -> {}", requestId, stage, next);
        stage = next;
        history.add(next);
    }

    /**
     * Advance unless the request already responded through a short-circuit.
     */
    public void finish() {
        if (stage != RequestStage.RESPONDED) {
            advance(RequestStage.RESPONDED);
        }
    }

    public String getRequestId() {
        return requestId;
    }

    public RoutePolicy getRoute() {
        return route;
    }

    public RequestStage getStage() {
        return stage;
    }

    public List<RequestStage> getHistory() {
        return Collections.unmodifiableList(history);
    }

    public Principal getPrincipal() {
        return principal;
    }

    void setPrincipal(Principal principal) {
        this.principal = principal;
    }
}
