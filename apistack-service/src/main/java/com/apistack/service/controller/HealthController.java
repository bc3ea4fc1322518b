package com.apistack.service.controller;

import com.apistack.persistence.DataAccessGateway;
import com.apistack.service.ratelimit.CounterStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness and readiness endpoints for the orchestrator.
 */
@Slf4j
@RestController
@RequestMapping("/health")
@RequiredArgsConstructor
public class HealthController {

    private final DataAccessGateway dataAccessGateway;
    private final CounterStore counterStore;

    @GetMapping
    public Map<String, Object> health() {
        return Map.of("status", "UP");
    }

    @GetMapping("/ready")
    public ResponseEntity<Map<String, Object>> ready() {
        boolean database = dataAccessGateway.ping();
        boolean store = counterStore.ping();

        Map<String, Object> components = new LinkedHashMap<>();
        components.put("database", status(database));
        components.put("engine", dataAccessGateway.engine().name().toLowerCase());
        components.put("counterStore", status(store));

        boolean ready = database && store;
        if (!ready) {
            log.warn("Readiness check failed: {}", components);
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status(ready));
        body.put("components", components);
        return ResponseEntity.status(ready ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    private static String status(boolean up) {
        return up ? "UP" : "DOWN";
    }
}
