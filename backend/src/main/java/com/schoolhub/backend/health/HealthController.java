package com.schoolhub.backend.health;

import java.time.Clock;
import java.time.Instant;

import org.springframework.boot.actuate.health.CompositeHealth;
import org.springframework.boot.actuate.health.HealthComponent;
import org.springframework.boot.actuate.health.HealthEndpoint;
import org.springframework.boot.actuate.health.Status;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Probe endpoints for the load balancer and the container runtime.
 */
@RestController
public class HealthController {

    private final HealthEndpoint healthEndpoint;
    private final Clock clock;

    public HealthController(HealthEndpoint healthEndpoint, Clock clock) {
        this.healthEndpoint = healthEndpoint;
        this.clock = clock;
    }

    /**
     * Liveness: the process is up and serving requests.
     */
    @GetMapping({"/health", "/healthz"})
    public HealthResponse healthz() {
        return respond(Status.UP.getCode());
    }

    /**
     * Readiness: reflects the database health contributor when present.
     */
    @GetMapping("/readyz")
    public HealthResponse readyz() {
        try {
            HealthComponent root = healthEndpoint.health();
            HealthComponent db = root instanceof CompositeHealth composite
                    ? composite.getComponents().get("db")
                    : null;
            return respond((db != null ? db : root).getStatus().getCode());
        } catch (RuntimeException ex) {
            return respond(Status.DOWN.getCode());
        }
    }

    private HealthResponse respond(String status) {
        return new HealthResponse(status, Instant.now(clock).toString());
    }

    public record HealthResponse(
            String status,
            String timestamp
    ) {
    }
}
