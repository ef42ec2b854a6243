package com.strata.observability;

import java.util.Map;

/**
 * Health result for a single component.
 *
 * @param name component name (e.g. "event-store", "subscription:orders")
 * @param status health status of this component
 * @param message optional human-readable message
 * @param latencyMs time taken to check the component, in milliseconds
 * @param details component-specific values (positions, states), never null
 */
public record ComponentHealth(
        String name, HealthStatus status, String message, long latencyMs, Map<String, Object> details) {

    public ComponentHealth {
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    public ComponentHealth(String name, HealthStatus status, String message, long latencyMs) {
        this(name, status, message, latencyMs, Map.of());
    }

    /** Creates a healthy component result. */
    public static ComponentHealth healthy(String name, long latencyMs) {
        return new ComponentHealth(name, HealthStatus.HEALTHY, null, latencyMs);
    }

    /** Creates a degraded component result. */
    public static ComponentHealth degraded(String name, String message, long latencyMs) {
        return new ComponentHealth(name, HealthStatus.DEGRADED, message, latencyMs);
    }

    /** Creates an unhealthy component result. */
    public static ComponentHealth unhealthy(String name, String message, long latencyMs) {
        return new ComponentHealth(name, HealthStatus.UNHEALTHY, message, latencyMs);
    }

    /** Returns a copy of this result carrying the given details. */
    public ComponentHealth withDetails(Map<String, Object> details) {
        return new ComponentHealth(name, status, message, latencyMs, details);
    }
}
