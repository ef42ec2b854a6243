package com.strata.observability;

import java.time.Instant;
import java.util.Map;

/**
 * Aggregate health of every registered check.
 *
 * @param status worst status among the checks (HEALTHY when there are none)
 * @param checks individual results keyed by registration name
 * @param timestamp when the checks completed
 */
public record HealthResult(HealthStatus status, Map<String, ComponentHealth> checks, Instant timestamp) {

    public HealthResult {
        checks = Map.copyOf(checks);
    }
}
