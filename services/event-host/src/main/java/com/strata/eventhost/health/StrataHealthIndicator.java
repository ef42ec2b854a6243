package com.strata.eventhost.health;

import com.strata.observability.ComponentHealth;
import com.strata.observability.HealthCheckRegistry;
import com.strata.observability.HealthResult;
import com.strata.observability.HealthStatus;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.stereotype.Component;

/** Exposes the {@link HealthCheckRegistry} result as the actuator {@code strata} health component. */
@Component("strata")
public class StrataHealthIndicator implements HealthIndicator {

    static final Status DEGRADED = new Status("DEGRADED");

    private final HealthCheckRegistry registry;

    public StrataHealthIndicator(HealthCheckRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Health health() {
        HealthResult result = registry.checkAll();
        Map<String, Object> components = new LinkedHashMap<>();
        result.checks().forEach((name, check) -> components.put(name, describe(check)));
        return Health.status(toStatus(result.status()))
                .withDetails(components)
                .build();
    }

    static Status toStatus(HealthStatus status) {
        return switch (status) {
            case HEALTHY -> Status.UP;
            case DEGRADED -> DEGRADED;
            case UNHEALTHY -> Status.DOWN;
        };
    }

    private static Map<String, Object> describe(ComponentHealth check) {
        Map<String, Object> description = new LinkedHashMap<>();
        description.put("status", check.status().name());
        if (check.message() != null) {
            description.put("message", check.message());
        }
        description.put("latencyMs", check.latencyMs());
        description.putAll(check.details());
        return description;
    }
}
