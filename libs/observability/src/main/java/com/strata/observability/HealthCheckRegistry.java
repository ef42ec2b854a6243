package com.strata.observability;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Named collection of {@link HealthCheck}s that are checked together.
 *
 * <p>All checks start at once; each one is awaited with the configured timeout. A check that times
 * out or completes exceptionally is reported as {@link HealthStatus#UNHEALTHY}.
 */
public final class HealthCheckRegistry {

    /** Default per-check timeout in milliseconds. */
    public static final long DEFAULT_TIMEOUT_MS = 5000;

    private final Map<String, HealthCheck> checks = new ConcurrentHashMap<>();
    private final long timeoutMs;

    public HealthCheckRegistry() {
        this(DEFAULT_TIMEOUT_MS);
    }

    /**
     * @param timeoutMs timeout applied to each individual check, must be positive
     */
    public HealthCheckRegistry(long timeoutMs) {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive");
        }
        this.timeoutMs = timeoutMs;
    }

    /**
     * Registers a check, replacing any previous check with the same name.
     */
    public void register(String name, HealthCheck check) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (check == null) {
            throw new IllegalArgumentException("check must not be null");
        }
        checks.put(name, check);
    }

    /**
     * @return true if a check was registered under the name
     */
    public boolean deregister(String name) {
        return checks.remove(name) != null;
    }

    /**
     * Runs every registered check and folds the individual statuses into the worst one.
     */
    public HealthResult checkAll() {
        Map<String, CompletableFuture<ComponentHealth>> pending = new LinkedHashMap<>();
        checks.forEach((name, check) -> pending.put(name, start(name, check)));

        Map<String, ComponentHealth> results = new LinkedHashMap<>();
        HealthStatus overall = HealthStatus.HEALTHY;
        for (Map.Entry<String, CompletableFuture<ComponentHealth>> entry : pending.entrySet()) {
            ComponentHealth health = await(entry.getKey(), entry.getValue());
            results.put(entry.getKey(), health);
            overall = overall.worse(health.status());
        }
        return new HealthResult(overall, results, Instant.now());
    }

    public int size() {
        return checks.size();
    }

    public long timeoutMs() {
        return timeoutMs;
    }

    private static CompletableFuture<ComponentHealth> start(String name, HealthCheck check) {
        try {
            return check.check();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private ComponentHealth await(String name, CompletableFuture<ComponentHealth> future) {
        try {
            return future.orTimeout(timeoutMs, TimeUnit.MILLISECONDS).join();
        } catch (RuntimeException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return ComponentHealth.unhealthy(name, "Timeout or error: " + cause, timeoutMs);
        }
    }
}
