package com.strata.observability;

import java.util.concurrent.CompletableFuture;

/**
 * Checks one component: the event store connection, a running subscription, etc.
 *
 * <p>Checks must be cheap. They are run concurrently by {@link HealthCheckRegistry}, which applies
 * a timeout to each of them.
 */
@FunctionalInterface
public interface HealthCheck {

    /**
     * Checks the component.
     *
     * @return a future that completes with the component health
     */
    CompletableFuture<ComponentHealth> check();
}
