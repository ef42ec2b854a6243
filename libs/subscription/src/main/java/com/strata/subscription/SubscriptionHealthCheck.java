package com.strata.subscription;

import com.strata.eventstore.GlobalLogReader;
import com.strata.observability.ComponentHealth;
import com.strata.observability.HealthCheck;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Reports a worker's state: healthy while subscribed and within {@link SubscriptionOptions#maxLag()}
 * of the log head, degraded while (re)subscribing, unhealthy when terminated or lagging.
 */
public final class SubscriptionHealthCheck implements HealthCheck {

    private final SubscribeToAllWorker worker;
    private final GlobalLogReader reader;

    public SubscriptionHealthCheck(SubscribeToAllWorker worker, GlobalLogReader reader) {
        if (worker == null || reader == null) {
            throw new IllegalArgumentException("worker and reader must not be null");
        }
        this.worker = worker;
        this.reader = reader;
    }

    public String name() {
        return "subscription:" + worker.subscriptionId();
    }

    @Override
    public CompletableFuture<ComponentHealth> check() {
        return CompletableFuture.supplyAsync(this::evaluate);
    }

    private ComponentHealth evaluate() {
        long start = System.nanoTime();
        SubscriptionState state = worker.state();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("state", state.name());
        details.put("checkpoint", worker.lastCheckpoint());
        details.put("processedPosition", worker.processedPosition());

        ComponentHealth health = switch (state) {
            case SUBSCRIBED, DELIVERING -> {
                long head = reader.lastGlobalPosition();
                long lag = Math.max(0, head - worker.processedPosition());
                details.put("head", head);
                details.put("lag", lag);
                yield lag > worker.options().maxLag()
                        ? ComponentHealth.unhealthy(name(), "Lagging " + lag + " positions behind the log head", elapsed(start))
                        : ComponentHealth.healthy(name(), elapsed(start));
            }
            case STARTING, DROPPED, RESUBSCRIBING ->
                    ComponentHealth.degraded(name(), "Subscription is " + state.name().toLowerCase(), elapsed(start));
            case TERMINATED -> ComponentHealth.unhealthy(name(), "Subscription terminated", elapsed(start));
        };
        return health.withDetails(details);
    }

    private static long elapsed(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
