package com.strata.eventhost.lifecycle;

import com.strata.eventstore.GlobalLogReader;
import com.strata.observability.HealthCheckRegistry;
import com.strata.subscription.SubscribeToAllWorker;
import com.strata.subscription.SubscriptionHealthCheck;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * Starts the subscription worker once the context is refreshed and stops it on shutdown, before
 * the data source closes. A worker cannot be restarted, so each start builds a new one.
 */
public class SubscriptionWorkerLifecycle implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionWorkerLifecycle.class);

    private final Supplier<SubscribeToAllWorker> workerFactory;
    private final GlobalLogReader reader;
    private final HealthCheckRegistry healthChecks;
    private volatile SubscribeToAllWorker worker;
    private volatile String healthCheckName;

    public SubscriptionWorkerLifecycle(
            Supplier<SubscribeToAllWorker> workerFactory, GlobalLogReader reader, HealthCheckRegistry healthChecks) {
        this.workerFactory = workerFactory;
        this.reader = reader;
        this.healthChecks = healthChecks;
    }

    @Override
    public synchronized void start() {
        if (worker != null) {
            return;
        }
        SubscribeToAllWorker created = workerFactory.get();
        SubscriptionHealthCheck healthCheck = new SubscriptionHealthCheck(created, reader);
        healthChecks.register(healthCheck.name(), healthCheck);
        created.start();
        healthCheckName = healthCheck.name();
        worker = created;
        log.info("Subscription worker {} scheduled", created.subscriptionId());
    }

    @Override
    public synchronized void stop() {
        SubscribeToAllWorker current = worker;
        if (current == null) {
            return;
        }
        current.stop();
        healthChecks.deregister(healthCheckName);
        worker = null;
    }

    @Override
    public boolean isRunning() {
        return worker != null;
    }

    /** The running worker, or null when stopped. */
    public SubscribeToAllWorker worker() {
        return worker;
    }
}
