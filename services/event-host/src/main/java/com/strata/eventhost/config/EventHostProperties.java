package com.strata.eventhost.config;

import com.strata.eventstore.subscription.PollingOptions;
import com.strata.subscription.Backoff;
import com.strata.subscription.RetryPolicy;
import com.strata.subscription.SubscriptionOptions;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Event host settings, bound from {@code strata.event-store.*}:
 *
 * <pre>
 * strata:
 *   event-store:
 *     service-name: orders-host
 *     migrate-on-startup: true
 *     read-page-size: 500
 *     subscription:
 *       enabled: true
 *       id: orders-read-model
 *       batch-size: 500
 *       idle-interval: 100ms
 *       retry-attempts: 3
 *       resubscribe-delay: 1s
 *       resubscribe-jitter: 1s
 *       max-lag: 10000
 * </pre>
 *
 * @param serviceName value of the {@code service} tag on every meter
 * @param migrateOnStartup apply the event store schema before the store is used (default true)
 * @param readPageSize rows fetched per query when reading streams and the global log
 * @param subscription catch-up subscription settings
 */
@ConfigurationProperties(prefix = "strata.event-store")
@Validated
public record EventHostProperties(
        @NotBlank String serviceName,
        Boolean migrateOnStartup,
        int readPageSize,
        @Valid Subscription subscription) {

    public static final int DEFAULT_READ_PAGE_SIZE = 500;

    /** Defaults run before Bean Validation, so they satisfy the constraints. */
    public EventHostProperties {
        if (migrateOnStartup == null) {
            migrateOnStartup = Boolean.TRUE;
        }
        if (readPageSize <= 0) {
            readPageSize = DEFAULT_READ_PAGE_SIZE;
        }
        if (subscription == null) {
            subscription = new Subscription(null, null, 0, null, 0, null, null, 0);
        }
    }

    /**
     * @param enabled run the subscription worker (default true)
     * @param id checkpoint key (default {@code default})
     * @param batchSize events read per poll
     * @param idleInterval pause between polls once caught up
     * @param retryAttempts delivery attempts per handler stage, including the first
     * @param resubscribeDelay fixed part of the resubscribe backoff
     * @param resubscribeJitter upper bound of the random part of the resubscribe backoff
     * @param maxLag positions behind the log head before the worker reports unhealthy
     */
    public record Subscription(
            Boolean enabled,
            String id,
            int batchSize,
            Duration idleInterval,
            int retryAttempts,
            Duration resubscribeDelay,
            Duration resubscribeJitter,
            long maxLag) {

        public Subscription {
            if (enabled == null) {
                enabled = Boolean.TRUE;
            }
            if (id == null || id.isBlank()) {
                id = SubscriptionOptions.DEFAULT_SUBSCRIPTION_ID;
            }
            if (batchSize <= 0) {
                batchSize = PollingOptions.DEFAULT_BATCH_SIZE;
            }
            if (idleInterval == null || idleInterval.isNegative() || idleInterval.isZero()) {
                idleInterval = PollingOptions.DEFAULT_IDLE_INTERVAL;
            }
            if (retryAttempts <= 0) {
                retryAttempts = RetryPolicy.DEFAULT_MAX_ATTEMPTS;
            }
            if (resubscribeDelay == null || resubscribeDelay.isNegative()) {
                resubscribeDelay = Backoff.DEFAULT_BASE;
            }
            if (resubscribeJitter == null || resubscribeJitter.isNegative()) {
                resubscribeJitter = Backoff.DEFAULT_JITTER;
            }
            if (maxLag <= 0) {
                maxLag = SubscriptionOptions.DEFAULT_MAX_LAG;
            }
        }

        public SubscriptionOptions toOptions() {
            return new SubscriptionOptions(
                    id,
                    new PollingOptions(batchSize, idleInterval),
                    new RetryPolicy(retryAttempts, Backoff.none()),
                    Backoff.jittered(resubscribeDelay, resubscribeJitter),
                    maxLag);
        }
    }
}
