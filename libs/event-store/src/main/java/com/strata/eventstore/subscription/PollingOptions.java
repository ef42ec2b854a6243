package com.strata.eventstore.subscription;

import java.time.Duration;

/**
 * How a live subscription polls the global log.
 *
 * @param batchSize maximum number of events read per poll
 * @param idleInterval pause after a poll that found nothing new
 */
public record PollingOptions(int batchSize, Duration idleInterval) {

    public static final int DEFAULT_BATCH_SIZE = 500;
    public static final Duration DEFAULT_IDLE_INTERVAL = Duration.ofMillis(100);

    public PollingOptions {
        if (batchSize <= 0) {
            batchSize = DEFAULT_BATCH_SIZE;
        }
        if (idleInterval == null || idleInterval.isNegative() || idleInterval.isZero()) {
            idleInterval = DEFAULT_IDLE_INTERVAL;
        }
    }

    public static PollingOptions defaults() {
        return new PollingOptions(DEFAULT_BATCH_SIZE, DEFAULT_IDLE_INTERVAL);
    }
}
