package com.strata.subscription;

import io.github.resilience4j.core.IntervalFunction;
import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/** Delay before a retry. {@code attempt} is 1 for the first retry. */
@FunctionalInterface
public interface Backoff {

    Duration DEFAULT_BASE = Duration.ofMillis(1000);
    Duration DEFAULT_JITTER = Duration.ofMillis(1000);

    Duration nextDelay(int attempt);

    /** Adapts this backoff to the wait function of a resilience4j retry. */
    default IntervalFunction toIntervalFunction() {
        return attempt -> nextDelay(attempt).toMillis();
    }

    static Backoff none() {
        return attempt -> Duration.ZERO;
    }

    static Backoff fixed(Duration delay) {
        if (delay == null || delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }
        return attempt -> delay;
    }

    /** {@code base} plus a uniformly random amount in {@code [0, maxJitter)}. */
    static Backoff jittered(Duration base, Duration maxJitter) {
        if (base == null || base.isNegative() || maxJitter == null || maxJitter.isNegative()) {
            throw new IllegalArgumentException("base and maxJitter must be >= 0");
        }
        long jitterMillis = maxJitter.toMillis();
        return attempt -> jitterMillis == 0
                ? base
                : base.plusMillis(ThreadLocalRandom.current().nextLong(jitterMillis));
    }

    /** One second plus up to one second of jitter. */
    static Backoff defaultResubscribe() {
        return jittered(DEFAULT_BASE, DEFAULT_JITTER);
    }
}
