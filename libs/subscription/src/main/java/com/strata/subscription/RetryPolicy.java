package com.strata.subscription;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Retries a delivery step a bounded number of times.
 *
 * <p>A value object carried by {@link SubscriptionOptions}; {@link #newRetry(RetryRegistry, String)}
 * turns it into a resilience4j {@link Retry}. Only {@link Exception}s are retried, never an
 * {@link InterruptedException}.
 *
 * @param maxAttempts total attempts including the first; 1 disables retries
 * @param backoff delay between attempts
 */
public record RetryPolicy(int maxAttempts, Backoff backoff) {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    /** First try plus two retries. */
    public static final int DEFAULT_MAX_ATTEMPTS = 3;

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        if (backoff == null) {
            backoff = Backoff.none();
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_MAX_ATTEMPTS, Backoff.none());
    }

    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Backoff.none());
    }

    public RetryConfig toRetryConfig() {
        return RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(backoff.toIntervalFunction())
                .retryExceptions(Exception.class)
                .ignoreExceptions(InterruptedException.class)
                .build();
    }

    /**
     * Creates a named {@link Retry} in {@code registry} that logs a warning before every retry.
     */
    public Retry newRetry(RetryRegistry registry, String name) {
        Retry retry = registry.retry(name, toRetryConfig());
        retry.getEventPublisher().onRetry(event -> log.warn("{} failed on attempt {}/{}, retrying in {} ms: {}",
                event.getName(), event.getNumberOfRetryAttempts(), maxAttempts,
                event.getWaitInterval().toMillis(), String.valueOf(event.getLastThrowable())));
        return retry;
    }
}
