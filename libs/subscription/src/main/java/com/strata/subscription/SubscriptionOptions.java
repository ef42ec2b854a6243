package com.strata.subscription;

import com.strata.eventstore.subscription.PollingOptions;

/**
 * Settings for one {@link SubscribeToAllWorker}.
 *
 * @param subscriptionId checkpoint key, also used in thread names, metric tags and logs
 * @param polling batch size and idle interval of the underlying all-stream subscription
 * @param deliveryRetry retries applied separately to the event bus and the projection publisher
 * @param resubscribeBackoff delay between failed resubscribe attempts
 * @param maxLag log positions the worker may trail the head before it reports unhealthy
 */
public record SubscriptionOptions(
        String subscriptionId,
        PollingOptions polling,
        RetryPolicy deliveryRetry,
        Backoff resubscribeBackoff,
        long maxLag) {

    public static final String DEFAULT_SUBSCRIPTION_ID = "default";
    public static final long DEFAULT_MAX_LAG = 10_000;

    public SubscriptionOptions {
        if (subscriptionId == null || subscriptionId.isBlank()) {
            subscriptionId = DEFAULT_SUBSCRIPTION_ID;
        }
        if (polling == null) {
            polling = PollingOptions.defaults();
        }
        if (deliveryRetry == null) {
            deliveryRetry = RetryPolicy.defaults();
        }
        if (resubscribeBackoff == null) {
            resubscribeBackoff = Backoff.defaultResubscribe();
        }
        if (maxLag <= 0) {
            maxLag = DEFAULT_MAX_LAG;
        }
    }

    public static SubscriptionOptions defaults() {
        return named(DEFAULT_SUBSCRIPTION_ID);
    }

    public static SubscriptionOptions named(String subscriptionId) {
        return new SubscriptionOptions(subscriptionId, null, null, null, 0);
    }

    public SubscriptionOptions withPolling(PollingOptions polling) {
        return new SubscriptionOptions(subscriptionId, polling, deliveryRetry, resubscribeBackoff, maxLag);
    }

    public SubscriptionOptions withDeliveryRetry(RetryPolicy deliveryRetry) {
        return new SubscriptionOptions(subscriptionId, polling, deliveryRetry, resubscribeBackoff, maxLag);
    }

    public SubscriptionOptions withResubscribeBackoff(Backoff resubscribeBackoff) {
        return new SubscriptionOptions(subscriptionId, polling, deliveryRetry, resubscribeBackoff, maxLag);
    }

    public SubscriptionOptions withMaxLag(long maxLag) {
        return new SubscriptionOptions(subscriptionId, polling, deliveryRetry, resubscribeBackoff, maxLag);
    }
}
