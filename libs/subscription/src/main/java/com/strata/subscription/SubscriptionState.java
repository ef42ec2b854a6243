package com.strata.subscription;

/** Lifecycle of a {@link SubscribeToAllWorker}. */
public enum SubscriptionState {
    STARTING,
    SUBSCRIBED,
    DELIVERING,
    DROPPED,
    RESUBSCRIBING,
    TERMINATED
}
