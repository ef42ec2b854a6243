package com.strata.eventstore.subscription;

/** Why a live subscription stopped. */
public enum SubscriptionDroppedReason {

    /** Stopped on request. Not an error; the subscription must not be restarted. */
    DISPOSED,

    /** Reading the log failed. */
    SERVER_ERROR,

    /** The event handler threw. */
    SUBSCRIBER_ERROR
}
