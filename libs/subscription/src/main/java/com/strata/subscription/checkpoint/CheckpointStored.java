package com.strata.subscription.checkpoint;

import java.time.Instant;

/**
 * Marker appended to {@code checkpoint_{subscriptionId}} each time a subscription stores its
 * position. Register it in the event type registry under {@link #EVENT_TYPE}.
 */
public record CheckpointStored(String subscriptionId, long position, Instant checkpointedAt) {

    public static final String EVENT_TYPE = "CheckpointStored";
}
