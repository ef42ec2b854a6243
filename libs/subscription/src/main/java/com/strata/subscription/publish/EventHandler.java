package com.strata.subscription.publish;

import com.strata.eventmodel.StreamEventEnvelope;

/** Handles one event type delivered by an {@link InternalEventBus}. */
@FunctionalInterface
public interface EventHandler<T> {

    void handle(StreamEventEnvelope<T> envelope) throws Exception;
}
