package com.strata.subscription.publish;

import com.strata.eventmodel.StreamEventEnvelope;

/**
 * In-process fan-out of decoded events to handlers registered by payload type.
 *
 * <p>A handler registered for a type receives events whose payload is that type or a subtype.
 */
public interface InternalEventBus {

    <T> void subscribe(Class<T> payloadType, EventHandler<T> handler);

    /**
     * Delivers the envelope to every matching handler, sequentially in registration order. The
     * first handler failure stops delivery and propagates.
     */
    void publish(StreamEventEnvelope<?> envelope) throws Exception;
}
