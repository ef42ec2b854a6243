package com.strata.subscription.publish;

import com.strata.eventmodel.StreamEventEnvelope;

/** Fans a decoded event out to the registered read projections. */
public interface ReadProjectionPublisher {

    void publish(StreamEventEnvelope<?> envelope) throws Exception;
}
