package com.strata.subscription.publish;

import com.strata.eventmodel.StreamEventEnvelope;

/**
 * A read model fed by the subscription. Receives every decoded event; ignores the ones it does not
 * project. Projections must tolerate redelivery, since delivery is at-least-once.
 */
@FunctionalInterface
public interface ReadProjection {

    void project(StreamEventEnvelope<?> envelope) throws Exception;
}
