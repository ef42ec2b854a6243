package com.strata.subscription.checkpoint;

import java.util.OptionalLong;

/**
 * Durable mapping from a subscription id to the last global position it fully processed.
 *
 * <p>Calls for different subscription ids may run concurrently. Calls for one id are sequential.
 */
public interface SubscriptionCheckpointRepository {

    /**
     * @return the last stored position, empty when the subscription never stored one
     */
    OptionalLong load(String subscriptionId);

    /**
     * Records a new checkpoint.
     *
     * @throws IllegalArgumentException if the id is blank or the position negative
     */
    void store(String subscriptionId, long position);
}
