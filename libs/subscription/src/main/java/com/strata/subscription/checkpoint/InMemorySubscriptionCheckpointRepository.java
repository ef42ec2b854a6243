package com.strata.subscription.checkpoint;

import java.util.Map;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;

/** Process-local checkpoints; lost on restart. */
public final class InMemorySubscriptionCheckpointRepository implements SubscriptionCheckpointRepository {

    private final Map<String, Long> checkpoints = new ConcurrentHashMap<>();

    @Override
    public OptionalLong load(String subscriptionId) {
        Long position = checkpoints.get(Checkpoints.requireId(subscriptionId));
        return position == null ? OptionalLong.empty() : OptionalLong.of(position);
    }

    @Override
    public void store(String subscriptionId, long position) {
        checkpoints.put(Checkpoints.requireId(subscriptionId), Checkpoints.requirePosition(position));
    }
}
