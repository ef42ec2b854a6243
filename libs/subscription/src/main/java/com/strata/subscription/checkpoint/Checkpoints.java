package com.strata.subscription.checkpoint;

final class Checkpoints {

    private Checkpoints() {}

    static String requireId(String subscriptionId) {
        if (subscriptionId == null || subscriptionId.isBlank()) {
            throw new IllegalArgumentException("subscriptionId must not be null or blank");
        }
        return subscriptionId;
    }

    static long requirePosition(long position) {
        if (position < 0) {
            throw new IllegalArgumentException("Checkpoint position must be >= 0, got " + position);
        }
        return position;
    }
}
