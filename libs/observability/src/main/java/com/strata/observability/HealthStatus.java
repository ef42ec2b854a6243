package com.strata.observability;

/**
 * Health status for an individual component or the aggregate system.
 *
 * <p>Constants are declared from best to worst so that {@link #worse(HealthStatus)} can compare
 * ordinals.
 */
public enum HealthStatus {

    /** The component is working normally. */
    HEALTHY,

    /** The component is impaired but still making progress (e.g. a subscription resubscribing). */
    DEGRADED,

    /** The component is down or has stopped making progress. */
    UNHEALTHY;

    /** Returns whichever of the two statuses is worse. */
    public HealthStatus worse(HealthStatus other) {
        return other != null && other.ordinal() > ordinal() ? other : this;
    }
}
