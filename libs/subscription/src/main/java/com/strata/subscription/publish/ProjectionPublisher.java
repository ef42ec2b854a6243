package com.strata.subscription.publish;

import com.strata.eventmodel.StreamEventEnvelope;
import java.util.List;

/** Runs each projection in order; the first failure propagates. */
public final class ProjectionPublisher implements ReadProjectionPublisher {

    private final List<ReadProjection> projections;

    public ProjectionPublisher(List<? extends ReadProjection> projections) {
        if (projections == null) {
            throw new IllegalArgumentException("projections must not be null");
        }
        this.projections = List.copyOf(projections);
    }

    public static ProjectionPublisher empty() {
        return new ProjectionPublisher(List.of());
    }

    @Override
    public void publish(StreamEventEnvelope<?> envelope) throws Exception {
        for (ReadProjection projection : projections) {
            projection.project(envelope);
        }
    }

    public int size() {
        return projections.size();
    }
}
