package com.strata.eventstore.aggregate;

import com.strata.eventstore.AppendResult;
import com.strata.eventstore.ExpectedStreamVersion;
import java.util.Optional;

/**
 * Loads and stores event-sourced aggregates.
 */
public interface AggregateStore {

    /**
     * Replays the aggregate's stream from the start.
     *
     * @return the aggregate, empty when its stream has no events
     * @throws IllegalArgumentException if the id is null or blank
     */
    <A extends EventSourcedAggregate<?, ?>> Optional<A> get(Class<A> type, Object aggregateId);

    /**
     * Appends the aggregate's uncommitted events, expecting the stream to be at the aggregate's
     * original version.
     */
    <A extends EventSourcedAggregate<?, ?>> AppendResult store(A aggregate);

    /**
     * Appends the aggregate's uncommitted events under an explicit expected version.
     *
     * @throws com.strata.eventstore.WrongExpectedVersionException on a version conflict; the
     *     aggregate keeps its events and must be reloaded before it can be stored again
     * @throws IllegalStateException if the aggregate lost an earlier version race
     */
    <A extends EventSourcedAggregate<?, ?>> AppendResult store(A aggregate, ExpectedStreamVersion expected);

    <A extends EventSourcedAggregate<?, ?>> boolean exists(Class<A> type, Object aggregateId);
}
