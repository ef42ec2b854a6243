package com.strata.eventstore.aggregate;

import com.strata.eventmodel.DomainEvent;
import com.strata.eventmodel.StreamEventEnvelope;
import com.strata.eventstore.AppendResult;
import com.strata.eventstore.EventStore;
import com.strata.eventstore.ExpectedStreamVersion;
import com.strata.eventstore.StreamName;
import com.strata.eventstore.WrongExpectedVersionException;
import com.strata.observability.MetricFactory;
import io.micrometer.core.instrument.Counter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link AggregateStore} on top of an {@link EventStore}.
 *
 * <p>Storing stamps each queued event with the aggregate id and a sequence number continuing from
 * the aggregate's original version, appends the batch under the expected version and, on success,
 * hands the committed envelopes to the {@link DomainEventsBuffer} of the caller. Conflicts are never
 * retried here.
 *
 * <p>The buffer is either fixed at construction or, for {@link #scoped}, looked up per store in the
 * {@link DomainEventsScope} open on the storing thread.
 */
public final class EventSourcedAggregateStore implements AggregateStore {

    private static final Logger log = LoggerFactory.getLogger(EventSourcedAggregateStore.class);

    private final EventStore eventStore;
    private final AggregateFactory factory;
    private final Supplier<Optional<DomainEventsBuffer>> eventsBuffer;
    private final Counter loaded;
    private final Counter appended;
    private final Counter conflicts;

    public EventSourcedAggregateStore(EventStore eventStore, AggregateFactory factory, DomainEventsBuffer eventsBuffer) {
        this(eventStore, factory, eventsBuffer, MetricFactory.detached("strata"));
    }

    public EventSourcedAggregateStore(
            EventStore eventStore, AggregateFactory factory, DomainEventsBuffer eventsBuffer, MetricFactory metrics) {
        this(eventStore, factory, fixed(eventsBuffer), metrics);
    }

    private EventSourcedAggregateStore(
            EventStore eventStore,
            AggregateFactory factory,
            Supplier<Optional<DomainEventsBuffer>> eventsBuffer,
            MetricFactory metrics) {
        if (eventStore == null || factory == null || metrics == null) {
            throw new IllegalArgumentException("eventStore, factory and metrics must not be null");
        }
        this.eventStore = eventStore;
        this.factory = factory;
        this.eventsBuffer = eventsBuffer;
        this.loaded = metrics.counter("strata.aggregates.loaded", "Aggregates rebuilt from their stream");
        this.appended = metrics.counter(
                "strata.aggregates.appends", "Aggregate store attempts", "outcome", "success");
        this.conflicts = metrics.counter(
                "strata.aggregates.appends", "Aggregate store attempts", "outcome", "conflict");
    }

    /** Buffers committed events in the unit of work open on the storing thread, if there is one. */
    public static EventSourcedAggregateStore scoped(EventStore eventStore, AggregateFactory factory, MetricFactory metrics) {
        return new EventSourcedAggregateStore(eventStore, factory, DomainEventsScope::current, metrics);
    }

    private static Supplier<Optional<DomainEventsBuffer>> fixed(DomainEventsBuffer buffer) {
        if (buffer == null) {
            throw new IllegalArgumentException("eventsBuffer must not be null");
        }
        Optional<DomainEventsBuffer> always = Optional.of(buffer);
        return () -> always;
    }

    @Override
    public <A extends EventSourcedAggregate<?, ?>> Optional<A> get(Class<A> type, Object aggregateId) {
        String streamId = StreamName.forAggregate(type, aggregateId).value();
        A seed = factory.create(type);
        Optional<A> aggregate = eventStore.aggregateStream(streamId, seed, (state, payload) -> {
            state.fold(payload);
            return state;
        });
        aggregate.ifPresent(a -> {
            loaded.increment();
            log.debug("Loaded {} at version {}", streamId, a.originalVersion());
        });
        return aggregate;
    }

    @Override
    public <A extends EventSourcedAggregate<?, ?>> AppendResult store(A aggregate) {
        if (aggregate == null) {
            throw new IllegalArgumentException("aggregate must not be null");
        }
        return store(aggregate, ExpectedStreamVersion.of(aggregate.originalVersion()));
    }

    @Override
    public <A extends EventSourcedAggregate<?, ?>> AppendResult store(A aggregate, ExpectedStreamVersion expected) {
        if (aggregate == null || expected == null) {
            throw new IllegalArgumentException("aggregate and expected version must not be null");
        }
        if (aggregate.isStale()) {
            throw new IllegalStateException("Aggregate " + aggregate.getClass().getSimpleName() + "-"
                    + aggregate.id() + " lost a version race and must be reloaded before it is stored again");
        }
        String aggregateId = StreamName.requireId(aggregate.id());
        String streamId = StreamName.forAggregate(aggregate.getClass(), aggregateId).value();

        List<? extends DomainEvent> pending = aggregate.getUncommittedEvents();
        if (pending.isEmpty()) {
            log.debug("Nothing to store for {}", streamId);
            return AppendResult.unchanged(aggregate.originalVersion());
        }

        List<StreamEventEnvelope<?>> envelopes = new ArrayList<>(pending.size());
        for (int i = 0; i < pending.size(); i++) {
            long sequence = aggregate.originalVersion() + i + 1;
            envelopes.add(StreamEventEnvelope.forDomainEvent(pending.get(i), sequence, aggregateId));
        }

        AppendResult result;
        try {
            result = eventStore.appendEvents(streamId, envelopes, expected);
        } catch (WrongExpectedVersionException e) {
            aggregate.markStale();
            conflicts.increment();
            log.warn("Concurrency conflict storing {}: expected {}, actual {}",
                    streamId, e.expectedVersion(), e.actualVersion());
            throw e;
        }

        aggregate.dequeueUncommittedEvents();
        aggregate.markCommitted(result.nextExpectedVersion());
        eventsBuffer.get().ifPresentOrElse(
                buffer -> buffer.addAll(committed(envelopes, result)),
                () -> log.debug("No unit of work open, committed events of {} are not buffered", streamId));
        appended.increment();
        log.debug("Stored {} event(s) on {}, next expected version {}",
                envelopes.size(), streamId, result.nextExpectedVersion());

        eventStore.commit();
        return result;
    }

    @Override
    public <A extends EventSourcedAggregate<?, ?>> boolean exists(Class<A> type, Object aggregateId) {
        return eventStore.streamExists(StreamName.forAggregate(type, aggregateId).value());
    }

    /** Re-stamps the envelopes with the positions the store assigned; both are contiguous per batch. */
    private static List<StreamEventEnvelope<?>> committed(List<StreamEventEnvelope<?>> envelopes, AppendResult result) {
        int size = envelopes.size();
        long firstStreamPosition = result.nextExpectedVersion() - size + 1;
        long firstLogPosition = result.globalPosition() - size + 1;
        List<StreamEventEnvelope<?>> committed = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            StreamEventEnvelope<?> envelope = envelopes.get(i);
            committed.add(envelope.withMetadata(envelope.metadata()
                    .withStreamPosition(firstStreamPosition + i)
                    .withLogPosition(firstLogPosition + i)));
        }
        return committed;
    }
}
