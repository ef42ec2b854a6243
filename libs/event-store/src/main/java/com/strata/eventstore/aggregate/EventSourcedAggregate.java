package com.strata.eventstore.aggregate;

import com.strata.eventmodel.DomainEvent;
import com.strata.eventstore.ExpectedStreamVersion;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Base class for aggregates whose state is derived from their events.
 *
 * <p>Subclasses implement {@link #apply(DomainEvent)} as a switch over their sealed event hierarchy
 * and raise new events through {@link #raise(DomainEvent)}. Raised events stay queued, in order and
 * unique by event id, until an {@link AggregateStore} appends them.
 *
 * <p>{@link #originalVersion()} is the stream version the aggregate was loaded at. It is
 * {@link #NEW_AGGREGATE_VERSION} for an aggregate that was never stored and only moves on replay or
 * after a successful store.
 *
 * @param <TId> identifier type
 * @param <E> root of the aggregate's event hierarchy
 */
public abstract class EventSourcedAggregate<TId, E extends DomainEvent> {

    /** Original version of an aggregate that has no stream yet. */
    public static final long NEW_AGGREGATE_VERSION = ExpectedStreamVersion.NO_STREAM_VALUE;

    private final Class<E> eventType;
    private final Map<String, E> uncommitted = new LinkedHashMap<>();
    private TId id;
    private long originalVersion = NEW_AGGREGATE_VERSION;
    private boolean stale;

    protected EventSourcedAggregate(Class<E> eventType) {
        if (eventType == null) {
            throw new IllegalArgumentException("eventType must not be null");
        }
        this.eventType = eventType;
    }

    /** Applies one event to the in-memory state. Must not fail for an event that was already stored. */
    protected abstract void apply(E event);

    public TId id() {
        return id;
    }

    protected void assignId(TId id) {
        this.id = id;
    }

    public long originalVersion() {
        return originalVersion;
    }

    public long currentVersion() {
        return originalVersion + uncommitted.size();
    }

    /**
     * Applies the event and queues it for the next store. An event whose id is already queued is
     * ignored.
     */
    protected void raise(E event) {
        if (event == null) {
            throw new IllegalArgumentException("event must not be null");
        }
        if (uncommitted.containsKey(event.eventId())) {
            return;
        }
        apply(event);
        uncommitted.put(event.eventId(), event);
    }

    /** Queues an event without applying it; no-op when an event with the same id is queued. */
    public void addEvent(E event) {
        if (event == null) {
            throw new IllegalArgumentException("event must not be null");
        }
        uncommitted.putIfAbsent(event.eventId(), event);
    }

    public boolean hasUncommittedEvents() {
        return !uncommitted.isEmpty();
    }

    public List<E> getUncommittedEvents() {
        return List.copyOf(uncommitted.values());
    }

    public List<E> dequeueUncommittedEvents() {
        List<E> events = new ArrayList<>(uncommitted.values());
        uncommitted.clear();
        return List.copyOf(events);
    }

    public void clearEvents() {
        uncommitted.clear();
    }

    /**
     * Replays one stored payload.
     *
     * @throws IllegalArgumentException if the payload is not an event of this aggregate
     */
    public void fold(Object payload) {
        if (!eventType.isInstance(payload)) {
            throw new IllegalArgumentException(getClass().getSimpleName() + " cannot apply "
                    + (payload == null ? "null" : payload.getClass().getName()));
        }
        apply(eventType.cast(payload));
        originalVersion++;
    }

    public Class<E> eventType() {
        return eventType;
    }

    /** True after a store of this instance lost a version race; it must be reloaded. */
    public boolean isStale() {
        return stale;
    }

    void markCommitted(long version) {
        this.originalVersion = version;
        this.stale = false;
    }

    void markStale() {
        this.stale = true;
    }
}
