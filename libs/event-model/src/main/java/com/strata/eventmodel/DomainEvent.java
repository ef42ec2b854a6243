package com.strata.eventmodel;

/**
 * A fact raised by an aggregate.
 *
 * <p>Implementations are immutable records. The event id is assigned when the event is raised and
 * stays with it through the log, so it can be used to de-duplicate.
 */
public interface DomainEvent {

    /** Globally unique identifier of this event instance. */
    String eventId();
}
