package com.strata.eventmodel;

import java.util.UUID;

/**
 * A payload together with its {@link StreamEventMetadata}; the unit that is appended to and read
 * from an event stream.
 *
 * <p>Envelopes are immutable. The store returns copies whose metadata carries the assigned stream
 * and log positions.
 *
 * @param <T> payload type
 */
public record StreamEventEnvelope<T>(T payload, StreamEventMetadata metadata) {

    /**
     * Wraps a payload. A {@link DomainEvent} keeps its own event id, any other payload gets a random
     * UUID.
     */
    public static <T> StreamEventEnvelope<T> of(T payload) {
        String eventId = payload instanceof DomainEvent
                ? ((DomainEvent) payload).eventId()
                : UUID.randomUUID().toString();
        return new StreamEventEnvelope<>(payload, StreamEventMetadata.of(eventId));
    }

    /**
     * Wraps a domain event stamped for an aggregate stream.
     *
     * @param event the event
     * @param streamPosition sequence number of the event within the aggregate stream
     * @param aggregateId aggregate identifier in string form
     */
    public static <E extends DomainEvent> StreamEventEnvelope<E> forDomainEvent(
            E event, long streamPosition, String aggregateId) {
        StreamEventMetadata metadata = StreamEventMetadata.of(event.eventId())
                .withStreamPosition(streamPosition)
                .withAggregateId(aggregateId);
        return new StreamEventEnvelope<>(event, metadata);
    }

    public String eventId() {
        return metadata.eventId();
    }

    public StreamEventEnvelope<T> withMetadata(StreamEventMetadata newMetadata) {
        return new StreamEventEnvelope<>(payload, newMetadata);
    }
}
