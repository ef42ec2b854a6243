package com.strata.eventmodel;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;

/**
 * Metadata stored next to every event payload.
 *
 * <p>Positions are 0-based. {@code streamPosition} is known once the event is stamped for a
 * specific stream version; {@code logPosition} is assigned by the store on append. Both are omitted
 * from the JSON form while unassigned.
 *
 * @param eventId unique event identifier
 * @param streamPosition position within the stream, or null while unassigned
 * @param logPosition position within the global log, or null while unassigned
 * @param aggregateId id of the aggregate that raised the event, if any
 * @param occurredAt when the envelope was created
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StreamEventMetadata(
        String eventId, Long streamPosition, Long logPosition, String aggregateId, Instant occurredAt) {

    public static StreamEventMetadata of(String eventId) {
        return new StreamEventMetadata(eventId, null, null, null, Instant.now());
    }

    public StreamEventMetadata withStreamPosition(long position) {
        return new StreamEventMetadata(eventId, position, logPosition, aggregateId, occurredAt);
    }

    public StreamEventMetadata withLogPosition(long position) {
        return new StreamEventMetadata(eventId, streamPosition, position, aggregateId, occurredAt);
    }

    public StreamEventMetadata withoutLogPosition() {
        return new StreamEventMetadata(eventId, streamPosition, null, aggregateId, occurredAt);
    }

    public StreamEventMetadata withAggregateId(String id) {
        return new StreamEventMetadata(eventId, streamPosition, logPosition, id, occurredAt);
    }
}
