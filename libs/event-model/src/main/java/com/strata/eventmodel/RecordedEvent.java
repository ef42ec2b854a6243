package com.strata.eventmodel;

import java.time.Instant;

/**
 * An event as it is held by the log: encoded payload and metadata plus the positions assigned on
 * append.
 *
 * @param streamId stream the event belongs to
 * @param eventId unique event identifier
 * @param eventType registered type tag
 * @param contentType encoding of {@code data}
 * @param data encoded payload, possibly empty
 * @param metadata encoded {@link StreamEventMetadata}
 * @param streamPosition 0-based position within the stream
 * @param globalPosition 0-based position within the global log
 * @param createdAt when the store accepted the event
 */
public record RecordedEvent(
        String streamId,
        String eventId,
        String eventType,
        String contentType,
        byte[] data,
        byte[] metadata,
        long streamPosition,
        long globalPosition,
        Instant createdAt) {

    /** Prefix of store-internal event types. */
    public static final String SYSTEM_EVENT_PREFIX = "$";

    public boolean hasEmptyPayload() {
        return data == null || data.length == 0;
    }

    public boolean isSystemEvent() {
        return eventType != null && eventType.startsWith(SYSTEM_EVENT_PREFIX);
    }
}
