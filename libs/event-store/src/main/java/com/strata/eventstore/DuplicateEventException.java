package com.strata.eventstore;

/** An append carried an event id that is already in the log, or twice in the same batch. */
public class DuplicateEventException extends RuntimeException {

    private final String streamId;
    private final String eventId;

    public DuplicateEventException(String streamId, String eventId) {
        this(streamId, eventId, null);
    }

    public DuplicateEventException(String streamId, String eventId, Throwable cause) {
        super("Event '" + eventId + "' already exists (append to stream '" + streamId + "')", cause);
        this.streamId = streamId;
        this.eventId = eventId;
    }

    public String streamId() {
        return streamId;
    }

    public String eventId() {
        return eventId;
    }
}
