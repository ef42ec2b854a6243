package com.strata.eventmodel;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;

/**
 * JSON encoding of {@link StreamEventEnvelope}s.
 *
 * <p>Payload and metadata are serialized independently. The payload's type tag comes from the
 * {@link EventTypeRegistry} and is resolved back to a class through the same registry when the event
 * is read. {@code JavaTimeModule} writes instants as ISO 8601 strings.
 */
public final class EventSerializer {

    /** Content type of every payload written by this serializer. */
    public static final String CONTENT_TYPE = "application/json";

    private final EventTypeRegistry registry;
    private final ObjectMapper mapper;

    public EventSerializer(EventTypeRegistry registry) {
        this(registry, defaultObjectMapper());
    }

    public EventSerializer(EventTypeRegistry registry, ObjectMapper mapper) {
        if (registry == null || mapper == null) {
            throw new IllegalArgumentException("registry and mapper must not be null");
        }
        this.registry = registry;
        this.mapper = mapper;
    }

    /** A mapper configured the way the log expects: ISO dates, tolerant of added fields. */
    public static ObjectMapper defaultObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Encodes an envelope for appending.
     *
     * @throws IllegalArgumentException if the payload class is not registered
     * @throws EventSerializationException if Jackson cannot write the payload or metadata
     */
    public EventData encode(StreamEventEnvelope<?> envelope) {
        String eventType = registry.nameOf(envelope.payload().getClass());
        try {
            byte[] data = mapper.writeValueAsBytes(envelope.payload());
            byte[] metadata = mapper.writeValueAsBytes(envelope.metadata());
            return new EventData(envelope.eventId(), eventType, CONTENT_TYPE, data, metadata);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("Failed to serialize event: " + envelope.eventId(), e);
        }
    }

    /**
     * Decodes a recorded event. The returned metadata carries the positions held by the record,
     * whatever was written at append time.
     *
     * @throws EventSerializationException if the type is unknown or the bytes cannot be decoded
     */
    public StreamEventEnvelope<Object> decode(RecordedEvent event) {
        Object payload = decodePayload(event.eventType(), event.data(), event.eventId());
        StreamEventMetadata metadata = decodeMetadata(event)
                .withStreamPosition(event.streamPosition())
                .withLogPosition(event.globalPosition());
        return new StreamEventEnvelope<>(payload, metadata);
    }

    private Object decodePayload(String eventType, byte[] data, String eventId) {
        RegisteredEventType<?> registered = registry.lookup(eventType)
                .orElseThrow(() -> new EventSerializationException(
                        "Unknown event type '" + eventType + "' for event " + eventId, null));
        try {
            Object payload = registered.decoder().decode(mapper, data);
            if (payload == null) {
                throw new EventSerializationException("Event " + eventId + " decoded to null", null);
            }
            return payload;
        } catch (IOException e) {
            throw new EventSerializationException(
                    "Failed to deserialize event " + eventId + " as " + eventType, e);
        }
    }

    private StreamEventMetadata decodeMetadata(RecordedEvent event) {
        if (event.metadata() == null || event.metadata().length == 0) {
            return new StreamEventMetadata(event.eventId(), null, null, null, event.createdAt());
        }
        try {
            return mapper.readValue(event.metadata(), StreamEventMetadata.class);
        } catch (IOException e) {
            throw new EventSerializationException("Failed to deserialize metadata of event " + event.eventId(), e);
        }
    }

    public EventTypeRegistry registry() {
        return registry;
    }

    /** Returns the ObjectMapper used for payloads and metadata. */
    public ObjectMapper objectMapper() {
        return mapper;
    }

    /**
     * Exception thrown when event serialization/deserialization fails.
     */
    public static class EventSerializationException extends RuntimeException {
        public EventSerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
