package com.strata.eventmodel;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks an envelope before it is appended. All errors are collected into one
 * {@link ValidationResult}.
 */
public final class EventValidator {

    private EventValidator() {
        // utility class
    }

    public static ValidationResult validate(StreamEventEnvelope<?> event) {
        var errors = new ArrayList<String>();

        if (event == null) {
            return ValidationResult.fail(List.of("event must not be null"));
        }
        if (event.payload() == null) {
            errors.add("payload must not be null");
        }
        StreamEventMetadata metadata = event.metadata();
        if (metadata == null) {
            errors.add("metadata must not be null");
            return ValidationResult.fail(errors);
        }
        if (isBlank(metadata.eventId())) {
            errors.add("eventId must not be null or blank");
        }
        if (metadata.streamPosition() != null && metadata.streamPosition() < 0) {
            errors.add("streamPosition must be >= 0");
        }
        if (metadata.logPosition() != null && metadata.logPosition() < 0) {
            errors.add("logPosition must be >= 0");
        }
        if (metadata.occurredAt() == null) {
            errors.add("occurredAt must not be null");
        }
        if (event.payload() instanceof DomainEvent
                && metadata.eventId() != null
                && !metadata.eventId().equals(((DomainEvent) event.payload()).eventId())) {
            errors.add("eventId must match the domain event's id");
        }

        return errors.isEmpty() ? ValidationResult.ok() : ValidationResult.fail(errors);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
