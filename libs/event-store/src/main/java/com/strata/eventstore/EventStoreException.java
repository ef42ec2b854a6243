package com.strata.eventstore;

/**
 * Storage fault raised by an event store: connection loss, timeout, failed SQL. Never retried by the
 * store itself.
 */
public class EventStoreException extends RuntimeException {

    public EventStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
