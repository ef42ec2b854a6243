package com.strata.eventmodel;

/**
 * One entry of the {@link EventTypeRegistry}.
 *
 * @param name the event type tag written to the log
 * @param type payload class
 * @param decoder turns stored bytes into the payload
 */
public record RegisteredEventType<T>(String name, Class<T> type, EventDecoder<T> decoder) {}
