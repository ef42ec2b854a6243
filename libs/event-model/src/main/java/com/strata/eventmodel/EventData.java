package com.strata.eventmodel;

/**
 * An encoded event ready to be written by a store.
 *
 * @param eventId unique event identifier
 * @param eventType registered type tag
 * @param contentType encoding of {@code data}
 * @param data encoded payload
 * @param metadata encoded metadata
 */
public record EventData(String eventId, String eventType, String contentType, byte[] data, byte[] metadata) {}
