package com.strata.eventmodel;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;

/**
 * Turns the stored bytes of one event type back into its payload.
 *
 * <p>The default decoder binds the JSON to the registered class. Custom decoders can upcast older
 * shapes of an event.
 *
 * @param <T> payload type
 */
@FunctionalInterface
public interface EventDecoder<T> {

    T decode(ObjectMapper mapper, byte[] data) throws IOException;

    static <T> EventDecoder<T> json(Class<T> type) {
        return (mapper, data) -> mapper.readValue(data, type);
    }
}
