package com.strata.eventmodel;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps event type tags to payload classes and decoders, in both directions.
 *
 * <p>Populated at startup. A payload class can only be appended or read once it is registered; the
 * default tag is the class simple name.
 */
public final class EventTypeRegistry {

    private final Map<String, RegisteredEventType<?>> byName = new ConcurrentHashMap<>();
    private final Map<Class<?>, String> namesByType = new ConcurrentHashMap<>();

    /** Registers {@code type} under its simple name with the JSON decoder. */
    public <T> EventTypeRegistry register(Class<T> type) {
        return register(type.getSimpleName(), type);
    }

    public <T> EventTypeRegistry register(String name, Class<T> type) {
        return register(name, type, EventDecoder.json(type));
    }

    /**
     * Registers a payload class under an explicit tag.
     *
     * @throws IllegalArgumentException if the name is blank
     * @throws IllegalStateException if the name or the class is already bound to something else
     */
    public synchronized <T> EventTypeRegistry register(String name, Class<T> type, EventDecoder<T> decoder) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("event type name must not be null or blank");
        }
        if (type == null || decoder == null) {
            throw new IllegalArgumentException("type and decoder must not be null");
        }
        RegisteredEventType<?> existing = byName.get(name);
        if (existing != null && !existing.type().equals(type)) {
            throw new IllegalStateException(
                    "Event type '" + name + "' is already registered for " + existing.type().getName());
        }
        String existingName = namesByType.get(type);
        if (existingName != null && !existingName.equals(name)) {
            throw new IllegalStateException(
                    type.getName() + " is already registered as '" + existingName + "'");
        }
        byName.put(name, new RegisteredEventType<>(name, type, decoder));
        namesByType.put(type, name);
        return this;
    }

    /**
     * @throws IllegalArgumentException if the class is not registered
     */
    public String nameOf(Class<?> type) {
        String name = namesByType.get(type);
        if (name == null) {
            throw new IllegalArgumentException("Unregistered event type: " + type.getName());
        }
        return name;
    }

    public Optional<RegisteredEventType<?>> lookup(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    public boolean isRegistered(Class<?> type) {
        return namesByType.containsKey(type);
    }

    public int size() {
        return byName.size();
    }
}
