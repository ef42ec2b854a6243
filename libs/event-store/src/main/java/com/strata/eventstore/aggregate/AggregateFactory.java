package com.strata.eventstore.aggregate;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Creates empty aggregate instances by type. Every aggregate type is registered at startup.
 */
public final class AggregateFactory {

    private final Map<Class<?>, Supplier<?>> suppliers = new ConcurrentHashMap<>();

    public <A extends EventSourcedAggregate<?, ?>> AggregateFactory register(Class<A> type, Supplier<A> supplier) {
        if (type == null || supplier == null) {
            throw new IllegalArgumentException("type and supplier must not be null");
        }
        suppliers.put(type, supplier);
        return this;
    }

    /**
     * @throws IllegalArgumentException if the type was never registered
     */
    public <A extends EventSourcedAggregate<?, ?>> A create(Class<A> type) {
        Supplier<?> supplier = suppliers.get(type);
        if (supplier == null) {
            throw new IllegalArgumentException("No factory registered for aggregate " + type.getName());
        }
        return type.cast(supplier.get());
    }

    public boolean isRegistered(Class<?> type) {
        return suppliers.containsKey(type);
    }
}
