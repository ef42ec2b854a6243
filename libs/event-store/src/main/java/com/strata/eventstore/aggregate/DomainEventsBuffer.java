package com.strata.eventstore.aggregate;

import com.strata.eventmodel.StreamEventEnvelope;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Committed events waiting to be published by whoever owns the current unit of work.
 *
 * <p>The aggregate store only adds to the buffer; draining and publishing is left to the caller.
 */
public final class DomainEventsBuffer {

    private final ConcurrentLinkedQueue<StreamEventEnvelope<?>> events = new ConcurrentLinkedQueue<>();

    public void addAll(Collection<? extends StreamEventEnvelope<?>> committed) {
        events.addAll(committed);
    }

    /** Events in commit order, without removing them. */
    public List<StreamEventEnvelope<?>> peek() {
        return List.copyOf(events);
    }

    /** Removes and returns every buffered event in commit order. */
    public List<StreamEventEnvelope<?>> drain() {
        List<StreamEventEnvelope<?>> drained = new ArrayList<>();
        StreamEventEnvelope<?> next;
        while ((next = events.poll()) != null) {
            drained.add(next);
        }
        return drained;
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }
}
