package com.strata.eventstore.aggregate;

import com.strata.eventmodel.StreamEventEnvelope;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * A {@link DomainEventsBuffer} bound to the calling thread for the length of one unit of work.
 *
 * <p>{@link #run(Supplier)} opens a fresh buffer, runs the work and hands back everything the work
 * committed; the buffer is unbound even when the work throws, so nothing outlives the unit of work.
 * Stores made outside {@code run} find no buffer and buffer nothing.
 */
public final class DomainEventsScope {

    private static final ThreadLocal<DomainEventsBuffer> CURRENT = new ThreadLocal<>();

    private DomainEventsScope() {
    }

    /** What a unit of work returned together with the events it committed, in commit order. */
    public record Completed<T>(T result, List<StreamEventEnvelope<?>> events) {
        public Completed {
            events = List.copyOf(events);
        }
    }

    /**
     * Runs {@code work} inside a new unit of work.
     *
     * @throws IllegalStateException if a unit of work is already open on this thread
     */
    public static <T> Completed<T> run(Supplier<T> work) {
        if (work == null) {
            throw new IllegalArgumentException("work must not be null");
        }
        if (CURRENT.get() != null) {
            throw new IllegalStateException("A unit of work is already open on " + Thread.currentThread().getName());
        }
        DomainEventsBuffer buffer = new DomainEventsBuffer();
        CURRENT.set(buffer);
        try {
            T result = work.get();
            return new Completed<>(result, buffer.drain());
        } finally {
            CURRENT.remove();
        }
    }

    /** The buffer of the unit of work open on this thread, if any. */
    public static Optional<DomainEventsBuffer> current() {
        return Optional.ofNullable(CURRENT.get());
    }
}
