package com.strata.eventstore.subscription;

import com.strata.eventmodel.RecordedEvent;
import java.util.Set;

/**
 * Decides which recorded events a subscription passes on to its handler.
 */
public final class EventTypeFilter {

    private final boolean excludeSystemEvents;
    private final Set<String> excludedTypes;

    private EventTypeFilter(boolean excludeSystemEvents, Set<String> excludedTypes) {
        this.excludeSystemEvents = excludeSystemEvents;
        this.excludedTypes = Set.copyOf(excludedTypes);
    }

    /** Passes every event. */
    public static EventTypeFilter none() {
        return new EventTypeFilter(false, Set.of());
    }

    /** Drops store-internal events, whose type starts with {@code $}. */
    public static EventTypeFilter excludeSystemEvents() {
        return new EventTypeFilter(true, Set.of());
    }

    /** Drops store-internal events and the given event types. */
    public static EventTypeFilter excludeSystemEventsAnd(String... eventTypes) {
        return new EventTypeFilter(true, Set.of(eventTypes));
    }

    public boolean accepts(RecordedEvent event) {
        if (excludeSystemEvents && event.isSystemEvent()) {
            return false;
        }
        return !excludedTypes.contains(event.eventType());
    }

    public Set<String> excludedTypes() {
        return excludedTypes;
    }
}
