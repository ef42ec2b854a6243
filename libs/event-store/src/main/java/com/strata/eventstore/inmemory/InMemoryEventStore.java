package com.strata.eventstore.inmemory;

import com.strata.eventmodel.EventData;
import com.strata.eventmodel.EventSerializer;
import com.strata.eventmodel.EventValidator;
import com.strata.eventmodel.RecordedEvent;
import com.strata.eventmodel.StreamEventEnvelope;
import com.strata.eventstore.AppendResult;
import com.strata.eventstore.DuplicateEventException;
import com.strata.eventstore.EventStore;
import com.strata.eventstore.ExpectedStreamVersion;
import com.strata.eventstore.GlobalLogReader;
import com.strata.eventstore.StreamName;
import com.strata.eventstore.StreamPages;
import com.strata.eventstore.StreamReadPosition;
import com.strata.eventstore.WrongExpectedVersionException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-local event store.
 *
 * <p>Events are kept in their encoded form so that reads go through the same codec as the durable
 * store. One lock serializes appends and guards reads. Streams and the global log are sorted by
 * position, so events removed by a stream's max count leave holes that reads step over.
 */
public final class InMemoryEventStore implements EventStore, GlobalLogReader {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEventStore.class);

    private static final int PAGE_SIZE = 256;

    private final EventSerializer serializer;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, StreamState> streams = new HashMap<>();
    private final Map<String, Integer> maxCounts = new HashMap<>();
    private final NavigableMap<Long, RecordedEvent> all = new TreeMap<>();
    private final Set<String> eventIds = new HashSet<>();
    private long lastGlobalPosition = -1;

    public InMemoryEventStore(EventSerializer serializer) {
        this(serializer, Clock.systemUTC());
    }

    public InMemoryEventStore(EventSerializer serializer, Clock clock) {
        if (serializer == null || clock == null) {
            throw new IllegalArgumentException("serializer and clock must not be null");
        }
        this.serializer = serializer;
        this.clock = clock;
    }

    @Override
    public boolean streamExists(String streamId) {
        StreamName.requireValid(streamId);
        lock.lock();
        try {
            return streams.containsKey(streamId);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Iterable<StreamEventEnvelope<?>> readStream(String streamId, StreamReadPosition from, int maxCount) {
        StreamName.requireValid(streamId);
        return new StreamPages<RecordedEvent, StreamEventEnvelope<?>>(
                from.value(),
                maxCount,
                PAGE_SIZE,
                (position, count) -> page(streamId, position, count),
                RecordedEvent::streamPosition,
                serializer::decode);
    }

    @Override
    public Optional<StreamEventEnvelope<?>> readLastEvent(String streamId) {
        StreamName.requireValid(streamId);
        RecordedEvent last;
        lock.lock();
        try {
            StreamState stream = streams.get(streamId);
            last = stream == null || stream.events.isEmpty() ? null : stream.events.lastEntry().getValue();
        } finally {
            lock.unlock();
        }
        return last == null ? Optional.empty() : Optional.of(serializer.decode(last));
    }

    @Override
    public void setStreamMaxCount(String streamId, int maxCount) {
        StreamName.requireValid(streamId);
        if (maxCount <= 0) {
            throw new IllegalArgumentException("maxCount must be positive, got " + maxCount);
        }
        lock.lock();
        try {
            maxCounts.put(streamId, maxCount);
            StreamState stream = streams.get(streamId);
            if (stream != null) {
                truncate(streamId, stream);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public AppendResult appendEvents(
            String streamId, List<? extends StreamEventEnvelope<?>> events, ExpectedStreamVersion expected) {
        StreamName.requireValid(streamId);
        if (events == null || events.isEmpty()) {
            throw new IllegalArgumentException("events must not be null or empty");
        }
        if (expected == null) {
            throw new IllegalArgumentException("expected version must not be null");
        }
        events.forEach(event -> EventValidator.validate(event).throwIfInvalid());

        lock.lock();
        try {
            StreamState stream = streams.get(streamId);
            long actual = stream == null ? ExpectedStreamVersion.NO_STREAM_VALUE : stream.version;
            if (!expected.matches(actual)) {
                log.debug("Version conflict on {}: expected {}, actual {}", streamId, expected, actual);
                throw new WrongExpectedVersionException(streamId, expected, actual);
            }
            requireUniqueIds(streamId, events);

            List<RecordedEvent> appended = new ArrayList<>(events.size());
            long streamPosition = actual;
            long globalPosition = lastGlobalPosition;
            for (StreamEventEnvelope<?> event : events) {
                streamPosition++;
                EventData data = serializer.encode(
                        event.withMetadata(event.metadata().withStreamPosition(streamPosition).withoutLogPosition()));
                appended.add(new RecordedEvent(
                        streamId,
                        data.eventId(),
                        data.eventType(),
                        data.contentType(),
                        data.data(),
                        data.metadata(),
                        streamPosition,
                        ++globalPosition,
                        clock.instant()));
            }

            StreamState target = streams.computeIfAbsent(streamId, id -> new StreamState());
            for (RecordedEvent event : appended) {
                target.events.put(event.streamPosition(), event);
                all.put(event.globalPosition(), event);
                eventIds.add(event.eventId());
            }
            target.version = streamPosition;
            lastGlobalPosition = globalPosition;
            truncate(streamId, target);

            log.debug("Appended {} event(s) to {} at version {}", appended.size(), streamId, streamPosition);
            return new AppendResult(globalPosition, streamPosition);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<RecordedEvent> readAll(long fromGlobalPosition, int maxCount) {
        if (fromGlobalPosition < 0) {
            throw new IllegalArgumentException("fromGlobalPosition must be >= 0");
        }
        if (maxCount <= 0) {
            throw new IllegalArgumentException("maxCount must be positive");
        }
        lock.lock();
        try {
            return first(all.tailMap(fromGlobalPosition, true), maxCount);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long lastGlobalPosition() {
        lock.lock();
        try {
            return lastGlobalPosition;
        } finally {
            lock.unlock();
        }
    }

    /** Number of streams that received at least one event. */
    public int streamCount() {
        lock.lock();
        try {
            return streams.size();
        } finally {
            lock.unlock();
        }
    }

    private List<RecordedEvent> page(String streamId, long from, int count) {
        lock.lock();
        try {
            StreamState stream = streams.get(streamId);
            return stream == null ? List.of() : first(stream.events.tailMap(from, true), count);
        } finally {
            lock.unlock();
        }
    }

    private void requireUniqueIds(String streamId, List<? extends StreamEventEnvelope<?>> events) {
        Set<String> batch = new HashSet<>();
        for (StreamEventEnvelope<?> event : events) {
            if (eventIds.contains(event.eventId()) || !batch.add(event.eventId())) {
                throw new DuplicateEventException(streamId, event.eventId());
            }
        }
    }

    /** Drops the oldest events of a stream beyond its max count. Caller holds the lock. */
    private void truncate(String streamId, StreamState stream) {
        Integer maxCount = maxCounts.get(streamId);
        if (maxCount == null) {
            return;
        }
        int removed = 0;
        while (stream.events.size() > maxCount) {
            RecordedEvent oldest = stream.events.pollFirstEntry().getValue();
            all.remove(oldest.globalPosition());
            removed++;
        }
        if (removed > 0) {
            log.debug("Removed {} event(s) from {} beyond max count {}", removed, streamId, maxCount);
        }
    }

    private static List<RecordedEvent> first(NavigableMap<Long, RecordedEvent> source, int count) {
        List<RecordedEvent> result = new ArrayList<>();
        for (RecordedEvent event : source.values()) {
            if (result.size() >= count) {
                break;
            }
            result.add(event);
        }
        return result;
    }

    private static final class StreamState {
        private final NavigableMap<Long, RecordedEvent> events = new TreeMap<>();
        private long version = ExpectedStreamVersion.NO_STREAM_VALUE;
    }
}
