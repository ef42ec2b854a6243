package com.strata.eventstore;

import com.strata.eventmodel.StreamEventEnvelope;
import java.util.List;
import java.util.Optional;
import java.util.function.BiFunction;

/**
 * Append-only event log, partitioned into streams.
 *
 * <p>All operations block on I/O. Stream ids are validated before any I/O and a null or blank id
 * fails with {@link IllegalArgumentException}. A version mismatch on append raises
 * {@link WrongExpectedVersionException}; storage faults raise {@link EventStoreException} and are not
 * retried.
 */
public interface EventStore {

    /** Count used by the overloads that take no {@code maxCount}. */
    int UNBOUNDED = Integer.MAX_VALUE;

    /**
     * @return true iff at least one event was ever appended to the stream
     */
    boolean streamExists(String streamId);

    /**
     * Reads a stream forward.
     *
     * <p>The returned sequence is lazy and restartable: every call to {@code iterator()} re-opens the
     * read at {@code from}. A stream that does not exist reads as empty.
     *
     * @param from first stream position to return
     * @param maxCount maximum number of events, must be positive
     */
    Iterable<StreamEventEnvelope<?>> readStream(String streamId, StreamReadPosition from, int maxCount);

    default Iterable<StreamEventEnvelope<?>> readStream(String streamId, StreamReadPosition from) {
        return readStream(streamId, from, UNBOUNDED);
    }

    default Iterable<StreamEventEnvelope<?>> readStream(String streamId) {
        return readStream(streamId, StreamReadPosition.START, UNBOUNDED);
    }

    /**
     * Reads the most recent event of a stream.
     *
     * @return the event with the highest stream position, empty when the stream has no events
     */
    Optional<StreamEventEnvelope<?>> readLastEvent(String streamId);

    /**
     * Keeps only the {@code maxCount} most recent events of a stream. Older events are removed at once
     * and after every later append; the stream version and the positions of the kept events do not
     * change. The limit may be set before the stream exists.
     *
     * @throws IllegalArgumentException if {@code maxCount} is not positive
     */
    void setStreamMaxCount(String streamId, int maxCount);

    /**
     * Appends a batch atomically: either every event is appended or none is.
     *
     * @throws WrongExpectedVersionException if the stream version does not match {@code expected}
     * @throws DuplicateEventException if an event id is already in the log
     * @throws IllegalArgumentException if the batch is empty or an envelope is invalid
     */
    AppendResult appendEvents(
            String streamId, List<? extends StreamEventEnvelope<?>> events, ExpectedStreamVersion expected);

    default AppendResult appendEvent(String streamId, StreamEventEnvelope<?> event, ExpectedStreamVersion expected) {
        return appendEvents(streamId, List.of(event), expected);
    }

    /** Appends to a stream that must not exist yet. */
    default AppendResult appendEvent(String streamId, StreamEventEnvelope<?> event) {
        return appendEvent(streamId, event, ExpectedStreamVersion.NO_STREAM);
    }

    /**
     * Left-folds the payloads of a stream into a state, starting from {@code seed}.
     *
     * @return the folded state, empty when no event was read
     */
    default <T> Optional<T> aggregateStream(
            String streamId, StreamReadPosition from, T seed, BiFunction<T, Object, T> fold) {
        StreamName.requireValid(streamId);
        T state = seed;
        boolean any = false;
        for (StreamEventEnvelope<?> envelope : readStream(streamId, from)) {
            state = fold.apply(state, envelope.payload());
            any = true;
        }
        return any ? Optional.ofNullable(state) : Optional.empty();
    }

    default <T> Optional<T> aggregateStream(String streamId, T seed, BiFunction<T, Object, T> fold) {
        return aggregateStream(streamId, StreamReadPosition.START, seed, fold);
    }

    /** Flushes buffered work. Stores whose appends are immediately durable do nothing. */
    default void commit() {
        // appends are durable on return
    }
}
