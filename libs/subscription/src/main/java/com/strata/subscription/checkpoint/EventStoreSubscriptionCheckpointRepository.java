package com.strata.subscription.checkpoint;

import com.strata.eventmodel.StreamEventEnvelope;
import com.strata.eventstore.EventStore;
import com.strata.eventstore.ExpectedStreamVersion;
import com.strata.eventstore.StreamName;
import java.time.Clock;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps checkpoints in the event store itself: every store appends a {@link CheckpointStored} event
 * to the subscription's {@code checkpoint_{id}} stream, and load reads the last one back.
 *
 * <p>Appends use {@link ExpectedStreamVersion#ANY}, so the first checkpoint creates the stream. The
 * stream is limited to {@value #RETAINED_CHECKPOINTS} event before the first append of each
 * subscription, so it does not grow with every delivery.
 */
public final class EventStoreSubscriptionCheckpointRepository implements SubscriptionCheckpointRepository {

    private static final Logger log = LoggerFactory.getLogger(EventStoreSubscriptionCheckpointRepository.class);

    static final int RETAINED_CHECKPOINTS = 1;

    private final EventStore eventStore;
    private final Clock clock;
    private final Set<String> bounded = ConcurrentHashMap.newKeySet();

    public EventStoreSubscriptionCheckpointRepository(EventStore eventStore) {
        this(eventStore, Clock.systemUTC());
    }

    public EventStoreSubscriptionCheckpointRepository(EventStore eventStore, Clock clock) {
        if (eventStore == null || clock == null) {
            throw new IllegalArgumentException("eventStore and clock must not be null");
        }
        this.eventStore = eventStore;
        this.clock = clock;
    }

    @Override
    public OptionalLong load(String subscriptionId) {
        String streamId = StreamName.checkpoint(Checkpoints.requireId(subscriptionId)).value();
        Optional<CheckpointStored> last = eventStore.readLastEvent(streamId).map(envelope -> {
            Object payload = envelope.payload();
            if (!(payload instanceof CheckpointStored)) {
                throw new IllegalStateException("Unexpected event " + payload.getClass().getName()
                        + " in checkpoint stream " + streamId);
            }
            return (CheckpointStored) payload;
        });
        log.debug("Loaded checkpoint for {}: {}", subscriptionId, last.map(CheckpointStored::position).orElse(null));
        return last.map(c -> OptionalLong.of(c.position())).orElseGet(OptionalLong::empty);
    }

    @Override
    public void store(String subscriptionId, long position) {
        Checkpoints.requireId(subscriptionId);
        Checkpoints.requirePosition(position);
        String streamId = StreamName.checkpoint(subscriptionId).value();
        if (!bounded.contains(subscriptionId)) {
            eventStore.setStreamMaxCount(streamId, RETAINED_CHECKPOINTS);
            bounded.add(subscriptionId);
        }
        var marker = new CheckpointStored(subscriptionId, position, clock.instant());
        eventStore.appendEvent(streamId, StreamEventEnvelope.of(marker), ExpectedStreamVersion.ANY);
    }
}
