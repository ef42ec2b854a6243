package com.strata.subscription;

import com.strata.eventmodel.EventSerializer;
import com.strata.eventmodel.RecordedEvent;
import com.strata.eventmodel.StreamEventEnvelope;
import com.strata.eventstore.GlobalLogReader;
import com.strata.eventstore.subscription.AllStreamSubscription;
import com.strata.eventstore.subscription.EventTypeFilter;
import com.strata.eventstore.subscription.SubscriptionDroppedReason;
import com.strata.observability.MetricFactory;
import com.strata.observability.SpanHelper;
import com.strata.subscription.checkpoint.CheckpointStored;
import com.strata.subscription.checkpoint.SubscriptionCheckpointRepository;
import com.strata.subscription.publish.InternalEventBus;
import com.strata.subscription.publish.ReadProjectionPublisher;
import io.github.resilience4j.micrometer.tagged.TaggedRetryMetrics;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import io.micrometer.core.instrument.Counter;
import io.opentelemetry.api.trace.SpanKind;
import java.time.Duration;
import java.util.Map;
import java.util.OptionalLong;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Long-running catch-up subscription over the global log.
 *
 * <p>On start it loads the subscription's checkpoint and subscribes from the position after it (or
 * from 0 when there is none). Each event is decoded, delivered to the in-process bus and then to the
 * read projections, and its global position stored as the new checkpoint. Delivery is at-least-once:
 * a crash between delivery and the checkpoint write replays that event.
 *
 * <p>Events with an empty payload and checkpoint markers are skipped without a checkpoint write.
 * System events (type prefixed with {@code $}) never reach the worker.
 *
 * <p>When the subscription drops for any reason other than {@link #stop()}, the worker resubscribes
 * from its stored checkpoint, waiting {@link SubscriptionOptions#resubscribeBackoff()} before the
 * first attempt and between failed ones. At most one resubscribe loop runs at a time, and the
 * loop hands over before the new subscription starts, so a drop of that subscription always
 * schedules the next attempt.
 *
 * <p>{@link SubscriptionState#TERMINATED} is final: once {@link #stop()} has run, no other state is
 * reported.
 */
public final class SubscribeToAllWorker implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SubscribeToAllWorker.class);

    static final String SPAN_NAME = "subscription.deliver";

    private final SubscriptionOptions options;
    private final GlobalLogReader reader;
    private final EventSerializer serializer;
    private final SubscriptionCheckpointRepository checkpoints;
    private final InternalEventBus eventBus;
    private final ReadProjectionPublisher projections;
    private final SpanHelper spans;
    private final Retry busRetry;
    private final Retry projectionRetry;
    private final EventTypeFilter filter = EventTypeFilter.excludeSystemEventsAnd(CheckpointStored.EVENT_TYPE);

    private final ScheduledExecutorService supervisor;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean resubscribing = new AtomicBoolean(false);
    private volatile boolean stopped;
    private final AtomicReference<SubscriptionState> state = new AtomicReference<>(SubscriptionState.STARTING);
    private volatile AllStreamSubscription subscription;
    private final AtomicLong processedPosition = new AtomicLong(-1);

    private final Counter delivered;
    private final Counter skipped;
    private final Counter failed;
    private final Counter resubscribes;
    private final AtomicLong checkpointGauge;

    public SubscribeToAllWorker(
            SubscriptionOptions options,
            GlobalLogReader reader,
            EventSerializer serializer,
            SubscriptionCheckpointRepository checkpoints,
            InternalEventBus eventBus,
            ReadProjectionPublisher projections,
            MetricFactory metrics,
            SpanHelper spans) {
        if (options == null || reader == null || serializer == null || checkpoints == null
                || eventBus == null || projections == null || metrics == null || spans == null) {
            throw new IllegalArgumentException("SubscribeToAllWorker collaborators must not be null");
        }
        this.options = options;
        this.reader = reader;
        this.serializer = serializer;
        this.checkpoints = checkpoints;
        this.eventBus = eventBus;
        this.projections = projections;
        this.spans = spans;

        String id = options.subscriptionId();
        this.supervisor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "strata-subscription-supervisor-" + id);
            thread.setDaemon(true);
            return thread;
        });
        this.delivered = metrics.counter("strata.subscription.events", "Events handled by the subscription",
                "subscription", id, "outcome", "delivered");
        this.skipped = metrics.counter("strata.subscription.events", "Events handled by the subscription",
                "subscription", id, "outcome", "skipped");
        this.failed = metrics.counter("strata.subscription.events", "Events handled by the subscription",
                "subscription", id, "outcome", "failed");
        this.resubscribes = metrics.counter("strata.subscription.resubscribes",
                "Resubscribe attempts after a dropped subscription", "subscription", id);
        this.checkpointGauge = metrics.gauge("strata.subscription.checkpoint",
                "Last checkpointed global position", "subscription", id);
        this.checkpointGauge.set(-1);

        RetryRegistry retries = RetryRegistry.ofDefaults();
        RetryPolicy deliveryRetry = options.deliveryRetry();
        this.busRetry = deliveryRetry.newRetry(retries, "subscription." + id + ".event-bus");
        this.projectionRetry = deliveryRetry.newRetry(retries, "subscription." + id + ".projections");
        TaggedRetryMetrics.ofRetryRegistry(retries).bindTo(metrics.registry());
    }

    /**
     * Subscribes in the background. A failure to load the checkpoint or to subscribe is retried like a
     * dropped subscription.
     *
     * @throws IllegalStateException if the worker was already started
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Subscription worker " + options.subscriptionId() + " already started");
        }
        log.info("Starting subscription worker {}", options.subscriptionId());
        resubscribing.set(true);
        submit(() -> attemptSubscribe(0), Duration.ZERO);
    }

    /**
     * Stops delivery and resubscription. An event being delivered when this is called finishes, but its
     * checkpoint is not stored.
     */
    public void stop() {
        if (stopped) {
            return;
        }
        stopped = true;
        AllStreamSubscription current = subscription;
        if (current != null) {
            current.stop();
        }
        supervisor.shutdownNow();
        state.set(SubscriptionState.TERMINATED);
        log.info("Subscription worker {} stopped at checkpoint {}", options.subscriptionId(), checkpointGauge.get());
    }

    @Override
    public void close() {
        stop();
    }

    public SubscriptionState state() {
        return state.get();
    }

    public String subscriptionId() {
        return options.subscriptionId();
    }

    public SubscriptionOptions options() {
        return options;
    }

    /** Last checkpoint written by this worker, or the one it started from; -1 for none. */
    public long lastCheckpoint() {
        return checkpointGauge.get();
    }

    /** Highest global position this worker has delivered or skipped; -1 before the first event. */
    public long processedPosition() {
        return processedPosition.get();
    }

    public boolean isStopped() {
        return stopped;
    }

    private void attemptSubscribe(int failedAttempts) {
        if (stopped) {
            resubscribing.set(false);
            return;
        }
        long from;
        try {
            transition(SubscriptionState.STARTING);
            from = startPosition();
        } catch (RuntimeException e) {
            int attempt = failedAttempts + 1;
            Duration delay = options.resubscribeBackoff().nextDelay(attempt);
            log.warn("Subscribe attempt {} for {} failed, retrying in {} ms",
                    attempt, options.subscriptionId(), delay.toMillis(), e);
            submit(() -> attemptSubscribe(attempt), delay);
            return;
        }

        // from here on a drop of the new subscription schedules its own resubscribe
        transition(SubscriptionState.SUBSCRIBED);
        resubscribing.set(false);
        AllStreamSubscription created = AllStreamSubscription.start(
                options.subscriptionId(), reader, from, filter, options.polling(),
                this::onEvent, this::onDropped);
        subscription = created;
        if (stopped) {
            created.stop();
            return;
        }
        log.info("Subscription {} subscribed to all from global position {}", options.subscriptionId(), from);
        if (failedAttempts > 0) {
            log.info("Subscription {} resubscribed after {} failed attempt(s)", options.subscriptionId(), failedAttempts);
        }
    }

    private long startPosition() {
        OptionalLong checkpoint = checkpoints.load(options.subscriptionId());
        long from = checkpoint.isPresent() ? checkpoint.getAsLong() + 1 : 0;
        checkpointGauge.set(checkpoint.orElse(-1));
        processedPosition.set(from - 1);
        return from;
    }

    private void onEvent(AllStreamSubscription source, RecordedEvent event) throws Exception {
        if (stopped || !source.isRunning()) {
            return;
        }
        transition(SubscriptionState.DELIVERING);
        try {
            if (event.hasEmptyPayload()) {
                log.info("Skipping event {} ({}) at global position {}: empty payload",
                        event.eventId(), event.eventType(), event.globalPosition());
                skipped.increment();
            } else if (CheckpointStored.EVENT_TYPE.equals(event.eventType())) {
                skipped.increment();
            } else {
                spans.inSpan(SPAN_NAME, SpanKind.CONSUMER, spanAttributes(event), span -> {
                    deliver(source, event);
                    return null;
                });
            }
            processedPosition.set(event.globalPosition());
        } catch (Exception e) {
            failed.increment();
            log.error("Subscription {} failed to handle event {} ({}) at global position {}",
                    options.subscriptionId(), event.eventId(), event.eventType(), event.globalPosition(), e);
            throw e;
        } finally {
            state.compareAndSet(SubscriptionState.DELIVERING, SubscriptionState.SUBSCRIBED);
        }
    }

    private void deliver(AllStreamSubscription source, RecordedEvent event) throws Exception {
        StreamEventEnvelope<Object> envelope = serializer.decode(event);
        busRetry.executeCallable(() -> {
            eventBus.publish(envelope);
            return null;
        });
        projectionRetry.executeCallable(() -> {
            projections.publish(envelope);
            return null;
        });

        if (stopped || !source.isRunning()) {
            log.info("Subscription {} stopped while delivering global position {}; checkpoint not stored",
                    options.subscriptionId(), event.globalPosition());
            return;
        }
        checkpoints.store(options.subscriptionId(), event.globalPosition());
        checkpointGauge.set(event.globalPosition());
        delivered.increment();
        log.debug("Subscription {} checkpointed global position {}", options.subscriptionId(), event.globalPosition());
    }

    private void onDropped(AllStreamSubscription source, SubscriptionDroppedReason reason, Exception cause) {
        if (reason == SubscriptionDroppedReason.DISPOSED || stopped) {
            state.set(SubscriptionState.TERMINATED);
            log.info("Subscription {} disposed", options.subscriptionId());
            return;
        }
        transition(SubscriptionState.DROPPED);
        log.warn("Subscription {} dropped: {}", options.subscriptionId(), reason, cause);
        if (!resubscribing.compareAndSet(false, true)) {
            log.debug("Resubscribe for {} already in progress", options.subscriptionId());
            return;
        }
        transition(SubscriptionState.RESUBSCRIBING);
        resubscribes.increment();
        submit(() -> attemptSubscribe(0), options.resubscribeBackoff().nextDelay(1));
    }

    /** Moves to {@code next} unless the worker has terminated. */
    private void transition(SubscriptionState next) {
        state.getAndUpdate(current -> current == SubscriptionState.TERMINATED ? current : next);
    }

    private void submit(Runnable task, Duration delay) {
        if (stopped) {
            resubscribing.set(false);
            return;
        }
        try {
            supervisor.schedule(task, delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            resubscribing.set(false);
            log.debug("Subscription worker {} is shutting down; subscribe attempt not scheduled",
                    options.subscriptionId());
        }
    }

    private static Map<String, String> spanAttributes(RecordedEvent event) {
        return Map.of(
                "strata.event.type", event.eventType(),
                "strata.event.id", event.eventId(),
                "strata.stream.id", event.streamId(),
                "strata.global_position", Long.toString(event.globalPosition()));
    }
}
