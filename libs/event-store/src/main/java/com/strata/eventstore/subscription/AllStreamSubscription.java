package com.strata.eventstore.subscription;

import com.strata.eventmodel.RecordedEvent;
import com.strata.eventstore.GlobalLogReader;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Catch-up subscription to the global log.
 *
 * <p>A dedicated thread reads the log from the start position, hands every event accepted by the
 * filter to the handler one at a time and keeps polling once it reaches the head. The subscription
 * ends when {@link #stop()} is called, when reading fails or when the handler throws; the drop
 * callback is invoked exactly once with the reason.
 */
public final class AllStreamSubscription implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AllStreamSubscription.class);

    /** Receives each accepted event on the subscription thread. */
    @FunctionalInterface
    public interface EventAppeared {
        void onEvent(AllStreamSubscription subscription, RecordedEvent event) throws Exception;
    }

    /** Told once that the subscription ended; {@code cause} is null for {@link SubscriptionDroppedReason#DISPOSED}. */
    @FunctionalInterface
    public interface SubscriptionDropped {
        void onDropped(AllStreamSubscription subscription, SubscriptionDroppedReason reason, Exception cause);
    }

    private final String name;
    private final GlobalLogReader reader;
    private final EventTypeFilter filter;
    private final PollingOptions options;
    private final EventAppeared eventAppeared;
    private final SubscriptionDropped subscriptionDropped;
    private final AtomicBoolean running = new AtomicBoolean(true);
    private final AtomicBoolean dropped = new AtomicBoolean(false);
    private final AtomicLong nextPosition;
    private final Thread thread;

    private AllStreamSubscription(
            String name,
            GlobalLogReader reader,
            long fromPosition,
            EventTypeFilter filter,
            PollingOptions options,
            EventAppeared eventAppeared,
            SubscriptionDropped subscriptionDropped) {
        this.name = name;
        this.reader = reader;
        this.filter = filter;
        this.options = options;
        this.eventAppeared = eventAppeared;
        this.subscriptionDropped = subscriptionDropped;
        this.nextPosition = new AtomicLong(fromPosition);
        this.thread = new Thread(this::run, "strata-subscription-" + name);
        this.thread.setDaemon(true);
    }

    /**
     * Starts a subscription on its own thread.
     *
     * @param name used in the thread name and logs
     * @param fromPosition first global position to deliver
     */
    public static AllStreamSubscription start(
            String name,
            GlobalLogReader reader,
            long fromPosition,
            EventTypeFilter filter,
            PollingOptions options,
            EventAppeared eventAppeared,
            SubscriptionDropped subscriptionDropped) {
        if (reader == null || filter == null || options == null || eventAppeared == null || subscriptionDropped == null) {
            throw new IllegalArgumentException("reader, filter, options and callbacks must not be null");
        }
        if (fromPosition < 0) {
            throw new IllegalArgumentException("fromPosition must be >= 0");
        }
        var subscription = new AllStreamSubscription(
                name, reader, fromPosition, filter, options, eventAppeared, subscriptionDropped);
        subscription.thread.start();
        return subscription;
    }

    /**
     * Stops delivering. No further event reaches the handler once this returns, except the one the
     * handler may be processing right now. Reports {@link SubscriptionDroppedReason#DISPOSED}.
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            thread.interrupt();
            drop(SubscriptionDroppedReason.DISPOSED, null);
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running.get();
    }

    /** Next global position this subscription will read. */
    public long nextPosition() {
        return nextPosition.get();
    }

    public String name() {
        return name;
    }

    private void run() {
        log.debug("Subscription {} reading from global position {}", name, nextPosition.get());
        while (running.get()) {
            List<RecordedEvent> batch;
            try {
                batch = reader.readAll(nextPosition.get(), options.batchSize());
            } catch (RuntimeException e) {
                fail(SubscriptionDroppedReason.SERVER_ERROR, e);
                return;
            }

            for (RecordedEvent event : batch) {
                if (!running.get()) {
                    return;
                }
                if (filter.accepts(event)) {
                    try {
                        eventAppeared.onEvent(this, event);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        if (running.get()) {
                            fail(SubscriptionDroppedReason.SUBSCRIBER_ERROR, e);
                        }
                        return;
                    } catch (Exception e) {
                        if (running.get()) {
                            fail(SubscriptionDroppedReason.SUBSCRIBER_ERROR, e);
                        }
                        return;
                    }
                }
                nextPosition.set(event.globalPosition() + 1);
            }

            if (batch.isEmpty() && !idle()) {
                return;
            }
        }
    }

    private boolean idle() {
        try {
            Thread.sleep(options.idleInterval().toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (running.get()) {
                fail(SubscriptionDroppedReason.SERVER_ERROR, e);
            }
            return false;
        }
    }

    private void fail(SubscriptionDroppedReason reason, Exception cause) {
        running.set(false);
        drop(reason, cause);
    }

    private void drop(SubscriptionDroppedReason reason, Exception cause) {
        if (!dropped.compareAndSet(false, true)) {
            return;
        }
        if (cause == null) {
            log.info("Subscription {} dropped: {}", name, reason);
        } else {
            log.warn("Subscription {} dropped: {}", name, reason, cause);
        }
        try {
            subscriptionDropped.onDropped(this, reason, cause);
        } catch (RuntimeException e) {
            log.error("Drop handler of subscription {} failed", name, e);
        }
    }
}
