package com.strata.eventhost.lifecycle;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.strata.eventstore.GlobalLogReader;
import com.strata.observability.HealthCheckRegistry;
import com.strata.subscription.SubscribeToAllWorker;
import java.util.ArrayDeque;
import java.util.Deque;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SubscriptionWorkerLifecycle")
class SubscriptionWorkerLifecycleTest {

    private final HealthCheckRegistry healthChecks = new HealthCheckRegistry();
    private final Deque<SubscribeToAllWorker> workers = new ArrayDeque<>();
    private SubscriptionWorkerLifecycle lifecycle;

    @BeforeEach
    void setUp() {
        lifecycle = new SubscriptionWorkerLifecycle(() -> {
            SubscribeToAllWorker worker = mock(SubscribeToAllWorker.class);
            when(worker.subscriptionId()).thenReturn("orders");
            workers.push(worker);
            return worker;
        }, mock(GlobalLogReader.class), healthChecks);
    }

    @Test
    @DisplayName("starts the worker and registers its health check")
    void start() {
        lifecycle.start();

        assertThat(lifecycle.isRunning()).isTrue();
        verify(workers.peek()).start();
        assertThat(healthChecks.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("is idempotent while running")
    void startTwice() {
        lifecycle.start();
        lifecycle.start();

        assertThat(workers).hasSize(1);
    }

    @Test
    @DisplayName("stops the worker and removes its health check")
    void stop() {
        lifecycle.start();
        SubscribeToAllWorker worker = workers.peek();

        lifecycle.stop();

        verify(worker).stop();
        assertThat(lifecycle.isRunning()).isFalse();
        assertThat(lifecycle.worker()).isNull();
        assertThat(healthChecks.size()).isZero();
    }

    @Test
    @DisplayName("builds a fresh worker when restarted")
    void restart() {
        lifecycle.start();
        SubscribeToAllWorker first = workers.peek();
        lifecycle.stop();

        lifecycle.start();

        assertThat(workers).hasSize(2);
        assertThat(lifecycle.worker()).isNotSameAs(first);
        verify(first).stop();
        verify(lifecycle.worker()).start();
    }
}
