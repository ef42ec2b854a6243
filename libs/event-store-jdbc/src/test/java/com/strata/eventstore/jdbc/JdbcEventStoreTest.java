package com.strata.eventstore.jdbc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.strata.eventmodel.EventSerializer;
import com.strata.eventmodel.StreamEventEnvelope;
import com.strata.eventstore.EventStore;
import com.strata.eventstore.EventStoreContractTest;
import com.strata.eventstore.EventStoreException;
import com.strata.eventstore.ExpectedStreamVersion;
import com.strata.eventstore.StreamReadPosition;
import com.strata.eventstore.WrongExpectedVersionException;
import com.strata.eventstore.fixtures.OrderFixtures;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import javax.sql.DataSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

@DisplayName("JdbcEventStore")
class JdbcEventStoreTest extends EventStoreContractTest {

    private DataSource dataSource;

    @Override
    protected EventStore createStore(EventSerializer serializer) {
        dataSource = H2DataSources.migrated();
        return new JdbcEventStore(dataSource, serializer, Clock.systemUTC(), 3);
    }

    @Test
    @DisplayName("events survive a new store instance on the same database")
    void durable() {
        store.appendEvent("Order-1", OrderFixtures.created("1"));

        var reopened = new JdbcEventStore(dataSource, OrderFixtures.serializer());

        assertThat(reopened.streamExists("Order-1")).isTrue();
        assertThat(toList(reopened.readStream("Order-1"))).hasSize(1);
        assertThat(reopened.lastGlobalPosition()).isZero();
    }

    @Test
    @DisplayName("reads page through streams longer than the page size")
    void paging() {
        List<StreamEventEnvelope<?>> batch = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            batch.add(OrderFixtures.shipped("1"));
        }
        store.appendEvents("Order-1", batch, ExpectedStreamVersion.NO_STREAM);

        assertThat(toList(store.readStream("Order-1"))).extracting(e -> e.metadata().streamPosition())
                .containsExactly(0L, 1L, 2L, 3L, 4L, 5L, 6L, 7L);
        assertThat(toList(store.readStream("Order-1", StreamReadPosition.of(2), 5))).hasSize(5);
    }

    @Test
    @DisplayName("concurrent appenders to one version: exactly one wins")
    void concurrentAppenders() throws Exception {
        store.appendEvent("Order-1", OrderFixtures.created("1"));
        int writers = 6;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger wins = new AtomicInteger();
        AtomicInteger conflicts = new AtomicInteger();

        for (int i = 0; i < writers; i++) {
            pool.submit(() -> {
                start.await();
                try {
                    store.appendEvent("Order-1", OrderFixtures.shipped("1"), ExpectedStreamVersion.of(0));
                    wins.incrementAndGet();
                } catch (WrongExpectedVersionException e) {
                    conflicts.incrementAndGet();
                }
                return null;
            });
        }
        start.countDown();
        pool.shutdown();
        assertThat(pool.awaitTermination(30, TimeUnit.SECONDS)).isTrue();

        assertThat(wins.get()).isEqualTo(1);
        assertThat(conflicts.get()).isEqualTo(writers - 1);
        assertThat(toList(store.readStream("Order-1"))).hasSize(2);
    }

    @Test
    @DisplayName("concurrent creators of one stream: exactly one wins")
    void concurrentCreators() throws Exception {
        int writers = 4;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger wins = new AtomicInteger();

        for (int i = 0; i < writers; i++) {
            pool.submit(() -> {
                start.await();
                try {
                    store.appendEvent("Order-9", OrderFixtures.created("9"));
                    wins.incrementAndGet();
                } catch (WrongExpectedVersionException e) {
                    // lost the race
                }
                return null;
            });
        }
        start.countDown();
        pool.shutdown();
        assertThat(pool.awaitTermination(30, TimeUnit.SECONDS)).isTrue();

        assertThat(wins.get()).isEqualTo(1);
        assertThat(globalLog.lastGlobalPosition()).isZero();
    }

    @Test
    @DisplayName("concurrent Any appends that all create the same stream never conflict")
    void concurrentAnyCreators() throws Exception {
        int writers = 6;
        int streams = 10;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        AtomicInteger conflicts = new AtomicInteger();

        for (int n = 0; n < streams; n++) {
            String streamId = "checkpoint_race-" + n;
            CountDownLatch start = new CountDownLatch(1);
            List<Future<?>> appends = new ArrayList<>();
            for (int i = 0; i < writers; i++) {
                appends.add(pool.submit(() -> {
                    start.await();
                    try {
                        store.appendEvent(streamId, OrderFixtures.shipped("1"), ExpectedStreamVersion.ANY);
                    } catch (WrongExpectedVersionException e) {
                        conflicts.incrementAndGet();
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> append : appends) {
                append.get(30, TimeUnit.SECONDS);
            }
            assertThat(toList(store.readStream(streamId))).hasSize(writers);
        }
        pool.shutdown();

        assertThat(conflicts).hasValue(0);
        assertThat(globalLog.lastGlobalPosition()).isEqualTo((long) writers * streams - 1);
    }

    @Test
    @DisplayName("the checkpoint-style stream keeps one row however many appends it takes")
    void maxCountDeletesRows() throws SQLException {
        store.setStreamMaxCount("checkpoint_orders", 1);
        for (int i = 0; i < 20; i++) {
            store.appendEvent("checkpoint_orders", OrderFixtures.shipped("1"), ExpectedStreamVersion.ANY);
        }

        try (Connection conn = dataSource.getConnection();
                var rs = conn.createStatement().executeQuery(
                        "SELECT COUNT(*), MAX(stream_position) FROM events WHERE stream_id = 'checkpoint_orders'")) {
            assertThat(rs.next()).isTrue();
            assertThat(rs.getLong(1)).isEqualTo(1);
            assertThat(rs.getLong(2)).isEqualTo(19);
        }
        assertThat(store.readLastEvent("checkpoint_orders")).isPresent();
    }

    @Test
    @DisplayName("connection failures surface as EventStoreException")
    void storageFault() throws SQLException {
        DataSource failing = Mockito.mock(DataSource.class);
        Mockito.when(failing.getConnection()).thenThrow(new SQLException("connection refused", "08001"));
        var broken = new JdbcEventStore(failing, OrderFixtures.serializer());

        assertThatThrownBy(() -> broken.streamExists("Order-1"))
                .isInstanceOf(EventStoreException.class)
                .hasCauseInstanceOf(SQLException.class);
        assertThatThrownBy(() -> broken.appendEvent("Order-1", OrderFixtures.created("1")))
                .isInstanceOf(EventStoreException.class);
        assertThatThrownBy(() -> broken.readAll(0, 10)).isInstanceOf(EventStoreException.class);
    }

    @Test
    @DisplayName("a failed append leaves no partial rows behind")
    void atomicBatch() throws SQLException {
        store.appendEvent("Order-1", OrderFixtures.created("1"));
        var unregistered = StreamEventEnvelope.of("not registered");

        assertThatThrownBy(() -> store.appendEvents("Order-1",
                List.of(OrderFixtures.shipped("1"), unregistered), ExpectedStreamVersion.of(0)))
                .isInstanceOf(IllegalArgumentException.class);

        assertThat(toList(store.readStream("Order-1"))).hasSize(1);
        assertThat(globalLog.lastGlobalPosition()).isZero();
        try (Connection conn = dataSource.getConnection();
                var rs = conn.createStatement().executeQuery("SELECT version FROM streams WHERE stream_id = 'Order-1'")) {
            assertThat(rs.next()).isTrue();
            assertThat(rs.getLong(1)).isZero();
        }
    }
}
