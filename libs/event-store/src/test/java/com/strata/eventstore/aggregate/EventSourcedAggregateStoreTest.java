package com.strata.eventstore.aggregate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;

import com.strata.eventmodel.StreamEventEnvelope;
import com.strata.eventstore.AppendResult;
import com.strata.eventstore.EventStore;
import com.strata.eventstore.ExpectedStreamVersion;
import com.strata.eventstore.StreamReadPosition;
import com.strata.eventstore.WrongExpectedVersionException;
import com.strata.eventstore.fixtures.Order;
import com.strata.eventstore.fixtures.OrderEvent.OrderCancelled;
import com.strata.eventstore.fixtures.OrderEvent.OrderShipped;
import com.strata.eventstore.fixtures.OrderFixtures;
import com.strata.eventstore.inmemory.InMemoryEventStore;
import com.strata.observability.MetricFactory;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("EventSourcedAggregateStore")
class EventSourcedAggregateStoreTest {

    private EventStore eventStore;
    private DomainEventsBuffer buffer;
    private MetricFactory metrics;
    private AggregateStore aggregates;

    @BeforeEach
    void setUp() {
        eventStore = spy(new InMemoryEventStore(OrderFixtures.serializer()));
        buffer = new DomainEventsBuffer();
        metrics = MetricFactory.detached("test");
        aggregates = new EventSourcedAggregateStore(eventStore, OrderFixtures.aggregateFactory(), buffer, metrics);
    }

    private List<StreamEventEnvelope<?>> stream(String streamId) {
        return StreamSupport.stream(eventStore.readStream(streamId).spliterator(), false)
                .collect(Collectors.toList());
    }

    @Nested
    @DisplayName("new aggregate")
    class NewAggregate {

        @Test
        @DisplayName("get on an empty store is empty")
        void getMissing() {
            assertThat(aggregates.get(Order.class, "1")).isEmpty();
            assertThat(aggregates.exists(Order.class, "1")).isFalse();
        }

        @Test
        @DisplayName("store with NoStream yields version 0 and get reloads it at version 0")
        void storeThenGet() {
            Order order = Order.create("1", "alice", 1250);

            AppendResult result = aggregates.store(order, ExpectedStreamVersion.NO_STREAM);

            assertThat(result.nextExpectedVersion()).isZero();
            assertThat(order.originalVersion()).isZero();
            assertThat(order.hasUncommittedEvents()).isFalse();

            Order loaded = aggregates.get(Order.class, "1").orElseThrow();
            assertThat(loaded.originalVersion()).isZero();
            assertThat(loaded.status()).isEqualTo(Order.Status.CREATED);
            assertThat(loaded.customer()).isEqualTo("alice");
            assertThat(aggregates.exists(Order.class, "1")).isTrue();
        }

        @Test
        @DisplayName("round trip reproduces the state before store")
        void roundTrip() {
            Order order = Order.create("7", "bob", 999);
            order.cancel("duplicate order");
            aggregates.store(order);

            Order loaded = aggregates.get(Order.class, "7").orElseThrow();

            assertThat(loaded.id()).isEqualTo(order.id());
            assertThat(loaded.status()).isEqualTo(order.status());
            assertThat(loaded.customer()).isEqualTo(order.customer());
            assertThat(loaded.totalCents()).isEqualTo(order.totalCents());
            assertThat(loaded.cancelReason()).isEqualTo(order.cancelReason());
            assertThat(loaded.originalVersion()).isEqualTo(order.originalVersion()).isEqualTo(1);
        }

        @Test
        @DisplayName("stamps events with the aggregate id and contiguous sequence numbers")
        void stamping() {
            Order order = Order.create("1", "alice", 100);
            aggregates.store(order);
            order.ship("TRK");
            aggregates.store(order);

            List<StreamEventEnvelope<?>> events = stream("Order-1");

            assertThat(events).extracting(e -> e.metadata().streamPosition()).containsExactly(0L, 1L);
            assertThat(events).extracting(e -> e.metadata().aggregateId()).containsOnly("1");
        }
    }

    @Nested
    @DisplayName("conflicting update")
    class ConflictingUpdate {

        @Test
        @DisplayName("the second writer at the same version fails and its events are not applied")
        void secondWriterFails() {
            aggregates.store(Order.create("1", "alice", 100));
            Order handleA = aggregates.get(Order.class, "1").orElseThrow();
            Order handleB = aggregates.get(Order.class, "1").orElseThrow();

            handleA.ship("TRK-A");
            AppendResult resultA = aggregates.store(handleA);
            handleB.cancel("too slow");

            assertThat(resultA.nextExpectedVersion()).isEqualTo(1);
            assertThatThrownBy(() -> aggregates.store(handleB))
                    .isInstanceOfSatisfying(WrongExpectedVersionException.class, e -> {
                        assertThat(e.expectedVersion()).isEqualTo(ExpectedStreamVersion.of(0));
                        assertThat(e.actualVersion()).isEqualTo(1);
                    });

            List<StreamEventEnvelope<?>> events = stream("Order-1");
            assertThat(events).hasSize(2);
            assertThat(events.get(1).payload()).isInstanceOf(OrderShipped.class);
            assertThat(events).noneMatch(e -> e.payload() instanceof OrderCancelled);
            assertThat(handleB.hasUncommittedEvents()).isTrue();
            assertThat(handleB.originalVersion()).isZero();
        }

        @Test
        @DisplayName("a handle that lost the race must be reloaded before storing again")
        void staleHandleRefused() {
            aggregates.store(Order.create("1", "alice", 100));
            Order handleA = aggregates.get(Order.class, "1").orElseThrow();
            Order handleB = aggregates.get(Order.class, "1").orElseThrow();
            handleA.ship("TRK-A");
            aggregates.store(handleA);
            handleB.cancel("late");
            assertThatThrownBy(() -> aggregates.store(handleB)).isInstanceOf(WrongExpectedVersionException.class);

            assertThatThrownBy(() -> aggregates.store(handleB, ExpectedStreamVersion.ANY))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("reloaded");

            Order reloaded = aggregates.get(Order.class, "1").orElseThrow();
            assertThat(reloaded.originalVersion()).isEqualTo(1);
            assertThat(reloaded.isStale()).isFalse();
        }

        @Test
        @DisplayName("conflicts are counted")
        void conflictsCounted() {
            aggregates.store(Order.create("1", "alice", 100));
            Order stale = Order.create("1", "alice", 100);

            assertThatThrownBy(() -> aggregates.store(stale)).isInstanceOf(WrongExpectedVersionException.class);

            assertThat(metrics.registry().get("strata.aggregates.appends").tag("outcome", "conflict")
                    .counter().count()).isEqualTo(1.0);
            assertThat(metrics.registry().get("strata.aggregates.appends").tag("outcome", "success")
                    .counter().count()).isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("after a successful store")
    class AfterStore {

        @Test
        @DisplayName("committed envelopes are buffered with their assigned positions")
        void bufferedForPublication() {
            aggregates.store(Order.create("1", "alice", 100));
            Order order = Order.create("2", "bob", 200);
            order.ship("TRK-2");
            aggregates.store(order);

            List<StreamEventEnvelope<?>> drained = buffer.drain();

            assertThat(drained).hasSize(3);
            assertThat(drained).extracting(e -> e.metadata().logPosition()).containsExactly(0L, 1L, 2L);
            assertThat(drained).extracting(e -> e.metadata().streamPosition()).containsExactly(0L, 0L, 1L);
            assertThat(buffer.isEmpty()).isTrue();
        }

        @Test
        @DisplayName("commit is called on the event store")
        void commitCalled() {
            aggregates.store(Order.create("1", "alice", 100));

            verify(eventStore).commit();
        }

        @Test
        @DisplayName("storing without pending events appends nothing")
        void nothingToStore() {
            Order order = Order.create("1", "alice", 100);
            aggregates.store(order);

            AppendResult result = aggregates.store(order);

            assertThat(result).isEqualTo(AppendResult.unchanged(0));
            verify(eventStore).appendEvents(anyString(), anyList(), any());
        }
    }

    @Nested
    @DisplayName("scoped to a unit of work")
    class Scoped {

        private AggregateStore scoped;

        @BeforeEach
        void setUp() {
            scoped = EventSourcedAggregateStore.scoped(eventStore, OrderFixtures.aggregateFactory(), metrics);
        }

        @Test
        @DisplayName("a unit of work hands back exactly the events it committed")
        void collectsPerUnitOfWork() {
            var first = DomainEventsScope.run(() -> scoped.store(Order.create("1", "alice", 100)));
            var second = DomainEventsScope.run(() -> {
                Order order = Order.create("2", "bob", 200);
                order.ship("TRK-2");
                return scoped.store(order);
            });

            assertThat(first.events()).extracting(e -> e.metadata().logPosition()).containsExactly(0L);
            assertThat(second.events()).extracting(e -> e.metadata().logPosition()).containsExactly(1L, 2L);
            assertThat(second.result().nextExpectedVersion()).isEqualTo(1L);
            assertThat(DomainEventsScope.current()).isEmpty();
        }

        @Test
        @DisplayName("stores outside a unit of work retain nothing however many there are")
        void nothingRetainedOutsideScope() {
            for (int i = 0; i < 100; i++) {
                scoped.store(Order.create("order" + i, "alice", 100));
            }

            var next = DomainEventsScope.run(() -> scoped.store(Order.create("last", "bob", 1)));

            assertThat(next.events()).hasSize(1);
            assertThat(stream("Order-order99")).hasSize(1);
        }

        @Test
        @DisplayName("the buffer is unbound when the work fails")
        void unboundOnFailure() {
            Order stale = Order.create("1", "alice", 100);
            scoped.store(Order.create("1", "bob", 100));

            assertThatThrownBy(() -> DomainEventsScope.run(() -> scoped.store(stale, ExpectedStreamVersion.NO_STREAM)))
                    .isInstanceOf(WrongExpectedVersionException.class);
            assertThat(DomainEventsScope.current()).isEmpty();
        }

        @Test
        @DisplayName("units of work do not nest")
        void noNesting() {
            assertThatThrownBy(() -> DomainEventsScope.run(() -> DomainEventsScope.run(() -> 1)))
                    .isInstanceOf(IllegalStateException.class);
            assertThat(DomainEventsScope.current()).isEmpty();
        }
    }

    @Nested
    @DisplayName("validation")
    class Validation {

        @Test
        @DisplayName("blank ids fail before any read")
        void blankId() {
            assertThatThrownBy(() -> aggregates.get(Order.class, " ")).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> aggregates.store(new Order())).isInstanceOf(IllegalArgumentException.class);

            verify(eventStore, never()).readStream(anyString(), any(StreamReadPosition.class), anyInt());
        }

        @Test
        @DisplayName("unregistered aggregate types are rejected")
        void unregisteredType() {
            var bare = new EventSourcedAggregateStore(eventStore, new AggregateFactory(), buffer);

            assertThatThrownBy(() -> bare.get(Order.class, "1"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining(Order.class.getName());
        }

        @Test
        @DisplayName("aggregates loaded are counted")
        void loadsCounted() {
            aggregates.store(Order.create("1", "alice", 100));
            Optional<Order> loaded = aggregates.get(Order.class, "1");

            assertThat(loaded).isPresent();
            assertThat(metrics.registry().get("strata.aggregates.loaded").counter().count()).isEqualTo(1.0);
        }
    }
}
