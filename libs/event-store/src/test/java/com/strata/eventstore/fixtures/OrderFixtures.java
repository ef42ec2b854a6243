package com.strata.eventstore.fixtures;

import com.strata.eventmodel.EventSerializer;
import com.strata.eventmodel.EventTypeRegistry;
import com.strata.eventmodel.StreamEventEnvelope;
import com.strata.eventstore.aggregate.AggregateFactory;
import com.strata.eventstore.fixtures.OrderEvent.OrderCancelled;
import com.strata.eventstore.fixtures.OrderEvent.OrderCreated;
import com.strata.eventstore.fixtures.OrderEvent.OrderShipped;

/** Registries and sample envelopes for the {@link Order} aggregate. */
public final class OrderFixtures {

    private OrderFixtures() {}

    public static EventTypeRegistry registry() {
        return new EventTypeRegistry()
                .register(OrderCreated.class)
                .register(OrderShipped.class)
                .register(OrderCancelled.class);
    }

    public static EventSerializer serializer() {
        return new EventSerializer(registry());
    }

    public static AggregateFactory aggregateFactory() {
        return new AggregateFactory().register(Order.class, Order::new);
    }

    public static StreamEventEnvelope<OrderCreated> created(String orderId) {
        return StreamEventEnvelope.of(new OrderCreated(OrderEvent.newEventId(), orderId, "alice", 1250));
    }

    public static StreamEventEnvelope<OrderShipped> shipped(String orderId) {
        return StreamEventEnvelope.of(new OrderShipped(OrderEvent.newEventId(), orderId, "TRK-" + orderId));
    }

    public static StreamEventEnvelope<OrderCancelled> cancelled(String orderId) {
        return StreamEventEnvelope.of(new OrderCancelled(OrderEvent.newEventId(), orderId, "changed mind"));
    }
}
