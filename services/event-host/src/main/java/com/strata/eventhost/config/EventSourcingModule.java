package com.strata.eventhost.config;

import com.strata.eventmodel.EventTypeRegistry;
import com.strata.eventstore.aggregate.AggregateFactory;
import com.strata.subscription.publish.InternalEventBus;
import com.strata.subscription.publish.ReadProjection;
import java.util.List;

/**
 * Contributes a bounded context to the host. Every bean of this type is applied once at startup,
 * before the subscription worker starts.
 */
public interface EventSourcingModule {

    default void registerEventTypes(EventTypeRegistry registry) {}

    default void registerAggregates(AggregateFactory factory) {}

    default void registerHandlers(InternalEventBus eventBus) {}

    default List<ReadProjection> projections() {
        return List.of();
    }
}
