package com.strata.eventhost.config;

import com.strata.eventmodel.EventSerializer;
import com.strata.eventmodel.EventTypeRegistry;
import com.strata.eventstore.aggregate.AggregateFactory;
import com.strata.eventstore.aggregate.AggregateStore;
import com.strata.eventstore.aggregate.EventSourcedAggregateStore;
import com.strata.eventstore.jdbc.EventStoreSchemaMigrator;
import com.strata.eventstore.jdbc.JdbcEventStore;
import com.strata.observability.ComponentHealth;
import com.strata.observability.HealthCheckRegistry;
import com.strata.observability.MetricFactory;
import com.strata.observability.SpanHelper;
import com.strata.subscription.checkpoint.CheckpointStored;
import com.strata.subscription.checkpoint.EventStoreSubscriptionCheckpointRepository;
import com.strata.subscription.checkpoint.SubscriptionCheckpointRepository;
import com.strata.subscription.publish.InProcessEventBus;
import com.strata.subscription.publish.InternalEventBus;
import com.strata.subscription.publish.ProjectionPublisher;
import com.strata.subscription.publish.ReadProjection;
import com.strata.subscription.publish.ReadProjectionPublisher;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Wires the JDBC event store, the aggregate store and the in-process consumers. */
@Configuration(proxyBeanMethods = false)
public class EventStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(EventStoreConfig.class);

    static final String EVENT_STORE_HEALTH = "event-store";

    @Bean
    public MetricFactory metricFactory(MeterRegistry meterRegistry, EventHostProperties properties) {
        return new MetricFactory(meterRegistry, properties.serviceName());
    }

    @Bean
    public SpanHelper spanHelper() {
        return new SpanHelper(GlobalOpenTelemetry.getTracer("strata-event-host"));
    }

    @Bean
    public EventTypeRegistry eventTypeRegistry(ObjectProvider<EventSourcingModule> modules) {
        EventTypeRegistry registry = new EventTypeRegistry().register(CheckpointStored.class);
        modules.orderedStream().forEach(module -> module.registerEventTypes(registry));
        log.info("Registered {} event types", registry.size());
        return registry;
    }

    @Bean
    public EventSerializer eventSerializer(EventTypeRegistry registry) {
        return new EventSerializer(registry);
    }

    @Bean
    public EventStoreSchemaMigrator eventStoreSchemaMigrator(DataSource dataSource) {
        return new EventStoreSchemaMigrator(dataSource);
    }

    @Bean
    public JdbcEventStore eventStore(
            DataSource dataSource,
            EventSerializer serializer,
            EventStoreSchemaMigrator migrator,
            EventHostProperties properties) {
        if (properties.migrateOnStartup()) {
            int applied = migrator.migrate();
            log.info("Event store schema migrated, {} migration(s) applied", applied);
        }
        return new JdbcEventStore(dataSource, serializer, Clock.systemUTC(), properties.readPageSize());
    }

    @Bean
    public AggregateFactory aggregateFactory(ObjectProvider<EventSourcingModule> modules) {
        AggregateFactory factory = new AggregateFactory();
        modules.orderedStream().forEach(module -> module.registerAggregates(factory));
        return factory;
    }

    /** Committed events are buffered per unit of work; see {@code DomainEventsScope}. */
    @Bean
    public AggregateStore aggregateStore(
            JdbcEventStore eventStore, AggregateFactory aggregateFactory, MetricFactory metricFactory) {
        return EventSourcedAggregateStore.scoped(eventStore, aggregateFactory, metricFactory);
    }

    @Bean
    public SubscriptionCheckpointRepository subscriptionCheckpointRepository(JdbcEventStore eventStore) {
        return new EventStoreSubscriptionCheckpointRepository(eventStore);
    }

    @Bean
    public InternalEventBus internalEventBus(ObjectProvider<EventSourcingModule> modules) {
        InProcessEventBus bus = new InProcessEventBus();
        modules.orderedStream().forEach(module -> module.registerHandlers(bus));
        return bus;
    }

    @Bean
    public ReadProjectionPublisher readProjectionPublisher(ObjectProvider<EventSourcingModule> modules) {
        List<ReadProjection> projections = modules.orderedStream()
                .flatMap(module -> module.projections().stream())
                .toList();
        log.info("Publishing to {} read projection(s)", projections.size());
        return new ProjectionPublisher(projections);
    }

    @Bean
    public HealthCheckRegistry healthCheckRegistry(JdbcEventStore eventStore) {
        HealthCheckRegistry registry = new HealthCheckRegistry();
        registry.register(EVENT_STORE_HEALTH, () -> CompletableFuture.supplyAsync(() -> {
            long start = System.nanoTime();
            long head = eventStore.lastGlobalPosition();
            long latencyMs = (System.nanoTime() - start) / 1_000_000;
            return ComponentHealth.healthy(EVENT_STORE_HEALTH, latencyMs).withDetails(Map.of("head", head));
        }));
        return registry;
    }
}
