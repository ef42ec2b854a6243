package com.strata.eventhost.config;

import com.strata.eventhost.lifecycle.SubscriptionWorkerLifecycle;
import com.strata.eventmodel.EventSerializer;
import com.strata.eventstore.jdbc.JdbcEventStore;
import com.strata.observability.HealthCheckRegistry;
import com.strata.observability.MetricFactory;
import com.strata.observability.SpanHelper;
import com.strata.subscription.SubscribeToAllWorker;
import com.strata.subscription.checkpoint.SubscriptionCheckpointRepository;
import com.strata.subscription.publish.InternalEventBus;
import com.strata.subscription.publish.ReadProjectionPublisher;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Runs the catch-up subscription unless {@code strata.event-store.subscription.enabled=false}. */
@Configuration(proxyBeanMethods = false)
@ConditionalOnProperty(prefix = "strata.event-store.subscription", name = "enabled", havingValue = "true",
        matchIfMissing = true)
public class SubscriptionConfig {

    @Bean
    public SubscriptionWorkerLifecycle subscriptionWorkerLifecycle(
            EventHostProperties properties,
            JdbcEventStore eventStore,
            EventSerializer serializer,
            SubscriptionCheckpointRepository checkpoints,
            InternalEventBus eventBus,
            ReadProjectionPublisher projections,
            MetricFactory metricFactory,
            SpanHelper spanHelper,
            HealthCheckRegistry healthCheckRegistry) {
        var options = properties.subscription().toOptions();
        return new SubscriptionWorkerLifecycle(
                () -> new SubscribeToAllWorker(options, eventStore, serializer, checkpoints, eventBus, projections,
                        metricFactory, spanHelper),
                eventStore,
                healthCheckRegistry);
    }
}
