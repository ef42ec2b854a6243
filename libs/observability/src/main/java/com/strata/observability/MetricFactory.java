package com.strata.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Creates Micrometer meters that all carry a {@code service} tag.
 *
 * <p>Meter names follow the {@code strata.<component>.<measure>} convention, e.g.
 * {@code strata.eventstore.appends} or {@code strata.subscription.delivered}. Registering the same
 * name and tags twice returns the existing meter.
 */
public final class MetricFactory {

    /** Tag key for the service name. */
    public static final String TAG_SERVICE = "service";

    private final MeterRegistry registry;
    private final String serviceName;

    /**
     * @param registry the meter registry (Prometheus in production, {@link SimpleMeterRegistry} in tests)
     * @param serviceName value of the {@code service} tag
     */
    public MetricFactory(MeterRegistry registry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.registry = registry;
        this.serviceName = serviceName;
    }

    /**
     * A factory backed by a private {@link SimpleMeterRegistry}, for components constructed without
     * an explicit registry.
     */
    public static MetricFactory detached(String serviceName) {
        return new MetricFactory(new SimpleMeterRegistry(), serviceName);
    }

    public Counter counter(String name, String description, String... tags) {
        return Counter.builder(name)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
    }

    public Timer timer(String name, String description, String... tags) {
        return Timer.builder(name)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
    }

    /**
     * Registers a gauge that reads the returned {@link AtomicLong}.
     *
     * @return the holder to update; the gauge keeps a strong reference to it
     */
    public AtomicLong gauge(String name, String description, String... tags) {
        AtomicLong value = new AtomicLong();
        Gauge.builder(name, value, AtomicLong::doubleValue)
                .strongReference(true)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
        return value;
    }

    public MeterRegistry registry() {
        return registry;
    }

    public String serviceName() {
        return serviceName;
    }

    private Tags baseTags(String... extraTags) {
        Tags tags = Tags.of(TAG_SERVICE, serviceName);
        if (extraTags.length > 0) {
            tags = tags.and(extraTags);
        }
        return tags;
    }
}
