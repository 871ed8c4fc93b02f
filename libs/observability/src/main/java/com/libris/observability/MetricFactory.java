package com.libris.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

/**
 * Builds Micrometer meters tagged {@code service=<name>}, so the catalog's counters and timers are
 * told apart on a shared Prometheus.
 *
 * <p>The registry deduplicates meters: the same name and tags always yield the same instance.
 */
public final class MetricFactory {

    public static final String TAG_SERVICE = "service";

    private final MeterRegistry registry;
    private final Tags serviceTags;

    /**
     * @throws IllegalArgumentException if {@code registry} is null or {@code serviceName} blank
     */
    public MetricFactory(MeterRegistry registry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.registry = registry;
        this.serviceTags = Tags.of(TAG_SERVICE, serviceName);
    }

    /**
     * @param tags extra tags as alternating keys and values
     */
    public Counter counter(String name, String description, String... tags) {
        return Counter.builder(name).description(description).tags(serviceTags.and(tags)).register(registry);
    }

    /**
     * @param tags extra tags as alternating keys and values
     */
    public Timer timer(String name, String description, String... tags) {
        return Timer.builder(name).description(description).tags(serviceTags.and(tags)).register(registry);
    }
}
