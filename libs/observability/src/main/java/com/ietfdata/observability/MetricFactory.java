package com.ietfdata.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

/**
 * Factory for Micrometer meters that carry a {@code client} tag.
 * <p>
 * Several clients (for example one per configured base URL) can share a registry and still be
 * told apart. Meters are registered lazily; asking twice for the same name and tags returns the
 * same meter.
 */
public final class MetricFactory {

    /** Tag key identifying the client instance. */
    public static final String TAG_CLIENT = "client";

    private final MeterRegistry registry;
    private final String clientName;

    /**
     * Creates a MetricFactory bound to the given registry and client name.
     *
     * @param registry   the Micrometer meter registry
     * @param clientName logical client name included as a default tag
     */
    public MetricFactory(MeterRegistry registry, String clientName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (clientName == null || clientName.isBlank()) {
            throw new IllegalArgumentException("clientName must not be null or blank");
        }
        this.registry = registry;
        this.clientName = clientName;
    }

    /**
     * Creates a factory on Micrometer's global registry, which discards measurements until a
     * concrete registry is added to it.
     */
    public static MetricFactory global(String clientName) {
        return new MetricFactory(Metrics.globalRegistry, clientName);
    }

    /**
     * Creates or looks up a counter with the client tag.
     *
     * @param name        metric name (e.g., "datatracker.pages")
     * @param description human-readable description
     * @param tags        additional tags (key-value pairs)
     * @return the counter
     */
    public Counter counter(String name, String description, String... tags) {
        return Counter.builder(name)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
    }

    /**
     * Creates or looks up a timer with the client tag.
     *
     * @param name        metric name (e.g., "datatracker.fetch")
     * @param description human-readable description
     * @param tags        additional tags (key-value pairs)
     * @return the timer
     */
    public Timer timer(String name, String description, String... tags) {
        return Timer.builder(name)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
    }

    /**
     * Returns the underlying meter registry.
     */
    public MeterRegistry registry() {
        return registry;
    }

    public String clientName() {
        return clientName;
    }

    private Tags baseTags(String... extraTags) {
        Tags tags = Tags.of(TAG_CLIENT, clientName);
        if (extraTags.length > 0) {
            tags = tags.and(extraTags);
        }
        return tags;
    }
}
