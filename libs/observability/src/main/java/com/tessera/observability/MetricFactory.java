package com.tessera.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

/**
 * Factory for Micrometer meters that carry a {@code component} tag.
 *
 * <p>Every meter created through this factory is tagged with the component that owns it (for
 * example {@code permission-evaluator}), so dashboards can split authorization metrics by
 * subsystem. Registering the same name and tags twice returns the existing meter.
 */
public final class MetricFactory {

    /** Tag key for the owning component. */
    public static final String TAG_COMPONENT = "component";

    /** Common prefix of every Tessera metric name. */
    public static final String METRIC_PREFIX = "tessera.";

    private final MeterRegistry registry;
    private final String component;

    /**
     * Creates a MetricFactory bound to the given registry and component.
     *
     * @param registry  the Micrometer meter registry
     * @param component logical component name included as a default tag
     */
    public MetricFactory(MeterRegistry registry, String component) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (component == null || component.isBlank()) {
            throw new IllegalArgumentException("component must not be null or blank");
        }
        this.registry = registry;
        this.component = component;
    }

    /**
     * A factory backed by a private {@link SimpleMeterRegistry}, for callers that do not export
     * metrics.
     */
    public static MetricFactory standalone(String component) {
        return new MetricFactory(new SimpleMeterRegistry(), component);
    }

    /**
     * Creates (or looks up) a counter.
     *
     * @param name        metric name without the {@code tessera.} prefix (e.g., "permission.checks")
     * @param description human-readable description
     * @param tags        additional tags as key-value pairs
     * @return the counter
     */
    public Counter counter(String name, String description, String... tags) {
        return Counter.builder(METRIC_PREFIX + name)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
    }

    /**
     * Creates (or looks up) a timer.
     *
     * @param name        metric name without the {@code tessera.} prefix
     * @param description human-readable description
     * @param tags        additional tags as key-value pairs
     * @return the timer
     */
    public Timer timer(String name, String description, String... tags) {
        return Timer.builder(METRIC_PREFIX + name)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
    }

    /** Returns the underlying meter registry. */
    public MeterRegistry registry() {
        return registry;
    }

    /** Returns the component name used as a default tag. */
    public String component() {
        return component;
    }

    private Tags baseTags(String... extraTags) {
        Tags tags = Tags.of(TAG_COMPONENT, component);
        if (extraTags.length > 0) {
            tags = tags.and(extraTags);
        }
        return tags;
    }
}
