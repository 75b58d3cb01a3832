package com.ivamare.eventstore.metrics;

import java.time.Instant;
import java.util.Set;

/**
 * Filters for {@link MetricsStore#read}.
 *
 * @param since Inclusive lower bound on collection time (nullable, no bound when null)
 * @param components Components to include (empty means all)
 */
public record MetricsReadOptions(Instant since, Set<String> components) {

    private static final MetricsReadOptions ALL = new MetricsReadOptions(null, Set.of());

    public MetricsReadOptions {
        components = components != null ? Set.copyOf(components) : Set.of();
    }

    public static MetricsReadOptions all() {
        return ALL;
    }

    public static MetricsReadOptions since(Instant since) {
        return new MetricsReadOptions(since, Set.of());
    }

    public MetricsReadOptions withComponents(String... newComponents) {
        return new MetricsReadOptions(since, Set.of(newComponents));
    }
}
