package com.ivamare.eventstore.metrics;

import com.ivamare.eventstore.context.OperationContext;
import com.ivamare.eventstore.model.Metric;

import java.time.Instant;
import java.util.List;

/**
 * Append-only store for metric samples. Implementations must allow
 * record, read and purge to run concurrently.
 */
public interface MetricsStore {

    /**
     * Append samples.
     *
     * @param ctx operation context
     * @param metrics samples to append
     */
    void record(OperationContext ctx, List<Metric> metrics);

    /**
     * Read samples matching the options, oldest first.
     *
     * @param ctx operation context
     * @param options filters
     * @return matching samples, possibly empty
     */
    List<Metric> read(OperationContext ctx, MetricsReadOptions options);

    /**
     * Delete samples collected strictly before {@code before}.
     *
     * @param ctx operation context
     * @param before exclusive cutoff
     * @return number of deleted samples
     */
    int purge(OperationContext ctx, Instant before);
}
