package com.ivamare.eventstore.api;

import com.ivamare.eventstore.context.OperationContext;
import com.ivamare.eventstore.model.Event;

import java.time.Instant;
import java.util.List;

/**
 * A retention-scoped collection of events, backed by one table.
 *
 * <p>Every operation fails with
 * {@link com.ivamare.eventstore.exception.OperationCanceledException} when
 * its context is already canceled or past its deadline. Engine failures
 * surface as {@link com.ivamare.eventstore.exception.StoreOperationException}.
 */
public interface Bucket extends AutoCloseable {

    /**
     * Physical table name.
     *
     * @return table name
     */
    String name();

    /**
     * Append one event. Does not deduplicate; call {@link #find} first for
     * at-most-once semantics.
     *
     * @param ctx operation context
     * @param event event to store
     */
    void insert(OperationContext ctx, Event event);

    /**
     * Find a stored event with the same time, name and type. A non-empty search
     * message and non-null search suggested actions must match exactly too.
     * Extra info must always match: same keys with identical values.
     *
     * @param ctx operation context
     * @param event search event
     * @return the first matching event in engine scan order, or null
     */
    Event find(OperationContext ctx, Event event);

    /**
     * Get events strictly newer than {@code since}, newest first.
     *
     * @param ctx operation context
     * @param since exclusive lower bound, compared at second precision
     * @return events, or null when none qualify
     * @throws com.ivamare.eventstore.exception.PayloadDecodingException if any row holds a malformed payload
     */
    default List<Event> get(OperationContext ctx, Instant since) {
        return get(ctx, since.getEpochSecond());
    }

    /**
     * Get events with a timestamp strictly greater than {@code sinceUnixSeconds},
     * newest first. Accepts the full signed 64-bit range, so
     * {@link Long#MIN_VALUE} selects every event.
     *
     * @param ctx operation context
     * @param sinceUnixSeconds exclusive lower bound in Unix seconds
     * @return events, or null when none qualify
     * @throws com.ivamare.eventstore.exception.PayloadDecodingException if any row holds a malformed payload
     */
    List<Event> get(OperationContext ctx, long sinceUnixSeconds);

    /**
     * Get the most recent event.
     *
     * @param ctx operation context
     * @return newest event, or null if the bucket is empty
     */
    Event latest(OperationContext ctx);

    /**
     * Delete events with a timestamp strictly before the cutoff.
     *
     * @param ctx operation context
     * @param beforeUnixSeconds exclusive cutoff in Unix seconds
     * @return number of deleted events
     */
    int purge(OperationContext ctx, long beforeUnixSeconds);

    /**
     * Stop the background purge loop. Data is kept. Idempotent.
     */
    @Override
    void close();
}
