package com.ivamare.eventstore.context;

import com.ivamare.eventstore.exception.OperationCanceledException;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation and deadline carrier passed to every store operation.
 *
 * <p>Contexts form a tree: a child is done as soon as its own cancel flag is
 * set, its deadline passes, or its parent is done. Operations call
 * {@link #checkActive(String)} before touching the database and use
 * {@link #queryTimeoutSeconds()} to bound the statement itself.
 *
 * <p>Example:
 * <pre>
 * OperationContext ctx = OperationContext.withTimeout(Duration.ofSeconds(10));
 * bucket.insert(ctx, event);
 * </pre>
 */
public final class OperationContext {

    private static final OperationContext BACKGROUND = new OperationContext(null, null);

    private final OperationContext parent;
    private final Instant deadline;
    private final AtomicBoolean canceled = new AtomicBoolean(false);

    private OperationContext(OperationContext parent, Instant deadline) {
        this.parent = parent;
        this.deadline = deadline;
    }

    /**
     * Root context that is never canceled and has no deadline.
     */
    public static OperationContext background() {
        return BACKGROUND;
    }

    public static OperationContext withTimeout(Duration timeout) {
        return withDeadline(BACKGROUND, Instant.now().plus(timeout));
    }

    public static OperationContext withTimeout(OperationContext parent, Duration timeout) {
        return withDeadline(parent, Instant.now().plus(timeout));
    }

    public static OperationContext withDeadline(OperationContext parent, Instant deadline) {
        return new OperationContext(parent, deadline);
    }

    /**
     * Cancelable child of {@code parent} without its own deadline.
     */
    public static OperationContext withCancel(OperationContext parent) {
        return new OperationContext(parent, null);
    }

    /**
     * Cancel this context and every context derived from it. Idempotent.
     * The background context cannot be canceled.
     */
    public void cancel() {
        if (this != BACKGROUND) {
            canceled.set(true);
        }
    }

    public boolean isCanceled() {
        return canceled.get() || (parent != null && parent.isCanceled());
    }

    public boolean isDeadlineExceeded() {
        return effectiveDeadline().map(d -> !Instant.now().isBefore(d)).orElse(false);
    }

    public boolean isDone() {
        return isCanceled() || isDeadlineExceeded();
    }

    /**
     * Earliest deadline along the parent chain.
     */
    public Optional<Instant> effectiveDeadline() {
        Optional<Instant> inherited = parent != null ? parent.effectiveDeadline() : Optional.empty();
        if (deadline == null) {
            return inherited;
        }
        return inherited.filter(d -> d.isBefore(deadline)).or(() -> Optional.of(deadline));
    }

    /**
     * Time left before the deadline, empty if there is none.
     */
    public Optional<Duration> remaining() {
        return effectiveDeadline().map(d -> Duration.between(Instant.now(), d));
    }

    /**
     * JDBC query timeout derived from the deadline: 0 (no limit) when there is
     * no deadline, otherwise the remaining time rounded up to whole seconds.
     */
    public int queryTimeoutSeconds() {
        return remaining()
            .map(r -> (int) Math.max(1, Math.min(Integer.MAX_VALUE, (r.toMillis() + 999) / 1000)))
            .orElse(0);
    }

    /**
     * Fail fast if this context can no longer be used.
     *
     * @param operation operation name for the error message
     * @throws OperationCanceledException if canceled or past the deadline
     */
    public void checkActive(String operation) {
        if (isCanceled()) {
            throw new OperationCanceledException(operation + ": context canceled", false);
        }
        if (isDeadlineExceeded()) {
            throw new OperationCanceledException(operation + ": context deadline exceeded", true);
        }
    }
}
