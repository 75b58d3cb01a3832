package com.ivamare.eventstore.worker.impl;

import com.ivamare.eventstore.context.OperationContext;
import com.ivamare.eventstore.exception.DatabaseExceptionClassifier;
import com.ivamare.eventstore.worker.Worker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs a task on a dedicated daemon thread, once per interval.
 *
 * <p>The first run happens one interval after {@link #start()}. A failing
 * iteration is logged and the loop carries on; the next tick retries.
 * The loop exits when stopped or when the parent context is done.
 */
public class PeriodicWorker implements Worker {

    private static final Logger log = LoggerFactory.getLogger(PeriodicWorker.class);

    /**
     * Consecutive failures at which iteration errors are logged at error level.
     */
    static final int ERROR_THRESHOLD = 5;

    /**
     * One iteration of a periodic loop.
     */
    @FunctionalInterface
    public interface Task {
        void run(OperationContext ctx) throws Exception;
    }

    private final String name;
    private final Duration interval;
    private final Task task;
    private final OperationContext context;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private final AtomicInteger consecutiveErrors = new AtomicInteger(0);
    private final AtomicLong iterations = new AtomicLong(0);
    private final CountDownLatch stopSignal = new CountDownLatch(1);

    private volatile ExecutorService executor;

    /**
     * Creates a worker whose loop ends only when stopped.
     *
     * @param name Worker name
     * @param interval Delay between iterations
     * @param task Work done each iteration
     */
    public PeriodicWorker(String name, Duration interval, Task task) {
        this(name, interval, task, OperationContext.background());
    }

    /**
     * Creates a worker whose loop also ends when {@code parent} is done.
     *
     * @param name Worker name
     * @param interval Delay between iterations
     * @param task Work done each iteration
     * @param parent Context the loop context is derived from
     */
    public PeriodicWorker(String name, Duration interval, Task task, OperationContext parent) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive, got " + interval);
        }
        this.name = name;
        this.interval = interval;
        this.task = task;
        this.context = OperationContext.withCancel(parent);
    }

    @Override
    public void start() {
        if (stopped.get()) {
            log.warn("Worker {} already stopped, not restarting", name);
            return;
        }
        if (running.getAndSet(true)) {
            log.warn("Worker {} already running", name);
            return;
        }

        executor = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, name);
            thread.setDaemon(true);
            return thread;
        });

        log.debug("Starting worker {} (interval={})", name, interval);
        executor.submit(this::runLoop);
    }

    @Override
    public CompletableFuture<Void> stop(Duration timeout) {
        if (!signalStop()) {
            return CompletableFuture.completedFuture(null);
        }

        ExecutorService current = executor;
        if (current == null) {
            return CompletableFuture.completedFuture(null);
        }

        return CompletableFuture.runAsync(() -> {
            current.shutdown();
            try {
                if (!current.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("Worker {} did not stop within {}, interrupting", name, timeout);
                    current.shutdownNow();
                }
            } catch (InterruptedException e) {
                current.shutdownNow();
                Thread.currentThread().interrupt();
            }
            log.debug("Worker {} stopped", name);
        });
    }

    @Override
    public void stopNow() {
        signalStop();
        ExecutorService current = executor;
        if (current != null) {
            current.shutdownNow();
        }
    }

    @Override
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        ExecutorService current = executor;
        if (current == null) {
            return true;
        }
        return current.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public boolean isRunning() {
        return running.get() && !context.isDone();
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public long iterationCount() {
        return iterations.get();
    }

    @Override
    public int getConsecutiveErrorCount() {
        return consecutiveErrors.get();
    }

    /**
     * Context handed to each iteration. Canceled when the worker stops.
     */
    public OperationContext context() {
        return context;
    }

    private boolean signalStop() {
        if (stopped.getAndSet(true)) {
            return false;
        }
        context.cancel();
        stopSignal.countDown();
        return true;
    }

    // --- Main Loop ---

    private void runLoop() {
        try {
            while (!context.isDone()) {
                if (stopSignal.await(interval.toMillis(), TimeUnit.MILLISECONDS)) {
                    return;
                }
                if (context.isDone()) {
                    return;
                }
                runOnce();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            running.set(false);
            log.debug("Worker loop ended for {}", name);
        }
    }

    private void runOnce() {
        try {
            task.run(context);
            consecutiveErrors.set(0);
        } catch (Exception e) {
            if (context.isDone()) {
                log.debug("Worker {} iteration aborted by shutdown: {}", name, e.getMessage());
                return;
            }
            int errors = consecutiveErrors.incrementAndGet();
            logIterationError(errors, e);
        } finally {
            iterations.incrementAndGet();
        }
    }

    private void logIterationError(int errorCount, Exception e) {
        if (DatabaseExceptionClassifier.isTransient(e) && errorCount < ERROR_THRESHOLD) {
            log.warn("Worker {} transient error (count={}, reason={}), retrying next tick: {}",
                name, errorCount, DatabaseExceptionClassifier.getTransientReason(e), e.getMessage());
        } else {
            log.error("Worker {} iteration failed (count={}), retrying next tick", name, errorCount, e);
        }
    }
}
