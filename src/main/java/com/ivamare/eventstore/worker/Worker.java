package com.ivamare.eventstore.worker;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Handle for a background loop owned by a bucket or syncer.
 *
 * <p>Example:
 * <pre>
 * Worker worker = new PeriodicWorker("purge-components_cpu_events_v0_4_0",
 *     Duration.ofMinutes(5), ctx -&gt; bucket.purge(ctx, cutoff()));
 *
 * worker.start();
 * // ... later
 * worker.stop(Duration.ofSeconds(5)).join();
 * </pre>
 */
public interface Worker {

    /**
     * Start the loop. Calling it on a running worker has no effect.
     */
    void start();

    /**
     * Signal the loop to exit and wait for the current iteration to finish.
     * Idempotent.
     *
     * @param timeout Maximum time to wait for the loop thread to exit
     * @return Future that completes when the worker has stopped
     */
    CompletableFuture<Void> stop(Duration timeout);

    /**
     * Stop immediately, interrupting an iteration in progress.
     */
    void stopNow();

    /**
     * Block until the loop thread has exited.
     *
     * @param timeout Maximum time to wait
     * @return true if the loop exited within the timeout
     * @throws InterruptedException if interrupted while waiting
     */
    boolean awaitTermination(Duration timeout) throws InterruptedException;

    /**
     * Check if the loop is running.
     *
     * @return true between start() and stop()
     */
    boolean isRunning();

    /**
     * Get the worker name, used for logs, thread names and health details.
     *
     * @return worker name
     */
    String name();

    /**
     * Get the number of iterations that have completed, failed or not.
     *
     * @return iteration count
     */
    long iterationCount();

    /**
     * Get the number of consecutive failed iterations.
     *
     * @return consecutive error count, reset by a successful iteration
     */
    int getConsecutiveErrorCount();
}
