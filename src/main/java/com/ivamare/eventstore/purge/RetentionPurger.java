package com.ivamare.eventstore.purge;

import com.ivamare.eventstore.context.OperationContext;
import com.ivamare.eventstore.worker.Worker;
import com.ivamare.eventstore.worker.impl.PeriodicWorker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Background loop that deletes rows older than the retention horizon.
 *
 * <p>Waits one purge interval, purges everything older than
 * {@code now - retention}, and repeats until the owner closes it.
 */
public class RetentionPurger implements Worker {

    private static final Logger log = LoggerFactory.getLogger(RetentionPurger.class);

    /**
     * Deletes rows with a timestamp strictly before the cutoff.
     */
    @FunctionalInterface
    public interface PurgeTarget {
        int purge(OperationContext ctx, long beforeUnixSeconds);
    }

    private final String table;
    private final RetentionPolicy policy;
    private final Clock clock;
    private final PeriodicWorker worker;

    public RetentionPurger(String table, RetentionPolicy policy, PurgeTarget target, OperationContext parent) {
        this(table, policy, target, parent, Clock.systemUTC());
    }

    RetentionPurger(String table, RetentionPolicy policy, PurgeTarget target,
                    OperationContext parent, Clock clock) {
        if (!policy.isEnabled()) {
            throw new IllegalArgumentException("retention is disabled for " + table);
        }
        this.table = table;
        this.policy = policy;
        this.clock = clock;
        this.worker = new PeriodicWorker("purge-" + table, policy.purgeInterval(),
            ctx -> purgeExpired(ctx, target), parent);
    }

    @Override
    public void start() {
        log.info("Start purging table={}, retention={}, checkInterval={}",
            table, policy.retention(), policy.purgeInterval());
        worker.start();
    }

    @Override
    public CompletableFuture<Void> stop(Duration timeout) {
        return worker.stop(timeout);
    }

    @Override
    public void stopNow() {
        worker.stopNow();
    }

    @Override
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return worker.awaitTermination(timeout);
    }

    @Override
    public boolean isRunning() {
        return worker.isRunning();
    }

    @Override
    public String name() {
        return worker.name();
    }

    @Override
    public long iterationCount() {
        return worker.iterationCount();
    }

    @Override
    public int getConsecutiveErrorCount() {
        return worker.getConsecutiveErrorCount();
    }

    public RetentionPolicy policy() {
        return policy;
    }

    private void purgeExpired(OperationContext ctx, PurgeTarget target) {
        long cutoff = clock.instant().minus(policy.retention()).getEpochSecond();
        int purged = target.purge(ctx, cutoff);
        log.info("Purged data table={}, retention={}, purged={}", table, policy.retention(), purged);
    }
}
