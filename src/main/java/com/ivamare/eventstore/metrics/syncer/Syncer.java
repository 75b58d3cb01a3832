package com.ivamare.eventstore.metrics.syncer;

import com.ivamare.eventstore.context.OperationContext;
import com.ivamare.eventstore.metrics.MetricsStore;
import com.ivamare.eventstore.metrics.Scraper;
import com.ivamare.eventstore.model.Metric;
import com.ivamare.eventstore.worker.Worker;
import com.ivamare.eventstore.worker.impl.PeriodicWorker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives a scraper into a metrics store and keeps the store within its
 * retention.
 *
 * <p>Two independent loops run after {@link #start()}: one scrapes and
 * records every scrape interval, the other purges samples older than the
 * retain duration every purge interval. A failing iteration is logged and
 * retried on the next tick.
 *
 * <p>Example:
 * <pre>
 * Syncer syncer = new Syncer(scraper, metricsStore,
 *     Duration.ofMinutes(1), Duration.ofMinutes(10), Duration.ofDays(3));
 * syncer.start();
 * // ... on shutdown
 * syncer.stop();
 * </pre>
 */
public class Syncer {

    private static final Logger log = LoggerFactory.getLogger(Syncer.class);

    private static final Duration STOP_TIMEOUT = Duration.ofSeconds(10);

    private final Scraper scraper;
    private final MetricsStore store;
    private final Duration scrapeInterval;
    private final Duration purgeInterval;
    private final Duration retainDuration;
    private final Clock clock;

    private final OperationContext rootContext;
    private final Worker scrapeWorker;
    private final Worker purgeWorker;
    private final AtomicBoolean started = new AtomicBoolean(false);

    public Syncer(
            Scraper scraper,
            MetricsStore store,
            Duration scrapeInterval,
            Duration purgeInterval,
            Duration retainDuration) {
        this(OperationContext.background(), scraper, store, scrapeInterval, purgeInterval, retainDuration,
            Clock.systemUTC());
    }

    /**
     * Creates a syncer whose loops also end when {@code parent} is done.
     *
     * @param parent Context the loop contexts derive from
     * @param scraper Metric source
     * @param store Metric sink
     * @param scrapeInterval Delay between scrapes
     * @param purgeInterval Delay between purges
     * @param retainDuration Maximum sample age kept by purges
     * @param clock Clock used to compute purge cutoffs
     */
    public Syncer(
            OperationContext parent,
            Scraper scraper,
            MetricsStore store,
            Duration scrapeInterval,
            Duration purgeInterval,
            Duration retainDuration,
            Clock clock) {
        this.scraper = scraper;
        this.store = store;
        this.scrapeInterval = scrapeInterval;
        this.purgeInterval = purgeInterval;
        this.retainDuration = retainDuration;
        this.clock = clock;
        this.rootContext = OperationContext.withCancel(parent);
        this.scrapeWorker = new PeriodicWorker("syncer-scrape", scrapeInterval, this::sync, rootContext);
        this.purgeWorker = new PeriodicWorker("syncer-purge", purgeInterval, this::purge, rootContext);
    }

    /**
     * Scrape once and record the result.
     *
     * @throws RuntimeException the scraper's or the store's failure, unchanged
     */
    public void sync() {
        sync(rootContext);
    }

    void sync(OperationContext ctx) {
        List<Metric> metrics = scraper.scrape(ctx);
        store.record(ctx, metrics != null ? metrics : List.of());
    }

    private void purge(OperationContext ctx) {
        Instant before = clock.instant().minus(retainDuration);
        int purged = store.purge(ctx, before);
        log.debug("Purged {} metrics older than {}", purged, before);
    }

    /**
     * Start both loops. Later calls have no effect.
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            log.warn("Syncer already started");
            return;
        }
        log.info("Starting syncer (scrapeInterval={}, purgeInterval={}, retain={})",
            scrapeInterval, purgeInterval, retainDuration);
        scrapeWorker.start();
        purgeWorker.start();
    }

    /**
     * Stop both loops and wait briefly for them to exit. Idempotent.
     */
    public void stop() {
        log.info("Stopping syncer");
        rootContext.cancel();
        scrapeWorker.stop(STOP_TIMEOUT).join();
        purgeWorker.stop(STOP_TIMEOUT).join();
    }

    public Duration scrapeInterval() {
        return scrapeInterval;
    }

    public Duration purgeInterval() {
        return purgeInterval;
    }

    public Duration retainDuration() {
        return retainDuration;
    }

    /**
     * The scrape and purge loops, for health reporting.
     */
    public List<Worker> workers() {
        return List.of(scrapeWorker, purgeWorker);
    }
}
