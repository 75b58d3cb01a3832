package com.ivamare.eventstore;

import com.ivamare.eventstore.metrics.impl.JdbcMetricsStore;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the event store.
 *
 * <p>Example configuration:
 * <pre>
 * eventstore:
 *   enabled: true
 *   path: /var/lib/gpud/gpud.state
 *   retention: 72h
 *   busy-timeout: 5s
 *   reader-pool-size: 4
 *   metrics:
 *     enabled: true
 *     table: gpud_metrics_v0_5_0
 *     scrape-interval: 1m
 *     purge-interval: 10m
 *     retention: 72h
 * </pre>
 */
@ConfigurationProperties(prefix = "eventstore")
public class EventStoreProperties {

    static final Duration MIN_RETENTION = Duration.ofMinutes(1);

    /**
     * Enable/disable event store auto-configuration.
     */
    private boolean enabled = true;

    /**
     * SQLite database file.
     */
    private String path = "gpud.state";

    /**
     * Default retention for event buckets.
     */
    private Duration retention = Duration.ofHours(72);

    /**
     * How long SQLite waits on a locked database before failing.
     */
    private Duration busyTimeout = Duration.ofSeconds(5);

    /**
     * Maximum connections in the read-only pool.
     */
    private int readerPoolSize = 4;

    /**
     * Metrics store and syncer configuration.
     */
    private MetricsProperties metrics = new MetricsProperties();

    /**
     * Check the settings for values the store cannot run with.
     *
     * @throws IllegalStateException on an empty path or a retention under one minute
     */
    public void validate() {
        if (path == null || path.isBlank()) {
            throw new IllegalStateException("eventstore.path is required");
        }
        if (retention == null || retention.compareTo(MIN_RETENTION) < 0) {
            throw new IllegalStateException("eventstore.retention must be at least 1 minute, got " + retention);
        }
        if (readerPoolSize < 1) {
            throw new IllegalStateException("eventstore.reader-pool-size must be positive, got " + readerPoolSize);
        }
        metrics.validate();
    }

    // Getters and setters

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public Duration getRetention() {
        return retention;
    }

    public void setRetention(Duration retention) {
        this.retention = retention;
    }

    public Duration getBusyTimeout() {
        return busyTimeout;
    }

    public void setBusyTimeout(Duration busyTimeout) {
        this.busyTimeout = busyTimeout;
    }

    public int getReaderPoolSize() {
        return readerPoolSize;
    }

    public void setReaderPoolSize(int readerPoolSize) {
        this.readerPoolSize = readerPoolSize;
    }

    public MetricsProperties getMetrics() {
        return metrics;
    }

    public void setMetrics(MetricsProperties metrics) {
        this.metrics = metrics;
    }

    /**
     * Metrics store and syncer configuration.
     */
    public static class MetricsProperties {

        /**
         * Enable/disable the metrics store and syncer.
         */
        private boolean enabled = true;

        /**
         * Metrics table name.
         */
        private String table = JdbcMetricsStore.DEFAULT_TABLE;

        /**
         * Delay between scrapes.
         */
        private Duration scrapeInterval = Duration.ofMinutes(1);

        /**
         * Delay between purges of old samples.
         */
        private Duration purgeInterval = Duration.ofMinutes(10);

        /**
         * Maximum sample age.
         */
        private Duration retention = Duration.ofHours(72);

        void validate() {
            if (scrapeInterval == null || scrapeInterval.isZero() || scrapeInterval.isNegative()) {
                throw new IllegalStateException("eventstore.metrics.scrape-interval must be positive");
            }
            if (purgeInterval == null || purgeInterval.isZero() || purgeInterval.isNegative()) {
                throw new IllegalStateException("eventstore.metrics.purge-interval must be positive");
            }
            if (retention == null || retention.compareTo(MIN_RETENTION) < 0) {
                throw new IllegalStateException(
                    "eventstore.metrics.retention must be at least 1 minute, got " + retention);
            }
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getTable() {
            return table;
        }

        public void setTable(String table) {
            this.table = table;
        }

        public Duration getScrapeInterval() {
            return scrapeInterval;
        }

        public void setScrapeInterval(Duration scrapeInterval) {
            this.scrapeInterval = scrapeInterval;
        }

        public Duration getPurgeInterval() {
            return purgeInterval;
        }

        public void setPurgeInterval(Duration purgeInterval) {
            this.purgeInterval = purgeInterval;
        }

        public Duration getRetention() {
            return retention;
        }

        public void setRetention(Duration retention) {
            this.retention = retention;
        }
    }
}
