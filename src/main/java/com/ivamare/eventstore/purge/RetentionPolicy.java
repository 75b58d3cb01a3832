package com.ivamare.eventstore.purge;

import java.time.Duration;

/**
 * How long rows are kept and how often expired rows are purged.
 *
 * <p>Resolved once per bucket when the bucket is created. A retention under
 * one second disables purging.
 *
 * @param retention Maximum row age
 * @param purgeInterval Delay between purge runs
 */
public record RetentionPolicy(Duration retention, Duration purgeInterval) {

    static final Duration MIN_RETENTION = Duration.ofSeconds(1);
    static final Duration MIN_PURGE_INTERVAL = Duration.ofSeconds(1);
    static final int PURGE_INTERVAL_DIVISOR = 5;

    private static final RetentionPolicy DISABLED = new RetentionPolicy(Duration.ZERO, Duration.ZERO);

    public RetentionPolicy {
        retention = retention != null ? retention : Duration.ZERO;
        purgeInterval = purgeInterval != null ? purgeInterval : Duration.ZERO;
    }

    /**
     * Policy with the default interval: one fifth of the retention, at least
     * one second, so expired rows are caught soon after a restart.
     *
     * @param retention Maximum row age
     * @return resolved policy, disabled when retention is under one second
     */
    public static RetentionPolicy of(Duration retention) {
        if (retention == null || retention.compareTo(MIN_RETENTION) < 0) {
            return DISABLED;
        }
        Duration interval = retention.dividedBy(PURGE_INTERVAL_DIVISOR);
        if (interval.compareTo(MIN_PURGE_INTERVAL) < 0) {
            interval = MIN_PURGE_INTERVAL;
        }
        return new RetentionPolicy(retention, interval);
    }

    /**
     * Policy with an explicit purge interval.
     *
     * @param retention Maximum row age
     * @param purgeInterval Delay between purge runs
     * @return resolved policy, disabled when retention is under one second
     */
    public static RetentionPolicy of(Duration retention, Duration purgeInterval) {
        if (retention == null || retention.compareTo(MIN_RETENTION) < 0
                || purgeInterval == null || purgeInterval.isZero() || purgeInterval.isNegative()) {
            return DISABLED;
        }
        return new RetentionPolicy(retention, purgeInterval);
    }

    public static RetentionPolicy disabled() {
        return DISABLED;
    }

    public boolean isEnabled() {
        return retention.compareTo(MIN_RETENTION) >= 0 && !purgeInterval.isZero();
    }
}
