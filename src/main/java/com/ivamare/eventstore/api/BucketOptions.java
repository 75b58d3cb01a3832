package com.ivamare.eventstore.api;

import com.ivamare.eventstore.purge.RetentionPolicy;

/**
 * Per-bucket options.
 *
 * @param disablePurge Do not start a purge loop for this bucket
 * @param retention Retention override (nullable, store default when null)
 */
public record BucketOptions(boolean disablePurge, RetentionPolicy retention) {

    private static final BucketOptions DEFAULTS = new BucketOptions(false, null);

    public static BucketOptions defaults() {
        return DEFAULTS;
    }

    public BucketOptions withDisablePurge(boolean newDisablePurge) {
        return new BucketOptions(newDisablePurge, retention);
    }

    public BucketOptions withRetention(RetentionPolicy newRetention) {
        return new BucketOptions(disablePurge, newRetention);
    }

    /**
     * Resolve the policy for a new bucket. Never mutates the store default.
     *
     * @param storeDefault the store's default policy
     * @return policy the bucket should use
     */
    public RetentionPolicy resolve(RetentionPolicy storeDefault) {
        if (disablePurge) {
            return RetentionPolicy.disabled();
        }
        return retention != null ? retention : storeDefault;
    }
}
