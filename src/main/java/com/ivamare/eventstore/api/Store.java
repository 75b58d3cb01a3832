package com.ivamare.eventstore.api;

/**
 * Factory for buckets.
 *
 * <p>Example:
 * <pre>
 * Bucket bucket = store.bucket("accelerator-nvidia-xid");
 * if (bucket.find(ctx, event) == null) {
 *     bucket.insert(ctx, event);
 * }
 * </pre>
 */
public interface Store extends AutoCloseable {

    /**
     * Open a bucket with default options.
     *
     * @param name logical bucket name
     * @return live bucket
     * @throws com.ivamare.eventstore.exception.InvalidBucketNameException if the name cannot be made safe
     */
    default Bucket bucket(String name) {
        return bucket(name, BucketOptions.defaults());
    }

    /**
     * Open a bucket, creating its table and indexes if they do not exist.
     * Safe to call concurrently for the same name.
     *
     * @param name logical bucket name
     * @param options bucket options
     * @return live bucket
     * @throws com.ivamare.eventstore.exception.InvalidBucketNameException if the name cannot be made safe
     */
    Bucket bucket(String name, BucketOptions options);

    /**
     * Open a bucket that never runs a purge loop.
     *
     * @param name logical bucket name
     * @return live bucket
     */
    default Bucket loadBucketWithNoPurge(String name) {
        return bucket(name, BucketOptions.defaults().withDisablePurge(true));
    }

    /**
     * Close every bucket handed out by this store.
     */
    @Override
    void close();
}
