package com.ivamare.eventstore.api.impl;

import com.ivamare.eventstore.api.Bucket;
import com.ivamare.eventstore.api.BucketOptions;
import com.ivamare.eventstore.api.Store;
import com.ivamare.eventstore.codec.JsonColumnCodec;
import com.ivamare.eventstore.datasource.ContextualJdbc;
import com.ivamare.eventstore.exception.DatabaseExceptionClassifier;
import com.ivamare.eventstore.exception.StoreOperationException;
import com.ivamare.eventstore.observe.OperationLatencyRecorder;
import com.ivamare.eventstore.purge.RetentionPolicy;
import com.ivamare.eventstore.worker.Worker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static com.ivamare.eventstore.api.impl.JdbcBucket.*;

/**
 * JDBC implementation of Store.
 *
 * <p>Each bucket gets its own table, created together with its indexes in
 * one transaction. The default retention policy is immutable; every bucket
 * resolves its own policy from it when created.
 */
public class JdbcStore implements Store {

    private static final Logger log = LoggerFactory.getLogger(JdbcStore.class);

    static final int CREATE_MAX_ATTEMPTS = 5;
    static final long CREATE_INITIAL_BACKOFF_MS = 50;
    static final Duration CREATE_TIMEOUT = Duration.ofSeconds(10);

    private final ContextualJdbc writer;
    private final ContextualJdbc reader;
    private final TransactionTemplate transactionTemplate;
    private final JsonColumnCodec codec;
    private final OperationLatencyRecorder latencyRecorder;
    private final RetentionPolicy defaultRetention;

    private final Set<JdbcBucket> openBuckets = ConcurrentHashMap.newKeySet();

    /**
     * Creates a store with no latency sink.
     *
     * @param writerDataSource Writable datasource
     * @param readerDataSource Read-only datasource over the same database
     * @param codec Codec for JSON payload columns
     * @param defaultRetention Default retention for new buckets
     */
    public JdbcStore(
            DataSource writerDataSource,
            DataSource readerDataSource,
            JsonColumnCodec codec,
            RetentionPolicy defaultRetention) {
        this(writerDataSource, readerDataSource, codec, defaultRetention, OperationLatencyRecorder.NOOP);
    }

    /**
     * Creates a store.
     *
     * @param writerDataSource Writable datasource
     * @param readerDataSource Read-only datasource over the same database
     * @param codec Codec for JSON payload columns
     * @param defaultRetention Default retention for new buckets
     * @param latencyRecorder Sink for operation latencies
     */
    public JdbcStore(
            DataSource writerDataSource,
            DataSource readerDataSource,
            JsonColumnCodec codec,
            RetentionPolicy defaultRetention,
            OperationLatencyRecorder latencyRecorder) {
        JdbcTemplate writerTemplate = new JdbcTemplate(writerDataSource);
        this.writer = new ContextualJdbc(writerTemplate);
        this.reader = new ContextualJdbc(readerDataSource);
        this.transactionTemplate = new TransactionTemplate(new DataSourceTransactionManager(writerDataSource));
        this.transactionTemplate.setTimeout((int) CREATE_TIMEOUT.toSeconds());
        this.codec = codec;
        this.defaultRetention = defaultRetention != null ? defaultRetention : RetentionPolicy.disabled();
        this.latencyRecorder = latencyRecorder;
    }

    @Override
    public Bucket bucket(String name, BucketOptions options) {
        String table = BucketTableNames.safeTableName(name);
        createTable(table);

        RetentionPolicy policy = (options != null ? options : BucketOptions.defaults()).resolve(defaultRetention);

        JdbcBucket bucket = new JdbcBucket(table, writer, reader, codec, latencyRecorder, policy,
            openBuckets::remove);
        openBuckets.add(bucket);

        log.info("Opened bucket {} (retention={}, purgeInterval={})",
            table, policy.retention(), policy.purgeInterval());
        return bucket;
    }

    /**
     * Names of buckets opened and not yet closed.
     */
    public List<String> openBucketNames() {
        return openBuckets.stream().map(JdbcBucket::name).sorted().distinct().toList();
    }

    /**
     * Purge loops of open buckets that have retention enabled.
     */
    public List<Worker> purgers() {
        return openBuckets.stream()
            .map(JdbcBucket::purger)
            .filter(Objects::nonNull)
            .map(Worker.class::cast)
            .toList();
    }

    public RetentionPolicy defaultRetention() {
        return defaultRetention;
    }

    @Override
    public void close() {
        log.info("Closing {} buckets", openBuckets.size());
        List.copyOf(openBuckets).forEach(JdbcBucket::close);
    }

    // --- Table provisioning ---

    private void createTable(String table) {
        List<String> statements = List.of(
            String.format("""
                CREATE TABLE IF NOT EXISTS %s (
                    %s INTEGER NOT NULL,
                    %s TEXT NOT NULL,
                    %s TEXT NOT NULL,
                    %s TEXT,
                    %s TEXT,
                    %s TEXT
                )""", table,
                COLUMN_TIMESTAMP, COLUMN_NAME, COLUMN_TYPE,
                COLUMN_MESSAGE, COLUMN_EXTRA_INFO, COLUMN_SUGGESTED_ACTIONS),
            createIndex(table, COLUMN_TIMESTAMP),
            createIndex(table, COLUMN_NAME),
            createIndex(table, COLUMN_TYPE)
        );

        long backoff = CREATE_INITIAL_BACKOFF_MS;
        for (int attempt = 1; ; attempt++) {
            try {
                transactionTemplate.executeWithoutResult(status ->
                    statements.forEach(sql -> writer.jdbcTemplate().execute(sql)));
                log.debug("Ensured table {}", table);
                return;
            } catch (DataAccessException | TransactionException e) {
                if (attempt >= CREATE_MAX_ATTEMPTS || !DatabaseExceptionClassifier.isTransient(e)) {
                    throw new StoreOperationException("create table", table, e);
                }
                log.warn("Creating table {} hit a transient error (attempt={}, reason={}), retrying in {}ms",
                    table, attempt, DatabaseExceptionClassifier.getTransientReason(e), backoff);
                try {
                    Thread.sleep(backoff);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new StoreOperationException("create table", table, ie);
                }
                backoff *= 2;
            }
        }
    }

    private static String createIndex(String table, String column) {
        return String.format("CREATE INDEX IF NOT EXISTS idx_%s_%s ON %s(%s)", table, column, table, column);
    }
}
