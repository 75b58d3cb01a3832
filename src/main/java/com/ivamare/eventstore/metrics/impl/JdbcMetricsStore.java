package com.ivamare.eventstore.metrics.impl;

import com.ivamare.eventstore.context.OperationContext;
import com.ivamare.eventstore.datasource.ContextualJdbc;
import com.ivamare.eventstore.exception.StoreOperationException;
import com.ivamare.eventstore.metrics.MetricsReadOptions;
import com.ivamare.eventstore.metrics.MetricsStore;
import com.ivamare.eventstore.model.Metric;
import com.ivamare.eventstore.observe.OperationLatencyRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * JDBC implementation of MetricsStore over one SQLite table.
 */
public class JdbcMetricsStore implements MetricsStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcMetricsStore.class);

    public static final String DEFAULT_TABLE = "gpud_metrics_v0_5_0";

    private static final Pattern SAFE_TABLE_NAME = Pattern.compile("[a-z0-9_]+");

    static final String COLUMN_UNIX_MILLISECONDS = "unix_milliseconds";
    static final String COLUMN_COMPONENT = "component";
    static final String COLUMN_NAME = "name";
    static final String COLUMN_LABEL = "label";
    static final String COLUMN_VALUE = "value";

    private final String table;
    private final ContextualJdbc writer;
    private final ContextualJdbc reader;
    private final PlatformTransactionManager transactionManager;
    private final OperationLatencyRecorder latencyRecorder;
    private final RowMapper<Metric> metricMapper;

    private final String insertSql;
    private final String selectSql;
    private final String purgeSql;

    public JdbcMetricsStore(DataSource writerDataSource, DataSource readerDataSource) {
        this(writerDataSource, readerDataSource, DEFAULT_TABLE, OperationLatencyRecorder.NOOP);
    }

    /**
     * Creates the store and its table if missing.
     *
     * @param writerDataSource Writable datasource
     * @param readerDataSource Read-only datasource over the same database
     * @param table Table name ({@code [a-z0-9_]+})
     * @param latencyRecorder Sink for operation latencies
     */
    public JdbcMetricsStore(
            DataSource writerDataSource,
            DataSource readerDataSource,
            String table,
            OperationLatencyRecorder latencyRecorder) {
        if (table == null || !SAFE_TABLE_NAME.matcher(table).matches()) {
            throw new IllegalArgumentException("invalid metrics table name: " + table);
        }
        this.table = table;
        this.writer = new ContextualJdbc(new JdbcTemplate(writerDataSource));
        this.reader = new ContextualJdbc(readerDataSource);
        this.transactionManager = new DataSourceTransactionManager(writerDataSource);
        this.latencyRecorder = latencyRecorder;
        this.metricMapper = (rs, rowNum) -> new Metric(
            rs.getLong(COLUMN_UNIX_MILLISECONDS),
            rs.getString(COLUMN_COMPONENT),
            rs.getString(COLUMN_NAME),
            rs.getString(COLUMN_LABEL),
            rs.getDouble(COLUMN_VALUE)
        );

        this.insertSql = String.format("INSERT INTO %s (%s, %s, %s, %s, %s) VALUES (?, ?, ?, ?, ?)",
            table, COLUMN_UNIX_MILLISECONDS, COLUMN_COMPONENT, COLUMN_NAME, COLUMN_LABEL, COLUMN_VALUE);
        this.selectSql = String.format("SELECT %s, %s, %s, %s, %s FROM %s",
            COLUMN_UNIX_MILLISECONDS, COLUMN_COMPONENT, COLUMN_NAME, COLUMN_LABEL, COLUMN_VALUE, table);
        this.purgeSql = String.format("DELETE FROM %s WHERE %s < ?", table, COLUMN_UNIX_MILLISECONDS);

        createTable();
    }

    public String table() {
        return table;
    }

    @Override
    public void record(OperationContext ctx, List<Metric> metrics) {
        ctx.checkActive("record");
        if (metrics == null || metrics.isEmpty()) {
            return;
        }

        List<Object[]> batchArgs = metrics.stream()
            .map(m -> new Object[] {
                m.unixMilliseconds(),
                m.component(),
                m.name(),
                m.label(),
                m.value()
            })
            .toList();

        timed("insert", () -> transaction(ctx).execute(status ->
            writer.jdbcTemplate().batchUpdate(insertSql, batchArgs)));
        log.debug("Recorded {} metrics into {}", metrics.size(), table);
    }

    @Override
    public List<Metric> read(OperationContext ctx, MetricsReadOptions options) {
        MetricsReadOptions opts = options != null ? options : MetricsReadOptions.all();

        StringBuilder sql = new StringBuilder(selectSql);
        List<Object> params = new ArrayList<>();
        List<String> conditions = new ArrayList<>();
        if (opts.since() != null) {
            conditions.add(COLUMN_UNIX_MILLISECONDS + " >= ?");
            params.add(opts.since().toEpochMilli());
        }
        if (!opts.components().isEmpty()) {
            conditions.add(COLUMN_COMPONENT + " IN ("
                + String.join(", ", Collections.nCopies(opts.components().size(), "?")) + ")");
            params.addAll(opts.components().stream().sorted().toList());
        }
        if (!conditions.isEmpty()) {
            sql.append(" WHERE ").append(String.join(" AND ", conditions));
        }
        sql.append(" ORDER BY ").append(COLUMN_UNIX_MILLISECONDS).append(" ASC");

        return timed("select", () -> reader.query(ctx, "read", sql.toString(), metricMapper, params.toArray()));
    }

    @Override
    public int purge(OperationContext ctx, Instant before) {
        int purged = timed("delete", () -> writer.update(ctx, "purge", purgeSql, before.toEpochMilli()));
        log.debug("Purged {} metrics before {} from {}", purged, before, table);
        return purged;
    }

    private void createTable() {
        TransactionTemplate tx = new TransactionTemplate(transactionManager);
        try {
            tx.executeWithoutResult(status -> {
                JdbcTemplate jdbc = writer.jdbcTemplate();
                jdbc.execute(String.format("""
                    CREATE TABLE IF NOT EXISTS %s (
                        %s INTEGER NOT NULL,
                        %s TEXT NOT NULL,
                        %s TEXT NOT NULL,
                        %s TEXT,
                        %s REAL NOT NULL
                    )""", table,
                    COLUMN_UNIX_MILLISECONDS, COLUMN_COMPONENT, COLUMN_NAME, COLUMN_LABEL, COLUMN_VALUE));
                jdbc.execute(String.format("CREATE INDEX IF NOT EXISTS idx_%s_%s ON %s(%s)",
                    table, COLUMN_UNIX_MILLISECONDS, table, COLUMN_UNIX_MILLISECONDS));
                jdbc.execute(String.format("CREATE INDEX IF NOT EXISTS idx_%s_%s_%s ON %s(%s, %s)",
                    table, COLUMN_COMPONENT, COLUMN_NAME, table, COLUMN_COMPONENT, COLUMN_NAME));
            });
        } catch (DataAccessException e) {
            throw new StoreOperationException("create table", table, e);
        }
        log.info("Opened metrics table {}", table);
    }

    private TransactionTemplate transaction(OperationContext ctx) {
        TransactionTemplate tx = new TransactionTemplate(transactionManager);
        int timeout = ctx.queryTimeoutSeconds();
        tx.setTimeout(timeout > 0 ? timeout : TransactionDefinition.TIMEOUT_DEFAULT);
        return tx;
    }

    private <T> T timed(String operation, Supplier<T> action) {
        long start = System.nanoTime();
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new StoreOperationException(operation, table, e);
        } finally {
            latencyRecorder.record(operation, table, Duration.ofNanos(System.nanoTime() - start));
        }
    }
}
