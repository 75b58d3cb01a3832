package com.ivamare.eventstore.api.impl;

import com.ivamare.eventstore.api.Bucket;
import com.ivamare.eventstore.codec.JsonColumnCodec;
import com.ivamare.eventstore.context.OperationContext;
import com.ivamare.eventstore.datasource.ContextualJdbc;
import com.ivamare.eventstore.exception.StoreOperationException;
import com.ivamare.eventstore.model.Event;
import com.ivamare.eventstore.model.EventType;
import com.ivamare.eventstore.observe.OperationLatencyRecorder;
import com.ivamare.eventstore.purge.RetentionPolicy;
import com.ivamare.eventstore.purge.RetentionPurger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.RowMapper;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * JDBC implementation of Bucket over one SQLite table.
 *
 * <p>Inserts and purges use the writer; find, get and latest use the
 * read-only reader.
 */
public class JdbcBucket implements Bucket {

    private static final Logger log = LoggerFactory.getLogger(JdbcBucket.class);

    private static final Duration PURGER_STOP_TIMEOUT = Duration.ofSeconds(10);

    static final String COLUMN_TIMESTAMP = "timestamp";
    static final String COLUMN_NAME = "name";
    static final String COLUMN_TYPE = "type";
    static final String COLUMN_MESSAGE = "message";
    static final String COLUMN_EXTRA_INFO = "extra_info";
    static final String COLUMN_SUGGESTED_ACTIONS = "suggested_actions";

    static final String SELECT_COLUMNS = String.join(", ",
        COLUMN_TIMESTAMP, COLUMN_NAME, COLUMN_TYPE, COLUMN_MESSAGE, COLUMN_EXTRA_INFO, COLUMN_SUGGESTED_ACTIONS);

    private final String table;
    private final ContextualJdbc writer;
    private final ContextualJdbc reader;
    private final JsonColumnCodec codec;
    private final OperationLatencyRecorder latencyRecorder;
    private final RetentionPolicy retentionPolicy;
    private final RowMapper<Event> eventMapper;
    private final Consumer<JdbcBucket> onClose;

    private final OperationContext rootContext = OperationContext.withCancel(OperationContext.background());
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final RetentionPurger purger;

    private final String insertSql;
    private final String findSql;
    private final String getSql;
    private final String latestSql;
    private final String purgeSql;

    /**
     * Creates a bucket over an existing table and starts its purge loop if
     * the retention policy is enabled.
     *
     * @param table Physical table name (already validated and created)
     * @param writer Writable connection wrapper
     * @param reader Read-only connection wrapper
     * @param codec Codec for JSON payload columns
     * @param latencyRecorder Sink for operation latencies
     * @param retentionPolicy Policy resolved for this bucket
     * @param onClose Callback run once when the bucket closes
     */
    public JdbcBucket(
            String table,
            ContextualJdbc writer,
            ContextualJdbc reader,
            JsonColumnCodec codec,
            OperationLatencyRecorder latencyRecorder,
            RetentionPolicy retentionPolicy,
            Consumer<JdbcBucket> onClose) {
        this.table = table;
        this.writer = writer;
        this.reader = reader;
        this.codec = codec;
        this.latencyRecorder = latencyRecorder;
        this.retentionPolicy = retentionPolicy;
        this.onClose = onClose;
        this.eventMapper = createEventMapper();

        this.insertSql = String.format(
            "INSERT INTO %s (%s, %s, %s, %s, %s, %s) VALUES (?, ?, ?, NULLIF(?, ''), NULLIF(?, ''), NULLIF(?, ''))",
            table, COLUMN_TIMESTAMP, COLUMN_NAME, COLUMN_TYPE,
            COLUMN_MESSAGE, COLUMN_EXTRA_INFO, COLUMN_SUGGESTED_ACTIONS);
        this.findSql = String.format("SELECT %s FROM %s WHERE %s = ? AND %s = ? AND %s = ?",
            SELECT_COLUMNS, table, COLUMN_TIMESTAMP, COLUMN_NAME, COLUMN_TYPE);
        this.getSql = String.format("SELECT %s FROM %s WHERE %s > ? ORDER BY %s DESC",
            SELECT_COLUMNS, table, COLUMN_TIMESTAMP, COLUMN_TIMESTAMP);
        this.latestSql = String.format("SELECT %s FROM %s ORDER BY %s DESC LIMIT 1",
            SELECT_COLUMNS, table, COLUMN_TIMESTAMP);
        this.purgeSql = String.format("DELETE FROM %s WHERE %s < ?", table, COLUMN_TIMESTAMP);

        if (retentionPolicy.isEnabled()) {
            this.purger = new RetentionPurger(table, retentionPolicy, this::purge, rootContext);
            this.purger.start();
        } else {
            this.purger = null;
        }
    }

    private RowMapper<Event> createEventMapper() {
        return (rs, rowNum) -> {
            String message = rs.getString(COLUMN_MESSAGE);
            return new Event(
                rs.getLong(COLUMN_TIMESTAMP),
                rs.getString(COLUMN_NAME),
                EventType.fromLabel(rs.getString(COLUMN_TYPE)),
                message != null ? message : "",
                codec.decodeExtraInfo(rs.getString(COLUMN_EXTRA_INFO)),
                codec.decodeSuggestedActions(rs.getString(COLUMN_SUGGESTED_ACTIONS))
            );
        };
    }

    @Override
    public String name() {
        return table;
    }

    @Override
    public void insert(OperationContext ctx, Event event) {
        String extraInfoJson = codec.encodeExtraInfo(event.extraInfo());
        String suggestedActionsJson = codec.encodeSuggestedActions(event.suggestedActions());

        timed("insert", () -> writer.update(ctx, "insert", insertSql,
            event.unixSeconds(),
            event.name(),
            event.type().label(),
            event.message(),
            extraInfoJson != null ? extraInfoJson : "",
            suggestedActionsJson != null ? suggestedActionsJson : ""));

        log.debug("Inserted event {} into {}", event.name(), table);
    }

    @Override
    public Event find(OperationContext ctx, Event event) {
        StringBuilder sql = new StringBuilder(findSql);
        List<Object> params = new ArrayList<>(List.of(event.unixSeconds(), event.name(), event.type().label()));

        if (!event.message().isEmpty()) {
            sql.append(" AND ").append(COLUMN_MESSAGE).append(" = ?");
            params.add(event.message());
        }
        if (event.suggestedActions() != null) {
            sql.append(" AND ").append(COLUMN_SUGGESTED_ACTIONS).append(" = ?");
            params.add(codec.encodeSuggestedActions(event.suggestedActions()));
        }

        // Extra info is compared here rather than in SQL; first match in scan order wins
        return timed("select", () -> reader.query(ctx, "find", sql.toString(), rs -> {
            int rowNum = 0;
            while (rs.next()) {
                Event candidate = eventMapper.mapRow(rs, rowNum++);
                if (candidate != null && candidate.sameExtraInfo(event)) {
                    return candidate;
                }
            }
            return null;
        }, params.toArray()));
    }

    @Override
    public List<Event> get(OperationContext ctx, long sinceUnixSeconds) {
        List<Event> events = timed("select", () ->
            reader.query(ctx, "get", getSql, eventMapper, sinceUnixSeconds));
        return events.isEmpty() ? null : events;
    }

    @Override
    public Event latest(OperationContext ctx) {
        List<Event> events = timed("select", () -> reader.query(ctx, "latest", latestSql, eventMapper));
        return events.isEmpty() ? null : events.get(0);
    }

    @Override
    public int purge(OperationContext ctx, long beforeUnixSeconds) {
        int purged = timed("delete", () -> writer.update(ctx, "purge", purgeSql, beforeUnixSeconds));
        log.debug("Purged {} events before {} from {}", purged, beforeUnixSeconds, table);
        return purged;
    }

    @Override
    public void close() {
        if (closed.getAndSet(true)) {
            return;
        }
        log.info("Closing bucket {}", table);
        rootContext.cancel();
        if (purger != null) {
            purger.stop(PURGER_STOP_TIMEOUT);
        }
        onClose.accept(this);
    }

    public boolean isClosed() {
        return closed.get();
    }

    public RetentionPolicy retentionPolicy() {
        return retentionPolicy;
    }

    /**
     * Background purge loop, or null when retention is disabled.
     */
    public RetentionPurger purger() {
        return purger;
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
