package com.ivamare.eventstore.health;

import com.ivamare.eventstore.api.impl.JdbcStore;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Health indicator for the event store database.
 *
 * <p>Checks that a writer connection is valid and reports the open buckets
 * and writer pool statistics.
 */
public class EventStoreHealthIndicator implements HealthIndicator {

    private static final int CONNECTION_VALIDITY_TIMEOUT_SECONDS = 3;

    private final DataSource dataSource;
    private final JdbcStore store;

    public EventStoreHealthIndicator(DataSource dataSource) {
        this(dataSource, null);
    }

    public EventStoreHealthIndicator(DataSource dataSource, JdbcStore store) {
        this.dataSource = dataSource;
        this.store = store;
    }

    @Override
    public Health health() {
        try {
            if (!isConnectionValid()) {
                return Health.down()
                    .withDetail("error", "Database connection invalid")
                    .build();
            }

            Health.Builder builder = Health.up().withDetail("database", "sqlite");
            if (store != null) {
                builder.withDetail("buckets", store.openBucketNames());
                builder.withDetail("retention", store.defaultRetention().retention().toString());
            }
            addPoolStats(builder);
            return builder.build();

        } catch (Exception e) {
            return Health.down()
                .withDetail("error", e.getMessage())
                .build();
        }
    }

    private boolean isConnectionValid() {
        try (Connection conn = dataSource.getConnection()) {
            return conn.isValid(CONNECTION_VALIDITY_TIMEOUT_SECONDS);
        } catch (SQLException e) {
            return false;
        }
    }

    private void addPoolStats(Health.Builder builder) {
        if (dataSource instanceof HikariDataSource hikari) {
            HikariPoolMXBean pool = hikari.getHikariPoolMXBean();
            if (pool != null) {
                builder.withDetail("pool.active", pool.getActiveConnections());
                builder.withDetail("pool.idle", pool.getIdleConnections());
                builder.withDetail("pool.total", pool.getTotalConnections());
                builder.withDetail("pool.pending", pool.getThreadsAwaitingConnection());
            }
        }
    }
}
