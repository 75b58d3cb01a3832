package com.ivamare.eventstore.health;

import com.ivamare.eventstore.api.impl.JdbcStore;
import com.ivamare.eventstore.codec.JsonColumnCodec;
import com.ivamare.eventstore.datasource.SqliteDataSources;
import com.ivamare.eventstore.purge.RetentionPolicy;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("EventStoreHealthIndicator")
class EventStoreHealthIndicatorTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("should return UP with buckets and pool stats")
    void shouldReturnUpWithBucketsAndPoolStats() {
        try (SqliteDataSources dataSources = SqliteDataSources.open(tempDir.resolve("health.db"));
             JdbcStore store = new JdbcStore(dataSources.writer(), dataSources.reader(),
                 new JsonColumnCodec(new ObjectMapper()), RetentionPolicy.of(Duration.ofHours(72)))) {
            store.loadBucketWithNoPurge("cpu");

            Health health = new EventStoreHealthIndicator(dataSources.writer(), store).health();

            assertEquals(Status.UP, health.getStatus());
            assertEquals("sqlite", health.getDetails().get("database"));
            assertEquals(List.of("components_cpu_events_v0_4_0"), health.getDetails().get("buckets"));
            assertEquals("PT72H", health.getDetails().get("retention"));
            assertNotNull(health.getDetails().get("pool.total"));
        }
    }

    @Test
    @DisplayName("should return DOWN when the connection is invalid")
    void shouldReturnDownWhenConnectionInvalid() throws SQLException {
        DataSource dataSource = mock(DataSource.class);
        Connection connection = mock(Connection.class);
        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.isValid(anyInt())).thenReturn(false);

        Health health = new EventStoreHealthIndicator(dataSource).health();

        assertEquals(Status.DOWN, health.getStatus());
        assertEquals("Database connection invalid", health.getDetails().get("error"));
    }

    @Test
    @DisplayName("should return DOWN when no connection can be obtained")
    void shouldReturnDownWhenNoConnection() throws SQLException {
        DataSource dataSource = mock(DataSource.class);
        when(dataSource.getConnection()).thenThrow(new SQLException("unable to open database file"));

        Health health = new EventStoreHealthIndicator(dataSource).health();

        assertEquals(Status.DOWN, health.getStatus());
    }
}
