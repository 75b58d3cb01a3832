package com.ivamare.eventstore.metrics.impl;

import com.ivamare.eventstore.context.OperationContext;
import com.ivamare.eventstore.datasource.SqliteDataSources;
import com.ivamare.eventstore.exception.OperationCanceledException;
import com.ivamare.eventstore.metrics.MetricsReadOptions;
import com.ivamare.eventstore.model.Metric;
import com.ivamare.eventstore.observe.MicrometerLatencyRecorder;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("JdbcMetricsStore")
class JdbcMetricsStoreTest {

    private static final long T0 = 1_714_560_000_000L;

    @TempDir
    Path tempDir;

    private SqliteDataSources dataSources;
    private JdbcMetricsStore store;
    private OperationContext ctx;

    @BeforeEach
    void setUp() {
        dataSources = SqliteDataSources.open(tempDir.resolve("metrics.db"));
        store = new JdbcMetricsStore(dataSources.writer(), dataSources.reader());
        ctx = OperationContext.withTimeout(Duration.ofSeconds(30));
    }

    @AfterEach
    void tearDown() {
        dataSources.close();
    }

    @Test
    @DisplayName("should record and read samples oldest first")
    void shouldRecordAndReadOldestFirst() {
        Metric later = new Metric(T0 + 2000, "accelerator-nvidia-temperature", "gpu_temp_c", "GPU-0", 71.5);
        Metric earlier = new Metric(T0, "accelerator-nvidia-temperature", "gpu_temp_c", "GPU-0", 70.0);

        store.record(ctx, List.of(later, earlier));

        assertEquals(List.of(earlier, later), store.read(ctx, MetricsReadOptions.all()));
    }

    @Test
    @DisplayName("should store an empty label for unlabeled samples")
    void shouldStoreEmptyLabel() {
        store.record(ctx, List.of(Metric.of(T0, "cpu", "load_1m", 0.42)));

        Metric read = store.read(ctx, null).get(0);

        assertEquals("", read.label());
        assertEquals(0.42, read.value());
    }

    @Test
    @DisplayName("should treat since as inclusive")
    void shouldTreatSinceAsInclusive() {
        store.record(ctx, List.of(
            Metric.of(T0 - 1, "cpu", "load_1m", 1),
            Metric.of(T0, "cpu", "load_1m", 2),
            Metric.of(T0 + 1, "cpu", "load_1m", 3)));

        List<Metric> read = store.read(ctx, MetricsReadOptions.since(Instant.ofEpochMilli(T0)));

        assertEquals(List.of(2.0, 3.0), read.stream().map(Metric::value).toList());
    }

    @Test
    @DisplayName("should filter by component")
    void shouldFilterByComponent() {
        store.record(ctx, List.of(
            Metric.of(T0, "cpu", "load_1m", 1),
            Metric.of(T0, "memory", "used_bytes", 2),
            Metric.of(T0, "disk", "used_bytes", 3)));

        List<Metric> read = store.read(ctx, MetricsReadOptions.all().withComponents("cpu", "disk"));

        assertEquals(List.of("cpu", "disk"), read.stream().map(Metric::component).sorted().toList());
    }

    @Test
    @DisplayName("should ignore an empty batch")
    void shouldIgnoreEmptyBatch() {
        store.record(ctx, List.of());

        assertTrue(store.read(ctx, MetricsReadOptions.all()).isEmpty());
    }

    @Test
    @DisplayName("should purge strictly older samples")
    void shouldPurgeStrictlyOlderSamples() {
        store.record(ctx, List.of(
            Metric.of(T0 - 1, "cpu", "load_1m", 1),
            Metric.of(T0, "cpu", "load_1m", 2)));

        assertEquals(1, store.purge(ctx, Instant.ofEpochMilli(T0)));
        assertEquals(0, store.purge(ctx, Instant.ofEpochMilli(T0)));
        assertEquals(1, store.read(ctx, MetricsReadOptions.all()).size());
    }

    @Test
    @DisplayName("should reject a canceled context")
    void shouldRejectCanceledContext() {
        OperationContext canceled = OperationContext.withCancel(OperationContext.background());
        canceled.cancel();

        assertThrows(OperationCanceledException.class,
            () -> store.record(canceled, List.of(Metric.of(T0, "cpu", "load_1m", 1))));
        assertThrows(OperationCanceledException.class, () -> store.read(canceled, MetricsReadOptions.all()));
        assertThrows(OperationCanceledException.class, () -> store.purge(canceled, Instant.now()));
    }

    @Test
    @DisplayName("should reject unsafe table names")
    void shouldRejectUnsafeTableNames() {
        assertThrows(IllegalArgumentException.class, () -> new JdbcMetricsStore(
            dataSources.writer(), dataSources.reader(), "metrics; DROP", null));
    }

    @Test
    @DisplayName("should record latencies per operation")
    void shouldRecordLatencies() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        JdbcMetricsStore timed = new JdbcMetricsStore(dataSources.writer(), dataSources.reader(),
            "custom_metrics", new MicrometerLatencyRecorder(registry));

        timed.record(ctx, List.of(Metric.of(T0, "cpu", "load_1m", 1)));
        timed.read(ctx, MetricsReadOptions.all());

        assertEquals(1, registry.get(MicrometerLatencyRecorder.METER_NAME)
            .tag("operation", "insert").tag("table", "custom_metrics").timer().count());
        assertEquals(1, registry.get(MicrometerLatencyRecorder.METER_NAME)
            .tag("operation", "select").timer().count());
    }
}
