package com.ivamare.eventstore.observe;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Publishes operation latencies as Micrometer timers named
 * {@code eventstore.operation}, tagged by operation and table.
 */
public class MicrometerLatencyRecorder implements OperationLatencyRecorder {

    public static final String METER_NAME = "eventstore.operation";

    private final MeterRegistry meterRegistry;
    private final Map<String, Timer> timers = new ConcurrentHashMap<>();

    public MicrometerLatencyRecorder(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void record(String operation, String table, Duration elapsed) {
        timers.computeIfAbsent(operation + "|" + table, k -> Timer.builder(METER_NAME)
                .description("Time spent in the storage engine")
                .tag("operation", operation)
                .tag("table", table)
                .register(meterRegistry))
            .record(elapsed);
    }
}
