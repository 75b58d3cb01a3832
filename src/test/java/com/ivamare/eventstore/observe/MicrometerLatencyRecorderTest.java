package com.ivamare.eventstore.observe;

import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MicrometerLatencyRecorder")
class MicrometerLatencyRecorderTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final MicrometerLatencyRecorder recorder = new MicrometerLatencyRecorder(registry);

    @Test
    @DisplayName("should register one timer per operation and table")
    void shouldRegisterOneTimerPerOperationAndTable() {
        recorder.record("insert", "components_cpu_events_v0_4_0", Duration.ofMillis(3));
        recorder.record("insert", "components_cpu_events_v0_4_0", Duration.ofMillis(5));
        recorder.record("select", "components_cpu_events_v0_4_0", Duration.ofMillis(1));

        Timer inserts = registry.get(MicrometerLatencyRecorder.METER_NAME)
            .tags("operation", "insert", "table", "components_cpu_events_v0_4_0")
            .timer();

        assertEquals(2, inserts.count());
        assertEquals(8.0, inserts.totalTime(TimeUnit.MILLISECONDS), 0.001);
        assertEquals(2, registry.get(MicrometerLatencyRecorder.METER_NAME).timers().size());
    }

    @Test
    @DisplayName("noop recorder should accept observations")
    void noopShouldAcceptObservations() {
        assertDoesNotThrow(() -> OperationLatencyRecorder.NOOP.record("delete", "t", Duration.ZERO));
    }
}
