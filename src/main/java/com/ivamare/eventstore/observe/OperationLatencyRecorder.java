package com.ivamare.eventstore.observe;

import java.time.Duration;

/**
 * Receives latency observations for store operations.
 */
public interface OperationLatencyRecorder {

    /**
     * Recorder that drops every observation.
     */
    OperationLatencyRecorder NOOP = (operation, table, elapsed) -> { };

    /**
     * Record how long one operation took.
     *
     * @param operation operation kind: insert, select, delete
     * @param table physical table name
     * @param elapsed time spent in the engine
     */
    void record(String operation, String table, Duration elapsed);
}
