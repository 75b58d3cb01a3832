package com.ivamare.eventstore.health;

import com.ivamare.eventstore.worker.Worker;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("WorkerHealthIndicator")
class WorkerHealthIndicatorTest {

    @Test
    @DisplayName("should return UNKNOWN when no workers registered")
    void shouldReturnUnknownWhenNoWorkersRegistered() {
        WorkerHealthIndicator healthIndicator = new WorkerHealthIndicator(List.of());

        Health health = healthIndicator.health();

        assertEquals(Status.UNKNOWN, health.getStatus());
        assertEquals("No workers registered", health.getDetails().get("message"));
    }

    @Test
    @DisplayName("should return UP when all workers running")
    void shouldReturnUpWhenAllWorkersRunning() {
        Worker purger = worker("purge-components_cpu_events_v0_4_0", true, 0);
        Worker scrape = worker("syncer-scrape", true, 2);

        Health health = new WorkerHealthIndicator(List.of(purger, scrape)).health();

        assertEquals(Status.UP, health.getStatus());
        assertEquals(2, health.getDetails().get("maxConsecutiveErrors"));
        assertNotNull(health.getDetails().get("workers"));
    }

    @Test
    @DisplayName("should return DOWN when any worker not running")
    void shouldReturnDownWhenAnyWorkerNotRunning() {
        Worker running = worker("syncer-scrape", true, 0);
        Worker stopped = worker("syncer-purge", false, 0);

        Health health = new WorkerHealthIndicator(List.of(running, stopped)).health();

        assertEquals(Status.DOWN, health.getStatus());
    }

    @Test
    @DisplayName("should return DOWN at five consecutive errors")
    void shouldReturnDownAtFiveConsecutiveErrors() {
        Worker failing = worker("syncer-scrape", true, 5);

        Health health = new WorkerHealthIndicator(List.of(failing)).health();

        assertEquals(Status.DOWN, health.getStatus());
        assertEquals(5, health.getDetails().get("maxConsecutiveErrors"));
    }

    @Test
    @DisplayName("should report individual worker status")
    void shouldReportIndividualWorkerStatus() {
        Worker worker = worker("syncer-purge", true, 1);
        when(worker.iterationCount()).thenReturn(7L);

        Health health = new WorkerHealthIndicator(List.of(worker)).health();

        @SuppressWarnings("unchecked")
        var workers = (Map<String, WorkerHealthIndicator.WorkerStatus>) health.getDetails().get("workers");
        assertTrue(workers.containsKey("syncer-purge"));
        WorkerHealthIndicator.WorkerStatus status = workers.get("syncer-purge");
        assertTrue(status.running());
        assertEquals(7L, status.iterations());
        assertEquals(1, status.consecutiveErrors());
    }

    @Test
    @DisplayName("should re-read supplied workers on every check")
    void shouldReReadSuppliedWorkersOnEveryCheck() {
        List<Worker> workers = new ArrayList<>();
        WorkerHealthIndicator healthIndicator = new WorkerHealthIndicator(() -> workers);

        assertEquals(Status.UNKNOWN, healthIndicator.health().getStatus());

        workers.add(worker("purge-components_gpu_events_v0_4_0", true, 0));

        assertEquals(Status.UP, healthIndicator.health().getStatus());
    }

    private static Worker worker(String name, boolean running, int consecutiveErrors) {
        Worker worker = mock(Worker.class);
        when(worker.name()).thenReturn(name);
        when(worker.isRunning()).thenReturn(running);
        when(worker.getConsecutiveErrorCount()).thenReturn(consecutiveErrors);
        return worker;
    }
}
