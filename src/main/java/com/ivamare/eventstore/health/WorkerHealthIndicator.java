package com.ivamare.eventstore.health;

import com.ivamare.eventstore.worker.Worker;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Health indicator for background loops (bucket purgers, syncer loops).
 *
 * <p>Reports:
 * <ul>
 *   <li>Status of each loop by name</li>
 *   <li>Iteration counts</li>
 *   <li>Overall health based on loop status</li>
 * </ul>
 */
public class WorkerHealthIndicator implements HealthIndicator {

    static final int MAX_CONSECUTIVE_ERRORS = 5;

    private final Supplier<List<Worker>> workers;

    public WorkerHealthIndicator(List<Worker> workers) {
        List<Worker> fixed = workers != null ? List.copyOf(workers) : List.of();
        this.workers = () -> fixed;
    }

    /**
     * Creates an indicator over a changing set of workers, e.g. the purge
     * loops of buckets opened after startup.
     *
     * @param workers Supplier called on every health check
     */
    public WorkerHealthIndicator(Supplier<List<Worker>> workers) {
        this.workers = workers;
    }

    @Override
    public Health health() {
        List<Worker> current = workers.get();
        if (current == null || current.isEmpty()) {
            return Health.unknown()
                .withDetail("message", "No workers registered")
                .build();
        }

        Map<String, WorkerStatus> workerStatuses = current.stream()
            .collect(Collectors.toMap(
                Worker::name,
                w -> new WorkerStatus(w.isRunning(), w.iterationCount(), w.getConsecutiveErrorCount()),
                (existing, replacement) -> existing
            ));

        boolean allRunning = current.stream().allMatch(Worker::isRunning);
        int maxConsecutiveErrors = current.stream()
            .mapToInt(Worker::getConsecutiveErrorCount)
            .max()
            .orElse(0);

        boolean healthy = allRunning && maxConsecutiveErrors < MAX_CONSECUTIVE_ERRORS;
        Health.Builder builder = healthy ? Health.up() : Health.down();

        return builder
            .withDetail("workers", workerStatuses)
            .withDetail("maxConsecutiveErrors", maxConsecutiveErrors)
            .build();
    }

    record WorkerStatus(boolean running, long iterations, int consecutiveErrors) {}
}
