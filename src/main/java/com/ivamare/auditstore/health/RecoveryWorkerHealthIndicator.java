package com.ivamare.auditstore.health;

import com.ivamare.auditstore.worker.RecoveryWorker;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

/**
 * Health indicator for the DLQ recovery worker.
 *
 * <p>Reports UNKNOWN while the worker is not running (auto-start disabled),
 * DOWN once reading the DLQ has failed {@code errorThreshold} times in a row.
 */
public class RecoveryWorkerHealthIndicator implements HealthIndicator {

    private final RecoveryWorker worker;
    private final int errorThreshold;

    public RecoveryWorkerHealthIndicator(RecoveryWorker worker, int errorThreshold) {
        this.worker = worker;
        this.errorThreshold = errorThreshold;
    }

    @Override
    public Health health() {
        int consecutiveErrors = worker.getConsecutiveErrorCount();
        if (!worker.isRunning()) {
            return Health.unknown()
                .withDetail("worker", worker.name())
                .withDetail("message", "Recovery worker not running")
                .build();
        }

        Health.Builder builder = consecutiveErrors < errorThreshold ? Health.up() : Health.down();
        return builder
            .withDetail("worker", worker.name())
            .withDetail("inFlight", worker.inFlightCount())
            .withDetail("consecutiveErrors", consecutiveErrors)
            .build();
    }
}
