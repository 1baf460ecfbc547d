package com.ivamare.auditstore;

import com.ivamare.auditstore.worker.DrainStats;
import com.ivamare.auditstore.worker.RecoveryWorker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;

import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Auto-start configuration for the DLQ recovery worker.
 *
 * <p>Enable with:
 * <pre>
 * auditstore:
 *   worker:
 *     auto-start: true
 * </pre>
 *
 * <p>On shutdown the worker stops leasing, waits for in-flight replays, then
 * drains what is left for at most {@code auditstore.worker.shutdown-drain-timeout}.
 */
@AutoConfiguration(after = AuditStoreAutoConfiguration.class)
@ConditionalOnBean(RecoveryWorker.class)
@ConditionalOnProperty(prefix = "auditstore.worker", name = "auto-start", havingValue = "true")
public class RecoveryWorkerAutoStartConfiguration {

    private static final Logger log = LoggerFactory.getLogger(RecoveryWorkerAutoStartConfiguration.class);

    static final Duration STOP_TIMEOUT = Duration.ofSeconds(30);

    private final RecoveryWorker worker;
    private final AuditStoreProperties properties;

    public RecoveryWorkerAutoStartConfiguration(RecoveryWorker worker, AuditStoreProperties properties) {
        this.worker = worker;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void startWorker() {
        worker.start();
        log.info("Started recovery worker for {}", worker.name());
    }

    @PreDestroy
    public void stopWorker() {
        if (!worker.isRunning()) {
            return;
        }

        log.info("Stopping recovery worker for {}...", worker.name());
        try {
            worker.stop(STOP_TIMEOUT).get(STOP_TIMEOUT.toMillis() + 1000, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Recovery worker did not stop within {}s", STOP_TIMEOUT.toSeconds());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        } catch (Exception e) {
            log.warn("Error stopping recovery worker: {}", e.getMessage());
        }

        Duration drainTimeout = properties.getWorker().getShutdownDrainTimeout();
        if (drainTimeout != null && !drainTimeout.isZero() && !drainTimeout.isNegative()) {
            try {
                DrainStats stats = worker.drain(drainTimeout);
                log.info("Shutdown drain finished: {}", stats);
            } catch (RuntimeException e) {
                log.warn("Shutdown drain aborted, entries stay in the DLQ: {}", e.getMessage());
            }
        }
        log.info("Recovery worker stopped");
    }
}
