package com.ivamare.auditstore.metrics;

import com.ivamare.auditstore.dlq.DeadLetterQueue;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * Micrometer meters emitted by the audit store.
 *
 * <p>Meter names:
 * <ul>
 *   <li>{@code auditstore.events.ingested} (tag {@code result}: created, duplicate, queued)</li>
 *   <li>{@code auditstore.validation.failures} (tag {@code reason})</li>
 *   <li>{@code auditstore.write.latency}</li>
 *   <li>{@code auditstore.dlq.fallbacks}, {@code auditstore.dlq.enqueue.failures}</li>
 *   <li>{@code auditstore.dlq.replays} (tag {@code result}: succeeded, retried)</li>
 *   <li>{@code auditstore.dlq.dead_lettered}</li>
 *   <li>{@code auditstore.dlq.depth}</li>
 *   <li>{@code auditstore.partition.missing}</li>
 *   <li>{@code auditstore.aggregation.failures}</li>
 * </ul>
 */
public class AuditStoreMetrics {

    private static final Logger log = LoggerFactory.getLogger(AuditStoreMetrics.class);

    private final MeterRegistry registry;
    private final Timer writeTimer;
    private final Counter dlqFallbacks;
    private final Counter dlqEnqueueFailures;
    private final Counter deadLettered;
    private final Counter partitionMissing;
    private final Counter aggregationFailures;

    public AuditStoreMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.writeTimer = Timer.builder("auditstore.write.latency")
            .description("Synchronous audit event store writes")
            .register(registry);
        this.dlqFallbacks = Counter.builder("auditstore.dlq.fallbacks")
            .description("Events sent to the DLQ because the store was unavailable")
            .register(registry);
        this.dlqEnqueueFailures = Counter.builder("auditstore.dlq.enqueue.failures")
            .description("Events lost because the DLQ enqueue failed")
            .register(registry);
        this.deadLettered = Counter.builder("auditstore.dlq.dead_lettered")
            .description("DLQ entries that exhausted their retries")
            .register(registry);
        this.partitionMissing = Counter.builder("auditstore.partition.missing")
            .description("Writes refused because no partition covers the event date")
            .register(registry);
        this.aggregationFailures = Counter.builder("auditstore.aggregation.failures")
            .description("Success-rate queries that failed on storage")
            .register(registry);
    }

    public <T> T timeWrite(Supplier<T> write) {
        return writeTimer.record(write);
    }

    public void eventIngested(String result) {
        registry.counter("auditstore.events.ingested", "result", result).increment();
    }

    public void validationFailure(String reason) {
        registry.counter("auditstore.validation.failures", "reason", reason).increment();
    }

    public void dlqFallback() {
        dlqFallbacks.increment();
    }

    public void dlqEnqueueFailure() {
        dlqEnqueueFailures.increment();
    }

    public void replay(String result) {
        registry.counter("auditstore.dlq.replays", "result", result).increment();
    }

    public void deadLettered() {
        deadLettered.increment();
    }

    public void partitionMissing() {
        partitionMissing.increment();
    }

    public void aggregationFailure() {
        aggregationFailures.increment();
    }

    /**
     * Register the DLQ depth gauge. The gauge reads NaN while the queue cannot be reached.
     */
    public void bindDlqDepth(DeadLetterQueue dlq) {
        Gauge.builder("auditstore.dlq.depth", dlq, AuditStoreMetrics::safeDepth)
            .description("Entries waiting in the DLQ")
            .register(registry);
    }

    private static double safeDepth(DeadLetterQueue dlq) {
        try {
            return dlq.depth();
        } catch (RuntimeException e) {
            log.debug("DLQ depth unavailable: {}", e.getMessage());
            return Double.NaN;
        }
    }
}
