package com.ivamare.auditstore.worker.impl;

import com.ivamare.auditstore.AuditStoreProperties.ResilienceProperties;
import com.ivamare.auditstore.AuditStoreProperties.WorkerProperties;
import com.ivamare.auditstore.dlq.DeadLetterQueue;
import com.ivamare.auditstore.dlq.DlqEntry;
import com.ivamare.auditstore.exception.DatabaseExceptionClassifier;
import com.ivamare.auditstore.exception.PartitionMissingException;
import com.ivamare.auditstore.exception.ValidationException;
import com.ivamare.auditstore.ingest.AuditEventWriter;
import com.ivamare.auditstore.ingest.IngestContext;
import com.ivamare.auditstore.ingest.WriteResult;
import com.ivamare.auditstore.metrics.AuditStoreMetrics;
import com.ivamare.auditstore.policy.RetryPolicy;
import com.ivamare.auditstore.worker.DrainStats;
import com.ivamare.auditstore.worker.RecoveryWorker;
import com.ivamare.auditstore.worker.ReplayOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Polling DLQ recovery worker.
 *
 * <p>One loop thread leases as many entries as there are free replay slots and
 * hands each to a fixed pool of replay threads. A failed replay is rescheduled
 * with exponential backoff from the {@link RetryPolicy} until the retry ceiling,
 * then dead-lettered. A malformed payload can never succeed and is dead-lettered
 * on its first failure.
 */
public class DlqRecoveryWorker implements RecoveryWorker {

    private static final Logger log = LoggerFactory.getLogger(DlqRecoveryWorker.class);

    private final DeadLetterQueue deadLetterQueue;
    private final AuditEventWriter writer;
    private final RetryPolicy retryPolicy;
    private final AuditStoreMetrics metrics;
    private final String name;
    private final Duration lease;
    private final int pollIntervalMs;
    private final int concurrency;
    private final long warnDepth;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean stopping = new AtomicBoolean(false);
    private final AtomicBoolean depthWarning = new AtomicBoolean(false);
    private final AtomicInteger inFlightCount = new AtomicInteger(0);
    private final AtomicInteger consecutiveErrors = new AtomicInteger(0);
    private final Semaphore semaphore;

    // Resilience configuration
    private final long initialBackoffMs;
    private final long maxBackoffMs;
    private final double backoffMultiplier;
    private final int errorThreshold;

    private ExecutorService executor;

    /**
     * Creates a new DlqRecoveryWorker.
     *
     * @param deadLetterQueue Queue to drain
     * @param writer Validated write path shared with the ingestion gateway
     * @param retryPolicy Retry ceiling and backoff for failed replays
     * @param metrics Meters
     * @param properties Worker configuration
     * @param warnDepth DLQ depth above which growth is logged at WARN
     */
    public DlqRecoveryWorker(
            DeadLetterQueue deadLetterQueue,
            AuditEventWriter writer,
            RetryPolicy retryPolicy,
            AuditStoreMetrics metrics,
            WorkerProperties properties,
            long warnDepth) {
        this.deadLetterQueue = deadLetterQueue;
        this.writer = writer;
        this.retryPolicy = retryPolicy;
        this.metrics = metrics;
        this.name = DeadLetterQueue.AUDIT_EVENTS_DESTINATION;
        this.lease = Duration.ofSeconds(properties.getLeaseSeconds());
        this.pollIntervalMs = properties.getPollIntervalMs();
        this.concurrency = Math.max(1, properties.getConcurrency());
        this.warnDepth = warnDepth;

        this.semaphore = new Semaphore(concurrency);

        ResilienceProperties resilience = properties.getResilience();
        this.initialBackoffMs = resilience.getInitialBackoffMs();
        this.maxBackoffMs = resilience.getMaxBackoffMs();
        this.backoffMultiplier = resilience.getBackoffMultiplier();
        this.errorThreshold = resilience.getErrorThreshold();
    }

    @Override
    public void start() {
        if (running.getAndSet(true)) {
            log.warn("Recovery worker for {} already running", name);
            return;
        }

        stopping.set(false);
        // one extra thread for the loop itself
        executor = Executors.newFixedThreadPool(concurrency + 1,
            new CustomizableThreadFactory("dlq-recovery-" + name + "-"));

        log.info("Starting recovery worker for {}, concurrency={}, lease={}s, pollInterval={}ms",
            name, concurrency, lease.toSeconds(), pollIntervalMs);

        executor.submit(this::runLoop);
    }

    @Override
    public CompletableFuture<Void> stop(Duration timeout) {
        if (!running.get()) {
            return CompletableFuture.completedFuture(null);
        }

        stopping.set(true);
        log.info("Stopping recovery worker for {}, waiting for {} in-flight replays",
            name, inFlightCount.get());

        return CompletableFuture.runAsync(() -> {
            try {
                long deadline = System.currentTimeMillis() + timeout.toMillis();
                while (inFlightCount.get() > 0 && System.currentTimeMillis() < deadline) {
                    Thread.sleep(100);
                }

                if (inFlightCount.get() > 0) {
                    log.warn("Timeout waiting for {} in-flight replays, their leases will expire",
                        inFlightCount.get());
                }

                running.set(false);
                executor.shutdown();

                if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }

                log.info("Recovery worker for {} stopped", name);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
    }

    @Override
    public void stopNow() {
        stopping.set(true);
        running.set(false);
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    @Override
    public DrainStats drain(Duration timeout) {
        long deadline = System.currentTimeMillis() + timeout.toMillis();
        int succeeded = 0;
        int retried = 0;
        int deadLettered = 0;

        while (System.currentTimeMillis() < deadline) {
            List<DlqEntry> entries = deadLetterQueue.lease(concurrency, lease);
            if (entries.isEmpty()) {
                log.info("Drained DLQ {}: succeeded={}, retried={}, deadLettered={}",
                    name, succeeded, retried, deadLettered);
                return new DrainStats(succeeded, retried, deadLettered, false);
            }
            for (DlqEntry entry : entries) {
                switch (replay(entry)) {
                    case SUCCEEDED -> succeeded++;
                    case RETRIED -> retried++;
                    case DEAD_LETTERED -> deadLettered++;
                    case ABANDONED -> { }
                }
            }
        }

        log.warn("DLQ drain for {} timed out after {}: succeeded={}, retried={}, deadLettered={}",
            name, timeout, succeeded, retried, deadLettered);
        return new DrainStats(succeeded, retried, deadLettered, true);
    }

    @Override
    public boolean isRunning() {
        return running.get() && !stopping.get();
    }

    @Override
    public int inFlightCount() {
        return inFlightCount.get();
    }

    @Override
    public int getConsecutiveErrorCount() {
        return consecutiveErrors.get();
    }

    @Override
    public String name() {
        return name;
    }

    // --- Main Processing Loop ---

    private void runLoop() {
        log.debug("Recovery loop started for {}", name);

        try {
            while (running.get() && !stopping.get()) {
                try {
                    drainQueue();
                    checkDepth();
                    consecutiveErrors.set(0);
                    if (stopping.get()) {
                        return;
                    }

                    sleep(pollIntervalMs);
                } catch (Exception e) {
                    if (!stopping.get()) {
                        int errors = consecutiveErrors.incrementAndGet();
                        long backoff = calculateBackoff(errors);
                        logQueueError(errors, backoff, e);
                        sleep(backoff);
                    }
                }
            }
        } finally {
            running.set(false);
            log.debug("Recovery loop ended for {}", name);
        }
    }

    /**
     * Calculate exponential backoff delay with jitter.
     *
     * @param errorCount consecutive error count (1-based)
     * @return delay in milliseconds
     */
    long calculateBackoff(int errorCount) {
        if (errorCount <= 0) {
            return initialBackoffMs;
        }
        double delay = initialBackoffMs * Math.pow(backoffMultiplier, errorCount - 1);
        // +/- 10%
        double jitter = delay * 0.1 * (Math.random() * 2 - 1);
        return Math.min((long) (delay + jitter), maxBackoffMs);
    }

    private void logQueueError(int errorCount, long backoffMs, Exception e) {
        String reason = DatabaseExceptionClassifier.isTransient(e)
            ? DatabaseExceptionClassifier.getTransientReason(e)
            : e.getClass().getSimpleName();
        String message = "Recovery worker {} cannot read DLQ (count={}, reason={}), backing off {}ms: {}";

        if (errorCount >= errorThreshold) {
            log.error(message, name, errorCount, reason, backoffMs, e.getMessage());
        } else {
            log.warn(message, name, errorCount, reason, backoffMs, e.getMessage());
        }
    }

    private void drainQueue() {
        while (running.get() && !stopping.get()) {
            int availableSlots = semaphore.availablePermits();
            if (availableSlots == 0) {
                waitForSlot();
                continue;
            }

            List<DlqEntry> entries = deadLetterQueue.lease(availableSlots, lease);
            if (entries.isEmpty()) {
                break;
            }

            for (DlqEntry entry : entries) {
                submit(entry);
            }
        }
    }

    private void checkDepth() {
        long depth = deadLetterQueue.depth();
        if (depth > warnDepth) {
            if (!depthWarning.getAndSet(true)) {
                log.warn("DLQ {} depth {} exceeds warning threshold {}", name, depth, warnDepth);
            }
        } else if (depthWarning.getAndSet(false)) {
            log.info("DLQ {} depth {} back under warning threshold {}", name, depth, warnDepth);
        }
    }

    private void waitForSlot() {
        try {
            semaphore.acquire();
            semaphore.release();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void sleep(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    // --- Replay ---

    private void submit(DlqEntry entry) {
        try {
            semaphore.acquire();
            inFlightCount.incrementAndGet();

            executor.submit(() -> {
                try {
                    replay(entry);
                } finally {
                    inFlightCount.decrementAndGet();
                    semaphore.release();
                }
            });

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Replay one leased entry and settle it in the DLQ.
     */
    ReplayOutcome replay(DlqEntry entry) {
        log.debug("Replaying DLQ entry {} (event {}, retry_count={})",
            entry.id(), entry.payload().eventId(), entry.retryCount());
        try {
            WriteResult result;
            try {
                result = writer.write(entry.payload(), IngestContext.forReplay());
            } catch (ValidationException e) {
                return deadLetter(entry.failedAttempt("invalid payload: " + e.getMessage()));
            } catch (PartitionMissingException e) {
                metrics.partitionMissing();
                return retryOrDeadLetter(entry.failedAttempt(e.getMessage()));
            } catch (RuntimeException e) {
                return retryOrDeadLetter(entry.failedAttempt(e.getMessage()));
            }

            deadLetterQueue.acknowledge(entry);
            metrics.replay("succeeded");
            log.info("Replayed event {} from DLQ ({})", result.event().eventId(), result.outcome());
            return ReplayOutcome.SUCCEEDED;
        } catch (RuntimeException e) {
            log.warn("Could not settle DLQ entry {}, it will be leased again after {}s: {}",
                entry.id(), lease.toSeconds(), e.getMessage());
            return ReplayOutcome.ABANDONED;
        }
    }

    private ReplayOutcome retryOrDeadLetter(DlqEntry failed) {
        if (!retryPolicy.shouldRetry(failed.retryCount())) {
            return deadLetter(failed);
        }
        Duration delay = retryPolicy.getBackoff(failed.retryCount());
        deadLetterQueue.retryLater(failed, delay);
        metrics.replay("retried");
        log.warn("Replay of event {} failed (retry {}/{}), next attempt in {}s: {}",
            failed.payload().eventId(), failed.retryCount(), retryPolicy.maxRetries(),
            delay.toSeconds(), failed.lastError());
        return ReplayOutcome.RETRIED;
    }

    private ReplayOutcome deadLetter(DlqEntry failed) {
        deadLetterQueue.deadLetter(failed);
        metrics.deadLettered();
        log.error("ALERT event {} dead-lettered after {} failed replays: {}",
            failed.payload().eventId(), failed.retryCount(), failed.lastError());
        return ReplayOutcome.DEAD_LETTERED;
    }
}
