package com.ivamare.auditstore.worker;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Worker that drains the DLQ and replays queued audit event writes.
 *
 * <p>Replays run with bounded parallelism and every entry is leased before it is
 * replayed, so an entry is never replayed by two workers at once.
 *
 * <p>Example:
 * <pre>
 * RecoveryWorker worker = new DlqRecoveryWorker(dlq, writer, retryPolicy, metrics, properties);
 * worker.start();
 * // ... later
 * worker.stop(Duration.ofSeconds(30)).join();
 * DrainStats stats = worker.drain(Duration.ofSeconds(10));
 * </pre>
 */
public interface RecoveryWorker {

    /**
     * Start the drain loop.
     */
    void start();

    /**
     * Stop the worker gracefully.
     *
     * <p>Stops leasing new entries and waits for in-flight replays to complete
     * within the specified timeout.
     *
     * @param timeout Maximum time to wait for in-flight replays
     * @return Future that completes when the worker has stopped
     */
    CompletableFuture<Void> stop(Duration timeout);

    /**
     * Stop the worker immediately without waiting.
     */
    void stopNow();

    /**
     * Replay entries on the calling thread until the DLQ is empty or the timeout expires.
     *
     * @param timeout Maximum time to spend draining
     * @return what happened to the entries replayed
     */
    DrainStats drain(Duration timeout);

    /**
     * @return true if the worker is leasing and replaying entries
     */
    boolean isRunning();

    /**
     * @return count of replays in progress
     */
    int inFlightCount();

    /**
     * @return consecutive errors reading the DLQ, reset on success
     */
    int getConsecutiveErrorCount();

    /**
     * @return name of the queue or destination this worker drains
     */
    String name();
}
