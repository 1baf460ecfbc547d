package com.ivamare.auditstore.worker;

/**
 * Result of a synchronous DLQ drain.
 *
 * @param succeeded Entries replayed and removed
 * @param retried Entries rescheduled after a failed replay
 * @param deadLettered Entries moved to the dead-letter location
 * @param timedOut Whether the drain stopped at its deadline with entries still visible
 */
public record DrainStats(int succeeded, int retried, int deadLettered, boolean timedOut) {

    public int total() {
        return succeeded + retried + deadLettered;
    }
}
