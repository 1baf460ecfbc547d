package com.ivamare.auditstore.dlq;

/**
 * Lifecycle of a DLQ entry.
 *
 * <pre>
 * PENDING -> IN_FLIGHT -> SUCCEEDED (removed)
 *               |   \
 *               |    -> DEAD_LETTERED (terminal)
 *               v
 *            PENDING (after backoff)
 * </pre>
 */
public enum DlqEntryState {
    /** Waiting to be leased, possibly after a backoff delay */
    PENDING,
    /** Leased by a recovery worker */
    IN_FLIGHT,
    /** Replayed successfully and removed */
    SUCCEEDED,
    /** Retry ceiling reached, never replayed again */
    DEAD_LETTERED
}
