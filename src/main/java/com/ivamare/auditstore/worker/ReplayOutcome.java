package com.ivamare.auditstore.worker;

/**
 * What happened to a DLQ entry after one replay.
 */
public enum ReplayOutcome {
    SUCCEEDED,
    RETRIED,
    DEAD_LETTERED,
    /** The DLQ itself failed; the entry stays leased until its lease expires */
    ABANDONED
}
