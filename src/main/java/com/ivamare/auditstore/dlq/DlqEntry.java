package com.ivamare.auditstore.dlq;

import com.ivamare.auditstore.model.AuditEventRequest;

import java.time.Instant;
import java.util.Objects;

/**
 * An audit event write parked in the DLQ.
 *
 * @param id Queue assigned id, unique within the queue
 * @param payload The original request, with its event id already assigned
 * @param destination Target table of the write
 * @param retryCount Number of failed replays so far
 * @param enqueuedAt When the write first failed
 * @param lastError Error of the most recent failure
 * @param state Lifecycle state
 */
public record DlqEntry(
    long id,
    AuditEventRequest payload,
    String destination,
    int retryCount,
    Instant enqueuedAt,
    String lastError,
    DlqEntryState state
) {
    public DlqEntry {
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(destination, "destination");
        Objects.requireNonNull(state, "state");
        if (retryCount < 0) {
            throw new IllegalArgumentException("retryCount must be >= 0");
        }
    }

    /**
     * Entry after one more failed replay.
     */
    public DlqEntry failedAttempt(String error) {
        return new DlqEntry(id, payload, destination, retryCount + 1, enqueuedAt, error, DlqEntryState.PENDING);
    }

    public DlqEntry withState(DlqEntryState newState) {
        return new DlqEntry(id, payload, destination, retryCount, enqueuedAt, lastError, newState);
    }

    public DlqEntry withId(long newId) {
        return new DlqEntry(newId, payload, destination, retryCount, enqueuedAt, lastError, state);
    }
}
