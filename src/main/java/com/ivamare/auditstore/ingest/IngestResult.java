package com.ivamare.auditstore.ingest;

import com.ivamare.auditstore.model.InsertOutcome;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Outcome of ingesting one event.
 *
 * @param status Accepted, queued for replay or rejected
 * @param eventId Event id, assigned by the gateway when the producer sent none
 * @param eventDate Partition date, null unless accepted
 * @param insertOutcome Created or duplicate, null unless accepted
 * @param reason Rejection reason code, null unless rejected
 * @param violations Rejection details, empty unless rejected
 */
public record IngestResult(
    Status status,
    UUID eventId,
    LocalDate eventDate,
    InsertOutcome insertOutcome,
    String reason,
    List<String> violations
) {
    public enum Status {
        /** Persisted in the store */
        ACCEPTED,
        /** Store unavailable; accepted into the DLQ for replay */
        QUEUED,
        /** Not persisted and will not be */
        REJECTED
    }

    public IngestResult {
        violations = violations != null ? List.copyOf(violations) : List.of();
    }

    public static IngestResult accepted(UUID eventId, LocalDate eventDate, InsertOutcome outcome) {
        return new IngestResult(Status.ACCEPTED, eventId, eventDate, outcome, null, null);
    }

    public static IngestResult queued(UUID eventId) {
        return new IngestResult(Status.QUEUED, eventId, null, null, null, null);
    }

    public static IngestResult rejected(UUID eventId, String reason, List<String> violations) {
        return new IngestResult(Status.REJECTED, eventId, null, null, reason, violations);
    }
}
