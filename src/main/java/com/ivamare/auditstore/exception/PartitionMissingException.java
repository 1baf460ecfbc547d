package com.ivamare.auditstore.exception;

import java.time.LocalDate;
import java.time.YearMonth;

/**
 * Thrown when the partition an event belongs to has not been created.
 *
 * <p>This is an operational condition, not a caller error: the write is neither
 * dropped nor rerouted, and an alert is raised.
 */
public class PartitionMissingException extends AuditStoreException {

    private final LocalDate eventDate;

    public PartitionMissingException(LocalDate eventDate) {
        this(eventDate, null);
    }

    public PartitionMissingException(LocalDate eventDate, Throwable cause) {
        super("no partition exists for event_date " + eventDate
            + " (bucket " + YearMonth.from(eventDate) + ")", cause);
        this.eventDate = eventDate;
    }

    public LocalDate getEventDate() {
        return eventDate;
    }

    public YearMonth getPartition() {
        return YearMonth.from(eventDate);
    }
}
