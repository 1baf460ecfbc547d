package com.ivamare.auditstore.dlq;

import com.ivamare.auditstore.model.AuditEventRequest;

import java.time.Duration;
import java.util.List;

/**
 * Durable holding area for audit event writes that failed on a storage outage.
 *
 * <p>The ingestion gateway only enqueues. Leasing, acknowledging, rescheduling
 * and dead-lettering belong to the recovery worker. A leased entry is invisible
 * to other readers until its lease expires, so an entry abandoned by a crashed
 * worker is picked up again.
 */
public interface DeadLetterQueue {

    /** Destination recorded on entries written by the audit event gateway */
    String AUDIT_EVENTS_DESTINATION = "audit_events";

    /**
     * Park a failed write.
     *
     * @param request the request, carrying its assigned event id
     * @param error why the write failed
     * @return the stored entry
     */
    DlqEntry enqueue(AuditEventRequest request, String error);

    /**
     * Lease visible entries.
     *
     * @param maxEntries upper bound on entries returned
     * @param leaseDuration how long the entries stay hidden from other readers
     * @return leased entries in {@link DlqEntryState#IN_FLIGHT}, possibly empty
     */
    List<DlqEntry> lease(int maxEntries, Duration leaseDuration);

    /**
     * Remove an entry whose replay succeeded.
     */
    void acknowledge(DlqEntry entry);

    /**
     * Store the updated entry and make it visible again after a delay.
     *
     * @param entry entry carrying the incremented retry count and last error
     * @param delay backoff before the next lease
     */
    void retryLater(DlqEntry entry, Duration delay);

    /**
     * Move the entry to the permanent dead-letter location.
     *
     * @param entry entry carrying the final retry count and last error
     */
    void deadLetter(DlqEntry entry);

    /**
     * @return number of entries waiting or in flight
     */
    long depth();

    /**
     * @param limit maximum number of entries
     * @return dead-lettered entries, most recent first
     */
    List<DlqEntry> deadLetters(int limit);
}
