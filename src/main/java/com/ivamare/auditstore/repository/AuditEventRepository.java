package com.ivamare.auditstore.repository;

import com.ivamare.auditstore.exception.ChildEventsExistException;
import com.ivamare.auditstore.exception.EventNotFoundException;
import com.ivamare.auditstore.exception.PartitionMissingException;
import com.ivamare.auditstore.exception.ReferentialIntegrityException;
import com.ivamare.auditstore.exception.StorageUnavailableException;
import com.ivamare.auditstore.model.AuditEvent;
import com.ivamare.auditstore.model.InsertOutcome;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only, monthly partitioned store of audit events.
 *
 * <p>Parent existence, partition resolution and the row write of an insert
 * happen as one atomic unit, and a delete checks for children in the same
 * critical section that removes the row, so no interleaving of inserts and
 * deletes can leave a child whose parent is gone.
 */
public interface AuditEventRepository {

    /**
     * Insert an event.
     *
     * @param event the event; when it has a parent, {@code parentEventDate} must be set
     * @return {@link InsertOutcome#DUPLICATE} if an event with the same id already exists
     * @throws ReferentialIntegrityException if the parent does not exist
     * @throws PartitionMissingException if no partition covers the event date
     * @throws StorageUnavailableException if the store cannot be reached
     */
    InsertOutcome insert(AuditEvent event);

    /**
     * Look up an event without knowing its partition.
     */
    Optional<AuditEvent> findById(UUID eventId);

    /**
     * Partition-local lookup.
     */
    Optional<AuditEvent> findById(UUID eventId, LocalDate eventDate);

    /**
     * Delete an event that has no children.
     *
     * @throws EventNotFoundException if no such event exists
     * @throws ChildEventsExistException if at least one event references it
     */
    void delete(UUID eventId, LocalDate eventDate);

    boolean hasPartition(YearMonth month);

    /**
     * Create the partition for a month. No-op if it already exists.
     */
    void createPartition(YearMonth month);
}
