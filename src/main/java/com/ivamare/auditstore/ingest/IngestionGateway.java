package com.ivamare.auditstore.ingest;

import com.ivamare.auditstore.exception.PartitionMissingException;
import com.ivamare.auditstore.exception.ReferentialIntegrityException;
import com.ivamare.auditstore.exception.ValidationException;
import com.ivamare.auditstore.model.AuditEventRequest;

import java.util.List;

/**
 * Entry point for producers.
 *
 * <p>Best effort toward the caller: a storage outage never fails the call. The
 * event is parked in the DLQ and reported as queued. The gateway never retries
 * synchronously.
 */
public interface IngestionGateway {

    /**
     * Ingest one event.
     *
     * @param request the event; an event id is assigned when absent
     * @param context per-request context collecting violations
     * @return {@link IngestResult.Status#ACCEPTED} or {@link IngestResult.Status#QUEUED}
     * @throws ValidationException if the request is malformed
     * @throws ReferentialIntegrityException if the referenced parent does not exist
     * @throws PartitionMissingException if no partition covers the event date
     */
    IngestResult ingest(AuditEventRequest request, IngestContext context);

    /**
     * Ingest several events independently. A rejected event does not affect the others.
     *
     * @return one result per request, in request order
     */
    List<IngestResult> ingestBatch(List<AuditEventRequest> requests);
}
