package com.ivamare.auditstore.ingest;

import com.ivamare.auditstore.exception.PartitionMissingException;
import com.ivamare.auditstore.exception.ReferentialIntegrityException;
import com.ivamare.auditstore.exception.StorageUnavailableException;
import com.ivamare.auditstore.exception.ValidationException;
import com.ivamare.auditstore.metrics.AuditStoreMetrics;
import com.ivamare.auditstore.model.AuditEvent;
import com.ivamare.auditstore.model.AuditEventRequest;
import com.ivamare.auditstore.model.InsertOutcome;
import com.ivamare.auditstore.repository.AuditEventRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.UUID;

/**
 * The validated write path: validate, resolve the parent, insert.
 *
 * <p>Shared by the ingestion gateway and the DLQ recovery worker so a replayed
 * event goes through exactly the checks a live one does.
 */
public class AuditEventWriter {

    private static final Logger log = LoggerFactory.getLogger(AuditEventWriter.class);

    private final AuditEventValidator validator;
    private final AuditEventRepository repository;
    private final AuditStoreMetrics metrics;

    public AuditEventWriter(AuditEventValidator validator, AuditEventRepository repository, AuditStoreMetrics metrics) {
        this.validator = validator;
        this.repository = repository;
        this.metrics = metrics;
    }

    /**
     * Write one event.
     *
     * @param request request carrying its event id
     * @param context per-request context
     * @return the written event and whether a row was created
     * @throws ValidationException if the request is malformed
     * @throws ReferentialIntegrityException if the parent does not exist
     * @throws PartitionMissingException if no partition covers the event date
     * @throws StorageUnavailableException if the store cannot be reached
     */
    public WriteResult write(AuditEventRequest request, IngestContext context) {
        AuditEvent event = validator.validate(request, context);
        context.throwIfInvalid();

        if (event.hasParent()) {
            UUID parentId = event.parentEventId();
            AuditEvent parent = repository.findById(parentId)
                .orElseThrow(() -> new ReferentialIntegrityException(parentId));
            event = event.toBuilder().parentEventDate(parent.eventDate()).build();
        }

        AuditEvent toInsert = event;
        InsertOutcome outcome = metrics.timeWrite(() -> repository.insert(toInsert));
        log.debug("Wrote event {} ({}) partition={} outcome={}", toInsert.eventId(),
            context.getOrigin(), toInsert.partition(), outcome);
        return new WriteResult(toInsert, outcome);
    }
}
