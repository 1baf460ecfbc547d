package com.ivamare.auditstore.ingest.impl;

import com.ivamare.auditstore.dlq.DeadLetterQueue;
import com.ivamare.auditstore.exception.PartitionMissingException;
import com.ivamare.auditstore.exception.ReferentialIntegrityException;
import com.ivamare.auditstore.exception.StorageUnavailableException;
import com.ivamare.auditstore.exception.ValidationException;
import com.ivamare.auditstore.ingest.AuditEventWriter;
import com.ivamare.auditstore.ingest.IngestContext;
import com.ivamare.auditstore.ingest.IngestResult;
import com.ivamare.auditstore.ingest.IngestionGateway;
import com.ivamare.auditstore.ingest.WriteResult;
import com.ivamare.auditstore.metrics.AuditStoreMetrics;
import com.ivamare.auditstore.model.AuditEventRequest;
import com.ivamare.auditstore.model.InsertOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Default implementation of IngestionGateway.
 */
public class DefaultIngestionGateway implements IngestionGateway {

    private static final Logger log = LoggerFactory.getLogger(DefaultIngestionGateway.class);

    public static final String REASON_VALIDATION = "validation_failed";
    public static final String REASON_PARENT_NOT_FOUND = "parent_not_found";
    public static final String REASON_PARTITION_MISSING = "partition_missing";

    private final AuditEventWriter writer;
    private final DeadLetterQueue deadLetterQueue;
    private final AuditStoreMetrics metrics;

    public DefaultIngestionGateway(AuditEventWriter writer, DeadLetterQueue deadLetterQueue, AuditStoreMetrics metrics) {
        this.writer = writer;
        this.deadLetterQueue = deadLetterQueue;
        this.metrics = metrics;
    }

    @Override
    public IngestResult ingest(AuditEventRequest request, IngestContext context) {
        AuditEventRequest identified = request.eventId() == null || request.eventId().isBlank()
            ? request.withEventId(UUID.randomUUID().toString())
            : request;

        try {
            WriteResult result = writer.write(identified, context);
            metrics.eventIngested(result.outcome() == InsertOutcome.CREATED ? "created" : "duplicate");
            return IngestResult.accepted(result.event().eventId(), result.event().eventDate(), result.outcome());
        } catch (ValidationException e) {
            context.getViolations().forEach(v -> metrics.validationFailure(v.code()));
            log.debug("Rejected event {}: {}", identified.eventId(), e.getMessage());
            throw e;
        } catch (ReferentialIntegrityException e) {
            metrics.validationFailure(REASON_PARENT_NOT_FOUND);
            log.debug("Rejected event {}: {}", identified.eventId(), e.getMessage());
            throw e;
        } catch (PartitionMissingException e) {
            metrics.partitionMissing();
            log.error("ALERT partition {} missing, event {} refused", e.getPartition(), identified.eventId());
            throw e;
        } catch (StorageUnavailableException e) {
            return fallbackToDlq(identified, e);
        }
    }

    @Override
    public List<IngestResult> ingestBatch(List<AuditEventRequest> requests) {
        List<IngestResult> results = new ArrayList<>(requests.size());
        for (AuditEventRequest request : requests) {
            results.add(ingestOne(request));
        }
        return results;
    }

    private IngestResult ingestOne(AuditEventRequest request) {
        AuditEventRequest identified = request.eventId() == null || request.eventId().isBlank()
            ? request.withEventId(UUID.randomUUID().toString())
            : request;
        UUID eventId = parseOrNull(identified.eventId());
        try {
            return ingest(identified, IngestContext.forProducer());
        } catch (ValidationException e) {
            return IngestResult.rejected(eventId, REASON_VALIDATION, e.getViolations());
        } catch (ReferentialIntegrityException e) {
            return IngestResult.rejected(eventId, REASON_PARENT_NOT_FOUND, List.of(e.getMessage()));
        } catch (PartitionMissingException e) {
            return IngestResult.rejected(eventId, REASON_PARTITION_MISSING, List.of(e.getMessage()));
        }
    }

    private IngestResult fallbackToDlq(AuditEventRequest request, StorageUnavailableException cause) {
        metrics.dlqFallback();
        String error = describe(cause);
        log.warn("Store unavailable, queueing event {} for replay: {}", request.eventId(), error);
        try {
            deadLetterQueue.enqueue(request, error);
            metrics.eventIngested("queued");
        } catch (RuntimeException e) {
            metrics.dlqEnqueueFailure();
            log.error("DLQ enqueue failed, event {} is lost: {}", request.eventId(), request, e);
        }
        return IngestResult.queued(UUID.fromString(request.eventId()));
    }

    private static String describe(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root == e ? e.getMessage() : e.getMessage() + ": " + root.getMessage();
    }

    private static UUID parseOrNull(String value) {
        try {
            return UUID.fromString(value);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
