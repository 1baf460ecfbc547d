package com.ivamare.auditstore.web;

import com.ivamare.auditstore.exception.ValidationException;
import com.ivamare.auditstore.ingest.IngestContext;
import com.ivamare.auditstore.ingest.IngestResult;
import com.ivamare.auditstore.ingest.IngestionGateway;
import com.ivamare.auditstore.model.AuditEventRequest;
import com.ivamare.auditstore.web.dto.BatchIngestResponse;
import com.ivamare.auditstore.web.dto.IngestResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Write API for audit events.
 */
@RestController
@RequestMapping("/api/v1/audit/events")
public class AuditEventController {

    static final int MAX_BATCH_SIZE = 1000;

    private final IngestionGateway gateway;

    public AuditEventController(IngestionGateway gateway) {
        this.gateway = gateway;
    }

    /**
     * 201 when stored (created or duplicate), 202 when queued for replay.
     * Rejections surface as problem details through the exception handler.
     */
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<IngestResponse> ingest(@RequestBody AuditEventRequest request) {
        IngestResult result = gateway.ingest(request, IngestContext.forProducer());
        HttpStatus status = result.status() == IngestResult.Status.QUEUED
            ? HttpStatus.ACCEPTED
            : HttpStatus.CREATED;
        return ResponseEntity.status(status).body(IngestResponse.from(result));
    }

    @PostMapping(path = "/batch", consumes = MediaType.APPLICATION_JSON_VALUE)
    public BatchIngestResponse ingestBatch(@RequestBody List<AuditEventRequest> requests) {
        if (requests.isEmpty()) {
            throw new ValidationException("batch must contain at least one event");
        }
        if (requests.size() > MAX_BATCH_SIZE) {
            throw new ValidationException("batch exceeds " + MAX_BATCH_SIZE + " events");
        }
        List<IngestResponse> results = gateway.ingestBatch(requests).stream()
            .map(IngestResponse::from)
            .toList();
        return BatchIngestResponse.of(results);
    }
}
