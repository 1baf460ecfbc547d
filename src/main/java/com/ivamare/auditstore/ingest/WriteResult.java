package com.ivamare.auditstore.ingest;

import com.ivamare.auditstore.model.AuditEvent;
import com.ivamare.auditstore.model.InsertOutcome;

/**
 * @param event The event as written, parent date resolved
 * @param outcome Whether a row was created
 */
public record WriteResult(AuditEvent event, InsertOutcome outcome) {
}
