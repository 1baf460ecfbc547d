package com.ivamare.auditstore.exception;

import java.util.UUID;

/**
 * Thrown when an event references a parent event that does not exist.
 */
public class ReferentialIntegrityException extends AuditStoreException {

    private final UUID parentEventId;

    public ReferentialIntegrityException(UUID parentEventId) {
        super("parent event " + parentEventId + " does not exist");
        this.parentEventId = parentEventId;
    }

    public ReferentialIntegrityException(UUID parentEventId, Throwable cause) {
        super("parent event " + parentEventId + " does not exist", cause);
        this.parentEventId = parentEventId;
    }

    public UUID getParentEventId() {
        return parentEventId;
    }
}
