package com.ivamare.auditstore.exception;

import java.util.UUID;

/**
 * Thrown when deleting an event that is still referenced as a parent.
 */
public class ChildEventsExistException extends AuditStoreException {

    private final UUID eventId;

    public ChildEventsExistException(UUID eventId) {
        this(eventId, null);
    }

    public ChildEventsExistException(UUID eventId, Throwable cause) {
        super("event " + eventId + " has child events and cannot be deleted", cause);
        this.eventId = eventId;
    }

    public UUID getEventId() {
        return eventId;
    }
}
