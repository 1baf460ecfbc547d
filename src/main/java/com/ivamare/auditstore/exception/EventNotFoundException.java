package com.ivamare.auditstore.exception;

import java.util.UUID;

/**
 * Thrown when an event cannot be found.
 */
public class EventNotFoundException extends AuditStoreException {

    private final UUID eventId;

    public EventNotFoundException(UUID eventId) {
        super("Event not found: " + eventId);
        this.eventId = eventId;
    }

    public UUID getEventId() {
        return eventId;
    }
}
