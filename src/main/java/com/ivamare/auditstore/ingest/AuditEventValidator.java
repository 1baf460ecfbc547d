package com.ivamare.auditstore.ingest;

import com.ivamare.auditstore.model.AuditEvent;
import com.ivamare.auditstore.model.AuditEventRequest;
import com.ivamare.auditstore.model.EventOutcome;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.UUID;

/**
 * Shape validation of inbound audit events.
 *
 * <p>Stateless: every finding is recorded in the request's {@link IngestContext}
 * so all problems of a request are reported together.
 */
public class AuditEventValidator {

    public static final String MISSING = "missing_field";
    public static final String INVALID_OUTCOME = "invalid_outcome";
    public static final String INVALID_TIMESTAMP = "invalid_timestamp";
    public static final String INVALID_UUID = "invalid_uuid";
    public static final String TOO_LONG = "too_long";
    public static final String OUT_OF_RANGE = "out_of_range";

    static final int MAX_LENGTH = 255;

    /**
     * Validate a request and convert it to an event without parent date.
     *
     * @param request request carrying an event id
     * @param context receives every violation found
     * @return the event, or null if any violation was recorded
     */
    public AuditEvent validate(AuditEventRequest request, IngestContext context) {
        UUID eventId = parseUuid("event_id", request.eventId(), true, context);
        requireText("service", request.service(), context);
        requireText("event_type", request.eventType(), context);
        requireText("correlation_id", request.correlationId(), context);
        requireText("operation", request.operation(), context);
        checkLength("version", request.version(), context);
        checkLength("actor_id", request.actorId(), context);
        checkLength("actor_type", request.actorType(), context);
        checkLength("resource_type", request.resourceType(), context);
        checkLength("resource_id", request.resourceId(), context);
        checkLength("severity", request.severity(), context);
        checkLength("error_code", request.errorCode(), context);

        Instant timestamp = parseTimestamp(request.eventTimestamp(), context);
        EventOutcome outcome = parseOutcome(request.outcome(), context);
        UUID parentEventId = parseUuid("parent_event_id", request.parentEventId(), false, context);

        if (request.durationMs() != null && request.durationMs() < 0) {
            context.reject("duration_ms", OUT_OF_RANGE, "duration_ms must be >= 0");
        }
        if (request.retentionDays() != null && request.retentionDays() <= 0) {
            context.reject("retention_days", OUT_OF_RANGE, "retention_days must be > 0");
        }

        if (context.hasViolations()) {
            return null;
        }

        return AuditEvent.builder()
            .eventId(eventId)
            .version(isBlank(request.version()) ? AuditEvent.DEFAULT_VERSION : request.version())
            .service(request.service())
            .eventType(request.eventType())
            .eventTimestamp(timestamp)
            .correlationId(request.correlationId())
            .outcome(outcome)
            .operation(request.operation())
            .eventData(request.eventData())
            .parentEventId(parentEventId)
            .actorId(request.actorId())
            .actorType(request.actorType())
            .resourceType(request.resourceType())
            .resourceId(request.resourceId())
            .severity(request.severity())
            .durationMs(request.durationMs())
            .errorCode(request.errorCode())
            .errorMessage(request.errorMessage())
            .retentionDays(request.retentionDays() != null
                ? request.retentionDays() : AuditEvent.DEFAULT_RETENTION_DAYS)
            .sensitive(Boolean.TRUE.equals(request.sensitive()))
            .build();
    }

    private void requireText(String field, String value, IngestContext context) {
        if (isBlank(value)) {
            context.reject(field, MISSING, field + " is required");
        } else {
            checkLength(field, value, context);
        }
    }

    private void checkLength(String field, String value, IngestContext context) {
        if (value != null && value.length() > MAX_LENGTH) {
            context.reject(field, TOO_LONG, field + " must be at most " + MAX_LENGTH + " characters");
        }
    }

    private Instant parseTimestamp(String value, IngestContext context) {
        if (isBlank(value)) {
            context.reject("event_timestamp", MISSING, "event_timestamp is required");
            return null;
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            context.reject("event_timestamp", INVALID_TIMESTAMP,
                "event_timestamp must be an ISO-8601 timestamp with offset");
            return null;
        }
    }

    private EventOutcome parseOutcome(String value, IngestContext context) {
        if (isBlank(value)) {
            context.reject("outcome", MISSING, "outcome is required");
            return null;
        }
        return EventOutcome.fromValue(value).orElseGet(() -> {
            context.reject("outcome", INVALID_OUTCOME, "outcome must be one of success, failure, pending");
            return null;
        });
    }

    private UUID parseUuid(String field, String value, boolean required, IngestContext context) {
        if (isBlank(value)) {
            if (required) {
                context.reject(field, MISSING, field + " is required");
            }
            return null;
        }
        try {
            UUID uuid = UUID.fromString(value);
            // UUID.fromString accepts shortened groups; require the canonical form
            if (!uuid.toString().equalsIgnoreCase(value)) {
                throw new IllegalArgumentException(value);
            }
            return uuid;
        } catch (IllegalArgumentException e) {
            context.reject(field, INVALID_UUID, field + " must be a UUID");
            return null;
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
