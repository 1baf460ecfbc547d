package com.ivamare.auditstore.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * An audit event as submitted by a producer, before validation.
 *
 * <p>All fields are kept in their wire form so that an invalid request can be
 * reported field by field, and so that a request parked in the DLQ is replayed
 * through exactly the same validation as a live one. {@code event_date} and
 * {@code parent_event_date} are never accepted from producers.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record AuditEventRequest(
    @JsonProperty("event_id") String eventId,
    @JsonProperty("version") String version,
    @JsonProperty("service") String service,
    @JsonProperty("event_type") String eventType,
    @JsonProperty("event_timestamp") String eventTimestamp,
    @JsonProperty("correlation_id") String correlationId,
    @JsonProperty("outcome") String outcome,
    @JsonProperty("operation") String operation,
    @JsonProperty("event_data") Map<String, Object> eventData,
    @JsonProperty("parent_event_id") String parentEventId,
    @JsonProperty("actor_id") String actorId,
    @JsonProperty("actor_type") String actorType,
    @JsonProperty("resource_type") String resourceType,
    @JsonProperty("resource_id") String resourceId,
    @JsonProperty("severity") String severity,
    @JsonProperty("duration_ms") Integer durationMs,
    @JsonProperty("error_code") String errorCode,
    @JsonProperty("error_message") String errorMessage,
    @JsonProperty("retention_days") Integer retentionDays,
    @JsonProperty("is_sensitive") Boolean sensitive
) {
    /**
     * Copy of this request carrying the given event id.
     */
    public AuditEventRequest withEventId(String eventId) {
        return new AuditEventRequest(
            eventId, version, service, eventType, eventTimestamp, correlationId, outcome,
            operation, eventData, parentEventId, actorId, actorType, resourceType, resourceId,
            severity, durationMs, errorCode, errorMessage, retentionDays, sensitive);
    }

    /**
     * Minimal request with only the required fields, mostly useful to producers
     * living in the same process.
     */
    public static AuditEventRequest of(
            String service,
            String eventType,
            String eventTimestamp,
            String correlationId,
            String outcome,
            String operation,
            Map<String, Object> eventData,
            String parentEventId) {
        return new AuditEventRequest(
            null, AuditEvent.DEFAULT_VERSION, service, eventType, eventTimestamp, correlationId,
            outcome, operation, eventData, parentEventId, null, null, null, null, null, null,
            null, null, null, null);
    }
}
