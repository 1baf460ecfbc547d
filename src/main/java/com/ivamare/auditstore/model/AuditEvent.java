package com.ivamare.auditstore.model;

import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * An immutable audit event as persisted in the store.
 *
 * <p>{@code eventDate} is always the UTC calendar date of {@code eventTimestamp}
 * and selects the monthly partition. {@code parentEventDate} is resolved from the
 * stored parent at write time and is null when the event has no parent.
 *
 * @param eventId Globally unique identifier
 * @param eventDate Partition key, derived from eventTimestamp
 * @param version Schema version of the event
 * @param service Identity of the producing service
 * @param eventType Producer defined event type
 * @param eventTimestamp When the event happened
 * @param correlationId Id shared by all events of one flow
 * @param outcome Outcome reported by the producer
 * @param operation Operation the event describes
 * @param eventData Opaque event payload
 * @param parentEventId Optional causal parent
 * @param parentEventDate Partition key of the parent
 * @param actorId Optional actor identifier
 * @param actorType Optional actor type
 * @param resourceType Optional type of the affected resource
 * @param resourceId Optional id of the affected resource
 * @param severity Optional severity
 * @param durationMs Optional duration of the operation
 * @param errorCode Optional error code
 * @param errorMessage Optional error message
 * @param retentionDays Retention period in days
 * @param sensitive Whether the event carries sensitive data
 * @param createdAt When the store wrote the row, null before insert
 */
public record AuditEvent(
    UUID eventId,
    LocalDate eventDate,
    String version,
    String service,
    String eventType,
    Instant eventTimestamp,
    String correlationId,
    EventOutcome outcome,
    String operation,
    Map<String, Object> eventData,
    UUID parentEventId,
    LocalDate parentEventDate,
    String actorId,
    String actorType,
    String resourceType,
    String resourceId,
    String severity,
    Integer durationMs,
    String errorCode,
    String errorMessage,
    int retentionDays,
    boolean sensitive,
    Instant createdAt
) {
    public static final String DEFAULT_VERSION = "1.0";

    /** Seven years. */
    public static final int DEFAULT_RETENTION_DAYS = 2555;

    public AuditEvent {
        Objects.requireNonNull(eventId, "eventId");
        Objects.requireNonNull(eventTimestamp, "eventTimestamp");
        eventData = eventData != null ? Map.copyOf(eventData) : Map.of();
        if (eventDate == null) {
            eventDate = utcDate(eventTimestamp);
        }
        if (parentEventId == null && parentEventDate != null) {
            throw new IllegalArgumentException("parentEventDate set without parentEventId");
        }
    }

    /**
     * @return the monthly partition this event belongs to
     */
    public YearMonth partition() {
        return YearMonth.from(eventDate);
    }

    /**
     * @return true if the event references a parent
     */
    public boolean hasParent() {
        return parentEventId != null;
    }

    /**
     * Copy of this event with the store assigned creation time.
     */
    public AuditEvent withCreatedAt(Instant createdAt) {
        return toBuilder().createdAt(createdAt).build();
    }

    public static LocalDate utcDate(Instant timestamp) {
        return LocalDate.ofInstant(timestamp, ZoneOffset.UTC);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .eventId(eventId)
            .version(version)
            .service(service)
            .eventType(eventType)
            .eventTimestamp(eventTimestamp)
            .correlationId(correlationId)
            .outcome(outcome)
            .operation(operation)
            .eventData(eventData)
            .parentEventId(parentEventId)
            .parentEventDate(parentEventDate)
            .actorId(actorId)
            .actorType(actorType)
            .resourceType(resourceType)
            .resourceId(resourceId)
            .severity(severity)
            .durationMs(durationMs)
            .errorCode(errorCode)
            .errorMessage(errorMessage)
            .retentionDays(retentionDays)
            .sensitive(sensitive)
            .createdAt(createdAt);
    }

    public static final class Builder {
        private UUID eventId;
        private String version = DEFAULT_VERSION;
        private String service;
        private String eventType;
        private Instant eventTimestamp;
        private String correlationId;
        private EventOutcome outcome;
        private String operation;
        private Map<String, Object> eventData;
        private UUID parentEventId;
        private LocalDate parentEventDate;
        private String actorId;
        private String actorType;
        private String resourceType;
        private String resourceId;
        private String severity;
        private Integer durationMs;
        private String errorCode;
        private String errorMessage;
        private int retentionDays = DEFAULT_RETENTION_DAYS;
        private boolean sensitive;
        private Instant createdAt;

        private Builder() {
        }

        public Builder eventId(UUID eventId) {
            this.eventId = eventId;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder service(String service) {
            this.service = service;
            return this;
        }

        public Builder eventType(String eventType) {
            this.eventType = eventType;
            return this;
        }

        public Builder eventTimestamp(Instant eventTimestamp) {
            this.eventTimestamp = eventTimestamp;
            return this;
        }

        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public Builder outcome(EventOutcome outcome) {
            this.outcome = outcome;
            return this;
        }

        public Builder operation(String operation) {
            this.operation = operation;
            return this;
        }

        public Builder eventData(Map<String, Object> eventData) {
            this.eventData = eventData;
            return this;
        }

        public Builder parentEventId(UUID parentEventId) {
            this.parentEventId = parentEventId;
            return this;
        }

        public Builder parentEventDate(LocalDate parentEventDate) {
            this.parentEventDate = parentEventDate;
            return this;
        }

        public Builder actorId(String actorId) {
            this.actorId = actorId;
            return this;
        }

        public Builder actorType(String actorType) {
            this.actorType = actorType;
            return this;
        }

        public Builder resourceType(String resourceType) {
            this.resourceType = resourceType;
            return this;
        }

        public Builder resourceId(String resourceId) {
            this.resourceId = resourceId;
            return this;
        }

        public Builder severity(String severity) {
            this.severity = severity;
            return this;
        }

        public Builder durationMs(Integer durationMs) {
            this.durationMs = durationMs;
            return this;
        }

        public Builder errorCode(String errorCode) {
            this.errorCode = errorCode;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder retentionDays(int retentionDays) {
            this.retentionDays = retentionDays;
            return this;
        }

        public Builder sensitive(boolean sensitive) {
            this.sensitive = sensitive;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public AuditEvent build() {
            return new AuditEvent(
                eventId, null, version, service, eventType, eventTimestamp, correlationId,
                outcome, operation, eventData, parentEventId, parentEventDate, actorId,
                actorType, resourceType, resourceId, severity, durationMs, errorCode,
                errorMessage, retentionDays, sensitive, createdAt);
        }
    }
}
