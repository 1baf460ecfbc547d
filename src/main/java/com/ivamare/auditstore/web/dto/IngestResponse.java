package com.ivamare.auditstore.web.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.ivamare.auditstore.ingest.IngestResult;
import com.ivamare.auditstore.model.InsertOutcome;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Response body for one ingested event.
 *
 * @param eventId Event id, assigned by the store when the producer sent none
 * @param eventDate Partition date, present once the event is stored
 * @param status created, duplicate, queued or rejected
 * @param message Human readable summary
 * @param reason Rejection reason code, batch responses only
 * @param violations Rejection details, batch responses only
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record IngestResponse(
    @JsonProperty("event_id") UUID eventId,
    @JsonProperty("event_date") @JsonFormat(shape = JsonFormat.Shape.STRING) LocalDate eventDate,
    @JsonProperty("status") String status,
    @JsonProperty("message") String message,
    @JsonProperty("reason") String reason,
    @JsonProperty("violations") List<String> violations
) {
    public static final String STATUS_CREATED = "created";
    public static final String STATUS_DUPLICATE = "duplicate";
    public static final String STATUS_QUEUED = "queued";
    public static final String STATUS_REJECTED = "rejected";

    public static IngestResponse from(IngestResult result) {
        return switch (result.status()) {
            case ACCEPTED -> result.insertOutcome() == InsertOutcome.DUPLICATE
                ? new IngestResponse(result.eventId(), result.eventDate(), STATUS_DUPLICATE,
                    "Event already stored", null, null)
                : new IngestResponse(result.eventId(), result.eventDate(), STATUS_CREATED,
                    "Event stored", null, null);
            case QUEUED -> new IngestResponse(result.eventId(), null, STATUS_QUEUED,
                "Storage unavailable, event queued for replay", null, null);
            case REJECTED -> new IngestResponse(result.eventId(), null, STATUS_REJECTED,
                "Event rejected", result.reason(), result.violations());
        };
    }
}
