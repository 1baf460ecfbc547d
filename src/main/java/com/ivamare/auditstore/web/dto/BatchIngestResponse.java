package com.ivamare.auditstore.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Response body for a batch ingest: one result per event, in request order, plus counts.
 */
public record BatchIngestResponse(
    @JsonProperty("results") List<IngestResponse> results,
    @JsonProperty("created") long created,
    @JsonProperty("duplicate") long duplicate,
    @JsonProperty("queued") long queued,
    @JsonProperty("rejected") long rejected
) {
    public static BatchIngestResponse of(List<IngestResponse> results) {
        return new BatchIngestResponse(
            List.copyOf(results),
            count(results, IngestResponse.STATUS_CREATED),
            count(results, IngestResponse.STATUS_DUPLICATE),
            count(results, IngestResponse.STATUS_QUEUED),
            count(results, IngestResponse.STATUS_REJECTED));
    }

    private static long count(List<IngestResponse> results, String status) {
        return results.stream().filter(r -> status.equals(r.status())).count();
    }
}
