package com.ivamare.auditstore.aggregation;

import com.fasterxml.jackson.annotation.JsonProperty;

public record IncidentTypeBreakdown(
    @JsonProperty("incident_type") String incidentType,
    @JsonProperty("executions") long executions,
    @JsonProperty("successful_executions") long successfulExecutions,
    @JsonProperty("success_rate") double successRate,
    @JsonProperty("confidence") ConfidenceLevel confidence
) {
}
