package com.ivamare.auditstore.aggregation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Aggregate for an exact combination of dimensions. No breakdown.
 */
public record MultiDimensionalSuccessRate(
    @JsonProperty("dimensions") Dimensions dimensions,
    @JsonProperty("time_range") TimeRange timeRange,
    @JsonProperty("total_executions") long totalExecutions,
    @JsonProperty("successful_executions") long successfulExecutions,
    @JsonProperty("failed_executions") long failedExecutions,
    @JsonProperty("success_rate") double successRate,
    @JsonProperty("confidence") ConfidenceLevel confidence,
    @JsonProperty("min_samples_met") boolean minSamplesMet
) {
    /**
     * The dimensions the aggregate was computed for. Unset ones are omitted.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Dimensions(
        @JsonProperty("incident_type") String incidentType,
        @JsonProperty("playbook_id") String playbookId,
        @JsonProperty("playbook_version") String playbookVersion,
        @JsonProperty("action_type") String actionType
    ) {
    }
}
