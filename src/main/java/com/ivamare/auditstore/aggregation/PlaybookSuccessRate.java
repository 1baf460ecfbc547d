package com.ivamare.auditstore.aggregation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Success rate of one playbook, optionally one version, with a per-incident-type
 * breakdown sorted best first.
 */
public record PlaybookSuccessRate(
    @JsonProperty("playbook_id") String playbookId,
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonProperty("playbook_version") String playbookVersion,
    @JsonProperty("time_range") TimeRange timeRange,
    @JsonProperty("total_executions") long totalExecutions,
    @JsonProperty("successful_executions") long successfulExecutions,
    @JsonProperty("failed_executions") long failedExecutions,
    @JsonProperty("success_rate") double successRate,
    @JsonProperty("confidence") ConfidenceLevel confidence,
    @JsonProperty("min_samples_met") boolean minSamplesMet,
    @JsonProperty("ai_execution_mode") AiExecutionMode aiExecutionMode,
    @JsonProperty("breakdown_by_incident_type") List<IncidentTypeBreakdown> breakdownByIncidentType
) {
    public PlaybookSuccessRate {
        breakdownByIncidentType = List.copyOf(breakdownByIncidentType);
    }
}
