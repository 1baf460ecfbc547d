package com.ivamare.auditstore.aggregation;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Success rate of one incident type, with a per-playbook breakdown sorted best first.
 */
public record IncidentTypeSuccessRate(
    @JsonProperty("incident_type") String incidentType,
    @JsonProperty("time_range") TimeRange timeRange,
    @JsonProperty("total_executions") long totalExecutions,
    @JsonProperty("successful_executions") long successfulExecutions,
    @JsonProperty("failed_executions") long failedExecutions,
    @JsonProperty("success_rate") double successRate,
    @JsonProperty("confidence") ConfidenceLevel confidence,
    @JsonProperty("min_samples_met") boolean minSamplesMet,
    @JsonProperty("ai_execution_mode") AiExecutionMode aiExecutionMode,
    @JsonProperty("breakdown_by_playbook") List<PlaybookBreakdown> breakdownByPlaybook
) {
    public IncidentTypeSuccessRate {
        breakdownByPlaybook = List.copyOf(breakdownByPlaybook);
    }
}
