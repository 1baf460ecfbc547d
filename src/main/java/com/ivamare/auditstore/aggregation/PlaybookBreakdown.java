package com.ivamare.auditstore.aggregation;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PlaybookBreakdown(
    @JsonProperty("playbook_id") String playbookId,
    @JsonProperty("playbook_version") String playbookVersion,
    @JsonProperty("executions") long executions,
    @JsonProperty("successful_executions") long successfulExecutions,
    @JsonProperty("success_rate") double successRate,
    @JsonProperty("confidence") ConfidenceLevel confidence
) {
}
