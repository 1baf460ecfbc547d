package com.ivamare.auditstore.aggregation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ivamare.auditstore.repository.ExecutionModeCounts;

/**
 * AI execution-mode distribution of a report.
 */
public record AiExecutionMode(
    @JsonProperty("catalog_selected") long catalogSelected,
    @JsonProperty("chained") long chained,
    @JsonProperty("manual_escalation") long manualEscalation,
    @JsonProperty("anomalies") long anomalies
) {
    public static AiExecutionMode from(ExecutionModeCounts counts) {
        return new AiExecutionMode(counts.catalogSelected(), counts.chained(),
            counts.manualEscalation(), counts.anomalies());
    }
}
