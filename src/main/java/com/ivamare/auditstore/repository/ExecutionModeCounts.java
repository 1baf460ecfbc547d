package com.ivamare.auditstore.repository;

/**
 * Distribution of the AI execution-mode flags.
 *
 * <p>Exactly one flag is expected per trace. Traces with none or several set
 * are counted as anomalies and not in any mode.
 *
 * @param catalogSelected Traces with only the catalog flag
 * @param chained Traces with only the chained flag
 * @param manualEscalation Traces with only the manual escalation flag
 * @param anomalies Traces with zero or several flags
 */
public record ExecutionModeCounts(
    long catalogSelected,
    long chained,
    long manualEscalation,
    long anomalies
) {
    public static final ExecutionModeCounts EMPTY = new ExecutionModeCounts(0, 0, 0, 0);
}
