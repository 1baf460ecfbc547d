package com.ivamare.auditstore.repository;

/**
 * Execution counts for one value of a breakdown dimension.
 *
 * @param key Playbook id or incident type
 * @param version Playbook version for playbook breakdowns, otherwise null
 * @param counts Execution counts for this value
 */
public record BreakdownRow(String key, String version, ExecutionCounts counts) {
}
