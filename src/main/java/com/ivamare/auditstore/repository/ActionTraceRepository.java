package com.ivamare.auditstore.repository;

import com.ivamare.auditstore.model.ActionTrace;

import java.time.Instant;
import java.util.List;

/**
 * Read side of the action traces the success-rate reports are computed from.
 *
 * <p>Every query counts traces with {@code action_timestamp >= since}. Reads
 * take no locks.
 */
public interface ActionTraceRepository {

    void insert(ActionTrace trace);

    ExecutionCounts countExecutions(ActionTraceFilter filter, Instant since);

    ExecutionModeCounts countExecutionModes(ActionTraceFilter filter, Instant since);

    /**
     * Counts per (playbook id, playbook version) for one incident type.
     * Traces without a playbook are left out.
     *
     * @return rows in no particular order
     */
    List<BreakdownRow> breakdownByPlaybook(String incidentType, Instant since);

    /**
     * Counts per incident type for one playbook, optionally one version of it.
     *
     * @return rows in no particular order
     */
    List<BreakdownRow> breakdownByIncidentType(String playbookId, String playbookVersion, Instant since);
}
