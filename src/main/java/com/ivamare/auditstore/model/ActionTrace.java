package com.ivamare.auditstore.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One recorded remediation action, the unit the success-rate reports count.
 *
 * @param incidentType Incident classification
 * @param alertName Alert that raised the incident
 * @param incidentSeverity Severity of the incident
 * @param playbookId Playbook that ran, if any
 * @param playbookVersion Version of the playbook
 * @param playbookStepNumber Step within the playbook
 * @param playbookExecutionId Id of the playbook run
 * @param catalogSelected AI picked a single catalog playbook
 * @param chained AI chained several playbooks
 * @param manualEscalation AI escalated to a human
 * @param actionType Kind of action executed
 * @param executionStatus Execution status, {@code completed} counts as success
 * @param actionTimestamp When the action ran
 */
public record ActionTrace(
    String incidentType,
    String alertName,
    String incidentSeverity,
    String playbookId,
    String playbookVersion,
    Integer playbookStepNumber,
    String playbookExecutionId,
    boolean catalogSelected,
    boolean chained,
    boolean manualEscalation,
    String actionType,
    String executionStatus,
    Instant actionTimestamp
) {
    public static final String STATUS_COMPLETED = "completed";

    public ActionTrace {
        Objects.requireNonNull(actionTimestamp, "actionTimestamp");
    }

    public boolean isSuccessful() {
        return STATUS_COMPLETED.equals(executionStatus);
    }
}
