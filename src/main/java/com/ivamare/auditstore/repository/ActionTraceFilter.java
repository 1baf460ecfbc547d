package com.ivamare.auditstore.repository;

/**
 * Equality filters over action traces. Null components do not filter.
 *
 * @param incidentType Incident type to match
 * @param playbookId Playbook to match
 * @param playbookVersion Playbook version to match, only meaningful with playbookId
 * @param actionType Action type to match
 */
public record ActionTraceFilter(
    String incidentType,
    String playbookId,
    String playbookVersion,
    String actionType
) {
    public static ActionTraceFilter byIncidentType(String incidentType) {
        return new ActionTraceFilter(incidentType, null, null, null);
    }

    public static ActionTraceFilter byPlaybook(String playbookId, String playbookVersion) {
        return new ActionTraceFilter(null, playbookId, playbookVersion, null);
    }

    public boolean isEmpty() {
        return incidentType == null && playbookId == null && playbookVersion == null && actionType == null;
    }
}
