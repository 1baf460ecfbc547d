package com.ivamare.auditstore.aggregation;

import com.ivamare.auditstore.repository.ActionTraceFilter;

/**
 * Multi-dimensional success-rate query, as received.
 *
 * @param incidentType Optional incident type
 * @param playbookId Optional playbook id
 * @param playbookVersion Optional playbook version, requires playbookId
 * @param actionType Optional action type
 * @param timeRange Look-back window, see {@link TimeRange}
 * @param minSamples Sample threshold for {@code min_samples_met}
 */
public record SuccessRateQuery(
    String incidentType,
    String playbookId,
    String playbookVersion,
    String actionType,
    String timeRange,
    int minSamples
) {
    public SuccessRateQuery {
        incidentType = blankToNull(incidentType);
        playbookId = blankToNull(playbookId);
        playbookVersion = blankToNull(playbookVersion);
        actionType = blankToNull(actionType);
    }

    public ActionTraceFilter toFilter() {
        return new ActionTraceFilter(incidentType, playbookId, playbookVersion, actionType);
    }

    static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
