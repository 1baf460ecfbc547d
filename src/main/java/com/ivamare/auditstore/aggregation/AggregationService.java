package com.ivamare.auditstore.aggregation;

import com.ivamare.auditstore.exception.AggregationException;
import com.ivamare.auditstore.exception.ValidationException;

/**
 * Confidence-weighted success-rate reports over action traces.
 *
 * <p>{@code success_rate} is {@code successful / total * 100} and 0 when there
 * are no executions. {@code min_samples_met} compares the total with the
 * caller's threshold and does not depend on the confidence level.
 *
 * <p>All methods throw {@link ValidationException} for bad arguments (unknown
 * time range, negative min samples, missing filters) and
 * {@link AggregationException} when the traces cannot be read.
 */
public interface AggregationService {

    IncidentTypeSuccessRate successRateByIncidentType(String incidentType, String timeRange, int minSamples);

    PlaybookSuccessRate successRateByPlaybook(String playbookId, String playbookVersion, String timeRange, int minSamples);

    MultiDimensionalSuccessRate successRateMultiDimensional(SuccessRateQuery query);
}
