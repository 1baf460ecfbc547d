package com.ivamare.auditstore.web;

import com.ivamare.auditstore.aggregation.AggregationService;
import com.ivamare.auditstore.aggregation.IncidentTypeSuccessRate;
import com.ivamare.auditstore.aggregation.MultiDimensionalSuccessRate;
import com.ivamare.auditstore.aggregation.PlaybookSuccessRate;
import com.ivamare.auditstore.aggregation.SuccessRateQuery;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read API for success-rate reports.
 */
@RestController
@RequestMapping("/api/v1/success-rate")
public class SuccessRateController {

    static final String DEFAULT_TIME_RANGE = "7d";
    static final String DEFAULT_MIN_SAMPLES = "5";

    private final AggregationService aggregationService;

    public SuccessRateController(AggregationService aggregationService) {
        this.aggregationService = aggregationService;
    }

    @GetMapping("/incident-type")
    public IncidentTypeSuccessRate byIncidentType(
            @RequestParam(name = "incident_type") String incidentType,
            @RequestParam(name = "time_range", defaultValue = DEFAULT_TIME_RANGE) String timeRange,
            @RequestParam(name = "min_samples", defaultValue = DEFAULT_MIN_SAMPLES) int minSamples) {
        return aggregationService.successRateByIncidentType(incidentType, timeRange, minSamples);
    }

    @GetMapping("/playbook")
    public PlaybookSuccessRate byPlaybook(
            @RequestParam(name = "playbook_id") String playbookId,
            @RequestParam(name = "playbook_version", required = false) String playbookVersion,
            @RequestParam(name = "time_range", defaultValue = DEFAULT_TIME_RANGE) String timeRange,
            @RequestParam(name = "min_samples", defaultValue = DEFAULT_MIN_SAMPLES) int minSamples) {
        return aggregationService.successRateByPlaybook(playbookId, playbookVersion, timeRange, minSamples);
    }

    @GetMapping("/multi-dimensional")
    public MultiDimensionalSuccessRate multiDimensional(
            @RequestParam(name = "incident_type", required = false) String incidentType,
            @RequestParam(name = "playbook_id", required = false) String playbookId,
            @RequestParam(name = "playbook_version", required = false) String playbookVersion,
            @RequestParam(name = "action_type", required = false) String actionType,
            @RequestParam(name = "time_range", defaultValue = DEFAULT_TIME_RANGE) String timeRange,
            @RequestParam(name = "min_samples", defaultValue = DEFAULT_MIN_SAMPLES) int minSamples) {
        return aggregationService.successRateMultiDimensional(
            new SuccessRateQuery(incidentType, playbookId, playbookVersion, actionType, timeRange, minSamples));
    }
}
