package com.ivamare.auditstore.aggregation.impl;

import com.ivamare.auditstore.aggregation.AggregationService;
import com.ivamare.auditstore.aggregation.AiExecutionMode;
import com.ivamare.auditstore.aggregation.ConfidenceLevel;
import com.ivamare.auditstore.aggregation.IncidentTypeBreakdown;
import com.ivamare.auditstore.aggregation.IncidentTypeSuccessRate;
import com.ivamare.auditstore.aggregation.MultiDimensionalSuccessRate;
import com.ivamare.auditstore.aggregation.PlaybookBreakdown;
import com.ivamare.auditstore.aggregation.PlaybookSuccessRate;
import com.ivamare.auditstore.aggregation.SuccessRateQuery;
import com.ivamare.auditstore.aggregation.TimeRange;
import com.ivamare.auditstore.exception.AggregationException;
import com.ivamare.auditstore.exception.ValidationException;
import com.ivamare.auditstore.metrics.AuditStoreMetrics;
import com.ivamare.auditstore.repository.ActionTraceFilter;
import com.ivamare.auditstore.repository.ActionTraceRepository;
import com.ivamare.auditstore.repository.BreakdownRow;
import com.ivamare.auditstore.repository.ExecutionCounts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Supplier;

/**
 * Computes success-rate reports from the action trace repository.
 *
 * <p>Each report is read without locks, so its aggregate and breakdown may
 * observe slightly different sets of traces under concurrent inserts.
 */
public class DefaultAggregationService implements AggregationService {

    private static final Logger log = LoggerFactory.getLogger(DefaultAggregationService.class);

    private static final Comparator<PlaybookBreakdown> PLAYBOOK_ORDER =
        Comparator.comparingDouble(PlaybookBreakdown::successRate).reversed()
            .thenComparing(Comparator.comparingLong(PlaybookBreakdown::executions).reversed())
            .thenComparing(PlaybookBreakdown::playbookId)
            .thenComparing(PlaybookBreakdown::playbookVersion, Comparator.nullsFirst(Comparator.naturalOrder()));

    private static final Comparator<IncidentTypeBreakdown> INCIDENT_TYPE_ORDER =
        Comparator.comparingDouble(IncidentTypeBreakdown::successRate).reversed()
            .thenComparing(Comparator.comparingLong(IncidentTypeBreakdown::executions).reversed())
            .thenComparing(IncidentTypeBreakdown::incidentType, Comparator.nullsLast(Comparator.naturalOrder()));

    private final ActionTraceRepository repository;
    private final Clock clock;
    private final AuditStoreMetrics metrics;

    public DefaultAggregationService(ActionTraceRepository repository, Clock clock, AuditStoreMetrics metrics) {
        this.repository = repository;
        this.clock = clock;
        this.metrics = metrics;
    }

    @Override
    public IncidentTypeSuccessRate successRateByIncidentType(String incidentType, String timeRange, int minSamples) {
        if (isBlank(incidentType)) {
            throw new ValidationException("incident_type is required");
        }
        TimeRange range = parseTimeRange(timeRange);
        requireNonNegative(minSamples);
        Instant since = since(range);
        ActionTraceFilter filter = ActionTraceFilter.byIncidentType(incidentType);

        return query("incident_type=" + incidentType, () -> {
            ExecutionCounts counts = repository.countExecutions(filter, since);
            AiExecutionMode modes = AiExecutionMode.from(repository.countExecutionModes(filter, since));
            List<PlaybookBreakdown> breakdown = new ArrayList<>();
            for (BreakdownRow row : repository.breakdownByPlaybook(incidentType, since)) {
                ExecutionCounts c = row.counts();
                breakdown.add(new PlaybookBreakdown(row.key(), row.version(), c.total(), c.successful(),
                    successRate(c), ConfidenceLevel.forSampleCount(c.total())));
            }
            breakdown.sort(PLAYBOOK_ORDER);
            return new IncidentTypeSuccessRate(incidentType, range,
                counts.total(), counts.successful(), counts.failed(), successRate(counts),
                ConfidenceLevel.forSampleCount(counts.total()), counts.total() >= minSamples,
                modes, breakdown);
        });
    }

    @Override
    public PlaybookSuccessRate successRateByPlaybook(String playbookId, String playbookVersion,
                                                     String timeRange, int minSamples) {
        if (isBlank(playbookId)) {
            throw new ValidationException("playbook_id is required");
        }
        String version = isBlank(playbookVersion) ? null : playbookVersion;
        TimeRange range = parseTimeRange(timeRange);
        requireNonNegative(minSamples);
        Instant since = since(range);
        ActionTraceFilter filter = ActionTraceFilter.byPlaybook(playbookId, version);

        return query("playbook_id=" + playbookId, () -> {
            ExecutionCounts counts = repository.countExecutions(filter, since);
            AiExecutionMode modes = AiExecutionMode.from(repository.countExecutionModes(filter, since));
            List<IncidentTypeBreakdown> breakdown = new ArrayList<>();
            for (BreakdownRow row : repository.breakdownByIncidentType(playbookId, version, since)) {
                ExecutionCounts c = row.counts();
                breakdown.add(new IncidentTypeBreakdown(row.key(), c.total(), c.successful(),
                    successRate(c), ConfidenceLevel.forSampleCount(c.total())));
            }
            breakdown.sort(INCIDENT_TYPE_ORDER);
            return new PlaybookSuccessRate(playbookId, version, range,
                counts.total(), counts.successful(), counts.failed(), successRate(counts),
                ConfidenceLevel.forSampleCount(counts.total()), counts.total() >= minSamples,
                modes, breakdown);
        });
    }

    @Override
    public MultiDimensionalSuccessRate successRateMultiDimensional(SuccessRateQuery query) {
        ActionTraceFilter filter = query.toFilter();
        if (filter.isEmpty()) {
            throw new ValidationException(
                "at least one of incident_type, playbook_id or action_type is required");
        }
        if (filter.playbookVersion() != null && filter.playbookId() == null) {
            throw new ValidationException("playbook_version requires playbook_id");
        }
        TimeRange range = parseTimeRange(query.timeRange());
        requireNonNegative(query.minSamples());
        Instant since = since(range);

        return query(filter.toString(), () -> {
            ExecutionCounts counts = repository.countExecutions(filter, since);
            return new MultiDimensionalSuccessRate(
                new MultiDimensionalSuccessRate.Dimensions(filter.incidentType(), filter.playbookId(),
                    filter.playbookVersion(), filter.actionType()),
                range, counts.total(), counts.successful(), counts.failed(), successRate(counts),
                ConfidenceLevel.forSampleCount(counts.total()), counts.total() >= query.minSamples());
        });
    }

    static double successRate(ExecutionCounts counts) {
        if (counts.total() == 0) {
            return 0.0;
        }
        return counts.successful() * 100.0 / counts.total();
    }

    private <T> T query(String description, Supplier<T> body) {
        try {
            return body.get();
        } catch (RuntimeException e) {
            metrics.aggregationFailure();
            log.error("Success-rate query failed for {}", description, e);
            throw new AggregationException("Failed to compute success rate for " + description, e);
        }
    }

    private Instant since(TimeRange range) {
        return clock.instant().minus(range.getDuration());
    }

    private static TimeRange parseTimeRange(String value) {
        if (value == null) {
            return TimeRange.DEFAULT;
        }
        return TimeRange.fromValue(value).orElseThrow(() -> new ValidationException(
            "invalid time_range '" + value + "', expected one of " + TimeRange.allowedValues()));
    }

    private static void requireNonNegative(int minSamples) {
        if (minSamples < 0) {
            throw new ValidationException("min_samples must be >= 0");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
