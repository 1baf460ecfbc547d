package com.ivamare.auditstore.repository.impl;

import com.ivamare.auditstore.model.ActionTrace;
import com.ivamare.auditstore.repository.ActionTraceFilter;
import com.ivamare.auditstore.repository.ActionTraceRepository;
import com.ivamare.auditstore.repository.BreakdownRow;
import com.ivamare.auditstore.repository.ExecutionCounts;
import com.ivamare.auditstore.repository.ExecutionModeCounts;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * In-process ActionTraceRepository. Scans are over a snapshot of the trace list.
 */
public class InMemoryActionTraceRepository implements ActionTraceRepository {

    private final List<ActionTrace> traces = new CopyOnWriteArrayList<>();

    @Override
    public void insert(ActionTrace trace) {
        traces.add(Objects.requireNonNull(trace, "trace"));
    }

    @Override
    public ExecutionCounts countExecutions(ActionTraceFilter filter, Instant since) {
        return count(matching(filter, since));
    }

    @Override
    public ExecutionModeCounts countExecutionModes(ActionTraceFilter filter, Instant since) {
        long catalog = 0;
        long chained = 0;
        long manual = 0;
        long anomalies = 0;
        for (ActionTrace t : matching(filter, since).toList()) {
            int flags = (t.catalogSelected() ? 1 : 0) + (t.chained() ? 1 : 0) + (t.manualEscalation() ? 1 : 0);
            if (flags != 1) {
                anomalies++;
            } else if (t.catalogSelected()) {
                catalog++;
            } else if (t.chained()) {
                chained++;
            } else {
                manual++;
            }
        }
        return new ExecutionModeCounts(catalog, chained, manual, anomalies);
    }

    @Override
    public List<BreakdownRow> breakdownByPlaybook(String incidentType, Instant since) {
        return breakdown(
            matching(ActionTraceFilter.byIncidentType(incidentType), since).filter(t -> t.playbookId() != null),
            t -> new GroupKey(t.playbookId(), t.playbookVersion()));
    }

    @Override
    public List<BreakdownRow> breakdownByIncidentType(String playbookId, String playbookVersion, Instant since) {
        return breakdown(
            matching(ActionTraceFilter.byPlaybook(playbookId, playbookVersion), since),
            t -> new GroupKey(t.incidentType(), null));
    }

    private Stream<ActionTrace> matching(ActionTraceFilter filter, Instant since) {
        return traces.stream()
            .filter(t -> !t.actionTimestamp().isBefore(since))
            .filter(equalsIfSet(filter.incidentType(), ActionTrace::incidentType))
            .filter(equalsIfSet(filter.playbookId(), ActionTrace::playbookId))
            .filter(equalsIfSet(filter.playbookVersion(), ActionTrace::playbookVersion))
            .filter(equalsIfSet(filter.actionType(), ActionTrace::actionType));
    }

    private static Predicate<ActionTrace> equalsIfSet(String expected, Function<ActionTrace, String> field) {
        return t -> expected == null || expected.equals(field.apply(t));
    }

    private static ExecutionCounts count(Stream<ActionTrace> traces) {
        long[] totals = new long[2];
        traces.forEach(t -> {
            totals[0]++;
            if (t.isSuccessful()) {
                totals[1]++;
            }
        });
        return new ExecutionCounts(totals[0], totals[1]);
    }

    private static List<BreakdownRow> breakdown(Stream<ActionTrace> traces, Function<ActionTrace, GroupKey> keyFn) {
        Map<GroupKey, long[]> groups = new LinkedHashMap<>();
        traces.forEach(t -> {
            long[] totals = groups.computeIfAbsent(keyFn.apply(t), k -> new long[2]);
            totals[0]++;
            if (t.isSuccessful()) {
                totals[1]++;
            }
        });
        return groups.entrySet().stream()
            .map(e -> new BreakdownRow(e.getKey().key(), e.getKey().version(),
                new ExecutionCounts(e.getValue()[0], e.getValue()[1])))
            .toList();
    }

    private record GroupKey(String key, String version) {
    }
}
