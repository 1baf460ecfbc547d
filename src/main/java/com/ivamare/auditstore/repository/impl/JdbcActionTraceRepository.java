package com.ivamare.auditstore.repository.impl;

import com.ivamare.auditstore.model.ActionTrace;
import com.ivamare.auditstore.repository.ActionTraceFilter;
import com.ivamare.auditstore.repository.ActionTraceRepository;
import com.ivamare.auditstore.repository.BreakdownRow;
import com.ivamare.auditstore.repository.ExecutionCounts;
import com.ivamare.auditstore.repository.ExecutionModeCounts;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * JDBC implementation of ActionTraceRepository over {@code resource_action_traces}.
 */
public class JdbcActionTraceRepository implements ActionTraceRepository {

    private static final String SUCCESS = "execution_status = '" + ActionTrace.STATUS_COMPLETED + "'";
    private static final String FLAG_SUM =
        "(catalog_selected::int + chained::int + manual_escalation::int)";

    private final JdbcTemplate jdbcTemplate;

    public JdbcActionTraceRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void insert(ActionTrace trace) {
        jdbcTemplate.update("""
            INSERT INTO resource_action_traces (
                incident_type, alert_name, incident_severity, playbook_id, playbook_version,
                playbook_step_number, playbook_execution_id, catalog_selected, chained,
                manual_escalation, action_type, execution_status, action_timestamp
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """,
            trace.incidentType(),
            trace.alertName(),
            trace.incidentSeverity(),
            trace.playbookId(),
            trace.playbookVersion(),
            trace.playbookStepNumber(),
            trace.playbookExecutionId(),
            trace.catalogSelected(),
            trace.chained(),
            trace.manualEscalation(),
            trace.actionType(),
            trace.executionStatus(),
            Timestamp.from(trace.actionTimestamp())
        );
    }

    @Override
    public ExecutionCounts countExecutions(ActionTraceFilter filter, Instant since) {
        Where where = where(filter, since);
        ExecutionCounts counts = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) AS total, COUNT(*) FILTER (WHERE " + SUCCESS + ") AS successful" +
            " FROM resource_action_traces" + where.sql,
            (rs, rowNum) -> new ExecutionCounts(rs.getLong("total"), rs.getLong("successful")),
            where.args()
        );
        return counts != null ? counts : ExecutionCounts.EMPTY;
    }

    @Override
    public ExecutionModeCounts countExecutionModes(ActionTraceFilter filter, Instant since) {
        Where where = where(filter, since);
        ExecutionModeCounts counts = jdbcTemplate.queryForObject(
            "SELECT" +
            " COUNT(*) FILTER (WHERE " + FLAG_SUM + " = 1 AND catalog_selected) AS catalog_selected," +
            " COUNT(*) FILTER (WHERE " + FLAG_SUM + " = 1 AND chained) AS chained," +
            " COUNT(*) FILTER (WHERE " + FLAG_SUM + " = 1 AND manual_escalation) AS manual_escalation," +
            " COUNT(*) FILTER (WHERE " + FLAG_SUM + " <> 1) AS anomalies" +
            " FROM resource_action_traces" + where.sql,
            (rs, rowNum) -> new ExecutionModeCounts(
                rs.getLong("catalog_selected"),
                rs.getLong("chained"),
                rs.getLong("manual_escalation"),
                rs.getLong("anomalies")),
            where.args()
        );
        return counts != null ? counts : ExecutionModeCounts.EMPTY;
    }

    @Override
    public List<BreakdownRow> breakdownByPlaybook(String incidentType, Instant since) {
        return jdbcTemplate.query(
            "SELECT playbook_id, playbook_version, COUNT(*) AS total," +
            " COUNT(*) FILTER (WHERE " + SUCCESS + ") AS successful" +
            " FROM resource_action_traces" +
            " WHERE incident_type = ? AND action_timestamp >= ? AND playbook_id IS NOT NULL" +
            " GROUP BY playbook_id, playbook_version",
            (rs, rowNum) -> new BreakdownRow(
                rs.getString("playbook_id"),
                rs.getString("playbook_version"),
                new ExecutionCounts(rs.getLong("total"), rs.getLong("successful"))),
            incidentType, Timestamp.from(since)
        );
    }

    @Override
    public List<BreakdownRow> breakdownByIncidentType(String playbookId, String playbookVersion, Instant since) {
        Where where = where(ActionTraceFilter.byPlaybook(playbookId, playbookVersion), since);
        return jdbcTemplate.query(
            "SELECT incident_type, COUNT(*) AS total," +
            " COUNT(*) FILTER (WHERE " + SUCCESS + ") AS successful" +
            " FROM resource_action_traces" + where.sql +
            " GROUP BY incident_type",
            (rs, rowNum) -> new BreakdownRow(
                rs.getString("incident_type"),
                null,
                new ExecutionCounts(rs.getLong("total"), rs.getLong("successful"))),
            where.args()
        );
    }

    private static Where where(ActionTraceFilter filter, Instant since) {
        StringBuilder sql = new StringBuilder(" WHERE action_timestamp >= ?");
        List<Object> args = new ArrayList<>();
        args.add(Timestamp.from(since));
        append(sql, args, "incident_type", filter.incidentType());
        append(sql, args, "playbook_id", filter.playbookId());
        append(sql, args, "playbook_version", filter.playbookVersion());
        append(sql, args, "action_type", filter.actionType());
        return new Where(sql.toString(), args);
    }

    private static void append(StringBuilder sql, List<Object> args, String column, String value) {
        if (value != null) {
            sql.append(" AND ").append(column).append(" = ?");
            args.add(value);
        }
    }

    private record Where(String sql, List<Object> argList) {
        Object[] args() {
            return argList.toArray();
        }
    }
}
