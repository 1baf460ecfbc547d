package com.ivamare.auditstore.repository.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.auditstore.exception.ChildEventsExistException;
import com.ivamare.auditstore.exception.DatabaseExceptionClassifier;
import com.ivamare.auditstore.exception.EventNotFoundException;
import com.ivamare.auditstore.exception.PartitionMissingException;
import com.ivamare.auditstore.exception.ReferentialIntegrityException;
import com.ivamare.auditstore.exception.StorageUnavailableException;
import com.ivamare.auditstore.model.AuditEvent;
import com.ivamare.auditstore.model.EventOutcome;
import com.ivamare.auditstore.model.InsertOutcome;
import com.ivamare.auditstore.repository.AuditEventRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Date;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC implementation of AuditEventRepository on a PostgreSQL range partitioned table.
 *
 * <p>Integrity is left to the database: the self-referencing foreign key on
 * {@code (parent_event_id, parent_event_date)} rejects missing parents at insert
 * and restricts deletes of referenced rows, and PostgreSQL refuses rows no
 * partition accepts.
 */
public class JdbcAuditEventRepository implements AuditEventRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcAuditEventRepository.class);
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    public static final String TABLE = "audit_events";

    private static final String INSERT_SQL = """
        INSERT INTO audit_events (
            event_id, event_date, version, event_category, event_type, event_timestamp,
            correlation_id, outcome, operation, event_data, parent_event_id, parent_event_date,
            actor_id, actor_type, resource_type, resource_id, severity, duration_ms,
            error_code, error_message, retention_days, is_sensitive
        ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        ON CONFLICT DO NOTHING
        """;

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final RowMapper<AuditEvent> eventMapper;

    public JdbcAuditEventRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.eventMapper = (rs, rowNum) -> {
            String parentId = rs.getString("parent_event_id");
            Date parentDate = rs.getDate("parent_event_date");
            Timestamp createdAt = rs.getTimestamp("created_at");
            Object durationMs = rs.getObject("duration_ms");
            return new AuditEvent(
                UUID.fromString(rs.getString("event_id")),
                rs.getDate("event_date").toLocalDate(),
                rs.getString("version"),
                rs.getString("event_category"),
                rs.getString("event_type"),
                rs.getTimestamp("event_timestamp").toInstant(),
                rs.getString("correlation_id"),
                EventOutcome.fromValue(rs.getString("outcome")).orElse(null),
                rs.getString("operation"),
                deserializeData(rs.getString("event_data")),
                parentId != null ? UUID.fromString(parentId) : null,
                parentDate != null ? parentDate.toLocalDate() : null,
                rs.getString("actor_id"),
                rs.getString("actor_type"),
                rs.getString("resource_type"),
                rs.getString("resource_id"),
                rs.getString("severity"),
                durationMs != null ? ((Number) durationMs).intValue() : null,
                rs.getString("error_code"),
                rs.getString("error_message"),
                rs.getInt("retention_days"),
                rs.getBoolean("is_sensitive"),
                createdAt != null ? createdAt.toInstant() : null
            );
        };
    }

    @Override
    public InsertOutcome insert(AuditEvent event) {
        int rows;
        try {
            rows = jdbcTemplate.update(INSERT_SQL,
                event.eventId(),
                event.eventDate(),
                event.version(),
                event.service(),
                event.eventType(),
                Timestamp.from(event.eventTimestamp()),
                event.correlationId(),
                event.outcome() != null ? event.outcome().getValue() : null,
                event.operation(),
                serializeData(event.eventData()),
                event.parentEventId(),
                event.parentEventDate(),
                event.actorId(),
                event.actorType(),
                event.resourceType(),
                event.resourceId(),
                event.severity(),
                event.durationMs(),
                event.errorCode(),
                event.errorMessage(),
                event.retentionDays(),
                event.sensitive()
            );
        } catch (DataAccessException e) {
            throw translateInsertFailure(event, e);
        }

        if (rows == 0) {
            log.debug("Event {} already stored, insert ignored", event.eventId());
            return InsertOutcome.DUPLICATE;
        }
        return InsertOutcome.CREATED;
    }

    @Override
    public Optional<AuditEvent> findById(UUID eventId) {
        return queryOne("SELECT * FROM audit_events WHERE event_id = ? LIMIT 1", eventId);
    }

    @Override
    public Optional<AuditEvent> findById(UUID eventId, LocalDate eventDate) {
        return queryOne("SELECT * FROM audit_events WHERE event_id = ? AND event_date = ?", eventId, eventDate);
    }

    @Override
    public void delete(UUID eventId, LocalDate eventDate) {
        int rows;
        try {
            rows = jdbcTemplate.update(
                "DELETE FROM audit_events WHERE event_id = ? AND event_date = ?",
                eventId, eventDate
            );
        } catch (DataAccessException e) {
            if (DatabaseExceptionClassifier.isForeignKeyViolation(e)) {
                throw new ChildEventsExistException(eventId, e);
            }
            throw new StorageUnavailableException("Failed to delete event " + eventId, e);
        }
        if (rows == 0) {
            throw new EventNotFoundException(eventId);
        }
    }

    @Override
    public boolean hasPartition(YearMonth month) {
        Integer count = jdbcTemplate.queryForObject("""
            SELECT COUNT(*) FROM pg_inherits i
            JOIN pg_class c ON c.oid = i.inhrelid
            JOIN pg_class p ON p.oid = i.inhparent
            WHERE p.relname = ? AND c.relname = ?
            """,
            Integer.class,
            TABLE, partitionName(month)
        );
        return count != null && count > 0;
    }

    @Override
    public void createPartition(YearMonth month) {
        LocalDate from = month.atDay(1);
        LocalDate to = month.plusMonths(1).atDay(1);
        // DDL cannot take bind parameters; all values are derived from YearMonth
        jdbcTemplate.execute("CREATE TABLE IF NOT EXISTS " + partitionName(month) +
            " PARTITION OF " + TABLE +
            " FOR VALUES FROM ('" + from + "') TO ('" + to + "')");
        log.info("Ensured partition {} [{} .. {})", partitionName(month), from, to);
    }

    /**
     * @return partition table name in format audit_events_yYYYYmMM
     */
    public static String partitionName(YearMonth month) {
        return String.format("%s_y%04dm%02d", TABLE, month.getYear(), month.getMonthValue());
    }

    private Optional<AuditEvent> queryOne(String sql, Object... args) {
        try {
            List<AuditEvent> results = jdbcTemplate.query(sql, eventMapper, args);
            return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
        } catch (DataAccessException e) {
            throw new StorageUnavailableException("Failed to read audit event", e);
        }
    }

    private RuntimeException translateInsertFailure(AuditEvent event, DataAccessException e) {
        if (DatabaseExceptionClassifier.isPartitionMissing(e)) {
            return new PartitionMissingException(event.eventDate(), e);
        }
        if (DatabaseExceptionClassifier.isForeignKeyViolation(e)) {
            return new ReferentialIntegrityException(event.parentEventId(), e);
        }
        if (DatabaseExceptionClassifier.isTransient(e)) {
            log.warn("Transient failure writing event {}: {}", event.eventId(),
                DatabaseExceptionClassifier.getTransientReason(e));
        } else {
            log.warn("Unclassified failure writing event {} (sqlState={})", event.eventId(),
                DatabaseExceptionClassifier.getSqlState(e), e);
        }
        return new StorageUnavailableException("Failed to write event " + event.eventId(), e);
    }

    private String serializeData(Map<String, Object> data) {
        try {
            return objectMapper.writeValueAsString(data != null ? data : Map.of());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize event data", e);
        }
    }

    private Map<String, Object> deserializeData(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored event data is not valid JSON", e);
        }
    }
}
