package com.ivamare.auditstore.pgmq.impl;

import com.ivamare.auditstore.model.PgmqMessage;
import com.ivamare.auditstore.pgmq.PgmqClient;
import com.ivamare.auditstore.pgmq.QueueNames;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.Map;

/**
 * JdbcTemplate-based implementation of PgmqClient.
 */
public class JdbcPgmqClient implements PgmqClient {

    private static final Logger log = LoggerFactory.getLogger(JdbcPgmqClient.class);
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public JdbcPgmqClient(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public void createQueue(String queueName) {
        jdbcTemplate.execute("SELECT pgmq.create('" + escapeIdentifier(queueName) + "')");
        log.debug("Created queue: {}", queueName);
    }

    @Override
    public long send(String queueName, Map<String, Object> message) {
        return send(queueName, message, 0);
    }

    @Override
    public long send(String queueName, Map<String, Object> message, int delaySeconds) {
        Long msgId = jdbcTemplate.queryForObject(
            "SELECT pgmq.send(?, ?::jsonb, ?)",
            Long.class,
            queueName, toJson(message), delaySeconds
        );

        if (msgId == null) {
            throw new IllegalStateException("Failed to send message to queue " + queueName);
        }

        log.debug("Sent message to {}: msgId={}", queueName, msgId);
        return msgId;
    }

    @Override
    public List<PgmqMessage> read(String queueName, int visibilityTimeoutSeconds, int batchSize) {
        return jdbcTemplate.query(
            "SELECT * FROM pgmq.read(?, ?, ?)",
            this::mapToPgmqMessage,
            queueName, visibilityTimeoutSeconds, batchSize
        );
    }

    @Override
    public boolean delete(String queueName, long msgId) {
        Boolean result = jdbcTemplate.queryForObject(
            "SELECT pgmq.delete(?, ?)",
            Boolean.class,
            queueName, msgId
        );
        return Boolean.TRUE.equals(result);
    }

    @Override
    public boolean archive(String queueName, long msgId) {
        Boolean result = jdbcTemplate.queryForObject(
            "SELECT pgmq.archive(?, ?)",
            Boolean.class,
            queueName, msgId
        );
        return Boolean.TRUE.equals(result);
    }

    @Override
    public boolean setVisibilityTimeout(String queueName, long msgId, int visibilityTimeoutSeconds) {
        // pgmq.set_vt returns the updated message row if successful
        List<PgmqMessage> result = jdbcTemplate.query(
            "SELECT * FROM pgmq.set_vt(?, ?, ?)",
            this::mapToPgmqMessage,
            queueName, msgId, visibilityTimeoutSeconds
        );
        return !result.isEmpty();
    }

    @Override
    public boolean updateMessage(String queueName, long msgId, Map<String, Object> message) {
        int updated = jdbcTemplate.update(
            "UPDATE " + QueueNames.queueTable(escapeIdentifier(queueName)) +
            " SET message = ?::jsonb WHERE msg_id = ?",
            toJson(message), msgId
        );
        return updated > 0;
    }

    @Override
    public long queueLength(String queueName) {
        Long length = jdbcTemplate.queryForObject(
            "SELECT queue_length FROM pgmq.metrics(?)",
            Long.class,
            queueName
        );
        return length != null ? length : 0L;
    }

    @Override
    public List<PgmqMessage> readArchive(String queueName, int limit) {
        return jdbcTemplate.query(
            "SELECT msg_id, read_ct, enqueued_at, vt, message FROM " +
            QueueNames.archiveTable(escapeIdentifier(queueName)) +
            " ORDER BY archived_at DESC LIMIT ?",
            this::mapToPgmqMessage,
            limit
        );
    }

    // --- Helper Methods ---

    private PgmqMessage mapToPgmqMessage(ResultSet rs, int rowNum) throws SQLException {
        Timestamp enqueuedAt = rs.getTimestamp("enqueued_at");
        Timestamp vt = rs.getTimestamp("vt");

        return new PgmqMessage(
            rs.getLong("msg_id"),
            rs.getInt("read_ct"),
            enqueuedAt != null ? enqueuedAt.toInstant() : null,
            vt != null ? vt.toInstant() : null,
            fromJson(rs.getString("message"))
        );
    }

    private String toJson(Map<String, Object> map) {
        try {
            return objectMapper.writeValueAsString(map);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize message to JSON", e);
        }
    }

    private Map<String, Object> fromJson(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize message from JSON", e);
        }
    }

    /**
     * Only allows alphanumeric characters and underscores.
     */
    String escapeIdentifier(String identifier) {
        return identifier.replaceAll("[^a-zA-Z0-9_]", "_");
    }
}
