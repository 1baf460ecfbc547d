package com.ivamare.auditstore.dlq.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.auditstore.dlq.DeadLetterQueue;
import com.ivamare.auditstore.dlq.DlqEntry;
import com.ivamare.auditstore.dlq.DlqEntryState;
import com.ivamare.auditstore.model.AuditEventRequest;
import com.ivamare.auditstore.model.PgmqMessage;
import com.ivamare.auditstore.pgmq.PgmqClient;
import com.ivamare.auditstore.pgmq.QueueNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * DLQ backed by a PGMQ queue.
 *
 * <p>A PGMQ read with a visibility timeout is the lease. Rescheduling rewrites
 * the message and pushes its visibility forward; dead-lettering rewrites the
 * message and archives it, so the queue's archive table is the dead-letter
 * location. Both run in one transaction.
 */
public class PgmqDeadLetterQueue implements DeadLetterQueue {

    private static final Logger log = LoggerFactory.getLogger(PgmqDeadLetterQueue.class);
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    static final String PAYLOAD = "payload";
    static final String DESTINATION = "destination";
    static final String RETRY_COUNT = "retry_count";
    static final String ENQUEUED_AT = "enqueued_at";
    static final String LAST_ERROR = "last_error";
    static final String STATE = "state";

    private final PgmqClient pgmqClient;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String queueName;

    public PgmqDeadLetterQueue(
            PgmqClient pgmqClient,
            TransactionTemplate transactionTemplate,
            ObjectMapper objectMapper,
            Clock clock) {
        this.pgmqClient = pgmqClient;
        this.transactionTemplate = transactionTemplate;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.queueName = QueueNames.dlqQueue(AUDIT_EVENTS_DESTINATION);
    }

    public String getQueueName() {
        return queueName;
    }

    /**
     * Create the PGMQ queue if it does not exist. A failure is logged and left
     * to the schema migration, the store may be down at startup.
     *
     * @return true if the queue exists after the call
     */
    public boolean ensureQueue() {
        try {
            pgmqClient.createQueue(queueName);
            return true;
        } catch (DataAccessException e) {
            log.warn("Could not ensure DLQ queue {}: {}", queueName, e.getMessage());
            return false;
        }
    }

    @Override
    public DlqEntry enqueue(AuditEventRequest request, String error) {
        DlqEntry entry = new DlqEntry(0L, request, AUDIT_EVENTS_DESTINATION, 0,
            clock.instant(), error, DlqEntryState.PENDING);
        long msgId = pgmqClient.send(queueName, toMessage(entry));
        log.debug("Enqueued event {} to {}: msgId={}", request.eventId(), queueName, msgId);
        return entry.withId(msgId);
    }

    @Override
    public List<DlqEntry> lease(int maxEntries, Duration leaseDuration) {
        if (maxEntries <= 0) {
            return List.of();
        }
        return pgmqClient.read(queueName, toSeconds(leaseDuration), maxEntries).stream()
            .map(msg -> fromMessage(msg).withState(DlqEntryState.IN_FLIGHT))
            .toList();
    }

    @Override
    public void acknowledge(DlqEntry entry) {
        if (!pgmqClient.delete(queueName, entry.id())) {
            log.warn("DLQ entry {} was already gone on acknowledge", entry.id());
        }
    }

    @Override
    public void retryLater(DlqEntry entry, Duration delay) {
        DlqEntry pending = entry.withState(DlqEntryState.PENDING);
        transactionTemplate.executeWithoutResult(status -> {
            pgmqClient.updateMessage(queueName, entry.id(), toMessage(pending));
            pgmqClient.setVisibilityTimeout(queueName, entry.id(), toSeconds(delay));
        });
    }

    @Override
    public void deadLetter(DlqEntry entry) {
        DlqEntry dead = entry.withState(DlqEntryState.DEAD_LETTERED);
        transactionTemplate.executeWithoutResult(status -> {
            pgmqClient.updateMessage(queueName, entry.id(), toMessage(dead));
            pgmqClient.archive(queueName, entry.id());
        });
    }

    @Override
    public long depth() {
        return pgmqClient.queueLength(queueName);
    }

    @Override
    public List<DlqEntry> deadLetters(int limit) {
        return pgmqClient.readArchive(queueName, limit).stream()
            .map(this::fromMessage)
            .toList();
    }

    Map<String, Object> toMessage(DlqEntry entry) {
        Map<String, Object> message = new HashMap<>();
        message.put(PAYLOAD, objectMapper.convertValue(entry.payload(), MAP_TYPE));
        message.put(DESTINATION, entry.destination());
        message.put(RETRY_COUNT, entry.retryCount());
        message.put(ENQUEUED_AT, entry.enqueuedAt().toString());
        message.put(STATE, entry.state().name());
        if (entry.lastError() != null) {
            message.put(LAST_ERROR, entry.lastError());
        }
        return message;
    }

    DlqEntry fromMessage(PgmqMessage msg) {
        Map<String, Object> body = msg.message();
        AuditEventRequest payload = objectMapper.convertValue(body.get(PAYLOAD), AuditEventRequest.class);
        Object retryCount = body.get(RETRY_COUNT);
        Object enqueuedAt = body.get(ENQUEUED_AT);
        Object state = body.get(STATE);
        return new DlqEntry(
            msg.msgId(),
            payload,
            (String) body.getOrDefault(DESTINATION, QueueNames.extractDestination(queueName)),
            retryCount instanceof Number n ? n.intValue() : 0,
            enqueuedAt != null ? Instant.parse(enqueuedAt.toString()) : msg.enqueuedAt(),
            (String) body.get(LAST_ERROR),
            state != null ? DlqEntryState.valueOf(state.toString()) : DlqEntryState.PENDING
        );
    }

    private static int toSeconds(Duration duration) {
        return (int) Math.max(0, Math.min(Integer.MAX_VALUE, duration.toSeconds()));
    }
}
