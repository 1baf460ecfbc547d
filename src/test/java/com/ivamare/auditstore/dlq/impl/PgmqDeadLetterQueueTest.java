package com.ivamare.auditstore.dlq.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.auditstore.dlq.DlqEntry;
import com.ivamare.auditstore.dlq.DlqEntryState;
import com.ivamare.auditstore.model.AuditEventRequest;
import com.ivamare.auditstore.model.PgmqMessage;
import com.ivamare.auditstore.pgmq.PgmqClient;
import com.ivamare.auditstore.support.TestRequests;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PgmqDeadLetterQueueTest {

    private static final String QUEUE = "audit_events__dlq";
    private static final Instant NOW = Instant.parse("2025-11-18T10:00:00Z");

    @Mock
    private PgmqClient pgmqClient;

    @Mock
    private PlatformTransactionManager transactionManager;

    private PgmqDeadLetterQueue dlq;

    @BeforeEach
    void setUp() {
        dlq = new PgmqDeadLetterQueue(pgmqClient, new TransactionTemplate(transactionManager),
            new ObjectMapper(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void shouldUseDlqQueueName() {
        assertEquals(QUEUE, dlq.getQueueName());
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldEnqueueRequestWithMetadata() {
        AuditEventRequest request = TestRequests.valid();
        when(pgmqClient.send(eq(QUEUE), anyMap())).thenReturn(17L);

        DlqEntry entry = dlq.enqueue(request, "connection refused");

        assertEquals(17L, entry.id());
        ArgumentCaptor<Map<String, Object>> captor = ArgumentCaptor.forClass(Map.class);
        verify(pgmqClient).send(eq(QUEUE), captor.capture());
        Map<String, Object> message = captor.getValue();
        assertEquals(0, message.get("retry_count"));
        assertEquals("PENDING", message.get("state"));
        assertEquals("audit_events", message.get("destination"));
        assertEquals("connection refused", message.get("last_error"));
        assertEquals(NOW.toString(), message.get("enqueued_at"));
        assertEquals(request.eventId(), ((Map<String, Object>) message.get("payload")).get("event_id"));
    }

    @Test
    void shouldLeaseMessagesAsInFlightEntries() {
        AuditEventRequest request = TestRequests.valid();
        DlqEntry stored = new DlqEntry(5L, request, "audit_events", 2, NOW, "timeout", DlqEntryState.PENDING);
        when(pgmqClient.read(QUEUE, 60, 3)).thenReturn(List.of(
            new PgmqMessage(5L, 1, NOW, NOW.plusSeconds(60), dlq.toMessage(stored))));

        List<DlqEntry> leased = dlq.lease(3, Duration.ofSeconds(60));

        assertEquals(1, leased.size());
        DlqEntry entry = leased.get(0);
        assertEquals(5L, entry.id());
        assertEquals(2, entry.retryCount());
        assertEquals("timeout", entry.lastError());
        assertEquals(DlqEntryState.IN_FLIGHT, entry.state());
        assertEquals(request.eventId(), entry.payload().eventId());
        assertEquals(request.eventData(), entry.payload().eventData());
    }

    @Test
    void shouldNotReadWhenNoCapacity() {
        assertTrue(dlq.lease(0, Duration.ofSeconds(60)).isEmpty());
        verifyNoInteractions(pgmqClient);
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldRewriteAndDelayOnRetry() {
        DlqEntry entry = new DlqEntry(5L, TestRequests.valid(), "audit_events", 0, NOW, "down",
            DlqEntryState.IN_FLIGHT).failedAttempt("still down");

        dlq.retryLater(entry, Duration.ofSeconds(20));

        ArgumentCaptor<Map<String, Object>> captor = ArgumentCaptor.forClass(Map.class);
        verify(pgmqClient).updateMessage(eq(QUEUE), eq(5L), captor.capture());
        assertEquals(1, captor.getValue().get("retry_count"));
        assertEquals("still down", captor.getValue().get("last_error"));
        verify(pgmqClient).setVisibilityTimeout(QUEUE, 5L, 20);
        verify(transactionManager).commit(any());
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldArchiveDeadLetteredEntries() {
        DlqEntry entry = new DlqEntry(5L, TestRequests.valid(), "audit_events", 5, NOW, "gave up",
            DlqEntryState.IN_FLIGHT);

        dlq.deadLetter(entry);

        ArgumentCaptor<Map<String, Object>> captor = ArgumentCaptor.forClass(Map.class);
        verify(pgmqClient).updateMessage(eq(QUEUE), eq(5L), captor.capture());
        assertEquals("DEAD_LETTERED", captor.getValue().get("state"));
        verify(pgmqClient).archive(QUEUE, 5L);
    }

    @Test
    void shouldAcknowledgeByDeleting() {
        DlqEntry entry = new DlqEntry(5L, TestRequests.valid(), "audit_events", 0, NOW, null,
            DlqEntryState.IN_FLIGHT);
        when(pgmqClient.delete(QUEUE, 5L)).thenReturn(true);

        dlq.acknowledge(entry);

        verify(pgmqClient).delete(QUEUE, 5L);
    }

    @Test
    void shouldReportDepthFromQueueLength() {
        when(pgmqClient.queueLength(QUEUE)).thenReturn(3L);

        assertEquals(3L, dlq.depth());
    }

    @Test
    void shouldTolerateQueueCreationFailure() {
        doThrow(new DataAccessResourceFailureException("down")).when(pgmqClient).createQueue(QUEUE);

        assertFalse(dlq.ensureQueue());
    }
}
