package com.ivamare.auditstore.ingest.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.auditstore.dlq.impl.PgmqDeadLetterQueue;
import com.ivamare.auditstore.ingest.AuditEventValidator;
import com.ivamare.auditstore.ingest.AuditEventWriter;
import com.ivamare.auditstore.ingest.IngestContext;
import com.ivamare.auditstore.ingest.IngestResult;
import com.ivamare.auditstore.metrics.AuditStoreMetrics;
import com.ivamare.auditstore.model.AuditEventRequest;
import com.ivamare.auditstore.pgmq.impl.JdbcPgmqClient;
import com.ivamare.auditstore.repository.impl.JdbcAuditEventRepository;
import com.ivamare.auditstore.support.TestRequests;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Store and queue on separate connections: the store's pool is unreachable,
 * the dead letter database is not.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("Ingestion during a store outage")
class StoreOutageIngestionTest {

    private static final String SEND_SQL = "SELECT pgmq.send(?, ?::jsonb, ?)";

    @Mock
    private DataSource storeDataSource;

    @Mock
    private JdbcTemplate dlqJdbcTemplate;

    @Mock
    private PlatformTransactionManager dlqTransactionManager;

    private SimpleMeterRegistry registry;
    private DefaultIngestionGateway gateway;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
        registry = new SimpleMeterRegistry();
        AuditStoreMetrics metrics = new AuditStoreMetrics(registry);

        JdbcAuditEventRepository store = new JdbcAuditEventRepository(new JdbcTemplate(storeDataSource), objectMapper);
        AuditEventWriter writer = new AuditEventWriter(new AuditEventValidator(), store, metrics);
        PgmqDeadLetterQueue dlq = new PgmqDeadLetterQueue(
            new JdbcPgmqClient(dlqJdbcTemplate, objectMapper),
            new TransactionTemplate(dlqTransactionManager),
            objectMapper,
            Clock.fixed(Instant.parse(TestRequests.TIMESTAMP), ZoneOffset.UTC));

        gateway = new DefaultIngestionGateway(writer, dlq, metrics);
    }

    @Test
    @DisplayName("should hold the event in the dead letter queue when the store refuses connections")
    void shouldQueueEventWhenStoreUnreachable() throws SQLException {
        when(storeDataSource.getConnection()).thenThrow(new SQLException("Connection refused", "08001"));
        when(dlqJdbcTemplate.queryForObject(eq(SEND_SQL), eq(Long.class),
            eq("audit_events__dlq"), anyString(), eq(0))).thenReturn(11L);
        AuditEventRequest request = TestRequests.valid();

        IngestResult result = gateway.ingest(request, IngestContext.forProducer());

        assertEquals(IngestResult.Status.QUEUED, result.status());
        assertEquals(UUID.fromString(request.eventId()), result.eventId());
        verify(dlqJdbcTemplate).queryForObject(eq(SEND_SQL), eq(Long.class),
            eq("audit_events__dlq"), contains(request.eventId()), eq(0));
        assertEquals(1.0, registry.get("auditstore.dlq.fallbacks").counter().count());
        assertEquals(0.0, registry.get("auditstore.dlq.enqueue.failures").counter().count());
        assertEquals(1.0, registry.get("auditstore.events.ingested").tag("result", "queued").counter().count());
    }
}
