package com.ivamare.auditstore.pgmq;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class QueueNamesTest {

    @Test
    void shouldBuildDlqQueueName() {
        assertEquals("audit_events__dlq", QueueNames.dlqQueue("audit_events"));
    }

    @Test
    void shouldExtractDestination() {
        assertEquals("audit_events", QueueNames.extractDestination("audit_events__dlq"));
        assertEquals("plain", QueueNames.extractDestination("plain"));
    }

    @Test
    void shouldNameQueueTables() {
        assertEquals("pgmq.q_audit_events__dlq", QueueNames.queueTable("audit_events__dlq"));
        assertEquals("pgmq.a_audit_events__dlq", QueueNames.archiveTable("audit_events__dlq"));
    }
}
