package com.ivamare.auditstore.dlq.impl;

import com.ivamare.auditstore.dlq.DlqEntry;
import com.ivamare.auditstore.dlq.DlqEntryState;
import com.ivamare.auditstore.support.MutableClock;
import com.ivamare.auditstore.support.TestRequests;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InMemoryDeadLetterQueue")
class InMemoryDeadLetterQueueTest {

    private static final Duration LEASE = Duration.ofSeconds(60);

    private MutableClock clock;
    private InMemoryDeadLetterQueue dlq;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-11-18T10:00:00Z"));
        dlq = new InMemoryDeadLetterQueue(clock);
    }

    @Test
    @DisplayName("should enqueue pending entry with zero retries")
    void shouldEnqueuePendingEntry() {
        DlqEntry entry = dlq.enqueue(TestRequests.valid(), "connection refused");

        assertEquals(0, entry.retryCount());
        assertEquals(DlqEntryState.PENDING, entry.state());
        assertEquals("connection refused", entry.lastError());
        assertEquals(clock.instant(), entry.enqueuedAt());
        assertEquals(1, dlq.depth());
    }

    @Test
    @DisplayName("should hide leased entries until the lease expires")
    void shouldHideLeasedEntriesUntilLeaseExpires() {
        dlq.enqueue(TestRequests.valid(), "down");
        dlq.enqueue(TestRequests.valid(), "down");

        List<DlqEntry> first = dlq.lease(1, LEASE);
        assertEquals(1, first.size());
        assertEquals(DlqEntryState.IN_FLIGHT, first.get(0).state());

        List<DlqEntry> second = dlq.lease(5, LEASE);
        assertEquals(1, second.size());
        assertNotEquals(first.get(0).id(), second.get(0).id());
        assertTrue(dlq.lease(5, LEASE).isEmpty());

        clock.advance(LEASE);
        assertEquals(2, dlq.lease(5, LEASE).size());
    }

    @Test
    @DisplayName("should remove acknowledged entries")
    void shouldRemoveAcknowledgedEntries() {
        dlq.enqueue(TestRequests.valid(), "down");
        DlqEntry leased = dlq.lease(1, LEASE).get(0);

        dlq.acknowledge(leased);

        assertEquals(0, dlq.depth());
    }

    @Test
    @DisplayName("should make rescheduled entries visible after the delay")
    void shouldMakeRescheduledEntriesVisibleAfterDelay() {
        dlq.enqueue(TestRequests.valid(), "down");
        DlqEntry leased = dlq.lease(1, LEASE).get(0);

        dlq.retryLater(leased.failedAttempt("still down"), Duration.ofSeconds(10));

        assertTrue(dlq.lease(1, LEASE).isEmpty());
        clock.advance(Duration.ofSeconds(10));
        DlqEntry again = dlq.lease(1, LEASE).get(0);
        assertEquals(1, again.retryCount());
        assertEquals("still down", again.lastError());
    }

    @Test
    @DisplayName("should move dead-lettered entries out of the queue")
    void shouldMoveDeadLetteredEntriesOutOfQueue() {
        dlq.enqueue(TestRequests.valid(), "down");
        DlqEntry leased = dlq.lease(1, LEASE).get(0);

        dlq.deadLetter(leased.failedAttempt("gave up"));

        assertEquals(0, dlq.depth());
        clock.advance(Duration.ofHours(1));
        assertTrue(dlq.lease(1, LEASE).isEmpty());
        List<DlqEntry> dead = dlq.deadLetters(10);
        assertEquals(1, dead.size());
        assertEquals(DlqEntryState.DEAD_LETTERED, dead.get(0).state());
        assertEquals("gave up", dead.get(0).lastError());
    }

    @Test
    @DisplayName("should refuse enqueue beyond max depth")
    void shouldRefuseEnqueueBeyondMaxDepth() {
        InMemoryDeadLetterQueue bounded = new InMemoryDeadLetterQueue(clock, 1);
        bounded.enqueue(TestRequests.valid(), "down");

        assertThrows(IllegalStateException.class, () -> bounded.enqueue(TestRequests.valid(), "down"));
    }
}
