package com.ivamare.auditstore.dlq.impl;

import com.ivamare.auditstore.dlq.DeadLetterQueue;
import com.ivamare.auditstore.dlq.DlqEntry;
import com.ivamare.auditstore.dlq.DlqEntryState;
import com.ivamare.auditstore.model.AuditEventRequest;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process DLQ for the memory backend.
 *
 * <p>Entries are held in enqueue order. A lease hides an entry until
 * {@code now + leaseDuration}; an expired lease makes it visible again.
 * When {@code maxDepth > 0}, enqueue beyond that depth is refused.
 */
public class InMemoryDeadLetterQueue implements DeadLetterQueue {

    private final Clock clock;
    private final int maxDepth;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<Long, Slot> entries = new LinkedHashMap<>();
    private final LinkedList<DlqEntry> deadLetters = new LinkedList<>();
    private long nextId = 1;

    public InMemoryDeadLetterQueue(Clock clock, int maxDepth) {
        this.clock = clock;
        this.maxDepth = maxDepth;
    }

    public InMemoryDeadLetterQueue(Clock clock) {
        this(clock, 0);
    }

    @Override
    public DlqEntry enqueue(AuditEventRequest request, String error) {
        lock.lock();
        try {
            if (maxDepth > 0 && entries.size() >= maxDepth) {
                throw new IllegalStateException("DLQ is full (max depth " + maxDepth + ")");
            }
            Instant now = clock.instant();
            DlqEntry entry = new DlqEntry(nextId++, request, AUDIT_EVENTS_DESTINATION, 0,
                now, error, DlqEntryState.PENDING);
            entries.put(entry.id(), new Slot(entry, now));
            return entry;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<DlqEntry> lease(int maxEntries, Duration leaseDuration) {
        List<DlqEntry> leased = new ArrayList<>();
        lock.lock();
        try {
            Instant now = clock.instant();
            for (Slot slot : entries.values()) {
                if (leased.size() >= maxEntries) {
                    break;
                }
                if (!slot.visibleAt.isAfter(now)) {
                    slot.entry = slot.entry.withState(DlqEntryState.IN_FLIGHT);
                    slot.visibleAt = now.plus(leaseDuration);
                    leased.add(slot.entry);
                }
            }
        } finally {
            lock.unlock();
        }
        return leased;
    }

    @Override
    public void acknowledge(DlqEntry entry) {
        lock.lock();
        try {
            entries.remove(entry.id());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void retryLater(DlqEntry entry, Duration delay) {
        lock.lock();
        try {
            Slot slot = entries.get(entry.id());
            if (slot != null) {
                slot.entry = entry.withState(DlqEntryState.PENDING);
                slot.visibleAt = clock.instant().plus(delay);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void deadLetter(DlqEntry entry) {
        lock.lock();
        try {
            if (entries.remove(entry.id()) != null) {
                deadLetters.addFirst(entry.withState(DlqEntryState.DEAD_LETTERED));
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long depth() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<DlqEntry> deadLetters(int limit) {
        lock.lock();
        try {
            List<DlqEntry> result = new ArrayList<>();
            Iterator<DlqEntry> it = deadLetters.iterator();
            while (it.hasNext() && result.size() < limit) {
                result.add(it.next());
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    private static final class Slot {
        private DlqEntry entry;
        private Instant visibleAt;

        private Slot(DlqEntry entry, Instant visibleAt) {
            this.entry = entry;
            this.visibleAt = visibleAt;
        }
    }
}
