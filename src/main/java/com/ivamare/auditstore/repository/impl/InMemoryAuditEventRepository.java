package com.ivamare.auditstore.repository.impl;

import com.ivamare.auditstore.exception.ChildEventsExistException;
import com.ivamare.auditstore.exception.EventNotFoundException;
import com.ivamare.auditstore.exception.PartitionMissingException;
import com.ivamare.auditstore.exception.ReferentialIntegrityException;
import com.ivamare.auditstore.model.AuditEvent;
import com.ivamare.auditstore.model.InsertOutcome;
import com.ivamare.auditstore.repository.AuditEventRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process AuditEventRepository with the same integrity guarantees as the
 * PostgreSQL schema.
 *
 * <p>Each monthly partition has its own lock, rows keyed by event id, and a
 * count of children per row. An insert holds the locks of the child's and the
 * parent's partitions while it checks the parent and writes the row; a delete
 * holds the locks of the row's and its parent's partitions while it checks the
 * child count and removes the row. Locks are always taken in ascending month
 * order. Reads are lock-free.
 */
public class InMemoryAuditEventRepository implements AuditEventRepository {

    private static final Logger log = LoggerFactory.getLogger(InMemoryAuditEventRepository.class);

    private final Clock clock;
    private final ConcurrentSkipListMap<YearMonth, Partition> partitions = new ConcurrentSkipListMap<>();
    private final Map<UUID, LocalDate> eventDates = new ConcurrentHashMap<>();

    public InMemoryAuditEventRepository(Clock clock) {
        this.clock = clock;
    }

    @Override
    public InsertOutcome insert(AuditEvent event) {
        Partition target = partitions.get(event.partition());
        if (target == null) {
            throw new PartitionMissingException(event.eventDate());
        }

        Partition parentPartition = null;
        if (event.hasParent()) {
            parentPartition = partitions.get(YearMonth.from(event.parentEventDate()));
            if (parentPartition == null) {
                throw new ReferentialIntegrityException(event.parentEventId());
            }
        }

        List<Partition> locked = lockInOrder(target, parentPartition);
        try {
            if (parentPartition != null) {
                AuditEvent parent = parentPartition.rows.get(event.parentEventId());
                // Parent reference is (event_id, event_date)
                if (parent == null || !parent.eventDate().equals(event.parentEventDate())) {
                    throw new ReferentialIntegrityException(event.parentEventId());
                }
            }
            if (eventDates.putIfAbsent(event.eventId(), event.eventDate()) != null) {
                log.debug("Event {} already stored, insert ignored", event.eventId());
                return InsertOutcome.DUPLICATE;
            }
            target.rows.put(event.eventId(), event.withCreatedAt(clock.instant()));
            if (parentPartition != null) {
                parentPartition.childCounts.merge(event.parentEventId(), 1, Integer::sum);
            }
            return InsertOutcome.CREATED;
        } finally {
            unlock(locked);
        }
    }

    @Override
    public Optional<AuditEvent> findById(UUID eventId) {
        LocalDate eventDate = eventDates.get(eventId);
        return eventDate != null ? findById(eventId, eventDate) : Optional.empty();
    }

    @Override
    public Optional<AuditEvent> findById(UUID eventId, LocalDate eventDate) {
        Partition partition = partitions.get(YearMonth.from(eventDate));
        if (partition == null) {
            return Optional.empty();
        }
        AuditEvent event = partition.rows.get(eventId);
        if (event == null || !event.eventDate().equals(eventDate)) {
            return Optional.empty();
        }
        return Optional.of(event);
    }

    @Override
    public void delete(UUID eventId, LocalDate eventDate) {
        Partition partition = partitions.get(YearMonth.from(eventDate));
        AuditEvent existing = partition != null ? partition.rows.get(eventId) : null;
        if (existing == null || !existing.eventDate().equals(eventDate)) {
            throw new EventNotFoundException(eventId);
        }

        Partition parentPartition = existing.hasParent()
            ? partitions.get(YearMonth.from(existing.parentEventDate()))
            : null;

        List<Partition> locked = lockInOrder(partition, parentPartition);
        try {
            if (!partition.rows.containsKey(eventId)) {
                throw new EventNotFoundException(eventId);
            }
            if (partition.childCounts.getOrDefault(eventId, 0) > 0) {
                throw new ChildEventsExistException(eventId);
            }
            partition.rows.remove(eventId);
            partition.childCounts.remove(eventId);
            eventDates.remove(eventId);
            if (parentPartition != null) {
                parentPartition.childCounts.computeIfPresent(
                    existing.parentEventId(), (id, count) -> count > 1 ? count - 1 : null);
            }
        } finally {
            unlock(locked);
        }
    }

    @Override
    public boolean hasPartition(YearMonth month) {
        return partitions.containsKey(month);
    }

    @Override
    public void createPartition(YearMonth month) {
        if (partitions.putIfAbsent(month, new Partition(month)) == null) {
            log.info("Created in-memory partition {}", month);
        }
    }

    /**
     * @return number of events currently stored
     */
    public int size() {
        return eventDates.size();
    }

    private static List<Partition> lockInOrder(Partition first, Partition second) {
        TreeSet<Partition> ordered = new TreeSet<>((a, b) -> a.month.compareTo(b.month));
        ordered.add(first);
        if (second != null) {
            ordered.add(second);
        }
        List<Partition> locked = new ArrayList<>(ordered.size());
        for (Partition p : ordered) {
            p.lock.lock();
            locked.add(p);
        }
        return locked;
    }

    private static void unlock(List<Partition> locked) {
        for (int i = locked.size() - 1; i >= 0; i--) {
            locked.get(i).lock.unlock();
        }
    }

    private static final class Partition {
        private final YearMonth month;
        private final ReentrantLock lock = new ReentrantLock();
        private final Map<UUID, AuditEvent> rows = new ConcurrentHashMap<>();
        private final Map<UUID, Integer> childCounts = new ConcurrentHashMap<>();

        private Partition(YearMonth month) {
            this.month = month;
        }
    }
}
