package com.ivamare.auditstore.partition;

import com.ivamare.auditstore.repository.impl.InMemoryAuditEventRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneId;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PartitionMaintenance")
class PartitionMaintenanceTest {

    private InMemoryAuditEventRepository repository;
    private Clock clock;

    @BeforeEach
    void setUp() {
        clock = Clock.fixed(Instant.parse("2025-11-18T10:00:00Z"), ZoneId.of("UTC"));
        repository = new InMemoryAuditEventRepository(clock);
    }

    @Test
    @DisplayName("should create current month and months ahead")
    void shouldCreateCurrentAndAheadMonths() {
        PartitionMaintenance maintenance = new PartitionMaintenance(repository, clock, 3);

        List<YearMonth> created = maintenance.ensurePartitions();

        assertEquals(List.of(YearMonth.of(2025, 11), YearMonth.of(2025, 12),
            YearMonth.of(2026, 1), YearMonth.of(2026, 2)), created);
        assertTrue(repository.hasPartition(YearMonth.of(2026, 2)));
        assertFalse(repository.hasPartition(YearMonth.of(2026, 3)));
    }

    @Test
    @DisplayName("should only create missing partitions")
    void shouldOnlyCreateMissingPartitions() {
        repository.createPartition(YearMonth.of(2025, 11));
        PartitionMaintenance maintenance = new PartitionMaintenance(repository, clock, 1);

        assertEquals(List.of(YearMonth.of(2025, 12)), maintenance.ensurePartitions());
        assertTrue(maintenance.ensurePartitions().isEmpty());
    }

    @Test
    @DisplayName("should take the current month in UTC")
    void shouldTakeCurrentMonthInUtc() {
        // Still November 30th in New York, already December in UTC
        Clock newYork = Clock.fixed(Instant.parse("2025-12-01T02:00:00Z"), ZoneId.of("America/New_York"));
        PartitionMaintenance maintenance = new PartitionMaintenance(repository, newYork, 0);

        assertEquals(List.of(YearMonth.of(2025, 12)), maintenance.ensurePartitions());
    }

    @Test
    @DisplayName("should reject negative months ahead")
    void shouldRejectNegativeMonthsAhead() {
        assertThrows(IllegalArgumentException.class, () -> new PartitionMaintenance(repository, clock, -1));
    }
}
