package com.ivamare.auditstore.partition;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.YearMonth;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PartitionMaintenanceSchedulerTest {

    @Mock
    private PartitionMaintenance maintenance;

    @Test
    void shouldEnsurePartitionsOnStartupAndSchedule() {
        when(maintenance.ensurePartitions()).thenReturn(List.of(YearMonth.of(2025, 11)));
        PartitionMaintenanceScheduler scheduler = new PartitionMaintenanceScheduler(maintenance);

        scheduler.onApplicationReady();
        scheduler.scheduledRun();

        verify(maintenance, times(2)).ensurePartitions();
    }

    @Test
    void shouldNotPropagateMaintenanceFailure() {
        when(maintenance.ensurePartitions()).thenThrow(new DataAccessResourceFailureException("down"));
        PartitionMaintenanceScheduler scheduler = new PartitionMaintenanceScheduler(maintenance);

        assertDoesNotThrow(scheduler::scheduledRun);
    }
}
