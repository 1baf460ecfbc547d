package com.ivamare.auditstore.partition;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Runs partition maintenance once the application is ready and then on the
 * {@code auditstore.partitions.cron} schedule.
 */
public class PartitionMaintenanceScheduler {

    private static final Logger log = LoggerFactory.getLogger(PartitionMaintenanceScheduler.class);

    private final PartitionMaintenance maintenance;

    public PartitionMaintenanceScheduler(PartitionMaintenance maintenance) {
        this.maintenance = maintenance;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        run("startup");
    }

    @Scheduled(cron = "${auditstore.partitions.cron:0 15 0 * * *}", zone = "UTC")
    public void scheduledRun() {
        run("scheduled");
    }

    void run(String trigger) {
        try {
            maintenance.ensurePartitions();
        } catch (RuntimeException e) {
            // Next run retries; writes to a missing month fail with PartitionMissingException meanwhile
            log.error("ALERT: {} partition maintenance failed: {}", trigger, e.getMessage(), e);
        }
    }
}
