package com.ivamare.auditstore.partition;

import com.ivamare.auditstore.repository.AuditEventRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Keeps monthly partitions ahead of the clock.
 *
 * <p>Event dates are UTC, so the current month is taken in UTC as well.
 */
public class PartitionMaintenance {

    private static final Logger log = LoggerFactory.getLogger(PartitionMaintenance.class);

    private final AuditEventRepository repository;
    private final Clock clock;
    private final int monthsAhead;

    public PartitionMaintenance(AuditEventRepository repository, Clock clock, int monthsAhead) {
        if (monthsAhead < 0) {
            throw new IllegalArgumentException("monthsAhead must be >= 0");
        }
        this.repository = repository;
        this.clock = clock;
        this.monthsAhead = monthsAhead;
    }

    /**
     * Create the partitions of the current month and the next {@code monthsAhead} months.
     *
     * @return the months that had no partition before this call
     */
    public List<YearMonth> ensurePartitions() {
        YearMonth current = YearMonth.now(clock.withZone(ZoneOffset.UTC));
        List<YearMonth> created = new ArrayList<>();
        for (int i = 0; i <= monthsAhead; i++) {
            YearMonth month = current.plusMonths(i);
            if (!repository.hasPartition(month)) {
                repository.createPartition(month);
                created.add(month);
            }
        }
        if (created.isEmpty()) {
            log.debug("Partitions {} .. {} already exist", current, current.plusMonths(monthsAhead));
        } else {
            log.info("Created audit event partitions for {}", created);
        }
        return created;
    }

    public int getMonthsAhead() {
        return monthsAhead;
    }
}
