package com.ivamare.auditstore.health;

import com.ivamare.auditstore.dlq.DeadLetterQueue;
import com.ivamare.auditstore.repository.AuditEventRepository;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.YearMonth;
import java.time.ZoneOffset;

/**
 * Health indicator for the audit event store.
 *
 * <p>Checks:
 * <ul>
 *   <li>Database connection is valid (JDBC backend)</li>
 *   <li>A partition exists for the current month</li>
 *   <li>DLQ depth against the warn threshold</li>
 * </ul>
 *
 * <p>A DLQ deeper than the threshold reports {@code DEGRADED}; writes are still accepted.
 */
public class AuditStoreHealthIndicator implements HealthIndicator {

    public static final Status DEGRADED = new Status("DEGRADED", "DLQ depth above warn threshold");

    private static final int CONNECTION_VALIDITY_TIMEOUT_SECONDS = 3;

    private final AuditEventRepository repository;
    private final DeadLetterQueue deadLetterQueue;
    private final long warnDepth;
    private final Clock clock;
    private final DataSource dataSource;

    public AuditStoreHealthIndicator(AuditEventRepository repository, DeadLetterQueue deadLetterQueue,
                                     long warnDepth, Clock clock) {
        this(repository, deadLetterQueue, warnDepth, clock, null);
    }

    public AuditStoreHealthIndicator(AuditEventRepository repository, DeadLetterQueue deadLetterQueue,
                                     long warnDepth, Clock clock, DataSource dataSource) {
        this.repository = repository;
        this.deadLetterQueue = deadLetterQueue;
        this.warnDepth = warnDepth;
        this.clock = clock;
        this.dataSource = dataSource;
    }

    @Override
    public Health health() {
        try {
            if (dataSource != null && !isConnectionValid()) {
                return Health.down()
                    .withDetail("error", "Database connection invalid")
                    .build();
            }

            YearMonth current = YearMonth.now(clock.withZone(ZoneOffset.UTC));
            if (!repository.hasPartition(current)) {
                return Health.down()
                    .withDetail("error", "No partition for " + current)
                    .build();
            }

            long depth = deadLetterQueue.depth();
            Health.Builder builder = depth > warnDepth ? Health.status(DEGRADED) : Health.up();
            builder.withDetail("currentPartition", current.toString())
                .withDetail("dlqDepth", depth)
                .withDetail("dlqWarnDepth", warnDepth);

            addPoolStats(builder);
            return builder.build();

        } catch (Exception e) {
            return Health.down()
                .withDetail("error", e.getMessage())
                .build();
        }
    }

    private boolean isConnectionValid() {
        try (Connection conn = dataSource.getConnection()) {
            return conn.isValid(CONNECTION_VALIDITY_TIMEOUT_SECONDS);
        } catch (SQLException e) {
            return false;
        }
    }

    private void addPoolStats(Health.Builder builder) {
        if (dataSource instanceof HikariDataSource hikari) {
            HikariPoolMXBean pool = hikari.getHikariPoolMXBean();
            if (pool != null) {
                builder.withDetail("pool.active", pool.getActiveConnections());
                builder.withDetail("pool.idle", pool.getIdleConnections());
                builder.withDetail("pool.total", pool.getTotalConnections());
                builder.withDetail("pool.pending", pool.getThreadsAwaitingConnection());
            }
        }
    }
}
