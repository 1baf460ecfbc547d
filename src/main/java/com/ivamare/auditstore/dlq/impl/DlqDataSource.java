package com.ivamare.auditstore.dlq.impl;

import com.ivamare.auditstore.AuditStoreProperties.DlqDatasourceProperties;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.time.Duration;

/**
 * Connections the PGMQ dead letter queue writes through.
 *
 * <p>The queue holds writes the event store could not take, so it has to stay
 * reachable while the store is down. With {@code auditstore.dlq.datasource.url}
 * set it gets its own Hikari pool against that database. Without it the queue
 * falls back to the store's DataSource and shares its outages.
 */
public class DlqDataSource implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DlqDataSource.class);

    public static final String POOL_NAME = "auditstore-dlq";

    private final DataSource dataSource;
    private final boolean dedicated;

    public DlqDataSource(DataSource dataSource, boolean dedicated) {
        this.dataSource = dataSource;
        this.dedicated = dedicated;
    }

    /**
     * Build the queue's connections from configuration.
     *
     * @param properties {@code auditstore.dlq.datasource} settings
     * @param storeDataSource the event store's DataSource, used when no DLQ database is configured
     * @return a dedicated pool, or the store's DataSource
     */
    public static DlqDataSource create(DlqDatasourceProperties properties, DataSource storeDataSource) {
        if (!properties.isConfigured()) {
            log.warn("auditstore.dlq.datasource.url is not set, the dead letter queue shares "
                + "the event store database and cannot absorb its outages");
            return new DlqDataSource(storeDataSource, false);
        }

        HikariDataSource pool = new HikariDataSource();
        pool.setPoolName(POOL_NAME);
        pool.setJdbcUrl(properties.getUrl());
        pool.setUsername(properties.getUsername());
        pool.setPassword(properties.getPassword());
        if (properties.getDriverClassName() != null) {
            pool.setDriverClassName(properties.getDriverClassName());
        }
        pool.setMaximumPoolSize(properties.getMaximumPoolSize());
        pool.setConnectionTimeout(properties.getConnectionTimeout().toMillis());
        // Start without a connection, the queue database may come up after us
        pool.setInitializationFailTimeout(-1);

        log.info("Dead letter queue uses dedicated pool {} at {}", POOL_NAME, properties.getUrl());
        return new DlqDataSource(pool, true);
    }

    public DataSource getDataSource() {
        return dataSource;
    }

    /**
     * @return true if the queue has its own pool, false if it shares the store's DataSource
     */
    public boolean isDedicated() {
        return dedicated;
    }

    public JdbcTemplate createJdbcTemplate(Duration queryTimeout) {
        JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);
        jdbcTemplate.setQueryTimeout((int) Math.max(1, queryTimeout.toSeconds()));
        return jdbcTemplate;
    }

    public TransactionTemplate createTransactionTemplate() {
        return new TransactionTemplate(new DataSourceTransactionManager(dataSource));
    }

    /**
     * Close the dedicated pool. A shared DataSource belongs to the application and is left open.
     */
    @Override
    public void close() {
        if (dedicated && dataSource instanceof HikariDataSource) {
            ((HikariDataSource) dataSource).close();
        }
    }
}
