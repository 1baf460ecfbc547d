package com.ivamare.auditstore.dlq.impl;

import com.ivamare.auditstore.AuditStoreProperties.DlqDatasourceProperties;
import com.zaxxer.hikari.HikariDataSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("DlqDataSource")
class DlqDataSourceTest {

    @Test
    @DisplayName("should share the store DataSource when no queue database is configured")
    void shouldShareStoreDataSourceWhenUnconfigured() {
        DataSource store = mock(DataSource.class);

        DlqDataSource dlqDataSource = DlqDataSource.create(new DlqDatasourceProperties(), store);

        assertFalse(dlqDataSource.isDedicated());
        assertSame(store, dlqDataSource.getDataSource());
    }

    @Test
    @DisplayName("should open a separate pool for a configured queue database")
    void shouldCreateDedicatedPool() {
        DataSource store = mock(DataSource.class);
        DlqDatasourceProperties properties = new DlqDatasourceProperties();
        properties.setUrl("jdbc:postgresql://dlq-host:5432/auditstore_dlq");
        properties.setUsername("dlq");
        properties.setPassword("secret");
        properties.setMaximumPoolSize(3);
        properties.setConnectionTimeout(Duration.ofMillis(750));

        DlqDataSource dlqDataSource = DlqDataSource.create(properties, store);

        try {
            assertTrue(dlqDataSource.isDedicated());
            assertNotSame(store, dlqDataSource.getDataSource());
            HikariDataSource pool = (HikariDataSource) dlqDataSource.getDataSource();
            assertEquals(DlqDataSource.POOL_NAME, pool.getPoolName());
            assertEquals("jdbc:postgresql://dlq-host:5432/auditstore_dlq", pool.getJdbcUrl());
            assertEquals("dlq", pool.getUsername());
            assertEquals(3, pool.getMaximumPoolSize());
            assertEquals(750, pool.getConnectionTimeout());
        } finally {
            dlqDataSource.close();
        }
        verifyNoInteractions(store);
    }

    @Test
    @DisplayName("should close a dedicated pool")
    void shouldCloseDedicatedPool() {
        HikariDataSource pool = mock(HikariDataSource.class);

        new DlqDataSource(pool, true).close();

        verify(pool).close();
    }

    @Test
    @DisplayName("should leave a shared DataSource open")
    void shouldNotCloseSharedDataSource() {
        HikariDataSource store = mock(HikariDataSource.class);

        new DlqDataSource(store, false).close();

        verify(store, never()).close();
    }

    @Test
    @DisplayName("should apply the write timeout to queue statements")
    void shouldApplyQueryTimeout() {
        DlqDataSource dlqDataSource = new DlqDataSource(mock(DataSource.class), true);

        assertEquals(5, dlqDataSource.createJdbcTemplate(Duration.ofSeconds(5)).getQueryTimeout());
        assertEquals(1, dlqDataSource.createJdbcTemplate(Duration.ofMillis(200)).getQueryTimeout());
    }
}
