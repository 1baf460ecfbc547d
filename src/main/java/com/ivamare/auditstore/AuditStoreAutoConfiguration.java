package com.ivamare.auditstore;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.ivamare.auditstore.aggregation.AggregationService;
import com.ivamare.auditstore.aggregation.impl.DefaultAggregationService;
import com.ivamare.auditstore.dlq.DeadLetterQueue;
import com.ivamare.auditstore.dlq.impl.DlqDataSource;
import com.ivamare.auditstore.dlq.impl.InMemoryDeadLetterQueue;
import com.ivamare.auditstore.dlq.impl.PgmqDeadLetterQueue;
import com.ivamare.auditstore.ingest.AuditEventValidator;
import com.ivamare.auditstore.ingest.AuditEventWriter;
import com.ivamare.auditstore.ingest.IngestionGateway;
import com.ivamare.auditstore.ingest.impl.DefaultIngestionGateway;
import com.ivamare.auditstore.metrics.AuditStoreMetrics;
import com.ivamare.auditstore.partition.PartitionMaintenance;
import com.ivamare.auditstore.partition.PartitionMaintenanceScheduler;
import com.ivamare.auditstore.pgmq.PgmqClient;
import com.ivamare.auditstore.pgmq.impl.JdbcPgmqClient;
import com.ivamare.auditstore.policy.RetryPolicy;
import com.ivamare.auditstore.repository.ActionTraceRepository;
import com.ivamare.auditstore.repository.AuditEventRepository;
import com.ivamare.auditstore.repository.impl.InMemoryActionTraceRepository;
import com.ivamare.auditstore.repository.impl.InMemoryAuditEventRepository;
import com.ivamare.auditstore.repository.impl.JdbcActionTraceRepository;
import com.ivamare.auditstore.repository.impl.JdbcAuditEventRepository;
import com.ivamare.auditstore.web.AuditEventController;
import com.ivamare.auditstore.web.AuditStoreExceptionHandler;
import com.ivamare.auditstore.web.SuccessRateController;
import com.ivamare.auditstore.worker.RecoveryWorker;
import com.ivamare.auditstore.worker.impl.DlqRecoveryWorker;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.time.Clock;

/**
 * Auto-configuration for the audit store.
 *
 * <p>Automatically configures:
 * <ul>
 *   <li>Audit event and action trace repositories for the selected backend</li>
 *   <li>Dead letter queue (PGMQ or in-memory)</li>
 *   <li>Ingestion gateway and its validated write path</li>
 *   <li>DLQ recovery worker and retry policy</li>
 *   <li>Aggregation service</li>
 *   <li>Partition maintenance</li>
 *   <li>HTTP controllers (servlet web applications only)</li>
 * </ul>
 *
 * <p>To disable auto-configuration:
 * <pre>
 * auditstore.enabled=false
 * </pre>
 */
@AutoConfiguration(after = {DataSourceAutoConfiguration.class, JacksonAutoConfiguration.class})
@ConditionalOnProperty(prefix = "auditstore", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(AuditStoreProperties.class)
public class AuditStoreAutoConfiguration {

    // --- Shared infrastructure ---

    @Bean
    @ConditionalOnMissingBean(name = "auditStoreClock")
    public Clock auditStoreClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper auditStoreObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.findAndRegisterModules(); // Register JSR310 module
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    @ConditionalOnMissingBean
    public AuditStoreMetrics auditStoreMetrics(ObjectProvider<MeterRegistry> meterRegistry) {
        return new AuditStoreMetrics(meterRegistry.getIfAvailable(SimpleMeterRegistry::new));
    }

    // --- Write path ---

    @Bean
    @ConditionalOnMissingBean
    public AuditEventValidator auditEventValidator() {
        return new AuditEventValidator();
    }

    @Bean
    @ConditionalOnMissingBean
    public AuditEventWriter auditEventWriter(
            AuditEventValidator validator,
            AuditEventRepository auditEventRepository,
            AuditStoreMetrics metrics) {
        return new AuditEventWriter(validator, auditEventRepository, metrics);
    }

    @Bean
    @ConditionalOnMissingBean
    public IngestionGateway ingestionGateway(
            AuditEventWriter writer,
            DeadLetterQueue deadLetterQueue,
            AuditStoreMetrics metrics) {
        return new DefaultIngestionGateway(writer, deadLetterQueue, metrics);
    }

    // --- Recovery ---

    @Bean
    @ConditionalOnMissingBean
    public RetryPolicy retryPolicy(AuditStoreProperties properties) {
        return properties.getDlq().toRetryPolicy();
    }

    @Bean
    @ConditionalOnMissingBean
    public RecoveryWorker recoveryWorker(
            DeadLetterQueue deadLetterQueue,
            AuditEventWriter writer,
            RetryPolicy retryPolicy,
            AuditStoreMetrics metrics,
            AuditStoreProperties properties) {
        return new DlqRecoveryWorker(deadLetterQueue, writer, retryPolicy, metrics,
            properties.getWorker(), properties.getDlq().getWarnDepth());
    }

    // --- Analytics ---

    @Bean
    @ConditionalOnMissingBean
    public AggregationService aggregationService(
            ActionTraceRepository actionTraceRepository,
            Clock auditStoreClock,
            AuditStoreMetrics metrics) {
        return new DefaultAggregationService(actionTraceRepository, auditStoreClock, metrics);
    }

    // --- Partitions ---

    @Bean
    @ConditionalOnMissingBean
    public PartitionMaintenance partitionMaintenance(
            AuditEventRepository auditEventRepository,
            Clock auditStoreClock,
            AuditStoreProperties properties) {
        return new PartitionMaintenance(auditEventRepository, auditStoreClock,
            properties.getPartitions().getMonthsAhead());
    }

    /**
     * Startup and daily partition creation. Disable when migrations own the DDL.
     */
    @Configuration(proxyBeanMethods = false)
    @EnableScheduling
    @ConditionalOnProperty(prefix = "auditstore.partitions", name = "maintenance-enabled",
        havingValue = "true", matchIfMissing = true)
    static class PartitionMaintenanceConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public PartitionMaintenanceScheduler partitionMaintenanceScheduler(PartitionMaintenance partitionMaintenance) {
            return new PartitionMaintenanceScheduler(partitionMaintenance);
        }
    }

    // --- Backends ---

    /**
     * PostgreSQL partitioned table with a PGMQ dead letter queue, the queue on
     * its own database when one is configured.
     */
    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(JdbcTemplate.class)
    @ConditionalOnBean(DataSource.class)
    @ConditionalOnProperty(prefix = "auditstore", name = "backend", havingValue = "jdbc", matchIfMissing = true)
    static class JdbcBackendConfiguration {

        /**
         * JdbcTemplate whose statements time out after {@code auditstore.store.write-timeout},
         * so a hung database surfaces as a storage failure instead of blocking producers.
         */
        @Bean
        @ConditionalOnMissingBean(name = "auditStoreJdbcTemplate")
        public JdbcTemplate auditStoreJdbcTemplate(DataSource dataSource, AuditStoreProperties properties) {
            JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);
            jdbcTemplate.setQueryTimeout((int) Math.max(1, properties.getStore().getWriteTimeout().toSeconds()));
            return jdbcTemplate;
        }

        @Bean
        @ConditionalOnMissingBean
        public AuditEventRepository auditEventRepository(JdbcTemplate auditStoreJdbcTemplate, ObjectMapper objectMapper) {
            return new JdbcAuditEventRepository(auditStoreJdbcTemplate, objectMapper);
        }

        @Bean
        @ConditionalOnMissingBean
        public ActionTraceRepository actionTraceRepository(JdbcTemplate auditStoreJdbcTemplate) {
            return new JdbcActionTraceRepository(auditStoreJdbcTemplate);
        }

        /**
         * Connections for the PGMQ queue, a separate pool when
         * {@code auditstore.dlq.datasource.url} is configured.
         */
        @Bean
        @ConditionalOnMissingBean
        public DlqDataSource auditStoreDlqDataSource(DataSource dataSource, AuditStoreProperties properties) {
            return DlqDataSource.create(properties.getDlq().getDatasource(), dataSource);
        }

        @Bean
        @ConditionalOnMissingBean
        public PgmqClient pgmqClient(
                DlqDataSource auditStoreDlqDataSource,
                AuditStoreProperties properties,
                ObjectMapper objectMapper) {
            JdbcTemplate jdbcTemplate = auditStoreDlqDataSource.createJdbcTemplate(
                properties.getStore().getWriteTimeout());
            return new JdbcPgmqClient(jdbcTemplate, objectMapper);
        }

        @Bean
        @ConditionalOnMissingBean
        public DeadLetterQueue deadLetterQueue(
                PgmqClient pgmqClient,
                DlqDataSource auditStoreDlqDataSource,
                ObjectProvider<TransactionTemplate> transactionTemplate,
                ObjectMapper objectMapper,
                Clock auditStoreClock,
                AuditStoreMetrics metrics) {
            TransactionTemplate tx = auditStoreDlqDataSource.isDedicated()
                ? auditStoreDlqDataSource.createTransactionTemplate()
                : transactionTemplate.getIfAvailable(auditStoreDlqDataSource::createTransactionTemplate);
            PgmqDeadLetterQueue dlq = new PgmqDeadLetterQueue(pgmqClient, tx, objectMapper, auditStoreClock);
            dlq.ensureQueue();
            metrics.bindDlqDepth(dlq);
            return dlq;
        }
    }

    /**
     * In-process store and queue for tests, demos and single-node deployments
     * that can lose data on restart.
     */
    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "auditstore", name = "backend", havingValue = "memory")
    static class MemoryBackendConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public AuditEventRepository auditEventRepository(Clock auditStoreClock) {
            return new InMemoryAuditEventRepository(auditStoreClock);
        }

        @Bean
        @ConditionalOnMissingBean
        public ActionTraceRepository actionTraceRepository() {
            return new InMemoryActionTraceRepository();
        }

        @Bean
        @ConditionalOnMissingBean
        public DeadLetterQueue deadLetterQueue(
                Clock auditStoreClock,
                AuditStoreProperties properties,
                AuditStoreMetrics metrics) {
            InMemoryDeadLetterQueue dlq = new InMemoryDeadLetterQueue(auditStoreClock,
                properties.getDlq().getMaxDepth());
            metrics.bindDlqDepth(dlq);
            return dlq;
        }
    }

    // --- HTTP API ---

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(RestController.class)
    @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
    static class WebConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public AuditEventController auditEventController(IngestionGateway ingestionGateway) {
            return new AuditEventController(ingestionGateway);
        }

        @Bean
        @ConditionalOnMissingBean
        public SuccessRateController successRateController(AggregationService aggregationService) {
            return new SuccessRateController(aggregationService);
        }

        @Bean
        @ConditionalOnMissingBean
        public AuditStoreExceptionHandler auditStoreExceptionHandler() {
            return new AuditStoreExceptionHandler();
        }
    }
}
