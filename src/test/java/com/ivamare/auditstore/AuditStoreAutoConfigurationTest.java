package com.ivamare.auditstore;

import com.ivamare.auditstore.aggregation.AggregationService;
import com.ivamare.auditstore.dlq.DeadLetterQueue;
import com.ivamare.auditstore.dlq.impl.DlqDataSource;
import com.ivamare.auditstore.dlq.impl.InMemoryDeadLetterQueue;
import com.ivamare.auditstore.dlq.impl.PgmqDeadLetterQueue;
import com.ivamare.auditstore.health.AuditStoreHealthIndicator;
import com.ivamare.auditstore.health.HealthAutoConfiguration;
import com.ivamare.auditstore.health.RecoveryWorkerHealthIndicator;
import com.ivamare.auditstore.ingest.IngestionGateway;
import com.ivamare.auditstore.metrics.AuditStoreMetrics;
import com.ivamare.auditstore.partition.PartitionMaintenance;
import com.ivamare.auditstore.partition.PartitionMaintenanceScheduler;
import com.ivamare.auditstore.pgmq.PgmqClient;
import com.ivamare.auditstore.policy.RetryPolicy;
import com.ivamare.auditstore.repository.ActionTraceRepository;
import com.ivamare.auditstore.repository.AuditEventRepository;
import com.ivamare.auditstore.repository.impl.InMemoryAuditEventRepository;
import com.ivamare.auditstore.repository.impl.JdbcAuditEventRepository;
import com.ivamare.auditstore.web.AuditEventController;
import com.ivamare.auditstore.web.AuditStoreExceptionHandler;
import com.ivamare.auditstore.web.SuccessRateController;
import com.ivamare.auditstore.worker.RecoveryWorker;
import com.zaxxer.hikari.HikariDataSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.boot.test.context.runner.WebApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.time.Clock;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

@DisplayName("AuditStoreAutoConfiguration")
class AuditStoreAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(AuditStoreAutoConfiguration.class, HealthAutoConfiguration.class));

    @Nested
    @DisplayName("memory backend")
    class MemoryBackend {

        private final ApplicationContextRunner memory = contextRunner.withPropertyValues("auditstore.backend=memory");

        @Test
        @DisplayName("should create all beans")
        void shouldCreateAllBeans() {
            memory.run(context -> {
                assertThat(context).hasSingleBean(AuditEventRepository.class);
                assertThat(context).hasSingleBean(ActionTraceRepository.class);
                assertThat(context).hasSingleBean(InMemoryDeadLetterQueue.class);
                assertThat(context).hasSingleBean(IngestionGateway.class);
                assertThat(context).hasSingleBean(RetryPolicy.class);
                assertThat(context).hasSingleBean(RecoveryWorker.class);
                assertThat(context).hasSingleBean(AggregationService.class);
                assertThat(context).hasSingleBean(PartitionMaintenance.class);
                assertThat(context).hasSingleBean(PartitionMaintenanceScheduler.class);
                assertThat(context).hasSingleBean(AuditStoreMetrics.class);
                assertThat(context).hasSingleBean(AuditStoreHealthIndicator.class);
                assertThat(context).hasSingleBean(RecoveryWorkerHealthIndicator.class);
                assertThat(context).doesNotHaveBean(PgmqClient.class);
                assertThat(context).doesNotHaveBean(AuditEventController.class);
            });
        }

        @Test
        @DisplayName("should bind retry policy from properties")
        void shouldBindRetryPolicy() {
            memory
                .withPropertyValues("auditstore.dlq.max-retries=7", "auditstore.dlq.initial-backoff=5s")
                .run(context -> {
                    RetryPolicy policy = context.getBean(RetryPolicy.class);
                    assertThat(policy.maxRetries()).isEqualTo(7);
                    assertThat(policy.getBackoff(1)).isEqualTo(Duration.ofSeconds(5));
                });
        }

        @Test
        @DisplayName("should skip scheduler when maintenance is disabled")
        void shouldSkipSchedulerWhenMaintenanceDisabled() {
            memory
                .withPropertyValues("auditstore.partitions.maintenance-enabled=false")
                .run(context -> {
                    assertThat(context).hasSingleBean(PartitionMaintenance.class);
                    assertThat(context).doesNotHaveBean(PartitionMaintenanceScheduler.class);
                });
        }

        @Test
        @DisplayName("should use custom repository if provided")
        void shouldUseCustomRepository() {
            memory
                .withUserConfiguration(CustomRepositoryConfig.class)
                .run(context -> {
                    assertThat(context).hasSingleBean(AuditEventRepository.class);
                    assertThat(context.getBean(AuditEventRepository.class))
                        .isSameAs(CustomRepositoryConfig.CUSTOM_REPOSITORY);
                });
        }

        @Test
        @DisplayName("should register controllers in servlet applications")
        void shouldRegisterControllersInServletApplications() {
            new WebApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(AuditStoreAutoConfiguration.class))
                .withPropertyValues("auditstore.backend=memory")
                .run(context -> {
                    assertThat(context).hasSingleBean(AuditEventController.class);
                    assertThat(context).hasSingleBean(SuccessRateController.class);
                    assertThat(context).hasSingleBean(AuditStoreExceptionHandler.class);
                });
        }
    }

    @Nested
    @DisplayName("jdbc backend")
    class JdbcBackend {

        @Test
        @DisplayName("should create JDBC repositories and PGMQ dead letter queue")
        void shouldCreateJdbcBeans() {
            contextRunner
                .withUserConfiguration(MockDataSourceConfig.class)
                .run(context -> {
                    assertThat(context).hasSingleBean(PgmqClient.class);
                    assertThat(context).hasSingleBean(PgmqDeadLetterQueue.class);
                    assertThat(context.getBean(AuditEventRepository.class))
                        .isInstanceOf(JdbcAuditEventRepository.class);
                    assertThat(context).hasSingleBean(IngestionGateway.class);
                });
        }

        @Test
        @DisplayName("should fall back to the store DataSource when no queue database is configured")
        void shouldShareStoreDataSourceByDefault() {
            contextRunner
                .withUserConfiguration(MockDataSourceConfig.class)
                .run(context -> {
                    DlqDataSource dlqDataSource = context.getBean(DlqDataSource.class);
                    assertThat(dlqDataSource.isDedicated()).isFalse();
                    assertThat(dlqDataSource.getDataSource()).isSameAs(context.getBean(DataSource.class));
                });
        }

        @Test
        @DisplayName("should give the dead letter queue its own pool when a queue database is configured")
        void shouldUseDedicatedDlqPool() {
            contextRunner
                .withUserConfiguration(MockDataSourceConfig.class)
                .withPropertyValues(
                    "auditstore.dlq.datasource.url=jdbc:postgresql://localhost:1/auditstore_dlq",
                    "auditstore.dlq.datasource.connection-timeout=250ms")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    assertThat(context).hasSingleBean(DataSource.class);
                    DlqDataSource dlqDataSource = context.getBean(DlqDataSource.class);
                    assertThat(dlqDataSource.isDedicated()).isTrue();
                    assertThat(dlqDataSource.getDataSource())
                        .isNotSameAs(context.getBean(DataSource.class))
                        .isInstanceOf(HikariDataSource.class);
                    assertThat(((HikariDataSource) dlqDataSource.getDataSource()).getJdbcUrl())
                        .isEqualTo("jdbc:postgresql://localhost:1/auditstore_dlq");
                    assertThat(context).hasSingleBean(PgmqDeadLetterQueue.class);
                });
        }
    }

    @Test
    @DisplayName("should not create beans when disabled")
    void shouldNotCreateBeansWhenDisabled() {
        contextRunner
            .withPropertyValues("auditstore.enabled=false", "auditstore.backend=memory")
            .run(context -> {
                assertThat(context).doesNotHaveBean(IngestionGateway.class);
                assertThat(context).doesNotHaveBean(DeadLetterQueue.class);
                assertThat(context).doesNotHaveBean(AuditStoreHealthIndicator.class);
            });
    }

    @Configuration
    static class MockDataSourceConfig {
        @Bean
        public DataSource dataSource() {
            return mock(DataSource.class);
        }
    }

    @Configuration
    static class CustomRepositoryConfig {
        static final AuditEventRepository CUSTOM_REPOSITORY = new InMemoryAuditEventRepository(Clock.systemUTC());

        @Bean
        public AuditEventRepository auditEventRepository() {
            return CUSTOM_REPOSITORY;
        }
    }
}
