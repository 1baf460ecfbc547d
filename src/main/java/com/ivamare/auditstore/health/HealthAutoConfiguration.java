package com.ivamare.auditstore.health;

import com.ivamare.auditstore.AuditStoreAutoConfiguration;
import com.ivamare.auditstore.AuditStoreProperties;
import com.ivamare.auditstore.dlq.DeadLetterQueue;
import com.ivamare.auditstore.repository.AuditEventRepository;
import com.ivamare.auditstore.worker.RecoveryWorker;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;
import java.time.Clock;

/**
 * Auto-configuration for audit store health indicators.
 */
@AutoConfiguration(after = AuditStoreAutoConfiguration.class)
@ConditionalOnClass(HealthIndicator.class)
@ConditionalOnProperty(prefix = "auditstore", name = "enabled", havingValue = "true", matchIfMissing = true)
public class HealthAutoConfiguration {

    @Bean
    @ConditionalOnBean({AuditEventRepository.class, DeadLetterQueue.class})
    @ConditionalOnMissingBean(name = "auditStoreHealthIndicator")
    public AuditStoreHealthIndicator auditStoreHealthIndicator(
            AuditEventRepository auditEventRepository,
            DeadLetterQueue deadLetterQueue,
            Clock auditStoreClock,
            AuditStoreProperties properties,
            ObjectProvider<DataSource> dataSource) {
        DataSource ds = properties.getBackend() == AuditStoreProperties.Backend.JDBC
            ? dataSource.getIfAvailable() : null;
        return new AuditStoreHealthIndicator(auditEventRepository, deadLetterQueue,
            properties.getDlq().getWarnDepth(), auditStoreClock, ds);
    }

    @Bean
    @ConditionalOnBean(RecoveryWorker.class)
    @ConditionalOnMissingBean(name = "recoveryWorkerHealthIndicator")
    public RecoveryWorkerHealthIndicator recoveryWorkerHealthIndicator(
            RecoveryWorker recoveryWorker, AuditStoreProperties properties) {
        return new RecoveryWorkerHealthIndicator(recoveryWorker,
            properties.getWorker().getResilience().getErrorThreshold());
    }
}
