package com.ivamare.auditstore;

import com.ivamare.auditstore.policy.RetryPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the audit store.
 *
 * <p>Example configuration:
 * <pre>
 * auditstore:
 *   enabled: true
 *   backend: jdbc
 *   store:
 *     write-timeout: 5s
 *   partitions:
 *     maintenance-enabled: true
 *     months-ahead: 3
 *   dlq:
 *     max-retries: 5
 *     initial-backoff: 10s
 *     backoff-multiplier: 2.0
 *     max-backoff: 10m
 *     warn-depth: 1000
 *     datasource:
 *       url: jdbc:postgresql://dlq-host:5432/auditstore_dlq
 *       username: auditstore
 *       password: secret
 *   worker:
 *     auto-start: true
 *     concurrency: 2
 *     lease-seconds: 60
 *     poll-interval-ms: 1000
 *     shutdown-drain-timeout: 10s
 *     resilience:
 *       initial-backoff-ms: 1000
 *       max-backoff-ms: 30000
 *       backoff-multiplier: 2.0
 *       error-threshold: 5
 * </pre>
 */
@ConfigurationProperties(prefix = "auditstore")
public class AuditStoreProperties {

    /**
     * Storage backend selection.
     */
    public enum Backend {
        /** PostgreSQL partitioned table, PGMQ dead letter queue */
        JDBC,
        /** In-process store and queue */
        MEMORY
    }

    /**
     * Enable/disable audit store auto-configuration.
     */
    private boolean enabled = true;

    private Backend backend = Backend.JDBC;

    private StoreProperties store = new StoreProperties();

    private PartitionProperties partitions = new PartitionProperties();

    private DlqProperties dlq = new DlqProperties();

    private WorkerProperties worker = new WorkerProperties();

    // Getters and setters

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Backend getBackend() {
        return backend;
    }

    public void setBackend(Backend backend) {
        this.backend = backend;
    }

    public StoreProperties getStore() {
        return store;
    }

    public void setStore(StoreProperties store) {
        this.store = store;
    }

    public PartitionProperties getPartitions() {
        return partitions;
    }

    public void setPartitions(PartitionProperties partitions) {
        this.partitions = partitions;
    }

    public DlqProperties getDlq() {
        return dlq;
    }

    public void setDlq(DlqProperties dlq) {
        this.dlq = dlq;
    }

    public WorkerProperties getWorker() {
        return worker;
    }

    public void setWorker(WorkerProperties worker) {
        this.worker = worker;
    }

    /**
     * Store write path configuration.
     */
    public static class StoreProperties {

        /**
         * Longest a synchronous write may block before it is treated as a
         * storage outage and the event goes to the DLQ.
         */
        private Duration writeTimeout = Duration.ofSeconds(5);

        public Duration getWriteTimeout() {
            return writeTimeout;
        }

        public void setWriteTimeout(Duration writeTimeout) {
            this.writeTimeout = writeTimeout;
        }
    }

    /**
     * Partition maintenance configuration.
     */
    public static class PartitionProperties {

        /**
         * Create monthly partitions at startup and daily. Disable when
         * migrations own the DDL.
         */
        private boolean maintenanceEnabled = true;

        /**
         * Months past the current one to keep partitions for.
         */
        private int monthsAhead = 3;

        /**
         * Cron expression for the daily maintenance run.
         */
        private String cron = "0 15 0 * * *";

        public boolean isMaintenanceEnabled() {
            return maintenanceEnabled;
        }

        public void setMaintenanceEnabled(boolean maintenanceEnabled) {
            this.maintenanceEnabled = maintenanceEnabled;
        }

        public int getMonthsAhead() {
            return monthsAhead;
        }

        public void setMonthsAhead(int monthsAhead) {
            this.monthsAhead = monthsAhead;
        }

        public String getCron() {
            return cron;
        }

        public void setCron(String cron) {
            this.cron = cron;
        }
    }

    /**
     * Dead letter queue configuration.
     */
    public static class DlqProperties {

        /**
         * Failed replays after which an entry is dead-lettered.
         */
        private int maxRetries = 5;

        private Duration initialBackoff = Duration.ofSeconds(10);

        private double backoffMultiplier = 2.0;

        private Duration maxBackoff = Duration.ofMinutes(10);

        /**
         * Depth above which DLQ growth is logged at WARN and health reports DEGRADED.
         */
        private long warnDepth = 1000;

        /**
         * Capacity of the in-memory queue, 0 for unbounded. Ignored by the PGMQ queue.
         */
        private int maxDepth = 0;

        /**
         * Database of the PGMQ queue. Kept apart from the event store so a store
         * outage does not also take down the queue that absorbs it.
         */
        private DlqDatasourceProperties datasource = new DlqDatasourceProperties();

        public RetryPolicy toRetryPolicy() {
            return new RetryPolicy(maxRetries, initialBackoff, backoffMultiplier, maxBackoff);
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public Duration getInitialBackoff() {
            return initialBackoff;
        }

        public void setInitialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
        }

        public double getBackoffMultiplier() {
            return backoffMultiplier;
        }

        public void setBackoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
        }

        public Duration getMaxBackoff() {
            return maxBackoff;
        }

        public void setMaxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
        }

        public long getWarnDepth() {
            return warnDepth;
        }

        public void setWarnDepth(long warnDepth) {
            this.warnDepth = warnDepth;
        }

        public int getMaxDepth() {
            return maxDepth;
        }

        public void setMaxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
        }

        public DlqDatasourceProperties getDatasource() {
            return datasource;
        }

        public void setDatasource(DlqDatasourceProperties datasource) {
            this.datasource = datasource;
        }
    }

    /**
     * Connection settings for the dead letter queue database.
     */
    public static class DlqDatasourceProperties {

        /**
         * JDBC URL. When unset the queue uses the event store's DataSource.
         */
        private String url;

        private String username;

        private String password;

        private String driverClassName;

        private int maximumPoolSize = 4;

        private Duration connectionTimeout = Duration.ofSeconds(2);

        public boolean isConfigured() {
            return url != null && !url.isBlank();
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public String getDriverClassName() {
            return driverClassName;
        }

        public void setDriverClassName(String driverClassName) {
            this.driverClassName = driverClassName;
        }

        public int getMaximumPoolSize() {
            return maximumPoolSize;
        }

        public void setMaximumPoolSize(int maximumPoolSize) {
            this.maximumPoolSize = maximumPoolSize;
        }

        public Duration getConnectionTimeout() {
            return connectionTimeout;
        }

        public void setConnectionTimeout(Duration connectionTimeout) {
            this.connectionTimeout = connectionTimeout;
        }
    }

    /**
     * Recovery worker configuration properties.
     */
    public static class WorkerProperties {

        /**
         * Auto-start the recovery worker on application ready.
         */
        private boolean autoStart = false;

        /**
         * Maximum concurrent replays.
         */
        private int concurrency = 2;

        /**
         * Lease (visibility timeout) in seconds for leased DLQ entries.
         */
        private int leaseSeconds = 60;

        /**
         * Poll interval in milliseconds when the DLQ is empty.
         */
        private int pollIntervalMs = 1000;

        /**
         * Time allowed for a final synchronous drain on shutdown. Zero disables it.
         */
        private Duration shutdownDrainTimeout = Duration.ofSeconds(10);

        /**
         * Resilience configuration for errors while reading the DLQ.
         */
        private ResilienceProperties resilience = new ResilienceProperties();

        public boolean isAutoStart() {
            return autoStart;
        }

        public void setAutoStart(boolean autoStart) {
            this.autoStart = autoStart;
        }

        public int getConcurrency() {
            return concurrency;
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = concurrency;
        }

        public int getLeaseSeconds() {
            return leaseSeconds;
        }

        public void setLeaseSeconds(int leaseSeconds) {
            this.leaseSeconds = leaseSeconds;
        }

        public int getPollIntervalMs() {
            return pollIntervalMs;
        }

        public void setPollIntervalMs(int pollIntervalMs) {
            this.pollIntervalMs = pollIntervalMs;
        }

        public Duration getShutdownDrainTimeout() {
            return shutdownDrainTimeout;
        }

        public void setShutdownDrainTimeout(Duration shutdownDrainTimeout) {
            this.shutdownDrainTimeout = shutdownDrainTimeout;
        }

        public ResilienceProperties getResilience() {
            return resilience;
        }

        public void setResilience(ResilienceProperties resilience) {
            this.resilience = resilience;
        }
    }

    /**
     * Backoff applied by the recovery worker after errors reading the DLQ.
     */
    public static class ResilienceProperties {

        /**
         * Initial backoff duration in milliseconds after the first error.
         */
        private long initialBackoffMs = 1000;

        /**
         * Maximum backoff duration in milliseconds.
         */
        private long maxBackoffMs = 30000;

        private double backoffMultiplier = 2.0;

        /**
         * Number of consecutive errors before logging at ERROR level.
         * Below this threshold, errors are logged at WARN level.
         */
        private int errorThreshold = 5;

        public long getInitialBackoffMs() {
            return initialBackoffMs;
        }

        public void setInitialBackoffMs(long initialBackoffMs) {
            this.initialBackoffMs = initialBackoffMs;
        }

        public long getMaxBackoffMs() {
            return maxBackoffMs;
        }

        public void setMaxBackoffMs(long maxBackoffMs) {
            this.maxBackoffMs = maxBackoffMs;
        }

        public double getBackoffMultiplier() {
            return backoffMultiplier;
        }

        public void setBackoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
        }

        public int getErrorThreshold() {
            return errorThreshold;
        }

        public void setErrorThreshold(int errorThreshold) {
            this.errorThreshold = errorThreshold;
        }
    }
}
