package io.jobqueue.spring.boot;

import io.jobqueue.jdbc.TableNames;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for the job queue.
 *
 * @see JobQueueAutoConfiguration
 */
@ConfigurationProperties(prefix = "jobqueue")
public class JobQueueProperties {

    /**
     * Whether to auto-configure the job client.
     */
    private boolean enabled = true;

    /**
     * Whether to start the client with the application context. When false the client only
     * inserts until started manually.
     */
    private boolean autoStart = true;

    /**
     * Database table name for job rows.
     */
    private String tableName = TableNames.DEFAULT_TABLE;

    /**
     * Client identifier recorded as {@code attempted_by}. Generated when empty.
     */
    private String clientId = "";

    /**
     * Queues served by this client and their maximum concurrent workers. Defaults to
     * {@code default: 10} when empty.
     */
    private Map<String, Integer> queues = new LinkedHashMap<>();

    private Duration pollInterval = Duration.ofSeconds(1);
    private int fetchLimit = 100;
    private Duration jobTimeout = Duration.ofMinutes(1);
    private Duration leaseTimeout = Duration.ofHours(1);
    private Duration rescueInterval = Duration.ofSeconds(30);
    private Duration shutdownGracePeriod = Duration.ofSeconds(10);
    private int maxAttempts = 10;
    private int eventBufferSize = 1000;

    private final Retry retry = new Retry();
    private final Metrics metrics = new Metrics();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isAutoStart() {
        return autoStart;
    }

    public void setAutoStart(boolean autoStart) {
        this.autoStart = autoStart;
    }

    public String getTableName() {
        return tableName;
    }

    public void setTableName(String tableName) {
        this.tableName = tableName;
    }

    public String getClientId() {
        return clientId;
    }

    public void setClientId(String clientId) {
        this.clientId = clientId;
    }

    public Map<String, Integer> getQueues() {
        return queues;
    }

    public void setQueues(Map<String, Integer> queues) {
        this.queues = queues;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
    }

    public int getFetchLimit() {
        return fetchLimit;
    }

    public void setFetchLimit(int fetchLimit) {
        this.fetchLimit = fetchLimit;
    }

    public Duration getJobTimeout() {
        return jobTimeout;
    }

    public void setJobTimeout(Duration jobTimeout) {
        this.jobTimeout = jobTimeout;
    }

    public Duration getLeaseTimeout() {
        return leaseTimeout;
    }

    public void setLeaseTimeout(Duration leaseTimeout) {
        this.leaseTimeout = leaseTimeout;
    }

    public Duration getRescueInterval() {
        return rescueInterval;
    }

    public void setRescueInterval(Duration rescueInterval) {
        this.rescueInterval = rescueInterval;
    }

    public Duration getShutdownGracePeriod() {
        return shutdownGracePeriod;
    }

    public void setShutdownGracePeriod(Duration shutdownGracePeriod) {
        this.shutdownGracePeriod = shutdownGracePeriod;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public int getEventBufferSize() {
        return eventBufferSize;
    }

    public void setEventBufferSize(int eventBufferSize) {
        this.eventBufferSize = eventBufferSize;
    }

    public Retry getRetry() {
        return retry;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Retry {
        private Duration baseDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofHours(1);

        public Duration getBaseDelay() {
            return baseDelay;
        }

        public void setBaseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
        }

        public Duration getMaxDelay() {
            return maxDelay;
        }

        public void setMaxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "jobqueue";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
