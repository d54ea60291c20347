package io.jobqueue.spring.boot;

import io.jobqueue.JobClient;
import io.jobqueue.JobHandler;
import io.jobqueue.dispatch.ExponentialBackoffRetryPolicy;
import io.jobqueue.dispatch.JobInterceptor;
import io.jobqueue.dispatch.RetryPolicy;
import io.jobqueue.jdbc.DataSourceConnectionProvider;
import io.jobqueue.jdbc.TableNames;
import io.jobqueue.jdbc.store.AbstractJdbcJobStore;
import io.jobqueue.jdbc.store.JdbcJobStores;
import io.jobqueue.periodic.PeriodicJob;
import io.jobqueue.registry.DefaultWorkerRegistry;
import io.jobqueue.registry.WorkerRegistry;
import io.jobqueue.spi.ConnectionProvider;
import io.jobqueue.spi.JobStore;
import io.jobqueue.spi.MetricsExporter;
import io.jobqueue.spi.TxContext;
import io.jobqueue.spring.SpringTxContext;
import io.jobqueue.util.JsonCodec;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;
import java.util.Map;

/**
 * Auto-configuration for the job queue.
 *
 * <p>Wires a {@link JobClient} from a {@link DataSource} and {@link JobQueueProperties}.
 * Every {@link JobHandler} bean is registered in the worker registry, every
 * {@link PeriodicJob} bean is scheduled, and {@link JobInterceptor}, {@link RetryPolicy},
 * {@link MetricsExporter} and {@link JsonCodec} beans are picked up when present. The client
 * starts and stops with the application context unless {@code jobqueue.auto-start=false}.
 *
 * @see JobQueueProperties
 * @see JobQueueMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(JobClient.class)
@ConditionalOnBean(DataSource.class)
@ConditionalOnProperty(prefix = "jobqueue", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(JobQueueProperties.class)
public class JobQueueAutoConfiguration {

    static final String DEFAULT_QUEUE = "default";
    static final int DEFAULT_QUEUE_WORKERS = 10;

    @Bean
    @ConditionalOnMissingBean(JobStore.class)
    public AbstractJdbcJobStore jobStore(DataSource dataSource, JobQueueProperties props) {
        AbstractJdbcJobStore detected = JdbcJobStores.detect(dataSource);
        String tableName = props.getTableName();
        return TableNames.DEFAULT_TABLE.equals(tableName) ? detected : detected.withTableName(tableName);
    }

    @Bean
    @ConditionalOnMissingBean(ConnectionProvider.class)
    public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
        return new DataSourceConnectionProvider(dataSource);
    }

    @Bean
    @ConditionalOnMissingBean(TxContext.class)
    public SpringTxContext txContext(DataSource dataSource) {
        return new SpringTxContext(dataSource);
    }

    @Bean
    @ConditionalOnMissingBean(WorkerRegistry.class)
    public DefaultWorkerRegistry workerRegistry(ObjectProvider<JobHandler<?>> handlers) {
        DefaultWorkerRegistry registry = new DefaultWorkerRegistry();
        handlers.orderedStream().forEach(registry::register);
        return registry;
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public JobClient jobClient(JobQueueProperties props,
                               ConnectionProvider connectionProvider,
                               TxContext txContext,
                               JobStore jobStore,
                               WorkerRegistry workerRegistry,
                               ObjectProvider<MetricsExporter> metricsProvider,
                               ObjectProvider<RetryPolicy> retryPolicyProvider,
                               ObjectProvider<JsonCodec> jsonCodecProvider,
                               ObjectProvider<JobInterceptor> interceptorProvider,
                               ObjectProvider<PeriodicJob> periodicJobProvider) {
        RetryPolicy retryPolicy = retryPolicyProvider.getIfAvailable(() -> new ExponentialBackoffRetryPolicy(
            props.getRetry().getBaseDelay().toMillis(), props.getRetry().getMaxDelay().toMillis()));
        Map<String, Integer> queues = props.getQueues().isEmpty()
            ? Map.of(DEFAULT_QUEUE, DEFAULT_QUEUE_WORKERS)
            : props.getQueues();

        JobClient.Builder builder = JobClient.builder()
            .connectionProvider(connectionProvider)
            .txContext(txContext)
            .jobStore(jobStore)
            .registry(workerRegistry)
            .retryPolicy(retryPolicy)
            .queues(queues)
            .pollInterval(props.getPollInterval())
            .fetchLimit(props.getFetchLimit())
            .jobTimeout(props.getJobTimeout())
            .leaseTimeout(props.getLeaseTimeout())
            .rescueInterval(props.getRescueInterval())
            .shutdownGracePeriod(props.getShutdownGracePeriod())
            .maxAttempts(props.getMaxAttempts())
            .eventBufferSize(props.getEventBufferSize());
        if (props.getClientId() != null && !props.getClientId().isEmpty()) {
            builder.id(props.getClientId());
        }
        metricsProvider.ifAvailable(builder::metrics);
        jsonCodecProvider.ifAvailable(builder::jsonCodec);
        interceptorProvider.orderedStream().forEach(builder::interceptor);
        periodicJobProvider.orderedStream().forEach(builder::periodicJob);
        return builder.build();
    }

    @Bean
    @ConditionalOnProperty(prefix = "jobqueue", name = "auto-start", matchIfMissing = true)
    public JobClientLifecycle jobClientLifecycle(JobClient jobClient) {
        return new JobClientLifecycle(jobClient);
    }
}
