package io.jobqueue.spring.boot;

import io.jobqueue.JobArgs;
import io.jobqueue.JobClient;
import io.jobqueue.JobClientState;
import io.jobqueue.JsonJobHandler;
import io.jobqueue.dispatch.ExponentialBackoffRetryPolicy;
import io.jobqueue.dispatch.RetryPolicy;
import io.jobqueue.event.JobEvent;
import io.jobqueue.event.JobEventKind;
import io.jobqueue.event.Subscription;
import io.jobqueue.jdbc.DataSourceConnectionProvider;
import io.jobqueue.jdbc.store.AbstractJdbcJobStore;
import io.jobqueue.jdbc.store.H2JobStore;
import io.jobqueue.model.JobState;
import io.jobqueue.periodic.PeriodicJob;
import io.jobqueue.periodic.PeriodicSchedule;
import io.jobqueue.registry.WorkerRegistry;
import io.jobqueue.spi.ConnectionProvider;
import io.jobqueue.spi.TxContext;
import io.jobqueue.spring.SpringTxContext;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

import javax.sql.DataSource;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class JobQueueAutoConfigurationTest {

    record GreetArgs(String name) implements JobArgs {
        @Override
        public String kind() {
            return "greet";
        }
    }

    static final List<String> greeted = new CopyOnWriteArrayList<>();

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(JobQueueAutoConfiguration.class))
        .withUserConfiguration(DataSourceConfig.class)
        .withPropertyValues("jobqueue.poll-interval=100ms");

    @Test
    void createsAllBeans() {
        runner.withUserConfiguration(HandlerConfig.class).run(ctx -> {
            assertTrue(ctx.containsBean("jobStore"));
            assertTrue(ctx.containsBean("connectionProvider"));
            assertTrue(ctx.containsBean("txContext"));
            assertTrue(ctx.containsBean("workerRegistry"));
            assertTrue(ctx.containsBean("jobClient"));
            assertTrue(ctx.containsBean("jobClientLifecycle"));

            assertInstanceOf(H2JobStore.class, ctx.getBean(AbstractJdbcJobStore.class));
            assertInstanceOf(DataSourceConnectionProvider.class, ctx.getBean(ConnectionProvider.class));
            assertInstanceOf(SpringTxContext.class, ctx.getBean(TxContext.class));
            assertInstanceOf(ExponentialBackoffRetryPolicy.class, ctx.getBean(JobClient.class).retryPolicy());
        });
    }

    @Test
    void registersHandlerBeans() {
        runner.withUserConfiguration(HandlerConfig.class).run(ctx -> {
            WorkerRegistry registry = ctx.getBean(WorkerRegistry.class);
            assertTrue(registry.isRegistered("greet"));
            assertSame(registry, ctx.getBean(JobClient.class).registry());
        });
    }

    @Test
    void startsWithContextAndRunsJobs() {
        greeted.clear();
        runner.withUserConfiguration(HandlerConfig.class).run(ctx -> {
            JobClient client = ctx.getBean(JobClient.class);
            assertEquals(JobClientState.RUNNING, client.state());

            try (Subscription completed = client.subscribe(JobEventKind.COMPLETED)) {
                String id = client.insert(new GreetArgs("ada"));
                JobEvent event = completed.poll(10, TimeUnit.SECONDS);
                assertNotNull(event);
                assertEquals(id, event.job().id());
                assertEquals(JobState.COMPLETED, client.getJob(id).orElseThrow().state());
            }
            assertEquals(List.of("ada"), greeted);
        });
    }

    @Test
    void stopsWhenContextCloses() {
        JobClient[] client = new JobClient[1];
        runner.withUserConfiguration(HandlerConfig.class).run(ctx -> client[0] = ctx.getBean(JobClient.class));

        assertEquals(JobClientState.STOPPED, client[0].state());
    }

    @Test
    void autoStartDisabled() {
        runner.withPropertyValues("jobqueue.auto-start=false")
            .withUserConfiguration(HandlerConfig.class).run(ctx -> {
                assertFalse(ctx.containsBean("jobClientLifecycle"));
                assertEquals(JobClientState.STOPPED, ctx.getBean(JobClient.class).state());
            });
    }

    @Test
    void customTableName() {
        runner
            .withPropertyValues("jobqueue.table-name=custom_job", "test.schema=schema-custom.sql")
            .withUserConfiguration(HandlerConfig.class).run(ctx -> {
                AbstractJdbcJobStore store = ctx.getBean(AbstractJdbcJobStore.class);
                assertInstanceOf(H2JobStore.class, store);
                assertEquals("custom_job", store.tableName());
                assertEquals(JobClientState.RUNNING, ctx.getBean(JobClient.class).state());
            });
    }

    @Test
    void missingTableFailsStartup() {
        runner
            .withPropertyValues("jobqueue.table-name=missing_job")
            .run(ctx -> assertNotNull(ctx.getStartupFailure()));
    }

    @Test
    void usesCustomRetryPolicyAndClientId() {
        runner
            .withPropertyValues("jobqueue.client-id=node-1", "jobqueue.auto-start=false")
            .withUserConfiguration(RetryConfig.class).run(ctx -> {
                JobClient client = ctx.getBean(JobClient.class);
                assertEquals("node-1", client.id());
                assertSame(ctx.getBean(RetryPolicy.class), client.retryPolicy());
            });
    }

    @Test
    void schedulesPeriodicJobBeans() {
        runner.withUserConfiguration(HandlerConfig.class, PeriodicConfig.class).run(ctx -> {
            JobClient client = ctx.getBean(JobClient.class);
            assertEquals(1, client.periodicJobs().handles().size());
        });
    }

    @Test
    void disabledByProperty() {
        runner.withPropertyValues("jobqueue.enabled=false").run(ctx -> {
            assertFalse(ctx.containsBean("jobClient"));
        });
    }

    @Test
    void notLoadedWithoutDataSource() {
        new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(JobQueueAutoConfiguration.class))
            .run(ctx -> assertFalse(ctx.containsBean("jobClient")));
    }

    @Test
    void respectsConditionalOnMissingBean() {
        runner.withPropertyValues("jobqueue.auto-start=false")
            .withUserConfiguration(CustomStoreConfig.class).run(ctx -> {
                assertEquals("myCustomStore", ctx.getBeanNamesForType(AbstractJdbcJobStore.class)[0]);
            });
    }

    // ── Test configurations ──────────────────────────────────────

    @Configuration
    static class DataSourceConfig {
        @Bean
        DataSource dataSource(Environment env) {
            JdbcDataSource ds = new JdbcDataSource();
            ds.setURL("jdbc:h2:mem:jobqueue_boot_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
            String schema = env.getProperty("test.schema", "schema/h2.sql");
            new ResourceDatabasePopulator(new ClassPathResource(schema)).execute(ds);
            return ds;
        }
    }

    @Configuration
    static class HandlerConfig {
        @Bean
        JsonJobHandler<GreetArgs> greetHandler() {
            return JsonJobHandler.of("greet", GreetArgs.class, (ctx, args) -> greeted.add(args.name()));
        }
    }

    @Configuration
    static class RetryConfig {
        @Bean
        RetryPolicy fixedRetry() {
            return attempt -> 500;
        }
    }

    @Configuration
    static class PeriodicConfig {
        @Bean
        PeriodicJob greetEveryHour() {
            return PeriodicJob.builder(PeriodicSchedule.every(Duration.ofHours(1)), () -> new GreetArgs("hourly"))
                .build();
        }
    }

    @Configuration
    static class CustomStoreConfig {
        @Bean
        AbstractJdbcJobStore myCustomStore() {
            return new H2JobStore();
        }
    }
}
