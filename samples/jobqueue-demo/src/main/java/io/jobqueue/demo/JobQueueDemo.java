package io.jobqueue.demo;

import io.jobqueue.InsertOpts;
import io.jobqueue.JobArgs;
import io.jobqueue.JobClient;
import io.jobqueue.JsonJobHandler;
import io.jobqueue.dispatch.JobInterceptor;
import io.jobqueue.event.JobEvent;
import io.jobqueue.event.JobEventKind;
import io.jobqueue.event.Subscription;
import io.jobqueue.jdbc.DataSourceConnectionProvider;
import io.jobqueue.jdbc.store.JdbcJobStores;
import io.jobqueue.jdbc.tx.JdbcTransactionManager;
import io.jobqueue.jdbc.tx.ThreadLocalTxContext;
import io.jobqueue.model.JobRow;
import io.jobqueue.periodic.PeriodicJob;
import io.jobqueue.periodic.PeriodicSchedule;
import io.jobqueue.registry.DefaultWorkerRegistry;
import org.h2.jdbcx.JdbcDataSource;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.LogManager;

/**
 * Demo of the job queue without Spring: two sort jobs inserted inside a transaction and a
 * periodic heartbeat job, both running against H2.
 * <p>
 * Run with: mvn -pl samples/jobqueue-demo exec:java
 */
public final class JobQueueDemo {

    record SortArgs(List<String> strings) implements JobArgs {
        @Override
        public String kind() {
            return "sort";
        }
    }

    record HeartbeatArgs(int beat) implements JobArgs {
        @Override
        public String kind() {
            return "heartbeat";
        }
    }

    public static void main(String[] args) throws Exception {
        configureLogging();

        // 1. Setup H2 in-memory database
        JdbcDataSource dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:jobqueue_demo;DB_CLOSE_DELAY=-1");
        createSchema(dataSource);

        // 2. Core components
        var jobStore = JdbcJobStores.detect(dataSource);
        var connectionProvider = new DataSourceConnectionProvider(dataSource);
        var txContext = new ThreadLocalTxContext();
        AtomicInteger beats = new AtomicInteger();

        DefaultWorkerRegistry registry = new DefaultWorkerRegistry()
                .register(JsonJobHandler.of("sort", SortArgs.class, (ctx, sortArgs) -> {
                    List<String> sorted = new ArrayList<>(sortArgs.strings());
                    Collections.sort(sorted);
                    System.out.println("[Worker] Sorted: " + sorted);
                    ctx.recordOutput(sorted);
                }))
                .register(JsonJobHandler.of("heartbeat", HeartbeatArgs.class, (ctx, heartbeat) ->
                        System.out.println("[Worker] Heartbeat #" + heartbeat.beat())));

        // 3. Build and start the client
        try (JobClient client = JobClient.builder()
                .id("demo-client")
                .connectionProvider(connectionProvider)
                .txContext(txContext)
                .jobStore(jobStore)
                .registry(registry)
                .queue("default", 4)
                .pollInterval(Duration.ofMillis(200))
                .interceptor(JobInterceptor.before(ctx ->
                        System.out.println("[Audit] Running " + ctx.job().kind()
                                + " id=" + ctx.job().id() + " attempt=" + ctx.job().attempt())))
                .periodicJob(PeriodicJob.builder(
                                PeriodicSchedule.every(Duration.ofSeconds(1)),
                                () -> new HeartbeatArgs(beats.incrementAndGet()))
                        .runOnStart(true)
                        .build())
                .build();
             Subscription completed = client.subscribe(JobEventKind.COMPLETED)) {

            client.start();
            System.out.println("=== Job Queue Demo ===\n");

            // 4. Insert jobs in the same transaction as business writes
            JdbcTransactionManager txManager = new JdbcTransactionManager(connectionProvider, txContext);
            List<String> sortIds = new ArrayList<>();
            try (JdbcTransactionManager.Transaction tx = txManager.begin()) {
                sortIds.add(client.insertTx(new SortArgs(List.of("whale", "tiger", "bear")),
                        InsertOpts.builder().priority(1).build()));
                sortIds.add(client.insertTx(new SortArgs(
                        List.of("horse", "whale", "dog", "cat", "mouse", "goat"))));
                tx.commit();
            }
            System.out.println("Inserted sort jobs " + sortIds + "\n");

            // 5. Wait for both sort jobs and a few heartbeats
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            int sortsDone = 0;
            while ((sortsDone < sortIds.size() || beats.get() < 3) && System.nanoTime() < deadline) {
                JobEvent event = completed.poll(200, TimeUnit.MILLISECONDS);
                if (event != null && sortIds.contains(event.job().id())) {
                    sortsDone++;
                }
            }

            // 6. Show final state
            System.out.println("\n=== Sort Jobs ===");
            System.out.printf("%-26s | %-10s | %-7s | %s%n", "ID", "STATE", "ATTEMPT", "OUTPUT");
            System.out.println("-".repeat(80));
            for (String id : sortIds) {
                JobRow row = client.getJob(id).orElseThrow();
                System.out.printf("%-26s | %-10s | %-7d | %s%n",
                        row.id(), row.state(), row.attempt(), row.outputJson());
            }
            System.out.println("\nHeartbeats scheduled: " + beats.get());
        }

        System.out.println("\nDemo complete.");
    }

    private static void configureLogging() throws IOException {
        try (InputStream is = JobQueueDemo.class.getResourceAsStream("/logging.properties")) {
            if (is != null) {
                LogManager.getLogManager().readConfiguration(is);
            }
        }
    }

    private static void createSchema(JdbcDataSource dataSource) throws SQLException, IOException {
        String ddl;
        try (InputStream is = JobQueueDemo.class.getResourceAsStream("/schema/h2.sql")) {
            if (is == null) throw new IllegalStateException("Schema resource /schema/h2.sql not found");
            ddl = new String(is.readAllBytes(), StandardCharsets.UTF_8);
        }
        try (Connection conn = dataSource.getConnection();
             var stmt = conn.createStatement()) {
            for (String sql : ddl.split(";")) {
                String trimmed = sql.trim();
                if (!trimmed.isEmpty()) {
                    stmt.execute(trimmed);
                }
            }
        }
    }
}
