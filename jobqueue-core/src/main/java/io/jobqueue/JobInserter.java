package io.jobqueue;

import io.jobqueue.model.JobInsert;
import io.jobqueue.registry.WorkerRegistry;
import io.jobqueue.spi.ConnectionProvider;
import io.jobqueue.spi.JobStore;
import io.jobqueue.spi.MetricsExporter;
import io.jobqueue.spi.TxContext;
import io.jobqueue.util.JobIds;
import io.jobqueue.util.JsonCodec;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Validates and writes job rows.
 *
 * <p>Every job is validated before any row is written: its kind must be registered, its
 * arguments must serialize, and its options must be in range. Standalone inserts run in
 * their own transaction; {@code insertTx} variants join the caller's transaction, so the rows
 * become visible only if it commits. The {@link InsertHook} runs after commit in both cases.
 *
 * @see JobClient
 */
public final class JobInserter {
    private static final Logger logger = Logger.getLogger(JobInserter.class.getName());

    public static final String DEFAULT_QUEUE = "default";
    public static final int DEFAULT_PRIORITY = 1;
    public static final int MIN_PRIORITY = 1;
    public static final int MAX_PRIORITY = 4;
    public static final int DEFAULT_MAX_ATTEMPTS = 10;

    private static final Pattern QUEUE_NAME = Pattern.compile("[a-zA-Z0-9_.-]{1,128}");

    private final ConnectionProvider connectionProvider;
    private final TxContext txContext;
    private final JobStore jobStore;
    private final WorkerRegistry registry;
    private final JsonCodec jsonCodec;
    private final MetricsExporter metrics;
    private final Clock clock;
    private final int defaultMaxAttempts;
    private final InsertHook hook;

    /**
     * @param txContext may be {@code null} when only standalone inserts are used
     * @param hook      may be {@code null}
     */
    public JobInserter(
            ConnectionProvider connectionProvider,
            TxContext txContext,
            JobStore jobStore,
            WorkerRegistry registry,
            JsonCodec jsonCodec,
            MetricsExporter metrics,
            Clock clock,
            int defaultMaxAttempts,
            InsertHook hook
    ) {
        this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
        this.txContext = txContext;
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (defaultMaxAttempts < 1) {
            throw new IllegalArgumentException("defaultMaxAttempts must be >= 1");
        }
        this.defaultMaxAttempts = defaultMaxAttempts;
        this.hook = hook == null ? InsertHook.NOOP : hook;
    }

    /**
     * Inserts one job in its own transaction.
     *
     * @return the job id
     * @throws JobValidationException if the job is invalid; nothing is written
     * @throws JobStoreException      if the store fails
     */
    public String insert(JobArgs args, InsertOpts opts) {
        return insertMany(List.of(new InsertParams(args, opts))).get(0);
    }

    /**
     * Inserts all jobs in one transaction: either all rows are written or none.
     */
    public List<String> insertMany(List<InsertParams> params) {
        List<JobInsert> rows = prepareAll(params);
        if (rows.isEmpty()) {
            return List.of();
        }
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(false);
            try {
                jobStore.insertBatch(conn, rows);
                conn.commit();
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new JobStoreException("Failed to insert " + rows.size() + " job(s)", e);
        }
        committed(rows);
        return ids(rows);
    }

    /**
     * Inserts one job in the transaction active on the {@link TxContext}.
     *
     * @throws IllegalStateException if no transaction is active
     */
    public String insertTx(JobArgs args, InsertOpts opts) {
        return insertManyTx(List.of(new InsertParams(args, opts))).get(0);
    }

    public List<String> insertManyTx(List<InsertParams> params) {
        if (txContext == null || !txContext.isTransactionActive()) {
            throw new IllegalStateException("No active transaction");
        }
        List<JobInsert> rows = prepareAll(params);
        if (rows.isEmpty()) {
            return List.of();
        }
        jobStore.insertBatch(txContext.currentConnection(), rows);
        txContext.afterCommit(() -> committed(rows));
        return ids(rows);
    }

    /**
     * Inserts into a caller-managed connection. The caller commits; the insert hook does
     * not run, so the dispatcher sees the rows on its next poll.
     */
    public List<String> insertManyTx(Connection conn, List<InsertParams> params) {
        Objects.requireNonNull(conn, "conn");
        List<JobInsert> rows = prepareAll(params);
        if (rows.isEmpty()) {
            return List.of();
        }
        jobStore.insertBatch(conn, rows);
        metrics.incrementJobsInserted(rows.size());
        return ids(rows);
    }

    /**
     * Validates and resolves defaults for one job.
     *
     * @throws JobValidationException if the job is invalid
     */
    public JobInsert prepare(JobArgs args, InsertOpts opts, Instant now) {
        Objects.requireNonNull(args, "args");
        String kind = args.kind();
        if (kind == null || kind.isBlank()) {
            throw new JobValidationException("Job kind must not be blank: " + args.getClass().getName());
        }
        registry.resolve(kind);

        InsertOpts resolved = InsertOpts.DEFAULT.overriddenBy(args.insertOpts()).overriddenBy(opts);
        String queue = resolved.queue() != null ? resolved.queue() : DEFAULT_QUEUE;
        int priority = resolved.priority() != null ? resolved.priority() : DEFAULT_PRIORITY;
        int maxAttempts = resolved.maxAttempts() != null ? resolved.maxAttempts() : defaultMaxAttempts;
        Instant scheduledAt = resolved.resolveScheduledAt(now);

        if (!QUEUE_NAME.matcher(queue).matches()) {
            throw new JobValidationException("Invalid queue name: '" + queue + "'");
        }
        if (priority < MIN_PRIORITY || priority > MAX_PRIORITY) {
            throw new JobValidationException("priority must be between " + MIN_PRIORITY + " and "
                + MAX_PRIORITY + ", got: " + priority);
        }
        if (maxAttempts < 1) {
            throw new JobValidationException("maxAttempts must be >= 1, got: " + maxAttempts);
        }

        String argsJson;
        try {
            argsJson = jsonCodec.toJson(args);
        } catch (IllegalArgumentException e) {
            throw new JobValidationException("Cannot serialize arguments of kind " + kind, e);
        }
        return new JobInsert(JobIds.next(), kind, argsJson, queue, priority, scheduledAt, maxAttempts, now);
    }

    private List<JobInsert> prepareAll(List<InsertParams> params) {
        Objects.requireNonNull(params, "params");
        Instant now = clock.instant();
        List<JobInsert> rows = new ArrayList<>(params.size());
        for (InsertParams p : params) {
            rows.add(prepare(p.args(), p.opts(), now));
        }
        return List.copyOf(rows);
    }

    private void committed(List<JobInsert> rows) {
        metrics.incrementJobsInserted(rows.size());
        try {
            hook.afterCommit(rows);
        } catch (RuntimeException ex) {
            logger.log(Level.WARNING, "InsertHook.afterCommit failed", ex);
        }
    }

    private static List<String> ids(List<JobInsert> rows) {
        List<String> ids = new ArrayList<>(rows.size());
        for (JobInsert row : rows) {
            ids.add(row.id());
        }
        return ids;
    }
}
