package io.jobqueue;

import io.jobqueue.dispatch.ExponentialBackoffRetryPolicy;
import io.jobqueue.dispatch.JobDispatcher;
import io.jobqueue.dispatch.JobInterceptor;
import io.jobqueue.dispatch.RetryPolicy;
import io.jobqueue.event.JobEventBus;
import io.jobqueue.event.JobEventKind;
import io.jobqueue.event.Subscription;
import io.jobqueue.maintenance.DiscardedJobs;
import io.jobqueue.maintenance.JobRescuer;
import io.jobqueue.model.JobInsert;
import io.jobqueue.model.JobRow;
import io.jobqueue.periodic.PeriodicJob;
import io.jobqueue.periodic.PeriodicJobScheduler;
import io.jobqueue.periodic.PeriodicJobs;
import io.jobqueue.registry.WorkerRegistry;
import io.jobqueue.spi.ConnectionProvider;
import io.jobqueue.spi.JobStore;
import io.jobqueue.spi.MetricsExporter;
import io.jobqueue.spi.TxContext;
import io.jobqueue.util.JsonCodec;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point of the job engine: inserts jobs, runs the dispatcher, the lease rescuer and the
 * periodic scheduler, and exposes lifecycle events.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * WorkerRegistry registry = new DefaultWorkerRegistry().register(new SortHandler());
 *
 * try (JobClient client = JobClient.builder()
 *         .connectionProvider(connProvider)
 *         .jobStore(JdbcJobStores.detect(dataSource))
 *         .txContext(txContext)
 *         .registry(registry)
 *         .queue(JobInserter.DEFAULT_QUEUE, 10)
 *         .build()) {
 *     client.start();
 *     try (Subscription completed = client.subscribe(JobEventKind.COMPLETED)) {
 *         client.insert(new SortArgs(List.of("whale", "tiger", "bear")));
 *         JobEvent event = completed.poll(10, TimeUnit.SECONDS);
 *     }
 * }
 * }</pre>
 *
 * <p>A client without queues can insert but not {@link #start()}.
 *
 * @see JobClient.Builder
 */
public final class JobClient implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(JobClient.class.getName());

    private final String id;
    private final ConnectionProvider connectionProvider;
    private final JobStore jobStore;
    private final WorkerRegistry registry;
    private final MetricsExporter metrics;
    private final JsonCodec jsonCodec;
    private final Clock clock;
    private final RetryPolicy retryPolicy;
    private final List<JobInterceptor> interceptors;
    private final Map<String, Integer> queues;
    private final Duration pollInterval;
    private final int fetchLimit;
    private final Duration jobTimeout;
    private final Duration leaseTimeout;
    private final Duration rescueInterval;
    private final Duration shutdownGracePeriod;

    private final JobEventBus eventBus;
    private final JobInserter inserter;
    private final PeriodicJobScheduler periodicScheduler;
    private final DiscardedJobs discardedJobs;

    private final AtomicReference<JobClientState> state = new AtomicReference<>(JobClientState.STOPPED);
    private volatile JobDispatcher dispatcher;
    private volatile JobRescuer rescuer;

    private JobClient(Builder builder) {
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.jobStore = Objects.requireNonNull(builder.jobStore, "jobStore");
        this.registry = Objects.requireNonNull(builder.registry, "registry");
        this.id = builder.id != null ? builder.id : "jobqueue-" + UUID.randomUUID();
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.jsonCodec = builder.jsonCodec != null ? builder.jsonCodec : JsonCodec.getDefault();
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.retryPolicy = builder.retryPolicy != null
            ? builder.retryPolicy : new ExponentialBackoffRetryPolicy(1_000, 3_600_000);
        this.interceptors = List.copyOf(builder.interceptors);
        this.queues = Collections.unmodifiableMap(new LinkedHashMap<>(builder.queues));
        this.pollInterval = builder.pollInterval;
        this.fetchLimit = builder.fetchLimit;
        this.jobTimeout = Objects.requireNonNull(builder.jobTimeout, "jobTimeout");
        this.leaseTimeout = Objects.requireNonNull(builder.leaseTimeout, "leaseTimeout");
        this.rescueInterval = Objects.requireNonNull(builder.rescueInterval, "rescueInterval");
        this.shutdownGracePeriod = Objects.requireNonNull(builder.shutdownGracePeriod, "shutdownGracePeriod");

        if (jobTimeout.isZero() || jobTimeout.isNegative()) {
            throw new IllegalArgumentException("jobTimeout must be > 0");
        }
        if (leaseTimeout.compareTo(jobTimeout) <= 0) {
            throw new IllegalArgumentException("leaseTimeout (" + leaseTimeout
                + ") must exceed jobTimeout (" + jobTimeout + ")");
        }

        this.eventBus = new JobEventBus(builder.eventBufferSize, metrics);
        this.inserter = new JobInserter(connectionProvider, builder.txContext, jobStore, registry,
            jsonCodec, metrics, clock, builder.maxAttempts, this::afterInsertCommit);
        this.periodicScheduler = new PeriodicJobScheduler(inserter::insert, clock);
        this.discardedJobs = new DiscardedJobs(connectionProvider, jobStore);
        for (PeriodicJob job : builder.periodicJobs) {
            periodicScheduler.add(job);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Identifier of this client, stamped on the rows it claims.
     */
    public String id() {
        return id;
    }

    public JobClientState state() {
        return state.get();
    }

    public WorkerRegistry registry() {
        return registry;
    }

    public RetryPolicy retryPolicy() {
        return retryPolicy;
    }

    /**
     * Verifies storage, then starts the dispatcher, the lease rescuer and the periodic
     * scheduler.
     *
     * @throws IllegalStateException if the client is not {@code STOPPED} or has no queues
     * @throws JobStoreException     if the store is unreachable; the client stays {@code STOPPED}
     */
    public void start() {
        if (!state.compareAndSet(JobClientState.STOPPED, JobClientState.STARTING)) {
            throw new IllegalStateException("Cannot start client in state " + state.get());
        }
        JobDispatcher newDispatcher = null;
        JobRescuer newRescuer = null;
        try {
            if (queues.isEmpty()) {
                throw new IllegalStateException("No queues configured; this client can only insert jobs");
            }
            verifyStorage();

            JobDispatcher.Builder dispatcherBuilder = JobDispatcher.builder()
                .connectionProvider(connectionProvider)
                .jobStore(jobStore)
                .registry(registry)
                .claimer(id)
                .retryPolicy(retryPolicy)
                .metrics(metrics)
                .eventBus(eventBus)
                .jsonCodec(jsonCodec)
                .clock(clock)
                .interceptors(interceptors)
                .pollInterval(pollInterval)
                .fetchLimit(fetchLimit)
                .jobTimeout(jobTimeout)
                .maxExecution(maxExecution(leaseTimeout))
                .shutdownGracePeriod(shutdownGracePeriod);
            queues.forEach(dispatcherBuilder::queue);
            newDispatcher = dispatcherBuilder.build();

            newRescuer = JobRescuer.builder()
                .connectionProvider(connectionProvider)
                .jobStore(jobStore)
                .metrics(metrics)
                .clock(clock)
                .leaseTimeout(leaseTimeout)
                .interval(rescueInterval)
                .onRescued(newDispatcher::wake)
                .build();

            newDispatcher.start();
            newRescuer.start();
            this.dispatcher = newDispatcher;
            this.rescuer = newRescuer;
            periodicScheduler.start();
            state.set(JobClientState.RUNNING);
            logger.log(Level.INFO, "Job client {0} started with queues {1}", new Object[]{id, queues});
        } catch (RuntimeException e) {
            this.dispatcher = null;
            this.rescuer = null;
            if (newRescuer != null) {
                newRescuer.close();
            }
            if (newDispatcher != null) {
                newDispatcher.close();
            }
            state.set(JobClientState.STOPPED);
            throw e;
        }
    }

    /**
     * Longest deadline any handler gets: nine tenths of the lease, leaving the rest for
     * recording the outcome before the rescuer may requeue the row.
     */
    static Duration maxExecution(Duration leaseTimeout) {
        return leaseTimeout.minus(leaseTimeout.dividedBy(10));
    }

    private void verifyStorage() {
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            jobStore.ping(conn);
        } catch (SQLException e) {
            throw new JobStoreException("Job storage is unreachable", e);
        }
    }

    /**
     * Stops the periodic scheduler and the rescuer, stops claiming, and waits up to the
     * shutdown grace period for in-flight jobs before cancelling them. No-op unless
     * {@code RUNNING}.
     */
    public void stop() {
        stop(false);
    }

    /**
     * Like {@link #stop()} but cancels in-flight jobs immediately.
     */
    public void stopAndCancel() {
        stop(true);
    }

    private void stop(boolean cancel) {
        if (!state.compareAndSet(JobClientState.RUNNING, JobClientState.STOPPING)) {
            return;
        }
        RuntimeException first = null;
        try {
            periodicScheduler.stop();
        } catch (RuntimeException e) {
            first = e;
        }
        JobRescuer currentRescuer = rescuer;
        if (currentRescuer != null) {
            try {
                currentRescuer.close();
            } catch (RuntimeException e) {
                if (first == null) first = e; else first.addSuppressed(e);
            }
        }
        JobDispatcher currentDispatcher = dispatcher;
        if (currentDispatcher != null) {
            try {
                if (cancel) {
                    currentDispatcher.cancelInFlight("client stopped with cancellation");
                }
                currentDispatcher.close();
            } catch (RuntimeException e) {
                if (first == null) first = e; else first.addSuppressed(e);
            }
        }
        dispatcher = null;
        rescuer = null;
        state.set(JobClientState.STOPPED);
        logger.log(Level.INFO, "Job client {0} stopped", id);
        if (first != null) {
            throw first;
        }
    }

    /**
     * Stops the client, removes periodic jobs, closes all subscriptions, and closes the
     * metrics exporter if it is {@link AutoCloseable}.
     */
    @Override
    public void close() {
        RuntimeException first = null;
        try {
            stop();
        } catch (RuntimeException e) {
            first = e;
        }
        periodicScheduler.close();
        eventBus.closeAll();
        if (metrics instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (Exception e) {
                RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
                if (first == null) first = re; else first.addSuppressed(re);
            }
        }
        if (first != null) {
            throw first;
        }
    }

    /**
     * Inserts a job with default options in its own transaction.
     *
     * @return the job id
     * @throws JobValidationException if the job is invalid (for example an unregistered kind)
     * @throws JobStoreException      if the store fails
     */
    public String insert(JobArgs args) {
        return inserter.insert(args, null);
    }

    public String insert(JobArgs args, InsertOpts opts) {
        return inserter.insert(args, opts);
    }

    /**
     * Inserts all jobs atomically in one transaction.
     */
    public List<String> insertMany(List<InsertParams> params) {
        return inserter.insertMany(params);
    }

    /**
     * Inserts a job in the transaction active on the configured {@link TxContext}. The job is
     * visible to workers only once that transaction commits, and vanishes if it rolls back.
     *
     * @throws IllegalStateException if no transaction is active
     */
    public String insertTx(JobArgs args) {
        return inserter.insertTx(args, null);
    }

    public String insertTx(JobArgs args, InsertOpts opts) {
        return inserter.insertTx(args, opts);
    }

    public List<String> insertManyTx(List<InsertParams> params) {
        return inserter.insertManyTx(params);
    }

    /**
     * Inserts a job using a caller-managed connection; the caller commits or rolls back.
     */
    public String insertTx(Connection conn, JobArgs args, InsertOpts opts) {
        return inserter.insertManyTx(conn, List.of(new InsertParams(args, opts))).get(0);
    }

    public List<String> insertManyTx(Connection conn, List<InsertParams> params) {
        return inserter.insertManyTx(conn, params);
    }

    /**
     * Subscribes to lifecycle events of jobs run by this client.
     *
     * @see JobEventBus
     */
    public Subscription subscribe(JobEventKind... kinds) {
        return eventBus.subscribe(kinds);
    }

    public Subscription subscribe(Set<JobEventKind> kinds) {
        return eventBus.subscribe(kinds);
    }

    /**
     * Adds, removes and clears periodic jobs, including while running.
     */
    public PeriodicJobs periodicJobs() {
        return periodicScheduler;
    }

    public DiscardedJobs discardedJobs() {
        return discardedJobs;
    }

    public Optional<JobRow> getJob(String jobId) {
        Objects.requireNonNull(jobId, "jobId");
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            return jobStore.findById(conn, jobId);
        } catch (SQLException e) {
            throw new JobStoreException("Failed to load job " + jobId, e);
        }
    }

    /**
     * Lists available jobs of a queue that are ready to run, in claim order.
     */
    public List<JobRow> listReady(String queue, int limit) {
        Objects.requireNonNull(queue, "queue");
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            return jobStore.listReady(conn, queue, clock.instant(), limit);
        } catch (SQLException e) {
            throw new JobStoreException("Failed to list ready jobs of queue " + queue, e);
        }
    }

    private void afterInsertCommit(List<JobInsert> jobs) {
        JobDispatcher current = dispatcher;
        if (current == null) {
            return;
        }
        Instant now = clock.instant();
        for (JobInsert job : jobs) {
            if (queues.containsKey(job.queue()) && !job.scheduledAt().isAfter(now)) {
                current.wake();
                return;
            }
        }
    }

    /** Builder for {@link JobClient}. */
    public static final class Builder {
        private String id;
        private ConnectionProvider connectionProvider;
        private JobStore jobStore;
        private WorkerRegistry registry;
        private TxContext txContext;
        private MetricsExporter metrics;
        private JsonCodec jsonCodec;
        private Clock clock;
        private RetryPolicy retryPolicy;
        private final List<JobInterceptor> interceptors = new ArrayList<>();
        private final Map<String, Integer> queues = new LinkedHashMap<>();
        private final List<PeriodicJob> periodicJobs = new ArrayList<>();
        private Duration pollInterval = Duration.ofSeconds(1);
        private int fetchLimit = 100;
        private Duration jobTimeout = Duration.ofMinutes(1);
        private Duration leaseTimeout = Duration.ofHours(1);
        private Duration rescueInterval = Duration.ofSeconds(30);
        private Duration shutdownGracePeriod = Duration.ofSeconds(10);
        private int maxAttempts = JobInserter.DEFAULT_MAX_ATTEMPTS;
        private int eventBufferSize = JobEventBus.DEFAULT_BUFFER_SIZE;

        private Builder() {}

        /**
         * Client identifier recorded as the claimer of running jobs. Defaults to a random id.
         */
        public Builder id(String id) {
            this.id = id;
            return this;
        }

        /**
         * <b>Required.</b>
         */
        public Builder connectionProvider(ConnectionProvider connectionProvider) {
            this.connectionProvider = connectionProvider;
            return this;
        }

        /**
         * <b>Required.</b>
         */
        public Builder jobStore(JobStore jobStore) {
            this.jobStore = jobStore;
            return this;
        }

        /**
         * <b>Required.</b>
         */
        public Builder registry(WorkerRegistry registry) {
            this.registry = registry;
            return this;
        }

        /**
         * Needed for {@code insertTx} without an explicit connection.
         */
        public Builder txContext(TxContext txContext) {
            this.txContext = txContext;
            return this;
        }

        /**
         * Serves a queue with at most {@code maxWorkers} concurrent jobs.
         */
        public Builder queue(String name, int maxWorkers) {
            Objects.requireNonNull(name, "name");
            if (maxWorkers <= 0) {
                throw new IllegalArgumentException("maxWorkers must be > 0 for queue " + name);
            }
            queues.put(name, maxWorkers);
            return this;
        }

        public Builder queues(Map<String, Integer> queues) {
            queues.forEach(this::queue);
            return this;
        }

        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder jsonCodec(JsonCodec jsonCodec) {
            this.jsonCodec = jsonCodec;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder interceptor(JobInterceptor interceptor) {
            interceptors.add(Objects.requireNonNull(interceptor, "interceptor"));
            return this;
        }

        /**
         * Registers a periodic job up front; more can be added at runtime through
         * {@link JobClient#periodicJobs()}.
         */
        public Builder periodicJob(PeriodicJob job) {
            periodicJobs.add(Objects.requireNonNull(job, "job"));
            return this;
        }

        public Builder pollInterval(Duration pollInterval) {
            this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
            return this;
        }

        public Builder fetchLimit(int fetchLimit) {
            this.fetchLimit = fetchLimit;
            return this;
        }

        /**
         * Default execution deadline; must be positive and shorter than the lease. Defaults
         * to 1 minute.
         */
        public Builder jobTimeout(Duration jobTimeout) {
            this.jobTimeout = jobTimeout;
            return this;
        }

        /**
         * How long a claim stays valid before the rescuer may requeue the row. Must exceed
         * the job timeout. Defaults to 1 hour.
         */
        public Builder leaseTimeout(Duration leaseTimeout) {
            this.leaseTimeout = leaseTimeout;
            return this;
        }

        public Builder rescueInterval(Duration rescueInterval) {
            this.rescueInterval = rescueInterval;
            return this;
        }

        public Builder shutdownGracePeriod(Duration shutdownGracePeriod) {
            this.shutdownGracePeriod = shutdownGracePeriod;
            return this;
        }

        /**
         * Default {@code maxAttempts} for inserted jobs. Defaults to 10.
         */
        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        /**
         * Per-subscriber event buffer. Defaults to 1000.
         */
        public Builder eventBufferSize(int eventBufferSize) {
            this.eventBufferSize = eventBufferSize;
            return this;
        }

        public JobClient build() {
            return new JobClient(this);
        }
    }
}
