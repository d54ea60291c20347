package io.jobqueue.dispatch;

import io.jobqueue.CancellationToken;
import io.jobqueue.JobConflictException;
import io.jobqueue.JobContext;
import io.jobqueue.JobDecodeException;
import io.jobqueue.JobDiscardException;
import io.jobqueue.JobHandler;
import io.jobqueue.JobSnoozeException;
import io.jobqueue.JobStoreException;
import io.jobqueue.event.JobEvent;
import io.jobqueue.event.JobEventBus;
import io.jobqueue.event.JobEventKind;
import io.jobqueue.model.JobRow;
import io.jobqueue.registry.WorkerRegistry;
import io.jobqueue.spi.ConnectionProvider;
import io.jobqueue.spi.JobStore;
import io.jobqueue.spi.MetricsExporter;
import io.jobqueue.util.DaemonThreadFactory;
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
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Claims ready jobs and executes them against the {@link WorkerRegistry}.
 *
 * <p>A single poller thread claims, for every configured queue, as many rows as that
 * queue has free worker slots. A queue whose slots are all busy is not polled until one
 * frees up; rows simply wait in the store. The poller sleeps for the poll interval between
 * rounds and is woken early by {@link #wake()} (new inserts, released slots, rescues).
 *
 * <p>Each attempt runs on the queue's worker pool with a deadline. When the deadline passes
 * the job's {@link CancellationToken} is cancelled and its thread interrupted; the attempt
 * then counts as failed. The outcome is written back to the store and published on the
 * {@link JobEventBus}: success completes the job, failures are retried with the
 * {@link RetryPolicy} until {@code maxAttempts} and then discarded, undecodable payloads are
 * discarded at once.
 *
 * <p>Create instances via {@link #builder()}; call {@link #start()} to begin polling.
 * {@link #close()} stops polling and waits for in-flight jobs up to the shutdown grace period.
 */
public final class JobDispatcher implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(JobDispatcher.class.getName());

    private static final long MAX_CLAIM_BACKOFF_MS = 30_000;
    private static final int RECORD_TRIES = 3;
    private static final long RECORD_RETRY_DELAY_MS = 50;

    private final ConnectionProvider connectionProvider;
    private final JobStore jobStore;
    private final WorkerRegistry registry;
    private final RetryPolicy retryPolicy;
    private final MetricsExporter metrics;
    private final JobEventBus eventBus;
    private final JsonCodec jsonCodec;
    private final List<JobInterceptor> interceptors;
    private final Clock clock;
    private final String claimer;
    private final long pollIntervalMs;
    private final int fetchLimit;
    private final Duration defaultTimeout;
    private final Duration maxExecution;
    private final long shutdownGracePeriodMs;

    private final Map<String, QueueWorkers> queues;
    private final ExecutorService poller;
    private final ScheduledExecutorService deadlines;
    private final Set<Execution> executions = ConcurrentHashMap.newKeySet();

    private final ReentrantLock wakeLock = new ReentrantLock();
    private final Condition wakeSignal = wakeLock.newCondition();
    private boolean wakeRequested;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private boolean started;
    private boolean closed;

    private JobDispatcher(Builder builder) {
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.jobStore = Objects.requireNonNull(builder.jobStore, "jobStore");
        this.registry = Objects.requireNonNull(builder.registry, "registry");
        this.claimer = Objects.requireNonNull(builder.claimer, "claimer");
        this.retryPolicy = builder.retryPolicy != null
            ? builder.retryPolicy : new ExponentialBackoffRetryPolicy(1_000, 3_600_000);
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.eventBus = builder.eventBus != null ? builder.eventBus : new JobEventBus(JobEventBus.DEFAULT_BUFFER_SIZE, metrics);
        this.jsonCodec = builder.jsonCodec != null ? builder.jsonCodec : JsonCodec.getDefault();
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.interceptors = Collections.unmodifiableList(new ArrayList<>(builder.interceptors));
        this.defaultTimeout = Objects.requireNonNull(builder.jobTimeout, "jobTimeout");
        this.maxExecution = builder.maxExecution;
        if (maxExecution != null && (maxExecution.isZero() || maxExecution.isNegative())) {
            throw new IllegalArgumentException("maxExecution must be > 0");
        }

        if (builder.queues.isEmpty()) {
            throw new IllegalArgumentException("At least one queue must be configured");
        }
        if (builder.pollInterval.isNegative() || builder.pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be > 0");
        }
        if (builder.fetchLimit <= 0) {
            throw new IllegalArgumentException("fetchLimit must be > 0");
        }
        if (builder.shutdownGracePeriod.isNegative()) {
            throw new IllegalArgumentException("shutdownGracePeriod must be >= 0");
        }
        this.pollIntervalMs = builder.pollInterval.toMillis();
        this.fetchLimit = builder.fetchLimit;
        this.shutdownGracePeriodMs = builder.shutdownGracePeriod.toMillis();

        Map<String, QueueWorkers> map = new LinkedHashMap<>();
        builder.queues.forEach((name, maxWorkers) -> map.put(name, new QueueWorkers(name, maxWorkers)));
        this.queues = Collections.unmodifiableMap(map);
        this.poller = Executors.newSingleThreadExecutor(new DaemonThreadFactory("jobqueue-poller-"));
        this.deadlines = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("jobqueue-deadline-"));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts the poller thread.
     *
     * @throws IllegalStateException if already started or closed
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("Dispatcher is closed");
        }
        if (started) {
            throw new IllegalStateException("Dispatcher already started");
        }
        started = true;
        running.set(true);
        poller.submit(this::pollLoop);
    }

    /**
     * Ends the poller's current sleep so it claims right away.
     */
    public void wake() {
        wakeLock.lock();
        try {
            wakeRequested = true;
            wakeSignal.signalAll();
        } finally {
            wakeLock.unlock();
        }
    }

    public String claimer() {
        return claimer;
    }

    public Set<String> queueNames() {
        return queues.keySet();
    }

    /**
     * Number of jobs of a queue currently executing.
     */
    public int inFlight(String queue) {
        QueueWorkers q = queues.get(queue);
        return q == null ? 0 : q.inFlight.get();
    }

    public int totalInFlight() {
        int total = 0;
        for (QueueWorkers q : queues.values()) {
            total += q.inFlight.get();
        }
        return total;
    }

    /**
     * Cancels every executing job's token and interrupts its thread. Handlers that honor
     * cancellation fail their attempt, which is then retried per policy.
     */
    public void cancelInFlight(String reason) {
        for (Execution execution : executions) {
            execution.cancel(reason);
        }
    }

    private void pollLoop() {
        int consecutiveFailures = 0;
        while (running.get()) {
            boolean failed = false;
            boolean moreReady = false;
            for (QueueWorkers q : queues.values()) {
                if (!running.get()) {
                    break;
                }
                int slack = q.slack();
                if (slack <= 0) {
                    continue;
                }
                int limit = Math.min(slack, fetchLimit);
                try {
                    List<JobRow> claimed = claim(q.name, limit);
                    for (JobRow job : claimed) {
                        q.submit(job);
                    }
                    if (claimed.size() == limit && q.slack() > 0) {
                        moreReady = true;
                    }
                } catch (SQLException | RuntimeException e) {
                    failed = true;
                    logger.log(Level.SEVERE, "Failed to claim jobs for queue " + q.name, e);
                }
            }
            if (failed) {
                consecutiveFailures++;
                sleepUninterruptedByWake(claimBackoffMs(consecutiveFailures));
            } else {
                consecutiveFailures = 0;
                if (!moreReady) {
                    awaitWake(pollIntervalMs);
                }
            }
        }
    }

    private List<JobRow> claim(String queue, int limit) throws SQLException {
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(false);
            try {
                List<JobRow> claimed = jobStore.claim(conn, queue, claimer, clock.instant(), limit);
                conn.commit();
                return claimed;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        }
    }

    private long claimBackoffMs(int failures) {
        long shift = 1L << Math.min(failures, 20);
        return Math.min(MAX_CLAIM_BACKOFF_MS, pollIntervalMs * shift);
    }

    private void awaitWake(long timeoutMs) {
        wakeLock.lock();
        try {
            long remaining = TimeUnit.MILLISECONDS.toNanos(timeoutMs);
            while (!wakeRequested && running.get() && remaining > 0) {
                remaining = wakeSignal.awaitNanos(remaining);
            }
            wakeRequested = false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            running.set(false);
        } finally {
            wakeLock.unlock();
        }
    }

    private void sleepUninterruptedByWake(long timeoutMs) {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        wakeLock.lock();
        try {
            long remaining;
            while (running.get() && (remaining = deadline - System.nanoTime()) > 0) {
                wakeSignal.awaitNanos(remaining);
            }
            wakeRequested = false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            running.set(false);
        } finally {
            wakeLock.unlock();
        }
    }

    private void runSlot(QueueWorkers q, JobRow job) {
        try {
            process(job);
        } catch (Throwable t) {
            logger.log(Level.SEVERE, "Unexpected failure processing job " + job.id(), t);
        } finally {
            int inFlight = q.inFlight.decrementAndGet();
            metrics.recordInFlight(q.name, inFlight);
            wake();
        }
    }

    private void process(JobRow job) {
        CancellationToken token = new CancellationToken();
        Duration timeout = timeoutFor(job);
        boolean hasDeadline = !timeout.isZero() && !timeout.isNegative();
        Instant deadline = hasDeadline ? clock.instant().plus(timeout) : null;
        JobContext context = new JobContext(job, token, deadline);

        Callable<Void> task;
        try {
            task = bind(registry.resolve(job.kind()), context, job.argsJson());
        } catch (JobDecodeException | RuntimeException e) {
            String error = "Cannot decode arguments of kind " + job.kind() + ": " + e.getMessage();
            logger.log(Level.WARNING, "Discarding job " + job.id() + ": " + error);
            discard(job, error);
            return;
        }

        Execution execution = new Execution(token, Thread.currentThread());
        executions.add(execution);
        ScheduledFuture<?> timer = null;
        Throwable failure;
        boolean timedOut;
        long startNanos = System.nanoTime();
        try {
            if (hasDeadline) {
                String reason = "job timed out after " + timeout.toMillis() + " ms";
                timer = deadlines.schedule(() -> execution.timeOut(reason), timeout.toMillis(), TimeUnit.MILLISECONDS);
            }
            failure = invoke(context, task);
        } finally {
            if (timer != null) {
                timer.cancel(false);
            }
            timedOut = !execution.finish();
            executions.remove(execution);
            // drop any interrupt aimed at the handler before touching the store
            Thread.interrupted();
        }
        metrics.recordJobDurationMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));

        if (timedOut) {
            recordFailure(job, "job timed out after " + timeout.toMillis() + " ms", failure);
        } else if (failure == null) {
            complete(job, context);
        } else if (failure instanceof JobSnoozeException snoozed) {
            snooze(job, snoozed.delay());
        } else if (failure instanceof JobDiscardException) {
            logger.log(Level.WARNING, "Job " + job.id() + " discarded by its handler: " + failure.getMessage());
            discard(job, describe(failure));
        } else {
            recordFailure(job, describe(failure), failure);
        }
    }

    private Duration timeoutFor(JobRow job) {
        Duration timeout = defaultTimeout;
        if (registry.isRegistered(job.kind())) {
            Duration handlerTimeout = registry.resolve(job.kind()).timeout();
            if (handlerTimeout != null) {
                timeout = handlerTimeout;
            }
        }
        if (maxExecution != null
                && (timeout.isZero() || timeout.isNegative() || timeout.compareTo(maxExecution) > 0)) {
            return maxExecution;
        }
        return timeout;
    }

    private static <A> Callable<Void> bind(JobHandler<A> handler, JobContext context, String payload)
            throws JobDecodeException {
        A args = handler.decode(payload);
        return () -> {
            handler.execute(context, args);
            return null;
        };
    }

    private Throwable invoke(JobContext context, Callable<Void> task) {
        int completedBefore = 0;
        Throwable error = null;
        try {
            for (int i = 0; i < interceptors.size(); i++) {
                interceptors.get(i).beforeExecute(context);
                completedBefore = i + 1;
            }
            task.call();
        } catch (Throwable t) {
            if (t instanceof VirtualMachineError) {
                logger.log(Level.SEVERE, "Fatal error in handler for job " + context.job().id(), t);
            }
            error = t;
        }
        for (int i = completedBefore - 1; i >= 0; i--) {
            try {
                interceptors.get(i).afterExecute(context, error);
            } catch (Exception ex) {
                logger.log(Level.WARNING, "Interceptor afterExecute failed", ex);
            }
        }
        return error;
    }

    private void complete(JobRow job, JobContext context) {
        String encoded;
        try {
            encoded = context.output() == null ? null : jsonCodec.toJson(context.output());
        } catch (IllegalArgumentException e) {
            recordFailure(job, "Cannot serialize job output: " + e.getMessage(), e);
            return;
        }
        String output = encoded;
        Instant now = clock.instant();
        if (record("complete", job, conn -> jobStore.complete(conn, job.id(), claimer, job.attempt(), now, output))) {
            metrics.incrementJobsCompleted();
            publish(JobEventKind.COMPLETED, job.withCompleted(now, output), null, now);
        }
    }

    private void snooze(JobRow job, Duration delay) {
        Instant now = clock.instant();
        Instant nextAt = now.plus(delay);
        if (record("snooze", job, conn -> jobStore.snooze(conn, job.id(), claimer, job.attempt(), nextAt))) {
            metrics.incrementJobsSnoozed();
            publish(JobEventKind.SNOOZED, job.withSnooze(nextAt), null, now);
        }
    }

    private void recordFailure(JobRow job, String error, Throwable cause) {
        if (!job.hasAttemptsLeft()) {
            logger.log(Level.WARNING, "Job " + job.id() + " (" + job.kind() + ") discarded after "
                + job.attempt() + " attempt(s): " + error, cause);
            discard(job, error);
            return;
        }
        Instant now = clock.instant();
        Instant nextAt = now.plusMillis(retryPolicy.computeDelayMs(job.attempt()));
        logger.log(Level.FINE, "Job {0} attempt {1} failed; retrying at {2}: {3}",
            new Object[]{job.id(), job.attempt(), nextAt, error});
        if (record("retry", job, conn -> jobStore.retry(conn, job.id(), claimer, job.attempt(), nextAt, error))) {
            metrics.incrementJobsFailed();
            publish(JobEventKind.FAILED, job.withRetry(nextAt, error), error, now);
        }
    }

    private void discard(JobRow job, String error) {
        Instant now = clock.instant();
        if (record("discard", job, conn -> jobStore.discard(conn, job.id(), claimer, job.attempt(), now, error))) {
            metrics.incrementJobsDiscarded();
            publish(JobEventKind.DISCARDED, job.withDiscarded(now, error), error, now);
        }
    }

    private void publish(JobEventKind kind, JobRow snapshot, String error, Instant now) {
        try {
            eventBus.publish(new JobEvent(kind, snapshot, error, now));
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Failed to publish " + kind + " event for job " + snapshot.id(), e);
        }
    }

    /**
     * Writes a transition, retrying transient store failures. Returns {@code false} when the
     * transition was not recorded; the row then stays {@code RUNNING} until its lease is rescued.
     */
    private boolean record(String transition, JobRow job, SqlAction action) {
        for (int attempt = 1; ; attempt++) {
            try (Connection conn = connectionProvider.getConnection()) {
                conn.setAutoCommit(true);
                action.execute(conn);
                return true;
            } catch (JobConflictException e) {
                logger.log(Level.WARNING, e.getMessage() + "; leaving the row to the lease rescuer");
                return false;
            } catch (SQLException | JobStoreException e) {
                if (attempt >= RECORD_TRIES) {
                    logger.log(Level.SEVERE, "Failed to " + transition + " job " + job.id()
                        + " after " + attempt + " tries", e);
                    return false;
                }
                logger.log(Level.WARNING, "Failed to " + transition + " job " + job.id() + "; retrying", e);
                try {
                    Thread.sleep(RECORD_RETRY_DELAY_MS * attempt);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return false;
                }
            }
        }
    }

    private static String describe(Throwable failure) {
        String message = failure.getMessage();
        return message == null || message.isBlank()
            ? failure.getClass().getName()
            : failure.getClass().getSimpleName() + ": " + message;
    }

    @FunctionalInterface
    private interface SqlAction {
        void execute(Connection conn) throws SQLException;
    }

    /**
     * Stops polling, waits up to the shutdown grace period for in-flight jobs, then cancels
     * and interrupts the remaining ones.
     */
    @Override
    public void close() {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
        }
        running.set(false);
        wake();
        poller.shutdown();
        try {
            if (!poller.awaitTermination(5, TimeUnit.SECONDS)) {
                poller.shutdownNow();
            }
            for (QueueWorkers q : queues.values()) {
                q.pool.shutdown();
            }
            long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(shutdownGracePeriodMs);
            boolean drained = awaitPools(deadline);
            if (!drained) {
                logger.log(Level.WARNING, "Shutdown grace period exceeded; cancelling "
                    + totalInFlight() + " in-flight job(s)");
                cancelInFlight("client stopping");
                for (QueueWorkers q : queues.values()) {
                    q.pool.shutdownNow();
                }
                awaitPools(System.nanoTime() + TimeUnit.SECONDS.toNanos(5));
            }
        } catch (InterruptedException e) {
            for (QueueWorkers q : queues.values()) {
                q.pool.shutdownNow();
            }
            Thread.currentThread().interrupt();
        } finally {
            deadlines.shutdownNow();
        }
    }

    private boolean awaitPools(long deadlineNanos) throws InterruptedException {
        for (QueueWorkers q : queues.values()) {
            long remaining = deadlineNanos - System.nanoTime();
            if (!q.pool.awaitTermination(Math.max(0, remaining), TimeUnit.NANOSECONDS)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Fixed worker pool and in-flight counter of one queue.
     */
    private final class QueueWorkers {
        final String name;
        final int maxWorkers;
        final ExecutorService pool;
        final AtomicInteger inFlight = new AtomicInteger();

        QueueWorkers(String name, int maxWorkers) {
            this.name = name;
            this.maxWorkers = maxWorkers;
            this.pool = Executors.newFixedThreadPool(maxWorkers,
                new DaemonThreadFactory("jobqueue-worker-" + name + "-"));
        }

        int slack() {
            return maxWorkers - inFlight.get();
        }

        void submit(JobRow job) {
            metrics.recordInFlight(name, inFlight.incrementAndGet());
            try {
                pool.execute(() -> runSlot(this, job));
            } catch (RejectedExecutionException e) {
                metrics.recordInFlight(name, inFlight.decrementAndGet());
                logger.log(Level.WARNING, "Worker pool of queue " + name + " is shut down; job "
                    + job.id() + " stays RUNNING until its lease is rescued");
            }
        }
    }

    /**
     * Ties one attempt's token to its thread. The deadline timer and the worker race to
     * settle it; whichever wins decides whether the attempt timed out, and the thread is
     * only interrupted while the handler is still running.
     */
    private static final class Execution {
        private static final int RUNNING = 0;
        private static final int FINISHED = 1;
        private static final int TIMED_OUT = 2;

        private final CancellationToken token;
        private final Thread thread;
        private int state = RUNNING;

        Execution(CancellationToken token, Thread thread) {
            this.token = token;
            this.thread = thread;
        }

        synchronized void timeOut(String reason) {
            if (state == RUNNING) {
                state = TIMED_OUT;
                token.cancel(reason);
                thread.interrupt();
            }
        }

        synchronized void cancel(String reason) {
            if (state == RUNNING) {
                token.cancel(reason);
                thread.interrupt();
            }
        }

        /**
         * @return {@code false} if the attempt had already timed out
         */
        synchronized boolean finish() {
            if (state == RUNNING) {
                state = FINISHED;
                return true;
            }
            return false;
        }
    }

    /** Builder for {@link JobDispatcher}. */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private JobStore jobStore;
        private WorkerRegistry registry;
        private RetryPolicy retryPolicy;
        private MetricsExporter metrics;
        private JobEventBus eventBus;
        private JsonCodec jsonCodec;
        private Clock clock;
        private String claimer;
        private final Map<String, Integer> queues = new LinkedHashMap<>();
        private final List<JobInterceptor> interceptors = new ArrayList<>();
        private Duration pollInterval = Duration.ofSeconds(1);
        private int fetchLimit = 100;
        private Duration jobTimeout = Duration.ofMinutes(1);
        private Duration maxExecution;
        private Duration shutdownGracePeriod = Duration.ofSeconds(10);

        private Builder() {}

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
         * Identifier stamped into {@code attempted_by}; must be unique per process.
         * <b>Required.</b>
         */
        public Builder claimer(String claimer) {
            this.claimer = claimer;
            return this;
        }

        /**
         * Adds a queue served with at most {@code maxWorkers} concurrent jobs.
         * At least one queue is required.
         */
        public Builder queue(String name, int maxWorkers) {
            Objects.requireNonNull(name, "name");
            if (maxWorkers <= 0) {
                throw new IllegalArgumentException("maxWorkers must be > 0 for queue " + name);
            }
            queues.put(name, maxWorkers);
            return this;
        }

        /**
         * Optional. Defaults to exponential backoff with a 1s base and a 1h cap.
         */
        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder eventBus(JobEventBus eventBus) {
            this.eventBus = eventBus;
            return this;
        }

        /**
         * Codec for handler output. Optional; defaults to {@link JsonCodec#getDefault()}.
         */
        public Builder jsonCodec(JsonCodec jsonCodec) {
            this.jsonCodec = jsonCodec;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder interceptor(JobInterceptor interceptor) {
            interceptors.add(Objects.requireNonNull(interceptor, "interceptor"));
            return this;
        }

        public Builder interceptors(List<JobInterceptor> interceptors) {
            for (JobInterceptor interceptor : interceptors) {
                interceptor(interceptor);
            }
            return this;
        }

        /**
         * Sleep between claim rounds when not woken. Defaults to 1s.
         */
        public Builder pollInterval(Duration pollInterval) {
            this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
            return this;
        }

        /**
         * Upper bound on rows claimed per queue per round. Defaults to 100.
         */
        public Builder fetchLimit(int fetchLimit) {
            this.fetchLimit = fetchLimit;
            return this;
        }

        /**
         * Deadline for handlers that do not declare their own. Defaults to 1 minute;
         * zero disables it unless {@link #maxExecution} is set.
         */
        public Builder jobTimeout(Duration jobTimeout) {
            this.jobTimeout = jobTimeout;
            return this;
        }

        /**
         * Upper bound on every deadline. Handler timeouts that are longer, zero or negative
         * are clamped to it so a job never outlives its lease. Optional; unbounded when unset.
         */
        public Builder maxExecution(Duration maxExecution) {
            this.maxExecution = maxExecution;
            return this;
        }

        /**
         * How long {@link #close()} waits for in-flight jobs before cancelling them.
         * Defaults to 10s.
         */
        public Builder shutdownGracePeriod(Duration shutdownGracePeriod) {
            this.shutdownGracePeriod = Objects.requireNonNull(shutdownGracePeriod, "shutdownGracePeriod");
            return this;
        }

        public JobDispatcher build() {
            return new JobDispatcher(this);
        }
    }
}
