package io.jobqueue.maintenance;

import io.jobqueue.spi.ConnectionProvider;
import io.jobqueue.spi.JobStore;
import io.jobqueue.spi.MetricsExporter;
import io.jobqueue.util.DaemonThreadFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Periodically resets {@code RUNNING} rows whose lease expired, so jobs of crashed or stuck
 * workers are offered again (or discarded once out of attempts).
 *
 * <p>A lease starts at claim time and lasts {@code leaseTimeout}. Any process may rescue any
 * expired row; the store's ownership guard turns the original worker's late update into a
 * conflict.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class JobRescuer implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(JobRescuer.class.getName());

    private final ConnectionProvider connectionProvider;
    private final JobStore jobStore;
    private final MetricsExporter metrics;
    private final Clock clock;
    private final Duration leaseTimeout;
    private final long intervalMs;
    private final Runnable onRescued;

    private ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> rescueTask;
    private volatile boolean closed;

    private JobRescuer(Builder builder) {
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.jobStore = Objects.requireNonNull(builder.jobStore, "jobStore");
        this.leaseTimeout = Objects.requireNonNull(builder.leaseTimeout, "leaseTimeout");
        Objects.requireNonNull(builder.interval, "interval");
        if (leaseTimeout.isNegative() || leaseTimeout.isZero()) {
            throw new IllegalArgumentException("leaseTimeout must be > 0");
        }
        if (builder.interval.isNegative() || builder.interval.isZero()) {
            throw new IllegalArgumentException("interval must be > 0");
        }
        this.intervalMs = builder.interval.toMillis();
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.onRescued = builder.onRescued != null ? builder.onRescued : () -> { };
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts the rescue schedule. Subsequent calls are no-ops if already started.
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("JobRescuer has been closed");
        }
        if (rescueTask != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("jobqueue-rescuer-"));
        rescueTask = scheduler.scheduleWithFixedDelay(this::runOnce, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Runs one rescue pass.
     *
     * @return number of rows reset or discarded
     */
    public int runOnce() {
        if (closed) {
            return 0;
        }
        Instant now = clock.instant();
        Instant expiredBefore = now.minus(leaseTimeout);
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            int rescued = jobStore.rescueExpired(conn, now, expiredBefore);
            if (rescued > 0) {
                metrics.incrementJobsRescued(rescued);
                logger.log(Level.WARNING, "Rescued {0} job(s) whose lease expired before {1}",
                    new Object[]{rescued, expiredBefore});
                onRescued.run();
            }
            return rescued;
        } catch (SQLException | RuntimeException e) {
            logger.log(Level.SEVERE, "Lease rescue failed", e);
            return 0;
        }
    }

    /** Cancels the rescue schedule and shuts down its thread. */
    @Override
    public synchronized void close() {
        closed = true;
        if (rescueTask != null) {
            rescueTask.cancel(false);
            rescueTask = null;
        }
        if (scheduler != null) {
            scheduler.shutdownNow();
            try {
                scheduler.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /** Builder for {@link JobRescuer}. */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private JobStore jobStore;
        private MetricsExporter metrics;
        private Clock clock;
        private Duration leaseTimeout = Duration.ofHours(1);
        private Duration interval = Duration.ofSeconds(30);
        private Runnable onRescued;

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

        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Lease length measured from claim time. Defaults to 1 hour.
         */
        public Builder leaseTimeout(Duration leaseTimeout) {
            this.leaseTimeout = leaseTimeout;
            return this;
        }

        /**
         * Delay between rescue passes. Defaults to 30 seconds.
         */
        public Builder interval(Duration interval) {
            this.interval = interval;
            return this;
        }

        /**
         * Called after a pass that rescued at least one row, typically to wake the dispatcher.
         */
        public Builder onRescued(Runnable onRescued) {
            this.onRescued = onRescued;
            return this;
        }

        public JobRescuer build() {
            return new JobRescuer(this);
        }
    }
}
