package io.jobqueue.periodic;

import io.jobqueue.InsertOpts;
import io.jobqueue.JobArgs;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * A recurring job template: a schedule and a factory for each fire's arguments.
 *
 * <pre>{@code
 * client.periodicJobs().add(PeriodicJob.builder(
 *         PeriodicSchedule.every(Duration.ofMinutes(15)),
 *         () -> new ReindexArgs("products"))
 *     .runOnStart(true)
 *     .build());
 * }</pre>
 *
 * <p>The factory may return {@code null} to skip a fire.
 */
public final class PeriodicJob {
    private final PeriodicSchedule schedule;
    private final Supplier<? extends JobArgs> constructor;
    private final InsertOpts opts;
    private final boolean runOnStart;

    private PeriodicJob(Builder builder) {
        this.schedule = Objects.requireNonNull(builder.schedule, "schedule");
        this.constructor = Objects.requireNonNull(builder.constructor, "constructor");
        this.opts = builder.opts;
        this.runOnStart = builder.runOnStart;
    }

    public static Builder builder(PeriodicSchedule schedule, Supplier<? extends JobArgs> constructor) {
        return new Builder(schedule, constructor);
    }

    public static PeriodicJob every(Duration interval, Supplier<? extends JobArgs> constructor) {
        return builder(PeriodicSchedule.every(interval), constructor).build();
    }

    public PeriodicSchedule schedule() {
        return schedule;
    }

    public Supplier<? extends JobArgs> constructor() {
        return constructor;
    }

    /**
     * Options applied to every inserted job, or {@code null}.
     */
    public InsertOpts opts() {
        return opts;
    }

    /**
     * Whether the first fire happens at start (or when added to a running scheduler)
     * instead of one period later.
     */
    public boolean runOnStart() {
        return runOnStart;
    }

    public static final class Builder {
        private final PeriodicSchedule schedule;
        private final Supplier<? extends JobArgs> constructor;
        private InsertOpts opts;
        private boolean runOnStart;

        private Builder(PeriodicSchedule schedule, Supplier<? extends JobArgs> constructor) {
            this.schedule = schedule;
            this.constructor = constructor;
        }

        public Builder opts(InsertOpts opts) {
            this.opts = opts;
            return this;
        }

        public Builder runOnStart(boolean runOnStart) {
            this.runOnStart = runOnStart;
            return this;
        }

        public PeriodicJob build() {
            return new PeriodicJob(this);
        }
    }
}
