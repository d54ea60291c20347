package io.jobqueue;

import java.time.Duration;
import java.time.Instant;

/**
 * Optional insert settings. A {@code null} field means "use the next default": the args'
 * own {@link JobArgs#insertOpts()}, then the client's defaults.
 *
 * @param queue       target queue name
 * @param priority    1 (highest) to 4 (lowest)
 * @param scheduledAt earliest time the job may run
 * @param scheduledIn delay added to the inserter's clock at insert time; ignored when
 *                    {@code scheduledAt} is set
 * @param maxAttempts total attempts before the job is discarded
 */
public record InsertOpts(String queue, Integer priority, Instant scheduledAt, Duration scheduledIn,
                         Integer maxAttempts) {

    public static final InsertOpts DEFAULT = new InsertOpts(null, null, null, null, null);

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns options where every non-null field of {@code override} replaces this one's.
     * {@code scheduledAt} and {@code scheduledIn} are replaced together.
     */
    public InsertOpts overriddenBy(InsertOpts override) {
        if (override == null) {
            return this;
        }
        boolean reschedules = override.scheduledAt != null || override.scheduledIn != null;
        return new InsertOpts(
            override.queue != null ? override.queue : queue,
            override.priority != null ? override.priority : priority,
            reschedules ? override.scheduledAt : scheduledAt,
            reschedules ? override.scheduledIn : scheduledIn,
            override.maxAttempts != null ? override.maxAttempts : maxAttempts);
    }

    /**
     * Earliest run time relative to {@code now}, or {@code now} when neither is set.
     */
    public Instant resolveScheduledAt(Instant now) {
        if (scheduledAt != null) {
            return scheduledAt;
        }
        return scheduledIn != null ? now.plus(scheduledIn) : now;
    }

    public static final class Builder {
        private String queue;
        private Integer priority;
        private Instant scheduledAt;
        private Duration scheduledIn;
        private Integer maxAttempts;

        private Builder() {
        }

        public Builder queue(String queue) {
            this.queue = queue;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder scheduledAt(Instant scheduledAt) {
            this.scheduledAt = scheduledAt;
            this.scheduledIn = null;
            return this;
        }

        public Builder scheduledIn(Duration delay) {
            this.scheduledIn = delay;
            this.scheduledAt = null;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public InsertOpts build() {
            return new InsertOpts(queue, priority, scheduledAt, scheduledIn, maxAttempts);
        }
    }
}
