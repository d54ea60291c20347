package io.jobqueue.model;

import java.time.Instant;

/**
 * Read-only snapshot of a persisted job row.
 *
 * @see io.jobqueue.spi.JobStore#claim
 */
public record JobRow(
    String id,
    String kind,
    String argsJson,
    String queue,
    JobState state,
    int priority,
    Instant scheduledAt,
    int attempt,
    int maxAttempts,
    String lastError,
    Instant createdAt,
    Instant attemptedAt,
    String attemptedBy,
    Instant finalizedAt,
    String outputJson
) {

    /**
     * Returns {@code true} if another failure would still be retried.
     */
    public boolean hasAttemptsLeft() {
        return attempt < maxAttempts;
    }

    public JobRow withState(JobState state) {
        return new JobRow(id, kind, argsJson, queue, state, priority, scheduledAt, attempt,
            maxAttempts, lastError, createdAt, attemptedAt, attemptedBy, finalizedAt, outputJson);
    }

    public JobRow withCompleted(Instant finalizedAt, String outputJson) {
        return new JobRow(id, kind, argsJson, queue, JobState.COMPLETED, priority, scheduledAt,
            attempt, maxAttempts, lastError, createdAt, attemptedAt, attemptedBy, finalizedAt, outputJson);
    }

    public JobRow withRetry(Instant nextAt, String error) {
        return new JobRow(id, kind, argsJson, queue, JobState.AVAILABLE, priority, nextAt,
            attempt, maxAttempts, error, createdAt, attemptedAt, attemptedBy, finalizedAt, outputJson);
    }

    public JobRow withSnooze(Instant nextAt) {
        return new JobRow(id, kind, argsJson, queue, JobState.AVAILABLE, priority, nextAt,
            attempt - 1, maxAttempts, lastError, createdAt, attemptedAt, attemptedBy, finalizedAt, outputJson);
    }

    public JobRow withDiscarded(Instant finalizedAt, String error) {
        return new JobRow(id, kind, argsJson, queue, JobState.DISCARDED, priority, scheduledAt,
            attempt, maxAttempts, error, createdAt, attemptedAt, attemptedBy, finalizedAt, outputJson);
    }
}
