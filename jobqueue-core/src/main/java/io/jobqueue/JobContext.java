package io.jobqueue;

import io.jobqueue.model.JobRow;

import java.time.Instant;
import java.util.Objects;

/**
 * Per-execution context passed to {@link JobHandler#execute}.
 */
public final class JobContext {
    private final JobRow job;
    private final CancellationToken token;
    private final Instant deadline;
    private volatile Object output;

    public JobContext(JobRow job, CancellationToken token, Instant deadline) {
        this.job = Objects.requireNonNull(job, "job");
        this.token = Objects.requireNonNull(token, "token");
        this.deadline = deadline;
    }

    /**
     * Snapshot of the row as claimed ({@code RUNNING}, attempt already incremented).
     */
    public JobRow job() {
        return job;
    }

    public CancellationToken cancellationToken() {
        return token;
    }

    public boolean isCancelled() {
        return token.isCancelled();
    }

    public void throwIfCancelled() {
        token.throwIfCancelled();
    }

    /**
     * When this attempt times out, or {@code null} if it has no deadline.
     */
    public Instant deadline() {
        return deadline;
    }

    /**
     * Records a result to be stored as JSON with the completed row.
     */
    public void recordOutput(Object output) {
        this.output = output;
    }

    public Object output() {
        return output;
    }
}
