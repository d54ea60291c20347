package io.jobqueue;

/**
 * Thrown when a state transition targets a row that is no longer {@code RUNNING} under
 * the caller's claim, typically because its lease expired and another process rescued it.
 */
public class JobConflictException extends JobQueueException {
    private final String jobId;

    public JobConflictException(String jobId, String transition) {
        super("Job " + jobId + " is not running under this claim; cannot " + transition);
        this.jobId = jobId;
    }

    public String jobId() {
        return jobId;
    }
}
