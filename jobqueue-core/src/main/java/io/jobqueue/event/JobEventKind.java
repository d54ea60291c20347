package io.jobqueue.event;

/**
 * Kinds of lifecycle events published after a job attempt is recorded.
 */
public enum JobEventKind {
    /**
     * The handler succeeded and the row is {@code COMPLETED}.
     */
    COMPLETED,
    /**
     * The attempt failed and a retry was scheduled.
     */
    FAILED,
    /**
     * The handler snoozed the job.
     */
    SNOOZED,
    /**
     * The job was discarded: attempts exhausted, undecodable payload, or handler request.
     */
    DISCARDED
}
