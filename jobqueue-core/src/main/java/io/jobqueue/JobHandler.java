package io.jobqueue;

import java.time.Duration;

/**
 * Executes jobs of one kind.
 *
 * <p>Decoding is separate from execution so that malformed payloads, which no retry can
 * fix, are discarded at once while execution failures are retried.
 *
 * <p>Execution outcome:
 * <ul>
 *   <li>normal return: the job completes</li>
 *   <li>{@link JobSnoozeException}: rescheduled without consuming an attempt</li>
 *   <li>{@link JobDiscardException}: discarded immediately</li>
 *   <li>anything else, or exceeding {@link #timeout()}: retried with backoff until
 *       {@code maxAttempts}, then discarded</li>
 * </ul>
 *
 * @param <A> decoded argument type
 * @see JsonJobHandler
 * @see io.jobqueue.registry.WorkerRegistry
 */
public interface JobHandler<A> {

    /**
     * The kind this handler serves.
     */
    String kind();

    /**
     * Decodes a stored payload.
     *
     * @throws JobDecodeException if the payload cannot be decoded
     */
    A decode(String payload) throws JobDecodeException;

    /**
     * Executes one attempt. Long-running work should check
     * {@link JobContext#isCancelled()} and react to interruption.
     */
    void execute(JobContext context, A args) throws Exception;

    /**
     * Execution deadline for this kind, or {@code null} for the client default.
     * Deadlines are capped below the client's lease timeout; a zero or negative duration
     * means the longest deadline the lease allows.
     */
    default Duration timeout() {
        return null;
    }
}
