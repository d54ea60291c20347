package io.jobqueue;

/**
 * Thrown when a job is rejected at insert time, before any row exists.
 */
public class JobValidationException extends JobQueueException {

    public JobValidationException(String message) {
        super(message);
    }

    public JobValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
