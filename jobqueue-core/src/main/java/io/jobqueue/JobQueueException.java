package io.jobqueue;

/**
 * Base class of the unchecked exceptions thrown by the job engine.
 */
public class JobQueueException extends RuntimeException {

    public JobQueueException(String message) {
        super(message);
    }

    public JobQueueException(String message, Throwable cause) {
        super(message, cause);
    }
}
