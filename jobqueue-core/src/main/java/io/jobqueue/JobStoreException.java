package io.jobqueue;

/**
 * Unchecked wrapper for storage failures (connectivity, SQL, transaction errors).
 */
public class JobStoreException extends JobQueueException {

    public JobStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
