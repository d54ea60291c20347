package io.jobqueue;

/**
 * Thrown by {@link JobHandler#decode(String)} when a stored payload cannot be turned into
 * arguments. Jobs failing to decode are discarded immediately and never retried.
 */
public class JobDecodeException extends Exception {

    public JobDecodeException(String message) {
        super(message);
    }

    public JobDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
