package io.jobqueue;

/**
 * Thrown by a handler to discard its job right away, skipping any remaining attempts.
 * The message is stored as the job's last error.
 */
public class JobDiscardException extends RuntimeException {

    public JobDiscardException(String message) {
        super(message);
    }

    public JobDiscardException(String message, Throwable cause) {
        super(message, cause);
    }
}
