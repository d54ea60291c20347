package io.jobqueue;

/**
 * Thrown when no handler is registered for a job kind.
 */
public class UnknownJobKindException extends JobValidationException {
    private final String kind;

    public UnknownJobKindException(String kind) {
        super("No handler registered for job kind: " + kind);
        this.kind = kind;
    }

    public String kind() {
        return kind;
    }
}
