package io.jobqueue;

/**
 * Thrown when a second handler is registered for a kind that already has one.
 */
public class DuplicateJobKindException extends JobQueueException {
    private final String kind;

    public DuplicateJobKindException(String kind) {
        super("Handler already registered for job kind: " + kind);
        this.kind = kind;
    }

    public String kind() {
        return kind;
    }
}
