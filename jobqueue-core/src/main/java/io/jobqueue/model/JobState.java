package io.jobqueue.model;

/**
 * Lifecycle states of a job row. Stored as integer codes in the database.
 *
 * <p>Transitions: {@code AVAILABLE → RUNNING → COMPLETED}, {@code RUNNING → AVAILABLE}
 * (retry, snooze or lease rescue) and {@code RUNNING → DISCARDED}. {@code COMPLETED} and
 * {@code DISCARDED} are terminal.
 */
public enum JobState {
    /**
     * Waiting for its scheduled time and a free worker.
     */
    AVAILABLE(0),
    /**
     * Claimed by a worker; owned by that claim until finalized or rescued.
     */
    RUNNING(1),
    /**
     * Handler succeeded.
     */
    COMPLETED(2),
    /**
     * Permanently failed; kept with its last error.
     */
    DISCARDED(3);

    private final int code;

    JobState(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == DISCARDED;
    }

    public static JobState fromCode(int code) {
        for (JobState state : values()) {
            if (state.code == code) {
                return state;
            }
        }
        throw new IllegalArgumentException("Unknown job state code: " + code);
    }
}
