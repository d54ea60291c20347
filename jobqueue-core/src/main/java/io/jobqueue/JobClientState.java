package io.jobqueue;

/**
 * Lifecycle of a {@link JobClient}: {@code STOPPED → STARTING → RUNNING → STOPPING → STOPPED}.
 */
public enum JobClientState {
    STOPPED,
    STARTING,
    RUNNING,
    STOPPING
}
