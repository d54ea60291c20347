package io.jobqueue.periodic;

/**
 * Identifies a registered periodic job for {@link PeriodicJobs#remove}.
 */
public record PeriodicJobHandle(long value) {
}
