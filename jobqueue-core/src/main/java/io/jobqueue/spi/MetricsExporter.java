package io.jobqueue.spi;

/**
 * Observability hook for exporting job counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of inserted jobs.
     */
    void incrementJobsInserted(int count);

    /**
     * Increments the count of jobs completed successfully.
     */
    void incrementJobsCompleted();

    /**
     * Increments the count of failed attempts that were scheduled for retry.
     */
    void incrementJobsFailed();

    /**
     * Increments the count of jobs discarded (no more retries).
     */
    void incrementJobsDiscarded();

    /**
     * Increments the count of jobs snoozed by their handler.
     */
    default void incrementJobsSnoozed() {
    }

    /**
     * Increments the count of expired leases reset by the rescuer.
     */
    default void incrementJobsRescued(int count) {
    }

    /**
     * Increments the count of lifecycle events dropped because a subscriber's buffer was full.
     */
    default void incrementEventsDropped() {
    }

    /**
     * Records how many jobs of a queue are currently executing.
     */
    default void recordInFlight(String queue, int inFlight) {
    }

    /**
     * Records the time spent executing the handler only.
     *
     * @param durationMs handler execution time in milliseconds (always non-negative)
     */
    default void recordJobDurationMs(long durationMs) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementJobsInserted(int count) {
        }

        @Override
        public void incrementJobsCompleted() {
        }

        @Override
        public void incrementJobsFailed() {
        }

        @Override
        public void incrementJobsDiscarded() {
        }
    }
}
