package io.jobqueue.event;

import io.jobqueue.model.JobRow;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable lifecycle event.
 *
 * @param kind       what happened
 * @param job        row snapshot after the transition
 * @param error      error text of the failed attempt, {@code null} unless failed or discarded
 * @param occurredAt when the transition was recorded
 */
public record JobEvent(JobEventKind kind, JobRow job, String error, Instant occurredAt) {

    public JobEvent {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(job, "job");
        Objects.requireNonNull(occurredAt, "occurredAt");
    }
}
