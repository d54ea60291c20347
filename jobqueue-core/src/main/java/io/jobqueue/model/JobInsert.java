package io.jobqueue.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A fully resolved row ready to be written by {@link io.jobqueue.spi.JobStore#insert}.
 * Built by the client after validation and defaulting.
 */
public record JobInsert(
    String id,
    String kind,
    String argsJson,
    String queue,
    int priority,
    Instant scheduledAt,
    int maxAttempts,
    Instant createdAt
) {
    public JobInsert {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(argsJson, "argsJson");
        Objects.requireNonNull(queue, "queue");
        Objects.requireNonNull(scheduledAt, "scheduledAt");
        Objects.requireNonNull(createdAt, "createdAt");
    }
}
