package io.jobqueue;

import java.util.Objects;

/**
 * One entry of a batch insert.
 */
public record InsertParams(JobArgs args, InsertOpts opts) {

    public InsertParams {
        Objects.requireNonNull(args, "args");
    }

    public static InsertParams of(JobArgs args) {
        return new InsertParams(args, null);
    }

    public static InsertParams of(JobArgs args, InsertOpts opts) {
        return new InsertParams(args, opts);
    }
}
