package io.jobqueue.periodic;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Fires every {@code interval}.
 */
public record IntervalSchedule(Duration interval) implements PeriodicSchedule {

    public IntervalSchedule {
        Objects.requireNonNull(interval, "interval");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be > 0, got: " + interval);
        }
    }

    @Override
    public Instant next(Instant after) {
        return after.plus(interval);
    }
}
