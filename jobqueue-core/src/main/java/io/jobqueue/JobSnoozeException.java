package io.jobqueue;

import java.time.Duration;
import java.util.Objects;

/**
 * Thrown by a handler to put its job back to {@code AVAILABLE} after the given delay
 * without consuming an attempt.
 *
 * <pre>{@code
 * if (!upstream.ready()) {
 *     throw new JobSnoozeException(Duration.ofSeconds(30));
 * }
 * }</pre>
 */
public class JobSnoozeException extends RuntimeException {
    private final Duration delay;

    public JobSnoozeException(Duration delay) {
        super("snoozed for " + Objects.requireNonNull(delay, "delay"));
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must not be negative: " + delay);
        }
        this.delay = delay;
    }

    public Duration delay() {
        return delay;
    }
}
