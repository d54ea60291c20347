package io.jobqueue.dispatch;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Retry policy using exponential backoff with additive jitter.
 *
 * <p>Delay formula: {@code min(maxDelay, baseDelay * 2^attempt)} plus a random jitter in
 * {@code [0, 10%)} of that value.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
    private static final double JITTER_RATIO = 0.1;

    private final long baseDelayMs;
    private final long maxDelayMs;

    /**
     * @param baseDelayMs base delay (milliseconds); the first retry waits about twice this
     * @param maxDelayMs  cap applied before jitter (milliseconds)
     */
    public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs) {
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException("baseDelayMs must be > 0, got: " + baseDelayMs);
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs);
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
    }

    @Override
    public long computeDelayMs(int attempt) {
        if (attempt <= 0) {
            return 0L;
        }
        long capped = cappedDelayMs(attempt);
        long jitterBound = (long) (capped * JITTER_RATIO);
        long jitter = jitterBound > 0 ? ThreadLocalRandom.current().nextLong(jitterBound) : 0L;
        return capped + jitter;
    }

    /**
     * The delay before jitter.
     */
    long cappedDelayMs(int attempt) {
        if (attempt >= 62) {
            return maxDelayMs;
        }
        long shift = 1L << attempt;
        // overflow guard
        if (shift > maxDelayMs / baseDelayMs) {
            return maxDelayMs;
        }
        return Math.min(maxDelayMs, baseDelayMs * shift);
    }
}
