package io.jobqueue;

import java.util.concurrent.CancellationException;

/**
 * Cooperative cancellation signal handed to each job execution. Set when the job's deadline
 * passes or the client is stopped; handlers are expected to check it and return.
 */
public final class CancellationToken {
    private volatile String reason;

    public boolean isCancelled() {
        return reason != null;
    }

    /**
     * Returns why the token was cancelled, or {@code null}.
     */
    public String reason() {
        return reason;
    }

    /**
     * Cancels the token. The first reason wins.
     */
    public synchronized void cancel(String reason) {
        if (this.reason == null) {
            this.reason = reason != null ? reason : "cancelled";
        }
    }

    /**
     * @throws CancellationException if the token is cancelled
     */
    public void throwIfCancelled() {
        String r = reason;
        if (r != null) {
            throw new CancellationException(r);
        }
    }
}
