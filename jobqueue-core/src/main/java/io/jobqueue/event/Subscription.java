package io.jobqueue.event;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A subscriber's bounded event buffer. When the buffer is full the oldest event is
 * dropped to make room; {@link #droppedCount()} tells how many were lost.
 *
 * <p>Closing unsubscribes; it is idempotent. Events already buffered can still be polled.
 */
public final class Subscription implements AutoCloseable {
    private final JobEventBus bus;
    private final Set<JobEventKind> kinds;
    private final ArrayBlockingQueue<JobEvent> buffer;
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicBoolean closed = new AtomicBoolean();

    Subscription(JobEventBus bus, Set<JobEventKind> kinds, int capacity) {
        this.bus = bus;
        this.kinds = Collections.unmodifiableSet(EnumSet.copyOf(kinds));
        this.buffer = new ArrayBlockingQueue<>(capacity);
    }

    public Set<JobEventKind> kinds() {
        return kinds;
    }

    /**
     * Returns the next buffered event, or {@code null} if none.
     */
    public JobEvent poll() {
        return buffer.poll();
    }

    /**
     * Waits up to the timeout for the next event.
     *
     * @return the event, or {@code null} on timeout
     */
    public JobEvent poll(long timeout, TimeUnit unit) throws InterruptedException {
        return buffer.poll(timeout, unit);
    }

    /**
     * Moves all buffered events into {@code target}.
     *
     * @return the number of events moved
     */
    public int drainTo(Collection<? super JobEvent> target) {
        return buffer.drainTo(target);
    }

    public long droppedCount() {
        return dropped.get();
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            bus.unsubscribe(this);
        }
    }

    boolean accepts(JobEventKind kind) {
        return !closed.get() && kinds.contains(kind);
    }

    /**
     * Offers without blocking, evicting the oldest event while full.
     *
     * @return the number of events dropped to make room
     */
    int offer(JobEvent event) {
        int evicted = 0;
        while (!buffer.offer(event)) {
            if (buffer.poll() != null) {
                evicted++;
            }
        }
        if (evicted > 0) {
            dropped.addAndGet(evicted);
        }
        return evicted;
    }
}
