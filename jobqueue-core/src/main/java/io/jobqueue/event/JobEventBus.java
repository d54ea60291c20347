package io.jobqueue.event;

import io.jobqueue.spi.MetricsExporter;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fan-out of job lifecycle events to independent subscribers.
 *
 * <p>{@link #publish} never blocks: each subscriber has its own bounded buffer, and a full
 * buffer drops its oldest event (counted per subscriber and reported through
 * {@link MetricsExporter#incrementEventsDropped()}). A slow subscriber only loses its own
 * events.
 */
public final class JobEventBus {
    private static final Logger logger = Logger.getLogger(JobEventBus.class.getName());

    public static final int DEFAULT_BUFFER_SIZE = 1000;

    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();
    private final int bufferSize;
    private final MetricsExporter metrics;

    public JobEventBus() {
        this(DEFAULT_BUFFER_SIZE, MetricsExporter.NOOP);
    }

    public JobEventBus(int bufferSize, MetricsExporter metrics) {
        if (bufferSize <= 0) {
            throw new IllegalArgumentException("bufferSize must be > 0");
        }
        this.bufferSize = bufferSize;
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Subscribes to the given kinds.
     *
     * @throws IllegalArgumentException if no kind is given
     */
    public Subscription subscribe(JobEventKind... kinds) {
        Objects.requireNonNull(kinds, "kinds");
        return subscribe(kinds.length == 0 ? EnumSet.noneOf(JobEventKind.class)
            : EnumSet.copyOf(Arrays.asList(kinds)));
    }

    public Subscription subscribe(Set<JobEventKind> kinds) {
        Objects.requireNonNull(kinds, "kinds");
        if (kinds.isEmpty()) {
            throw new IllegalArgumentException("subscribe requires at least one event kind");
        }
        Subscription subscription = new Subscription(this, kinds, bufferSize);
        subscriptions.add(subscription);
        return subscription;
    }

    public void publish(JobEvent event) {
        Objects.requireNonNull(event, "event");
        for (Subscription subscription : subscriptions) {
            if (!subscription.accepts(event.kind())) {
                continue;
            }
            int dropped = subscription.offer(event);
            for (int i = 0; i < dropped; i++) {
                metrics.incrementEventsDropped();
            }
            if (dropped > 0) {
                logger.log(Level.FINE, "Subscriber buffer full; dropped {0} oldest event(s), total {1}",
                    new Object[]{dropped, subscription.droppedCount()});
            }
        }
    }

    public int subscriberCount() {
        return subscriptions.size();
    }

    /**
     * Closes every subscription.
     */
    public void closeAll() {
        for (Subscription subscription : subscriptions) {
            subscription.close();
        }
    }

    void unsubscribe(Subscription subscription) {
        subscriptions.remove(subscription);
    }
}
