package io.jobqueue.micrometer;

import io.jobqueue.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code jobqueue.jobs.inserted}: rows written by insert calls</li>
 *   <li>{@code jobqueue.jobs.completed}: jobs completed successfully</li>
 *   <li>{@code jobqueue.jobs.failed}: failed attempts scheduled for retry</li>
 *   <li>{@code jobqueue.jobs.discarded}: jobs discarded with no more retries</li>
 *   <li>{@code jobqueue.jobs.snoozed}: jobs snoozed by their handler</li>
 *   <li>{@code jobqueue.jobs.rescued}: expired leases reset by the rescuer</li>
 *   <li>{@code jobqueue.events.dropped}: lifecycle events dropped by full subscriber buffers</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code jobqueue.jobs.inflight}: jobs executing, tagged {@code queue}</li>
 * </ul>
 *
 * <h3>Distribution Summaries</h3>
 * <ul>
 *   <li>{@code jobqueue.jobs.duration.ms}: handler execution time</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

    private final MeterRegistry registry;
    private final String namePrefix;
    private final Counter inserted;
    private final Counter completed;
    private final Counter failed;
    private final Counter discarded;
    private final Counter snoozed;
    private final Counter rescued;
    private final Counter eventsDropped;
    private final DistributionSummary jobDuration;

    private final Map<String, AtomicInteger> inFlight = new ConcurrentHashMap<>();
    private final Map<String, Gauge> inFlightGauges = new ConcurrentHashMap<>();
    private volatile boolean closed;

    /**
     * Creates an exporter with the default metric name prefix {@code "jobqueue"}.
     */
    public MicrometerMetricsExporter(MeterRegistry registry) {
        this(registry, "jobqueue");
    }

    /**
     * Creates an exporter with a custom metric name prefix for multi-client use.
     *
     * @param registry   the Micrometer meter registry
     * @param namePrefix prefix for all meter names (e.g. {@code "billing.jobqueue"})
     */
    public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(namePrefix, "namePrefix");
        if (namePrefix.isEmpty()) {
            throw new IllegalArgumentException("namePrefix must not be empty");
        }
        if (namePrefix.endsWith(".")) {
            throw new IllegalArgumentException("namePrefix must not end with '.'");
        }

        this.registry = registry;
        this.namePrefix = namePrefix;
        this.inserted = Counter.builder(namePrefix + ".jobs.inserted")
            .description("Jobs inserted")
            .register(registry);
        this.completed = Counter.builder(namePrefix + ".jobs.completed")
            .description("Jobs completed successfully")
            .register(registry);
        this.failed = Counter.builder(namePrefix + ".jobs.failed")
            .description("Failed attempts scheduled for retry")
            .register(registry);
        this.discarded = Counter.builder(namePrefix + ".jobs.discarded")
            .description("Jobs discarded (no more retries)")
            .register(registry);
        this.snoozed = Counter.builder(namePrefix + ".jobs.snoozed")
            .description("Jobs snoozed by their handler")
            .register(registry);
        this.rescued = Counter.builder(namePrefix + ".jobs.rescued")
            .description("Expired leases reset by the rescuer")
            .register(registry);
        this.eventsDropped = Counter.builder(namePrefix + ".events.dropped")
            .description("Lifecycle events dropped (subscriber buffer full)")
            .register(registry);
        this.jobDuration = DistributionSummary.builder(namePrefix + ".jobs.duration.ms")
            .description("Handler execution time in milliseconds")
            .register(registry);
    }

    @Override
    public void incrementJobsInserted(int count) {
        if (closed) return;
        inserted.increment(count);
    }

    @Override
    public void incrementJobsCompleted() {
        if (closed) return;
        completed.increment();
    }

    @Override
    public void incrementJobsFailed() {
        if (closed) return;
        failed.increment();
    }

    @Override
    public void incrementJobsDiscarded() {
        if (closed) return;
        discarded.increment();
    }

    @Override
    public void incrementJobsSnoozed() {
        if (closed) return;
        snoozed.increment();
    }

    @Override
    public void incrementJobsRescued(int count) {
        if (closed) return;
        rescued.increment(count);
    }

    @Override
    public void incrementEventsDropped() {
        if (closed) return;
        eventsDropped.increment();
    }

    @Override
    public void recordInFlight(String queue, int count) {
        if (closed) return;
        inFlight.computeIfAbsent(queue, q -> {
            AtomicInteger value = new AtomicInteger();
            inFlightGauges.put(q, Gauge.builder(namePrefix + ".jobs.inflight", value, AtomicInteger::get)
                .description("Jobs currently executing")
                .tag("queue", q)
                .register(registry));
            return value;
        }).set(count);
    }

    @Override
    public void recordJobDurationMs(long durationMs) {
        if (closed) return;
        jobDuration.record(durationMs);
    }

    /**
     * Removes all meters registered by this exporter from the registry.
     *
     * <p>Called by {@link io.jobqueue.JobClient#close()} so stale gauges do not outlive the
     * client.
     */
    @Override
    public void close() {
        closed = true;
        List<Meter> meters = new ArrayList<>(List.of(inserted, completed, failed, discarded,
            snoozed, rescued, eventsDropped, jobDuration));
        meters.addAll(inFlightGauges.values());
        RuntimeException first = null;
        for (Meter meter : meters) {
            try {
                registry.remove(meter);
            } catch (RuntimeException e) {
                if (first == null) first = e;
                else first.addSuppressed(e);
            }
        }
        if (first != null) throw first;
    }
}
