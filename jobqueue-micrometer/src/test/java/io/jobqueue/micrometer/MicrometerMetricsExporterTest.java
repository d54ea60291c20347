package io.jobqueue.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

    private SimpleMeterRegistry registry;
    private MicrometerMetricsExporter exporter;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        exporter = new MicrometerMetricsExporter(registry);
    }

    @Test
    void incrementJobsInsertedByCount() {
        exporter.incrementJobsInserted(3);
        exporter.incrementJobsInserted(1);
        assertEquals(4.0, counter("jobqueue.jobs.inserted").count());
    }

    @Test
    void outcomeCounters() {
        exporter.incrementJobsCompleted();
        exporter.incrementJobsFailed();
        exporter.incrementJobsFailed();
        exporter.incrementJobsDiscarded();
        exporter.incrementJobsSnoozed();

        assertEquals(1.0, counter("jobqueue.jobs.completed").count());
        assertEquals(2.0, counter("jobqueue.jobs.failed").count());
        assertEquals(1.0, counter("jobqueue.jobs.discarded").count());
        assertEquals(1.0, counter("jobqueue.jobs.snoozed").count());
    }

    @Test
    void rescuedAndDroppedCounters() {
        exporter.incrementJobsRescued(5);
        exporter.incrementEventsDropped();
        assertEquals(5.0, counter("jobqueue.jobs.rescued").count());
        assertEquals(1.0, counter("jobqueue.events.dropped").count());
    }

    @Test
    void inFlightGaugePerQueue() {
        exporter.recordInFlight("default", 3);
        exporter.recordInFlight("email", 1);
        exporter.recordInFlight("default", 2);

        assertEquals(2.0, inFlight("default").value());
        assertEquals(1.0, inFlight("email").value());
    }

    @Test
    void recordJobDuration() {
        exporter.recordJobDurationMs(40);
        exporter.recordJobDurationMs(60);

        DistributionSummary summary = registry.find("jobqueue.jobs.duration.ms").summary();
        assertNotNull(summary);
        assertEquals(2, summary.count());
        assertEquals(100.0, summary.totalAmount());
    }

    @Test
    void customPrefix() {
        SimpleMeterRegistry other = new SimpleMeterRegistry();
        MicrometerMetricsExporter custom = new MicrometerMetricsExporter(other, "billing.jobs");

        custom.incrementJobsCompleted();

        assertEquals(1.0, other.find("billing.jobs.jobs.completed").counter().count());
        assertNull(other.find("jobqueue.jobs.completed").counter());
    }

    @Test
    void rejectsInvalidPrefix() {
        assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(registry, null));
        assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
        assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "jobs."));
        assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
    }

    @Test
    void closeRemovesMetersAndIgnoresLaterUpdates() {
        exporter.recordInFlight("default", 1);
        exporter.close();

        assertNull(registry.find("jobqueue.jobs.completed").counter());
        assertNull(registry.find("jobqueue.jobs.inflight").gauge());
        assertTrue(registry.getMeters().isEmpty());

        exporter.incrementJobsCompleted();
        exporter.recordInFlight("email", 4);
        assertTrue(registry.getMeters().isEmpty());
    }

    private Counter counter(String name) {
        Counter counter = registry.find(name).counter();
        assertNotNull(counter, "Counter not found: " + name);
        return counter;
    }

    private Gauge inFlight(String queue) {
        Gauge gauge = registry.find("jobqueue.jobs.inflight").tag("queue", queue).gauge();
        assertNotNull(gauge, "Gauge not found for queue " + queue);
        return gauge;
    }
}
