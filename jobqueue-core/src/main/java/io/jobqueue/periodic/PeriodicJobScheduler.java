package io.jobqueue.periodic;

import io.jobqueue.InsertOpts;
import io.jobqueue.JobArgs;
import io.jobqueue.util.DaemonThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Inserts jobs for registered {@link PeriodicJob}s when they come due.
 *
 * <p>One daemon thread sleeps until the nearest fire time. {@link #add}, {@link #remove} and
 * {@link #clear} signal it so it recomputes its wait right away. Only that thread inserts,
 * so a periodic job never has two insertions in flight.
 *
 * <p>Each next fire time is computed from the previous planned one, so intervals do not
 * drift with insert latency. Fires missed while stopped or blocked are coalesced into one.
 * Registered jobs survive {@link #stop()}/{@link #start()}; {@link #close()} removes them.
 */
public final class PeriodicJobScheduler implements PeriodicJobs, AutoCloseable {
    private static final Logger logger = Logger.getLogger(PeriodicJobScheduler.class.getName());

    private static final long STOP_JOIN_TIMEOUT_MS = 10_000;

    private final Inserter inserter;
    private final Clock clock;
    private final DaemonThreadFactory threadFactory = new DaemonThreadFactory("jobqueue-periodic-");
    private final AtomicLong handleSequence = new AtomicLong();

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final Map<PeriodicJobHandle, Entry> entries = new LinkedHashMap<>();
    private boolean running;
    private long generation;
    private Thread thread;

    public PeriodicJobScheduler(Inserter inserter) {
        this(inserter, Clock.systemUTC());
    }

    public PeriodicJobScheduler(Inserter inserter, Clock clock) {
        this.inserter = Objects.requireNonNull(inserter, "inserter");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public PeriodicJobHandle add(PeriodicJob job) {
        Objects.requireNonNull(job, "job");
        PeriodicJobHandle handle = new PeriodicJobHandle(handleSequence.incrementAndGet());
        Entry entry = new Entry(handle, job);
        lock.lock();
        try {
            if (running) {
                entry.nextRunAt = firstFire(job, clock.instant());
            }
            entries.put(handle, entry);
            changed.signalAll();
        } finally {
            lock.unlock();
        }
        return handle;
    }

    @Override
    public boolean remove(PeriodicJobHandle handle) {
        lock.lock();
        try {
            boolean removed = entries.remove(handle) != null;
            changed.signalAll();
            return removed;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void clear() {
        lock.lock();
        try {
            entries.clear();
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<PeriodicJobHandle> handles() {
        lock.lock();
        try {
            return List.copyOf(entries.keySet());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Next planned fire of a registered job, or {@code null} if unknown or not scheduled.
     */
    public Instant nextRunAt(PeriodicJobHandle handle) {
        lock.lock();
        try {
            Entry entry = entries.get(handle);
            return entry == null ? null : entry.nextRunAt;
        } finally {
            lock.unlock();
        }
    }

    public boolean isRunning() {
        lock.lock();
        try {
            return running;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Computes every job's first fire and starts the timer thread.
     *
     * @throws IllegalStateException if already running
     */
    public void start() {
        lock.lock();
        try {
            if (running) {
                throw new IllegalStateException("Periodic scheduler already running");
            }
            running = true;
            long gen = ++generation;
            Instant now = clock.instant();
            for (Entry entry : entries.values()) {
                entry.nextRunAt = firstFire(entry.job, now);
            }
            thread = threadFactory.newThread(() -> loop(gen));
            thread.start();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stops the timer thread, waiting for an insertion in progress to finish.
     */
    public void stop() {
        Thread current;
        lock.lock();
        try {
            if (!running) {
                return;
            }
            running = false;
            current = thread;
            thread = null;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
        if (current != null && current != Thread.currentThread()) {
            try {
                current.join(STOP_JOIN_TIMEOUT_MS);
                if (current.isAlive()) {
                    logger.warning("Periodic scheduler thread did not stop within "
                        + STOP_JOIN_TIMEOUT_MS + " ms");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Stops and removes every periodic job.
     */
    @Override
    public void close() {
        stop();
        clear();
    }

    private static Instant firstFire(PeriodicJob job, Instant now) {
        return job.runOnStart() ? now : job.schedule().next(now);
    }

    private boolean active(long gen) {
        return running && generation == gen;
    }

    private void loop(long gen) {
        while (true) {
            List<Entry> due = new ArrayList<>();
            lock.lock();
            try {
                while (due.isEmpty()) {
                    if (!active(gen)) {
                        return;
                    }
                    Instant now = clock.instant();
                    Instant nearest = null;
                    for (Entry entry : entries.values()) {
                        Instant at = entry.nextRunAt;
                        if (at == null) {
                            continue;
                        }
                        if (!at.isAfter(now)) {
                            due.add(entry);
                        } else if (nearest == null || at.isBefore(nearest)) {
                            nearest = at;
                        }
                    }
                    if (!due.isEmpty()) {
                        break;
                    }
                    if (nearest == null) {
                        changed.await();
                    } else {
                        changed.awaitNanos(Math.max(1, Duration.between(now, nearest).toNanos()));
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } finally {
                lock.unlock();
            }
            for (Entry entry : due) {
                fire(entry, gen);
            }
        }
    }

    private void fire(Entry entry, long gen) {
        Instant planned;
        lock.lock();
        try {
            if (!active(gen) || entries.get(entry.handle) != entry) {
                return;
            }
            planned = entry.nextRunAt;
        } finally {
            lock.unlock();
        }

        try {
            JobArgs args = entry.job.constructor().get();
            if (args != null) {
                inserter.insert(args, entry.job.opts());
            }
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Periodic job " + entry.handle.value() + " failed to insert", e);
        }

        lock.lock();
        try {
            if (entries.get(entry.handle) == entry) {
                Instant now = clock.instant();
                Instant next = entry.job.schedule().next(planned);
                if (next != null && !next.isAfter(now)) {
                    next = entry.job.schedule().next(now);
                }
                entry.nextRunAt = next;
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Writes one job row for a periodic fire.
     */
    @FunctionalInterface
    public interface Inserter {
        void insert(JobArgs args, InsertOpts opts);
    }

    private static final class Entry {
        final PeriodicJobHandle handle;
        final PeriodicJob job;
        Instant nextRunAt;

        Entry(PeriodicJobHandle handle, PeriodicJob job) {
            this.handle = handle;
            this.job = job;
        }
    }
}
