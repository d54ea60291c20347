package io.jobqueue;

import io.jobqueue.model.JobInsert;
import io.jobqueue.model.JobRow;
import io.jobqueue.model.JobState;
import io.jobqueue.spi.ConnectionProvider;
import io.jobqueue.spi.JobStore;

import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * JobStore kept in memory with the same transition rules as the JDBC stores, for tests
 * that don't need a database. Connections are ignored.
 */
public class InMemoryJobStore implements JobStore {
    private static final Comparator<JobRow> CLAIM_ORDER = Comparator
        .comparingInt(JobRow::priority)
        .thenComparing(JobRow::scheduledAt)
        .thenComparing(JobRow::id);

    private final Map<String, JobRow> rows = new LinkedHashMap<>();

    public final AtomicInteger claimCalls = new AtomicInteger();
    public final AtomicInteger failingClaims = new AtomicInteger();
    public final AtomicInteger conflicts = new AtomicInteger();

    public static ConnectionProvider connections() {
        return InMemoryJobStore::connection;
    }

    /** A connection whose every method is a no-op returning {@code null}. */
    public static Connection connection() {
        return (Connection) Proxy.newProxyInstance(
            Connection.class.getClassLoader(),
            new Class<?>[]{Connection.class},
            (proxy, method, args) -> null);
    }

    @Override
    public synchronized void insert(Connection conn, JobInsert job) {
        rows.put(job.id(), new JobRow(job.id(), job.kind(), job.argsJson(), job.queue(),
            JobState.AVAILABLE, job.priority(), job.scheduledAt(), 0, job.maxAttempts(),
            null, job.createdAt(), null, null, null, null));
    }

    @Override
    public synchronized List<JobRow> claim(Connection conn, String queue, String claimer, Instant now, int limit) {
        claimCalls.incrementAndGet();
        if (failingClaims.get() > 0) {
            failingClaims.decrementAndGet();
            throw new JobStoreException("simulated claim failure", null);
        }
        List<JobRow> ready = readyRows(queue, now, limit);
        List<JobRow> claimed = new ArrayList<>(ready.size());
        for (JobRow r : ready) {
            JobRow running = new JobRow(r.id(), r.kind(), r.argsJson(), r.queue(), JobState.RUNNING,
                r.priority(), r.scheduledAt(), r.attempt() + 1, r.maxAttempts(), r.lastError(),
                r.createdAt(), now, claimer, null, null);
            rows.put(r.id(), running);
            claimed.add(running);
        }
        return claimed;
    }

    @Override
    public synchronized void complete(Connection conn, String id, String claimer, int attempt, Instant now,
                                      String outputJson) {
        JobRow r = owned(id, claimer, attempt, "complete");
        rows.put(id, r.withCompleted(now, outputJson));
    }

    @Override
    public synchronized void retry(Connection conn, String id, String claimer, int attempt, Instant nextAt,
                                   String error) {
        JobRow r = owned(id, claimer, attempt, "retry");
        rows.put(id, r.withRetry(nextAt, error));
    }

    @Override
    public synchronized void snooze(Connection conn, String id, String claimer, int attempt, Instant nextAt) {
        JobRow r = owned(id, claimer, attempt, "snooze");
        rows.put(id, r.withSnooze(nextAt));
    }

    @Override
    public synchronized void discard(Connection conn, String id, String claimer, int attempt, Instant now,
                                     String error) {
        JobRow r = owned(id, claimer, attempt, "discard");
        rows.put(id, r.withDiscarded(now, error));
    }

    @Override
    public synchronized int rescueExpired(Connection conn, Instant now, Instant expiredBefore) {
        int rescued = 0;
        for (JobRow r : new ArrayList<>(rows.values())) {
            if (r.state() != JobState.RUNNING || !r.attemptedAt().isBefore(expiredBefore)) {
                continue;
            }
            rows.put(r.id(), r.hasAttemptsLeft()
                ? r.withRetry(now, "lease expired")
                : r.withDiscarded(now, "lease expired"));
            rescued++;
        }
        return rescued;
    }

    @Override
    public synchronized List<JobRow> listReady(Connection conn, String queue, Instant now, int limit) {
        return readyRows(queue, now, limit);
    }

    @Override
    public synchronized Optional<JobRow> findById(Connection conn, String id) {
        return Optional.ofNullable(rows.get(id));
    }

    @Override
    public synchronized List<JobRow> queryByState(Connection conn, JobState state, String kind, int limit) {
        return rows.values().stream()
            .filter(r -> r.state() == state && (kind == null || kind.equals(r.kind())))
            .sorted(Comparator.comparing(JobRow::id))
            .limit(limit)
            .toList();
    }

    @Override
    public synchronized int countByState(Connection conn, JobState state, String kind) {
        return queryByState(conn, state, kind, Integer.MAX_VALUE).size();
    }

    @Override
    public void ping(Connection conn) {
    }

    public synchronized JobRow get(String id) {
        return rows.get(id);
    }

    public synchronized List<JobRow> all() {
        return List.copyOf(rows.values());
    }

    /** Overwrites a row, e.g. to age its claim. */
    public synchronized void put(JobRow row) {
        rows.put(row.id(), row);
    }

    private List<JobRow> readyRows(String queue, Instant now, int limit) {
        return rows.values().stream()
            .filter(r -> r.state() == JobState.AVAILABLE && r.queue().equals(queue)
                && !r.scheduledAt().isAfter(now))
            .sorted(CLAIM_ORDER)
            .limit(limit)
            .toList();
    }

    private JobRow owned(String id, String claimer, int attempt, String transition) {
        JobRow r = rows.get(id);
        if (r == null || r.state() != JobState.RUNNING || !claimer.equals(r.attemptedBy())
                || r.attempt() != attempt) {
            conflicts.incrementAndGet();
            throw new JobConflictException(id, transition);
        }
        return r;
    }
}
