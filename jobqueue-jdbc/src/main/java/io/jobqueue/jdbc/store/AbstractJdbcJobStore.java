package io.jobqueue.jdbc.store;

import io.jobqueue.JobConflictException;
import io.jobqueue.jdbc.JdbcTemplate;
import io.jobqueue.jdbc.TableNames;
import io.jobqueue.model.JobInsert;
import io.jobqueue.model.JobRow;
import io.jobqueue.model.JobState;
import io.jobqueue.spi.JobStore;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Base JDBC job store with standard SQL implementations.
 *
 * <p>The default claim selects candidate rows in claim order, then moves each to
 * {@code RUNNING} with a compare-and-set update guarded by {@code state = AVAILABLE}; a row
 * taken by a concurrent claimer updates zero rows and is skipped. Subclasses add a row lock
 * clause via {@link #claimLockClause()} or replace {@link #claim} entirely.
 *
 * <p>Every transition out of {@code RUNNING} is guarded by the claimer id and attempt, so a
 * worker whose lease was rescued cannot overwrite the row; such writes raise
 * {@link JobConflictException}.
 *
 * <p>Register custom implementations via
 * {@code META-INF/services/io.jobqueue.jdbc.store.AbstractJdbcJobStore}.
 *
 * @see JdbcJobStores
 */
public abstract class AbstractJdbcJobStore implements JobStore {
    static final int MAX_ERROR_LENGTH = 4000;
    static final String LEASE_EXPIRED = "lease expired";

    protected static final String COLUMNS =
        "id, kind, args, queue, state, priority, scheduled_at, attempt, max_attempts, " +
        "last_error, created_at, attempted_at, attempted_by, finalized_at, output";

    protected static final String CLAIM_ORDER = "ORDER BY priority, scheduled_at, id";

    protected static final Comparator<JobRow> CLAIM_ORDER_COMPARATOR = Comparator
        .comparingInt(JobRow::priority)
        .thenComparing(JobRow::scheduledAt)
        .thenComparing(JobRow::id);

    protected static final JdbcTemplate.RowMapper<JobRow> ROW_MAPPER = rs -> new JobRow(
        rs.getString("id"),
        rs.getString("kind"),
        rs.getString("args"),
        rs.getString("queue"),
        JobState.fromCode(rs.getInt("state")),
        rs.getInt("priority"),
        JdbcTemplate.instant(rs, "scheduled_at"),
        rs.getInt("attempt"),
        rs.getInt("max_attempts"),
        rs.getString("last_error"),
        JdbcTemplate.instant(rs, "created_at"),
        JdbcTemplate.instant(rs, "attempted_at"),
        rs.getString("attempted_by"),
        JdbcTemplate.instant(rs, "finalized_at"),
        rs.getString("output"));

    private static final int AVAILABLE = JobState.AVAILABLE.code();
    private static final int RUNNING = JobState.RUNNING.code();

    private final String tableName;

    protected AbstractJdbcJobStore() {
        this(TableNames.DEFAULT_TABLE);
    }

    protected AbstractJdbcJobStore(String tableName) {
        this.tableName = TableNames.validate(tableName);
    }

    /**
     * Unique identifier for this store (e.g., "mysql", "postgresql", "h2").
     */
    public abstract String name();

    /**
     * JDBC URL prefixes this store handles (e.g., "jdbc:mysql:", "jdbc:tidb:").
     */
    public abstract List<String> jdbcUrlPrefixes();

    /**
     * Returns a store of the same kind operating on another table.
     */
    public abstract AbstractJdbcJobStore withTableName(String tableName);

    public String tableName() {
        return tableName;
    }

    /**
     * Suffix appended to the candidate SELECT of the default claim, e.g.
     * {@code " FOR UPDATE SKIP LOCKED"}. Empty by default.
     */
    protected String claimLockClause() {
        return "";
    }

    @Override
    public void insert(Connection conn, JobInsert job) {
        JdbcTemplate.update(conn, insertSql(), insertParams(job));
    }

    @Override
    public void insertBatch(Connection conn, List<JobInsert> jobs) {
        List<Object[]> rows = new ArrayList<>(jobs.size());
        for (JobInsert job : jobs) {
            rows.add(insertParams(job));
        }
        JdbcTemplate.batchUpdate(conn, insertSql(), rows);
    }

    private String insertSql() {
        return "INSERT INTO " + tableName() + " (" +
            "id, kind, args, queue, state, priority, scheduled_at, attempt, max_attempts, created_at" +
            ") VALUES (?,?,?,?," + AVAILABLE + ",?,?,0,?,?)";
    }

    private static Object[] insertParams(JobInsert job) {
        return new Object[]{
            job.id(), job.kind(), job.argsJson(), job.queue(), job.priority(),
            JdbcTemplate.timestamp(job.scheduledAt()), job.maxAttempts(),
            JdbcTemplate.timestamp(job.createdAt())};
    }

    @Override
    public List<JobRow> claim(Connection conn, String queue, String claimer, Instant now, int limit) {
        String selectSql = "SELECT " + COLUMNS + " FROM " + tableName() +
            " WHERE queue=? AND state=" + AVAILABLE + " AND scheduled_at<=? " +
            CLAIM_ORDER + " LIMIT ?" + claimLockClause();
        List<JobRow> candidates = JdbcTemplate.query(conn, selectSql, ROW_MAPPER,
            queue, JdbcTemplate.timestamp(now), limit);
        if (candidates.isEmpty()) {
            return List.of();
        }

        Timestamp attemptedAt = JdbcTemplate.timestamp(now);
        String claimSql = "UPDATE " + tableName() +
            " SET state=" + RUNNING + ", attempt=attempt+1, attempted_at=?, attempted_by=?" +
            " WHERE id=? AND state=" + AVAILABLE;
        List<JobRow> claimed = new ArrayList<>(candidates.size());
        for (JobRow row : candidates) {
            if (JdbcTemplate.update(conn, claimSql, attemptedAt, claimer, row.id()) == 1) {
                claimed.add(new JobRow(row.id(), row.kind(), row.argsJson(), row.queue(), JobState.RUNNING,
                    row.priority(), row.scheduledAt(), row.attempt() + 1, row.maxAttempts(), row.lastError(),
                    row.createdAt(), attemptedAt.toInstant(), claimer, null, null));
            }
        }
        return claimed;
    }

    @Override
    public void complete(Connection conn, String id, String claimer, int attempt, Instant now, String outputJson) {
        String sql = "UPDATE " + tableName() +
            " SET state=" + JobState.COMPLETED.code() + ", finalized_at=?, output=?" +
            ownedBy();
        expectOwned(JdbcTemplate.update(conn, sql,
            JdbcTemplate.timestamp(now), outputJson, id, claimer, attempt), id, "complete");
    }

    @Override
    public void retry(Connection conn, String id, String claimer, int attempt, Instant nextAt, String error) {
        String sql = "UPDATE " + tableName() +
            " SET state=" + AVAILABLE + ", scheduled_at=?, last_error=?" +
            ownedBy();
        expectOwned(JdbcTemplate.update(conn, sql,
            JdbcTemplate.timestamp(nextAt), truncateError(error), id, claimer, attempt), id, "retry");
    }

    @Override
    public void snooze(Connection conn, String id, String claimer, int attempt, Instant nextAt) {
        String sql = "UPDATE " + tableName() +
            " SET state=" + AVAILABLE + ", scheduled_at=?, attempt=attempt-1" +
            ownedBy();
        expectOwned(JdbcTemplate.update(conn, sql,
            JdbcTemplate.timestamp(nextAt), id, claimer, attempt), id, "snooze");
    }

    @Override
    public void discard(Connection conn, String id, String claimer, int attempt, Instant now, String error) {
        String sql = "UPDATE " + tableName() +
            " SET state=" + JobState.DISCARDED.code() + ", finalized_at=?, last_error=?" +
            ownedBy();
        expectOwned(JdbcTemplate.update(conn, sql,
            JdbcTemplate.timestamp(now), truncateError(error), id, claimer, attempt), id, "discard");
    }

    private static String ownedBy() {
        return " WHERE id=? AND state=" + RUNNING + " AND attempted_by=? AND attempt=?";
    }

    private static void expectOwned(int updated, String id, String transition) {
        if (updated == 0) {
            throw new JobConflictException(id, transition);
        }
    }

    @Override
    public int rescueExpired(Connection conn, Instant now, Instant expiredBefore) {
        Timestamp nowTs = JdbcTemplate.timestamp(now);
        Timestamp cutoff = JdbcTemplate.timestamp(expiredBefore);
        String discardSql = "UPDATE " + tableName() +
            " SET state=" + JobState.DISCARDED.code() + ", finalized_at=?, last_error=?" +
            " WHERE state=" + RUNNING + " AND attempted_at<? AND attempt>=max_attempts";
        int discarded = JdbcTemplate.update(conn, discardSql, nowTs, LEASE_EXPIRED, cutoff);
        String requeueSql = "UPDATE " + tableName() +
            " SET state=" + AVAILABLE + ", scheduled_at=?, last_error=?" +
            " WHERE state=" + RUNNING + " AND attempted_at<?";
        int requeued = JdbcTemplate.update(conn, requeueSql, nowTs, LEASE_EXPIRED, cutoff);
        return discarded + requeued;
    }

    @Override
    public List<JobRow> listReady(Connection conn, String queue, Instant now, int limit) {
        String sql = "SELECT " + COLUMNS + " FROM " + tableName() +
            " WHERE queue=? AND state=" + AVAILABLE + " AND scheduled_at<=? " +
            CLAIM_ORDER + " LIMIT ?";
        return JdbcTemplate.query(conn, sql, ROW_MAPPER, queue, JdbcTemplate.timestamp(now), limit);
    }

    @Override
    public Optional<JobRow> findById(Connection conn, String id) {
        String sql = "SELECT " + COLUMNS + " FROM " + tableName() + " WHERE id=?";
        List<JobRow> rows = JdbcTemplate.query(conn, sql, ROW_MAPPER, id);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    @Override
    public List<JobRow> queryByState(Connection conn, JobState state, String kind, int limit) {
        if (kind == null) {
            String sql = "SELECT " + COLUMNS + " FROM " + tableName() +
                " WHERE state=? ORDER BY created_at, id LIMIT ?";
            return JdbcTemplate.query(conn, sql, ROW_MAPPER, state.code(), limit);
        }
        String sql = "SELECT " + COLUMNS + " FROM " + tableName() +
            " WHERE state=? AND kind=? ORDER BY created_at, id LIMIT ?";
        return JdbcTemplate.query(conn, sql, ROW_MAPPER, state.code(), kind, limit);
    }

    @Override
    public int countByState(Connection conn, JobState state, String kind) {
        JdbcTemplate.RowMapper<Integer> count = rs -> rs.getInt(1);
        List<Integer> result = kind == null
            ? JdbcTemplate.query(conn, "SELECT COUNT(*) FROM " + tableName() + " WHERE state=?",
                count, state.code())
            : JdbcTemplate.query(conn, "SELECT COUNT(*) FROM " + tableName() + " WHERE state=? AND kind=?",
                count, state.code(), kind);
        return result.get(0);
    }

    @Override
    public void ping(Connection conn) {
        JdbcTemplate.query(conn, "SELECT COUNT(*) FROM " + tableName() + " WHERE 1=0", rs -> rs.getInt(1));
    }

    static String truncateError(String error) {
        if (error == null || error.length() <= MAX_ERROR_LENGTH) {
            return error;
        }
        return error.substring(0, MAX_ERROR_LENGTH - 3) + "...";
    }
}
