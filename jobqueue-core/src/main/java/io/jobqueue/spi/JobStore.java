package io.jobqueue.spi;

import io.jobqueue.JobConflictException;
import io.jobqueue.model.JobInsert;
import io.jobqueue.model.JobRow;
import io.jobqueue.model.JobState;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for job rows.
 *
 * <p>All methods receive an explicit {@link Connection} so the caller controls transaction
 * boundaries. Transitions out of {@code RUNNING} are guarded by the claim that produced
 * them ({@code attempted_by} and {@code attempt}); when the guard matches no row the method
 * throws {@link JobConflictException}. Implementations live in the {@code jobqueue-jdbc}
 * module.
 *
 * @see io.jobqueue.jdbc.store.AbstractJdbcJobStore
 */
public interface JobStore {

    /**
     * Inserts a row in state {@code AVAILABLE}.
     *
     * @param conn the JDBC connection (typically within a transaction)
     * @param job  the resolved row
     */
    void insert(Connection conn, JobInsert job);

    /**
     * Inserts multiple rows. Default loops {@link #insert}.
     */
    default void insertBatch(Connection conn, List<JobInsert> jobs) {
        for (JobInsert job : jobs) {
            insert(conn, job);
        }
    }

    /**
     * Claims up to {@code limit} available rows of {@code queue} whose scheduled time has
     * arrived, in {@code priority, scheduled_at, id} order. Claimed rows become
     * {@code RUNNING} with {@code attempt + 1}, {@code attempted_at = now} and
     * {@code attempted_by = claimer}. Rows locked by a concurrent claimer are skipped,
     * never waited on.
     *
     * @param conn    connection with auto-commit disabled; the caller commits
     * @param queue   queue name
     * @param claimer identifier of the claiming process
     * @param now     current time
     * @param limit   maximum rows to claim
     * @return the claimed rows, in claim order
     */
    List<JobRow> claim(Connection conn, String queue, String claimer, Instant now, int limit);

    /**
     * {@code RUNNING → COMPLETED}.
     *
     * @param outputJson recorded handler output, may be {@code null}
     * @throws JobConflictException if the row is not running under this claim
     */
    void complete(Connection conn, String id, String claimer, int attempt, Instant now, String outputJson);

    /**
     * {@code RUNNING → AVAILABLE} at {@code nextAt}, keeping the consumed attempt.
     *
     * @throws JobConflictException if the row is not running under this claim
     */
    void retry(Connection conn, String id, String claimer, int attempt, Instant nextAt, String error);

    /**
     * {@code RUNNING → AVAILABLE} at {@code nextAt}, giving back the consumed attempt.
     *
     * @throws JobConflictException if the row is not running under this claim
     */
    void snooze(Connection conn, String id, String claimer, int attempt, Instant nextAt);

    /**
     * {@code RUNNING → DISCARDED}.
     *
     * @throws JobConflictException if the row is not running under this claim
     */
    void discard(Connection conn, String id, String claimer, int attempt, Instant now, String error);

    /**
     * Resets {@code RUNNING} rows claimed before {@code expiredBefore}: back to
     * {@code AVAILABLE} (scheduled at {@code now}) when attempts remain, otherwise to
     * {@code DISCARDED}.
     *
     * @return the number of rows rescued or discarded
     */
    int rescueExpired(Connection conn, Instant now, Instant expiredBefore);

    /**
     * Lists available rows of a queue that are ready at {@code now}, in claim order,
     * without locking them.
     */
    List<JobRow> listReady(Connection conn, String queue, Instant now, int limit);

    Optional<JobRow> findById(Connection conn, String id);

    /**
     * Queries rows by state, oldest first.
     *
     * @param kind optional kind filter ({@code null} for all)
     */
    List<JobRow> queryByState(Connection conn, JobState state, String kind, int limit);

    /**
     * Counts rows by state.
     *
     * @param kind optional kind filter ({@code null} for all)
     */
    int countByState(Connection conn, JobState state, String kind);

    /**
     * Verifies that the job table is reachable.
     *
     * @throws io.jobqueue.JobStoreException if it is not
     */
    void ping(Connection conn);
}
