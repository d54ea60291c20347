package io.jobqueue.maintenance;

import io.jobqueue.JobStoreException;
import io.jobqueue.model.JobRow;
import io.jobqueue.model.JobState;
import io.jobqueue.spi.ConnectionProvider;
import io.jobqueue.spi.JobStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;

/**
 * Read-only view of discarded jobs. Discarded rows keep their last error and are never
 * deleted by the engine.
 *
 * @see JobStore#queryByState
 * @see JobStore#countByState
 */
public final class DiscardedJobs {
    private final ConnectionProvider connectionProvider;
    private final JobStore jobStore;

    public DiscardedJobs(ConnectionProvider connectionProvider, JobStore jobStore) {
        this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore");
    }

    /**
     * Queries discarded jobs, oldest first.
     *
     * @param kind optional kind filter ({@code null} for all)
     */
    public List<JobRow> query(String kind, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0");
        }
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            return jobStore.queryByState(conn, JobState.DISCARDED, kind, limit);
        } catch (SQLException e) {
            throw new JobStoreException("Failed to query discarded jobs", e);
        }
    }

    /**
     * @param kind optional kind filter ({@code null} for all)
     */
    public int count(String kind) {
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            return jobStore.countByState(conn, JobState.DISCARDED, kind);
        } catch (SQLException e) {
            throw new JobStoreException("Failed to count discarded jobs", e);
        }
    }
}
