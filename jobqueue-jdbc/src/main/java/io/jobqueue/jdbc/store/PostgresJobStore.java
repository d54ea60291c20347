package io.jobqueue.jdbc.store;

import io.jobqueue.jdbc.JdbcTemplate;
import io.jobqueue.model.JobRow;
import io.jobqueue.model.JobState;

import java.sql.Connection;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * PostgreSQL job store.
 *
 * <p>Uses {@code FOR UPDATE SKIP LOCKED} with {@code RETURNING} for
 * single-round-trip claim.
 */
public final class PostgresJobStore extends AbstractJdbcJobStore {

    public PostgresJobStore() {
        super();
    }

    public PostgresJobStore(String tableName) {
        super(tableName);
    }

    @Override
    public String name() {
        return "postgresql";
    }

    @Override
    public List<String> jdbcUrlPrefixes() {
        return List.of("jdbc:postgresql:");
    }

    @Override
    public AbstractJdbcJobStore withTableName(String tableName) {
        return new PostgresJobStore(tableName);
    }

    @Override
    public List<JobRow> claim(Connection conn, String queue, String claimer, Instant now, int limit) {
        String sql = "UPDATE " + tableName() +
            " SET state=" + JobState.RUNNING.code() + ", attempt=attempt+1, attempted_at=?, attempted_by=?" +
            " WHERE id IN (" +
            "SELECT id FROM " + tableName() +
            " WHERE queue=? AND state=" + JobState.AVAILABLE.code() + " AND scheduled_at<=? " +
            CLAIM_ORDER + " LIMIT ? FOR UPDATE SKIP LOCKED" +
            ") RETURNING " + COLUMNS;
        List<JobRow> claimed = new ArrayList<>(JdbcTemplate.updateReturning(conn, sql, ROW_MAPPER,
            JdbcTemplate.timestamp(now), claimer, queue, JdbcTemplate.timestamp(now), limit));
        // RETURNING order is unspecified
        claimed.sort(CLAIM_ORDER_COMPARATOR);
        return claimed;
    }
}
