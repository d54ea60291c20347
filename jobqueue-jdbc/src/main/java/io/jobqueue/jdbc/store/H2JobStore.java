package io.jobqueue.jdbc.store;

import java.util.List;

/**
 * H2 job store. Primarily for tests and embedded use.
 *
 * <p>Uses the default select-then-compare-and-set claim from {@link AbstractJdbcJobStore}
 * with {@code FOR UPDATE SKIP LOCKED} on the candidate select, so a claimer passes over rows
 * held by another open claim instead of waiting on them.
 */
public final class H2JobStore extends AbstractJdbcJobStore {

    public H2JobStore() {
        super();
    }

    public H2JobStore(String tableName) {
        super(tableName);
    }

    @Override
    public String name() {
        return "h2";
    }

    @Override
    public List<String> jdbcUrlPrefixes() {
        return List.of("jdbc:h2:");
    }

    @Override
    public AbstractJdbcJobStore withTableName(String tableName) {
        return new H2JobStore(tableName);
    }

    @Override
    protected String claimLockClause() {
        return " FOR UPDATE SKIP LOCKED";
    }
}
