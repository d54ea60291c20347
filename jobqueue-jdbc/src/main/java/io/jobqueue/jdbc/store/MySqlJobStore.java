package io.jobqueue.jdbc.store;

import java.util.List;

/**
 * MySQL job store. Also compatible with TiDB.
 *
 * <p>Locks candidate rows with {@code FOR UPDATE SKIP LOCKED} (MySQL 8.0+), so concurrent
 * claimers pass over each other's rows instead of waiting on them.
 */
public final class MySqlJobStore extends AbstractJdbcJobStore {

    public MySqlJobStore() {
        super();
    }

    public MySqlJobStore(String tableName) {
        super(tableName);
    }

    @Override
    public String name() {
        return "mysql";
    }

    @Override
    public List<String> jdbcUrlPrefixes() {
        return List.of("jdbc:mysql:", "jdbc:tidb:");
    }

    @Override
    public AbstractJdbcJobStore withTableName(String tableName) {
        return new MySqlJobStore(tableName);
    }

    @Override
    protected String claimLockClause() {
        return " FOR UPDATE SKIP LOCKED";
    }
}
