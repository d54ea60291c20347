package io.jobqueue.jdbc.tx;

import io.jobqueue.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Transaction manager for plain JDBC. Obtains a connection, disables auto-commit and binds
 * it to a {@link ThreadLocalTxContext} so {@code JobClient.insertTx} joins the transaction.
 *
 * <pre>{@code
 * try (var tx = txManager.begin()) {
 *     orders.save(tx.connection(), order);
 *     client.insertTx(new ShipOrderArgs(order.id()));
 *     tx.commit();
 * }
 * }</pre>
 *
 * @see ThreadLocalTxContext
 */
public final class JdbcTransactionManager {
    private final ConnectionProvider connectionProvider;
    private final ThreadLocalTxContext txContext;

    public JdbcTransactionManager(ConnectionProvider connectionProvider, ThreadLocalTxContext txContext) {
        this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
        this.txContext = Objects.requireNonNull(txContext, "txContext");
    }

    /**
     * Begins a transaction on the calling thread.
     *
     * @return a handle to use with try-with-resources
     * @throws SQLException if a connection cannot be obtained
     */
    public Transaction begin() throws SQLException {
        Connection connection = connectionProvider.getConnection();
        try {
            connection.setAutoCommit(false);
            txContext.bind(connection);
        } catch (SQLException | RuntimeException e) {
            connection.close();
            throw e;
        }
        return new Transaction(connection, txContext);
    }

    /**
     * Runs {@code work} in a transaction, committing if it returns normally and rolling back
     * if it throws.
     */
    public <T> T inTransaction(TxWork<T> work) throws SQLException {
        try (Transaction tx = begin()) {
            T result = work.execute(tx.connection());
            tx.commit();
            return result;
        }
    }

    @FunctionalInterface
    public interface TxWork<T> {
        T execute(Connection connection) throws SQLException;
    }

    /**
     * An active transaction. {@link #close()} rolls back unless {@link #commit()} or
     * {@link #rollback()} was called.
     */
    public static final class Transaction implements AutoCloseable {
        private final Connection connection;
        private final ThreadLocalTxContext txContext;
        private boolean completed;

        private Transaction(Connection connection, ThreadLocalTxContext txContext) {
            this.connection = connection;
            this.txContext = txContext;
        }

        public Connection connection() {
            return connection;
        }

        public void commit() throws SQLException {
            if (completed) {
                return;
            }
            try {
                connection.commit();
            } catch (SQLException e) {
                try {
                    connection.rollback();
                } catch (SQLException re) {
                    e.addSuppressed(re);
                }
                finish(false, e);
                throw e;
            }
            finish(true, null);
        }

        public void rollback() throws SQLException {
            if (completed) {
                return;
            }
            try {
                connection.rollback();
            } catch (SQLException e) {
                finish(false, e);
                throw e;
            }
            finish(false, null);
        }

        @Override
        public void close() throws SQLException {
            if (!completed) {
                rollback();
            }
        }

        private void finish(boolean committed, SQLException pending) throws SQLException {
            completed = true;
            SQLException resetFailure = null;
            try {
                connection.setAutoCommit(true);
            } catch (SQLException e) {
                resetFailure = e;
            }
            SQLException closeFailure = null;
            try {
                connection.close();
            } catch (SQLException e) {
                closeFailure = e;
            }
            RuntimeException callbackFailure = null;
            try {
                if (committed) {
                    txContext.completeCommitted();
                } else {
                    txContext.completeRolledBack();
                }
            } catch (RuntimeException e) {
                callbackFailure = e;
            }

            Exception primary = pending != null ? pending : callbackFailure;
            if (primary == null) {
                primary = closeFailure;
            }
            if (primary == null) {
                return;
            }
            for (Exception secondary : new Exception[]{resetFailure, closeFailure, callbackFailure}) {
                if (secondary != null && secondary != primary) {
                    primary.addSuppressed(secondary);
                }
            }
            if (primary == pending) {
                return;
            }
            if (primary instanceof RuntimeException re) {
                throw re;
            }
            throw (SQLException) primary;
        }
    }
}
