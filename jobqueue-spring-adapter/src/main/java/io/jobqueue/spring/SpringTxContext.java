package io.jobqueue.spring;

import io.jobqueue.spi.TxContext;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.Objects;

/**
 * {@link TxContext} backed by Spring's {@link TransactionSynchronizationManager}.
 *
 * <p>{@link io.jobqueue.JobClient#insertTx} writes through the connection Spring bound to the
 * current transaction ({@link DataSourceUtils#getConnection}), so the job row commits or rolls
 * back with the caller's own writes. The {@code DataSource} must be the one the transaction
 * manager uses.
 *
 * @see TxContext
 */
public final class SpringTxContext implements TxContext {
    private final DataSource dataSource;

    public SpringTxContext(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    }

    public DataSource dataSource() {
        return dataSource;
    }

    @Override
    public boolean isTransactionActive() {
        return TransactionSynchronizationManager.isActualTransactionActive();
    }

    @Override
    public Connection currentConnection() {
        requireActive();
        return DataSourceUtils.getConnection(dataSource);
    }

    @Override
    public void afterCommit(Runnable callback) {
        register(callback, true, "afterCommit");
    }

    @Override
    public void afterRollback(Runnable callback) {
        register(callback, false, "afterRollback");
    }

    private void register(Runnable callback, boolean onCommit, String operation) {
        Objects.requireNonNull(callback, "callback");
        requireActive();
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            throw new IllegalStateException(
                "Transaction synchronization is not active; cannot register " + operation + " callback");
        }
        TransactionSynchronizationManager.registerSynchronization(new CallbackSynchronization(callback, onCommit));
    }

    private void requireActive() {
        if (!isTransactionActive()) {
            throw new IllegalStateException("No active transaction");
        }
    }

    private static final class CallbackSynchronization implements TransactionSynchronization {
        private final Runnable callback;
        private final boolean onCommit;

        private CallbackSynchronization(Runnable callback, boolean onCommit) {
            this.callback = callback;
            this.onCommit = onCommit;
        }

        @Override
        public void afterCommit() {
            if (onCommit) {
                callback.run();
            }
        }

        @Override
        public void afterCompletion(int status) {
            if (!onCommit && status == STATUS_ROLLED_BACK) {
                callback.run();
            }
        }
    }
}
