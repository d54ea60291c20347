package io.jobqueue.jdbc.tx;

import io.jobqueue.spi.TxContext;

import java.sql.Connection;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link TxContext} that keeps the current transaction in a {@link ThreadLocal}.
 *
 * <p>Bound and cleared by {@link JdbcTransactionManager}; callbacks registered with
 * {@link #afterCommit} run on the committing thread once the commit succeeded.
 *
 * @see JdbcTransactionManager
 */
public final class ThreadLocalTxContext implements TxContext {
    private final ThreadLocal<TxState> state = new ThreadLocal<>();

    @Override
    public boolean isTransactionActive() {
        return state.get() != null;
    }

    @Override
    public Connection currentConnection() {
        return current().connection;
    }

    @Override
    public void afterCommit(Runnable callback) {
        current().afterCommit.add(callback);
    }

    @Override
    public void afterRollback(Runnable callback) {
        current().afterRollback.add(callback);
    }

    void bind(Connection connection) {
        if (state.get() != null) {
            throw new IllegalStateException("Transaction already active on this thread");
        }
        state.set(new TxState(connection));
    }

    void completeCommitted() {
        complete(true);
    }

    void completeRolledBack() {
        complete(false);
    }

    private TxState current() {
        TxState current = state.get();
        if (current == null) {
            throw new IllegalStateException("No active transaction");
        }
        return current;
    }

    private void complete(boolean committed) {
        TxState current = state.get();
        if (current == null) {
            return;
        }
        state.remove();
        RuntimeException first = null;
        for (Runnable callback : committed ? current.afterCommit : current.afterRollback) {
            try {
                callback.run();
            } catch (RuntimeException e) {
                if (first == null) first = e;
                else first.addSuppressed(e);
            }
        }
        if (first != null) {
            throw first;
        }
    }

    private static final class TxState {
        private final Connection connection;
        private final List<Runnable> afterCommit = new ArrayList<>();
        private final List<Runnable> afterRollback = new ArrayList<>();

        private TxState(Connection connection) {
            this.connection = connection;
        }
    }
}
