package io.jobqueue.jdbc.tx;

import io.jobqueue.jdbc.DataSourceConnectionProvider;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JdbcTransactionManagerTest {
    private JdbcDataSource dataSource;
    private ThreadLocalTxContext txContext;
    private JdbcTransactionManager txManager;

    @BeforeEach
    void setUp() throws SQLException {
        dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:txmgr_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        txContext = new ThreadLocalTxContext();
        txManager = new JdbcTransactionManager(new DataSourceConnectionProvider(dataSource), txContext);

        try (Connection conn = dataSource.getConnection(); Statement st = conn.createStatement()) {
            st.execute("CREATE TABLE test_data (id INT PRIMARY KEY, val VARCHAR(100))");
        }
    }

    @Test
    void constructorRejectsNulls() {
        assertThrows(NullPointerException.class, () -> new JdbcTransactionManager(null, txContext));
        assertThrows(NullPointerException.class,
            () -> new JdbcTransactionManager(new DataSourceConnectionProvider(dataSource), null));
    }

    @Test
    void commitPersistsAndRunsCommitCallbacks() throws Exception {
        AtomicBoolean committed = new AtomicBoolean();
        AtomicBoolean rolledBack = new AtomicBoolean();

        try (var tx = txManager.begin()) {
            assertTrue(txContext.isTransactionActive());
            assertSame(tx.connection(), txContext.currentConnection());
            insert(txContext.currentConnection(), 1, "hello");
            txContext.afterCommit(() -> committed.set(true));
            txContext.afterRollback(() -> rolledBack.set(true));
            tx.commit();
            tx.commit();
        }

        assertEquals("hello", queryValue(1));
        assertTrue(committed.get());
        assertFalse(rolledBack.get());
        assertFalse(txContext.isTransactionActive());
    }

    @Test
    void rollbackDiscardsAndRunsRollbackCallbacks() throws Exception {
        AtomicBoolean committed = new AtomicBoolean();
        AtomicBoolean rolledBack = new AtomicBoolean();

        try (var tx = txManager.begin()) {
            insert(tx.connection(), 1, "hello");
            txContext.afterCommit(() -> committed.set(true));
            txContext.afterRollback(() -> rolledBack.set(true));
            tx.rollback();
        }

        assertNull(queryValue(1));
        assertFalse(committed.get());
        assertTrue(rolledBack.get());
    }

    @Test
    void closeRollsBackWhenNotCompleted() throws Exception {
        Connection captured;
        try (var tx = txManager.begin()) {
            captured = tx.connection();
            insert(captured, 1, "hello");
        }

        assertNull(queryValue(1));
        assertTrue(captured.isClosed());
        assertFalse(txContext.isTransactionActive());
    }

    @Test
    void nestedBeginOnSameThreadIsRejected() throws Exception {
        try (var tx = txManager.begin()) {
            assertThrows(IllegalStateException.class, txManager::begin);
            tx.commit();
        }
    }

    @Test
    void afterCommitCallbackExceptionPropagatesAfterCommit() throws Exception {
        RuntimeException first = new RuntimeException("first");
        RuntimeException second = new RuntimeException("second");

        RuntimeException thrown = assertThrows(RuntimeException.class, () -> {
            try (var tx = txManager.begin()) {
                insert(tx.connection(), 1, "kept");
                txContext.afterCommit(() -> {
                    throw first;
                });
                txContext.afterCommit(() -> {
                    throw second;
                });
                tx.commit();
            }
        });

        assertSame(first, thrown);
        assertSame(second, thrown.getSuppressed()[0]);
        assertEquals("kept", queryValue(1));
        assertFalse(txContext.isTransactionActive());
    }

    @Test
    void commitFailureRethrowsAndUnbinds() throws Exception {
        try (var tx = txManager.begin()) {
            insert(tx.connection(), 1, "hello");
            tx.connection().close();

            assertThrows(SQLException.class, tx::commit);
        }

        assertFalse(txContext.isTransactionActive());
    }

    @Test
    void inTransactionCommitsResult() throws Exception {
        int inserted = txManager.inTransaction(conn -> insert(conn, 7, "seven"));

        assertEquals(1, inserted);
        assertEquals("seven", queryValue(7));
    }

    @Test
    void inTransactionRollsBackOnFailure() throws Exception {
        assertThrows(IllegalStateException.class, () -> txManager.inTransaction(conn -> {
            insert(conn, 8, "eight");
            throw new IllegalStateException("abort");
        }));

        assertFalse(txContext.isTransactionActive());
        assertNull(queryValue(8));
    }

    private static int insert(Connection conn, int id, String val) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("INSERT INTO test_data (id, val) VALUES (?, ?)")) {
            ps.setInt(1, id);
            ps.setString(2, val);
            return ps.executeUpdate();
        }
    }

    private String queryValue(int id) throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement("SELECT val FROM test_data WHERE id = ?")) {
            ps.setInt(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getString(1) : null;
            }
        }
    }
}
