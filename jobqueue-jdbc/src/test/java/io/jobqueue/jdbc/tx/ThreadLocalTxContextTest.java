package io.jobqueue.jdbc.tx;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ThreadLocalTxContextTest {
    private final ThreadLocalTxContext ctx = new ThreadLocalTxContext();

    @AfterEach
    void tearDown() {
        ctx.completeRolledBack();
    }

    @Test
    void inactiveByDefault() {
        assertFalse(ctx.isTransactionActive());
        assertThrows(IllegalStateException.class, ctx::currentConnection);
        assertThrows(IllegalStateException.class, () -> ctx.afterCommit(() -> {}));
    }

    @Test
    void bindExposesConnection() {
        Connection conn = stubConnection();
        ctx.bind(conn);

        assertTrue(ctx.isTransactionActive());
        assertSame(conn, ctx.currentConnection());
        assertThrows(IllegalStateException.class, () -> ctx.bind(conn));
    }

    @Test
    void commitRunsCommitCallbacksInOrder() {
        List<String> calls = new ArrayList<>();
        ctx.bind(stubConnection());
        ctx.afterCommit(() -> calls.add("first"));
        ctx.afterCommit(() -> calls.add("second"));
        ctx.afterRollback(() -> calls.add("rollback"));

        ctx.completeCommitted();

        assertEquals(List.of("first", "second"), calls);
        assertFalse(ctx.isTransactionActive());
    }

    @Test
    void rollbackRunsOnlyRollbackCallbacks() {
        List<String> calls = new ArrayList<>();
        ctx.bind(stubConnection());
        ctx.afterCommit(() -> calls.add("commit"));
        ctx.afterRollback(() -> calls.add("rollback"));

        ctx.completeRolledBack();

        assertEquals(List.of("rollback"), calls);
    }

    @Test
    void failingCallbackDoesNotSkipOthers() {
        List<String> calls = new ArrayList<>();
        RuntimeException boom = new RuntimeException("boom");
        ctx.bind(stubConnection());
        ctx.afterCommit(() -> {
            throw boom;
        });
        ctx.afterCommit(() -> calls.add("after"));

        RuntimeException thrown = assertThrows(RuntimeException.class, ctx::completeCommitted);

        assertSame(boom, thrown);
        assertEquals(List.of("after"), calls);
        assertFalse(ctx.isTransactionActive());
    }

    @Test
    void contextIsPerThread() throws Exception {
        ctx.bind(stubConnection());
        boolean[] seenElsewhere = new boolean[1];

        Thread other = new Thread(() -> seenElsewhere[0] = ctx.isTransactionActive());
        other.start();
        other.join();

        assertFalse(seenElsewhere[0]);
    }

    private static Connection stubConnection() {
        return (Connection) Proxy.newProxyInstance(
            Connection.class.getClassLoader(), new Class<?>[]{Connection.class}, (proxy, method, args) -> null);
    }
}
