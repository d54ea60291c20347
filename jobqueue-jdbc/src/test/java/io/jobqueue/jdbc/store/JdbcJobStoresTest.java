package io.jobqueue.jdbc.store;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JdbcJobStoresTest {

    @Test
    void allReturnsBuiltInStores() {
        List<AbstractJdbcJobStore> stores = JdbcJobStores.all();

        assertTrue(stores.size() >= 3);
        assertTrue(stores.stream().anyMatch(s -> s.name().equals("mysql")));
        assertTrue(stores.stream().anyMatch(s -> s.name().equals("postgresql")));
        assertTrue(stores.stream().anyMatch(s -> s.name().equals("h2")));
    }

    @Test
    void getByNameIsCaseInsensitive() {
        assertInstanceOf(MySqlJobStore.class, JdbcJobStores.get("MySQL"));
        assertInstanceOf(PostgresJobStore.class, JdbcJobStores.get("POSTGRESQL"));
        assertInstanceOf(H2JobStore.class, JdbcJobStores.get("h2"));
    }

    @Test
    void getByNameThrowsForUnknown() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
            () -> JdbcJobStores.get("oracle"));
        assertTrue(ex.getMessage().contains("Unknown job store"));
        assertTrue(ex.getMessage().contains("oracle"));
    }

    @Test
    void detectFromJdbcUrl() {
        assertEquals("mysql", JdbcJobStores.detect("jdbc:mysql://localhost:3306/mydb").name());
        assertEquals("mysql", JdbcJobStores.detect("jdbc:tidb://localhost:4000/mydb").name());
        assertEquals("postgresql", JdbcJobStores.detect("jdbc:postgresql://localhost:5432/mydb").name());
        assertEquals("h2", JdbcJobStores.detect("JDBC:H2:mem:test").name());
    }

    @Test
    void detectFromJdbcUrlRejectsUnknownOrEmpty() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
            () -> JdbcJobStores.detect("jdbc:oracle:thin:@localhost:1521:xe"));
        assertTrue(ex.getMessage().contains("No job store found"));
        assertThrows(IllegalArgumentException.class, () -> JdbcJobStores.detect((String) null));
        assertThrows(IllegalArgumentException.class, () -> JdbcJobStores.detect(""));
    }

    @Test
    void detectFromDataSource() {
        JdbcDataSource ds = new JdbcDataSource();
        ds.setURL("jdbc:h2:mem:job_store_detect;DB_CLOSE_DELAY=-1");

        assertEquals("h2", JdbcJobStores.detect(ds).name());
    }

    @Test
    void withTableNameKeepsStoreKind() {
        AbstractJdbcJobStore store = JdbcJobStores.get("postgresql").withTableName("billing_job");

        assertInstanceOf(PostgresJobStore.class, store);
        assertEquals("billing_job", store.tableName());
        assertEquals("jobqueue_job", JdbcJobStores.get("postgresql").tableName());
        assertThrows(IllegalArgumentException.class, () -> store.withTableName("bad-name"));
    }

    @Test
    void truncateErrorCapsLength() {
        assertEquals(null, AbstractJdbcJobStore.truncateError(null));
        assertEquals("short", AbstractJdbcJobStore.truncateError("short"));
        String truncated = AbstractJdbcJobStore.truncateError("e".repeat(5000));
        assertEquals(AbstractJdbcJobStore.MAX_ERROR_LENGTH, truncated.length());
        assertTrue(truncated.endsWith("..."));
    }
}
