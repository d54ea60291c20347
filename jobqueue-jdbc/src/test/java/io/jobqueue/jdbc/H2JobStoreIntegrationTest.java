package io.jobqueue.jdbc;

import io.jobqueue.jdbc.store.AbstractJdbcJobStore;
import io.jobqueue.jdbc.store.H2JobStore;
import org.junit.jupiter.api.BeforeEach;

import javax.sql.DataSource;

class H2JobStoreIntegrationTest extends AbstractJobStoreIntegrationTest {

    private static final H2JobStore STORE = new H2JobStore();
    private DataSource dataSource;

    @BeforeEach
    void setUp() throws Exception {
        dataSource = Schemas.h2();
    }

    @Override
    DataSource dataSource() {
        return dataSource;
    }

    @Override
    AbstractJdbcJobStore store() {
        return STORE;
    }
}
