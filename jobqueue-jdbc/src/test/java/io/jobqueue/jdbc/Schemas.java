package io.jobqueue.jdbc;

import org.h2.jdbcx.JdbcDataSource;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.UUID;

/**
 * Applies the bundled DDL scripts to test databases.
 */
public final class Schemas {

    private Schemas() {}

    /** A fresh in-memory H2 database with the job table created. */
    public static JdbcDataSource h2() throws SQLException, IOException {
        JdbcDataSource dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:jobqueue_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        apply(dataSource, "/schema/h2.sql");
        return dataSource;
    }

    public static void apply(DataSource dataSource, String resource) throws SQLException, IOException {
        String schema = load(resource);
        try (Connection conn = dataSource.getConnection(); Statement st = conn.createStatement()) {
            for (String stmt : schema.split(";")) {
                String trimmed = stmt.trim();
                if (!trimmed.isEmpty()) {
                    st.execute(trimmed);
                }
            }
        }
    }

    private static String load(String path) throws IOException {
        try (InputStream is = Schemas.class.getResourceAsStream(path)) {
            if (is == null) throw new IOException("Resource not found: " + path);
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
