/**
 * JDBC infrastructure shared across sub-packages.
 *
 * <p>{@link io.jobqueue.jdbc.JdbcTemplate} provides lightweight JDBC helpers.
 * {@link io.jobqueue.jdbc.DataSourceConnectionProvider} adapts a {@link javax.sql.DataSource}
 * to the {@link io.jobqueue.spi.ConnectionProvider} SPI.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code io.jobqueue.jdbc.store}: {@link io.jobqueue.spi.JobStore} implementations</li>
 *   <li>{@code io.jobqueue.jdbc.tx}: manual transaction management</li>
 * </ul>
 *
 * <p>Table DDL for each database ships as {@code /schema/h2.sql}, {@code /schema/mysql.sql}
 * and {@code /schema/postgresql.sql} on the classpath.
 */
package io.jobqueue.jdbc;
