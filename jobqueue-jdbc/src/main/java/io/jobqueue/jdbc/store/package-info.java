/**
 * JDBC {@link io.jobqueue.spi.JobStore} implementations.
 *
 * <p>{@link io.jobqueue.jdbc.store.AbstractJdbcJobStore} holds the shared SQL and row
 * mapping; subclasses supply the database-specific claim: H2 (select, then compare-and-set
 * per row), MySQL (the same under {@code FOR UPDATE SKIP LOCKED}) and PostgreSQL
 * ({@code UPDATE ... RETURNING} over a {@code SKIP LOCKED} subquery).
 *
 * @see io.jobqueue.jdbc.store.JdbcJobStores
 */
package io.jobqueue.jdbc.store;
