/**
 * Manual JDBC transaction management.
 *
 * <p>{@link io.jobqueue.jdbc.tx.JdbcTransactionManager} binds a connection to a
 * {@link io.jobqueue.jdbc.tx.ThreadLocalTxContext} so transactional inserts share the
 * caller's transaction.
 */
package io.jobqueue.jdbc.tx;
