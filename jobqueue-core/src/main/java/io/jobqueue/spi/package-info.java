/**
 * Service provider interfaces: storage ({@link io.jobqueue.spi.JobStore}), connections,
 * transactions and metrics. JDBC implementations live in {@code jobqueue-jdbc}.
 */
package io.jobqueue.spi;
