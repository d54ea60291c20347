/**
 * Spring transaction integration.
 *
 * <p>{@link io.jobqueue.spring.SpringTxContext} lets {@code insertTx} join transactions managed
 * by a Spring {@code PlatformTransactionManager}, including {@code @Transactional} methods.
 */
package io.jobqueue.spring;
