/**
 * Root API of the job engine: durable background jobs stored in a relational table and
 * executed by worker pools, with retries, snoozing, periodic insertion and lifecycle events.
 *
 * <h2>Core Design</h2>
 * <p>Jobs are rows. {@link io.jobqueue.JobClient#insert} writes one in its own transaction;
 * {@link io.jobqueue.JobClient#insertTx} writes it inside the caller's transaction so the job
 * exists only if that transaction commits. The {@linkplain io.jobqueue.dispatch.JobDispatcher
 * dispatcher} claims ready rows per queue, bounded by each queue's free worker slots, and runs
 * them against the {@linkplain io.jobqueue.registry.WorkerRegistry registry} of
 * {@link io.jobqueue.JobHandler}s. Execution is at-least-once: a row whose claim outlives the
 * lease timeout is put back by the {@linkplain io.jobqueue.maintenance.JobRescuer rescuer}.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>jobqueue-core</b>: API, dispatcher, periodic scheduler, event bus</li>
 *   <li><b>jobqueue-jdbc</b>: JDBC job stores (H2, MySQL, PostgreSQL) and a thread-local
 *       transaction manager</li>
 *   <li><b>jobqueue-spring-adapter</b>: Spring transaction integration</li>
 *   <li><b>jobqueue-micrometer</b>: Micrometer metrics exporter</li>
 *   <li><b>jobqueue-spring-boot-starter</b>: auto-configuration</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * var registry = new DefaultWorkerRegistry()
 *     .register(JsonJobHandler.of("sort", SortArgs.class, (ctx, args) ->
 *         ctx.recordOutput(args.strings().stream().sorted().toList())));
 *
 * try (JobClient client = JobClient.builder()
 *     .connectionProvider(new DataSourceConnectionProvider(dataSource))
 *     .jobStore(JdbcJobStores.detect(dataSource))
 *     .registry(registry)
 *     .queue("default", 10)
 *     .build()) {
 *   client.start();
 *   client.insert(new SortArgs(List.of("whale", "tiger", "bear")));
 * }
 * }</pre>
 */
package io.jobqueue;
