/**
 * Spring Boot auto-configuration for the job queue.
 *
 * <p>Add {@code jobqueue-spring-boot-starter} next to a {@code DataSource}, declare
 * {@link io.jobqueue.JobHandler} beans, and inject {@link io.jobqueue.JobClient}. Properties
 * live under {@code jobqueue.*}; see {@link io.jobqueue.spring.boot.JobQueueProperties}.
 */
package io.jobqueue.spring.boot;
