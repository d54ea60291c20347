/**
 * Claiming and executing jobs: {@link io.jobqueue.dispatch.JobDispatcher}, retry policies
 * and execution interceptors.
 */
package io.jobqueue.dispatch;
