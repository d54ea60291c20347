/**
 * In-process job lifecycle events. Events are ephemeral and never persisted.
 */
package io.jobqueue.event;
