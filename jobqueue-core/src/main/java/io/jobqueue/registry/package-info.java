/**
 * Kind-to-handler lookup used at insert time (validation) and execution time (routing).
 */
package io.jobqueue.registry;
