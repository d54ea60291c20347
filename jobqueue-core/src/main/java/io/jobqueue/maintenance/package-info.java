/**
 * Background upkeep: lease rescue and inspection of discarded jobs.
 */
package io.jobqueue.maintenance;
