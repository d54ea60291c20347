/**
 * Persistent job data: {@link io.jobqueue.model.JobRow} snapshots, the
 * {@link io.jobqueue.model.JobState} lifecycle, and {@link io.jobqueue.model.JobInsert} rows.
 */
package io.jobqueue.model;
