package io.jobqueue;

import io.jobqueue.model.JobInsert;

import java.util.List;

/**
 * Callback run once inserted rows are committed and visible to claimers.
 * Exceptions are logged and never undo the insert.
 */
@FunctionalInterface
public interface InsertHook {

    InsertHook NOOP = jobs -> { };

    void afterCommit(List<JobInsert> jobs);
}
