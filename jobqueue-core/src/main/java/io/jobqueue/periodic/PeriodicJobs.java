package io.jobqueue.periodic;

import java.util.List;

/**
 * Runtime control of periodic jobs. All methods are safe to call while the scheduler
 * is running; changes take effect immediately.
 */
public interface PeriodicJobs {

    PeriodicJobHandle add(PeriodicJob job);

    default List<PeriodicJobHandle> addAll(List<PeriodicJob> jobs) {
        return jobs.stream().map(this::add).toList();
    }

    /**
     * @return {@code true} if the handle was registered
     */
    boolean remove(PeriodicJobHandle handle);

    void clear();

    List<PeriodicJobHandle> handles();
}
