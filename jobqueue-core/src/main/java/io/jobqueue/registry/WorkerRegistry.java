package io.jobqueue.registry;

import io.jobqueue.DuplicateJobKindException;
import io.jobqueue.JobHandler;
import io.jobqueue.UnknownJobKindException;

import java.util.Set;

/**
 * Maps job kinds to their handlers. Each kind maps to exactly one handler.
 *
 * <p>An instance is owned by one client and shared with its dispatcher; there is no
 * process-wide registry.
 *
 * @see DefaultWorkerRegistry
 */
public interface WorkerRegistry {

    /**
     * Registers a handler under its {@link JobHandler#kind()}.
     *
     * @return this registry for chaining
     * @throws DuplicateJobKindException if the kind already has a handler
     */
    WorkerRegistry register(JobHandler<?> handler);

    /**
     * Returns the handler for a kind.
     *
     * @throws UnknownJobKindException if none is registered
     */
    JobHandler<?> resolve(String kind);

    boolean isRegistered(String kind);

    Set<String> kinds();
}
