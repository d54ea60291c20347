package io.jobqueue.registry;

import io.jobqueue.DuplicateJobKindException;
import io.jobqueue.JobHandler;
import io.jobqueue.UnknownJobKindException;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe {@link WorkerRegistry}. Lookups are lock-free.
 *
 * <pre>{@code
 * WorkerRegistry registry = new DefaultWorkerRegistry()
 *     .register(new SortHandler())
 *     .register(JsonJobHandler.of("email", EmailArgs.class, (ctx, args) -> mailer.send(args)));
 * }</pre>
 */
public final class DefaultWorkerRegistry implements WorkerRegistry {
    private final Map<String, JobHandler<?>> handlers = new ConcurrentHashMap<>();

    @Override
    public DefaultWorkerRegistry register(JobHandler<?> handler) {
        Objects.requireNonNull(handler, "handler");
        String kind = Objects.requireNonNull(handler.kind(), "handler.kind()");
        if (kind.isBlank()) {
            throw new IllegalArgumentException("handler kind must not be blank");
        }
        if (handlers.putIfAbsent(kind, handler) != null) {
            throw new DuplicateJobKindException(kind);
        }
        return this;
    }

    @Override
    public JobHandler<?> resolve(String kind) {
        JobHandler<?> handler = kind != null ? handlers.get(kind) : null;
        if (handler == null) {
            throw new UnknownJobKindException(kind);
        }
        return handler;
    }

    @Override
    public boolean isRegistered(String kind) {
        return kind != null && handlers.containsKey(kind);
    }

    @Override
    public Set<String> kinds() {
        return Collections.unmodifiableSet(new TreeSet<>(handlers.keySet()));
    }
}
