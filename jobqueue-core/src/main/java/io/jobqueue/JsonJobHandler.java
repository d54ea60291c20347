package io.jobqueue;

import io.jobqueue.util.JsonCodec;

import java.time.Duration;
import java.util.Objects;

/**
 * {@link JobHandler} whose arguments are JSON-decoded into a class.
 *
 * <pre>{@code
 * registry.register(JsonJobHandler.of("sort", SortArgs.class, (ctx, args) -> {
 *     List<String> sorted = new ArrayList<>(args.strings());
 *     Collections.sort(sorted);
 *     ctx.recordOutput(sorted);
 * }));
 * }</pre>
 *
 * @param <A> argument type
 */
public abstract class JsonJobHandler<A> implements JobHandler<A> {
    private final String kind;
    private final Class<A> argsType;
    private final JsonCodec codec;

    protected JsonJobHandler(String kind, Class<A> argsType) {
        this(kind, argsType, JsonCodec.getDefault());
    }

    protected JsonJobHandler(String kind, Class<A> argsType, JsonCodec codec) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.argsType = Objects.requireNonNull(argsType, "argsType");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    /**
     * Creates a handler from a lambda.
     */
    public static <A> JsonJobHandler<A> of(String kind, Class<A> argsType, Work<A> work) {
        return of(kind, argsType, null, work);
    }

    /**
     * Creates a handler from a lambda with its own execution deadline.
     */
    public static <A> JsonJobHandler<A> of(String kind, Class<A> argsType, Duration timeout, Work<A> work) {
        Objects.requireNonNull(work, "work");
        return new JsonJobHandler<>(kind, argsType) {
            @Override
            public void execute(JobContext context, A args) throws Exception {
                work.execute(context, args);
            }

            @Override
            public Duration timeout() {
                return timeout;
            }
        };
    }

    @Override
    public String kind() {
        return kind;
    }

    public Class<A> argsType() {
        return argsType;
    }

    @Override
    public A decode(String payload) throws JobDecodeException {
        try {
            return codec.fromJson(payload, argsType);
        } catch (IllegalArgumentException e) {
            throw new JobDecodeException(e.getMessage(), e);
        }
    }

    @FunctionalInterface
    public interface Work<A> {
        void execute(JobContext context, A args) throws Exception;
    }
}
