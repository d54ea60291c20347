package io.jobqueue.dispatch;

import io.jobqueue.JobContext;

/**
 * Cross-cutting hook around handler execution.
 *
 * <p>{@link #beforeExecute} runs in registration order, then the handler, then
 * {@link #afterExecute} in reverse order. If {@code beforeExecute} throws, the attempt
 * fails as if the handler had thrown. {@code afterExecute} exceptions are logged and ignored.
 *
 * <pre>{@code
 * JobDispatcher.builder()
 *     .interceptor(JobInterceptor.before(ctx ->
 *         MDC.put("jobId", ctx.job().id())))
 *     .interceptor(JobInterceptor.after((ctx, error) -> {
 *         if (error != null) alerts.notify(ctx.job(), error);
 *     }))
 *     .build();
 * }</pre>
 */
public interface JobInterceptor {

    /**
     * Called before the handler is invoked.
     *
     * @throws Exception to fail the attempt
     */
    default void beforeExecute(JobContext context) throws Exception {
    }

    /**
     * Called after the handler (or after a failing {@code beforeExecute}).
     *
     * @param error null on success, the failure otherwise
     */
    default void afterExecute(JobContext context, Throwable error) {
    }

    static JobInterceptor before(BeforeHook hook) {
        return new JobInterceptor() {
            @Override
            public void beforeExecute(JobContext context) throws Exception {
                hook.accept(context);
            }
        };
    }

    static JobInterceptor after(AfterHook hook) {
        return new JobInterceptor() {
            @Override
            public void afterExecute(JobContext context, Throwable error) {
                hook.accept(context, error);
            }
        };
    }

    @FunctionalInterface
    interface BeforeHook {
        void accept(JobContext context) throws Exception;
    }

    @FunctionalInterface
    interface AfterHook {
        void accept(JobContext context, Throwable error);
    }
}
