package io.jobqueue;

/**
 * Typed arguments of a job. Implementations are usually records serialized to JSON
 * by the client; {@link #kind()} selects the handler.
 *
 * <pre>{@code
 * record SortArgs(List<String> strings) implements JobArgs {
 *     public String kind() { return "sort"; }
 * }
 * }</pre>
 */
public interface JobArgs {

    /**
     * The kind discriminator that routes this job to its {@link JobHandler}.
     */
    String kind();

    /**
     * Per-kind insert defaults. Options passed explicitly at insert time take precedence.
     *
     * @return defaults, or {@code null} for none
     */
    default InsertOpts insertOpts() {
        return null;
    }
}
