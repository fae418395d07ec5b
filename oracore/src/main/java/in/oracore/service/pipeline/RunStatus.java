package in.oracore.service.pipeline;

/**
 * Process exit status of a pipeline run.
 */
public enum RunStatus {
    SUCCESS(0),
    /** Configuration or schema validation failed before any processing. */
    FATAL(1),
    /** Some streams failed; the rest were processed. */
    PARTIAL_FAILURE(2);

    private final int exitCode;

    RunStatus(int exitCode) {
        this.exitCode = exitCode;
    }

    public int exitCode() {
        return exitCode;
    }
}
