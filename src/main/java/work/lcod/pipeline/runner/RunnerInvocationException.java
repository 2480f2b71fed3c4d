package work.lcod.pipeline.runner;

import work.lcod.pipeline.shared.PipelineException;

/**
 * The function runtime could not be started or is not supported.
 */
public final class RunnerInvocationException extends PipelineException {
    public RunnerInvocationException(String message) {
        super("runner_invocation_error", message);
    }

    public RunnerInvocationException(String message, Throwable cause) {
        super("runner_invocation_error", message, cause);
    }
}
