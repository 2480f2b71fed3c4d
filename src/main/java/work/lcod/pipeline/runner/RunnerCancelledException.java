package work.lcod.pipeline.runner;

import work.lcod.pipeline.shared.PipelineException;

/**
 * Raised when a run is cancelled or a deadline expires while a function is in flight.
 */
public final class RunnerCancelledException extends PipelineException {
    public RunnerCancelledException(String message) {
        super("cancelled", message);
    }
}
