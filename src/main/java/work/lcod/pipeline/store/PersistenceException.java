package work.lcod.pipeline.store;

import work.lcod.pipeline.shared.PipelineException;

/**
 * Reading or writing the resource tree (or the results directory) failed. Never retried.
 */
public final class PersistenceException extends PipelineException {
    public PersistenceException(String message, Throwable cause) {
        super("persistence_error", message, cause);
    }
}
