package work.lcod.pipeline.runtime;

import work.lcod.pipeline.shared.PipelineException;

public final class ScopeResolutionException extends PipelineException {
    public ScopeResolutionException(String message) {
        super("scope_resolution_error", message);
    }
}
