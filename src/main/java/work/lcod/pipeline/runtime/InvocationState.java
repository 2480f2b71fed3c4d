package work.lcod.pipeline.runtime;

public enum InvocationState {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED,
    DEFERRED
}
