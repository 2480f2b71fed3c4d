package work.lcod.pipeline.runtime;

public enum RunState {
    RUNNING,
    COMMITTED,
    ABORTED
}
