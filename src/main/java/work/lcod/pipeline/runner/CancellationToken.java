package work.lcod.pipeline.runner;

/**
 * Cooperative cancellation flag shared by the executor and the runner of the in-flight function.
 */
public final class CancellationToken {
    private volatile boolean cancelled = false;
    private volatile String reason = "";

    public void cancel() {
        cancel("cancelled by caller");
    }

    public void cancel(String why) {
        this.reason = why == null ? "" : why;
        this.cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public String reason() {
        return reason;
    }
}
