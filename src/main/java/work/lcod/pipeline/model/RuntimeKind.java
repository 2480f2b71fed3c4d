package work.lcod.pipeline.model;

/**
 * Closed set of runtime shapes a function declaration may take.
 */
public enum RuntimeKind {
    CONTAINER("container"),
    EXEC("exec");

    private final String key;

    RuntimeKind(String key) {
        this.key = key;
    }

    /**
     * Key under which the runtime block appears in a declaration annotation.
     */
    public String key() {
        return key;
    }
}
