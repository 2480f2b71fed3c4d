package work.lcod.pipeline.shared;

/**
 * Base exception for pipeline failures; carries a stable machine-readable code.
 */
public class PipelineException extends RuntimeException {
    private final String code;

    public PipelineException(String code, String message) {
        super(message);
        this.code = code;
    }

    public PipelineException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String code() {
        return code;
    }
}
