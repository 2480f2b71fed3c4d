package work.lcod.pipeline.runtime;

import work.lcod.pipeline.shared.PipelineException;

/**
 * A declaration annotation could not be turned into a well-formed function declaration.
 */
public final class DeclarationParseException extends PipelineException {
    public DeclarationParseException(String message) {
        super("declaration_parse_error", message);
    }

    public DeclarationParseException(String message, Throwable cause) {
        super("declaration_parse_error", message, cause);
    }
}
