package work.lcod.pipeline.codec;

import work.lcod.pipeline.shared.PipelineException;

public final class ResourceListParseException extends PipelineException {
    public ResourceListParseException(String message) {
        super("resource_list_parse_error", message);
    }

    public ResourceListParseException(String message, Throwable cause) {
        super("resource_list_parse_error", message, cause);
    }
}
