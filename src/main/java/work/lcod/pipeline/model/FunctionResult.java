package work.lcod.pipeline.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One structured result emitted by a function. Everything but severity and message is optional.
 */
public record FunctionResult(
    Severity severity,
    String message,
    Map<String, String> tags,
    Optional<ResourceKey> resourceRef,
    Optional<FileLocation> file,
    Optional<FieldRef> field
) {
    public FunctionResult {
        Objects.requireNonNull(severity, "severity");
        message = message == null ? "" : message;
        tags = tags == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(tags));
        Objects.requireNonNull(resourceRef, "resourceRef");
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(field, "field");
    }

    public static FunctionResult of(Severity severity, String message) {
        return new FunctionResult(severity, message, Map.of(), Optional.empty(), Optional.empty(), Optional.empty());
    }

    public record FileLocation(String path, int index) {
        public FileLocation {
            path = path == null ? "" : path;
        }
    }

    /**
     * Field a result points at, with the current and suggested values kept as raw document nodes.
     */
    public record FieldRef(String path, Object currentValue, Object suggestedValue) {
        public FieldRef {
            path = path == null ? "" : path;
            currentValue = Documents.deepCopy(currentValue);
            suggestedValue = Documents.deepCopy(suggestedValue);
        }
    }
}
