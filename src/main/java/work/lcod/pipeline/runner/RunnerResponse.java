package work.lcod.pipeline.runner;

import java.util.Objects;
import java.util.Optional;
import work.lcod.pipeline.model.ResourceCollection;

/**
 * What came back from a function: the parsed collection, or why it could not be parsed, plus the
 * exit status and free-text diagnostics.
 */
public record RunnerResponse(
    Optional<ResourceCollection> collection,
    Optional<String> parseFailure,
    int exitCode,
    String diagnostics
) {
    public RunnerResponse {
        Objects.requireNonNull(collection, "collection");
        Objects.requireNonNull(parseFailure, "parseFailure");
        diagnostics = diagnostics == null ? "" : diagnostics;
        if (collection.isPresent() && parseFailure.isPresent()) {
            throw new IllegalArgumentException("A response is either parsed or a parse failure, not both");
        }
    }

    public static RunnerResponse of(ResourceCollection collection, int exitCode, String diagnostics) {
        return new RunnerResponse(Optional.of(collection), Optional.empty(), exitCode, diagnostics);
    }

    public static RunnerResponse unparsable(String reason, int exitCode, String diagnostics) {
        return new RunnerResponse(Optional.empty(), Optional.of(reason), exitCode, diagnostics);
    }

    public boolean isWellFormed() {
        return collection.isPresent();
    }

    public boolean succeeded() {
        return exitCode == 0 && isWellFormed();
    }
}
