package work.lcod.pipeline.model;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Parsed form of a function declaration annotation.
 */
public record FunctionDeclaration(
    RuntimeDescriptor runtime,
    boolean deferFailure,
    Optional<String> name,
    Map<String, Object> parameters
) {
    public FunctionDeclaration {
        Objects.requireNonNull(runtime, "runtime");
        Objects.requireNonNull(name, "name");
        parameters = parameters == null ? Map.of() : Documents.copyMap(parameters);
    }

    public static FunctionDeclaration of(RuntimeDescriptor runtime) {
        return new FunctionDeclaration(runtime, false, Optional.empty(), Map.of());
    }

    public FunctionDeclaration withDeferFailure(boolean defer) {
        return new FunctionDeclaration(runtime, defer, name, parameters);
    }

    public String displayName() {
        return name.orElseGet(runtime::reference);
    }
}
