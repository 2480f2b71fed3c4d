package work.lcod.pipeline.model;

import java.util.List;
import java.util.Objects;

/**
 * Function shipped as a local executable.
 */
public record ExecRuntime(String path, List<String> args, List<String> env) implements RuntimeDescriptor {
    public ExecRuntime {
        Objects.requireNonNull(path, "path");
        args = args == null ? List.of() : List.copyOf(args);
        env = env == null ? List.of() : List.copyOf(env);
    }

    public static ExecRuntime of(String path) {
        return new ExecRuntime(path, List.of(), List.of());
    }

    @Override
    public RuntimeKind kind() {
        return RuntimeKind.EXEC;
    }

    @Override
    public String reference() {
        return path;
    }
}
