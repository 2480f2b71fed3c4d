package work.lcod.pipeline.model;

import java.util.Objects;

/**
 * One unit of work in an {@link ExecutionPlan}.
 *
 * @param functionConfig the declaring resource, handed to the function as its functionConfig
 * @param anchor directory the invocation is scoped to; {@code ""} is the tree root
 * @param sequence position in the plan
 */
public record FunctionInvocation(
    FunctionDeclaration declaration,
    Resource functionConfig,
    String anchor,
    int sequence,
    Origin origin
) {
    public FunctionInvocation {
        Objects.requireNonNull(declaration, "declaration");
        Objects.requireNonNull(functionConfig, "functionConfig");
        Objects.requireNonNull(origin, "origin");
    }

    public FunctionInvocation withSequence(int newSequence) {
        return new FunctionInvocation(declaration, functionConfig, anchor, newSequence, origin);
    }

    public String name() {
        return declaration.displayName();
    }

    public String describe() {
        return "#" + sequence + " " + name() + " @ " + (anchor == null || anchor.isEmpty() ? "." : anchor);
    }

    public enum Origin {
        DISCOVERED,
        EXPLICIT
    }
}
