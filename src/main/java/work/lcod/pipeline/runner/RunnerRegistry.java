package work.lcod.pipeline.runner;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import work.lcod.pipeline.model.ResourceCollection;
import work.lcod.pipeline.model.RuntimeDescriptor;
import work.lcod.pipeline.model.RuntimeKind;

/**
 * Routes each invocation to the runner registered for its runtime kind.
 */
public final class RunnerRegistry implements FunctionRunner {
    private final Map<RuntimeKind, FunctionRunner> runners = new EnumMap<>(RuntimeKind.class);

    public RunnerRegistry register(RuntimeKind kind, FunctionRunner runner) {
        runners.put(Objects.requireNonNull(kind, "kind"), Objects.requireNonNull(runner, "runner"));
        return this;
    }

    public FunctionRunner get(RuntimeKind kind) {
        return runners.get(kind);
    }

    @Override
    public RunnerResponse run(RuntimeDescriptor runtime, ResourceCollection request, RunnerContext context) {
        var runner = runners.get(runtime.kind());
        if (runner == null) {
            throw new RunnerInvocationException("No runner registered for " + runtime.kind().key() + " functions");
        }
        return runner.run(runtime, request, context);
    }

    /**
     * Registry with the process-backed runners: local executables and container images.
     */
    public static RunnerRegistry create(ContainerFunctionRunner.Settings containerSettings) {
        return new RunnerRegistry()
            .register(RuntimeKind.EXEC, new ExecFunctionRunner())
            .register(RuntimeKind.CONTAINER, new ContainerFunctionRunner(containerSettings));
    }
}
