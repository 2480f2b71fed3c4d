package work.lcod.pipeline.runner;

import work.lcod.pipeline.model.ResourceCollection;
import work.lcod.pipeline.model.RuntimeDescriptor;

/**
 * Executes one function invocation. Implementations must not keep any state between calls and
 * must not retain {@code request} after returning.
 */
@FunctionalInterface
public interface FunctionRunner {
    /**
     * @throws RunnerInvocationException when the runtime cannot be started
     * @throws RunnerCancelledException when the context is cancelled or its deadline passes
     */
    RunnerResponse run(RuntimeDescriptor runtime, ResourceCollection request, RunnerContext context);
}
