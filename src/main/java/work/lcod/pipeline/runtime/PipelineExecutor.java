package work.lcod.pipeline.runtime;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.pipeline.model.ExecutionPlan;
import work.lcod.pipeline.model.FunctionInvocation;
import work.lcod.pipeline.model.FunctionResult;
import work.lcod.pipeline.model.ResourceCollection;
import work.lcod.pipeline.model.ResultSet;
import work.lcod.pipeline.model.Severity;
import work.lcod.pipeline.runner.CancellationToken;
import work.lcod.pipeline.runner.FunctionRunner;
import work.lcod.pipeline.runner.RunnerCancelledException;
import work.lcod.pipeline.runner.RunnerContext;
import work.lcod.pipeline.runner.RunnerInvocationException;
import work.lcod.pipeline.runner.RunnerResponse;
import work.lcod.pipeline.shared.PipelineException;

/**
 * Runs an {@link ExecutionPlan} against a collection, one invocation at a time.
 *
 * <p>Each invocation sees only its scope; its output replaces that scope before the next one
 * starts. A failing invocation aborts the run unless it declares {@code deferFailure}, in which
 * case its output (when parsable) is kept, the run continues and the final status is a failure.
 * Aborted runs return the collection as it was before the failing step and must not be persisted.
 */
public final class PipelineExecutor {
    private static final Logger logger = LoggerFactory.getLogger(PipelineExecutor.class);
    private static final int DIAGNOSTICS_LIMIT = 4_000;

    private final FunctionRunner runner;
    private final ScopeResolver scopeResolver;
    private final ResourceReconciler reconciler;
    private final Optional<Duration> functionTimeout;
    private final CancellationToken cancellation;

    public PipelineExecutor(FunctionRunner runner) {
        this(runner, Optional.empty(), new CancellationToken());
    }

    public PipelineExecutor(FunctionRunner runner, Optional<Duration> functionTimeout, CancellationToken cancellation) {
        this.runner = Objects.requireNonNull(runner, "runner");
        this.functionTimeout = Objects.requireNonNull(functionTimeout, "functionTimeout");
        this.cancellation = Objects.requireNonNull(cancellation, "cancellation");
        this.scopeResolver = new ScopeResolver();
        this.reconciler = new ResourceReconciler();
    }

    public void cancel() {
        cancellation.cancel();
    }

    public PipelineOutcome execute(ResourceCollection input, ExecutionPlan plan) {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(plan, "plan");
        var run = new Run(ResourceCollection.of(input.items()), plan);
        logger.info("Running {} function invocation(s) over {} resource(s)", plan.size(), input.size());

        for (var invocation : plan) {
            if (cancellation.isCancelled()) {
                return run.abort(new RunnerCancelledException("Execution cancelled: " + cancellation.reason()));
            }
            var aborted = step(run, invocation);
            if (aborted != null) {
                return aborted;
            }
        }
        return run.commit();
    }

    /**
     * Runs one invocation; returns the aborted outcome when the run cannot continue.
     */
    private PipelineOutcome step(Run run, FunctionInvocation invocation) {
        int slot = invocation.sequence();
        run.mark(slot, run.record(slot).running());
        logger.info("Running {}", invocation.describe());
        long started = System.nanoTime();

        ScopeResolver.Scope scope;
        try {
            scope = scopeResolver.resolve(run.current, invocation.anchor());
        } catch (ScopeResolutionException ex) {
            run.finish(slot, InvocationState.FAILED, Optional.empty(), started, Optional.of(ex.getMessage()));
            return run.abort(ex);
        }

        var request = new ResourceCollection(scope.scoped(), Optional.of(invocation.functionConfig()), List.of());
        RunnerResponse response;
        Optional<String> failure = Optional.empty();
        try {
            response = runner.run(invocation.declaration().runtime(), request, RunnerContext.of(functionTimeout, cancellation));
        } catch (RunnerCancelledException ex) {
            run.finish(slot, InvocationState.FAILED, Optional.empty(), started, Optional.of(ex.getMessage()));
            return run.abort(ex);
        } catch (RunnerInvocationException ex) {
            response = null;
            failure = Optional.of(ex.getMessage());
        }

        var exitCode = response == null ? Optional.<Integer>empty() : Optional.of(response.exitCode());
        if (response != null && !response.succeeded()) {
            failure = Optional.of(describeFailure(response));
        }
        run.recordResults(invocation, response, failure);

        if (failure.isEmpty()) {
            run.current = run.current.withItems(
                reconciler.reconcile(run.current.items(), scope.scoped(), response.collection().orElseThrow().items(), scope.anchor())
            );
            run.finish(slot, InvocationState.SUCCEEDED, exitCode, started, Optional.empty());
            return null;
        }

        if (response != null && !response.diagnostics().isBlank()) {
            logger.warn("{} diagnostics:\n{}", invocation.describe(), truncate(response.diagnostics()));
        }
        if (!invocation.declaration().deferFailure()) {
            logger.warn("{} failed: {}", invocation.describe(), failure.get());
            run.finish(slot, InvocationState.FAILED, exitCode, started, failure);
            run.aggregator.markAborted();
            return run.outcome(RunState.ABORTED, Optional.empty());
        }

        logger.warn("{} failed, continuing (deferFailure): {}", invocation.describe(), failure.get());
        if (response != null && response.isWellFormed()) {
            run.current = run.current.withItems(
                reconciler.reconcile(run.current.items(), scope.scoped(), response.collection().get().items(), scope.anchor())
            );
        }
        run.aggregator.markDeferred();
        run.finish(slot, InvocationState.DEFERRED, exitCode, started, failure);
        return null;
    }

    private static String describeFailure(RunnerResponse response) {
        if (response.exitCode() != 0) {
            return "exited with code " + response.exitCode();
        }
        return "output could not be parsed: " + response.parseFailure().orElse("unknown reason");
    }

    private static String truncate(String text) {
        var trimmed = text.strip();
        if (trimmed.length() <= DIAGNOSTICS_LIMIT) {
            return trimmed;
        }
        return trimmed.substring(0, DIAGNOSTICS_LIMIT) + "...";
    }

    /**
     * Mutable state of a single run. Only the executor thread touches it.
     */
    private static final class Run {
        private final List<InvocationRecord> records = new ArrayList<>();
        private final ResultAggregator aggregator = new ResultAggregator();
        private ResourceCollection current;

        Run(ResourceCollection initial, ExecutionPlan plan) {
            this.current = initial;
            for (var invocation : plan) {
                records.add(InvocationRecord.pending(invocation));
            }
        }

        InvocationRecord record(int slot) {
            return records.get(slot);
        }

        void mark(int slot, InvocationRecord record) {
            records.set(slot, record);
        }

        void finish(int slot, InvocationState state, Optional<Integer> exitCode, long startedNanos, Optional<String> failure) {
            var took = Duration.ofNanos(System.nanoTime() - startedNanos);
            records.set(slot, records.get(slot).finish(state, exitCode, took, failure));
            logger.info("{} -> {} in {} ms", records.get(slot).invocation().describe(), state, took.toMillis());
        }

        void recordResults(FunctionInvocation invocation, RunnerResponse response, Optional<String> failure) {
            var results = new ArrayList<FunctionResult>();
            if (response != null) {
                response.collection().ifPresent(collection -> {
                    for (var set : collection.results()) {
                        results.addAll(set.results());
                    }
                });
            }
            if (failure.isPresent() && results.isEmpty()) {
                var message = invocation.name() + " " + failure.get();
                if (response != null && !response.diagnostics().isBlank()) {
                    message = message + ": " + truncate(response.diagnostics());
                }
                results.add(FunctionResult.of(Severity.ERROR, message));
            }
            int exitCode = response == null ? -1 : response.exitCode();
            aggregator.record(new ResultSet(invocation.name(), invocation.sequence(), Optional.of(exitCode), results));
        }

        PipelineOutcome abort(PipelineException cause) {
            logger.warn("Run aborted: {}", cause.getMessage());
            aggregator.markAborted();
            return outcome(RunState.ABORTED, Optional.of(cause));
        }

        PipelineOutcome commit() {
            logger.info("Run committed with {} resource(s)", current.size());
            return outcome(RunState.COMMITTED, Optional.empty());
        }

        PipelineOutcome outcome(RunState state, Optional<PipelineException> cause) {
            var resultSets = aggregator.resultSets();
            return new PipelineOutcome(
                state,
                current.withResults(resultSets),
                records,
                resultSets,
                aggregator.overallSeverity(),
                aggregator.finalStatus(),
                cause
            );
        }
    }
}
