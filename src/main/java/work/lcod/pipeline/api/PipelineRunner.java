package work.lcod.pipeline.api;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Timer;
import java.util.TimerTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.pipeline.codec.ResourceListCodec;
import work.lcod.pipeline.codec.YamlDocuments;
import work.lcod.pipeline.model.ExecutionPlan;
import work.lcod.pipeline.model.Resource;
import work.lcod.pipeline.model.ResourceCollection;
import work.lcod.pipeline.model.ResultSet;
import work.lcod.pipeline.model.Severity;
import work.lcod.pipeline.runner.CancellationToken;
import work.lcod.pipeline.runner.ContainerFunctionRunner;
import work.lcod.pipeline.runner.FunctionRunner;
import work.lcod.pipeline.runner.RunnerRegistry;
import work.lcod.pipeline.runtime.FunctionDiscoverer;
import work.lcod.pipeline.runtime.InvocationRecord;
import work.lcod.pipeline.runtime.PipelineExecutor;
import work.lcod.pipeline.runtime.PipelineOutcome;
import work.lcod.pipeline.shared.PipelineException;
import work.lcod.pipeline.store.DirectoryResourceStore;
import work.lcod.pipeline.store.ResultsWriter;

/**
 * Public entry point for running a pipeline over a directory tree.
 */
public final class PipelineRunner {
    private static final Logger logger = LoggerFactory.getLogger(PipelineRunner.class);

    private final FunctionRunner functionRunner;

    /**
     * Uses the process-backed runners built from each run's configuration.
     */
    public PipelineRunner() {
        this.functionRunner = null;
    }

    public PipelineRunner(FunctionRunner functionRunner) {
        this.functionRunner = functionRunner;
    }

    public RunResult run(PipelineRunConfiguration configuration) {
        var started = Instant.now();
        var metadata = new LinkedHashMap<String, Object>();
        metadata.put("root", configuration.root().toString());
        try {
            var excluded = configuration.resultsDirectory().map(List::of).orElse(List.of());
            var store = new DirectoryResourceStore(configuration.root(), excluded);
            var input = store.load();

            var explicit = loadFunctions(configuration.functionPaths());
            var options = new FunctionDiscoverer.Options(configuration.globalScope(), configuration.includeDiscovered());
            var plan = new FunctionDiscoverer().discover(input, explicit, options);
            metadata.put("plan", plan.describe());
            if (configuration.planOnly()) {
                return RunResult.planned(metadata, started);
            }

            var outcome = execute(configuration, input, plan);
            describeOutcome(outcome, metadata);

            configuration.resultsDirectory().ifPresent(directory -> {
                var files = new ResultsWriter(directory).write(outcome.resultSets());
                var written = new ArrayList<String>();
                for (var file : files) {
                    written.add(file.toString());
                }
                metadata.put("resultFiles", written);
            });
            if (outcome.committed()) {
                if (configuration.dryRun()) {
                    metadata.put("output", ResourceListCodec.encode(outcome.collection()));
                } else {
                    store.persist(outcome.collection());
                }
            }

            if (outcome.exitCode() == 0) {
                return RunResult.success(metadata, started);
            }
            var message = outcome.abortCause()
                .map(PipelineException::getMessage)
                .orElseGet(() -> failureSummary(outcome));
            outcome.abortCause().ifPresent(cause -> metadata.put("code", cause.code()));
            return RunResult.failure(message, metadata, started);
        } catch (PipelineException ex) {
            logger.error("Pipeline run failed: {}", ex.getMessage());
            metadata.put("code", ex.code());
            debugTrace(ex);
            return RunResult.failure(ex.getMessage(), metadata, started);
        } catch (IllegalArgumentException ex) {
            logger.error("Pipeline run rejected: {}", ex.getMessage());
            metadata.put("code", "invalid_argument");
            debugTrace(ex);
            return RunResult.failure(ex.getMessage(), metadata, started);
        } catch (RuntimeException ex) {
            logger.error("Pipeline run crashed", ex);
            metadata.put("code", "internal_error");
            debugTrace(ex);
            var message = ex.getMessage() == null || ex.getMessage().isBlank() ? ex.toString() : ex.getMessage();
            return RunResult.failure(message, metadata, started);
        }
    }

    private PipelineOutcome execute(PipelineRunConfiguration configuration, ResourceCollection input, ExecutionPlan plan) {
        var token = new CancellationToken();
        var executor = new PipelineExecutor(runnerFor(configuration), configuration.functionTimeout(), token);
        Timer deadline = null;
        if (configuration.timeout().isPresent()) {
            var timeout = configuration.timeout().get();
            deadline = new Timer("lcod-run-deadline", true);
            deadline.schedule(new TimerTask() {
                @Override
                public void run() {
                    token.cancel("run timeout of " + timeout.toMillis() + " ms exceeded");
                }
            }, Math.max(1L, timeout.toMillis()));
        }
        try {
            return executor.execute(input, plan);
        } finally {
            if (deadline != null) {
                deadline.cancel();
            }
        }
    }

    private FunctionRunner runnerFor(PipelineRunConfiguration configuration) {
        if (functionRunner != null) {
            return functionRunner;
        }
        return RunnerRegistry.create(
            new ContainerFunctionRunner.Settings(configuration.containerEngine(), configuration.allowNetwork())
        );
    }

    /**
     * Reads declaration resources that live outside the tree, in the given file order.
     */
    private static List<Resource> loadFunctions(List<Path> paths) {
        var functions = new ArrayList<Resource>();
        for (var path : paths) {
            if (!Files.isRegularFile(path)) {
                throw new IllegalArgumentException("Function file not found: " + path);
            }
            try (var reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
                for (var document : YamlDocuments.readAll(reader)) {
                    functions.add(Resource.of(document));
                }
            } catch (IOException ex) {
                throw new IllegalArgumentException("Unable to read function file " + path + ": " + ex.getMessage(), ex);
            }
        }
        return functions;
    }

    private static void describeOutcome(PipelineOutcome outcome, Map<String, Object> metadata) {
        metadata.put("state", outcome.state().name().toLowerCase(Locale.ROOT));
        var invocations = new ArrayList<Map<String, Object>>();
        for (InvocationRecord record : outcome.invocations()) {
            invocations.add(record.toSerializableMap());
        }
        metadata.put("invocations", invocations);
        metadata.put("severity", outcome.overallSeverity().map(Severity::wireName).orElse("none"));
        var counts = new LinkedHashMap<String, Object>();
        for (var severity : Severity.values()) {
            counts.put(severity.wireName(), count(outcome.resultSets(), severity));
        }
        metadata.put("results", counts);
        metadata.put("exitCode", outcome.exitCode());
    }

    private static long count(List<ResultSet> resultSets, Severity severity) {
        long count = 0;
        for (var set : resultSets) {
            for (var result : set.results()) {
                if (result.severity() == severity) {
                    count++;
                }
            }
        }
        return count;
    }

    private static String failureSummary(PipelineOutcome outcome) {
        Optional<String> failed = Optional.empty();
        for (var record : outcome.invocations()) {
            if (record.failure().isPresent()) {
                failed = Optional.of(record.invocation().name() + ": " + record.failure().get());
                break;
            }
        }
        return failed
            .map(first -> "Pipeline " + outcome.state().name().toLowerCase(Locale.ROOT) + " with failures (" + first + ")")
            .orElse("Pipeline reported error results");
    }

    private static void debugTrace(Exception ex) {
        if (Boolean.getBoolean("lcod.debug")) {
            ex.printStackTrace();
        }
    }
}
