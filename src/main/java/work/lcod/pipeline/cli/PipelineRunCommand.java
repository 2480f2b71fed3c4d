package work.lcod.pipeline.cli;

import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.pipeline.api.LogLevel;
import work.lcod.pipeline.api.PipelineRunConfiguration;
import work.lcod.pipeline.api.PipelineRunner;
import work.lcod.pipeline.api.RunResult;
import work.lcod.pipeline.codec.YamlDocuments;
import work.lcod.pipeline.config.PipelineConfigFile;
import work.lcod.pipeline.shared.DurationParser;

@CommandLine.Command(
    name = "lcod-pipeline",
    description = "Run the config functions declared in a directory tree and write the result back.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class PipelineRunCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", paramLabel = "DIR", description = "Directory holding the configuration resources.")
    private Path directory;

    @CommandLine.Option(
        names = "--fn-path",
        paramLabel = "FILE",
        description = "File with function declarations to run over the whole tree (repeatable)."
    )
    private List<Path> functionPaths = new ArrayList<>();

    @CommandLine.Option(
        names = "--include-discovered",
        description = "Also run declarations found in the tree when --fn-path is given."
    )
    private Boolean includeDiscovered;

    @CommandLine.Option(
        names = "--global-scope",
        description = "Give every function the whole tree instead of its own directory."
    )
    private Boolean globalScope;

    @CommandLine.Option(
        names = "--results-dir",
        paramLabel = "DIR",
        description = "Write one results file per invocation into this directory.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path resultsDir;

    @CommandLine.Option(
        names = "--dry-run",
        description = "Print the resulting ResourceList to stdout instead of writing the tree."
    )
    private Boolean dryRun;

    @CommandLine.Option(
        names = "--plan",
        description = "Print the execution plan and run nothing."
    )
    private boolean planOnly;

    @CommandLine.Option(
        names = "--timeout",
        description = "Deadline for the whole run (e.g. 30s, 2m, 1h).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String timeoutRaw;

    @CommandLine.Option(
        names = "--fn-timeout",
        description = "Deadline for each function (e.g. 30s, 2m).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String functionTimeoutRaw;

    @CommandLine.Option(
        names = "--network",
        description = "Allow container functions that ask for it to use the host network."
    )
    private Boolean network;

    @CommandLine.Option(
        names = "--container-engine",
        description = "Container engine binary (docker, podman, ...).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String containerEngine;

    @CommandLine.Option(
        names = "--config",
        paramLabel = "FILE",
        description = "TOML file with run defaults; flags override it.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path configFile;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold on stderr (trace|debug|info|warn|error|off).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    private final PipelineRunner runner;

    PipelineRunCommand() {
        this(new PipelineRunner());
    }

    PipelineRunCommand(PipelineRunner runner) {
        this.runner = runner;
    }

    @Override
    public Integer call() {
        var configuration = buildConfiguration();
        LogLevels.apply(configuration.logLevel());

        RunResult result = runner.run(configuration);
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        var summary = new LinkedHashMap<>(result.toSerializableMap());
        var metadata = new LinkedHashMap<>(result.metadata());
        var output = metadata.remove("output");
        summary.put("metadata", metadata);
        var json = YamlDocuments.writeJson(summary);
        if (output != null) {
            out.print(output);
            out.flush();
            err.println(json);
        } else {
            out.println(json);
        }
        if (result.status() == RunResult.Status.FAILURE && metadata.get("error") != null) {
            err.println(spec.commandLine().getColorScheme().errorText(ShortErrorHandler.PREFIX + metadata.get("error")));
        }
        out.flush();
        err.flush();
        return result.status().exitCode();
    }

    PipelineRunConfiguration buildConfiguration() {
        var root = directory.toAbsolutePath().normalize();
        if (!Files.isDirectory(root)) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Not a directory: " + root);
        }
        var builder = PipelineRunConfiguration.builder().root(root);
        if (configFile != null) {
            try {
                PipelineConfigFile.load(configFile).applyTo(builder);
            } catch (IllegalArgumentException ex) {
                throw new CommandLine.ParameterException(spec.commandLine(), ex.getMessage(), ex);
            }
        }
        if (!functionPaths.isEmpty()) {
            var absolute = new ArrayList<Path>();
            for (var path : functionPaths) {
                absolute.add(path.toAbsolutePath().normalize());
            }
            builder.functionPaths(absolute);
        }
        if (includeDiscovered != null) {
            builder.includeDiscovered(includeDiscovered);
        }
        if (globalScope != null) {
            builder.globalScope(globalScope);
        }
        if (resultsDir != null) {
            builder.resultsDirectory(resultsDir.toAbsolutePath().normalize());
        }
        if (dryRun != null) {
            builder.dryRun(dryRun);
        }
        builder.planOnly(planOnly);
        if (timeoutRaw != null) {
            builder.timeout(parseDuration("--timeout", timeoutRaw));
        }
        if (functionTimeoutRaw != null) {
            builder.functionTimeout(parseDuration("--fn-timeout", functionTimeoutRaw));
        }
        if (network != null) {
            builder.allowNetwork(network);
        }
        if (containerEngine != null && !containerEngine.isBlank()) {
            builder.containerEngine(containerEngine);
        }
        if (logLevelRaw != null) {
            try {
                builder.logLevel(LogLevel.from(logLevelRaw));
            } catch (IllegalArgumentException ex) {
                throw new CommandLine.ParameterException(spec.commandLine(), ex.getMessage());
            }
        }
        return builder.build();
    }

    private Optional<Duration> parseDuration(String option, String raw) {
        try {
            return DurationParser.parse(raw);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Invalid " + option + " value: " + raw);
        }
    }
}
