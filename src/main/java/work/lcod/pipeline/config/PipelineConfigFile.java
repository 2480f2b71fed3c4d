package work.lcod.pipeline.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.lcod.pipeline.api.LogLevel;
import work.lcod.pipeline.api.PipelineRunConfiguration;
import work.lcod.pipeline.shared.DurationParser;

/**
 * Run defaults read from a TOML file:
 *
 * <pre>
 * [run]
 * results-dir = "results"
 * global-scope = false
 * dry-run = false
 * timeout = "10m"
 * log-level = "info"
 *
 * [functions]
 * paths = ["fns/set-labels.yaml"]
 * include-discovered = true
 * timeout = "30s"
 *
 * [container]
 * engine = "podman"
 * network = false
 * </pre>
 *
 * Relative paths resolve against the directory holding the file.
 */
public final class PipelineConfigFile {
    private final Path source;
    private final TomlParseResult toml;

    private PipelineConfigFile(Path source, TomlParseResult toml) {
        this.source = source;
        this.toml = toml;
    }

    public static PipelineConfigFile load(Path file) {
        Objects.requireNonNull(file, "file");
        var absolute = file.toAbsolutePath().normalize();
        String raw;
        try {
            raw = Files.readString(absolute, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new IllegalArgumentException("Unable to read config file " + absolute + ": " + ex.getMessage(), ex);
        }
        return parse(absolute, raw);
    }

    static PipelineConfigFile parse(Path source, String raw) {
        var result = Toml.parse(raw);
        if (result.hasErrors()) {
            var errors = result.errors().stream().map(Object::toString).collect(Collectors.joining("; "));
            throw new IllegalArgumentException("Invalid config file " + source + ": " + errors);
        }
        return new PipelineConfigFile(source, result);
    }

    public Path source() {
        return source;
    }

    /**
     * Copies every value present in the file onto {@code builder}. Values absent from the file
     * leave the builder untouched, so flags applied afterwards win.
     */
    public PipelineRunConfiguration.Builder applyTo(PipelineRunConfiguration.Builder builder) {
        var run = toml.getTable("run");
        if (run != null) {
            var results = string(run, "results-dir", "run");
            if (results != null) {
                builder.resultsDirectory(resolve(results));
            }
            var globalScope = bool(run, "global-scope", "run");
            if (globalScope != null) {
                builder.globalScope(globalScope);
            }
            var dryRun = bool(run, "dry-run", "run");
            if (dryRun != null) {
                builder.dryRun(dryRun);
            }
            var timeout = string(run, "timeout", "run");
            if (timeout != null) {
                builder.timeout(DurationParser.parse(timeout));
            }
            var logLevel = string(run, "log-level", "run");
            if (logLevel != null) {
                builder.logLevel(LogLevel.from(logLevel));
            }
        }

        var functions = toml.getTable("functions");
        if (functions != null) {
            var paths = functions.getArray("paths");
            if (paths != null) {
                builder.functionPaths(paths(paths));
            }
            var includeDiscovered = bool(functions, "include-discovered", "functions");
            if (includeDiscovered != null) {
                builder.includeDiscovered(includeDiscovered);
            }
            var timeout = string(functions, "timeout", "functions");
            if (timeout != null) {
                builder.functionTimeout(DurationParser.parse(timeout));
            }
        }

        var container = toml.getTable("container");
        if (container != null) {
            var engine = string(container, "engine", "container");
            if (engine != null && !engine.isBlank()) {
                builder.containerEngine(engine);
            }
            var network = bool(container, "network", "container");
            if (network != null) {
                builder.allowNetwork(network);
            }
        }
        return builder;
    }

    private List<Path> paths(TomlArray array) {
        var paths = new ArrayList<Path>();
        for (int i = 0; i < array.size(); i++) {
            var value = array.get(i);
            if (!(value instanceof String text)) {
                throw new IllegalArgumentException(source + ": functions.paths must contain strings");
            }
            paths.add(resolve(text));
        }
        return paths;
    }

    private Path resolve(String value) {
        var path = Path.of(value);
        if (path.isAbsolute()) {
            return path.normalize();
        }
        var base = source.getParent();
        return (base == null ? path : base.resolve(path)).toAbsolutePath().normalize();
    }

    private String string(TomlTable table, String key, String tableName) {
        if (!table.contains(key)) {
            return null;
        }
        if (!table.isString(key)) {
            throw new IllegalArgumentException(source + ": " + tableName + "." + key + " must be a string");
        }
        return table.getString(key);
    }

    private Boolean bool(TomlTable table, String key, String tableName) {
        if (!table.contains(key)) {
            return null;
        }
        if (!table.isBoolean(key)) {
            throw new IllegalArgumentException(source + ": " + tableName + "." + key + " must be a boolean");
        }
        return table.getBoolean(key);
    }
}
