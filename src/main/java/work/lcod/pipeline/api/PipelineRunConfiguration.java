package work.lcod.pipeline.api;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable configuration of one pipeline run.
 *
 * @param root directory tree the pipeline runs over
 * @param resultsDirectory where result sets are written, if anywhere
 * @param functionPaths files with function declarations that live outside {@code root}
 * @param includeDiscovered also run in-tree declarations when {@code functionPaths} is set
 * @param globalScope let every function see the whole tree
 * @param dryRun do not write the tree back; the result is returned in the run metadata
 * @param planOnly stop after discovery and report the plan
 * @param timeout deadline for the whole run
 * @param functionTimeout deadline for each function
 */
public record PipelineRunConfiguration(
    Path root,
    Optional<Path> resultsDirectory,
    List<Path> functionPaths,
    boolean includeDiscovered,
    boolean globalScope,
    boolean dryRun,
    boolean planOnly,
    Optional<Duration> timeout,
    Optional<Duration> functionTimeout,
    String containerEngine,
    boolean allowNetwork,
    LogLevel logLevel
) {
    public PipelineRunConfiguration {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(resultsDirectory, "resultsDirectory");
        functionPaths = functionPaths == null ? List.of() : List.copyOf(functionPaths);
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(functionTimeout, "functionTimeout");
        Objects.requireNonNull(containerEngine, "containerEngine");
        Objects.requireNonNull(logLevel, "logLevel");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path root;
        private Optional<Path> resultsDirectory = Optional.empty();
        private final List<Path> functionPaths = new ArrayList<>();
        private boolean includeDiscovered;
        private boolean globalScope;
        private boolean dryRun;
        private boolean planOnly;
        private Optional<Duration> timeout = Optional.empty();
        private Optional<Duration> functionTimeout = Optional.empty();
        private String containerEngine = "docker";
        private boolean allowNetwork;
        private LogLevel logLevel = LogLevel.WARN;

        public Builder root(Path root) {
            this.root = root;
            return this;
        }

        public Builder resultsDirectory(Path resultsDirectory) {
            this.resultsDirectory = Optional.ofNullable(resultsDirectory);
            return this;
        }

        public Builder functionPaths(List<Path> paths) {
            this.functionPaths.clear();
            if (paths != null) {
                this.functionPaths.addAll(paths);
            }
            return this;
        }

        public Builder addFunctionPath(Path path) {
            this.functionPaths.add(path);
            return this;
        }

        public Builder includeDiscovered(boolean includeDiscovered) {
            this.includeDiscovered = includeDiscovered;
            return this;
        }

        public Builder globalScope(boolean globalScope) {
            this.globalScope = globalScope;
            return this;
        }

        public Builder dryRun(boolean dryRun) {
            this.dryRun = dryRun;
            return this;
        }

        public Builder planOnly(boolean planOnly) {
            this.planOnly = planOnly;
            return this;
        }

        public Builder timeout(Optional<Duration> timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder functionTimeout(Optional<Duration> functionTimeout) {
            this.functionTimeout = functionTimeout;
            return this;
        }

        public Builder containerEngine(String containerEngine) {
            this.containerEngine = containerEngine;
            return this;
        }

        public Builder allowNetwork(boolean allowNetwork) {
            this.allowNetwork = allowNetwork;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public PipelineRunConfiguration build() {
            return new PipelineRunConfiguration(
                root,
                resultsDirectory,
                functionPaths,
                includeDiscovered,
                globalScope,
                dryRun,
                planOnly,
                timeout,
                functionTimeout,
                containerEngine,
                allowNetwork,
                logLevel
            );
        }
    }
}
