package work.lcod.pipeline.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;
import work.lcod.pipeline.api.LogLevel;
import work.lcod.pipeline.api.PipelineRunner;
import work.lcod.pipeline.store.PersistenceException;
import work.lcod.pipeline.support.ScriptedFunctionRunner;
import work.lcod.pipeline.support.TestResources;

class PipelineRunCommandTest {
    @TempDir
    Path tempDir;

    private Path root;
    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();
    private final ScriptedFunctionRunner scripted = new ScriptedFunctionRunner()
        .on("fn/label", ScriptedFunctionRunner.mapItems(r -> TestResources.withLabel(r, "team", "core")))
        .on("fn/fail", ScriptedFunctionRunner.failing(4, "nope"));

    @BeforeEach
    void tree() throws IOException {
        root = tempDir.resolve("tree");
        Files.createDirectories(root);
        Files.writeString(root.resolve("fn.yaml"), String.join("\n",
            "apiVersion: v1",
            "kind: ConfigMap",
            "metadata:",
            "  name: labels",
            "  annotations:",
            "    config.kubernetes.io/function: |",
            "      container:",
            "        image: fn/label",
            ""
        ));
    }

    @Test
    void planPrintsTheSummary() {
        int exit = execute("--plan", root.toString());

        assertEquals(0, exit, err.toString());
        assertTrue(out.toString().contains("\"status\" : \"planned\""), out.toString());
        assertTrue(out.toString().contains("fn/label"), out.toString());
        assertTrue(scripted.calls().isEmpty());
    }

    @Test
    void dryRunPrintsTheResourceList() throws IOException {
        int exit = execute("--dry-run", root.toString());

        assertEquals(0, exit, err.toString());
        assertTrue(out.toString().startsWith("apiVersion: config.kubernetes.io/v1"), out.toString());
        assertTrue(out.toString().contains("team: core"));
        assertTrue(err.toString().contains("\"status\" : \"success\""));
        assertTrue(!Files.readString(root.resolve("fn.yaml")).contains("team: core"));
    }

    @Test
    void runWritesTheTree() throws IOException {
        int exit = execute(root.toString());

        assertEquals(0, exit, err.toString());
        assertTrue(Files.readString(root.resolve("fn.yaml")).contains("team: core"));
    }

    @Test
    void failingFunctionExitsNonZero() throws IOException {
        Files.writeString(root.resolve("fn.yaml"), Files.readString(root.resolve("fn.yaml")).replace("fn/label", "fn/fail"));

        int exit = execute(root.toString());

        assertEquals(1, exit);
        assertTrue(err.toString().contains("fn/fail"), err.toString());
    }

    @Test
    void invalidInputIsAUsageError() {
        assertEquals(2, execute(tempDir.resolve("absent").toString()));
        assertEquals(2, execute("--timeout", "soon", root.toString()));
        assertEquals(2, execute("--log-level", "loud", root.toString()));
    }

    @Test
    void flagsOverrideTheConfigFile() throws IOException {
        var toml = tempDir.resolve("pipeline.toml");
        Files.writeString(toml, "[container]\nengine = \"podman\"\nnetwork = true\n\n[functions]\ntimeout = \"1m\"\n");
        var command = new PipelineRunCommand(new PipelineRunner(scripted));
        new CommandLine(command).parseArgs("--config", toml.toString(), "--container-engine", "nerdctl", "--fn-timeout", "5s", root.toString());

        var configuration = command.buildConfiguration();

        assertEquals("nerdctl", configuration.containerEngine());
        assertTrue(configuration.allowNetwork());
        assertEquals(Optional.of(Duration.ofSeconds(5)), configuration.functionTimeout());
        assertEquals(root.toAbsolutePath().normalize(), configuration.root());
    }

    @Test
    void versionNamesTheTool() {
        assertEquals(0, execute("--version"));
        assertTrue(out.toString().startsWith("lcod-pipeline (java) "), out.toString());
        assertTrue(out.toString().contains("wire format: config.kubernetes.io/v1 ResourceList"), out.toString());
    }

    @Test
    void escapedExceptionsPrintTheInnermostPipelineFailure() {
        var commandLine = new CommandLine(new PipelineRunCommand(new PipelineRunner(scripted)))
            .setErr(new PrintWriter(err, true))
            .setColorScheme(CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.OFF));
        var wrapped = new IllegalStateException(
            "outer",
            new PersistenceException("Unable to write a.yaml: disk full", new IOException("disk full"))
        );

        int exit = new ShortErrorHandler().handleExecutionException(wrapped, commandLine, null);

        assertEquals(1, exit);
        assertEquals("lcod-pipeline: Unable to write a.yaml: disk full [persistence_error]", err.toString().trim());
        assertEquals("IllegalArgumentException", ShortErrorHandler.describe(new IllegalArgumentException()));
    }

    @Test
    void logLevelsMapOntoLogback() {
        assertEquals(Level.DEBUG, LogLevels.toLogback(LogLevel.DEBUG));
        assertEquals(Level.OFF, LogLevels.toLogback(LogLevel.OFF));
    }

    private int execute(String... args) {
        return new CommandLine(new PipelineRunCommand(new PipelineRunner(scripted)))
            .setExecutionExceptionHandler(new ShortErrorHandler())
            .setOut(new PrintWriter(out, true))
            .setErr(new PrintWriter(err, true))
            .execute(args);
    }
}
