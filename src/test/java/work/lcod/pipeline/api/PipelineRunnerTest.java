package work.lcod.pipeline.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.lcod.pipeline.model.FunctionResult;
import work.lcod.pipeline.model.Resource;
import work.lcod.pipeline.model.ResourceCollection;
import work.lcod.pipeline.model.ResultSet;
import work.lcod.pipeline.model.Severity;
import work.lcod.pipeline.runner.RunnerResponse;
import work.lcod.pipeline.support.ScriptedFunctionRunner;
import work.lcod.pipeline.support.TestResources;

class PipelineRunnerTest {
    @TempDir
    Path tempDir;

    private Path root;
    private Path results;

    private static final String DEPLOYMENT = "apiVersion: apps/v1\nkind: Deployment\nmetadata:\n  name: web\n";
    private static final String LABEL_FUNCTION = String.join("\n",
        "apiVersion: v1",
        "kind: ConfigMap",
        "metadata:",
        "  name: set-labels",
        "  annotations:",
        "    config.kubernetes.io/function: |",
        "      container:",
        "        image: fn/set-labels",
        "data:",
        "  team: core",
        ""
    );

    @BeforeEach
    void tree() throws IOException {
        root = tempDir.resolve("tree");
        results = tempDir.resolve("results");
        write("app/deploy.yaml", DEPLOYMENT);
        write("app/fn.yaml", LABEL_FUNCTION);
        write("other/cm.yaml", "apiVersion: v1\nkind: ConfigMap\nmetadata:\n  name: other\n");
    }

    @Test
    void runsDiscoveredFunctionsAndWritesTheTree() throws IOException {
        var scripted = labelling();

        var result = new PipelineRunner(scripted).run(configuration().build());

        assertEquals(RunResult.Status.SUCCESS, result.status(), String.valueOf(result.metadata()));
        assertEquals("committed", result.metadata().get("state"));
        assertTrue(read("app/deploy.yaml").contains("team: core"));
        assertTrue(read("app/fn.yaml").contains("labels:"));
        assertEquals("apiVersion: v1\nkind: ConfigMap\nmetadata:\n  name: other\n", read("other/cm.yaml"));
        assertTrue(Files.exists(results.resolve("results-0.yaml")));
        assertEquals(Map.of("info", 0L, "warning", 1L, "error", 0L), result.metadata().get("results"));
        assertEquals("warning", result.metadata().get("severity"));
    }

    @Test
    void functionConfigIsTheDeclaringResource() {
        var scripted = labelling();

        new PipelineRunner(scripted).run(configuration().build());

        var config = scripted.calls().get(0).request().functionConfig().orElseThrow();
        assertEquals("set-labels", config.key().name());
        assertEquals("core", config.get("data", "team"));
    }

    @Test
    void failedRunLeavesTheTreeAloneButWritesResults() throws IOException {
        var scripted = new ScriptedFunctionRunner().on("fn/set-labels", ScriptedFunctionRunner.failing(1, "denied"));

        var result = new PipelineRunner(scripted).run(configuration().build());

        assertEquals(RunResult.Status.FAILURE, result.status());
        assertEquals("aborted", result.metadata().get("state"));
        assertEquals(DEPLOYMENT, read("app/deploy.yaml"));
        assertTrue(Files.readString(results.resolve("results-0.yaml")).contains("denied"));
        assertTrue(String.valueOf(result.metadata().get("error")).contains("fn/set-labels"));
    }

    @Test
    void planOnlyRunsNothing() {
        var scripted = labelling();

        var result = new PipelineRunner(scripted).run(configuration().planOnly(true).build());

        assertEquals(RunResult.Status.PLANNED, result.status());
        assertTrue(scripted.calls().isEmpty());
        @SuppressWarnings("unchecked")
        var plan = (List<Map<String, Object>>) result.metadata().get("plan");
        assertEquals("fn/set-labels", plan.get(0).get("name"));
        assertEquals("app", plan.get(0).get("anchor"));
    }

    @Test
    void dryRunReturnsTheResourceListInstead() throws IOException {
        var result = new PipelineRunner(labelling()).run(configuration().dryRun(true).build());

        assertEquals(RunResult.Status.SUCCESS, result.status());
        assertEquals(DEPLOYMENT, read("app/deploy.yaml"));
        var output = String.valueOf(result.metadata().get("output"));
        assertTrue(output.contains("kind: ResourceList"), output);
        assertTrue(output.contains("team: core"), output);
    }

    @Test
    void explicitFunctionsRunOverTheWholeTree() throws IOException {
        var fnFile = tempDir.resolve("fns/annotate.yaml");
        Files.createDirectories(fnFile.getParent());
        Files.writeString(fnFile, LABEL_FUNCTION.replace("fn/set-labels", "fn/annotate"));
        var scripted = labelling().on("fn/annotate", ScriptedFunctionRunner.passThrough());

        var result = new PipelineRunner(scripted).run(configuration().addFunctionPath(fnFile).build());

        assertEquals(RunResult.Status.SUCCESS, result.status());
        assertEquals(List.of("fn/annotate"), scripted.calledReferences());
        assertEquals(3, scripted.calls().get(0).request().size());
    }

    @Test
    void malformedDeclarationFailsBeforeAnythingRuns() throws IOException {
        write("broken/fn.yaml", LABEL_FUNCTION.replace("image: fn/set-labels", "imag: fn/set-labels"));
        var scripted = labelling();

        var result = new PipelineRunner(scripted).run(configuration().build());

        assertEquals(RunResult.Status.FAILURE, result.status());
        assertEquals("declaration_parse_error", result.metadata().get("code"));
        assertTrue(scripted.calls().isEmpty());
        assertFalse(Files.exists(results));
    }

    @Test
    void runTimeoutCancelsTheRun() throws IOException {
        var scripted = new ScriptedFunctionRunner().on("fn/set-labels", (request, context) -> {
            long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
            while (!context.cancellation().isCancelled() && System.nanoTime() < deadline) {
                Thread.onSpinWait();
            }
            return RunnerResponse.of(request, 0, "");
        });
        write("app/second/fn.yaml", LABEL_FUNCTION);

        var result = new PipelineRunner(scripted).run(configuration().timeout(Optional.of(Duration.ofMillis(100))).build());

        assertEquals(RunResult.Status.FAILURE, result.status());
        assertEquals("cancelled", result.metadata().get("code"));
        assertEquals(1, scripted.calls().size());
    }

    @Test
    void missingRootIsAFailure() {
        var result = new PipelineRunner(labelling()).run(
            PipelineRunConfiguration.builder().root(tempDir.resolve("absent")).build()
        );

        assertEquals(RunResult.Status.FAILURE, result.status());
        assertEquals("persistence_error", result.metadata().get("code"));
    }

    @Test
    void outputPointingOutsideTheTreeWritesNothing() throws IOException {
        var scripted = new ScriptedFunctionRunner().on("fn/set-labels", (request, context) -> {
            var items = new ArrayList<Resource>();
            for (var item : request.items()) {
                items.add(TestResources.withLabel(item, "touched", "yes"));
            }
            items.add(TestResources.configMap("evil", "../escape.yaml", 0));
            return RunnerResponse.of(ResourceCollection.of(items), 0, "");
        });

        var result = new PipelineRunner(scripted).run(configuration().build());

        assertEquals(RunResult.Status.FAILURE, result.status());
        assertEquals("persistence_error", result.metadata().get("code"));
        assertEquals(DEPLOYMENT, read("app/deploy.yaml"));
        assertFalse(Files.exists(tempDir.resolve("escape.yaml")));
    }

    @Test
    void explicitFileWithoutFunctionIsRejected() throws IOException {
        var fnFile = tempDir.resolve("fns/typo.yaml");
        Files.createDirectories(fnFile.getParent());
        Files.writeString(fnFile, LABEL_FUNCTION.replace("config.kubernetes.io/function", "config.kubernetes.io/functon"));
        var scripted = labelling();

        var result = new PipelineRunner(scripted).run(configuration().addFunctionPath(fnFile).build());

        assertEquals(RunResult.Status.FAILURE, result.status());
        assertEquals("declaration_parse_error", result.metadata().get("code"));
        assertTrue(scripted.calls().isEmpty());
    }

    @Test
    void unexpectedRuntimeErrorsBecomeInternalFailures() throws IOException {
        var scripted = new ScriptedFunctionRunner().on("fn/set-labels", (request, context) -> {
            throw new IllegalStateException("runner state corrupted");
        });

        var result = new PipelineRunner(scripted).run(configuration().build());

        assertEquals(RunResult.Status.FAILURE, result.status());
        assertEquals("internal_error", result.metadata().get("code"));
        assertEquals("runner state corrupted", result.metadata().get("error"));
        assertEquals(DEPLOYMENT, read("app/deploy.yaml"));
    }

    private PipelineRunConfiguration.Builder configuration() {
        return PipelineRunConfiguration.builder().root(root).resultsDirectory(results);
    }

    private static ScriptedFunctionRunner labelling() {
        return new ScriptedFunctionRunner().on("fn/set-labels", (request, context) -> {
            var team = String.valueOf(request.functionConfig().orElseThrow().get("data", "team"));
            var labelled = ScriptedFunctionRunner.mapItems(r -> TestResources.withLabel(r, "team", team))
                .respond(request, context);
            var items = labelled.collection().orElseThrow().items();
            return RunnerResponse.of(
                ResourceCollection.of(items).withResults(List.of(
                    ResultSet.unsequenced("", List.of(FunctionResult.of(Severity.WARN, "labels rewritten")))
                )),
                0,
                ""
            );
        });
    }

    private void write(String relative, String content) throws IOException {
        var file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content, StandardCharsets.UTF_8);
    }

    private String read(String relative) throws IOException {
        return Files.readString(root.resolve(relative), StandardCharsets.UTF_8);
    }
}
