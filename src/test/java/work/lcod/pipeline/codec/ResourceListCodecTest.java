package work.lcod.pipeline.codec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.pipeline.model.FunctionResult;
import work.lcod.pipeline.model.ResourceCollection;
import work.lcod.pipeline.model.ResourceKey;
import work.lcod.pipeline.model.ResultSet;
import work.lcod.pipeline.model.Severity;
import work.lcod.pipeline.support.TestResources;

class ResourceListCodecTest {
    @Test
    void decodesItemsConfigAndFlatResults() {
        var text = String.join("\n",
            "apiVersion: config.kubernetes.io/v1",
            "kind: ResourceList",
            "items:",
            "- apiVersion: v1",
            "  kind: ConfigMap",
            "  metadata:",
            "    name: first",
            "- apiVersion: v1",
            "  kind: ConfigMap",
            "  metadata:",
            "    name: second",
            "functionConfig:",
            "  kind: Settings",
            "  data:",
            "    level: high",
            "results:",
            "- message: label missing",
            "  severity: warning",
            "  resourceRef:",
            "    apiVersion: v1",
            "    kind: ConfigMap",
            "    name: first",
            "  field:",
            "    path: metadata.labels",
            "    suggestedValue:",
            "      team: core",
            "- message: no severity",
            ""
        );

        var collection = ResourceListCodec.decode(text);

        assertEquals(2, collection.size());
        assertEquals("second", collection.items().get(1).key().name());
        assertEquals("Settings", collection.functionConfig().orElseThrow().key().kind());
        assertEquals(1, collection.results().size());
        var results = collection.results().get(0).results();
        assertEquals(Severity.WARN, results.get(0).severity());
        assertEquals(new ResourceKey("v1", "ConfigMap", "", "first"), results.get(0).resourceRef().orElseThrow());
        assertEquals(Map.of("team", "core"), results.get(0).field().orElseThrow().suggestedValue());
        assertEquals(Severity.ERROR, results.get(1).severity());
    }

    @Test
    void decodesNamedResultSets() {
        var collection = ResourceListCodec.decode(Map.of(
            "items", List.of(),
            "results", List.of(Map.of("name", "validate", "results", List.of(Map.of("message", "ok", "severity", "info"))))
        ));

        assertEquals("validate", collection.results().get(0).name());
        assertEquals(Severity.INFO, collection.results().get(0).results().get(0).severity());
    }

    @Test
    void missingItemsMeansEmptyCollection() {
        assertEquals(0, ResourceListCodec.decode("kind: ResourceList\n").size());
    }

    @Test
    void rejectsMalformedLists() {
        assertThrows(ResourceListParseException.class, () -> ResourceListCodec.decode("kind: ConfigMap\nitems: []\n"));
        assertThrows(ResourceListParseException.class, () -> ResourceListCodec.decode("items: nope\n"));
        assertThrows(ResourceListParseException.class, () -> ResourceListCodec.decode("items:\n- just a string\n"));
        assertThrows(ResourceListParseException.class, () -> ResourceListCodec.decode("items: [\n"));
        assertThrows(ResourceListParseException.class, () -> ResourceListCodec.decode("   "));
        assertThrows(ResourceListParseException.class,
            () -> ResourceListCodec.decode("items: []\nresults:\n- message: x\n  severity: fatal\n"));
    }

    @Test
    void encodesWireShape() {
        var config = TestResources.configMap("settings");
        var collection = ResourceCollection.of(List.of(TestResources.configMap("a", "cm.yaml", 0)))
            .withFunctionConfig(config)
            .withResults(List.of(ResultSet.unsequenced("check", List.of(FunctionResult.of(Severity.WARN, "careful")))));

        var document = ResourceListCodec.toDocument(collection);

        assertEquals("config.kubernetes.io/v1", document.get("apiVersion"));
        assertEquals("ResourceList", document.get("kind"));
        assertEquals(config.document(), document.get("functionConfig"));
        var text = ResourceListCodec.encode(collection);
        assertTrue(text.contains("severity: warning"), text);
        assertTrue(text.contains("config.kubernetes.io/path: cm.yaml"), text);
        assertEquals(collection.items(), ResourceListCodec.decode(text).items());
    }

    @Test
    void resultListCarriesSequenceAndExitCode() {
        var set = new ResultSet("fn/check", 3, java.util.Optional.of(1), List.of(FunctionResult.of(Severity.ERROR, "bad")));

        var document = ResourceListCodec.toResultListDocument(set);

        assertEquals("FunctionResultList", document.get("kind"));
        assertEquals(Map.of("name", "fn/check"), document.get("metadata"));
        assertEquals(3, document.get("sequence"));
        assertEquals(1, document.get("exitCode"));
    }
}
