package work.lcod.pipeline.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Converts YAML/JSON text into ordered generic trees ({@code LinkedHashMap}, {@code ArrayList},
 * scalars) and back.
 */
public final class YamlDocuments {
    private static final YAMLFactory FACTORY = YAMLFactory.builder()
        .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
        .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
        .enable(YAMLGenerator.Feature.ALWAYS_QUOTE_NUMBERS_AS_STRINGS)
        .enable(YAMLGenerator.Feature.INDENT_ARRAYS_WITH_INDICATOR)
        .build();
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(FACTORY);
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final String DOCUMENT_SEPARATOR = "---\n";

    private YamlDocuments() {}

    /**
     * Reads every document of a (possibly multi-document) stream. Empty documents are skipped;
     * non-object documents are rejected.
     */
    public static List<Map<String, Object>> readAll(Reader reader) throws IOException {
        var documents = new ArrayList<Map<String, Object>>();
        try (var parser = FACTORY.createParser(reader);
             var values = YAML_MAPPER.readValues(parser, JsonNode.class)) {
            while (values.hasNextValue()) {
                JsonNode node = values.nextValue();
                if (node == null || node.isNull() || node.isMissingNode()) {
                    continue;
                }
                documents.add(toMap(node));
            }
        }
        return documents;
    }

    public static Map<String, Object> readSingle(String text) throws IOException {
        JsonNode node = YAML_MAPPER.readTree(text);
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        return toMap(node);
    }

    /**
     * Parses a scalar-or-tree value such as an annotation block.
     */
    public static Object readValue(String text) throws IOException {
        JsonNode node = YAML_MAPPER.readTree(text);
        if (node == null || node.isMissingNode()) {
            return null;
        }
        return convertNode(node);
    }

    public static String write(Object document) {
        try {
            return YAML_MAPPER.writeValueAsString(document);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize document: " + ex.getMessage(), ex);
        }
    }

    public static String writeAll(List<Map<String, Object>> documents) {
        var sb = new StringBuilder();
        for (int i = 0; i < documents.size(); i++) {
            if (i > 0) {
                sb.append(DOCUMENT_SEPARATOR);
            }
            sb.append(write(documents.get(i)));
        }
        return sb.toString();
    }

    public static String writeJson(Object value) {
        try {
            return JSON_MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize JSON: " + ex.getMessage(), ex);
        }
    }

    private static Map<String, Object> toMap(JsonNode node) throws IOException {
        if (!node.isObject()) {
            throw new IOException("Document must be an object but was " + node.getNodeType().name().toLowerCase(Locale.ROOT));
        }
        @SuppressWarnings("unchecked")
        var map = (Map<String, Object>) convertNode(node);
        return map;
    }

    private static Object convertNode(JsonNode node) {
        if (node.isObject()) {
            var map = new LinkedHashMap<String, Object>();
            var fields = node.fields();
            while (fields.hasNext()) {
                var entry = fields.next();
                map.put(entry.getKey(), convertNode(entry.getValue()));
            }
            return map;
        }
        if (node.isArray()) {
            var list = new ArrayList<Object>();
            for (var item : node) {
                list.add(convertNode(item));
            }
            return list;
        }
        if (node.isNumber()) {
            return node.numberValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNull()) {
            return null;
        }
        if (node.isBinary()) {
            return node.asText();
        }
        return node.textValue();
    }
}
