package work.lcod.pipeline.codec;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import work.lcod.pipeline.model.Documents;
import work.lcod.pipeline.model.FunctionResult;
import work.lcod.pipeline.model.Resource;
import work.lcod.pipeline.model.ResourceCollection;
import work.lcod.pipeline.model.ResourceKey;
import work.lcod.pipeline.model.ResultSet;
import work.lcod.pipeline.model.Severity;

/**
 * Wire codec for the {@code ResourceList} exchanged with functions.
 *
 * <p>{@code results} is accepted either as named sets ({@code {name, results: [...]}}) or as a
 * flat list of result records, which becomes a single unnamed set.
 */
public final class ResourceListCodec {
    public static final String API_VERSION = "config.kubernetes.io/v1";
    public static final String KIND = "ResourceList";
    public static final String RESULT_LIST_KIND = "FunctionResultList";

    private ResourceListCodec() {}

    public static ResourceCollection decode(String text) {
        if (text == null || text.isBlank()) {
            throw new ResourceListParseException("Empty ResourceList");
        }
        Map<String, Object> root;
        try {
            root = YamlDocuments.readSingle(text);
        } catch (IOException ex) {
            throw new ResourceListParseException("Malformed ResourceList: " + ex.getMessage(), ex);
        }
        if (root == null) {
            throw new ResourceListParseException("Empty ResourceList");
        }
        return decode(root);
    }

    public static ResourceCollection decode(Map<String, Object> root) {
        Object kind = root.get("kind");
        if (kind != null && !KIND.equals(kind)) {
            throw new ResourceListParseException("Expected kind " + KIND + " but found " + kind);
        }
        Object rawItems = root.get("items");
        if (rawItems != null && !(rawItems instanceof List<?>)) {
            throw new ResourceListParseException("items must be a list");
        }
        var items = new ArrayList<Resource>();
        int position = 0;
        for (Object item : Documents.asList(rawItems)) {
            if (!(item instanceof Map<?, ?> map)) {
                throw new ResourceListParseException("items[" + position + "] must be an object");
            }
            items.add(Resource.of(Documents.copyMap(map)));
            position++;
        }
        Optional<Resource> functionConfig = Optional.empty();
        Object rawConfig = root.get("functionConfig");
        if (rawConfig instanceof Map<?, ?> configMap) {
            functionConfig = Optional.of(Resource.of(Documents.copyMap(configMap)));
        } else if (rawConfig != null) {
            throw new ResourceListParseException("functionConfig must be an object");
        }
        return new ResourceCollection(items, functionConfig, decodeResults(root.get("results")));
    }

    public static String encode(ResourceCollection collection) {
        return YamlDocuments.write(toDocument(collection));
    }

    public static Map<String, Object> toDocument(ResourceCollection collection) {
        var root = new LinkedHashMap<String, Object>();
        root.put("apiVersion", API_VERSION);
        root.put("kind", KIND);
        var items = new ArrayList<Object>();
        for (var resource : collection.items()) {
            items.add(resource.document());
        }
        root.put("items", items);
        collection.functionConfig().ifPresent(config -> root.put("functionConfig", config.document()));
        if (!collection.results().isEmpty()) {
            var sets = new ArrayList<Object>();
            for (var set : collection.results()) {
                var entry = new LinkedHashMap<String, Object>();
                entry.put("name", set.name());
                entry.put("results", encodeResults(set.results()));
                sets.add(entry);
            }
            root.put("results", sets);
        }
        return root;
    }

    /**
     * Document written to the results directory for one result set.
     */
    public static Map<String, Object> toResultListDocument(ResultSet set) {
        var root = new LinkedHashMap<String, Object>();
        root.put("apiVersion", API_VERSION);
        root.put("kind", RESULT_LIST_KIND);
        var metadata = new LinkedHashMap<String, Object>();
        metadata.put("name", set.name());
        root.put("metadata", metadata);
        if (set.sequence() >= 0) {
            root.put("sequence", set.sequence());
        }
        set.exitCode().ifPresent(code -> root.put("exitCode", code));
        root.put("items", encodeResults(set.results()));
        return root;
    }

    static List<ResultSet> decodeResults(Object raw) {
        if (raw == null) {
            return List.of();
        }
        if (!(raw instanceof List<?> entries)) {
            throw new ResourceListParseException("results must be a list");
        }
        var sets = new ArrayList<ResultSet>();
        var flat = new ArrayList<FunctionResult>();
        for (Object entry : entries) {
            if (!(entry instanceof Map<?, ?> map)) {
                throw new ResourceListParseException("results entries must be objects");
            }
            var record = Documents.copyMap(map);
            Object nested = record.containsKey("results") ? record.get("results") : record.get("items");
            if (nested instanceof List<?> nestedList && !record.containsKey("message")) {
                var results = new ArrayList<FunctionResult>();
                for (Object item : nestedList) {
                    results.add(decodeResult(item));
                }
                sets.add(ResultSet.unsequenced(Documents.string(record, "name"), results));
            } else {
                flat.add(decodeResult(record));
            }
        }
        if (!flat.isEmpty()) {
            sets.add(ResultSet.unsequenced("", flat));
        }
        return sets;
    }

    static FunctionResult decodeResult(Object raw) {
        if (!(raw instanceof Map<?, ?> map)) {
            throw new ResourceListParseException("result record must be an object");
        }
        var record = Documents.copyMap(map);
        Severity severity;
        try {
            Object rawSeverity = record.get("severity");
            severity = Severity.from(rawSeverity == null ? null : String.valueOf(rawSeverity));
        } catch (IllegalArgumentException ex) {
            throw new ResourceListParseException(ex.getMessage(), ex);
        }
        var tags = new LinkedHashMap<String, String>();
        Documents.asMap(record.get("tags")).forEach((k, v) -> tags.put(k, v == null ? "" : String.valueOf(v)));

        Optional<ResourceKey> ref = Optional.empty();
        if (record.get("resourceRef") instanceof Map<?, ?> refMap) {
            ref = Optional.of(ResourceKey.fromReference(Documents.copyMap(refMap)));
        }
        Optional<FunctionResult.FileLocation> file = Optional.empty();
        if (record.get("file") instanceof Map<?, ?> fileMap) {
            var fileRecord = Documents.copyMap(fileMap);
            Object index = fileRecord.get("index");
            file = Optional.of(new FunctionResult.FileLocation(
                Documents.string(fileRecord, "path"),
                index instanceof Number number ? number.intValue() : parseInt(index)
            ));
        }
        Optional<FunctionResult.FieldRef> field = Optional.empty();
        if (record.get("field") instanceof Map<?, ?> fieldMap) {
            var fieldRecord = Documents.copyMap(fieldMap);
            field = Optional.of(new FunctionResult.FieldRef(
                Documents.string(fieldRecord, "path"),
                fieldRecord.get("currentValue"),
                fieldRecord.get("suggestedValue")
            ));
        }
        return new FunctionResult(severity, Documents.string(record, "message"), tags, ref, file, field);
    }

    static List<Object> encodeResults(List<FunctionResult> results) {
        var encoded = new ArrayList<Object>();
        for (var result : results) {
            var record = new LinkedHashMap<String, Object>();
            record.put("message", result.message());
            record.put("severity", result.severity().wireName());
            if (!result.tags().isEmpty()) {
                record.put("tags", new LinkedHashMap<>(result.tags()));
            }
            result.resourceRef().ifPresent(ref -> record.put("resourceRef", ref.toReference()));
            result.file().ifPresent(file -> {
                var fileRecord = new LinkedHashMap<String, Object>();
                fileRecord.put("path", file.path());
                fileRecord.put("index", file.index());
                record.put("file", fileRecord);
            });
            result.field().ifPresent(field -> {
                var fieldRecord = new LinkedHashMap<String, Object>();
                fieldRecord.put("path", field.path());
                if (field.currentValue() != null) {
                    fieldRecord.put("currentValue", Documents.deepCopy(field.currentValue()));
                }
                if (field.suggestedValue() != null) {
                    fieldRecord.put("suggestedValue", Documents.deepCopy(field.suggestedValue()));
                }
                record.put("field", fieldRecord);
            });
            encoded.add(record);
        }
        return encoded;
    }

    private static int parseInt(Object raw) {
        if (raw == null) {
            return 0;
        }
        try {
            return Integer.parseInt(String.valueOf(raw).trim());
        } catch (NumberFormatException ex) {
            throw new ResourceListParseException("file.index must be an integer: " + raw, ex);
        }
    }
}
