package work.lcod.pipeline.runtime;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import work.lcod.pipeline.codec.YamlDocuments;
import work.lcod.pipeline.model.ContainerRuntime;
import work.lcod.pipeline.model.Documents;
import work.lcod.pipeline.model.ExecRuntime;
import work.lcod.pipeline.model.FunctionDeclaration;
import work.lcod.pipeline.model.Resource;
import work.lcod.pipeline.model.RuntimeDescriptor;
import work.lcod.pipeline.model.RuntimeKind;

/**
 * Turns a declaration annotation into a {@link FunctionDeclaration}.
 *
 * <p>The annotation value is a YAML block such as:
 * <pre>
 * container:
 *   image: example.org/fn/set-labels:v1
 *   network: false
 * deferFailure: true
 * </pre>
 * Exactly one runtime block ({@code container} or {@code exec}) is required and unknown keys are
 * rejected, so a typo never silently turns into a different pipeline.
 */
public final class DeclarationParser {
    public static final String FUNCTION_ANNOTATION = "config.kubernetes.io/function";
    public static final String LEGACY_FUNCTION_ANNOTATION = "config.k8s.io/function";

    private static final Set<String> TOP_LEVEL_KEYS = Set.of("container", "exec", "deferFailure", "name");
    private static final Set<String> CONTAINER_KEYS = Set.of("image", "network", "mounts", "env");
    private static final Set<String> EXEC_KEYS = Set.of("path", "args", "env");
    private static final Set<String> MOUNT_KEYS = Set.of("type", "src", "source", "dst", "destination", "rw");

    /**
     * Raw annotation value of {@code resource}, preferring the current key over the legacy one.
     */
    public static Optional<Object> declarationOf(Resource resource) {
        return resource.annotation(FUNCTION_ANNOTATION)
            .or(() -> resource.annotation(LEGACY_FUNCTION_ANNOTATION));
    }

    public FunctionDeclaration parse(Resource owner, Object rawValue) {
        var where = owner.toString();
        var block = toBlock(rawValue, where);
        for (var key : block.keySet()) {
            if ("starlark".equals(key)) {
                throw new DeclarationParseException(where + ": starlark functions are not supported");
            }
            if (!TOP_LEVEL_KEYS.contains(key)) {
                throw new DeclarationParseException(where + ": unknown declaration key '" + key + "'");
            }
        }

        var present = new ArrayList<RuntimeKind>();
        for (var kind : RuntimeKind.values()) {
            if (block.containsKey(kind.key())) {
                present.add(kind);
            }
        }
        if (present.size() != 1) {
            throw new DeclarationParseException(
                where + ": declaration must contain exactly one of container or exec, found " + present.size()
            );
        }

        RuntimeDescriptor runtime;
        var kind = present.get(0);
        var runtimeBlock = requireMap(block.get(kind.key()), kind.key(), where);
        switch (kind) {
            case CONTAINER:
                runtime = parseContainer(runtimeBlock, where);
                break;
            case EXEC:
                runtime = parseExec(runtimeBlock, where);
                break;
            default:
                throw new DeclarationParseException(where + ": unsupported runtime " + kind);
        }

        boolean deferFailure = parseBoolean(block.get("deferFailure"), "deferFailure", where, false);
        Optional<String> name = Optional.empty();
        if (block.containsKey("name")) {
            name = Optional.of(requireString(block.get("name"), "name", where));
        }
        return new FunctionDeclaration(runtime, deferFailure, name, block);
    }

    private static Map<String, Object> toBlock(Object rawValue, String where) {
        Object value = rawValue;
        if (value instanceof String text) {
            if (text.isBlank()) {
                throw new DeclarationParseException(where + ": declaration annotation is empty");
            }
            try {
                value = YamlDocuments.readValue(text);
            } catch (IOException ex) {
                throw new DeclarationParseException(where + ": declaration is not valid YAML: " + ex.getMessage(), ex);
            }
        }
        if (!(value instanceof Map<?, ?> map)) {
            throw new DeclarationParseException(where + ": declaration must be a mapping");
        }
        return Documents.copyMap(map);
    }

    private static ContainerRuntime parseContainer(Map<String, Object> block, String where) {
        rejectUnknown(block, CONTAINER_KEYS, "container", where);
        var image = requireString(block.get("image"), "container.image", where);
        boolean network = parseBoolean(block.get("network"), "container.network", where, false);
        var mounts = new ArrayList<ContainerRuntime.Mount>();
        for (Object raw : optionalList(block.get("mounts"), "container.mounts", where)) {
            mounts.add(parseMount(requireMap(raw, "container.mounts[]", where), where));
        }
        var env = parseEnv(block.get("env"), "container.env", where);
        return new ContainerRuntime(image, network, mounts, env);
    }

    private static ExecRuntime parseExec(Map<String, Object> block, String where) {
        rejectUnknown(block, EXEC_KEYS, "exec", where);
        var path = requireString(block.get("path"), "exec.path", where);
        var args = new ArrayList<String>();
        for (Object raw : optionalList(block.get("args"), "exec.args", where)) {
            if (raw == null || raw instanceof Map<?, ?> || raw instanceof List<?>) {
                throw new DeclarationParseException(where + ": exec.args entries must be scalars");
            }
            args.add(String.valueOf(raw));
        }
        return new ExecRuntime(path, args, parseEnv(block.get("env"), "exec.env", where));
    }

    private static ContainerRuntime.Mount parseMount(Map<String, Object> block, String where) {
        rejectUnknown(block, MOUNT_KEYS, "mount", where);
        var typeName = requireString(block.get("type"), "mount.type", where);
        ContainerRuntime.Mount.Type type;
        try {
            type = ContainerRuntime.Mount.Type.valueOf(typeName.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new DeclarationParseException(where + ": unsupported mount type '" + typeName + "'", ex);
        }
        Object src = block.containsKey("src") ? block.get("src") : block.get("source");
        Object dst = block.containsKey("dst") ? block.get("dst") : block.get("destination");
        var destination = requireString(dst, "mount.dst", where);
        String source = "";
        if (type != ContainerRuntime.Mount.Type.TMPFS) {
            source = requireString(src, "mount.src", where);
        }
        boolean rw = parseBoolean(block.get("rw"), "mount.rw", where, false);
        return new ContainerRuntime.Mount(type, source, destination, rw);
    }

    private static List<String> parseEnv(Object raw, String field, String where) {
        var env = new ArrayList<String>();
        for (Object entry : optionalList(raw, field, where)) {
            var value = requireString(entry, field + "[]", where);
            if (value.startsWith("=")) {
                throw new DeclarationParseException(where + ": " + field + " entry has no variable name: " + value);
            }
            env.add(value);
        }
        return env;
    }

    private static void rejectUnknown(Map<String, Object> block, Set<String> allowed, String section, String where) {
        for (var key : block.keySet()) {
            if (!allowed.contains(key)) {
                throw new DeclarationParseException(where + ": unknown " + section + " key '" + key + "'");
            }
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> requireMap(Object value, String field, String where) {
        if (value instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        throw new DeclarationParseException(where + ": " + field + " must be a mapping");
    }

    private static String requireString(Object value, String field, String where) {
        if (value instanceof String text && !text.isBlank()) {
            return text.trim();
        }
        throw new DeclarationParseException(where + ": " + field + " must be a non-empty string");
    }

    private static List<?> optionalList(Object value, String field, String where) {
        if (value == null) {
            return List.of();
        }
        if (value instanceof List<?> list) {
            return list;
        }
        throw new DeclarationParseException(where + ": " + field + " must be a list");
    }

    private static boolean parseBoolean(Object value, String field, String where, boolean fallback) {
        if (value == null) {
            return fallback;
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof String text) {
            var normalized = text.trim().toLowerCase(Locale.ROOT);
            if ("true".equals(normalized)) return true;
            if ("false".equals(normalized)) return false;
        }
        throw new DeclarationParseException(where + ": " + field + " must be a boolean");
    }
}
