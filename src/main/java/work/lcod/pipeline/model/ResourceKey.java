package work.lcod.pipeline.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Identity of a resource: {apiVersion, kind, namespace, name}. Missing parts are empty strings.
 */
public record ResourceKey(String apiVersion, String kind, String namespace, String name) {
    public ResourceKey {
        apiVersion = apiVersion == null ? "" : apiVersion;
        kind = kind == null ? "" : kind;
        namespace = namespace == null ? "" : namespace;
        name = name == null ? "" : name;
    }

    public static ResourceKey of(Map<String, Object> document) {
        Objects.requireNonNull(document, "document");
        var metadata = Documents.asMap(document.get("metadata"));
        return new ResourceKey(
            Documents.string(document, "apiVersion"),
            Documents.string(document, "kind"),
            Documents.string(metadata, "namespace"),
            Documents.string(metadata, "name")
        );
    }

    public static ResourceKey fromReference(Map<String, Object> ref) {
        return new ResourceKey(
            Documents.string(ref, "apiVersion"),
            Documents.string(ref, "kind"),
            Documents.string(ref, "namespace"),
            Documents.string(ref, "name")
        );
    }

    /**
     * Unnamed resources carry no usable identity and are matched by provenance instead.
     */
    public boolean isNamed() {
        return !name.isEmpty();
    }

    public Map<String, Object> toReference() {
        var ref = new LinkedHashMap<String, Object>();
        ref.put("apiVersion", apiVersion);
        ref.put("kind", kind);
        ref.put("name", name);
        if (!namespace.isEmpty()) {
            ref.put("namespace", namespace);
        }
        return ref;
    }

    public String display() {
        var sb = new StringBuilder();
        sb.append(kind.isEmpty() ? "<no kind>" : kind);
        if (!namespace.isEmpty()) {
            sb.append(' ').append(namespace).append('/');
        } else {
            sb.append(' ');
        }
        sb.append(name.isEmpty() ? "<unnamed>" : name);
        return sb.toString();
    }
}
