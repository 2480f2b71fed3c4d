package work.lcod.pipeline.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable configuration document. The underlying tree is kept as an ordered generic map so
 * fields nobody understands survive every pipeline step untouched.
 */
public final class Resource {
    private final Map<String, Object> document;
    private final ResourceKey key;

    private Resource(Map<String, Object> document) {
        this.document = Collections.unmodifiableMap(document);
        this.key = ResourceKey.of(document);
    }

    public static Resource of(Map<String, Object> document) {
        Objects.requireNonNull(document, "document");
        return new Resource(Documents.copyMap(document));
    }

    public ResourceKey key() {
        return key;
    }

    /**
     * Deep copy of the document, safe to hand to code that mutates it.
     */
    public Map<String, Object> document() {
        return Documents.copyMap(document);
    }

    public Object get(String... path) {
        return Documents.deepCopy(Documents.get(document, path));
    }

    public Map<String, String> annotations() {
        var raw = Documents.asMap(Documents.get(document, "metadata", "annotations"));
        var annotations = new LinkedHashMap<String, String>();
        raw.forEach((k, v) -> annotations.put(k, v == null ? null : String.valueOf(v)));
        return annotations;
    }

    public Optional<Object> annotation(String name) {
        var raw = Documents.asMap(Documents.get(document, "metadata", "annotations"));
        return Optional.ofNullable(Documents.deepCopy(raw.get(name)));
    }

    /**
     * Provenance recorded in the path/index annotations; empty when the path annotation is absent.
     */
    public Optional<Provenance> provenance() {
        var annotations = Documents.asMap(Documents.get(document, "metadata", "annotations"));
        Object path = annotations.get(Provenance.PATH_ANNOTATION);
        if (path == null || String.valueOf(path).isBlank()) {
            return Optional.empty();
        }
        int index = Provenance.parseIndex(annotations.get(Provenance.INDEX_ANNOTATION)).orElse(0);
        return Optional.of(new Provenance(String.valueOf(path), Math.max(index, 0)));
    }

    /**
     * Directory the resource lives in, {@code ""} when it has no provenance.
     */
    public String directory() {
        return provenance().map(Provenance::directory).orElse("");
    }

    public Resource withAnnotation(String name, String value) {
        var copy = Documents.copyMap(document);
        var metadata = childMap(copy, "metadata");
        var annotations = childMap(metadata, "annotations");
        if (value == null) {
            annotations.remove(name);
            if (annotations.isEmpty()) {
                metadata.remove("annotations");
            }
            if (metadata.isEmpty()) {
                copy.remove("metadata");
            }
        } else {
            annotations.put(name, value);
        }
        return new Resource(copy);
    }

    public Resource withProvenance(Provenance provenance) {
        return withAnnotation(Provenance.PATH_ANNOTATION, provenance.path())
            .withAnnotation(Provenance.INDEX_ANNOTATION, Integer.toString(provenance.index()));
    }

    public Resource withoutProvenance() {
        return withAnnotation(Provenance.PATH_ANNOTATION, null)
            .withAnnotation(Provenance.INDEX_ANNOTATION, null);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> childMap(Map<String, Object> parent, String key) {
        Object existing = parent.get(key);
        if (existing instanceof Map<?, ?>) {
            return (Map<String, Object>) existing;
        }
        var created = new LinkedHashMap<String, Object>();
        parent.put(key, created);
        return created;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof Resource that)) return false;
        return document.equals(that.document);
    }

    @Override
    public int hashCode() {
        return document.hashCode();
    }

    @Override
    public String toString() {
        return key.display() + provenance().map(p -> " (" + p.path() + "#" + p.index() + ")").orElse("");
    }
}
