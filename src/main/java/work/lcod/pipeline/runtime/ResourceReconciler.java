package work.lcod.pipeline.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.pipeline.model.Provenance;
import work.lcod.pipeline.model.Resource;
import work.lcod.pipeline.model.ResourceKey;

/**
 * Installs a function's output in place of the scoped subset it was given.
 *
 * <ul>
 *   <li>resources outside the scope stay exactly where they are;</li>
 *   <li>a scoped resource is replaced by the output item that matches it, or removed when the
 *       output no longer contains it;</li>
 *   <li>output items matching nothing are appended in output order;</li>
 *   <li>duplicates in one output collapse to the last one, so regenerating a resource never
 *       duplicates it.</li>
 * </ul>
 * Named resources match on identity key plus source path and index, so same-named documents in
 * one file stay distinct. An output item whose index moved still matches when its file holds only
 * one scoped resource of that identity; an item without a path binds to the single scoped resource
 * carrying its identity, if there is exactly one. Unnamed resources match on provenance only.
 */
public final class ResourceReconciler {
    private static final Logger logger = LoggerFactory.getLogger(ResourceReconciler.class);

    public List<Resource> reconcile(List<Resource> current, List<Resource> scoped, List<Resource> output, String anchor) {
        var scopedSet = Collections.newSetFromMap(new IdentityHashMap<Resource, Boolean>());
        scopedSet.addAll(scoped);

        var byKey = collapse(output, scoped);
        var consumed = new HashSet<Object>();
        var merged = new ArrayList<Resource>(current.size() + output.size());
        int deleted = 0;
        for (var resource : current) {
            if (!scopedSet.contains(resource)) {
                merged.add(resource);
                continue;
            }
            var key = inputKey(resource);
            var replacement = key == null || consumed.contains(key) ? null : byKey.get(key);
            if (replacement == null) {
                deleted++;
                continue;
            }
            consumed.add(key);
            if (replacement.provenance().isEmpty() && resource.provenance().isPresent()) {
                replacement = replacement.withProvenance(resource.provenance().get());
            }
            merged.add(replacement);
        }

        var defaults = new DefaultPaths(merged);
        int added = 0;
        for (var entry : byKey.entrySet()) {
            if (consumed.contains(entry.getKey())) {
                continue;
            }
            var resource = entry.getValue();
            if (resource.provenance().isEmpty()) {
                resource = resource.withProvenance(defaults.assign(resource, anchor));
            }
            merged.add(resource);
            added++;
        }
        logger.debug("Reconciled scope '{}': {} in, {} out, {} added, {} deleted", anchor, scoped.size(), output.size(), added, deleted);
        return merged;
    }

    private static Map<Object, Resource> collapse(List<Resource> output, List<Resource> scoped) {
        var scopedKeys = new HashSet<Object>();
        var scopedById = new HashMap<ResourceKey, List<NamedKey>>();
        for (var resource : scoped) {
            var key = inputKey(resource);
            scopedKeys.add(key);
            if (key instanceof NamedKey named) {
                scopedById.computeIfAbsent(named.key(), k -> new ArrayList<>()).add(named);
            }
        }

        var byKey = new LinkedHashMap<Object, Resource>();
        int anonymous = 0;
        for (var resource : output) {
            Object key;
            if (resource.key().isNamed()) {
                key = outputKey(resource, scopedKeys, scopedById.getOrDefault(resource.key(), List.of()));
            } else {
                key = resource.provenance().isPresent() ? resource.provenance().get() : new Anonymous(anonymous++);
            }
            // Keeps the first position, takes the last content.
            byKey.put(key, resource);
        }
        return byKey;
    }

    /**
     * Exact path and index first; otherwise the single scoped resource with the same identity in the
     * same file (or anywhere, for items without a path).
     */
    private static NamedKey outputKey(Resource resource, Set<Object> scopedKeys, List<NamedKey> candidates) {
        var provenance = resource.provenance();
        if (provenance.isEmpty()) {
            return candidates.size() == 1 ? candidates.get(0) : new NamedKey(resource.key(), null, -1);
        }
        var exact = new NamedKey(resource.key(), provenance.get().path(), provenance.get().index());
        if (scopedKeys.contains(exact)) {
            return exact;
        }
        var sameFile = candidates.stream().filter(c -> exact.path().equals(c.path())).toList();
        return sameFile.size() == 1 ? sameFile.get(0) : exact;
    }

    private static Object inputKey(Resource resource) {
        if (resource.key().isNamed()) {
            return resource.provenance()
                .map(p -> new NamedKey(resource.key(), p.path(), p.index()))
                .orElseGet(() -> new NamedKey(resource.key(), null, -1));
        }
        return resource.provenance().orElse(null);
    }

    private record NamedKey(ResourceKey key, String path, int index) {}

    private record Anonymous(int ordinal) {}

    /**
     * Chooses {@code <anchor>/<kind>_<name>.yaml} for resources created without provenance and
     * hands out the next free index within that file.
     */
    private static final class DefaultPaths {
        private final Map<String, Integer> nextIndex = new HashMap<>();

        DefaultPaths(List<Resource> existing) {
            for (var resource : existing) {
                resource.provenance().ifPresent(p -> nextIndex.merge(p.path(), p.index() + 1, Math::max));
            }
        }

        Provenance assign(Resource resource, String anchor) {
            var key = resource.key();
            var kind = key.kind().isEmpty() ? "resource" : key.kind().toLowerCase(Locale.ROOT);
            var name = key.name().isEmpty() ? "unnamed" : key.name();
            var file = sanitize(kind) + "_" + sanitize(name) + ".yaml";
            var path = anchor == null || anchor.isEmpty() ? file : anchor + "/" + file;
            int index = nextIndex.getOrDefault(path, 0);
            nextIndex.put(path, index + 1);
            return new Provenance(path, index);
        }

        private static String sanitize(String value) {
            return value.replaceAll("[^A-Za-z0-9._-]", "-");
        }
    }
}
