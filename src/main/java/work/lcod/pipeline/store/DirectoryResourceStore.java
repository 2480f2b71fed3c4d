package work.lcod.pipeline.store;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.pipeline.codec.YamlDocuments;
import work.lcod.pipeline.model.Provenance;
import work.lcod.pipeline.model.Resource;
import work.lcod.pipeline.model.ResourceCollection;

/**
 * Reads every {@code .yaml}/{@code .yml}/{@code .json} file below a root directory into one
 * collection and writes the result back file by file. Hidden directories and excluded paths
 * (such as the results directory) are skipped.
 *
 * <p>Only files whose documents changed are rewritten; files whose resources all disappeared are
 * deleted. Formatting and comments of rewritten files are not preserved.
 */
public final class DirectoryResourceStore implements ResourceStore {
    private static final Logger logger = LoggerFactory.getLogger(DirectoryResourceStore.class);
    private static final Set<String> EXTENSIONS = Set.of(".yaml", ".yml", ".json");
    private static final String FALLBACK_FILE = "resources.yaml";

    private final Path root;
    private final List<Path> excluded;
    private final Map<String, List<Map<String, Object>>> loaded = new HashMap<>();

    public DirectoryResourceStore(Path root) {
        this(root, List.of());
    }

    public DirectoryResourceStore(Path root, List<Path> excluded) {
        this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
        this.excluded = new ArrayList<>();
        for (var path : excluded == null ? List.<Path>of() : excluded) {
            this.excluded.add(path.toAbsolutePath().normalize());
        }
    }

    public Path root() {
        return root;
    }

    @Override
    public ResourceCollection load() {
        if (!Files.isDirectory(root)) {
            throw new PersistenceException("Not a directory: " + root, null);
        }
        loaded.clear();
        var items = new ArrayList<Resource>();
        for (var file : listFiles()) {
            var relative = relativize(file);
            List<Map<String, Object>> documents;
            try (var reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
                documents = YamlDocuments.readAll(reader);
            } catch (IOException ex) {
                throw new PersistenceException("Unable to read " + relative + ": " + ex.getMessage(), ex);
            }
            var originals = new ArrayList<Map<String, Object>>();
            for (int index = 0; index < documents.size(); index++) {
                var resource = Resource.of(documents.get(index)).withProvenance(new Provenance(relative, index));
                items.add(resource);
                originals.add(resource.withoutProvenance().document());
            }
            if (!originals.isEmpty()) {
                loaded.put(relative, originals);
            }
        }
        logger.info("Loaded {} resource(s) from {} file(s) under {}", items.size(), loaded.size(), root);
        return ResourceCollection.of(items);
    }

    @Override
    public void persist(ResourceCollection collection) {
        var byFile = group(collection.items());
        int written = 0;
        for (var entry : byFile.entrySet()) {
            var relative = entry.getKey();
            var documents = entry.getValue();
            if (documents.equals(loaded.get(relative))) {
                continue;
            }
            write(relative, documents);
            written++;
        }
        int deleted = 0;
        for (var relative : loaded.keySet()) {
            if (byFile.containsKey(relative)) {
                continue;
            }
            var target = resolve(relative);
            try {
                Files.deleteIfExists(target);
                deleted++;
            } catch (IOException ex) {
                throw new PersistenceException("Unable to delete " + relative + ": " + ex.getMessage(), ex);
            }
        }
        loaded.clear();
        loaded.putAll(byFile);
        logger.info("Wrote {} file(s), deleted {} file(s) under {}", written, deleted, root);
    }

    private Map<String, List<Map<String, Object>>> group(List<Resource> items) {
        var byPath = new LinkedHashMap<String, List<Resource>>();
        for (var resource : items) {
            // Resources without provenance go last in the fallback file; the sort below is stable.
            var placed = resource.provenance().isPresent()
                ? resource
                : resource.withProvenance(new Provenance(FALLBACK_FILE, Integer.MAX_VALUE));
            byPath.computeIfAbsent(placed.provenance().orElseThrow().path(), k -> new ArrayList<>()).add(placed);
        }
        // Every target is checked before the first write so a bad path leaves the tree untouched.
        byPath.keySet().forEach(this::resolve);
        var grouped = new LinkedHashMap<String, List<Map<String, Object>>>();
        for (var entry : byPath.entrySet()) {
            var resources = entry.getValue();
            resources.sort(Comparator.comparingInt(r -> r.provenance().orElseThrow().index()));
            var documents = new ArrayList<Map<String, Object>>();
            for (var resource : resources) {
                documents.add(resource.withoutProvenance().document());
            }
            grouped.put(entry.getKey(), documents);
        }
        return grouped;
    }

    private void write(String relative, List<Map<String, Object>> documents) {
        var target = resolve(relative);
        String content;
        if (relative.toLowerCase(Locale.ROOT).endsWith(".json") && documents.size() == 1) {
            content = YamlDocuments.writeJson(documents.get(0)) + System.lineSeparator();
        } else {
            content = YamlDocuments.writeAll(documents);
        }
        try {
            var parent = target.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            var temp = Files.createTempFile(parent, ".lcod-", ".tmp");
            Files.writeString(temp, content, StandardCharsets.UTF_8);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException ex) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException ex) {
            throw new PersistenceException("Unable to write " + relative + ": " + ex.getMessage(), ex);
        }
        logger.debug("Wrote {} document(s) to {}", documents.size(), relative);
    }

    private Path resolve(String relative) {
        var target = root.resolve(relative).normalize();
        if (!target.startsWith(root) || target.equals(root)) {
            throw new PersistenceException("Refusing to write outside " + root + ": " + relative, null);
        }
        return target;
    }

    private List<Path> listFiles() {
        var files = new ArrayList<Path>();
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (dir.equals(root)) {
                        return FileVisitResult.CONTINUE;
                    }
                    var name = dir.getFileName().toString();
                    if (name.startsWith(".") || excluded.contains(dir.toAbsolutePath().normalize())) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    var name = file.getFileName().toString();
                    if (attrs.isRegularFile() && !name.startsWith(".") && hasSupportedExtension(name)) {
                        files.add(file);
                    }
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException ex) {
            throw new PersistenceException("Unable to walk " + root + ": " + ex.getMessage(), ex);
        }
        files.sort(Comparator.comparing(this::relativize));
        return files;
    }

    private static boolean hasSupportedExtension(String name) {
        var lower = name.toLowerCase(Locale.ROOT);
        for (var extension : EXTENSIONS) {
            if (lower.endsWith(extension)) {
                return true;
            }
        }
        return false;
    }

    private String relativize(Path file) {
        return root.relativize(file.toAbsolutePath().normalize()).toString().replace('\\', '/');
    }
}
