package work.lcod.pipeline.model;

import java.util.Optional;

/**
 * Where a resource came from: a slash-separated path relative to the tree root and the document
 * position inside that file.
 */
public record Provenance(String path, int index) {
    public static final String PATH_ANNOTATION = "config.kubernetes.io/path";
    public static final String INDEX_ANNOTATION = "config.kubernetes.io/index";

    public Provenance {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("path must not be blank");
        }
        if (index < 0) {
            throw new IllegalArgumentException("index must not be negative: " + index);
        }
        path = normalize(path);
    }

    /**
     * Directory part of {@link #path()}, {@code ""} for files at the tree root.
     */
    public String directory() {
        return parentOf(path);
    }

    public static String normalize(String raw) {
        var unified = raw.replace('\\', '/');
        while (unified.startsWith("./")) {
            unified = unified.substring(2);
        }
        while (unified.contains("//")) {
            unified = unified.replace("//", "/");
        }
        if (unified.endsWith("/")) {
            unified = unified.substring(0, unified.length() - 1);
        }
        return unified;
    }

    public static String parentOf(String path) {
        int slash = path.lastIndexOf('/');
        return slash < 0 ? "" : path.substring(0, slash);
    }

    static Optional<Integer> parseIndex(Object raw) {
        if (raw == null) {
            return Optional.empty();
        }
        if (raw instanceof Number number) {
            return Optional.of(number.intValue());
        }
        try {
            return Optional.of(Integer.parseInt(String.valueOf(raw).trim()));
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
    }
}
