package work.lcod.pipeline.runtime;

import java.util.ArrayList;
import java.util.List;
import work.lcod.pipeline.model.Resource;
import work.lcod.pipeline.model.ResourceCollection;

/**
 * Splits a collection into the resources an invocation may see and the ones it must not touch.
 * A resource is visible when its directory is the anchor or lies beneath it.
 */
public final class ScopeResolver {
    public Scope resolve(ResourceCollection collection, String anchor) {
        var normalized = validateAnchor(anchor);
        var scoped = new ArrayList<Resource>();
        var complement = new ArrayList<Resource>();
        for (var resource : collection.items()) {
            if (inScope(resource.directory(), normalized)) {
                scoped.add(resource);
            } else {
                complement.add(resource);
            }
        }
        return new Scope(normalized, scoped, complement);
    }

    static boolean inScope(String directory, String anchor) {
        if (anchor.isEmpty()) {
            return true;
        }
        return directory.equals(anchor) || directory.startsWith(anchor + "/");
    }

    static String validateAnchor(String anchor) {
        if (anchor == null) {
            throw new ScopeResolutionException("Invocation has no anchor location");
        }
        var unified = anchor.replace('\\', '/');
        if (unified.startsWith("/") || unified.matches("^[A-Za-z]:.*")) {
            throw new ScopeResolutionException("Anchor location must be relative to the tree root: " + anchor);
        }
        while (unified.startsWith("./")) {
            unified = unified.substring(2);
        }
        if (unified.equals(".")) {
            return "";
        }
        if (unified.endsWith("/")) {
            unified = unified.substring(0, unified.length() - 1);
        }
        if (unified.isEmpty()) {
            return unified;
        }
        for (var segment : unified.split("/", -1)) {
            if (segment.isEmpty() || segment.equals(".") || segment.equals("..")) {
                throw new ScopeResolutionException("Anchor location is ambiguous: " + anchor);
            }
        }
        return unified;
    }

    /**
     * Result of scoping. Both lists keep the collection's order.
     */
    public record Scope(String anchor, List<Resource> scoped, List<Resource> complement) {
        public Scope {
            scoped = List.copyOf(scoped);
            complement = List.copyOf(complement);
        }
    }
}
