package work.lcod.pipeline.runtime;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.pipeline.model.ExecutionPlan;
import work.lcod.pipeline.model.FunctionInvocation;
import work.lcod.pipeline.model.Provenance;
import work.lcod.pipeline.model.Resource;
import work.lcod.pipeline.model.ResourceCollection;

/**
 * Finds declaration annotations in a collection and orders them into an {@link ExecutionPlan}.
 *
 * <p>Order: nested directories before their parent (depth-first post-order), siblings and files
 * lexically, documents of one file in document order. Any malformed declaration aborts discovery;
 * no partial plan is ever returned.
 */
public final class FunctionDiscoverer {
    private static final Logger logger = LoggerFactory.getLogger(FunctionDiscoverer.class);

    static final Comparator<String> POST_ORDER = FunctionDiscoverer::comparePostOrder;

    private final DeclarationParser parser;

    public FunctionDiscoverer() {
        this(new DeclarationParser());
    }

    public FunctionDiscoverer(DeclarationParser parser) {
        this.parser = Objects.requireNonNull(parser, "parser");
    }

    public ExecutionPlan discover(ResourceCollection collection) {
        return discover(collection, List.of(), Options.defaults());
    }

    /**
     * @param explicitFunctions declaration resources that live outside the tree; they run with
     *     global scope, in the given order, ahead of any discovered invocation
     */
    public ExecutionPlan discover(ResourceCollection collection, List<Resource> explicitFunctions, Options options) {
        Objects.requireNonNull(collection, "collection");
        Objects.requireNonNull(options, "options");
        var ordered = new ArrayList<FunctionInvocation>();

        var explicit = explicitFunctions == null ? List.<Resource>of() : explicitFunctions;
        for (var resource : explicit) {
            var raw = DeclarationParser.declarationOf(resource);
            if (raw.isEmpty()) {
                throw new DeclarationParseException(resource + " was given as a function but carries no "
                    + DeclarationParser.FUNCTION_ANNOTATION + " annotation");
            }
            var declaration = parser.parse(resource, raw.get());
            ordered.add(new FunctionInvocation(declaration, resource, "", 0, FunctionInvocation.Origin.EXPLICIT));
        }

        if (explicit.isEmpty() || options.includeDiscovered()) {
            ordered.addAll(discoverInTree(collection, options));
        }

        var plan = ExecutionPlan.of(ordered);
        logger.info("Planned {} function invocation(s)", plan.size());
        return plan;
    }

    private List<FunctionInvocation> discoverInTree(ResourceCollection collection, Options options) {
        var candidates = new ArrayList<Candidate>();
        var items = collection.items();
        for (int position = 0; position < items.size(); position++) {
            var resource = items.get(position);
            var raw = DeclarationParser.declarationOf(resource);
            if (raw.isEmpty()) {
                continue;
            }
            var declaration = parser.parse(resource, raw.get());
            var provenance = resource.provenance();
            var directory = provenance.map(Provenance::directory).orElse("");
            var path = provenance.map(Provenance::path).orElse("");
            var index = provenance.map(Provenance::index).orElse(0);
            var anchor = options.globalScope() ? "" : directory;
            logger.debug("Found declaration {} in {}", declaration.displayName(), resource);
            candidates.add(new Candidate(
                new FunctionInvocation(declaration, resource, anchor, 0, FunctionInvocation.Origin.DISCOVERED),
                directory,
                path,
                index,
                position
            ));
        }

        candidates.sort(Comparator
            .comparing(Candidate::directory, POST_ORDER)
            .thenComparing(Candidate::path)
            .thenComparingInt(Candidate::index)
            .thenComparingInt(Candidate::position));

        var invocations = new ArrayList<FunctionInvocation>(candidates.size());
        for (var candidate : candidates) {
            invocations.add(candidate.invocation());
        }
        return invocations;
    }

    /**
     * Orders directories so every descendant precedes its ancestors and siblings compare lexically.
     */
    static int comparePostOrder(String left, String right) {
        var a = left.isEmpty() ? new String[0] : left.split("/");
        var b = right.isEmpty() ? new String[0] : right.split("/");
        int shared = Math.min(a.length, b.length);
        for (int i = 0; i < shared; i++) {
            int cmp = a[i].compareTo(b[i]);
            if (cmp != 0) {
                return cmp;
            }
        }
        // One is an ancestor of the other (or they are equal); the deeper one goes first.
        return Integer.compare(b.length, a.length);
    }

    private record Candidate(FunctionInvocation invocation, String directory, String path, int index, int position) {}

    /**
     * @param globalScope anchor every invocation at the tree root
     * @param includeDiscovered run in-tree declarations even when explicit functions are given
     */
    public record Options(boolean globalScope, boolean includeDiscovered) {
        public static Options defaults() {
            return new Options(false, false);
        }
    }
}
