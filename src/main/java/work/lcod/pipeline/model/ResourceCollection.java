package work.lcod.pipeline.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered resources plus an optional functionConfig and the result sets gathered so far.
 * Immutable; every transformation returns a new collection.
 */
public record ResourceCollection(List<Resource> items, Optional<Resource> functionConfig, List<ResultSet> results) {
    public ResourceCollection {
        items = items == null ? List.of() : List.copyOf(items);
        Objects.requireNonNull(functionConfig, "functionConfig");
        results = results == null ? List.of() : List.copyOf(results);
    }

    public static ResourceCollection empty() {
        return new ResourceCollection(List.of(), Optional.empty(), List.of());
    }

    public static ResourceCollection of(List<Resource> items) {
        return new ResourceCollection(items, Optional.empty(), List.of());
    }

    public ResourceCollection withItems(List<Resource> newItems) {
        return new ResourceCollection(newItems, functionConfig, results);
    }

    public ResourceCollection withFunctionConfig(Resource config) {
        return new ResourceCollection(items, Optional.ofNullable(config), results);
    }

    public ResourceCollection withResults(List<ResultSet> newResults) {
        return new ResourceCollection(items, functionConfig, newResults);
    }

    public ResourceCollection appendItem(Resource resource) {
        var copy = new ArrayList<>(items);
        copy.add(resource);
        return withItems(copy);
    }

    public int size() {
        return items.size();
    }
}
