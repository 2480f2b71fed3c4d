package work.lcod.pipeline.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import work.lcod.pipeline.model.FunctionResult;
import work.lcod.pipeline.model.ResultSet;
import work.lcod.pipeline.model.Severity;

/**
 * Collects result sets in invocation order and owns the run's final exit status.
 */
public final class ResultAggregator {
    public static final int EXIT_SUCCESS = 0;
    public static final int EXIT_FAILURE = 1;

    private final List<ResultSet> resultSets = new ArrayList<>();
    private int deferredCount;
    private boolean aborted;

    public void record(ResultSet resultSet) {
        resultSets.add(resultSet);
    }

    public void markDeferred() {
        deferredCount++;
    }

    public void markAborted() {
        aborted = true;
    }

    public List<ResultSet> resultSets() {
        return List.copyOf(resultSets);
    }

    /**
     * Every recorded result, flattened in invocation order.
     */
    public List<FunctionResult> results() {
        var flat = new ArrayList<FunctionResult>();
        for (var set : resultSets) {
            flat.addAll(set.results());
        }
        return flat;
    }

    public Optional<Severity> overallSeverity() {
        return resultSets.stream()
            .map(ResultSet::maxSeverity)
            .flatMap(Optional::stream)
            .max(Enum::compareTo);
    }

    public int deferredCount() {
        return deferredCount;
    }

    public boolean isAborted() {
        return aborted;
    }

    public long count(Severity severity) {
        return results().stream().filter(result -> result.severity() == severity).count();
    }

    public int finalStatus() {
        if (aborted || deferredCount > 0) {
            return EXIT_FAILURE;
        }
        return overallSeverity().filter(severity -> severity == Severity.ERROR).isPresent()
            ? EXIT_FAILURE
            : EXIT_SUCCESS;
    }
}
