package work.lcod.pipeline.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Results recorded for one invocation. {@code sequence} keeps repeated runs of the same
 * declaration apart; {@code exitCode} is absent for sets that did not come from a run.
 */
public record ResultSet(String name, int sequence, Optional<Integer> exitCode, List<FunctionResult> results) {
    public ResultSet {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(exitCode, "exitCode");
        results = results == null ? List.of() : List.copyOf(results);
    }

    public static ResultSet unsequenced(String name, List<FunctionResult> results) {
        return new ResultSet(name, -1, Optional.empty(), results);
    }

    public Optional<Severity> maxSeverity() {
        return results.stream().map(FunctionResult::severity).max(Enum::compareTo);
    }

    public boolean isEmpty() {
        return results.isEmpty();
    }
}
