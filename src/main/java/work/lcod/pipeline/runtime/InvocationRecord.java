package work.lcod.pipeline.runtime;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.lcod.pipeline.model.FunctionInvocation;

/**
 * Bookkeeping for one invocation of a run.
 *
 * @param exitCode exit status reported by the runner; empty when the function never returned
 */
public record InvocationRecord(
    FunctionInvocation invocation,
    InvocationState state,
    Optional<Integer> exitCode,
    Duration elapsed,
    Optional<String> failure
) {
    public InvocationRecord {
        Objects.requireNonNull(invocation, "invocation");
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(exitCode, "exitCode");
        elapsed = elapsed == null ? Duration.ZERO : elapsed;
        Objects.requireNonNull(failure, "failure");
    }

    public static InvocationRecord pending(FunctionInvocation invocation) {
        return new InvocationRecord(invocation, InvocationState.PENDING, Optional.empty(), Duration.ZERO, Optional.empty());
    }

    public InvocationRecord running() {
        return new InvocationRecord(invocation, InvocationState.RUNNING, Optional.empty(), Duration.ZERO, Optional.empty());
    }

    public InvocationRecord finish(InvocationState finalState, Optional<Integer> code, Duration took, Optional<String> why) {
        return new InvocationRecord(invocation, finalState, code, took, why);
    }

    public Map<String, Object> toSerializableMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("sequence", invocation.sequence());
        map.put("name", invocation.name());
        map.put("anchor", invocation.anchor());
        map.put("state", state.name().toLowerCase(Locale.ROOT));
        exitCode.ifPresent(code -> map.put("exitCode", code));
        map.put("elapsedMillis", elapsed.toMillis());
        failure.ifPresent(message -> map.put("failure", message));
        return map;
    }
}
