package work.lcod.pipeline.runtime;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import work.lcod.pipeline.model.ResourceCollection;
import work.lcod.pipeline.model.ResultSet;
import work.lcod.pipeline.model.Severity;
import work.lcod.pipeline.shared.PipelineException;

/**
 * Terminal state of one pipeline run.
 *
 * @param collection the committed collection, or the last good state before the abort; only a
 *     {@link RunState#COMMITTED} outcome may be persisted
 * @param abortCause the fatal error for aborted runs that did not abort on a plain function failure
 */
public record PipelineOutcome(
    RunState state,
    ResourceCollection collection,
    List<InvocationRecord> invocations,
    List<ResultSet> resultSets,
    Optional<Severity> overallSeverity,
    int exitCode,
    Optional<PipelineException> abortCause
) {
    public PipelineOutcome {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(collection, "collection");
        invocations = List.copyOf(invocations);
        resultSets = List.copyOf(resultSets);
        Objects.requireNonNull(overallSeverity, "overallSeverity");
        Objects.requireNonNull(abortCause, "abortCause");
    }

    public boolean committed() {
        return state == RunState.COMMITTED;
    }

    public long count(InvocationState invocationState) {
        return invocations.stream().filter(record -> record.state() == invocationState).count();
    }
}
