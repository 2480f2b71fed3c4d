package work.lcod.pipeline.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import work.lcod.pipeline.model.FunctionResult;
import work.lcod.pipeline.model.ResultSet;
import work.lcod.pipeline.model.Severity;

class ResultAggregatorTest {
    @Test
    void noResultsIsSuccess() {
        var aggregator = new ResultAggregator();

        assertEquals(Optional.empty(), aggregator.overallSeverity());
        assertEquals(ResultAggregator.EXIT_SUCCESS, aggregator.finalStatus());
    }

    @Test
    void warningsAndInfoDoNotFailTheRun() {
        var aggregator = new ResultAggregator();
        aggregator.record(set("a", 0, Severity.INFO, Severity.WARN));
        aggregator.record(set("b", 1, Severity.INFO));

        assertEquals(Optional.of(Severity.WARN), aggregator.overallSeverity());
        assertEquals(ResultAggregator.EXIT_SUCCESS, aggregator.finalStatus());
        assertEquals(2, aggregator.count(Severity.INFO));
    }

    @Test
    void oneErrorAnywhereFailsTheRun() {
        var aggregator = new ResultAggregator();
        aggregator.record(set("a", 0, Severity.WARN));
        aggregator.record(set("b", 1, Severity.ERROR));
        aggregator.record(set("c", 2, Severity.INFO));

        assertEquals(Optional.of(Severity.ERROR), aggregator.overallSeverity());
        assertEquals(ResultAggregator.EXIT_FAILURE, aggregator.finalStatus());
    }

    @Test
    void deferredOrAbortedRunsFail() {
        var deferred = new ResultAggregator();
        deferred.markDeferred();
        var aborted = new ResultAggregator();
        aborted.markAborted();

        assertEquals(ResultAggregator.EXIT_FAILURE, deferred.finalStatus());
        assertEquals(ResultAggregator.EXIT_FAILURE, aborted.finalStatus());
        assertTrue(aborted.isAborted());
    }

    @Test
    void repeatedNamesAreKeptApartBySequence() {
        var aggregator = new ResultAggregator();
        aggregator.record(set("same", 0, Severity.INFO));
        aggregator.record(set("same", 1, Severity.WARN));

        assertEquals(2, aggregator.resultSets().size());
        assertEquals(List.of(0, 1), aggregator.resultSets().stream().map(ResultSet::sequence).toList());
        assertEquals(2, aggregator.results().size());
    }

    private static ResultSet set(String name, int sequence, Severity... severities) {
        var results = new ArrayList<FunctionResult>();
        for (var severity : severities) {
            results.add(FunctionResult.of(severity, name + " " + severity.wireName()));
        }
        return new ResultSet(name, sequence, Optional.of(0), results);
    }
}
