package work.lcod.pipeline.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.lcod.pipeline.model.FunctionResult;
import work.lcod.pipeline.model.ResultSet;
import work.lcod.pipeline.model.Severity;

class ResultsWriterTest {
    @TempDir
    Path tempDir;

    @Test
    void writesOneFilePerInvocation() throws IOException {
        var directory = tempDir.resolve("out/results");
        var sets = List.of(
            new ResultSet("fn/lint", 0, Optional.of(0), List.of(FunctionResult.of(Severity.WARN, "odd name"))),
            new ResultSet("fn/lint", 1, Optional.of(1), List.of())
        );

        var files = new ResultsWriter(directory).write(sets);

        assertEquals(List.of(directory.resolve("results-0.yaml"), directory.resolve("results-1.yaml")), files);
        var first = Files.readString(files.get(0));
        assertTrue(first.contains("kind: FunctionResultList"), first);
        assertTrue(first.contains("severity: warning"), first);
        assertTrue(first.contains("message: odd name"), first);
        assertTrue(Files.readString(files.get(1)).contains("exitCode: 1"));
    }
}
