package work.lcod.pipeline.store;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.pipeline.codec.ResourceListCodec;
import work.lcod.pipeline.codec.YamlDocuments;
import work.lcod.pipeline.model.ResultSet;

/**
 * Writes each result set as its own {@code results-<sequence>.yaml} file.
 */
public final class ResultsWriter {
    private static final Logger logger = LoggerFactory.getLogger(ResultsWriter.class);

    private final Path directory;

    public ResultsWriter(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory").toAbsolutePath().normalize();
    }

    public Path directory() {
        return directory;
    }

    /**
     * @return the files written, in result set order
     */
    public List<Path> write(List<ResultSet> resultSets) {
        try {
            Files.createDirectories(directory);
        } catch (IOException ex) {
            throw new PersistenceException("Unable to create results directory " + directory + ": " + ex.getMessage(), ex);
        }
        var written = new ArrayList<Path>();
        for (int position = 0; position < resultSets.size(); position++) {
            var set = resultSets.get(position);
            int sequence = set.sequence() >= 0 ? set.sequence() : position;
            var target = directory.resolve(fileName(sequence));
            var content = YamlDocuments.write(ResourceListCodec.toResultListDocument(set));
            try {
                Files.writeString(target, content, StandardCharsets.UTF_8);
            } catch (IOException ex) {
                throw new PersistenceException("Unable to write " + target + ": " + ex.getMessage(), ex);
            }
            written.add(target);
        }
        logger.info("Wrote {} result file(s) to {}", written.size(), directory);
        return written;
    }

    static String fileName(int sequence) {
        return "results-" + sequence + ".yaml";
    }
}
