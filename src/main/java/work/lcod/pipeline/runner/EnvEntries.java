package work.lcod.pipeline.runner;

import java.util.List;
import java.util.Map;

/**
 * Declared environment entries: {@code KEY=VALUE} sets a value, a bare {@code KEY} copies it from
 * the host when present.
 */
final class EnvEntries {
    private EnvEntries() {}

    static void apply(List<String> entries, Map<String, String> target) {
        for (var entry : entries) {
            int eq = entry.indexOf('=');
            if (eq > 0) {
                target.put(entry.substring(0, eq), entry.substring(eq + 1));
                continue;
            }
            var hostValue = System.getenv(entry);
            if (hostValue != null) {
                target.put(entry, hostValue);
            }
        }
    }
}
