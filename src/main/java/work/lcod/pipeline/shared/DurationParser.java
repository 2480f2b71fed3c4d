package work.lcod.pipeline.shared;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parses user-friendly durations: {@code 30s}, {@code 2m}, {@code 1h}, {@code 1500ms}, compounds
 * such as {@code 1m30s}, and bare numbers as milliseconds.
 */
public final class DurationParser {
    private static final Pattern PART = Pattern.compile("(\\d+)(ms|s|m|h)?");

    private DurationParser() {}

    public static Optional<Duration> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        var text = raw.trim().toLowerCase(Locale.ROOT).replace(" ", "");
        var matcher = PART.matcher(text);
        var total = Duration.ZERO;
        int consumed = 0;
        while (matcher.find()) {
            if (matcher.start() != consumed) {
                break;
            }
            long value = Long.parseLong(matcher.group(1));
            var unit = matcher.group(2);
            if (unit == null && matcher.end() != text.length()) {
                throw new IllegalArgumentException("Missing unit in duration: " + raw);
            }
            total = total.plus(toDuration(value, unit == null ? "ms" : unit));
            consumed = matcher.end();
        }
        if (consumed != text.length()) {
            throw new IllegalArgumentException("Invalid duration: " + raw);
        }
        return Optional.of(total);
    }

    private static Duration toDuration(long value, String unit) {
        switch (unit) {
            case "h":
                return Duration.ofHours(value);
            case "m":
                return Duration.ofMinutes(value);
            case "s":
                return Duration.ofSeconds(value);
            default:
                return Duration.ofMillis(value);
        }
    }
}
