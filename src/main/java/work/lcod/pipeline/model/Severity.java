package work.lcod.pipeline.model;

import java.util.Locale;

/**
 * Ordinal classification of a function result; {@code ERROR > WARN > INFO}.
 */
public enum Severity {
    INFO("info"),
    WARN("warning"),
    ERROR("error");

    private final String wireName;

    Severity(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public boolean isAtLeast(Severity other) {
        return compareTo(other) >= 0;
    }

    /**
     * Parses the wire value. A missing severity counts as an error.
     */
    public static Severity from(String value) {
        if (value == null || value.isBlank()) {
            return ERROR;
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "error":
                return ERROR;
            case "warn":
            case "warning":
                return WARN;
            case "info":
                return INFO;
            default:
                throw new IllegalArgumentException("Unsupported severity: " + value);
        }
    }
}
