package work.lcod.pipeline.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class DurationParserTest {
    @Test
    void parsesSeconds() {
        assertEquals(Optional.of(Duration.ofSeconds(30)), DurationParser.parse("30s"));
    }

    @Test
    void parsesMinutesAndHours() {
        assertEquals(Optional.of(Duration.ofMinutes(2)), DurationParser.parse("2m"));
        assertEquals(Optional.of(Duration.ofHours(1)), DurationParser.parse("1h"));
    }

    @Test
    void parsesMillisecondsByDefault() {
        assertEquals(Optional.of(Duration.ofMillis(1500)), DurationParser.parse("1500"));
        assertEquals(Optional.of(Duration.ofMillis(250)), DurationParser.parse("250ms"));
    }

    @Test
    void parsesCompoundValues() {
        assertEquals(Optional.of(Duration.ofSeconds(90)), DurationParser.parse("1m30s"));
        assertEquals(Optional.of(Duration.ofMinutes(61)), DurationParser.parse("1h 1m"));
    }

    @Test
    void blankMeansNoLimit() {
        assertTrue(DurationParser.parse(null).isEmpty());
        assertTrue(DurationParser.parse("  ").isEmpty());
    }

    @Test
    void rejectsGarbage() {
        assertThrows(IllegalArgumentException.class, () -> DurationParser.parse("soon"));
        assertThrows(IllegalArgumentException.class, () -> DurationParser.parse("10d"));
        assertThrows(IllegalArgumentException.class, () -> DurationParser.parse("1.5s"));
    }
}
