package work.lcod.orbital.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class DurationParserTest {
    @Test
    void parsesSeconds() {
        Optional<Duration> duration = DurationParser.parse("30s");
        assertTrue(duration.isPresent());
        assertEquals(Duration.ofSeconds(30), duration.get());
    }

    @Test
    void parsesMinutesAndHours() {
        assertEquals(Duration.ofMinutes(2), DurationParser.parse("2m").orElseThrow());
        assertEquals(Duration.ofHours(1), DurationParser.parse("1H").orElseThrow());
    }

    @Test
    void parsesMilliseconds() {
        assertEquals(Duration.ofMillis(1500), DurationParser.parse("1500").orElseThrow());
        assertEquals(Duration.ofMillis(250), DurationParser.parse("250ms").orElseThrow());
        assertEquals(Duration.ofMillis(16), DurationParser.parse((Object) 16.4).orElseThrow());
    }

    @Test
    void parsesFractionsOfAUnit() {
        assertEquals(Duration.ofMillis(1500), DurationParser.parse("1.5s").orElseThrow());
        assertEquals(Duration.ofSeconds(15), DurationParser.parse("0.25 m").orElseThrow());
        assertTrue(DurationParser.isDuration("250ms"));
        assertFalse(DurationParser.isDuration("-1s"));
        assertFalse(DurationParser.isDuration("later"));
    }

    @Test
    void handlesZeroAndBlank() {
        assertEquals(Duration.ZERO, DurationParser.parse("0").orElseThrow());
        assertTrue(DurationParser.parse("  ").isEmpty());
        assertTrue(DurationParser.parse((Object) null).isEmpty());
    }

    @Test
    void rejectsMalformedValues() {
        assertThrows(IllegalArgumentException.class, () -> DurationParser.parse("soon"));
        assertThrows(IllegalArgumentException.class, () -> DurationParser.parse("-5s"));
    }
}
