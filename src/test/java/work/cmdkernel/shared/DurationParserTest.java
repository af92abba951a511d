package work.cmdkernel.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;
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
    void parsesMinutesAndDays() {
        assertEquals(Duration.ofMinutes(2), DurationParser.parse("2m").orElseThrow());
        assertEquals(Duration.ofDays(3), DurationParser.parse("3d").orElseThrow());
    }

    @Test
    void parsesMillisecondsByDefault() {
        assertEquals(Duration.ofMillis(1500), DurationParser.parse("1500").orElseThrow());
        assertEquals(Duration.ofMillis(250), DurationParser.parse("250ms").orElseThrow());
    }

    @Test
    void parsesIsoAndClockForms() {
        assertEquals(Duration.ofMinutes(90), DurationParser.parse("PT1H30M").orElseThrow());
        assertEquals(Duration.ofMinutes(90), DurationParser.parse("01:30:00").orElseThrow());
        assertEquals(Duration.ofDays(2).plusHours(14).plusMinutes(30), DurationParser.parse("2.14:30:00").orElseThrow());
        assertEquals(Duration.ofSeconds(5).plusMillis(500), DurationParser.parse("00:00:05.5").orElseThrow());
    }

    @Test
    void blankIsEmptyAndGarbageFails() {
        assertTrue(DurationParser.parse("  ").isEmpty());
        assertEquals(Duration.ZERO, DurationParser.parse("0").orElseThrow());
        assertThrows(IllegalArgumentException.class, () -> DurationParser.parse("soon"));
    }
}
