package work.cmdkernel.shared;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses durations written on a command line: ISO-8601 ({@code PT1H30M}), clock form
 * ({@code 01:30:00}, {@code 2.14:30:00}) and short units ({@code 1500ms}, {@code 30s}, {@code 2m},
 * {@code 5h}, {@code 3d}). A bare number is milliseconds.
 */
public final class DurationParser {
    private static final Pattern CLOCK = Pattern.compile(
        "^(-)?(?:(\\d+)\\.)?(\\d{1,2}):(\\d{2})(?::(\\d{2})(?:\\.(\\d{1,9}))?)?$"
    );

    private DurationParser() {}

    public static Optional<Duration> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String trimmed = raw.trim().toLowerCase(Locale.ROOT);
        if ("0".equals(trimmed)) {
            return Optional.of(Duration.ZERO);
        }
        if (trimmed.startsWith("p") || trimmed.startsWith("-p")) {
            try {
                return Optional.of(Duration.parse(trimmed.toUpperCase(Locale.ROOT)));
            } catch (DateTimeParseException ex) {
                throw new IllegalArgumentException("Invalid ISO-8601 duration: " + raw, ex);
            }
        }
        var clock = CLOCK.matcher(trimmed);
        if (clock.matches()) {
            return Optional.of(fromClock(clock));
        }
        long multiplier = 1L;
        if (trimmed.endsWith("ms")) {
            trimmed = trimmed.substring(0, trimmed.length() - 2);
        } else if (trimmed.endsWith("s")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
            multiplier = 1_000L;
        } else if (trimmed.endsWith("m")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
            multiplier = 60_000L;
        } else if (trimmed.endsWith("h")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
            multiplier = 3_600_000L;
        } else if (trimmed.endsWith("d")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
            multiplier = 86_400_000L;
        }
        long value;
        try {
            value = Long.parseLong(trimmed.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid duration: " + raw, ex);
        }
        return Optional.of(Duration.ofMillis(Math.multiplyExact(value, multiplier)));
    }

    private static Duration fromClock(Matcher clock) {
        var duration = Duration.ZERO;
        if (clock.group(2) != null) {
            duration = duration.plusDays(Long.parseLong(clock.group(2)));
        }
        duration = duration
            .plusHours(Long.parseLong(clock.group(3)))
            .plusMinutes(Long.parseLong(clock.group(4)));
        if (clock.group(5) != null) {
            duration = duration.plusSeconds(Long.parseLong(clock.group(5)));
        }
        if (clock.group(6) != null) {
            var fraction = (clock.group(6) + "000000000").substring(0, 9);
            duration = duration.plusNanos(Long.parseLong(fraction));
        }
        return clock.group(1) != null ? duration.negated() : duration;
    }
}
