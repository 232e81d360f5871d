package work.lcod.orbital.shared;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Durations as written in behavior files, scenarios and settings: {@code 250ms}, {@code 1.5s},
 * {@code 2m}, {@code 5h}. Bare numbers are milliseconds.
 */
public final class DurationParser {
    private static final Pattern DURATION = Pattern.compile("(\\d+(?:\\.\\d+)?)\\s*(ms|s|m|h)?");
    private static final Map<String, Long> UNIT_MILLIS = Map.of(
        "ms", 1L,
        "s", 1_000L,
        "m", 60_000L,
        "h", 3_600_000L
    );

    private DurationParser() {}

    /**
     * Numbers are rounded to whole milliseconds; anything else goes through {@link #parse(String)}.
     */
    public static Optional<Duration> parse(Object raw) {
        if (raw instanceof Number number) {
            return Optional.of(Duration.ofMillis(Math.round(number.doubleValue())));
        }
        return raw == null ? Optional.empty() : parse(raw.toString());
    }

    public static Optional<Duration> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        var text = raw.trim().toLowerCase(Locale.ROOT);
        if (text.startsWith("-")) {
            throw new IllegalArgumentException("Duration must not be negative: " + raw);
        }
        var matcher = DURATION.matcher(text);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid duration: " + raw);
        }
        long unit = UNIT_MILLIS.get(matcher.group(2) == null ? "ms" : matcher.group(2));
        var millis = new BigDecimal(matcher.group(1))
            .multiply(BigDecimal.valueOf(unit))
            .setScale(0, RoundingMode.HALF_UP);
        return Optional.of(Duration.ofMillis(millis.longValueExact()));
    }

    /**
     * Whether {@code raw} is a non-negative duration string {@link #parse(String)} accepts.
     */
    public static boolean isDuration(String raw) {
        return raw != null && DURATION.matcher(raw.trim().toLowerCase(Locale.ROOT)).matches();
    }
}
