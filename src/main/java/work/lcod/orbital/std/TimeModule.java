package work.lcod.orbital.std;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.time.format.TextStyle;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.orbital.runtime.OperatorRegistry;

/**
 * {@code time/*}: epoch-millisecond timestamps, always interpreted in UTC. "Now" is the
 * evaluation context's clock, so results are reproducible for a given context.
 */
public final class TimeModule {
    private static final Logger LOG = LoggerFactory.getLogger(TimeModule.class);
    private static final long SECOND = 1000L;
    private static final long MINUTE = 60 * SECOND;
    private static final long HOUR = 60 * MINUTE;
    private static final long DAY = 24 * HOUR;
    private static final long WEEK = 7 * DAY;
    private static final List<String> FORMAT_TOKENS = List.of(
        "YYYY", "YY", "MMMM", "MMM", "MM", "M", "DD", "D", "dddd", "ddd", "HH", "H", "mm", "m", "ss", "s", "SSS");

    private static final List<Function<String, Long>> PARSERS = List.of(
        text -> Instant.parse(text).toEpochMilli(),
        text -> OffsetDateTime.parse(text).toInstant().toEpochMilli(),
        text -> LocalDateTime.parse(text).toInstant(ZoneOffset.UTC).toEpochMilli(),
        text -> LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli());

    private TimeModule() {}

    public static OperatorRegistry register(OperatorRegistry registry) {
        new ModuleDefinition(registry, "time")
            .define("now", 0, 0, "number", "Current time from the evaluation context", a -> (double) a.ctx().now())
            .define("today", 0, 0, "number", "Start of the current UTC day", a -> (double) startOf(a.ctx().now(), "day"))
            .define("parse", 1, 1, "number", "ISO-8601 string to timestamp, NaN when unparseable", TimeModule::parse)
            .define("format", 2, 2, "string", "Render with YYYY MM DD HH mm ss SSS style tokens",
                a -> format(millis(a, 0), a.string(1)))
            .define("year", 1, 1, "number", "UTC year", a -> (double) utc(millis(a, 0)).getYear())
            .define("month", 1, 1, "number", "UTC month, 1 to 12", a -> (double) utc(millis(a, 0)).getMonthValue())
            .define("day", 1, 1, "number", "UTC day of month", a -> (double) utc(millis(a, 0)).getDayOfMonth())
            .define("weekday", 1, 1, "number", "Day of week, 0 for Sunday", a -> (double) (utc(millis(a, 0)).getDayOfWeek().getValue() % 7))
            .define("hour", 1, 1, "number", "UTC hour", a -> (double) utc(millis(a, 0)).getHour())
            .define("minute", 1, 1, "number", "UTC minute", a -> (double) utc(millis(a, 0)).getMinute())
            .define("second", 1, 1, "number", "UTC second", a -> (double) utc(millis(a, 0)).getSecond())
            .define("add", 3, 3, "number", "Add an amount of a unit", a -> (double) add(millis(a, 0), (long) a.number(1), a.string(2)))
            .define("subtract", 3, 3, "number", "Subtract an amount of a unit", a -> (double) add(millis(a, 0), -(long) a.number(1), a.string(2)))
            .define("diff", 2, 3, "number", "a - b in a unit (default ms), floored", a -> diff(millis(a, 0), millis(a, 1), a.string(2, "ms")))
            .define("startOf", 2, 2, "number", "Start of the enclosing unit", a -> (double) startOf(millis(a, 0), a.string(1)))
            .define("endOf", 2, 2, "number", "Last millisecond of the enclosing unit", a -> (double) endOf(millis(a, 0), a.string(1)))
            .define("isBefore", 2, 2, "boolean", "a < b", a -> a.number(0) < a.number(1))
            .define("isAfter", 2, 2, "boolean", "a > b", a -> a.number(0) > a.number(1))
            .define("isBetween", 3, 3, "boolean", "start <= t <= end", a -> a.number(0) >= a.number(1) && a.number(0) <= a.number(2))
            .define("isSame", 2, 3, "boolean", "Equal, or in the same unit", a -> isSame(millis(a, 0), millis(a, 1), a.has(2) ? a.string(2) : null))
            .define("isPast", 1, 1, "boolean", "Before now", a -> millis(a, 0) < a.ctx().now())
            .define("isFuture", 1, 1, "boolean", "After now", a -> millis(a, 0) > a.ctx().now())
            .define("isToday", 1, 1, "boolean", "Same UTC day as now", a -> isSame(millis(a, 0), a.ctx().now(), "day"))
            .define("relative", 1, 1, "string", "Human relative time such as \"3 hours ago\"", a -> relative(millis(a, 0), a.ctx().now()))
            .define("duration", 1, 1, "string", "Compact duration such as \"1h 30m\"", a -> duration(millis(a, 0)));
        return registry;
    }

    private static long millis(Args a, int index) {
        return (long) a.number(index);
    }

    private static ZonedDateTime utc(long millis) {
        return Instant.ofEpochMilli(millis).atZone(ZoneOffset.UTC);
    }

    /**
     * Parses an instant, offset date-time, local date-time or local date (the last two in UTC).
     * Returns null when none matches.
     */
    static Long parseInstant(String text) {
        var value = text.strip();
        DateTimeParseException failure = null;
        for (var parser : PARSERS) {
            try {
                return parser.apply(value);
            } catch (DateTimeParseException ex) {
                failure = ex;
            }
        }
        LOG.debug("Unparseable timestamp {}", value, failure);
        return null;
    }

    private static Object parse(Args a) {
        var value = a.get(0);
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        var parsed = parseInstant(a.string(0));
        return parsed == null ? Double.NaN : (double) parsed;
    }

    static String format(long millis, String pattern) {
        var date = utc(millis);
        var out = new StringBuilder();
        int i = 0;
        while (i < pattern.length()) {
            String token = null;
            for (var candidate : FORMAT_TOKENS) {
                if (pattern.startsWith(candidate, i)) {
                    token = candidate;
                    break;
                }
            }
            if (token == null) {
                out.append(pattern.charAt(i++));
                continue;
            }
            out.append(render(date, token));
            i += token.length();
        }
        return out.toString();
    }

    private static String render(ZonedDateTime date, String token) {
        return switch (token) {
            case "YYYY" -> String.valueOf(date.getYear());
            case "YY" -> two(date.getYear() % 100);
            case "MMMM" -> date.getMonth().getDisplayName(TextStyle.FULL, Locale.ENGLISH);
            case "MMM" -> date.getMonth().getDisplayName(TextStyle.SHORT, Locale.ENGLISH);
            case "MM" -> two(date.getMonthValue());
            case "M" -> String.valueOf(date.getMonthValue());
            case "DD" -> two(date.getDayOfMonth());
            case "D" -> String.valueOf(date.getDayOfMonth());
            case "dddd" -> date.getDayOfWeek().getDisplayName(TextStyle.FULL, Locale.ENGLISH);
            case "ddd" -> date.getDayOfWeek().getDisplayName(TextStyle.SHORT, Locale.ENGLISH);
            case "HH" -> two(date.getHour());
            case "H" -> String.valueOf(date.getHour());
            case "mm" -> two(date.getMinute());
            case "m" -> String.valueOf(date.getMinute());
            case "ss" -> two(date.getSecond());
            case "s" -> String.valueOf(date.getSecond());
            case "SSS" -> String.format(Locale.ROOT, "%03d", date.getNano() / 1_000_000);
            default -> token;
        };
    }

    private static String two(int value) {
        return String.format(Locale.ROOT, "%02d", value);
    }

    static long add(long millis, long amount, String unit) {
        var date = utc(millis);
        var shifted = switch (unit) {
            case "year" -> date.plusYears(amount);
            case "month" -> date.plusMonths(amount);
            case "week" -> date.plusWeeks(amount);
            case "day" -> date.plusDays(amount);
            case "hour" -> date.plusHours(amount);
            case "minute" -> date.plusMinutes(amount);
            case "second" -> date.plusSeconds(amount);
            default -> date.plus(amount, ChronoUnit.MILLIS);
        };
        return shifted.toInstant().toEpochMilli();
    }

    static double diff(long a, long b, String unit) {
        double delta = a - b;
        return switch (unit) {
            case "year" -> Math.floor(delta / (DAY * 365.25));
            case "month" -> Math.floor(delta / (DAY * 30.44));
            case "week" -> Math.floor(delta / WEEK);
            case "day" -> Math.floor(delta / DAY);
            case "hour" -> Math.floor(delta / HOUR);
            case "minute" -> Math.floor(delta / MINUTE);
            case "second" -> Math.floor(delta / SECOND);
            default -> delta;
        };
    }

    static long startOf(long millis, String unit) {
        var date = utc(millis);
        var start = switch (unit) {
            case "year" -> date.withDayOfYear(1).truncatedTo(ChronoUnit.DAYS);
            case "month" -> date.withDayOfMonth(1).truncatedTo(ChronoUnit.DAYS);
            case "week" -> date.with(TemporalAdjusters.previousOrSame(DayOfWeek.SUNDAY)).truncatedTo(ChronoUnit.DAYS);
            case "day" -> date.truncatedTo(ChronoUnit.DAYS);
            case "hour" -> date.truncatedTo(ChronoUnit.HOURS);
            case "minute" -> date.truncatedTo(ChronoUnit.MINUTES);
            case "second" -> date.truncatedTo(ChronoUnit.SECONDS);
            default -> date;
        };
        return start.toInstant().toEpochMilli();
    }

    static long endOf(long millis, String unit) {
        var date = utc(startOf(millis, unit));
        var next = switch (unit) {
            case "year" -> date.plusYears(1);
            case "month" -> date.plusMonths(1);
            case "week" -> date.plusWeeks(1);
            case "day" -> date.plusDays(1);
            case "hour" -> date.plusHours(1);
            case "minute" -> date.plusMinutes(1);
            case "second" -> date.plusSeconds(1);
            default -> null;
        };
        return next == null ? millis : next.toInstant().toEpochMilli() - 1;
    }

    static boolean isSame(long a, long b, String unit) {
        if (unit == null) {
            return a == b;
        }
        return switch (unit) {
            case "year", "month", "week", "day", "hour", "minute", "second" -> startOf(a, unit) == startOf(b, unit);
            default -> a == b;
        };
    }

    static String relative(long millis, long now) {
        long diff = millis - now;
        long abs = Math.abs(diff);
        if (abs < MINUTE) {
            return "just now";
        }
        long value;
        String unit;
        if (abs < HOUR) {
            value = Math.round((double) abs / MINUTE);
            unit = "minute";
        } else if (abs < DAY) {
            value = Math.round((double) abs / HOUR);
            unit = "hour";
        } else if (abs < WEEK) {
            value = Math.round((double) abs / DAY);
            unit = "day";
        } else if (abs < DAY * 30) {
            value = Math.round((double) abs / WEEK);
            unit = "week";
        } else if (abs < DAY * 365) {
            value = Math.round((double) abs / (DAY * 30));
            unit = "month";
        } else {
            value = Math.round((double) abs / (DAY * 365));
            unit = "year";
        }
        var label = value + " " + unit + (value == 1 ? "" : "s");
        return diff < 0 ? label + " ago" : "in " + label;
    }

    static String duration(long millis) {
        long remaining = Math.abs(millis);
        var parts = new ArrayList<String>();
        if (remaining >= DAY) {
            parts.add(remaining / DAY + "d");
            remaining %= DAY;
        }
        if (remaining >= HOUR) {
            parts.add(remaining / HOUR + "h");
            remaining %= HOUR;
        }
        if (remaining >= MINUTE) {
            parts.add(remaining / MINUTE + "m");
            remaining %= MINUTE;
        }
        if (remaining >= SECOND && parts.size() < 2) {
            parts.add(remaining / SECOND + "s");
        }
        return parts.isEmpty() ? "0s" : String.join(" ", parts);
    }
}
